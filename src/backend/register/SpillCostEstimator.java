package backend.register;

import backend.mc.MCInstr;
import backend.mc.MCOperand.MCReg;
import backend.mc.MCProgram;

public class SpillCostEstimator {
    private static final float LOOP_SCALE = 10;
    private static final float BRANCH_SCALE = 0.5f;

    public float[] rawCosts(MCProgram program, boolean[] noSpill, SpillRewriter spills) {
        int count = program.getAlloc().count();
        float[] costs = new float[count];
        float blockScale = 1.0f;
        for (MCInstr instr : program.instructions()) {
            for (int i = 0; i < instr.getSourceCount(); ++i) {
                if (instr.readsVirtual(i)) {
                    costs[((MCReg) instr.getSrc(i)).getNr()] += instr.regsRead(i) * blockScale;
                }
            }
            if (instr.writesVirtual()) {
                costs[((MCReg) instr.getDst()).getNr()] += instr.regsWritten() * blockScale;
            }
            if (spills.isSpillInstr(instr)) {
                for (int i = 0; i < instr.getSourceCount(); ++i) {
                    if (instr.readsVirtual(i)) {
                        noSpill[((MCReg) instr.getSrc(i)).getNr()] = true;
                    }
                }
                if (instr.writesVirtual()) {
                    noSpill[((MCReg) instr.getDst()).getNr()] = true;
                }
            }
            switch (instr.getTag()) {
                case DO:
                    blockScale *= LOOP_SCALE;
                    break;
                case WHILE:
                    blockScale /= LOOP_SCALE;
                    break;
                case IF:
                    blockScale *= BRANCH_SCALE;
                    break;
                case ENDIF:
                    blockScale /= BRANCH_SCALE;
                    break;
                default:
                    break;
            }
        }
        return costs;
    }

    /**
     * Ranked spill cost per vgrf. Zero marks a register that must not be spilled.
     */
    public float[] estimate(MCProgram program, LiveRanges ranges, SpillRewriter spills) {
        int count = program.getAlloc().count();
        boolean[] noSpill = new boolean[count];
        float[] costs = rawCosts(program, noSpill, spills);
        float[] ranked = new float[count];
        for (int i = 0; i < count; ++i) {
            if (noSpill[i] || i >= ranges.count() || spills.isSpilled(i)) {
                continue;
            }
            int liveLength = ranges.length(i);
            if (liveLength <= 0) {
                continue;
            }
            float adjusted = costs[i] / (float) Math.log(liveLength);
            if (Float.isFinite(adjusted) && adjusted > 0) {
                ranked[i] = adjusted;
            }
        }
        return ranked;
    }
}
