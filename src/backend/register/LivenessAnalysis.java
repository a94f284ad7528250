package backend.register;

import backend.mc.MCBasicBlock;
import backend.mc.MCInstr;
import backend.mc.MCOperand.MCReg;
import backend.mc.MCProgram;

import java.util.HashSet;
import java.util.List;

public class LivenessAnalysis implements LiveRangeOracle {

    public void analysis(MCProgram program) {
        for (MCBasicBlock mcBB : program.getBlocks()) {
            mcBB.liveUse.clear();
            mcBB.liveDef.clear();
            for (MCInstr instr : mcBB.getList()) {
                for (int i = 0; i < instr.getSourceCount(); ++i) {
                    if (instr.readsVirtual(i)) {
                        int reg = ((MCReg) instr.getSrc(i)).getNr();
                        if (!mcBB.liveDef.contains(reg)) {
                            mcBB.liveUse.add(reg);
                        }
                    }
                }
                if (instr.writesVirtual() && !instr.isPartialWrite()) {
                    int reg = ((MCReg) instr.getDst()).getNr();
                    if (!mcBB.liveUse.contains(reg)) {
                        mcBB.liveDef.add(reg);
                    }
                }
            }
            mcBB.liveIn.clear();
            mcBB.liveOut.clear();
            mcBB.liveIn.addAll(mcBB.liveUse);
        }
        List<MCBasicBlock> blocks = program.getBlocks();
        boolean stable = false;
        while (!stable) {
            stable = true;
            for (int b = blocks.size() - 1; b >= 0; --b) {
                MCBasicBlock mcBB = blocks.get(b);
                HashSet<Integer> newLiveOut = new HashSet<>();
                for (int succ : mcBB.getSucc()) {
                    for (int liveIn : blocks.get(succ).liveIn) {
                        if (mcBB.liveOut.add(liveIn)) {
                            newLiveOut.add(liveIn);
                        }
                    }
                }
                for (int reg : newLiveOut) {
                    if (!mcBB.liveDef.contains(reg) && mcBB.liveIn.add(reg)) {
                        stable = false;
                    }
                }
            }
        }
    }

    @Override
    public LiveRanges computeLiveRanges(MCProgram program) {
        analysis(program);
        LiveRanges ranges = new LiveRanges(program.getAlloc().count());
        for (MCBasicBlock mcBB : program.getBlocks()) {
            if (mcBB.getList().isEmpty()) {
                continue;
            }
            for (MCInstr instr : mcBB.getList()) {
                for (int i = 0; i < instr.getSourceCount(); ++i) {
                    if (instr.readsVirtual(i)) {
                        ranges.extend(((MCReg) instr.getSrc(i)).getNr(), instr.getIp());
                    }
                }
                if (instr.writesVirtual()) {
                    ranges.extend(((MCReg) instr.getDst()).getNr(), instr.getIp());
                }
            }
            for (int reg : mcBB.liveIn) {
                ranges.extend(reg, mcBB.getStartIp());
            }
            for (int reg : mcBB.liveOut) {
                ranges.extend(reg, mcBB.getEndIp());
            }
        }
        return ranges;
    }
}
