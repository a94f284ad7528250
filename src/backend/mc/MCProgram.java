package backend.mc;

import backend.mc.MCInstr.MCInstrTag;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class MCProgram {
    private final String name;
    private final int dispatchWidth;
    private final int firstNonPayloadGrf;
    private final ArrayList<MCBasicBlock> blocks = new ArrayList<>();
    private final VirtualRegisters alloc;
    private final Stats stats = new Stats();
    private int lastScratch = 0;
    private boolean spilledAnyRegisters = false;
    private int grfUsed = 0;

    public static class Stats {
        private int spillCount = 0;
        private int fillCount = 0;

        public int getSpillCount() {
            return spillCount;
        }

        public int getFillCount() {
            return fillCount;
        }

        public void countSpill() {
            ++spillCount;
        }

        public void countFill() {
            ++fillCount;
        }
    }

    private MCProgram(String name, int dispatchWidth, int firstNonPayloadGrf, VirtualRegisters alloc) {
        this.name = name;
        this.dispatchWidth = dispatchWidth;
        this.firstNonPayloadGrf = firstNonPayloadGrf;
        this.alloc = alloc;
    }

    public static MCProgram build(String name, int dispatchWidth, int firstNonPayloadGrf,
                                  List<MCInstr> instrs, VirtualRegisters alloc) {
        if (dispatchWidth != 8 && dispatchWidth != 16 && dispatchWidth != 32) {
            throw new IllegalArgumentException("unsupported dispatch width " + dispatchWidth);
        }
        MCProgram program = new MCProgram(name, dispatchWidth, firstNonPayloadGrf, alloc);
        MCBasicBlock cur = program.newBlock();
        for (MCInstr instr : instrs) {
            if (instr.getTag().startsBlock() && !cur.getList().isEmpty()) {
                cur = program.newBlock();
            }
            cur.getList().add(instr);
            if (instr.getTag().endsBlock()) {
                cur = program.newBlock();
            }
        }
        if (cur.getList().isEmpty() && program.blocks.size() > 1) {
            program.blocks.remove(program.blocks.size() - 1);
        }
        program.linkBlocks();
        program.numberInstructions();
        return program;
    }

    private MCBasicBlock newBlock() {
        MCBasicBlock bb = new MCBasicBlock(blocks.size());
        blocks.add(bb);
        return bb;
    }

    private void link(MCBasicBlock from, MCBasicBlock to) {
        if (!from.getSucc().contains(to.getIndex())) {
            from.getSucc().add(to.getIndex());
            to.getPred().add(from.getIndex());
        }
    }

    private void linkBlocks() {
        Deque<MCBasicBlock> doStack = new ArrayDeque<>();
        Deque<MCBasicBlock[]> ifStack = new ArrayDeque<>();
        for (MCBasicBlock bb : blocks) {
            if (bb.getList().isEmpty()) {
                continue;
            }
            MCBasicBlock next = bb.getIndex() + 1 < blocks.size() ? blocks.get(bb.getIndex() + 1) : null;
            MCInstrTag first = bb.start().getTag();
            if (first == MCInstrTag.DO) {
                doStack.push(bb);
            } else if (first == MCInstrTag.ENDIF) {
                if (ifStack.isEmpty()) {
                    throw new IllegalArgumentException("ENDIF without IF in " + name);
                }
                MCBasicBlock[] branch = ifStack.pop();
                link(branch[1] != null ? branch[1] : branch[0], bb);
            }
            MCInstrTag last = bb.end().getTag();
            switch (last) {
                case WHILE:
                    if (doStack.isEmpty()) {
                        throw new IllegalArgumentException("WHILE without DO in " + name);
                    }
                    link(bb, doStack.pop());
                    if (next != null) {
                        link(bb, next);
                    }
                    break;
                case IF:
                    ifStack.push(new MCBasicBlock[]{bb, null});
                    if (next != null) {
                        link(bb, next);
                    }
                    break;
                case ELSE:
                    if (ifStack.isEmpty()) {
                        throw new IllegalArgumentException("ELSE without IF in " + name);
                    }
                    ifStack.peek()[1] = bb;
                    if (next != null) {
                        link(ifStack.peek()[0], next);
                    }
                    break;
                default:
                    if (next != null) {
                        link(bb, next);
                    }
                    break;
            }
        }
        if (!doStack.isEmpty() || !ifStack.isEmpty()) {
            throw new IllegalArgumentException("unbalanced control flow in " + name);
        }
    }

    private void numberInstructions() {
        int ip = 0;
        for (MCBasicBlock bb : blocks) {
            for (MCInstr instr : bb.getList()) {
                instr.setIp(ip++);
            }
        }
    }

    public List<MCInstr> instructions() {
        ArrayList<MCInstr> res = new ArrayList<>();
        for (MCBasicBlock bb : blocks) {
            res.addAll(bb.getList());
        }
        return res;
    }

    public String getName() {
        return name;
    }

    public int getDispatchWidth() {
        return dispatchWidth;
    }

    public int getFirstNonPayloadGrf() {
        return firstNonPayloadGrf;
    }

    public List<MCBasicBlock> getBlocks() {
        return blocks;
    }

    public VirtualRegisters getAlloc() {
        return alloc;
    }

    public Stats getStats() {
        return stats;
    }

    public int getLastScratch() {
        return lastScratch;
    }

    public void addScratch(int bytes) {
        this.lastScratch += bytes;
    }

    public boolean isSpilledAnyRegisters() {
        return spilledAnyRegisters;
    }

    public void setSpilledAnyRegisters() {
        this.spilledAnyRegisters = true;
    }

    public int getGrfUsed() {
        return grfUsed;
    }

    public void setGrfUsed(int grfUsed) {
        this.grfUsed = grfUsed;
    }

    public boolean hasVirtualOperands() {
        for (MCInstr instr : instructions()) {
            if (instr.getDst().isVirtual()) {
                return true;
            }
            for (MCOperand src : instr.getSrcs()) {
                if (src.isVirtual()) {
                    return true;
                }
            }
        }
        return false;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(name).append(" (SIMD").append(dispatchWidth).append(")\n");
        for (MCBasicBlock bb : blocks) {
            sb.append(bb);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return name;
    }
}
