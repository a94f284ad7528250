package backend.mc;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

public class MCBasicBlock {
    private final int index;
    private final ArrayList<MCInstr> list = new ArrayList<>();
    private final ArrayList<Integer> succ = new ArrayList<>();
    private final ArrayList<Integer> pred = new ArrayList<>();
    public final HashSet<Integer> liveUse = new HashSet<>();
    public final HashSet<Integer> liveDef = new HashSet<>();
    public final HashSet<Integer> liveIn = new HashSet<>();
    public final HashSet<Integer> liveOut = new HashSet<>();

    public MCBasicBlock(int index) {
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    public List<MCInstr> getList() {
        return list;
    }

    public ArrayList<Integer> getSucc() {
        return succ;
    }

    public ArrayList<Integer> getPred() {
        return pred;
    }

    public MCInstr start() {
        return list.get(0);
    }

    public MCInstr end() {
        return list.get(list.size() - 1);
    }

    public int getStartIp() {
        return start().getIp();
    }

    public int getEndIp() {
        return end().getIp();
    }

    public void insertBefore(MCInstr anchor, MCInstr instr) {
        list.add(indexOf(anchor), instr);
    }

    public void insertAfter(MCInstr anchor, MCInstr instr) {
        list.add(indexOf(anchor) + 1, instr);
    }

    public void remove(MCInstr instr) {
        list.remove(indexOf(instr));
    }

    private int indexOf(MCInstr instr) {
        for (int i = 0; i < list.size(); ++i) {
            if (list.get(i) == instr) {
                return i;
            }
        }
        throw new IllegalArgumentException("instruction not in block " + index + ": " + instr);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("START B").append(index).append(" <-").append(pred).append("\n");
        for (MCInstr instr : list) {
            sb.append(instr.getIp()).append(instr);
        }
        sb.append("END B").append(index).append(" ->").append(succ).append("\n");
        return sb.toString();
    }
}
