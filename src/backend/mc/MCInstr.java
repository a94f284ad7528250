package backend.mc;

import backend.mc.MCOperand.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import static backend.mc.MCOperand.REG_SIZE;

public class MCInstr {
    public enum MCInstrTag {
        MOV, ADD, MUL, MAD, SEL, SHL, CMP,
        // extended math reads its sources after the first destination write
        MATH(true),
        SEND,
        DO, WHILE, IF, ELSE, ENDIF, HALT,
        UNDEF, SCRATCH_HEADER, NOP;

        private final boolean sourceDestHazard;

        MCInstrTag() {
            this(false);
        }

        MCInstrTag(boolean sourceDestHazard) {
            this.sourceDestHazard = sourceDestHazard;
        }

        public boolean hasSourceDestHazard() {
            return sourceDestHazard;
        }

        public boolean isSend() {
            return this == SEND;
        }

        public boolean isControlFlow() {
            return this == DO || this == WHILE || this == IF || this == ELSE || this == ENDIF || this == HALT;
        }

        public boolean startsBlock() {
            return this == DO || this == ENDIF;
        }

        public boolean endsBlock() {
            return this == WHILE || this == IF || this == ELSE;
        }

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final MCInstrTag tag;
    private MCOperand dst;
    private final ArrayList<MCOperand> srcs;
    private final int execSize;
    private boolean forceWriteMaskAll = false;
    private boolean eot = false;
    private boolean partialWrite = false;
    private boolean sourceDestHazard = false;
    private int mlen = 0;
    private int exMlen = 0;
    private int sizeWritten = -1;
    private int ip = -1;

    public MCInstr(MCInstrTag tag, int execSize, MCOperand dst, MCOperand... srcs) {
        this.tag = tag;
        this.execSize = execSize;
        this.dst = dst;
        this.srcs = new ArrayList<>(Arrays.asList(srcs));
    }

    public static MCInstr alu(MCInstrTag tag, int execSize, MCOperand dst, MCOperand... srcs) {
        assert !tag.isSend() && !tag.isControlFlow();
        return new MCInstr(tag, execSize, dst, srcs);
    }

    public static MCInstr mov(int execSize, MCOperand dst, MCOperand src) {
        return alu(MCInstrTag.MOV, execSize, dst, src);
    }

    /**
     * A message with sources {desc, ex_desc, payload, payload2}. payload2 may be {@link MCNull#NULL} when
     * exMlen is 0.
     */
    public static MCInstr send(int execSize, MCOperand dst, MCOperand payload, MCOperand payload2,
                               int mlen, int exMlen, int sizeWritten) {
        MCInstr instr = new MCInstr(MCInstrTag.SEND, execSize, dst,
                new MCImm(0), new MCImm(0), payload, payload2);
        instr.mlen = mlen;
        instr.exMlen = exMlen;
        instr.sizeWritten = sizeWritten;
        return instr;
    }

    public static MCInstr control(MCInstrTag tag) {
        assert tag.isControlFlow();
        return new MCInstr(tag, 1, MCNull.NULL);
    }

    public static MCInstr undef(MCVirtualReg dst) {
        return new MCInstr(MCInstrTag.UNDEF, 8, dst);
    }

    public MCInstrTag getTag() {
        return tag;
    }

    public MCOperand getDst() {
        return dst;
    }

    public void setDst(MCOperand dst) {
        this.dst = dst;
    }

    public int getSourceCount() {
        return srcs.size();
    }

    public MCOperand getSrc(int i) {
        return srcs.get(i);
    }

    public void setSrc(int i, MCOperand src) {
        srcs.set(i, src);
    }

    public List<MCOperand> getSrcs() {
        return srcs;
    }

    public int getExecSize() {
        return execSize;
    }

    public boolean isForceWriteMaskAll() {
        return forceWriteMaskAll;
    }

    public MCInstr setForceWriteMaskAll(boolean forceWriteMaskAll) {
        this.forceWriteMaskAll = forceWriteMaskAll;
        return this;
    }

    public boolean isEot() {
        return eot;
    }

    public MCInstr setEot(boolean eot) {
        this.eot = eot;
        return this;
    }

    public MCInstr setPartialWrite(boolean partialWrite) {
        this.partialWrite = partialWrite;
        return this;
    }

    public MCInstr setSourceDestHazard(boolean sourceDestHazard) {
        this.sourceDestHazard = sourceDestHazard;
        return this;
    }

    public int getMlen() {
        return mlen;
    }

    public int getExMlen() {
        return exMlen;
    }

    public int getSizeWritten() {
        return sizeWritten;
    }

    public int getIp() {
        return ip;
    }

    public void setIp(int ip) {
        this.ip = ip;
    }

    public boolean isSendFromGrf() {
        return tag.isSend() && srcs.size() > 2 && srcs.get(2) instanceof MCReg;
    }

    public boolean hasSourceAndDestinationHazard() {
        return sourceDestHazard || tag.hasSourceDestHazard();
    }

    public boolean writesVirtual() {
        return dst.isVirtual();
    }

    public boolean readsVirtual(int i) {
        return srcs.get(i).isVirtual();
    }

    public int regsRead(int i) {
        MCOperand src = srcs.get(i);
        if (!(src instanceof MCReg)) {
            return 0;
        }
        if (tag.isSend() && i == 2) {
            return mlen;
        }
        if (tag.isSend() && i == 3) {
            return exMlen;
        }
        MCReg reg = (MCReg) src;
        return divRoundUp(reg.getOffset() % REG_SIZE + reg.bytes(execSize), REG_SIZE);
    }

    public int bytesWritten() {
        if (!(dst instanceof MCReg)) {
            return 0;
        }
        return sizeWritten >= 0 ? sizeWritten : ((MCReg) dst).bytes(execSize);
    }

    public int regsWritten() {
        if (!(dst instanceof MCReg)) {
            return 0;
        }
        return divRoundUp(((MCReg) dst).getOffset() % REG_SIZE + bytesWritten(), REG_SIZE);
    }

    public boolean isPartialWrite() {
        if (!(dst instanceof MCReg)) {
            return false;
        }
        return partialWrite || bytesWritten() < REG_SIZE || ((MCReg) dst).isScalar();
    }

    public static int divRoundUp(int a, int b) {
        return (a + b - 1) / b;
    }

    public static int align(int a, int b) {
        return divRoundUp(a, b) * b;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("\t").append(tag).append("(").append(execSize).append(")\t\t").append(dst);
        for (MCOperand src : srcs) {
            sb.append(", ").append(src);
        }
        if (tag.isSend()) {
            sb.append(" mlen ").append(mlen).append(" ex_mlen ").append(exMlen);
        }
        if (forceWriteMaskAll) {
            sb.append(" NoMask");
        }
        if (eot) {
            sb.append(" EOT");
        }
        return sb.append("\n").toString();
    }
}
