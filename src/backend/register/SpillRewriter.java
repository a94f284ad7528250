package backend.register;

import backend.mc.MCBasicBlock;
import backend.mc.MCInstr;
import backend.mc.MCInstr.MCInstrTag;
import backend.mc.MCOperand;
import backend.mc.MCOperand.MCImm;
import backend.mc.MCOperand.MCNull;
import backend.mc.MCOperand.MCReg;
import backend.mc.MCOperand.MCVirtualReg;
import backend.mc.MCProgram;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import static backend.mc.MCOperand.REG_SIZE;

public class SpillRewriter {
    private final MCProgram program;
    private final DeviceInfo devinfo;
    private final TreeSet<Integer> spilled = new TreeSet<>();
    private final TreeMap<Integer, Integer> spillTempIp = new TreeMap<>();
    private final TreeSet<Integer> headerTemps = new TreeSet<>();
    private final Set<MCInstr> spillInstrs = Collections.newSetFromMap(new IdentityHashMap<>());

    public SpillRewriter(MCProgram program, DeviceInfo devinfo) {
        this.program = program;
        this.devinfo = devinfo;
    }

    public int spillMaxSize() {
        if (devinfo.hasLsc()) {
            return 2;
        }
        return program.getDispatchWidth() / 8;
    }

    public boolean isSpilled(int vgrf) {
        return spilled.contains(vgrf);
    }

    public SortedSet<Integer> getSpilled() {
        return Collections.unmodifiableSortedSet(spilled);
    }

    public int getSpillTempIp(int vgrf) {
        Integer ip = spillTempIp.get(vgrf);
        if (ip == null) {
            throw new IllegalArgumentException("vgrf" + vgrf + " is not a spill temporary");
        }
        return ip;
    }

    public SortedMap<Integer, Integer> getSpillTemps() {
        return Collections.unmodifiableSortedMap(spillTempIp);
    }

    public SortedSet<Integer> getHeaderTemps() {
        return Collections.unmodifiableSortedSet(headerTemps);
    }

    public boolean isSpillInstr(MCInstr instr) {
        return spillInstrs.contains(instr);
    }

    public void spill(int vgrf) {
        if (spilled.contains(vgrf) || spillTempIp.containsKey(vgrf)) {
            throw new IllegalArgumentException("vgrf" + vgrf + " cannot be spilled again");
        }
        int size = program.getAlloc().size(vgrf);
        int spillOffset = program.getLastScratch();
        if (spillOffset % 16 != 0) {
            throw new IllegalStateException("scratch offset " + spillOffset + " is not oword aligned");
        }
        program.setSpilledAnyRegisters();
        program.addScratch(size * REG_SIZE);
        spilled.add(vgrf);

        for (MCBasicBlock mcBB : program.getBlocks()) {
            for (MCInstr instr : new ArrayList<>(mcBB.getList())) {
                int ip = instr.getIp();
                for (int i = 0; i < instr.getSourceCount(); ++i) {
                    MCOperand src = instr.getSrc(i);
                    if (!src.isVirtual() || ((MCReg) src).getNr() != vgrf) {
                        continue;
                    }
                    MCReg reg = (MCReg) src;
                    int count = instr.regsRead(i);
                    int subsetSpillOffset = spillOffset + roundDown(reg.getOffset(), REG_SIZE);
                    MCVirtualReg unspillDst = allocSpillReg(count, ip);
                    instr.setSrc(i, reg.withNr(unspillDst.getNr()).withOffset(reg.getOffset() % REG_SIZE));
                    // power-of-two block reads only
                    int width = Math.min(32, 1 << Integer.numberOfTrailingZeros(Math.max(1, count) * 8));
                    emitUnspill(new Cursor(mcBB, instr, false), width, true, unspillDst, subsetSpillOffset,
                            count, ip);
                }

                if (!instr.getDst().isVirtual() || ((MCReg) instr.getDst()).getNr() != vgrf) {
                    continue;
                }
                if (instr.getTag() == MCInstrTag.UNDEF) {
                    mcBB.remove(instr);
                    continue;
                }
                MCReg dst = (MCReg) instr.getDst();
                boolean partial = instr.isPartialWrite();
                int written = instr.regsWritten();
                int subsetSpillOffset = spillOffset + roundDown(dst.getOffset(), REG_SIZE);
                MCVirtualReg spillSrc = allocSpillReg(written, ip);
                instr.setDst(dst.withNr(spillSrc.getNr()).withOffset(dst.getOffset() % REG_SIZE));

                int regUnit = devinfo.getRegUnit();
                int width = 8 * regUnit * MCInstr.divRoundUp(
                        Math.min(dst.componentSize(instr.getExecSize()), spillMaxSize() * REG_SIZE),
                        regUnit * REG_SIZE);
                // a per-channel spill only stores the channels the instruction actually wrote
                boolean perChannel = !dst.isScalar() && dst.getTypeSize() == 4 && instr.getExecSize() == width;
                if (partial || (!instr.isForceWriteMaskAll() && !perChannel)) {
                    emitUnspill(new Cursor(mcBB, instr, false), width, !perChannel, spillSrc, subsetSpillOffset,
                            written, ip);
                }
                emitSpill(new Cursor(mcBB, instr, true), width, !perChannel, spillSrc, subsetSpillOffset,
                        written, ip);
            }
        }
    }

    private MCVirtualReg allocSpillReg(int size, int ip) {
        int nr = program.getAlloc().allocate(MCInstr.align(size, devinfo.getRegUnit()));
        spillTempIp.put(nr, ip);
        return new MCVirtualReg(nr);
    }

    private void emitUnspill(Cursor cursor, int width, boolean forceWriteMaskAll, MCVirtualReg dst,
                             int spillOffset, int count, int ip) {
        int regSize = dst.componentSize(width) / REG_SIZE;
        MCReg cur = dst;
        for (int i = 0; i < MCInstr.divRoundUp(count, regSize); ++i) {
            program.getStats().countFill();
            MCInstr unspill;
            if (devinfo.hasLsc()) {
                // wide fills use a transposed block load from a single address
                boolean useTranspose = width > 16;
                MCVirtualReg offset = useTranspose ? buildSingleOffset(cursor, spillOffset, ip)
                        : buildLaneOffsets(cursor, width, spillOffset, ip);
                int execSize = useTranspose ? 1 : width;
                unspill = MCInstr.send(execSize, cur, offset, MCNull.NULL,
                        MCInstr.divRoundUp(execSize * 4, REG_SIZE), 0, regSize * REG_SIZE);
                unspill.setForceWriteMaskAll(useTranspose || forceWriteMaskAll);
            } else {
                MCVirtualReg header = buildLegacyScratchHeader(cursor, spillOffset, ip);
                unspill = MCInstr.send(width, cur, header, MCNull.NULL, 1, 0, regSize * REG_SIZE);
                unspill.setForceWriteMaskAll(forceWriteMaskAll);
            }
            cursor.emit(unspill, ip);
            cur = cur.byteOffset(regSize * REG_SIZE);
            spillOffset += regSize * REG_SIZE;
        }
    }

    private void emitSpill(Cursor cursor, int width, boolean forceWriteMaskAll, MCVirtualReg src,
                           int spillOffset, int count, int ip) {
        int regSize = src.componentSize(width) / REG_SIZE;
        MCReg cur = src;
        for (int i = 0; i < MCInstr.divRoundUp(count, regSize); ++i) {
            program.getStats().countSpill();
            MCInstr spill;
            if (devinfo.hasLsc()) {
                MCVirtualReg offset = buildLaneOffsets(cursor, width, spillOffset, ip);
                spill = MCInstr.send(width, MCNull.NULL, offset, cur,
                        MCInstr.divRoundUp(width * 4, REG_SIZE), regSize, 0);
            } else {
                MCVirtualReg header = buildLegacyScratchHeader(cursor, spillOffset, ip);
                spill = MCInstr.send(width, MCNull.NULL, header, cur, 1, regSize, 0);
            }
            spill.setForceWriteMaskAll(forceWriteMaskAll);
            cursor.emit(spill, ip);
            cur = cur.byteOffset(regSize * REG_SIZE);
            spillOffset += regSize * REG_SIZE;
        }
    }

    private MCVirtualReg buildSingleOffset(Cursor cursor, int spillOffset, int ip) {
        MCVirtualReg offset = allocSpillReg(1, ip);
        cursor.emit(MCInstr.mov(1, offset, new MCImm(spillOffset)).setForceWriteMaskAll(true), ip);
        return offset;
    }

    private MCVirtualReg buildLaneOffsets(Cursor cursor, int width, int spillOffset, int ip) {
        if (width > 16) {
            throw new IllegalStateException("lane offsets for SIMD" + width);
        }
        MCVirtualReg offset = allocSpillReg(width / 8, ip);
        MCVirtualReg offsetW = offset.withType(2, 1);
        cursor.emit(MCInstr.mov(8, offsetW, new MCImm(0x76543210)).setForceWriteMaskAll(true), ip);
        cursor.emit(MCInstr.mov(8, offset, offsetW).setForceWriteMaskAll(true), ip);
        if (width > 8) {
            cursor.emit(MCInstr.alu(MCInstrTag.ADD, 8, offset.byteOffset(REG_SIZE), offset, new MCImm(8))
                    .setForceWriteMaskAll(true), ip);
        }
        cursor.emit(MCInstr.alu(MCInstrTag.SHL, width, offset, offset, new MCImm(2))
                .setForceWriteMaskAll(true), ip);
        cursor.emit(MCInstr.alu(MCInstrTag.ADD, width, offset, offset, new MCImm(spillOffset))
                .setForceWriteMaskAll(true), ip);
        return offset;
    }

    /**
     * Scratch message header for devices without LSC. The header is built from g0, so it must not share
     * a register with it.
     */
    private MCVirtualReg buildLegacyScratchHeader(Cursor cursor, int spillOffset, int ip) {
        MCVirtualReg header = allocSpillReg(1, ip);
        headerTemps.add(header.getNr());
        cursor.emit(new MCInstr(MCInstrTag.SCRATCH_HEADER, 8, header).setForceWriteMaskAll(true), ip);
        MCVirtualReg offsetSlot = new MCVirtualReg(header.getNr(), 8, 4, 1, true);
        cursor.emit(MCInstr.mov(1, offsetSlot, new MCImm(spillOffset / 16)).setForceWriteMaskAll(true), ip);
        return header;
    }

    private static int roundDown(int value, int align) {
        return value / align * align;
    }

    private class Cursor {
        private final MCBasicBlock block;
        private MCInstr anchor;
        private final boolean after;

        Cursor(MCBasicBlock block, MCInstr anchor, boolean after) {
            this.block = block;
            this.anchor = anchor;
            this.after = after;
        }

        void emit(MCInstr instr, int ip) {
            instr.setIp(ip);
            spillInstrs.add(instr);
            if (after) {
                block.insertAfter(anchor, instr);
                anchor = instr;
            } else {
                block.insertBefore(anchor, instr);
            }
        }
    }
}
