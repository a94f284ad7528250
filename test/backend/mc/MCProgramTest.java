package backend.mc;

import backend.mc.MCInstr.MCInstrTag;
import backend.mc.MCOperand.MCFixedReg;
import backend.mc.MCOperand.MCImm;
import backend.mc.MCOperand.MCVirtualReg;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class MCProgramTest {

    private static MCProgram build(MCInstr... instrs) {
        VirtualRegisters alloc = new VirtualRegisters();
        alloc.allocate(1);
        alloc.allocate(1);
        return MCProgram.build("cfg", 8, 1, Arrays.asList(instrs), alloc);
    }

    private static MCInstr mov(int dst) {
        return MCInstr.mov(8, new MCVirtualReg(dst), new MCImm(dst));
    }

    @Test
    public void straightLineIsOneBlock() {
        MCProgram program = build(mov(0), mov(1), MCInstr.mov(8, new MCFixedReg(0), new MCVirtualReg(1)));
        assertEquals(1, program.getBlocks().size());
        List<MCInstr> instrs = program.instructions();
        for (int ip = 0; ip < instrs.size(); ++ip) {
            assertEquals(ip, instrs.get(ip).getIp());
        }
        assertTrue(program.hasVirtualOperands());
    }

    @Test
    public void loopLinksBackEdge() {
        MCProgram program = build(mov(0), MCInstr.control(MCInstrTag.DO), mov(1),
                MCInstr.control(MCInstrTag.WHILE), mov(0));
        List<MCBasicBlock> blocks = program.getBlocks();
        assertEquals(3, blocks.size());
        assertEquals(MCInstrTag.DO, blocks.get(1).start().getTag());
        assertEquals(MCInstrTag.WHILE, blocks.get(1).end().getTag());
        assertEquals(List.of(1), blocks.get(0).getSucc());
        assertEquals(List.of(1, 2), blocks.get(1).getSucc());
        assertEquals(List.of(0, 1), blocks.get(1).getPred());
        assertEquals(1, blocks.get(1).getStartIp());
        assertEquals(3, blocks.get(1).getEndIp());
        assertTrue(blocks.get(2).getSucc().isEmpty());
    }

    @Test
    public void ifElseJoinsAtEndif() {
        MCProgram program = build(MCInstr.control(MCInstrTag.IF), mov(0), MCInstr.control(MCInstrTag.ELSE),
                mov(1), MCInstr.control(MCInstrTag.ENDIF), mov(0));
        List<MCBasicBlock> blocks = program.getBlocks();
        assertEquals(4, blocks.size());
        assertEquals(List.of(1, 2), blocks.get(0).getSucc());
        assertEquals(List.of(3), blocks.get(1).getSucc());
        assertEquals(List.of(3), blocks.get(2).getSucc());
        assertEquals(List.of(2, 1), blocks.get(3).getPred());
    }

    @Test
    public void ifWithoutElseFallsThrough() {
        MCProgram program = build(MCInstr.control(MCInstrTag.IF), mov(0), MCInstr.control(MCInstrTag.ENDIF),
                mov(1));
        List<MCBasicBlock> blocks = program.getBlocks();
        assertEquals(3, blocks.size());
        assertEquals(List.of(1, 2), blocks.get(0).getSucc());
        assertEquals(List.of(1, 0), blocks.get(2).getPred());
    }

    @Test(expected = IllegalArgumentException.class)
    public void whileWithoutDoIsRejected() {
        build(mov(0), MCInstr.control(MCInstrTag.WHILE));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unclosedLoopIsRejected() {
        build(MCInstr.control(MCInstrTag.DO), mov(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void oddDispatchWidthIsRejected() {
        MCProgram.build("simd4", 4, 1, List.of(mov(0)), new VirtualRegisters());
    }

    @Test
    public void insertionKeepsNeighbours() {
        MCProgram program = build(mov(0), mov(1));
        MCBasicBlock bb = program.getBlocks().get(0);
        MCInstr first = bb.start();
        MCInstr nop = new MCInstr(MCInstrTag.NOP, 8, MCOperand.MCNull.NULL);
        bb.insertAfter(first, nop);
        assertEquals(3, bb.getList().size());
        assertEquals(nop, bb.getList().get(1));
        bb.remove(nop);
        assertFalse(bb.getList().contains(nop));
    }

    @Test
    public void scratchGrowsMonotonically() {
        MCProgram program = build(mov(0));
        assertEquals(0, program.getLastScratch());
        program.addScratch(64);
        program.addScratch(32);
        assertEquals(96, program.getLastScratch());
        assertFalse(program.isSpilledAnyRegisters());
    }
}
