package backend.register;

import backend.mc.MCInstr;
import backend.mc.MCInstr.MCInstrTag;
import backend.mc.MCOperand.MCVirtualReg;
import backend.mc.MCProgram;
import org.junit.Test;

import static backend.register.Programs.g;
import static backend.register.Programs.imm;
import static backend.register.Programs.program;
import static backend.register.Programs.sizes;
import static backend.register.Programs.v;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class LivenessAnalysisTest {

    @Test
    public void lastReadAndNextDefinitionDoNotInterfere() {
        MCProgram program = program(8, 1, sizes(1, 1, 1, 1),
                MCInstr.mov(8, v(0), imm(1)),
                MCInstr.mov(8, v(1), imm(2)),
                MCInstr.alu(MCInstrTag.ADD, 8, v(2), v(0), v(1)),
                MCInstr.mov(8, g(0), v(2)));
        LiveRanges ranges = new LivenessAnalysis().computeLiveRanges(program);
        assertEquals(0, ranges.getStart(0));
        assertEquals(2, ranges.getEnd(0));
        assertEquals(1, ranges.getStart(1));
        assertEquals(2, ranges.getStart(2));
        assertEquals(3, ranges.getEnd(2));
        assertTrue(ranges.interferes(0, 1));
        assertFalse(ranges.interferes(0, 2));
        assertFalse(ranges.interferes(1, 2));
    }

    @Test
    public void unreferencedRegisterIsDegenerate() {
        MCProgram program = program(8, 1, sizes(1, 1),
                MCInstr.mov(8, v(0), imm(1)),
                MCInstr.mov(8, g(0), v(0)));
        LiveRanges ranges = new LivenessAnalysis().computeLiveRanges(program);
        assertEquals(Integer.MAX_VALUE, ranges.getStart(1));
        assertEquals(-1, ranges.getEnd(1));
        assertFalse(ranges.interferes(0, 1));
    }

    @Test
    public void valueLiveIntoLoopLastsUntilLoopEnd() {
        MCProgram program = program(8, 1, sizes(1, 1),
                MCInstr.mov(8, v(0), imm(1)),
                MCInstr.control(MCInstrTag.DO),
                MCInstr.alu(MCInstrTag.ADD, 8, v(1), v(0), imm(1)),
                MCInstr.control(MCInstrTag.WHILE),
                MCInstr.mov(8, g(0), v(1)));
        LiveRanges ranges = new LivenessAnalysis().computeLiveRanges(program);
        assertEquals(0, ranges.getStart(0));
        assertEquals(3, ranges.getEnd(0));
        assertEquals(2, ranges.getStart(1));
        assertEquals(4, ranges.getEnd(1));
        assertTrue(program.getBlocks().get(1).liveIn.contains(0));
        assertTrue(program.getBlocks().get(1).liveOut.contains(0));
        assertTrue(program.getBlocks().get(1).liveOut.contains(1));
    }

    @Test
    public void partialWriteDoesNotKillTheValue() {
        MCVirtualReg halfWidth = new MCVirtualReg(0, 0, 2, 1, false);
        MCProgram program = program(8, 1, sizes(1),
                MCInstr.mov(8, halfWidth, imm(1)),
                MCInstr.mov(8, g(0), v(0)));
        new LivenessAnalysis().analysis(program);
        assertTrue(program.getBlocks().get(0).liveUse.contains(0));
        assertFalse(program.getBlocks().get(0).liveDef.contains(0));
        assertTrue(program.getBlocks().get(0).liveIn.contains(0));
    }

    @Test
    public void valueDefinedInOneBranchIsLiveAcrossTheOther() {
        MCProgram program = program(8, 1, sizes(1),
                MCInstr.control(MCInstrTag.IF),
                MCInstr.mov(8, v(0), imm(1)),
                MCInstr.control(MCInstrTag.ELSE),
                MCInstr.mov(8, g(0), imm(2)),
                MCInstr.control(MCInstrTag.ENDIF),
                MCInstr.mov(8, g(0), v(0)));
        LiveRanges ranges = new LivenessAnalysis().computeLiveRanges(program);
        // undefined on the else path, so live from program entry
        assertEquals(0, ranges.getStart(0));
        assertEquals(5, ranges.getEnd(0));
    }
}
