package backend.register;

import backend.mc.MCInstr;
import backend.mc.MCInstr.MCInstrTag;
import backend.mc.MCOperand.MCNull;
import backend.mc.MCOperand.MCVirtualReg;
import backend.mc.MCProgram;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static backend.register.Programs.g;
import static backend.register.Programs.imm;
import static backend.register.Programs.program;
import static backend.register.Programs.sizes;
import static backend.register.Programs.v;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class InterferenceBuilderTest {
    private InterferenceBuilder builder;

    private InterfereGraph build(DeviceInfo devinfo, MCProgram program) {
        return build(devinfo, program, InterferenceBuilder.defaultRules());
    }

    private InterfereGraph build(DeviceInfo devinfo, MCProgram program, List<HazardRule> rules) {
        builder = new InterferenceBuilder(devinfo, RegisterManager.forDevice(devinfo), rules);
        LiveRanges ranges = new LivenessAnalysis().computeLiveRanges(program);
        InterfereGraph graph = new InterfereGraph();
        builder.build(program, ranges, new SpillRewriter(program, devinfo), graph);
        return graph;
    }

    private boolean vgrfsInterfere(InterfereGraph graph, int a, int b) {
        return graph.interferes(builder.vgrfNode(a), builder.vgrfNode(b));
    }

    @Test
    public void nodesArePayloadThenErratumThenVgrfs() {
        MCProgram program = program(8, 2, sizes(1, 1), MCInstr.mov(8, v(0), imm(0)), MCInstr.mov(8, v(1), v(0)));
        InterfereGraph graph = build(DeviceInfo.gen9(), program);
        assertEquals(2, builder.getPayloadNodeCount());
        assertEquals(2, builder.getErratumNode());
        assertEquals(3, builder.getFirstVgrfNode());
        assertEquals(5, graph.nodeCount());
        assertEquals(5, builder.getFirstSpillNode());
        assertTrue(graph.isPinned(0));
        assertTrue(graph.isPinned(2));
        assertFalse(graph.isPinned(3));

        graph = build(DeviceInfo.gen9().withSendOverlapErratum(false), program);
        assertFalse(builder.hasErratumNode());
        assertEquals(2, builder.getFirstVgrfNode());
    }

    @Test
    public void payloadIsRoundedToTheDispatchWidth() {
        MCProgram program = program(16, 3, sizes(2), MCInstr.mov(16, v(0), imm(0)));
        assertEquals(4, InterferenceBuilder.payloadNodeCount(program, DeviceInfo.gen9()));
        assertEquals(2, InterferenceBuilder.payloadNodeCount(program, DeviceInfo.xe2()));
    }

    @Test
    public void payloadUseInsideLoopLastsUntilOutermostWhile() {
        MCProgram program = program(8, 2, sizes(1, 1, 1),
                MCInstr.mov(8, v(0), g(1)),
                MCInstr.control(MCInstrTag.DO),
                MCInstr.control(MCInstrTag.DO),
                MCInstr.alu(MCInstrTag.ADD, 8, v(1), v(0), g(0)),
                MCInstr.control(MCInstrTag.WHILE),
                MCInstr.control(MCInstrTag.WHILE),
                MCInstr.mov(8, v(2), v(1)));
        assertArrayEquals(new int[]{5, 0}, InterferenceBuilder.calculatePayloadRanges(program, 2, 1));

        InterfereGraph graph = build(DeviceInfo.gen9(), program);
        assertArrayEquals(new int[]{5, 0}, builder.getPayloadLastUseIp());
        assertTrue(graph.interferes(builder.vgrfNode(0), 0));
        assertTrue(graph.interferes(builder.vgrfNode(0), 1));
        assertTrue(graph.interferes(builder.vgrfNode(1), 0));
        assertFalse(graph.interferes(builder.vgrfNode(1), 1));
    }

    @Test
    public void terminatorKeepsG0Live() {
        MCProgram program = program(8, 1, sizes(1),
                MCInstr.mov(8, v(0), imm(0)),
                MCInstr.send(8, MCNull.NULL, v(0), MCNull.NULL, 1, 0, 0).setEot(true));
        assertArrayEquals(new int[]{1}, InterferenceBuilder.calculatePayloadRanges(program, 1, 1));
    }

    @Test
    public void spillTemporariesInterfereAroundTheirInstruction() {
        MCProgram program = program(8, 1, sizes(1, 1, 1, 1),
                MCInstr.mov(8, v(0), imm(1)),
                MCInstr.mov(8, v(1), imm(2)),
                MCInstr.alu(MCInstrTag.ADD, 8, v(2), v(0), v(0)),
                MCInstr.alu(MCInstrTag.ADD, 8, v(3), v(2), v(1)));
        DeviceInfo devinfo = DeviceInfo.gen9();
        LiveRanges ranges = new LivenessAnalysis().computeLiveRanges(program);
        SpillRewriter rewriter = new SpillRewriter(program, devinfo);
        rewriter.spill(0);
        // vgrf4 and vgrf5 store the mov, vgrf6 and vgrf8 fill the add, odd ones are headers
        assertEquals(Map.of(4, 0, 5, 0, 6, 2, 7, 2, 8, 2, 9, 2), new TreeMap<>(rewriter.getSpillTemps()));
        assertEquals(Set.of(5, 7, 9), rewriter.getHeaderTemps());

        builder = new InterferenceBuilder(devinfo, RegisterManager.forDevice(devinfo));
        InterfereGraph graph = new InterfereGraph();
        builder.build(program, ranges, rewriter, graph);
        assertEquals(6, builder.getFirstSpillNode());

        for (int a = 6; a < 10; ++a) {
            for (int b = a + 1; b < 10; ++b) {
                assertTrue("vgrf" + a + " and vgrf" + b, vgrfsInterfere(graph, a, b));
            }
            assertTrue(vgrfsInterfere(graph, a, 1));
            assertTrue(vgrfsInterfere(graph, a, 2));
            assertFalse(vgrfsInterfere(graph, a, 3));
            assertFalse(vgrfsInterfere(graph, a, 0));
            assertFalse(vgrfsInterfere(graph, a, 4));
        }
        assertTrue(vgrfsInterfere(graph, 4, 5));
        assertFalse(vgrfsInterfere(graph, 4, 1));

        for (int header : new int[]{5, 7, 9}) {
            assertTrue(graph.interferes(builder.vgrfNode(header), 0));
        }
        for (int temp : new int[]{4, 6, 8}) {
            assertFalse(graph.interferes(builder.vgrfNode(temp), 0));
        }
    }

    @Test
    public void mathSourcesInterfereWithDestination() {
        MCProgram math = program(8, 1, sizes(1, 1),
                MCInstr.mov(8, v(1), imm(3)),
                MCInstr.alu(MCInstrTag.MATH, 8, v(0), v(1)),
                MCInstr.mov(8, g(0), v(0)));
        assertTrue(vgrfsInterfere(build(DeviceInfo.gen9(), math), 0, 1));

        MCProgram mov = program(8, 1, sizes(1, 1),
                MCInstr.mov(8, v(1), imm(3)),
                MCInstr.mov(8, v(0), v(1)),
                MCInstr.mov(8, g(0), v(0)));
        assertFalse(vgrfsInterfere(build(DeviceInfo.gen9(), mov), 0, 1));

        MCProgram flagged = program(8, 1, sizes(1, 1),
                MCInstr.mov(8, v(1), imm(3)),
                MCInstr.mov(8, v(0), v(1)).setSourceDestHazard(true),
                MCInstr.mov(8, g(0), v(0)));
        assertTrue(vgrfsInterfere(build(DeviceInfo.gen9(), flagged), 0, 1));
    }

    @Test
    public void compressedWriteInterferesWithSources() {
        MCProgram program = program(16, 2, sizes(2, 2),
                MCInstr.mov(16, v(1), imm(3)),
                MCInstr.mov(16, v(0), v(1)),
                MCInstr.mov(16, g(0), v(0)));
        assertTrue(vgrfsInterfere(build(DeviceInfo.gen9(), program), 0, 1));
        assertFalse(vgrfsInterfere(build(DeviceInfo.gen9().withCompressedWriteHazard(false), program), 0, 1));
        assertFalse(vgrfsInterfere(build(DeviceInfo.gen9(), program, List.of(new SourceDestHazardRule())), 0, 1));
    }

    @Test
    public void narrowSendAvoidsErratumRegister() {
        MCProgram simd8 = program(8, 1, sizes(1, 1),
                MCInstr.mov(8, v(1), imm(3)),
                MCInstr.send(8, v(0), v(1), MCNull.NULL, 1, 0, 32),
                MCInstr.mov(8, g(0), v(0)));
        InterfereGraph graph = build(DeviceInfo.gen9(), simd8);
        assertTrue(graph.interferes(builder.vgrfNode(0), builder.getErratumNode()));
        assertFalse(graph.interferes(builder.vgrfNode(1), builder.getErratumNode()));

        MCProgram simd16 = program(16, 2, sizes(2, 2),
                MCInstr.mov(16, v(1), imm(3)),
                MCInstr.send(16, v(0), v(1), MCNull.NULL, 2, 0, 64),
                MCInstr.mov(16, g(0), v(0)));
        graph = build(DeviceInfo.gen9(), simd16);
        assertFalse(graph.interferes(builder.vgrfNode(0), builder.getErratumNode()));
    }

    @Test
    public void splitSendPayloadsNeverOverlap() {
        MCProgram program = program(8, 1, sizes(1, 1),
                MCInstr.mov(8, v(0), imm(3)),
                MCInstr.send(8, MCNull.NULL, v(0), v(1), 1, 1, 0));
        LiveRanges ranges = new LivenessAnalysis().computeLiveRanges(program);
        assertFalse(ranges.interferes(0, 1));
        assertTrue(vgrfsInterfere(build(DeviceInfo.gen9(), program), 0, 1));
        assertFalse(vgrfsInterfere(build(DeviceInfo.gen9().withSendPayloadOverlap(false), program), 0, 1));
    }

    private static MCProgram terminator(int... payloadSizes) {
        MCVirtualReg payload = new MCVirtualReg(0, 0, 4, payloadSizes[0], false);
        if (payloadSizes.length == 1) {
            return program(8, 2, sizes(payloadSizes),
                    MCInstr.mov(8, payload, imm(1)),
                    MCInstr.send(8, MCNull.NULL, v(0), MCNull.NULL, payloadSizes[0], 0, 0).setEot(true));
        }
        return program(8, 2, sizes(payloadSizes),
                MCInstr.mov(8, payload, imm(1)),
                MCInstr.mov(8, v(1), imm(2)),
                MCInstr.send(8, MCNull.NULL, v(0), v(1), payloadSizes[0], payloadSizes[1], 0).setEot(true));
    }

    @Test
    public void terminatorPayloadIsPinnedAtTheTop() {
        InterfereGraph graph = build(DeviceInfo.gen9().withSendOverlapErratum(false), terminator(2));
        assertTrue(graph.isPinned(builder.vgrfNode(0)));
        assertTrue(graph.allocate());
        assertEquals(126, graph.assignedRegister(builder.vgrfNode(0)));

        graph = build(DeviceInfo.gen9(), terminator(2));
        assertTrue(graph.allocate());
        assertEquals(125, graph.assignedRegister(builder.vgrfNode(0)));
    }

    @Test
    public void secondPayloadSitsBelowTheFirst() {
        InterfereGraph graph = build(DeviceInfo.gen9(), terminator(2, 1));
        assertTrue(graph.allocate());
        assertEquals(125, graph.assignedRegister(builder.vgrfNode(0)));
        assertEquals(124, graph.assignedRegister(builder.vgrfNode(1)));
    }

    @Test(expected = IllegalStateException.class)
    public void terminatorInsidePayloadIsFatal() {
        MCProgram program = program(8, 3, sizes(2),
                MCInstr.mov(8, new MCVirtualReg(0, 0, 4, 2, false), imm(1)),
                MCInstr.send(8, MCNull.NULL, v(0), MCNull.NULL, 2, 0, 0).setEot(true));
        build(DeviceInfo.gen9().withGrfCount(4), program);
    }
}
