package backend.register;

import backend.mc.MCBasicBlock;
import backend.mc.MCInstr;
import backend.mc.MCInstr.MCInstrTag;
import backend.mc.MCOperand;
import backend.mc.MCOperand.MCReg;
import backend.mc.MCProgram;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

public class InterferenceBuilder {
    private final DeviceInfo devinfo;
    private final RegisterManager regs;
    private final List<HazardRule> rules = new ArrayList<>();
    private MCProgram program;
    private ColoringOracle graph;
    private LiveRanges ranges;
    private SpillRewriter spills;
    private int payloadNodeCount;
    private int erratumNode = -1;
    private int firstVgrfNode;
    private int firstSpillNode;
    private int[] payloadLastUseIp = new int[0];

    public InterferenceBuilder(DeviceInfo devinfo, RegisterManager regs) {
        this(devinfo, regs, defaultRules());
    }

    public InterferenceBuilder(DeviceInfo devinfo, RegisterManager regs, List<HazardRule> rules) {
        this.devinfo = devinfo;
        this.regs = regs;
        for (HazardRule rule : rules) {
            if (rule.isEnabled(devinfo)) {
                this.rules.add(rule);
            }
        }
    }

    public static List<HazardRule> defaultRules() {
        return List.of(new SourceDestHazardRule(), new CompressedWriteHazardRule(), new SendOverlapErratumRule(),
                new SendPayloadOverlapRule(), new EotPlacementRule());
    }

    public static int payloadNodeCount(MCProgram program, DeviceInfo devinfo) {
        int regWidth = program.getDispatchWidth() / 8;
        int payloadRegs = MCInstr.align(program.getFirstNonPayloadGrf(), regWidth);
        return MCInstr.divRoundUp(payloadRegs, devinfo.getRegUnit());
    }

    public ColoringOracle build(MCProgram program, LiveRanges ranges, SpillRewriter spills, ColoringOracle graph) {
        this.program = program;
        this.ranges = ranges;
        this.spills = spills;
        this.graph = graph;
        if (graph.nodeCount() != 0) {
            throw new IllegalArgumentException("interference graph must start empty");
        }
        payloadNodeCount = payloadNodeCount(program, devinfo);
        if (payloadNodeCount > regs.getCapacity()) {
            throw new IllegalArgumentException("payload of " + program + " does not fit the register file");
        }
        for (int i = 0; i < payloadNodeCount; ++i) {
            graph.pinNode(graph.addNode(regs.getClass(1)), i);
        }
        erratumNode = -1;
        if (devinfo.hasSendOverlapErratum()) {
            erratumNode = graph.addNode(regs.getClass(1));
            graph.pinNode(erratumNode, devinfo.getErratumReg());
        }
        firstVgrfNode = graph.nodeCount();
        int count = program.getAlloc().count();
        for (int i = 0; i < count; ++i) {
            int n = graph.addNode(regs.getClass(sizeInUnits(i)));
            if (n != firstVgrfNode + i) {
                throw new IllegalStateException("vgrf" + i + " landed on node " + n);
            }
        }
        firstSpillNode = firstVgrfNode + ranges.count();

        payloadLastUseIp = calculatePayloadRanges(program, payloadNodeCount, devinfo.getRegUnit());

        for (int i = 0; i < count; ++i) {
            if (spills.isSpilled(i)) {
                continue;
            }
            if (i < ranges.count()) {
                setupLiveInterference(i, ranges.getStart(i), ranges.getEnd(i));
            } else {
                setupSpillTempInterference(i, spills.getSpillTempIp(i));
            }
        }
        if (payloadNodeCount > 0) {
            for (int header : spills.getHeaderTemps()) {
                graph.addEdge(vgrfNode(header), 0);
            }
        }
        for (MCInstr instr : program.instructions()) {
            for (HazardRule rule : rules) {
                rule.apply(instr, this);
            }
        }
        return graph;
    }

    private void setupLiveInterference(int vgrf, int startIp, int endIp) {
        int node = vgrfNode(vgrf);
        for (int i = 0; i < payloadNodeCount; ++i) {
            // <= rather than the strict overlap test: payload units are defined before ip 0
            if (payloadLastUseIp[i] != -1 && startIp <= payloadLastUseIp[i]) {
                graph.addEdge(node, i);
            }
        }
        for (int other = 0; other < ranges.count() && other < vgrf; ++other) {
            if (spills.isSpilled(other)) {
                continue;
            }
            if (!(endIp <= ranges.getStart(other) || ranges.getEnd(other) <= startIp)) {
                graph.addEdge(node, vgrfNode(other));
            }
        }
    }

    private void setupSpillTempInterference(int vgrf, int ip) {
        setupLiveInterference(vgrf, ip - 1, ip + 1);
        for (Map.Entry<Integer, Integer> temp : spills.getSpillTemps().entrySet()) {
            if (temp.getKey() >= vgrf) {
                break;
            }
            if (temp.getValue() == ip) {
                graph.addEdge(vgrfNode(vgrf), vgrfNode(temp.getKey()));
            }
        }
    }

    /**
     * Last ip at which each payload unit is read or written, -1 if never. A use inside a loop lasts until
     * the end of the outermost enclosing loop, and a program terminator keeps unit 0 live.
     */
    public static int[] calculatePayloadRanges(MCProgram program, int payloadNodeCount, int regUnit) {
        int[] lastUseIp = new int[payloadNodeCount];
        Arrays.fill(lastUseIp, -1);
        int loopDepth = 0;
        int loopEndIp = 0;
        List<MCBasicBlock> blocks = program.getBlocks();
        for (MCBasicBlock mcBB : blocks) {
            for (MCInstr instr : mcBB.getList()) {
                if (instr.getTag() == MCInstrTag.DO) {
                    loopDepth++;
                    if (loopDepth == 1) {
                        loopEndIp = countToLoopEnd(blocks, mcBB.getIndex());
                    }
                } else if (instr.getTag() == MCInstrTag.WHILE) {
                    loopDepth--;
                }
                int useIp = loopDepth > 0 ? loopEndIp : instr.getIp();
                for (int i = 0; i < instr.getSourceCount(); ++i) {
                    MCOperand src = instr.getSrc(i);
                    if (src.isFixed()) {
                        markPayload(lastUseIp, regUnit, ((MCReg) src).getNr(), instr.regsRead(i), useIp);
                    }
                }
                if (instr.getDst().isFixed()) {
                    markPayload(lastUseIp, regUnit, ((MCReg) instr.getDst()).getNr(), instr.regsWritten(), useIp);
                }
                if (instr.isEot() && payloadNodeCount > 0) {
                    lastUseIp[0] = useIp;
                }
            }
        }
        return lastUseIp;
    }

    private static void markPayload(int[] lastUseIp, int regUnit, int nr, int regs, int useIp) {
        int first = nr / regUnit;
        int end = Math.min(lastUseIp.length, MCInstr.divRoundUp(nr + regs, regUnit));
        for (int unit = first; unit < end; ++unit) {
            lastUseIp[unit] = useIp;
        }
    }

    private static int countToLoopEnd(List<MCBasicBlock> blocks, int index) {
        MCBasicBlock mcBB = blocks.get(index);
        if (mcBB.end().getTag() == MCInstrTag.WHILE) {
            return mcBB.getEndIp();
        }
        int depth = 1;
        for (int b = index + 1; b < blocks.size(); ++b) {
            MCBasicBlock next = blocks.get(b);
            if (next.getList().isEmpty()) {
                continue;
            }
            if (next.start().getTag() == MCInstrTag.DO) {
                depth++;
            }
            if (next.end().getTag() == MCInstrTag.WHILE) {
                depth--;
                if (depth == 0) {
                    return next.getEndIp();
                }
            }
        }
        throw new IllegalStateException("DO in block " + index + " is never closed");
    }

    public void addVgrfInterference(int vgrf1, int vgrf2) {
        graph.addEdge(vgrfNode(vgrf1), vgrfNode(vgrf2));
    }

    public void addErratumInterference(int vgrf) {
        if (erratumNode >= 0) {
            graph.addEdge(vgrfNode(vgrf), erratumNode);
        }
    }

    public void pinVgrf(int vgrf, int reg) {
        graph.pinNode(vgrfNode(vgrf), reg);
    }

    public int sizeInUnits(int vgrf) {
        return devinfo.units(program.getAlloc().size(vgrf));
    }

    public int vgrfNode(int vgrf) {
        return firstVgrfNode + vgrf;
    }

    public DeviceInfo getDevinfo() {
        return devinfo;
    }

    public boolean hasErratumNode() {
        return erratumNode >= 0;
    }

    public int getErratumNode() {
        return erratumNode;
    }

    public int getPayloadNodeCount() {
        return payloadNodeCount;
    }

    public int getFirstVgrfNode() {
        return firstVgrfNode;
    }

    public int getFirstSpillNode() {
        return firstSpillNode;
    }

    public int[] getPayloadLastUseIp() {
        return payloadLastUseIp;
    }
}
