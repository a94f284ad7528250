package backend.register;

import backend.mc.MCInstr;
import backend.mc.MCOperand.MCReg;
import backend.mc.MCProgram;
import backend.register.RegisterAllocationException.Failure;
import utils.Logger;

import java.util.ArrayList;
import java.util.OptionalInt;
import java.util.function.Supplier;

public class GraphColorRegisterAllocator extends RegisterAllocator {
    private final LiveRangeOracle liveness;
    private final Supplier<ColoringOracle> graphFactory;
    private final SpillScheme spillScheme;
    private final InterferenceBuilder builder;
    private final SpillCostEstimator costEstimator = new SpillCostEstimator();
    private LiveRanges ranges;
    private SpillRewriter rewriter;
    private ColoringOracle graph;

    public GraphColorRegisterAllocator(MCProgram program, DeviceInfo devinfo) {
        this(program, devinfo, RegisterManager.forDevice(devinfo), new LivenessAnalysis(), InterfereGraph::new,
                SpillScheme.fromConfig());
    }

    public GraphColorRegisterAllocator(MCProgram program, DeviceInfo devinfo, RegisterManager regs,
                                       LiveRangeOracle liveness, Supplier<ColoringOracle> graphFactory,
                                       SpillScheme spillScheme) {
        super(program, devinfo);
        this.liveness = liveness;
        this.graphFactory = graphFactory;
        this.spillScheme = spillScheme;
        this.builder = new InterferenceBuilder(devinfo, regs);
    }

    @Override
    public AllocationResult allocate(boolean allowSpilling, boolean spillAll) {
        ranges = liveness.computeLiveRanges(program);
        rewriter = new SpillRewriter(program, devinfo);
        int originalCount = program.getAlloc().count();
        int spilled = 0;
        int rounds = 0;
        buildInterferenceGraph();

        while (true) {
            if (spillAll) {
                OptionalInt reg = chooseSpillReg();
                if (reg.isPresent()) {
                    spillReg(reg.getAsInt(), originalCount);
                    spilled++;
                    buildInterferenceGraph();
                    continue;
                }
            }

            if (graph.allocate()) {
                break;
            }

            if (!allowSpilling) {
                throw fail(Failure.SPILLING_DISALLOWED,
                        "out of registers and spilling is not allowed, " + describeUncolored());
            }

            int nrSpills = spillScheme.spillsThisRound(spilled);
            for (int j = 0; j < nrSpills; ++j) {
                OptionalInt reg = chooseSpillReg();
                if (reg.isEmpty()) {
                    if (j == 0) {
                        throw fail(Failure.NO_SPILL_CANDIDATE, "no register to spill, " + describeUncolored());
                    }
                    break;
                }
                spillReg(reg.getAsInt(), originalCount);
                // the spilled node stays in this graph until the rebuild, keep it out of the next pick
                graph.setSpillCost(builder.vgrfNode(reg.getAsInt()), 0);
                spilled++;
            }
            rounds++;
            Logger.logSpillRound(program, rounds, spilled);
            buildInterferenceGraph();
        }

        int[] hwRegMapping = new int[program.getAlloc().count()];
        for (int i = 0; i < hwRegMapping.length; ++i) {
            hwRegMapping[i] = rewriter.isSpilled(i) ? AllocationResult.SPILLED
                    : graph.assignedRegister(builder.vgrfNode(i));
        }
        return assignRegs(hwRegMapping, rounds, new ArrayList<>(rewriter.getSpilled()));
    }

    private void buildInterferenceGraph() {
        graph = builder.build(program, ranges, rewriter, graphFactory.get());
        float[] costs = costEstimator.estimate(program, ranges, rewriter);
        for (int i = 0; i < costs.length; ++i) {
            graph.setSpillCost(builder.vgrfNode(i), costs[i]);
        }
    }

    private String describeUncolored() {
        int node = graph.failedNode();
        if (node < builder.getFirstVgrfNode()) {
            return "no vgrf left uncolored";
        }
        int vgrf = node - builder.getFirstVgrfNode();
        for (MCInstr instr : program.instructions()) {
            if (references(instr, vgrf)) {
                return "vgrf" + vgrf + " cannot be colored at " + instr.toString().strip();
            }
        }
        return "vgrf" + vgrf + " cannot be colored";
    }

    private static boolean references(MCInstr instr, int vgrf) {
        if (instr.writesVirtual() && ((MCReg) instr.getDst()).getNr() == vgrf) {
            return true;
        }
        for (int i = 0; i < instr.getSourceCount(); ++i) {
            if (instr.readsVirtual(i) && ((MCReg) instr.getSrc(i)).getNr() == vgrf) {
                return true;
            }
        }
        return false;
    }

    private OptionalInt chooseSpillReg() {
        OptionalInt node = graph.bestSpillCandidate();
        if (node.isEmpty()) {
            return node;
        }
        if (node.getAsInt() < builder.getFirstVgrfNode()) {
            throw new IllegalStateException("spill candidate " + node.getAsInt() + " is not a vgrf node");
        }
        return OptionalInt.of(node.getAsInt() - builder.getFirstVgrfNode());
    }

    private void spillReg(int vgrf, int originalCount) {
        if (vgrf >= originalCount) {
            throw new IllegalStateException("spill temporary vgrf" + vgrf + " chosen for spilling");
        }
        if (rewriter.getSpilled().size() >= originalCount) {
            throw new IllegalStateException("spilled more registers than " + program + " has");
        }
        Logger.logSpill(program, vgrf, program.getAlloc().size(vgrf));
        rewriter.spill(vgrf);
    }

    public ColoringOracle getGraph() {
        return graph;
    }

    public InterferenceBuilder getBuilder() {
        return builder;
    }
}
