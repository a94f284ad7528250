package backend.register;

import backend.register.RegisterManager.RegisterClass;

import java.util.OptionalInt;

/**
 * Graph-coloring engine the allocation driver talks to. Nodes are numbered densely in creation order.
 */
public interface ColoringOracle {
    int addNode(RegisterClass cls);

    void addEdge(int n1, int n2);

    /**
     * Fixes node {@code n} at base offset {@code reg}. Pinned nodes are never simplified nor spilled.
     */
    void pinNode(int n, int reg);

    /**
     * A cost of zero (the default) or a non-finite cost makes the node unspillable.
     */
    void setSpillCost(int n, double cost);

    boolean allocate();

    OptionalInt bestSpillCandidate();

    /**
     * Base offset chosen for {@code n} by the last successful {@link #allocate()}, or -1.
     */
    int assignedRegister(int n);

    /**
     * Node the last failed {@link #allocate()} found no register for, or -1.
     */
    int failedNode();

    int nodeCount();

    boolean interferes(int n1, int n2);
}
