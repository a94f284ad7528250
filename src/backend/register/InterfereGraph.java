package backend.register;

import backend.register.RegisterManager.RegisterClass;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.OptionalInt;
import java.util.TreeSet;

public class InterfereGraph implements ColoringOracle {
    private static final int NO_REG = -1;
    private final ArrayList<RegisterClass> classes = new ArrayList<>();
    private final ArrayList<TreeSet<Integer>> edge = new ArrayList<>();
    private final ArrayList<Integer> pinned = new ArrayList<>();
    private final ArrayList<Double> spillCost = new ArrayList<>();
    private final Deque<Integer> selectedStack = new ArrayDeque<>();
    private int[] color = new int[0];
    private int failedNode = NO_REG;

    @Override
    public int addNode(RegisterClass cls) {
        classes.add(cls);
        edge.add(new TreeSet<>());
        pinned.add(NO_REG);
        spillCost.add(0.0);
        return classes.size() - 1;
    }

    @Override
    public void addEdge(int n1, int n2) {
        checkNode(n1);
        checkNode(n2);
        if (n1 == n2) {
            return;
        }
        edge.get(n1).add(n2);
        edge.get(n2).add(n1);
    }

    @Override
    public void pinNode(int n, int reg) {
        checkNode(n);
        if (!classes.get(n).contains(reg)) {
            throw new IllegalArgumentException("node " + n + " of " + classes.get(n) + " cannot sit at " + reg);
        }
        pinned.set(n, reg);
    }

    @Override
    public void setSpillCost(int n, double cost) {
        checkNode(n);
        spillCost.set(n, cost);
    }

    public boolean isPinned(int n) {
        return pinned.get(n) != NO_REG;
    }

    public int getDegree(int n) {
        return edge.get(n).size();
    }

    @Override
    public boolean interferes(int n1, int n2) {
        return edge.get(n1).contains(n2);
    }

    @Override
    public int nodeCount() {
        return classes.size();
    }

    private void checkNode(int n) {
        if (n < 0 || n >= classes.size()) {
            throw new IllegalArgumentException("no node " + n + " in a graph of " + classes.size());
        }
    }

    private int conflicts(int n, int neighbour) {
        return classes.get(n).conflicts(classes.get(neighbour));
    }

    private boolean isSpillable(int n) {
        double cost = spillCost.get(n);
        return !isPinned(n) && cost > 0 && Double.isFinite(cost);
    }

    @Override
    public boolean allocate() {
        int count = nodeCount();
        boolean[] removed = new boolean[count];
        int[] qTotal = new int[count];
        int remaining = 0;
        selectedStack.clear();
        failedNode = NO_REG;
        for (int n = 0; n < count; ++n) {
            if (isPinned(n)) {
                removed[n] = true;
                continue;
            }
            ++remaining;
            for (int m : edge.get(n)) {
                qTotal[n] += conflicts(n, m);
            }
        }
        while (remaining > 0) {
            int pick = -1;
            for (int n = 0; n < count; ++n) {
                if (!removed[n] && qTotal[n] < classes.get(n).getRegCount()) {
                    pick = n;
                    break;
                }
            }
            if (pick < 0) {
                pick = optimisticPick(removed, qTotal);
            }
            removed[pick] = true;
            --remaining;
            selectedStack.push(pick);
            for (int m : edge.get(pick)) {
                if (!removed[m]) {
                    qTotal[m] -= conflicts(m, pick);
                }
            }
        }
        return select();
    }

    // lowest spill cost per blocked offset goes first, so it is colored last
    private int optimisticPick(boolean[] removed, int[] qTotal) {
        int pick = -1;
        double best = Double.POSITIVE_INFINITY;
        for (int n = 0; n < removed.length; ++n) {
            if (removed[n]) {
                continue;
            }
            double cost = isSpillable(n) ? spillCost.get(n) : Double.MAX_VALUE;
            double ratio = cost / Math.max(1, qTotal[n]);
            if (pick < 0 || ratio < best) {
                pick = n;
                best = ratio;
            }
        }
        return pick;
    }

    private boolean select() {
        color = new int[nodeCount()];
        Arrays.fill(color, NO_REG);
        for (int n = 0; n < color.length; ++n) {
            color[n] = pinned.get(n);
        }
        while (!selectedStack.isEmpty()) {
            int n = selectedStack.pop();
            int reg = lowestFreeRegister(n);
            if (reg == NO_REG) {
                failedNode = n;
                selectedStack.clear();
                Arrays.fill(color, NO_REG);
                return false;
            }
            color[n] = reg;
        }
        return true;
    }

    private int lowestFreeRegister(int n) {
        RegisterClass cls = classes.get(n);
        boolean[] used = new boolean[cls.getCapacity()];
        for (int m : edge.get(n)) {
            if (color[m] == NO_REG) {
                continue;
            }
            int end = Math.min(used.length, color[m] + classes.get(m).getSize());
            for (int r = color[m]; r < end; ++r) {
                used[r] = true;
            }
        }
        for (int reg = 0; reg < cls.getRegCount(); ++reg) {
            boolean ok = true;
            for (int r = reg; r < reg + cls.getSize(); ++r) {
                if (used[r]) {
                    ok = false;
                    break;
                }
            }
            if (ok) {
                return reg;
            }
        }
        return NO_REG;
    }

    @Override
    public OptionalInt bestSpillCandidate() {
        int best = -1;
        double bestBenefit = 0.0;
        for (int n = 0; n < nodeCount(); ++n) {
            if (!isSpillable(n)) {
                continue;
            }
            double benefit = 1.0;
            for (int m : edge.get(n)) {
                benefit += (double) conflicts(n, m) / classes.get(n).getRegCount();
            }
            benefit /= spillCost.get(n);
            if (benefit > bestBenefit) {
                bestBenefit = benefit;
                best = n;
            }
        }
        return best < 0 ? OptionalInt.empty() : OptionalInt.of(best);
    }

    @Override
    public int failedNode() {
        return failedNode;
    }

    @Override
    public int assignedRegister(int n) {
        checkNode(n);
        return n < color.length ? color[n] : NO_REG;
    }
}
