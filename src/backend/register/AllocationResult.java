package backend.register;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class AllocationResult {
    public static final int SPILLED = -1;
    private final int[] hwRegMapping;
    private final int grfUsed;
    private final int scratchBytes;
    private final int spillCount;
    private final int fillCount;
    private final int spillRounds;
    private final List<Integer> spilledRegisters;

    public AllocationResult(int[] hwRegMapping, int grfUsed, int scratchBytes, int spillCount, int fillCount,
                            int spillRounds, List<Integer> spilledRegisters) {
        this.hwRegMapping = hwRegMapping.clone();
        this.grfUsed = grfUsed;
        this.scratchBytes = scratchBytes;
        this.spillCount = spillCount;
        this.fillCount = fillCount;
        this.spillRounds = spillRounds;
        this.spilledRegisters = Collections.unmodifiableList(spilledRegisters);
    }

    /**
     * Base allocation unit of {@code vgrf}, or {@link #SPILLED}.
     */
    public int getRegister(int vgrf) {
        return hwRegMapping[vgrf];
    }

    public boolean isSpilled(int vgrf) {
        return hwRegMapping[vgrf] == SPILLED;
    }

    public int getVgrfCount() {
        return hwRegMapping.length;
    }

    public int getGrfUsed() {
        return grfUsed;
    }

    public int getScratchBytes() {
        return scratchBytes;
    }

    public int getSpillCount() {
        return spillCount;
    }

    public int getFillCount() {
        return fillCount;
    }

    public int getSpillRounds() {
        return spillRounds;
    }

    public List<Integer> getSpilledRegisters() {
        return spilledRegisters;
    }

    @Override
    public String toString() {
        return "AllocationResult{grfUsed=" + grfUsed + ", scratch=" + scratchBytes + ", spills=" + spillCount
                + ", fills=" + fillCount + ", rounds=" + spillRounds + ", map=" + Arrays.toString(hwRegMapping) + "}";
    }
}
