package utils;

import backend.register.RegisterAllocator.RegisterAllocatorChoice;
import backend.register.SpillScheme.SpillSchemeChoice;

public class Config {
    public static final RegisterAllocatorChoice registerAllocatorChoice = RegisterAllocatorChoice.graphColor;
    public static final SpillSchemeChoice spillChoice = SpillSchemeChoice.Rate;
    public static final int spillingRate = 11;
    public static final boolean debugSpillAll = false;
    public static final boolean dumpInstructionsOnFailure = true;
    public static final boolean logRegisterAllocation = false;
}
