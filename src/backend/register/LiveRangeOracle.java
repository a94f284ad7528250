package backend.register;

import backend.mc.MCProgram;

public interface LiveRangeOracle {
    /**
     * Per-vgrf live ranges over instruction ips. The end of a range is the ip of its last read.
     */
    LiveRanges computeLiveRanges(MCProgram program);
}
