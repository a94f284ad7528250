package backend.register;

public final class DeviceInfo {
    private final String name;
    private final int grfCount;
    private final int regUnit;
    private final boolean hasLsc;
    private final int maxClassSize;
    private final boolean sendOverlapErratum;
    private final int erratumReg;
    private final boolean compressedWriteHazard;
    private final boolean sendPayloadOverlap;
    private final boolean eotHighRegisters;

    private DeviceInfo(String name, int grfCount, int regUnit, boolean hasLsc, int maxClassSize,
                       boolean sendOverlapErratum, int erratumReg, boolean compressedWriteHazard,
                       boolean sendPayloadOverlap, boolean eotHighRegisters) {
        if (grfCount <= 0) {
            throw new IllegalArgumentException("register file must not be empty");
        }
        if (regUnit != 1 && regUnit != 2) {
            throw new IllegalArgumentException("unsupported register unit " + regUnit);
        }
        if (sendOverlapErratum && (erratumReg < 0 || erratumReg >= grfCount)) {
            throw new IllegalArgumentException("erratum register " + erratumReg + " outside the file");
        }
        this.name = name;
        this.grfCount = grfCount;
        this.regUnit = regUnit;
        this.hasLsc = hasLsc;
        this.maxClassSize = maxClassSize;
        this.sendOverlapErratum = sendOverlapErratum;
        this.erratumReg = erratumReg;
        this.compressedWriteHazard = compressedWriteHazard;
        this.sendPayloadOverlap = sendPayloadOverlap;
        this.eotHighRegisters = eotHighRegisters;
    }

    public static DeviceInfo gen9() {
        return new DeviceInfo("gen9", 128, 1, false, 20, true, 127, true, true, true);
    }

    public static DeviceInfo xeHpg() {
        return new DeviceInfo("xe-hpg", 128, 1, true, 20, true, 127, true, true, true);
    }

    public static DeviceInfo xe2() {
        return new DeviceInfo("xe2", 128, 2, true, 20, true, 127, true, true, true);
    }

    public DeviceInfo withGrfCount(int grfCount) {
        int erratum = sendOverlapErratum ? grfCount - 1 : erratumReg;
        return new DeviceInfo(name, grfCount, regUnit, hasLsc, Math.min(maxClassSize, grfCount),
                sendOverlapErratum, erratum, compressedWriteHazard, sendPayloadOverlap, eotHighRegisters);
    }

    public DeviceInfo withSendOverlapErratum(boolean enabled) {
        return new DeviceInfo(name, grfCount, regUnit, hasLsc, maxClassSize, enabled,
                enabled ? grfCount - 1 : -1, compressedWriteHazard, sendPayloadOverlap, eotHighRegisters);
    }

    public DeviceInfo withCompressedWriteHazard(boolean enabled) {
        return new DeviceInfo(name, grfCount, regUnit, hasLsc, maxClassSize, sendOverlapErratum,
                erratumReg, enabled, sendPayloadOverlap, eotHighRegisters);
    }

    public DeviceInfo withSendPayloadOverlap(boolean enabled) {
        return new DeviceInfo(name, grfCount, regUnit, hasLsc, maxClassSize, sendOverlapErratum,
                erratumReg, compressedWriteHazard, enabled, eotHighRegisters);
    }

    public DeviceInfo withEotHighRegisters(boolean enabled) {
        return new DeviceInfo(name, grfCount, regUnit, hasLsc, maxClassSize, sendOverlapErratum,
                erratumReg, compressedWriteHazard, sendPayloadOverlap, enabled);
    }

    public String getName() {
        return name;
    }

    /**
     * Capacity of the register file in allocation units.
     */
    public int getGrfCount() {
        return grfCount;
    }

    public int getRegUnit() {
        return regUnit;
    }

    public boolean hasLsc() {
        return hasLsc;
    }

    public int getMaxClassSize() {
        return maxClassSize;
    }

    public boolean hasSendOverlapErratum() {
        return sendOverlapErratum;
    }

    public int getErratumReg() {
        return erratumReg;
    }

    public boolean hasCompressedWriteHazard() {
        return compressedWriteHazard;
    }

    public boolean hasSendPayloadOverlap() {
        return sendPayloadOverlap;
    }

    public boolean hasEotHighRegisters() {
        return eotHighRegisters;
    }

    public int units(int regs) {
        return (regs + regUnit - 1) / regUnit;
    }

    @Override
    public String toString() {
        return name + "(" + grfCount + "x" + regUnit + ")";
    }
}
