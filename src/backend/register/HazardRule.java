package backend.register;

import backend.mc.MCInstr;

public interface HazardRule {
    boolean isEnabled(DeviceInfo devinfo);

    void apply(MCInstr instr, InterferenceBuilder builder);
}
