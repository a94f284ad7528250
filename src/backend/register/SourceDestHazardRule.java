package backend.register;

import backend.mc.MCInstr;
import backend.mc.MCOperand.MCReg;

public class SourceDestHazardRule implements HazardRule {
    @Override
    public boolean isEnabled(DeviceInfo devinfo) {
        return true;
    }

    @Override
    public void apply(MCInstr instr, InterferenceBuilder builder) {
        if (!instr.writesVirtual() || !instr.hasSourceAndDestinationHazard()) {
            return;
        }
        int dst = ((MCReg) instr.getDst()).getNr();
        for (int i = 0; i < instr.getSourceCount(); ++i) {
            if (instr.readsVirtual(i)) {
                builder.addVgrfInterference(dst, ((MCReg) instr.getSrc(i)).getNr());
            }
        }
    }
}
