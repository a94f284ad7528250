package backend.register;

import backend.mc.MCInstr;
import backend.mc.MCOperand.MCReg;

public class SendOverlapErratumRule implements HazardRule {
    @Override
    public boolean isEnabled(DeviceInfo devinfo) {
        return devinfo.hasSendOverlapErratum();
    }

    @Override
    public void apply(MCInstr instr, InterferenceBuilder builder) {
        if (instr.getExecSize() < 16 && instr.isSendFromGrf() && instr.writesVirtual()) {
            builder.addErratumInterference(((MCReg) instr.getDst()).getNr());
        }
    }
}
