package backend.register;

import backend.mc.MCInstr;
import backend.mc.MCOperand;
import backend.mc.MCOperand.MCReg;

public class CompressedWriteHazardRule implements HazardRule {
    @Override
    public boolean isEnabled(DeviceInfo devinfo) {
        return devinfo.hasCompressedWriteHazard();
    }

    @Override
    public void apply(MCInstr instr, InterferenceBuilder builder) {
        if (!instr.writesVirtual()) {
            return;
        }
        MCReg dst = (MCReg) instr.getDst();
        if (dst.componentSize(instr.getExecSize()) <= MCOperand.REG_SIZE) {
            return;
        }
        for (int i = 0; i < instr.getSourceCount(); ++i) {
            if (instr.readsVirtual(i)) {
                builder.addVgrfInterference(dst.getNr(), ((MCReg) instr.getSrc(i)).getNr());
            }
        }
    }
}
