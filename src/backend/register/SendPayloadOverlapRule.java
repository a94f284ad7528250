package backend.register;

import backend.mc.MCInstr;
import backend.mc.MCOperand.MCReg;

public class SendPayloadOverlapRule implements HazardRule {
    @Override
    public boolean isEnabled(DeviceInfo devinfo) {
        return devinfo.hasSendPayloadOverlap();
    }

    @Override
    public void apply(MCInstr instr, InterferenceBuilder builder) {
        if (!instr.getTag().isSend() || instr.getExMlen() <= 0) {
            return;
        }
        if (!instr.readsVirtual(2) || !instr.readsVirtual(3)) {
            return;
        }
        int payload = ((MCReg) instr.getSrc(2)).getNr();
        int payload2 = ((MCReg) instr.getSrc(3)).getNr();
        if (payload != payload2) {
            builder.addVgrfInterference(payload, payload2);
        }
    }
}
