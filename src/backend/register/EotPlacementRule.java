package backend.register;

import backend.mc.MCInstr;
import backend.mc.MCOperand.MCReg;

public class EotPlacementRule implements HazardRule {
    @Override
    public boolean isEnabled(DeviceInfo devinfo) {
        return devinfo.hasEotHighRegisters();
    }

    @Override
    public void apply(MCInstr instr, InterferenceBuilder builder) {
        if (!instr.isEot()) {
            return;
        }
        int payloadSrc = instr.getTag().isSend() ? 2 : 0;
        if (instr.getSourceCount() <= payloadSrc || !instr.readsVirtual(payloadSrc)) {
            return;
        }
        DeviceInfo devinfo = builder.getDevinfo();
        int vgrf = ((MCReg) instr.getSrc(payloadSrc)).getNr();
        int reg = devinfo.getGrfCount() - builder.sizeInUnits(vgrf);
        if (builder.hasErratumNode()) {
            reg--;
        }
        builder.pinVgrf(vgrf, checkPlacement(builder, reg, instr));

        if (instr.getTag().isSend() && instr.getExMlen() > 0 && instr.readsVirtual(3)) {
            int vgrf2 = ((MCReg) instr.getSrc(3)).getNr();
            reg -= builder.sizeInUnits(vgrf2);
            builder.pinVgrf(vgrf2, checkPlacement(builder, reg, instr));
        }
    }

    private static int checkPlacement(InterferenceBuilder builder, int reg, MCInstr instr) {
        if (reg < builder.getPayloadNodeCount()) {
            throw new IllegalStateException("terminator payload of " + instr.toString().strip()
                    + " would sit at " + reg + ", inside the thread payload");
        }
        return reg;
    }
}
