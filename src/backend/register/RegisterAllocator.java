package backend.register;

import backend.mc.MCInstr;
import backend.mc.MCOperand;
import backend.mc.MCOperand.MCVirtualReg;
import backend.mc.MCProgram;
import backend.register.RegisterAllocationException.Failure;
import utils.Config;
import utils.Logger;

import java.util.List;

import static backend.mc.MCOperand.REG_SIZE;

public abstract class RegisterAllocator {
    protected final MCProgram program;
    protected final DeviceInfo devinfo;

    protected RegisterAllocator(MCProgram program, DeviceInfo devinfo) {
        this.program = program;
        this.devinfo = devinfo;
    }

    public static RegisterAllocator create(MCProgram program, DeviceInfo devinfo) {
        return create(Config.registerAllocatorChoice, program, devinfo);
    }

    public static RegisterAllocator create(RegisterAllocatorChoice choice, MCProgram program, DeviceInfo devinfo) {
        switch (choice) {
            case trivial:
                return new TrivialRegisterAllocator(program, devinfo);
            case graphColor:
                return new GraphColorRegisterAllocator(program, devinfo);
            default:
                throw new IllegalArgumentException("unknown register allocator " + choice);
        }
    }

    /**
     * Rewrites every vgrf operand of the program to a fixed register.
     *
     * @throws RegisterAllocationException when the program cannot be allocated
     */
    public abstract AllocationResult allocate(boolean allowSpilling, boolean spillAll);

    public AllocationResult allocate() {
        return allocate(true, Config.debugSpillAll);
    }

    protected int payloadUnits() {
        return MCInstr.divRoundUp(program.getFirstNonPayloadGrf(), devinfo.getRegUnit());
    }

    protected AllocationResult assignRegs(int[] hwRegMapping, int spillRounds, List<Integer> spilled) {
        int grfUsed = payloadUnits();
        for (int i = 0; i < hwRegMapping.length; ++i) {
            if (hwRegMapping[i] == AllocationResult.SPILLED) {
                continue;
            }
            grfUsed = Math.max(grfUsed, hwRegMapping[i] + devinfo.units(program.getAlloc().size(i)));
        }
        for (MCInstr instr : program.instructions()) {
            instr.setDst(assignReg(hwRegMapping, instr.getDst()));
            for (int i = 0; i < instr.getSourceCount(); ++i) {
                instr.setSrc(i, assignReg(hwRegMapping, instr.getSrc(i)));
            }
        }
        if (program.hasVirtualOperands()) {
            throw new IllegalStateException("vgrf operands left in " + program + " after allocation");
        }
        program.setGrfUsed(grfUsed);
        AllocationResult result = new AllocationResult(hwRegMapping, grfUsed, program.getLastScratch(),
                program.getStats().getSpillCount(), program.getStats().getFillCount(), spillRounds, spilled);
        Logger.logAllocation(program, result);
        return result;
    }

    private MCOperand assignReg(int[] hwRegMapping, MCOperand operand) {
        if (!operand.isVirtual()) {
            return operand;
        }
        MCVirtualReg reg = (MCVirtualReg) operand;
        int unit = hwRegMapping[reg.getNr()];
        if (unit == AllocationResult.SPILLED) {
            throw new IllegalStateException(reg + " was spilled but is still referenced");
        }
        int hwNr = devinfo.getRegUnit() * unit + reg.getOffset() / REG_SIZE;
        return reg.withOffset(reg.getOffset() % REG_SIZE).toFixed(hwNr);
    }

    protected RegisterAllocationException fail(Failure failure, String message) {
        Logger.logAllocationFailure(program, failure, message);
        String dump = Config.dumpInstructionsOnFailure ? program.dump() : null;
        return new RegisterAllocationException(failure, program.getName(), message, dump);
    }

    public enum RegisterAllocatorChoice {
        trivial, graphColor,
    }
}
