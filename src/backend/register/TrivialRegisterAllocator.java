package backend.register;

import backend.mc.MCProgram;
import backend.register.RegisterAllocationException.Failure;

import java.util.List;

public class TrivialRegisterAllocator extends RegisterAllocator {
    public TrivialRegisterAllocator(MCProgram program, DeviceInfo devinfo) {
        super(program, devinfo);
    }

    @Override
    public AllocationResult allocate(boolean allowSpilling, boolean spillAll) {
        int count = program.getAlloc().count();
        int[] hwRegMapping = new int[count];
        int next = payloadUnits();
        for (int i = 0; i < count; ++i) {
            hwRegMapping[i] = next;
            next += devinfo.units(program.getAlloc().size(i));
        }
        if (next >= devinfo.getGrfCount()) {
            throw fail(Failure.OUT_OF_REGISTERS, "ran out of registers on the trivial allocator ("
                    + next + " of " + devinfo.getGrfCount() + ")");
        }
        return assignRegs(hwRegMapping, 0, List.of());
    }
}
