package utils;

import backend.mc.MCProgram;
import backend.register.AllocationResult;
import backend.register.RegisterAllocationException.Failure;

public class Logger {

    public static void logSpill(MCProgram program, int vgrf, int size) {
        if (Config.logRegisterAllocation) {
            System.err.println(program + ": spilling vgrf" + vgrf + " (" + size + " regs) at scratch offset "
                    + program.getLastScratch());
        }
    }

    public static void logSpillRound(MCProgram program, int round, int spilled) {
        if (Config.logRegisterAllocation) {
            System.err.println(program + ": spill round " + round + ", " + spilled + " registers spilled");
        }
    }

    public static void logAllocation(MCProgram program, AllocationResult result) {
        if (Config.logRegisterAllocation) {
            System.err.println(program + ": " + result);
        }
    }

    public static void logAllocationFailure(MCProgram program, Failure failure, String message) {
        if (Config.logRegisterAllocation) {
            System.err.println(program + ": register allocation failed (" + failure + "): " + message);
            printProgram(program);
        }
    }

    public static void printProgram(MCProgram program) {
        System.err.print(program.dump());
    }
}
