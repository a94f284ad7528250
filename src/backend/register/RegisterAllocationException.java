package backend.register;

public class RegisterAllocationException extends RuntimeException {
    public enum Failure {
        SPILLING_DISALLOWED,
        NO_SPILL_CANDIDATE,
        OUT_OF_REGISTERS,
    }

    private final Failure failure;
    private final String programName;
    private final String dump;

    public RegisterAllocationException(Failure failure, String programName, String message, String dump) {
        super(programName + ": " + message);
        this.failure = failure;
        this.programName = programName;
        this.dump = dump;
    }

    public Failure getFailure() {
        return failure;
    }

    public String getProgramName() {
        return programName;
    }

    /**
     * Instruction listing at the point of failure, or null when dumping is turned off.
     */
    public String getDump() {
        return dump;
    }
}
