package domain.design;

/** A design script command could not be applied. Carries the failing row. */
public class DesignReplayException extends RuntimeException {

    private final DesignCommand command;

    public DesignReplayException(DesignCommand command, Throwable cause) {
        super("line " + command.getLineNo() + " [" + command.getName() + "]: " + cause.getMessage(), cause);
        this.command = command;
    }

    public DesignReplayException(DesignCommand command, String message) {
        super("line " + command.getLineNo() + " [" + command.getName() + "]: " + message);
        this.command = command;
    }

    public DesignCommand getCommand() {
        return command;
    }
}
