package difftree;

/**
 * Diff output that couldn't be understood. Fails the whole batch it was found in.
 */
public class DiffParseException extends RuntimeException {

    private final String input;

    public DiffParseException(String message, String input) {
        super(message + ": `" + input + "`");
        this.input = input;
    }

    public DiffParseException(String message, String input, Throwable cause) {
        super(message + ": `" + input + "`", cause);
        this.input = input;
    }

    /**
     * The offending line, record or size literal.
     */
    public String getInput() {
        return input;
    }
}
