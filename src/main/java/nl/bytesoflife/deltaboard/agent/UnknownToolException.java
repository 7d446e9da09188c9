package nl.bytesoflife.deltaboard.agent;

/**
 * Thrown when the agent calls a tool that does not exist. Aborts that call only.
 */
public class UnknownToolException extends RuntimeException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Unsupported tool: " + toolName);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
