// Thrown by GraphReader on a malformed graph file.

package edgecon;

import java.io.IOException;

public class GraphFormatException extends IOException {
    private static final long serialVersionUID = 1L;

    private final int lineNumber;

    public GraphFormatException(int lineNumber, String message) {
        super("line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public GraphFormatException(int lineNumber, String message, Throwable cause) {
        super("line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
