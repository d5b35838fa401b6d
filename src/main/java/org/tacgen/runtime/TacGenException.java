package org.tacgen.runtime;

import java.io.Serial;

/**
 * TacGenException is raised at the boundary of the generator: for blank input and for
 * sources that cannot be read. The analyzer and the code generator themselves never throw;
 * malformed lines are dropped there instead.
 */
public class TacGenException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    // Name of the source the error refers to, or null
    private final String fileName;

    public TacGenException(String message) {
        this(message, null, null);
    }

    public TacGenException(String message, String fileName, Throwable cause) {
        super(message, cause);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * Returns the message prefixed with the source name when one is known.
     *
     * @return the detailed error message
     */
    public String getDetailedMessage() {
        return fileName == null ? getMessage() : fileName + ": " + getMessage();
    }
}
