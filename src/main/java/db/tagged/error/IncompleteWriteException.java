package db.tagged.error;

import java.io.IOException;

/**
 * An export stream was closed or abandoned before its closing structural token was written.
 * The partial output must be treated as invalid.
 */
public class IncompleteWriteException extends IOException {
    private final int rowsWritten;

    public IncompleteWriteException(String message, int rowsWritten, Throwable cause) {
        super(message, cause);
        this.rowsWritten = rowsWritten;
    }

    public int rowsWritten() { return rowsWritten; }
}
