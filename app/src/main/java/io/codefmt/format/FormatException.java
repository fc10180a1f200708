package io.codefmt.format;

/**
 * Runtime exception for failures reading, writing or staging a source file.
 */
public class FormatException extends RuntimeException {

    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
