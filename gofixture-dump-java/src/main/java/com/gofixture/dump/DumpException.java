package com.gofixture.dump;

/**
 * Raised when a literal cannot be written to its sink. The only failure that aborts a dump;
 * unreadable values degrade to markers in the output instead.
 */
public class DumpException extends RuntimeException {

    public DumpException(String message, Throwable cause) {
        super(message, cause);
    }
}
