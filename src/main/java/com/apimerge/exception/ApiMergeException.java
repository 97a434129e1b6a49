package com.apimerge.exception;

/**
 * A runtime exception for failures that abort a merge run or a single retrieval.
 * <p>
 * Per-source problems that the merge can absorb (an invalid document, a key collision)
 * are reported as diagnostics instead; this exception is reserved for conditions the
 * caller has to handle, such as an undecodable payload or an unwritable output file.
 */
public class ApiMergeException extends RuntimeException {

    /**
     * Constructs a new ApiMergeException with the specified detail message.
     *
     * @param message The detail message.
     */
    public ApiMergeException(String message) {
        super(message);
    }

    /**
     * Constructs a new ApiMergeException with the specified detail message and cause.
     *
     * @param message The detail message.
     * @param cause   The underlying cause, or {@code null} if unknown.
     */
    public ApiMergeException(String message, Throwable cause) {
        super(message, cause);
    }
}
