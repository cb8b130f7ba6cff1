package junie.email.intel.service;

/**
 * Digest generation stopped before anything was written.
 */
public class DigestCancelledException extends RuntimeException {
    public DigestCancelledException(String message) {
        super(message);
    }

    public DigestCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
