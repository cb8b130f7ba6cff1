package junie.email.intel.service;

/**
 * Raised at the ingestion boundary; a rejected record is never scored.
 */
public class InvalidEmailRecordException extends RuntimeException {
    public InvalidEmailRecordException(String message) {
        super(message);
    }
}
