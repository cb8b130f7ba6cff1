package junie.email.intel.service;

public class InvalidPreferencesException extends RuntimeException {
    public InvalidPreferencesException(String message) {
        super(message);
    }
}
