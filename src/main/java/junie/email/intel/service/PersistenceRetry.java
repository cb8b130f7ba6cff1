package junie.email.intel.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Bounded retry of idempotent writes that failed with a {@link DataAccessException}.
 */
@Slf4j
@Component
public class PersistenceRetry {
    static final int MAX_ATTEMPTS = 3;
    static final long BACKOFF_MS = 50;

    public <T> T execute(String operation, Supplier<T> write) {
        DataAccessException last = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                return write.get();
            } catch (DataAccessException e) {
                last = e;
                log.warn("{} failed (attempt {}/{}): {}", operation, attempt, MAX_ATTEMPTS, e.getMessage());
                if (attempt < MAX_ATTEMPTS) {
                    try {
                        Thread.sleep(BACKOFF_MS * attempt);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }
        log.error("{} failed after {} attempts", operation, MAX_ATTEMPTS, last);
        throw last;
    }
}
