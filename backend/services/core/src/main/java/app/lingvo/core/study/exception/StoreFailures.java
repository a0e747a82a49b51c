package app.lingvo.core.study.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.function.Supplier;

/**
 * Translates infrastructure failures of the backing store into {@link StoreUnavailableException}.
 * Nothing is retried here: a silently repeated write could score a word twice.
 */
public final class StoreFailures {

    private static final Logger log = LoggerFactory.getLogger(StoreFailures.class);

    private StoreFailures() {
    }

    public static <T> T guard(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException ex) {
            if (isTransient(ex)) {
                throw unavailable(operation, ex);
            }
            throw ex;
        }
    }

    public static void guard(String operation, Runnable call) {
        guard(operation, () -> {
            call.run();
            return null;
        });
    }

    public static boolean isTransient(Throwable ex) {
        return ex instanceof DataAccessResourceFailureException
                || ex instanceof TransientDataAccessException
                || ex instanceof RecoverableDataAccessException
                || ex instanceof CannotCreateTransactionException;
    }

    public static StoreUnavailableException unavailable(String operation, Throwable cause) {
        log.warn("Store unavailable during {}: {}", operation, cause.getMessage());
        return new StoreUnavailableException("Store unavailable during " + operation, cause);
    }
}
