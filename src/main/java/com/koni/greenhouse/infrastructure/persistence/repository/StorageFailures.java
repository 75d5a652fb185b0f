package com.koni.greenhouse.infrastructure.persistence.repository;

import com.koni.greenhouse.domain.exception.DatabaseUnavailableException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.function.Supplier;

/**
 * Translates Spring's connectivity failures into {@link DatabaseUnavailableException}.
 * Any other data access exception passes through unchanged.
 */
final class StorageFailures {

    private StorageFailures() {
    }

    static <T> T translate(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessResourceFailureException
                 | TransientDataAccessException
                 | RecoverableDataAccessException
                 | CannotCreateTransactionException e) {
            throw new DatabaseUnavailableException("Database unavailable during " + operation, e);
        }
    }
}
