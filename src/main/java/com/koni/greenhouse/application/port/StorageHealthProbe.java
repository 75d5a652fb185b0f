package com.koni.greenhouse.application.port;

/**
 * Port interface for checking that the database answers queries.
 */
public interface StorageHealthProbe {

    /**
     * Executes a trivial round-trip query.
     *
     * @throws com.koni.greenhouse.domain.exception.DatabaseUnavailableException if the query fails
     */
    void ping();
}
