package org.kdbear.engine.execution;

import org.kdbear.engine.KdbException;

/**
 * Thrown when the engine reports an error for a query, or answers with an
 * unexpected outcome.
 */
public class QueryFailedException extends KdbException {

    private final String query;

    public QueryFailedException(String query, String message) {
        super(message + " [query: " + query + "]");
        this.query = query;
    }

    public String getQuery() {
        return query;
    }
}
