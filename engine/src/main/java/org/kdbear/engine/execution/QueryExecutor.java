package org.kdbear.engine.execution;

/**
 * Sends q text to the engine over an established connection.
 *
 * Implementations own the connection, timeouts and cancellation. They report
 * engine-side errors as {@link ExecutionOutcome.Failed} and throw
 * {@link ConnectionLostException} when the connection is gone. Calls are never
 * retried by this library.
 */
@FunctionalInterface
public interface QueryExecutor {

    ExecutionOutcome execute(String query);
}
