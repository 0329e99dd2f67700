package org.kdbear.engine.execution;

import org.kdbear.engine.wire.QueryResponse;

import java.util.Objects;

/**
 * Result of one executor call: no payload, a payload, or an engine failure.
 */
public sealed interface ExecutionOutcome
        permits ExecutionOutcome.Completed, ExecutionOutcome.Data, ExecutionOutcome.Failed {

    static ExecutionOutcome completed() {
        return Completed.INSTANCE;
    }

    static ExecutionOutcome data(QueryResponse response) {
        return new Data(response);
    }

    static ExecutionOutcome failed(String message) {
        return new Failed(message);
    }

    /**
     * Success without a payload, e.g. an assignment.
     */
    record Completed() implements ExecutionOutcome {
        static final Completed INSTANCE = new Completed();
    }

    /**
     * Success with a payload. The receiver owns the response and must close it.
     */
    record Data(QueryResponse response) implements ExecutionOutcome {
        public Data {
            Objects.requireNonNull(response, "response");
        }
    }

    /**
     * The engine rejected the query.
     */
    record Failed(String message) implements ExecutionOutcome {
        public Failed {
            Objects.requireNonNull(message, "message");
        }
    }
}
