package org.kdbear.engine.execution;

import org.kdbear.engine.config.KdbSettings;
import org.kdbear.engine.types.TypeRegistry;
import org.kdbear.engine.wire.KObject.KError;
import org.kdbear.engine.wire.QueryResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Explicit session value passed to every component: the executor plus the
 * registry, converter, shaper and settings used with it.
 *
 * A session is not thread-safe. At most one call may be in flight at a time;
 * concurrent callers serialize externally or use separate sessions.
 */
public final class KdbSession {

    private static final Logger log = LoggerFactory.getLogger(KdbSession.class);

    private final QueryExecutor executor;
    private final KdbSettings settings;
    private final TypeRegistry registry;
    private final ValueConverter converter;
    private final ResultShaper shaper;

    public KdbSession(QueryExecutor executor, KdbSettings settings, TypeRegistry registry,
            UnknownTypeListener unknownTypes) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.converter = new ValueConverter(registry);
        this.shaper = new ResultShaper(converter, unknownTypes);
    }

    /**
     * Session over {@code executor} with default settings and the standard registry.
     */
    public static KdbSession open(QueryExecutor executor) {
        return new KdbSession(executor, KdbSettings.defaults(), TypeRegistry.standard(),
                UnknownTypeListener.logging());
    }

    public KdbSettings settings() {
        return settings;
    }

    public TypeRegistry registry() {
        return registry;
    }

    public ValueConverter converter() {
        return converter;
    }

    public ResultShaper shaper() {
        return shaper;
    }

    // ==================== Execution ====================

    /**
     * Sends one query and returns the raw outcome. An {@link KError} payload is
     * turned into {@link ExecutionOutcome.Failed} and its response released.
     *
     * @throws ConnectionLostException if the executor lost its connection
     */
    public ExecutionOutcome execute(String query) {
        log.debug("[{}] q) {}", settings.sessionName(), query);
        ExecutionOutcome outcome = executor.execute(query);
        if (outcome instanceof ExecutionOutcome.Data data) {
            QueryResponse response = data.response();
            if (response.root() instanceof KError error) {
                response.close();
                return ExecutionOutcome.failed(error.message());
            }
        }
        return outcome;
    }

    /**
     * Runs a query that must produce a payload. The caller owns the returned
     * response.
     *
     * @throws QueryFailedException if the engine reports a failure or returns nothing
     */
    public QueryResponse query(String query) {
        ExecutionOutcome outcome = execute(query);
        if (outcome instanceof ExecutionOutcome.Data data) {
            return data.response();
        }
        if (outcome instanceof ExecutionOutcome.Failed failed) {
            throw new QueryFailedException(query, failed.message());
        }
        throw new QueryFailedException(query, "Query returned no data");
    }

    /**
     * Runs a query for its side effect. Any payload is released.
     *
     * @throws QueryFailedException if the engine reports a failure
     */
    public void run(String query) {
        ExecutionOutcome outcome = execute(query);
        if (outcome instanceof ExecutionOutcome.Failed failed) {
            throw new QueryFailedException(query, failed.message());
        }
        if (outcome instanceof ExecutionOutcome.Data data) {
            data.response().close();
        }
    }
}
