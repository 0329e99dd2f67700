package org.kdbear.engine.join;

import org.kdbear.engine.config.KdbSettings;
import org.kdbear.engine.execution.ExecutionOutcome;
import org.kdbear.engine.execution.KdbSession;
import org.kdbear.engine.execution.QueryFailedException;
import org.kdbear.engine.execution.Value;
import org.kdbear.engine.types.QLiterals;
import org.kdbear.engine.wire.KObject;
import org.kdbear.engine.wire.KObject.KDict;
import org.kdbear.engine.wire.KObject.KTable;
import org.kdbear.engine.wire.KObject.KVector;
import org.kdbear.engine.wire.KType;
import org.kdbear.engine.wire.QueryResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Runs joins on the engine.
 *
 * Every join follows the same steps: stage an unkeyed copy of each input,
 * assign the joined table to the result name, fetch it, and remove whatever was
 * staged. Removal happens on every path, including failures. Staged names
 * never collide with the inputs, the result or any existing global. The fetched table
 * is returned as an owning {@link QueryResponse}; the result global itself is
 * left on the engine.
 */
public final class JoinOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(JoinOrchestrator.class);

    private final KdbSession session;
    private final KdbSettings settings;

    public JoinOrchestrator(KdbSession session) {
        this.session = Objects.requireNonNull(session, "session");
        this.settings = session.settings();
    }

    /**
     * Plan of the join-specific part: may stage more globals, returns the join
     * expression assigned to the result.
     */
    @FunctionalInterface
    private interface JoinPlan {
        String build(StagingArea staging, String left, String right);
    }

    // ==================== Keyed joins ====================

    /**
     * Rows of {@code left} with a match in {@code right}. An empty column list
     * joins on the first column the tables share.
     */
    public QueryResponse innerJoin(String left, String right, String result, List<String> joinColumns) {
        return keyedJoin(JoinKind.INNER, "ij", left, right, result, joinColumns);
    }

    /**
     * All rows of {@code left}, with matching columns of {@code right} or nulls.
     */
    public QueryResponse leftJoin(String left, String right, String result, List<String> joinColumns) {
        return keyedJoin(JoinKind.LEFT, "lj", left, right, result, joinColumns);
    }

    /**
     * All rows of {@code right}, with matching columns of {@code left} or nulls.
     */
    public QueryResponse rightJoin(String left, String right, String result, List<String> joinColumns) {
        return keyedJoin(JoinKind.RIGHT, "lj", left, right, result, joinColumns);
    }

    private QueryResponse keyedJoin(JoinKind kind, String operator, String left, String right, String result,
            List<String> joinColumns) {
        checkNames(kind, joinColumns);
        return orchestrate(kind, left, right, result, (staging, l, r) -> {
            String key = joinColumns.isEmpty()
                    ? "(enlist first cols[" + l + "] inter cols[" + r + "])"
                    : QLiterals.symbols(joinColumns);
            return kind == JoinKind.RIGHT
                    ? r + " " + operator + " " + key + " xkey " + l
                    : l + " " + operator + " " + key + " xkey " + r;
        });
    }

    // ==================== Temporal joins ====================

    /**
     * Matches each left row with the last right row at or before its time,
     * optionally within equal {@code joinColumns}. The result has exactly one
     * row per left row.
     */
    public QueryResponse asofJoin(String left, String right, String result, String leftTime, String rightTime,
            List<String> joinColumns) {
        JoinKind kind = JoinKind.ASOF;
        checkNames(kind, joinColumns);
        checkNames(kind, List.of(leftTime, rightTime));
        return orchestrate(kind, left, right, result, (staging, l, r) -> {
            String copies = rightTime + "2:" + rightTime;
            if (!leftTime.equals(rightTime)) {
                copies += ", " + leftTime + ":" + rightTime;
            }
            String adjusted = staging.stage(r + "_" + settings.asofSuffix(), "update " + copies + " from " + r);
            List<String> keys = new ArrayList<>(joinColumns);
            keys.add(leftTime);
            return "aj[" + QLiterals.symbols(keys) + ";" + l + ";" + adjusted + "]";
        });
    }

    /**
     * Aggregates, for each left row, the right rows with equal {@code joinColumns}
     * whose time lies within {@code window} either side of the left time. Each
     * remaining right column is aggregated with {@code last}. When the time
     * columns are named differently the right time is copied under the left
     * name in a staged right table.
     *
     * @throws JoinFailureException if {@code joinColumns} is empty; nothing is staged then
     */
    public QueryResponse windowJoin(String left, String right, String result, String leftTime, String rightTime,
            Duration window, List<String> joinColumns) {
        JoinKind kind = JoinKind.WINDOW;
        if (joinColumns.isEmpty()) {
            throw new JoinFailureException(kind, JoinFailureException.Stage.VALIDATE,
                    "window joins need at least one join column");
        }
        if (window.isNegative()) {
            throw new JoinFailureException(kind, JoinFailureException.Stage.VALIDATE,
                    "window must not be negative: " + window);
        }
        checkNames(kind, joinColumns);
        checkNames(kind, List.of(leftTime, rightTime));
        return orchestrate(kind, left, right, result, (staging, l, r) -> {
            String width = session.registry().toLiteral(Value.ofTime(Math.toIntExact(window.toMillis())));
            String intervals = staging.stage(l + "_" + settings.windowSuffix(),
                    "(-" + width + " " + width + ") +\\: " + l + "`" + leftTime);

            List<String> excluded = new ArrayList<>();
            excluded.add(rightTime);
            String keyed = r;
            if (!leftTime.equals(rightTime)) {
                excluded.add(leftTime);
                keyed = staging.stage(r + "_" + settings.asofSuffix(),
                        "update " + leftTime + ":" + rightTime + " from " + r);
            }
            excluded.addAll(joinColumns);
            List<String> aggregated = remainingColumns(kind, r, excluded);

            StringJoiner keys = new StringJoiner(",");
            for (String column : joinColumns) {
                keys.add("`" + column);
            }
            keys.add("`" + leftTime);
            StringBuilder aggregates = new StringBuilder("(").append(keyed);
            for (String column : aggregated) {
                aggregates.append("; (last; `").append(column).append(')');
            }
            aggregates.append(')');
            return "wj[" + intervals + "; " + keys + "; " + l + "; " + aggregates + "]";
        });
    }

    private List<String> remainingColumns(JoinKind kind, String table, List<String> excluded) {
        String query = "(cols " + table + ") except " + QLiterals.symbols(excluded);
        try (QueryResponse response = session.query(query)) {
            KObject root = response.root();
            if (root instanceof KVector vector && vector.type() == KType.SYMBOL) {
                return List.of((String[]) vector.data());
            }
            throw new JoinFailureException(kind, JoinFailureException.Stage.EXECUTE,
                    "expected a symbol list of columns, got type " + root.type());
        } catch (QueryFailedException e) {
            throw new JoinFailureException(kind, JoinFailureException.Stage.EXECUTE,
                    "could not list columns of '" + table + "'", e);
        }
    }

    // ==================== Union ====================

    /**
     * Rows of {@code left} followed by rows of {@code right}; columns missing on
     * either side are filled with nulls.
     */
    public QueryResponse unionJoin(String left, String right, String result) {
        return orchestrate(JoinKind.UNION, left, right, result, (staging, l, r) -> l + " uj " + r);
    }

    // ==================== Orchestration ====================

    private QueryResponse orchestrate(JoinKind kind, String left, String right, String result, JoinPlan plan) {
        checkNames(kind, List.of(left, right, result));
        try (StagingArea staging = StagingArea.open(session, kind, List.of(left, right, result))) {
            String suffix = "_" + settings.stagingSuffix();
            String stagedLeft = staging.stage(left + suffix, "0!(" + left + ")");
            String stagedRight = staging.stage(right + suffix, "0!(" + right + ")");

            String query = result + ": " + plan.build(staging, stagedLeft, stagedRight);
            execute(kind, query);
            QueryResponse response = fetch(kind, result);
            log.debug("{} join into '{}' staged {}", kind, result, staging.names());
            return response;
        }
    }

    private void execute(JoinKind kind, String query) {
        ExecutionOutcome outcome = session.execute(query);
        if (outcome instanceof ExecutionOutcome.Failed failed) {
            throw new JoinFailureException(kind, JoinFailureException.Stage.EXECUTE, failed.message());
        }
        if (outcome instanceof ExecutionOutcome.Data data) {
            data.response().close();
        }
    }

    private QueryResponse fetch(JoinKind kind, String result) {
        QueryResponse response;
        try {
            response = session.query(result);
        } catch (QueryFailedException e) {
            throw new JoinFailureException(kind, JoinFailureException.Stage.FETCH,
                    "could not read '" + result + "'", e);
        }
        KObject root = response.root();
        if (root instanceof KTable || (root instanceof KDict dict && dict.isKeyedTable())) {
            return response;
        }
        response.close();
        throw new JoinFailureException(kind, JoinFailureException.Stage.FETCH,
                "'" + result + "' is not a table (type " + root.type() + ")");
    }

    private static void checkNames(JoinKind kind, List<String> names) {
        for (String name : names) {
            try {
                QLiterals.requireName(name);
            } catch (IllegalArgumentException e) {
                throw new JoinFailureException(kind, JoinFailureException.Stage.VALIDATE, e.getMessage(), e);
            }
        }
    }
}
