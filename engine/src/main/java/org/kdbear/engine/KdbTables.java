package org.kdbear.engine;

import org.kdbear.engine.execution.KdbSession;
import org.kdbear.engine.execution.QueryExecutor;
import org.kdbear.engine.execution.Result;
import org.kdbear.engine.execution.Value;
import org.kdbear.engine.join.JoinOrchestrator;
import org.kdbear.engine.metadata.ColumnMeta;
import org.kdbear.engine.metadata.MetadataProvider;
import org.kdbear.engine.metadata.TableShape;
import org.kdbear.engine.query.TableSelector;
import org.kdbear.engine.query.TableWriter;
import org.kdbear.engine.wire.QueryResponse;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Table operations against one engine session.
 *
 * <pre>
 * KdbTables tables = KdbTables.over(executor);
 * Result expensive = tables.loc("trades", "price > 25");
 * try (QueryResponse joined = tables.innerJoin("trades", "refs", "joined", List.of("ticker"))) {
 *     ...
 * }
 * </pre>
 */
public final class KdbTables {

    private final KdbSession session;
    private final MetadataProvider metadata;
    private final TableSelector selector;
    private final TableWriter writer;
    private final JoinOrchestrator joins;

    public KdbTables(KdbSession session) {
        this.session = Objects.requireNonNull(session, "session");
        this.metadata = new MetadataProvider(session);
        this.selector = new TableSelector(session, metadata);
        this.writer = new TableWriter(session);
        this.joins = new JoinOrchestrator(session);
    }

    public static KdbTables over(QueryExecutor executor) {
        return new KdbTables(KdbSession.open(executor));
    }

    public KdbSession session() {
        return session;
    }

    // ==================== Selection ====================

    public Result iloc(String table, List<Integer> rows, List<Integer> columns) {
        return selector.iloc(table, rows, columns);
    }

    public Result loc(String table, String conditions) {
        return selector.loc(table, conditions);
    }

    // ==================== Schema ====================

    public List<ColumnMeta> getMetadata(String table) {
        return metadata.getMetadata(table);
    }

    public TableShape shape(String table) {
        return metadata.shape(table);
    }

    public void makeTable(String name, List<String> columns, List<List<Value>> rows) {
        writer.makeTable(name, columns, rows);
    }

    // ==================== Joins ====================

    public QueryResponse innerJoin(String left, String right, String result, List<String> joinColumns) {
        return joins.innerJoin(left, right, result, joinColumns);
    }

    public QueryResponse leftJoin(String left, String right, String result, List<String> joinColumns) {
        return joins.leftJoin(left, right, result, joinColumns);
    }

    public QueryResponse rightJoin(String left, String right, String result, List<String> joinColumns) {
        return joins.rightJoin(left, right, result, joinColumns);
    }

    public QueryResponse asofJoin(String left, String right, String result, String leftTime, String rightTime,
            List<String> joinColumns) {
        return joins.asofJoin(left, right, result, leftTime, rightTime, joinColumns);
    }

    public QueryResponse windowJoin(String left, String right, String result, String leftTime, String rightTime,
            Duration window, List<String> joinColumns) {
        return joins.windowJoin(left, right, result, leftTime, rightTime, window, joinColumns);
    }

    public QueryResponse unionJoin(String left, String right, String result) {
        return joins.unionJoin(left, right, result);
    }
}
