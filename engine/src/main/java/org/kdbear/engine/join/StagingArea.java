package org.kdbear.engine.join;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.factory.Sets;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.MutableSet;
import org.kdbear.engine.execution.ExecutionOutcome;
import org.kdbear.engine.execution.KdbSession;
import org.kdbear.engine.execution.QueryFailedException;
import org.kdbear.engine.wire.KObject;
import org.kdbear.engine.wire.KObject.KVector;
import org.kdbear.engine.wire.KType;
import org.kdbear.engine.wire.QueryResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Temporary globals created by one join call.
 *
 * A staged name never equals a global that existed when the scope was opened
 * or any reserved name; a taken name gets a numeric suffix. Names are recorded
 * only once their assignment succeeded. {@link #close()} deletes each of them
 * independently; a failed delete is logged and never thrown.
 */
final class StagingArea implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StagingArea.class);

    static final String GLOBALS_QUERY = "key `.";

    private final KdbSession session;
    private final JoinKind kind;
    private final MutableSet<String> taken;
    private final MutableList<String> created = Lists.mutable.empty();

    private StagingArea(KdbSession session, JoinKind kind, MutableSet<String> taken) {
        this.session = session;
        this.kind = kind;
        this.taken = taken;
    }

    /**
     * Opens a scope whose names avoid {@code reserved} and every global of the
     * root namespace.
     *
     * @throws JoinFailureException if the globals cannot be listed
     */
    static StagingArea open(KdbSession session, JoinKind kind, Iterable<String> reserved) {
        MutableSet<String> taken = Sets.mutable.withAll(reserved);
        taken.addAll(existingGlobals(session, kind));
        return new StagingArea(session, kind, taken);
    }

    private static MutableList<String> existingGlobals(KdbSession session, JoinKind kind) {
        try (QueryResponse response = session.query(GLOBALS_QUERY)) {
            KObject root = response.root();
            if (root instanceof KVector vector && vector.type() == KType.SYMBOL) {
                return Lists.mutable.with((String[]) vector.data());
            }
            if (root.type() == KType.GENERAL_LIST && root.count() == 0) {
                return Lists.mutable.empty();
            }
            throw new JoinFailureException(kind, JoinFailureException.Stage.STAGE,
                    "expected a symbol list of globals, got type " + root.type());
        } catch (QueryFailedException e) {
            throw new JoinFailureException(kind, JoinFailureException.Stage.STAGE,
                    "could not list existing globals", e);
        }
    }

    /**
     * Assigns {@code expression} to a fresh global derived from {@code base}.
     *
     * @return the name actually assigned
     * @throws JoinFailureException if the engine rejects the assignment
     */
    String stage(String base, String expression) {
        String name = freeName(base);
        try {
            session.run(name + ": " + expression);
        } catch (QueryFailedException e) {
            throw new JoinFailureException(kind, JoinFailureException.Stage.STAGE,
                    "could not stage '" + name + "'", e);
        }
        created.add(name);
        return name;
    }

    private String freeName(String base) {
        String name = base;
        for (int n = 2; taken.contains(name); n++) {
            name = base + n;
        }
        taken.add(name);
        return name;
    }

    ImmutableList<String> names() {
        return created.toImmutable();
    }

    @Override
    public void close() {
        for (String name : created) {
            String query = "delete " + name + " from `.";
            try {
                ExecutionOutcome outcome = session.execute(query);
                if (outcome instanceof ExecutionOutcome.Failed failed) {
                    log.warn("Could not remove staging table '{}': {}", name, failed.message());
                } else if (outcome instanceof ExecutionOutcome.Data data) {
                    data.response().close();
                }
            } catch (RuntimeException e) {
                log.warn("Could not remove staging table '{}'", name, e);
            }
        }
        created.clear();
    }
}
