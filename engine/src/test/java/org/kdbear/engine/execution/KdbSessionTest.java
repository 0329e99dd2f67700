package org.kdbear.engine.execution;

import org.kdbear.engine.test.ScriptedExecutor;
import org.kdbear.engine.wire.KObject;
import org.kdbear.engine.wire.KObjects;
import org.kdbear.engine.wire.QueryResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KdbSession Tests")
class KdbSessionTest {

    private final ScriptedExecutor executor = new ScriptedExecutor();
    private final KdbSession session = KdbSession.open(executor);

    @Test
    @DisplayName("query returns the payload, owned by the caller")
    void testQuery() {
        executor.respond("count t", KObjects.longAtom(3));

        try (QueryResponse response = session.query("count t")) {
            assertEquals(KObjects.longAtom(3).type(), response.root().type());
        }

        assertEquals(1, executor.releasedResponses());
    }

    @Test
    @DisplayName("Engine failures surface as QueryFailedException")
    void testFailure() {
        executor.fail("bad"::equals, "type");

        QueryFailedException e = assertThrows(QueryFailedException.class, () -> session.query("bad"));
        assertEquals("bad", e.getQuery());
        assertTrue(e.getMessage().contains("type"));
    }

    @Test
    @DisplayName("Error payloads are failures and are released")
    void testErrorPayload() {
        executor.respond("oops", new KObject.KError("length"));

        ExecutionOutcome outcome = session.execute("oops");

        ExecutionOutcome.Failed failed = assertInstanceOf(ExecutionOutcome.Failed.class, outcome);
        assertEquals("length", failed.message());
        assertTrue(executor.allResponsesReleased());
    }

    @Test
    @DisplayName("query without a payload fails")
    void testNoPayload() {
        assertThrows(QueryFailedException.class, () -> session.query("t: ([] a:1 2)"));
    }

    @Test
    @DisplayName("run releases an unexpected payload")
    void testRunReleases() {
        executor.respond("x: 1", KObjects.longAtom(1));

        session.run("x: 1");

        assertTrue(executor.allResponsesReleased());
        assertTrue(executor.globals().contains("x"));
    }

    @Test
    @DisplayName("Lost connections propagate untouched")
    void testConnectionLost() {
        executor.loseConnection(q -> true);
        assertThrows(ConnectionLostException.class, () -> session.run("x: 1"));
    }
}
