package org.kdbear.engine.join;

import org.kdbear.engine.KdbException;

/**
 * Thrown when a join cannot be completed. Staging tables have already been
 * removed when this is raised.
 */
public class JoinFailureException extends KdbException {

    /**
     * Step of a join that failed.
     */
    public enum Stage {
        VALIDATE,
        STAGE,
        EXECUTE,
        FETCH
    }

    private final JoinKind kind;
    private final Stage stage;

    public JoinFailureException(JoinKind kind, Stage stage, String message) {
        super(kind + " join failed during " + stage + ": " + message);
        this.kind = kind;
        this.stage = stage;
    }

    public JoinFailureException(JoinKind kind, Stage stage, String message, Throwable cause) {
        super(kind + " join failed during " + stage + ": " + message, cause);
        this.kind = kind;
        this.stage = stage;
    }

    public JoinKind getKind() {
        return kind;
    }

    public Stage getStage() {
        return stage;
    }
}
