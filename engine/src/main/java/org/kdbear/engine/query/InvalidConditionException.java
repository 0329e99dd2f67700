package org.kdbear.engine.query;

import org.kdbear.engine.KdbException;

/**
 * Thrown when condition text is malformed. Raised before any query is sent.
 */
public class InvalidConditionException extends KdbException {

    private final String condition;
    private final int position;

    public InvalidConditionException(String message, String condition, int position) {
        super(message + " at position " + position + " in condition '" + condition + "'");
        this.condition = condition;
        this.position = position;
    }

    public String getCondition() {
        return condition;
    }

    public int getPosition() {
        return position;
    }
}
