package org.kdbear.engine.join;

/**
 * The supported join variants.
 */
public enum JoinKind {
    INNER,
    LEFT,
    RIGHT,
    ASOF,
    WINDOW,
    UNION
}
