package org.kdbear.engine.execution;

import org.kdbear.engine.types.UnsupportedTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives every cell that was replaced by {@link Value#NULL} because its wire
 * type is not registered.
 */
@FunctionalInterface
public interface UnknownTypeListener {

    void onUnknownType(UnsupportedTypeException cause);

    /**
     * Listener that logs each occurrence at WARN.
     */
    static UnknownTypeListener logging() {
        Logger log = LoggerFactory.getLogger(UnknownTypeListener.class);
        return cause -> log.warn("Unknown type code {} decoded as null", cause.getTypeCode());
    }
}
