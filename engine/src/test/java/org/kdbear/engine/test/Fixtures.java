package org.kdbear.engine.test;

import org.kdbear.engine.wire.KObject.KTable;
import org.kdbear.engine.wire.KObjects;

import java.util.List;

/**
 * Wire objects shared by several tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    /**
     * ticker (symbol), price (long), size (long):
     * (GOOG,20,10), (MSFT,30,20), (AAPL,40,30).
     */
    public static KTable trades() {
        return KObjects.table(List.of("ticker", "price", "size"), List.of(
                KObjects.symbols("GOOG", "MSFT", "AAPL"),
                KObjects.longs(20, 30, 40),
                KObjects.longs(10, 20, 30)));
    }

    /**
     * Schema response of {@link #trades()}.
     */
    public static KTable tradesMeta() {
        return KObjects.table(List.of("name", "type"), List.of(
                KObjects.symbols("ticker", "price", "size"),
                KObjects.chars("sjj")));
    }
}
