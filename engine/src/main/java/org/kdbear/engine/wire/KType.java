package org.kdbear.engine.wire;

/**
 * Type codes of the engine's tagged objects.
 *
 * Vectors carry the positive code, atoms the negated code.
 */
public final class KType {

    public static final int GENERAL_LIST = 0;
    public static final int BOOLEAN = 1;
    public static final int BYTE = 4;
    public static final int SHORT = 5;
    public static final int INT = 6;
    public static final int LONG = 7;
    public static final int REAL = 8;
    public static final int FLOAT = 9;
    public static final int CHAR = 10;
    public static final int SYMBOL = 11;
    public static final int TIMESTAMP = 12;
    public static final int MONTH = 13;
    public static final int DATE = 14;
    public static final int DATETIME = 15;
    public static final int TIMESPAN = 16;
    public static final int MINUTE = 17;
    public static final int SECOND = 18;
    public static final int TIME = 19;

    public static final int TABLE = 98;
    public static final int DICT = 99;
    public static final int ERROR = -128;

    private KType() {
    }

    public static boolean isAtom(int type) {
        return type < 0 && type != ERROR;
    }

    public static boolean isVector(int type) {
        return type > 0 && type < TABLE;
    }
}
