package org.kdbear.engine.wire;

import java.lang.reflect.Array;
import java.util.List;
import java.util.Objects;

/**
 * A tagged object as returned by the engine.
 *
 * Shapes:
 * - {@link KAtom}: a scalar, negative type code
 * - {@link KVector}: a homogeneous array, positive type code
 * - {@link KList}: a general (mixed) list, type code 0
 * - {@link KTable}: a table (column names + columns), type code 98
 * - {@link KDict}: a dictionary or keyed table, type code 99
 * - {@link KError}: an engine error, type code -128
 *
 * Objects are immutable views. They never own resources; the enclosing
 * {@link QueryResponse} does.
 */
public sealed interface KObject
        permits KObject.KAtom, KObject.KVector, KObject.KList, KObject.KTable, KObject.KDict, KObject.KError {

    /**
     * @return the signed type code
     */
    int type();

    /**
     * @return the number of elements (1 for atoms)
     */
    int count();

    // ==================== Atom ====================

    /**
     * A scalar. The value is held in a one-element primitive array of the
     * vector storage type so that atoms and vectors are read the same way.
     */
    record KAtom(int type, Object data) implements KObject {
        public KAtom {
            if (type >= 0) {
                throw new IllegalArgumentException("Atom type must be negative: " + type);
            }
            Objects.requireNonNull(data, "data");
            if (!data.getClass().isArray() || Array.getLength(data) != 1) {
                throw new IllegalArgumentException("Atom data must be a one-element array");
            }
        }

        @Override
        public int count() {
            return 1;
        }

        /**
         * @return the positive code of the element type
         */
        public int elementType() {
            return -type;
        }
    }

    // ==================== Vector ====================

    /**
     * A homogeneous vector backed by a primitive array (or String[] for symbols).
     */
    record KVector(int type, Object data) implements KObject {
        public KVector {
            if (!KType.isVector(type)) {
                throw new IllegalArgumentException("Vector type must be in 1..97: " + type);
            }
            Objects.requireNonNull(data, "data");
            if (!data.getClass().isArray()) {
                throw new IllegalArgumentException("Vector data must be an array");
            }
        }

        @Override
        public int count() {
            return Array.getLength(data);
        }
    }

    // ==================== General list ====================

    record KList(List<KObject> elements) implements KObject {
        public KList {
            elements = List.copyOf(elements);
        }

        @Override
        public int type() {
            return KType.GENERAL_LIST;
        }

        @Override
        public int count() {
            return elements.size();
        }

        public KObject get(int index) {
            return elements.get(index);
        }
    }

    // ==================== Table ====================

    /**
     * A table: a symbol vector of column names and one column object per name.
     * Columns are vectors or general lists of equal length.
     */
    record KTable(KVector columnNames, KList columns) implements KObject {
        public KTable {
            Objects.requireNonNull(columnNames, "columnNames");
            Objects.requireNonNull(columns, "columns");
            if (columnNames.type() != KType.SYMBOL) {
                throw new IllegalArgumentException("Column names must be a symbol vector");
            }
            if (columnNames.count() != columns.count()) {
                throw new IllegalArgumentException("Column name count " + columnNames.count()
                        + " does not match column count " + columns.count());
            }
        }

        @Override
        public int type() {
            return KType.TABLE;
        }

        /**
         * @return the number of rows
         */
        @Override
        public int count() {
            return columns.count() == 0 ? 0 : columns.get(0).count();
        }

        public int columnCount() {
            return columns.count();
        }

        public String columnName(int index) {
            return ((String[]) columnNames.data())[index];
        }

        public KObject column(int index) {
            return columns.get(index);
        }

        /**
         * @return the index of the named column, or -1
         */
        public int indexOf(String name) {
            String[] names = (String[]) columnNames.data();
            for (int i = 0; i < names.length; i++) {
                if (names[i].equals(name)) {
                    return i;
                }
            }
            return -1;
        }
    }

    // ==================== Dictionary ====================

    /**
     * A dictionary. When both keys and values are tables it is a keyed table.
     */
    record KDict(KObject keys, KObject values) implements KObject {
        public KDict {
            Objects.requireNonNull(keys, "keys");
            Objects.requireNonNull(values, "values");
        }

        @Override
        public int type() {
            return KType.DICT;
        }

        @Override
        public int count() {
            return keys.count();
        }

        public boolean isKeyedTable() {
            return keys instanceof KTable && values instanceof KTable;
        }
    }

    // ==================== Error ====================

    record KError(String message) implements KObject {
        @Override
        public int type() {
            return KType.ERROR;
        }

        @Override
        public int count() {
            return 1;
        }
    }
}
