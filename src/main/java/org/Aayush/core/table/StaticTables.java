package org.Aayush.core.table;

import java.util.List;

/**
 * Bounds-checked access to the process-wide lookup tables.
 *
 * <p>Every index into a name or weekday table is derived arithmetically from validated inputs, so an
 * out-of-range index is an engine defect. It fails with {@link AssertionError} instead of being
 * clamped or defaulted.</p>
 */
public final class StaticTables {

    private StaticTables() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Returns {@code table[index]}.
     *
     * @param table immutable lookup table.
     * @param index zero-based index.
     * @param tableName table name used in the defect message.
     * @throws AssertionError when {@code index} is outside the table.
     */
    public static <T> T at(List<T> table, int index, String tableName) {
        if (index < 0 || index >= table.size()) {
            throw defect(tableName, index, table.size());
        }
        return table.get(index);
    }

    /**
     * Returns {@code table[index]} for primitive position tables.
     *
     * @throws AssertionError when {@code index} is outside the table.
     */
    public static int at(int[] table, int index, String tableName) {
        if (index < 0 || index >= table.length) {
            throw defect(tableName, index, table.length);
        }
        return table[index];
    }

    private static AssertionError defect(String tableName, int index, int size) {
        return new AssertionError(
                "lookup defect: " + tableName + " index " + index + " outside [0, " + (size - 1) + "]");
    }
}
