package org.broadinstitute.wombat.utils.tsv;

import org.broadinstitute.wombat.utils.Utils;

import java.util.function.Function;

/**
 * Table data-line string array wrapper.
 * <p>
 * Values are read by column name; numeric getters turn unparsable values into the
 * format exception of the table being read, so the error message points at the offending line.
 * </p>
 */
public final class DataLine {

    private final String[] values;

    /**
     * Next appended value index.
     */
    private int nextIndex = 0;

    private final TableColumnCollection columns;

    private final Function<String, RuntimeException> formatErrorFactory;

    DataLine(final String[] values, final TableColumnCollection columns,
             final Function<String, RuntimeException> formatErrorFactory) {
        this.values = Utils.nonNull(values, "the value array cannot be null");
        this.columns = Utils.nonNull(columns, "the columns cannot be null");
        this.formatErrorFactory = Utils.nonNull(formatErrorFactory, "the format error factory cannot be null");
        if (values.length != columns.columnCount()) {
            throw new IllegalArgumentException("mismatching value length and column count");
        }
    }

    /**
     * Creates a new data-line instance with no value set.
     */
    DataLine(final TableColumnCollection columns, final Function<String, RuntimeException> formatErrorFactory) {
        this(new String[Utils.nonNull(columns, "the columns cannot be null").columnCount()], columns, formatErrorFactory);
    }

    public TableColumnCollection columns() {
        return columns;
    }

    /**
     * Returns the values array after checking that every one has been set.
     */
    String[] unpack() {
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                throw new IllegalStateException(String.format("some data line value remains undefined: e.g. column '%s' index %d", columns.nameAt(i), i));
            }
        }
        return values;
    }

    /**
     * Returns a copy of the values in column order.
     */
    public String[] toArray() {
        return unpack().clone();
    }

    public String get(final String columnName) {
        final int index = columns.indexOf(columnName);
        if (index < 0) {
            throw new IllegalArgumentException("there is no such a column: " + columnName);
        }
        if (values[index] == null) {
            throw new IllegalStateException("requested column value " + columnName + " has not been initialized yet");
        }
        return values[index];
    }

    public int getInt(final String columnName) {
        try {
            return Integer.parseInt(get(columnName).trim());
        } catch (final NumberFormatException ex) {
            throw formatErrorFactory.apply(String.format("expected int value for column %s but found %s", columnName, get(columnName)));
        }
    }

    public double getDouble(final String columnName) {
        try {
            return Double.parseDouble(get(columnName));
        } catch (final NumberFormatException ex) {
            throw formatErrorFactory.apply(String.format("expected double value for column %s but found %s", columnName, get(columnName)));
        }
    }

    /**
     * Sets the next values, starting at the first column.
     */
    public DataLine append(final String... values) {
        for (final String value : Utils.nonNull(values, "the values cannot be null")) {
            if (nextIndex == this.values.length) {
                throw new IllegalStateException("gone beyond of the end of the data-line");
            }
            if (nextIndex == 0 && value != null && value.startsWith(TableUtils.COMMENT_PREFIX)) {
                throw new IllegalArgumentException("the value of the first column cannot start with the comment prefix: " + TableUtils.COMMENT_PREFIX);
            }
            this.values[nextIndex++] = value;
        }
        return this;
    }

    /**
     * Creates the format exception of the table for a problem found in this line.
     */
    public RuntimeException formatException(final String message) {
        return formatErrorFactory.apply(message);
    }
}
