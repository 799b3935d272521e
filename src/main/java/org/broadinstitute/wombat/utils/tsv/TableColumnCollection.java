package org.broadinstitute.wombat.utils.tsv;

import org.broadinstitute.wombat.utils.Utils;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Represents a list of table columns.
 * <p>
 * There must be at least one column.
 * </p>
 * <p>
 * Column names cannot be {@code null}, repeated, or start with {@link TableUtils#COMMENT_PREFIX}.
 * </p>
 */
public final class TableColumnCollection {

    /**
     * Column names in order of appearance.
     */
    private final List<String> names;

    /**
     * Map from column name to its index in the input.
     */
    private final Map<String, Integer> indexByName;

    /**
     * Creates a new table-column collection from a sequence of column names.
     *
     * @param names the column names in order.
     * @throws IllegalArgumentException if {@code names} is {@code null} or contains a {@code null},
     *  is empty or contains repeats.
     */
    public TableColumnCollection(final Iterable<String> names) {
        this(Utils.stream(Utils.nonNull(names, "the names cannot be null")).toArray(String[]::new));
    }

    public TableColumnCollection(final String... names) {
        this.names = Collections.unmodifiableList(Arrays.asList(checkNames(names.clone(), IllegalArgumentException::new)));
        this.indexByName = IntStream.range(0, names.length).boxed()
                .collect(Collectors.toMap(this.names::get, Function.identity()));
    }

    /**
     * Returns a view of all the column names, in order of appearance.
     */
    public List<String> names() {
        return names;
    }

    public String nameAt(final int index) {
        Utils.validIndex(index, names.size());
        return names.get(index);
    }

    /**
     * Returns the index of a column by its name or -1 if no such a column exists.
     */
    public int indexOf(final String name) {
        Utils.nonNull(name, "the column name cannot be null");
        return indexByName.getOrDefault(name, -1);
    }

    public boolean contains(final String name) {
        return indexByName.containsKey(Utils.nonNull(name, "cannot be null"));
    }

    public boolean containsAll(final Iterable<String> names) {
        for (final String name : Utils.nonNull(names, "names cannot be null")) {
            if (!contains(name)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks whether the column names match exactly, in the same order, the ones provided.
     */
    public boolean matchesExactly(final String... names) {
        Utils.nonNull(names, "names cannot be null");
        if (names.length != this.names.size()) {
            return false;
        }
        for (int i = 0; i < names.length; i++) {
            if (!this.names.get(i).equals(names[i])) {
                return false;
            }
        }
        return true;
    }

    public int columnCount() {
        return names.size();
    }

    /**
     * Check an array of column names.
     * <p>
     * This method will check that every name is not null, that there are no repeats and
     * that the first name does not start with the comment prefix.
     * </p>
     *
     * @param columnNames the column names to check.
     * @param exceptionFactory the exception factory to use to create the exception to throw.
     * @return the same array as the input.
     */
    public static String[] checkNames(final String[] columnNames,
                                      final Function<String, RuntimeException> exceptionFactory) {
        Utils.nonNull(columnNames, "column names cannot be null");
        Utils.nonNull(exceptionFactory, "exception factory cannot be null");

        if (columnNames.length == 0) {
            throw Utils.nonNull(exceptionFactory.apply("there must be at least one column"));
        }
        final Set<String> columnNameSet = new HashSet<>(columnNames.length);
        for (int i = 0; i < columnNames.length; i++) {
            final String columnName = Utils.nonNull(columnNames[i], "no column name can be null: e.g. " + i + " element");
            if (!columnNameSet.add(columnName)) {
                throw Utils.nonNull(exceptionFactory.apply("more than one column have the same name: " + columnNames[i]), "exception factory produces null exceptions");
            }
        }
        if (columnNames[0].startsWith(TableUtils.COMMENT_PREFIX)) {
            throw Utils.nonNull(exceptionFactory.apply("the first column name cannot start with the comment prefix"), "exception factory produces null exceptions");
        }
        return columnNames;
    }
}
