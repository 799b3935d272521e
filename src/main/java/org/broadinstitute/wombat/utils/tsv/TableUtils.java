package org.broadinstitute.wombat.utils.tsv;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.wombat.utils.Utils;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Common constants and factory methods for table readers and writers.
 */
public final class TableUtils {

    /**
     * Column separator {@value #COLUMN_SEPARATOR_STRING}.
     */
    public static final char COLUMN_SEPARATOR = '\t';

    public static final String COLUMN_SEPARATOR_STRING = String.valueOf(COLUMN_SEPARATOR);

    /**
     * Comment line prefix string {@value}.
     * <p>
     * Lines that start with this prefix (spaces are not ignored), will be considered comment
     * lines (neither a header line nor data line).
     * </p>
     */
    public static final String COMMENT_PREFIX = "#";

    /**
     * Quote character used to quote table values that contain special characters.
     */
    public static final char QUOTE_CHARACTER = '\"';

    /**
     * Escape character used within quotes.
     */
    public static final char ESCAPE_CHARACTER = '\\';

    /**
     * Creates a new table reader given a path and a record extractor factory based on the columns found in the input.
     *
     * @param path the source file.
     * @param recordExtractorFactory the record extractor factory, receives the columns and the format exception
     *                               factory of the reader.
     * @param <R> the record type.
     * @return never {@code null}.
     * @throws IOException if thrown when opening the file or reading its header.
     */
    public static <R> TableReader<R> reader(final Path path,
                                            final BiFunction<TableColumnCollection, Function<String, RuntimeException>, Function<DataLine, R>> recordExtractorFactory)
            throws IOException {
        Utils.nonNull(recordExtractorFactory, "the record extractor factory cannot be null");
        return new TableReader<R>(path) {
            private Function<DataLine, R> recordExtractor;

            @Override
            protected void processColumns(final TableColumnCollection columns) {
                recordExtractor = recordExtractorFactory.apply(columns, this::formatException);
                if (recordExtractor == null) {
                    throw new IllegalStateException("the record extractor function cannot be null");
                }
            }

            @Override
            protected R createRecord(final DataLine dataLine) {
                return recordExtractor.apply(dataLine);
            }
        };
    }

    /**
     * Creates a new table writer given a destination and a data-line composer.
     */
    public static <R> TableWriter<R> writer(final Writer writer, final TableColumnCollection columns,
                                            final BiConsumer<R, DataLine> dataLineComposer) throws IOException {
        Utils.nonNull(dataLineComposer, "the data-line composer cannot be null");
        return new TableWriter<R>(writer, columns) {
            @Override
            protected void composeLine(final R record, final DataLine dataLine) {
                dataLineComposer.accept(record, dataLine);
            }
        };
    }

    /**
     * Checks that a column collection contains all the mandatory columns.
     *
     * @throws RuntimeException created by {@code formatExceptionFactory} naming the missing columns.
     */
    public static void checkMandatoryColumns(final TableColumnCollection columns, final TableColumnCollection mandatoryColumns,
                                             final Function<String, RuntimeException> formatExceptionFactory) {
        if (!columns.containsAll(mandatoryColumns.names())) {
            final List<String> missingColumns = mandatoryColumns.names().stream()
                    .filter(name -> !columns.contains(name))
                    .collect(Collectors.toList());
            throw formatExceptionFactory.apply("Bad header in file.  Not all mandatory columns are present.  Missing: " + StringUtils.join(missingColumns, ", "));
        }
    }

    private TableUtils() {
        throw new UnsupportedOperationException();
    }
}
