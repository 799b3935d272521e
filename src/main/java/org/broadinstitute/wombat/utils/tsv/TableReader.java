package org.broadinstitute.wombat.utils.tsv;

import com.opencsv.CSVReader;
import org.broadinstitute.wombat.exceptions.UserException;
import org.broadinstitute.wombat.utils.Utils;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads the contents of a tab separated value formatted text input into
 * records of an arbitrary type {@link R}.
 * <h3>Format description</h3>
 * <p>
 * Tab separated values may contain any number of <i>comment lines</i> (started with {@link TableUtils#COMMENT_PREFIX}),
 * a column name containing line (aka. the <i>header line</i>) and any number of <i>data lines</i> one per record.
 * </p>
 * <p>
 * The header line is the first non-comment line, whereas any other non-comment line after that is
 * considered a data line. Comment lines can appear anywhere in the file and are ignored.
 * Blank lines are treated as having a single column with the empty string as the only value.
 * The header line values must all be different, and all data lines have to have as many values as the header line.
 * </p>
 * <h3>Implementing your own reader</h3>
 * <p>
 * Implementations control how instances of {@link R} are instantiated by extending
 * {@link #createRecord(DataLine) createRecord}, and can verify the header by overriding
 * {@link #processColumns(TableColumnCollection)}, using {@link #formatException(String)} to report problems.
 * </p>
 *
 * @param <R> the record type for the reader.
 */
public abstract class TableReader<R> implements Closeable, Iterable<R> {

    /**
     * Name of the input source, used in error messages.
     */
    private final String source;

    /**
     * Keeps track of the last line number read for error reporting purposes.
     */
    private final LineNumberReader reader;

    private TableColumnCollection columns;

    private final CSVReader csvReader;

    /**
     * Whether {@link #nextRecord} holds the next record to return ({@code null} at the end of the table).
     */
    private boolean nextRecordFetched = false;

    private R nextRecord;

    /**
     * Creates a new table reader given the input file path.
     * <p>
     * This operation will read the first lines of the input file until the
     * column name header line is found.
     * </p>
     *
     * @param path the input file path.
     * @throws IOException if any is raised when accessing the file.
     */
    public TableReader(final Path path) throws IOException {
        this.source = Utils.nonNull(path, "the input file cannot be null").toString();
        this.reader = new LineNumberReader(Files.newBufferedReader(path, StandardCharsets.UTF_8));
        this.csvReader = new CSVReader(this.reader, TableUtils.COLUMN_SEPARATOR, TableUtils.QUOTE_CHARACTER, TableUtils.ESCAPE_CHARACTER);
        findAndProcessHeaderLine();
    }

    private void findAndProcessHeaderLine() throws IOException {
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (!isCommentLine(line)) {
                TableColumnCollection.checkNames(line, UserException.BadInput::new);
                columns = new TableColumnCollection(line);
                processColumns(columns);
                return;
            }
        }
        throw formatException("premature end of table: header line not found");
    }

    /**
     * Checks whether a line is a comment line or not.
     */
    protected boolean isCommentLine(final String[] line) {
        return line.length > 0 && line[0].startsWith(TableUtils.COMMENT_PREFIX);
    }

    /**
     * Composes the exception to be thrown due to a formatting error.
     *
     * @param message custom error message, can be {@code null}.
     * @return never {@code null}.
     */
    protected final UserException.BadInput formatException(final String message) {
        final String explanation = message == null ? "" : ": " + message;
        return new UserException.BadInput(String.format("format error in '%s' at line %d", source, reader.getLineNumber()) + explanation);
    }

    /**
     * Process the header line's column names.
     *
     * @param tableColumns columns found in the input.
     * @throws UserException.BadInput if there is a formatting issue.
     */
    protected void processColumns(@SuppressWarnings("unused") final TableColumnCollection tableColumns) {
        // nothing by default.
    }

    /**
     * Returns the column collection for this reader.
     */
    public TableColumnCollection columns() {
        Utils.validate(columns != null, "columns are null");
        return columns;
    }

    /**
     * Determines whether a line is a repetition of the header; such lines are skipped.
     */
    protected boolean isHeaderLine(final String[] line) {
        return columns.matchesExactly(line);
    }

    private R fetchNextRecord() throws IOException {
        nextRecordFetched = true;
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (isCommentLine(line) || isHeaderLine(line)) {
                continue;
            }
            if (line.length != columns.columnCount()) {
                throw formatException(String.format("mismatch between number of values in line (%d) and number of columns (%d)", line.length, columns.columnCount()));
            }
            final R result = createRecord(new DataLine(line, columns, this::formatException));
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    /**
     * Transforms a data-line column values into a record.
     *
     * @param dataLine values corresponding to the columns passed earlier to {@link #processColumns(TableColumnCollection)}.
     * @return {@code null} to skip the line.
     */
    protected abstract R createRecord(final DataLine dataLine);

    @Override
    public void close() throws IOException {
        csvReader.close();
    }

    /**
     * Returns an iterator on the remaining records in the input.
     */
    @Override
    public Iterator<R> iterator() {
        return new Iterator<R>() {

            @Override
            public boolean hasNext() {
                fetchIfNeeded();
                return nextRecord != null;
            }

            @Override
            public R next() {
                fetchIfNeeded();
                if (nextRecord == null) {
                    throw new NoSuchElementException("there is no more record in the input");
                }
                nextRecordFetched = false;
                return nextRecord;
            }

            private void fetchIfNeeded() {
                if (!nextRecordFetched) {
                    try {
                        nextRecord = fetchNextRecord();
                    } catch (final IOException ex) {
                        throw new UncheckedIOException(ex);
                    }
                }
            }
        };
    }

    /**
     * Returns a stream on the remaining records in the source.
     * <p>
     * Any {@link IOException} raised when using the stream will be propagated up wrapped in a {@link UncheckedIOException}.
     * </p>
     */
    public Stream<R> stream() {
        return Utils.stream(this);
    }

    /**
     * Read the remaining records into a list. Does not close the reader.
     */
    public List<R> toList() {
        return stream().collect(Collectors.toList());
    }
}
