package org.broadinstitute.wombat.utils.tsv;

import com.opencsv.CSVWriter;
import org.broadinstitute.wombat.utils.Utils;

import java.io.*;

/**
 * Class to write tab separated value files.
 * <p>
 * The column header line is written first, either when the first record is written or on {@link #close()},
 * so a table without records still carries its header.
 * </p>
 * <p>
 * Implementations transfer the state of a record of type {@link R} into a {@link DataLine} by overriding
 * {@link #composeLine}.
 * </p>
 *
 * @param <R> the row record type.
 */
public abstract class TableWriter<R> implements Closeable {

    private final CSVWriter writer;

    private final TableColumnCollection columns;

    private boolean headerWritten = false;

    public TableWriter(final Writer writer, final TableColumnCollection columns) {
        this.columns = Utils.nonNull(columns, "The columns cannot be null.");
        this.writer = new CSVWriter(Utils.nonNull(writer, "the input writer cannot be null"),
                TableUtils.COLUMN_SEPARATOR, TableUtils.QUOTE_CHARACTER, TableUtils.ESCAPE_CHARACTER);
    }

    /**
     * Writes a new record.
     *
     * @param record the record to write.
     * @throws IOException if one was raised when writing the record.
     */
    public void writeRecord(final R record) throws IOException {
        Utils.nonNull(record, "The record cannot be null.");
        writeHeaderIfApplies();
        final DataLine dataLine = new DataLine(columns, IllegalArgumentException::new);
        composeLine(record, dataLine);
        writer.writeNext(dataLine.unpack(), false);
    }

    public final void writeAllRecords(final Iterable<R> records) throws IOException {
        Utils.nonNull(records, "The record iterable cannot be null.");
        for (final R record : records) {
            writeRecord(record);
        }
    }

    @Override
    public final void close() throws IOException {
        writeHeaderIfApplies();
        writer.close();
    }

    /**
     * Writes the header if it has not been written already.
     */
    public void writeHeaderIfApplies() throws IOException {
        if (!headerWritten) {
            writer.writeNext(columns.names().toArray(new String[columns.columnCount()]), false);
        }
        headerWritten = true;
    }

    /**
     * Composes the data-line to write into the output to represent a record.
     *
     * @param record the record to write.
     * @param dataLine the destination data-line object.
     */
    protected abstract void composeLine(final R record, final DataLine dataLine);
}
