package org.broadinstitute.wombat.utils.fasta;

import org.broadinstitute.wombat.utils.Utils;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes {@link SequenceRecord}s in FASTA format.
 * <p>
 * Each record is a header line, {@value #HEADER_START_CHAR} followed by the id and, when present, a space and the
 * description, then the residues wrapped at a fixed number per line ({@value #DEFAULT_RESIDUES_PER_LINE} by default).
 * The output is truncated on open.
 * </p>
 */
public final class FastaRecordWriter implements AutoCloseable {

    public static final int DEFAULT_RESIDUES_PER_LINE = 60;

    public static final char HEADER_START_CHAR = '>';

    public static final char HEADER_NAME_AND_DESCRIPTION_SEPARATOR = ' ';

    private final Writer writer;
    private final int residuesPerLine;
    private long recordsWritten = 0;

    public FastaRecordWriter(final Path path) throws IOException {
        this(path, DEFAULT_RESIDUES_PER_LINE);
    }

    public FastaRecordWriter(final Path path, final int residuesPerLine) throws IOException {
        Utils.nonNull(path, "the output path cannot be null");
        Utils.validateArg(residuesPerLine > 0, "residues per line must be 1 or greater");
        this.residuesPerLine = residuesPerLine;
        this.writer = new BufferedWriter(Files.newBufferedWriter(path, StandardCharsets.US_ASCII));
    }

    public FastaRecordWriter write(final SequenceRecord record) throws IOException {
        Utils.nonNull(record, "the record cannot be null");
        writer.write(HEADER_START_CHAR);
        writer.write(record.getId());
        if (!record.getDescription().isEmpty()) {
            writer.write(HEADER_NAME_AND_DESCRIPTION_SEPARATOR);
            writer.write(record.getDescription());
        }
        writer.write('\n');
        final String residues = record.getResidues();
        for (int start = 0; start < residues.length(); start += residuesPerLine) {
            writer.write(residues, start, Math.min(residuesPerLine, residues.length() - start));
            writer.write('\n');
        }
        recordsWritten++;
        return this;
    }

    public long getRecordsWritten() {
        return recordsWritten;
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
