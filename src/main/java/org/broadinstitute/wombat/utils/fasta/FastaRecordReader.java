package org.broadinstitute.wombat.utils.fasta;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.util.BufferedLineReader;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.LineReader;
import org.broadinstitute.wombat.exceptions.UserException;
import org.broadinstitute.wombat.utils.Utils;

import java.io.Closeable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

/**
 * Lazily reads the records of a FASTA file, line by line through htsjdk's {@link BufferedLineReader}.
 * The file name is not inspected, so protein ({@code .faa}, {@code .pep}) and nucleotide files read alike, gzipped
 * or not. Sequence lines are concatenated and blank lines ignored; a malformed record surfaces as a
 * {@link UserException.MalformedSequenceFile} at the point it is reached.
 */
public final class FastaRecordReader implements Closeable, Iterable<SequenceRecord> {

    private static final char HEADER_START_CHAR = '>';

    private final Path path;
    private final LineReader lineReader;
    // header line of the record to be read next, without the '>'
    private String pendingHeader;

    public FastaRecordReader(final Path path) {
        this.path = Utils.nonNull(path, "the FASTA path cannot be null");
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new UserException.CouldNotReadInputFile(path, "the file does not exist or is not readable");
        }
        try {
            this.lineReader = new BufferedLineReader(IOUtil.openFileForReading(path));
        } catch (final SAMException e) {
            throw new UserException.CouldNotReadInputFile(path, e.getMessage(), e);
        }
        final String first = nextNonBlankLine();
        if (first != null && first.charAt(0) != HEADER_START_CHAR) {
            close();
            throw new UserException.MalformedSequenceFile(path,
                    "the first non-blank line must be a header starting with '>', found: " + abbreviate(first));
        }
        this.pendingHeader = first == null ? null : first.substring(1);
    }

    @Override
    public Iterator<SequenceRecord> iterator() {
        return new Iterator<SequenceRecord>() {
            private SequenceRecord next = null;
            private boolean exhausted = false;

            @Override
            public boolean hasNext() {
                if (next == null && !exhausted) {
                    next = readNext();
                    exhausted = next == null;
                }
                return next != null;
            }

            @Override
            public SequenceRecord next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("no more records in " + path);
                }
                final SequenceRecord result = next;
                next = null;
                return result;
            }
        };
    }

    public Stream<SequenceRecord> stream() {
        return Utils.stream(this);
    }

    private SequenceRecord readNext() {
        if (pendingHeader == null) {
            return null;
        }
        final String header = pendingHeader;
        final StringBuilder residues = new StringBuilder();
        String line;
        while ((line = nextNonBlankLine()) != null && line.charAt(0) != HEADER_START_CHAR) {
            residues.append(line);
        }
        pendingHeader = line == null ? null : line.substring(1);
        return toRecord(header, residues.toString());
    }

    /**
     * @return the next line with trailing whitespace removed that is not empty, or null at the end of the file
     */
    private String nextNonBlankLine() {
        try {
            String line;
            while ((line = lineReader.readLine()) != null) {
                final String stripped = line.replaceFirst("\\s+$", "");
                if (!stripped.isEmpty()) {
                    return stripped;
                }
            }
            return null;
        } catch (final SAMException e) {
            throw new UserException.CouldNotReadInputFile(path, "reading line " + lineReader.getLineNumber() + " failed", e);
        }
    }

    private static String abbreviate(final String line) {
        return line.length() <= 20 ? line : line.substring(0, 20) + "...";
    }

    private SequenceRecord toRecord(final String header, final String residues) {
        final String trimmed = header.trim();
        if (trimmed.isEmpty()) {
            throw new UserException.MalformedSequenceFile(path, "a record has an empty header line");
        }
        int split = 0;
        while (split < trimmed.length() && !Character.isWhitespace(trimmed.charAt(split))) {
            split++;
        }
        final String id = trimmed.substring(0, split);
        final String description = trimmed.substring(split).trim();
        return new SequenceRecord(id, description, residues);
    }

    @Override
    public void close() {
        lineReader.close();
    }
}
