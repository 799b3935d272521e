package org.broadinstitute.wombat.tools.curation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.wombat.exceptions.UserException;
import org.broadinstitute.wombat.utils.Utils;
import org.broadinstitute.wombat.utils.fasta.FastaRecordReader;
import org.broadinstitute.wombat.utils.fasta.FastaRecordWriter;
import org.broadinstitute.wombat.utils.fasta.SequenceRecord;

import java.io.IOException;
import java.nio.file.*;
import java.util.Arrays;
import java.util.Iterator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Drops short assembled contigs and gives the survivors short identifiers.
 * <p>
 * A record is kept when its length is strictly greater than the minimum length. Its id becomes the marker
 * followed by fields 1 to 3 (0-based) of the original id split on '_', so {@code NODE_3_length_5000_cov_12.3}
 * becomes {@code C_3_length_5000} with marker {@code C}; ids with fewer fields contribute what they have.
 * The description is cleared.
 * </p>
 */
public final class ContigCurator {
    private static final Logger logger = LogManager.getLogger(ContigCurator.class);

    static final String ID_FIELD_SEPARATOR = "_";
    static final int FIRST_KEPT_FIELD = 1;
    static final int LAST_KEPT_FIELD_EXCLUSIVE = 4;

    private final int minLength;
    private final String marker;

    public ContigCurator(final int minLength, final String marker) {
        Utils.validateArg(minLength >= 0, "the minimum length cannot be negative");
        this.minLength = minLength;
        this.marker = Utils.nonEmpty(marker, "the contig marker");
    }

    public int getMinLength() {
        return minLength;
    }

    public String getMarker() {
        return marker;
    }

    /**
     * @return the curated form of {@code originalId}
     */
    public static String curatedId(final String originalId, final String marker) {
        final String[] fields = originalId.split(ID_FIELD_SEPARATOR, -1);
        final int to = Math.min(LAST_KEPT_FIELD_EXCLUSIVE, fields.length);
        final String kept = fields.length > FIRST_KEPT_FIELD ?
                Arrays.stream(fields, FIRST_KEPT_FIELD, to).collect(Collectors.joining(ID_FIELD_SEPARATOR)) : "";
        return marker + ID_FIELD_SEPARATOR + kept;
    }

    /**
     * Lazily filters and renames a stream of records.
     */
    public Stream<SequenceRecord> curate(final Stream<SequenceRecord> records) {
        return records.filter(record -> record.length() > minLength)
                .map(record -> record.renamedWithoutDescription(curatedId(record.getId(), marker)));
    }

    /**
     * Curates {@code input} into {@code output}, replacing any previous content of {@code output}.
     * The result is first written next to {@code output} and moved into place once complete, so a malformed input
     * leaves no partial file behind. Zero surviving records give an empty file.
     *
     * @throws UserException.MalformedSequenceFile if a record of {@code input} cannot be parsed
     */
    public CurationResult curate(final Path input, final Path output) {
        Utils.nonNull(input, "the input cannot be null");
        Utils.nonNull(output, "the output cannot be null");

        final Path directory = output.toAbsolutePath().getParent();
        final Path partial;
        try {
            Files.createDirectories(directory);
            partial = Files.createTempFile(directory, output.getFileName().toString() + ".", ".partial");
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(output, "cannot create its directory or a temporary file", e);
        }

        boolean completed = false;
        long read = 0;
        long kept = 0;
        try (final FastaRecordReader reader = new FastaRecordReader(input);
             final FastaRecordWriter writer = new FastaRecordWriter(partial)) {
            final Iterator<SequenceRecord> records = reader.iterator();
            while (records.hasNext()) {
                final SequenceRecord record = records.next();
                read++;
                if (record.length() > minLength) {
                    writer.write(record.renamedWithoutDescription(curatedId(record.getId(), marker)));
                    kept++;
                }
            }
            completed = true;
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(output, "writing the curated contigs failed", e);
        } finally {
            if (!completed) {
                deleteQuietly(partial);
            }
        }

        moveIntoPlace(partial, output);
        logger.info(String.format("Kept %d of %d contigs longer than %d bp in %s", kept, read, minLength, output.getFileName()));
        return new CurationResult(read, kept);
    }

    private static void moveIntoPlace(final Path partial, final Path output) {
        try {
            try {
                Files.move(partial, output, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (final AtomicMoveNotSupportedException e) {
                Files.move(partial, output, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (final IOException e) {
            deleteQuietly(partial);
            throw new UserException.CouldNotCreateOutputFile(output, "cannot move the curated contigs into place", e);
        }
    }

    private static void deleteQuietly(final Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (final IOException e) {
            logger.warn("Could not delete temporary file " + path, e);
        }
    }

    /**
     * Record counts of one curation.
     */
    public static final class CurationResult {
        private final long recordsRead;
        private final long recordsKept;

        CurationResult(final long recordsRead, final long recordsKept) {
            this.recordsRead = recordsRead;
            this.recordsKept = recordsKept;
        }

        public long getRecordsRead() {
            return recordsRead;
        }

        public long getRecordsKept() {
            return recordsKept;
        }
    }
}
