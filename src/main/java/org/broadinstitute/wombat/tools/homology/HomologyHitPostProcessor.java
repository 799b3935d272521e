package org.broadinstitute.wombat.tools.homology;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.wombat.exceptions.UserException;
import org.broadinstitute.wombat.utils.Utils;
import org.broadinstitute.wombat.utils.tsv.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Filters a tabular protein-against-contigs hit table by percent identity and adds the query length and protein
 * coverage of each remaining hit.
 * <p>
 * Input: a tab-separated table with a header line, as written by the homology search stage (tblastn
 * {@code -outfmt 6} rows under the field names). Rows whose {@value #PERCENT_IDENTITY_COLUMN} is at or below the
 * threshold are dropped. Each surviving row gets two columns inserted right after {@value #SUBJECT_ID_COLUMN}:
 * {@value #QUERY_LENGTH_COLUMN}, looked up in a {@link ProteinLengthIndex}, and {@value #PROTEIN_COVERAGE_COLUMN},
 * {@code (qend - qstart + 1) / qlen * 100}. Coverage above 100 is kept as is. Other values are copied verbatim.
 * </p>
 * <p>
 * A query id missing from the index is a data error; nothing is written in that case.
 * </p>
 */
public final class HomologyHitPostProcessor {
    private static final Logger logger = LogManager.getLogger(HomologyHitPostProcessor.class);

    public static final double DEFAULT_MIN_PERCENT_IDENTITY = 50.0;

    public static final String FILTERED_TABLE_FILE_NAME = "BLAST_results_filtered.tab";

    public static final String QUERY_ID_COLUMN = "qseqid";
    public static final String SUBJECT_ID_COLUMN = "sseqid";
    public static final String PERCENT_IDENTITY_COLUMN = "pident";
    public static final String QUERY_START_COLUMN = "qstart";
    public static final String QUERY_END_COLUMN = "qend";
    public static final String QUERY_LENGTH_COLUMN = "qlen";
    public static final String PROTEIN_COVERAGE_COLUMN = "pcov";

    public static final TableColumnCollection MANDATORY_COLUMNS = new TableColumnCollection(
            QUERY_ID_COLUMN, SUBJECT_ID_COLUMN, PERCENT_IDENTITY_COLUMN, QUERY_START_COLUMN, QUERY_END_COLUMN);

    private final ProteinLengthIndex proteinLengths;
    private final double minPercentIdentity;

    public HomologyHitPostProcessor(final ProteinLengthIndex proteinLengths) {
        this(proteinLengths, DEFAULT_MIN_PERCENT_IDENTITY);
    }

    public HomologyHitPostProcessor(final ProteinLengthIndex proteinLengths, final double minPercentIdentity) {
        this.proteinLengths = Utils.nonNull(proteinLengths, "the protein length index cannot be null");
        Utils.validateArg(minPercentIdentity >= 0 && minPercentIdentity <= 100,
                () -> "the identity threshold must be between 0 and 100: " + minPercentIdentity);
        this.minPercentIdentity = minPercentIdentity;
    }

    /**
     * @return the coverage in percent of a protein of length {@code queryLength} by the 1-based inclusive query interval
     */
    public static double proteinCoverage(final int queryStart, final int queryEnd, final int queryLength) {
        Utils.validateArg(queryLength > 0, "the query length must be positive");
        return (queryEnd - queryStart + 1) / (double) queryLength * 100;
    }

    /**
     * Reads {@code hitTable}, then writes the enriched table to {@code output}, replacing it.
     *
     * @return the number of rows read and written
     * @throws UserException.BadInput if the table is malformed or refers to an unknown protein
     */
    public PostProcessingResult process(final Path hitTable, final Path output) {
        Utils.nonNull(hitTable, "the hit table cannot be null");
        Utils.nonNull(output, "the output cannot be null");

        final List<String[]> kept = new ArrayList<>();
        final long[] rowsRead = {0};
        final TableColumnCollection outputColumns;
        try (final TableReader<String[]> reader = TableUtils.reader(hitTable, (columns, formatExceptionFactory) -> {
            TableUtils.checkMandatoryColumns(columns, MANDATORY_COLUMNS, formatExceptionFactory);
            return dataLine -> {
                rowsRead[0]++;
                return enrich(dataLine);
            };
        })) {
            outputColumns = outputColumns(reader.columns());
            reader.stream().forEach(kept::add);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(hitTable, e);
        }

        try {
            Files.createDirectories(output.toAbsolutePath().getParent());
            try (final TableWriter<String[]> writer = TableUtils.writer(Files.newBufferedWriter(output), outputColumns,
                    (values, dataLine) -> dataLine.append(values))) {
                writer.writeAllRecords(kept);
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(output, "cannot write the filtered hits", e);
        }
        logger.info(String.format("Kept %d of %d hits with %s above %s", kept.size(), rowsRead[0], PERCENT_IDENTITY_COLUMN, minPercentIdentity));
        return new PostProcessingResult(rowsRead[0], kept.size());
    }

    /**
     * @return the output values of a row, or {@code null} when the row is filtered out
     */
    private String[] enrich(final DataLine dataLine) {
        if (dataLine.getDouble(PERCENT_IDENTITY_COLUMN) <= minPercentIdentity) {
            return null;
        }
        final String queryId = dataLine.get(QUERY_ID_COLUMN);
        final OptionalInt queryLength = proteinLengths.lengthOf(queryId);
        if (!queryLength.isPresent()) {
            throw dataLine.formatException("query " + queryId + " is not in the protein database");
        }
        if (queryLength.getAsInt() == 0) {
            throw dataLine.formatException("query " + queryId + " has length zero in the protein database");
        }
        final double coverage = proteinCoverage(dataLine.getInt(QUERY_START_COLUMN), dataLine.getInt(QUERY_END_COLUMN),
                queryLength.getAsInt());

        final String[] values = dataLine.toArray();
        final int insertAt = dataLine.columns().indexOf(SUBJECT_ID_COLUMN) + 1;
        final String[] result = new String[values.length + 2];
        System.arraycopy(values, 0, result, 0, insertAt);
        result[insertAt] = Integer.toString(queryLength.getAsInt());
        result[insertAt + 1] = Double.toString(coverage);
        System.arraycopy(values, insertAt, result, insertAt + 2, values.length - insertAt);
        return result;
    }

    static TableColumnCollection outputColumns(final TableColumnCollection inputColumns) {
        final List<String> names = new ArrayList<>(inputColumns.names());
        final int insertAt = names.indexOf(SUBJECT_ID_COLUMN) + 1;
        names.add(insertAt, PROTEIN_COVERAGE_COLUMN);
        names.add(insertAt, QUERY_LENGTH_COLUMN);
        return new TableColumnCollection(names);
    }

    public static final class PostProcessingResult {
        private final long rowsRead;
        private final long rowsWritten;

        PostProcessingResult(final long rowsRead, final long rowsWritten) {
            this.rowsRead = rowsRead;
            this.rowsWritten = rowsWritten;
        }

        public long getRowsRead() {
            return rowsRead;
        }

        public long getRowsWritten() {
            return rowsWritten;
        }
    }
}
