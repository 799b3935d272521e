package org.broadinstitute.wombat.tools.homology;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.wombat.utils.Utils;
import org.broadinstitute.wombat.utils.fasta.FastaRecordReader;
import org.broadinstitute.wombat.utils.fasta.SequenceRecord;

import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Sequence lengths of a protein database keyed by sequence id (the header up to the first whitespace).
 */
public final class ProteinLengthIndex {
    private static final Logger logger = LogManager.getLogger(ProteinLengthIndex.class);

    private final Map<String, Integer> lengths;

    public ProteinLengthIndex(final Map<String, Integer> lengths) {
        Utils.nonNull(lengths, "the length map cannot be null");
        this.lengths = Collections.unmodifiableMap(new HashMap<>(lengths));
    }

    /**
     * Parses {@code fasta} once. When an id repeats, the last record wins.
     */
    public static ProteinLengthIndex fromFasta(final Path fasta) {
        final Map<String, Integer> lengths = new HashMap<>();
        try (final FastaRecordReader reader = new FastaRecordReader(fasta)) {
            for (final SequenceRecord record : reader) {
                if (lengths.put(record.getId(), record.length()) != null) {
                    logger.warn(String.format("Protein id %s appears more than once in %s; using the last one", record.getId(), fasta));
                }
            }
        }
        logger.debug(String.format("Indexed %d protein lengths from %s", lengths.size(), fasta));
        return new ProteinLengthIndex(lengths);
    }

    public OptionalInt lengthOf(final String id) {
        final Integer length = lengths.get(id);
        return length == null ? OptionalInt.empty() : OptionalInt.of(length);
    }

    public boolean contains(final String id) {
        return lengths.containsKey(id);
    }

    public int size() {
        return lengths.size();
    }
}
