package org.broadinstitute.wombat.engine;

import org.broadinstitute.wombat.engine.layout.ArtifactLayout;
import org.broadinstitute.wombat.exceptions.UserException;
import org.broadinstitute.wombat.utils.Utils;
import org.broadinstitute.wombat.utils.tsv.DataLine;
import org.broadinstitute.wombat.utils.tsv.TableColumnCollection;
import org.broadinstitute.wombat.utils.tsv.TableReader;
import org.broadinstitute.wombat.utils.tsv.TableUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads the tab-separated sample manifest: a header naming at least the columns {@value #FORWARD_READS_COLUMN},
 * {@value #REVERSE_READS_COLUMN} and {@value #SAMPLE_ID_COLUMN}, then one row per sample. Read paths are resolved
 * against the manifest's directory when relative.
 * <p>
 * Every problem is reported as {@link UserException.MalformedManifest} before any stage runs.
 * </p>
 */
public final class SampleManifest {

    public static final String FORWARD_READS_COLUMN = "Read1";
    public static final String REVERSE_READS_COLUMN = "Read2";
    public static final String SAMPLE_ID_COLUMN = "Samples";

    public static final TableColumnCollection MANDATORY_COLUMNS =
            new TableColumnCollection(FORWARD_READS_COLUMN, REVERSE_READS_COLUMN, SAMPLE_ID_COLUMN);

    /**
     * Pseudo-sample id under which the optional reference genome is annotated.
     */
    public static final String REFERENCE_SAMPLE_ID = "Reference";

    private SampleManifest() {}

    /**
     * @return the samples in manifest order
     */
    public static List<Sample> read(final Path manifest) {
        Utils.nonNull(manifest, "the manifest path cannot be null");
        if (!Files.isReadable(manifest)) {
            throw new UserException.CouldNotReadInputFile(manifest, "the sample manifest does not exist or is not readable");
        }
        final Path baseDirectory = manifest.toAbsolutePath().getParent();

        final List<Sample> samples;
        try (final TableReader<Sample> reader = new TableReader<Sample>(manifest) {
            @Override
            protected void processColumns(final TableColumnCollection columns) {
                TableUtils.checkMandatoryColumns(columns, MANDATORY_COLUMNS, this::formatException);
            }

            @Override
            protected Sample createRecord(final DataLine dataLine) {
                final String sampleId = required(dataLine, SAMPLE_ID_COLUMN);
                return new Sample(sampleId,
                        baseDirectory.resolve(required(dataLine, FORWARD_READS_COLUMN)),
                        baseDirectory.resolve(required(dataLine, REVERSE_READS_COLUMN)));
            }
        }) {
            samples = reader.toList();
        } catch (final UserException.BadInput e) {
            throw new UserException.MalformedManifest(manifest, e.getMessage(), e);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(manifest, e);
        }

        validate(manifest, samples);
        return Collections.unmodifiableList(samples);
    }

    private static String required(final DataLine dataLine, final String column) {
        final String value = dataLine.get(column).trim();
        if (value.isEmpty()) {
            throw dataLine.formatException("empty value in column " + column);
        }
        return value;
    }

    private static void validate(final Path manifest, final List<Sample> samples) {
        if (samples.isEmpty()) {
            throw new UserException.MalformedManifest(manifest, "no samples listed");
        }
        final Map<String, String> seenIgnoringCase = new HashMap<>();
        for (final Sample sample : samples) {
            final String id = sample.getId();
            try {
                ArtifactLayout.validateSampleId(id);
            } catch (final UserException.InvalidSampleIdentifier e) {
                throw new UserException.MalformedManifest(manifest, e.getMessage(), e);
            }
            if (id.equalsIgnoreCase(REFERENCE_SAMPLE_ID)) {
                throw new UserException.MalformedManifest(manifest,
                        String.format("sample id '%s' is reserved for the reference genome", id));
            }
            final String previous = seenIgnoringCase.put(id.toLowerCase(Locale.ROOT), id);
            if (previous != null) {
                throw new UserException.MalformedManifest(manifest, previous.equals(id) ?
                        String.format("duplicate sample id '%s'", id) :
                        String.format("sample ids '%s' and '%s' differ only in case", previous, id));
            }
            for (final Path reads : Arrays.asList(sample.getForwardReads(), sample.getReverseReads())) {
                if (!Files.isRegularFile(reads)) {
                    throw new UserException.MalformedManifest(manifest,
                            String.format("read file %s of sample '%s' does not exist", reads, id));
                }
            }
        }
    }
}
