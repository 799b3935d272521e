package org.broadinstitute.wombat.tools.curation;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.wombat.cmdline.CommandLineProgram;
import org.broadinstitute.wombat.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.wombat.cmdline.programgroups.AssemblyPipelineProgramGroup;

import java.io.File;

/**
 * Drops the contigs of an assembly that are not longer than a minimum length and shortens the names of the others.
 *
 * Sample Usage:
 *
 * wombat CurateContigs \
 *   -I contigs.fasta \
 *   -O S1_contigs.fasta \
 *   --min-contig-length 200
 */
@CommandLineProgramProperties(
        summary = "Filters assembled contigs by length and renames them to <marker>_<number>_length_<length>",
        oneLineSummary = "Filter and rename assembled contigs",
        programGroup = AssemblyPipelineProgramGroup.class
)
public final class CurateContigs extends CommandLineProgram {

    @Argument(fullName = StandardArgumentDefinitions.INPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
            doc = "Assembled contigs in FASTA format")
    public File input;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Curated contigs output; replaced if it exists")
    public File output;

    @Argument(fullName = StandardArgumentDefinitions.MIN_CONTIG_LENGTH_LONG_NAME,
            doc = "Contigs must be longer than this to be kept; defaults to the configured value",
            optional = true)
    public Integer minContigLength = null;

    @Argument(fullName = StandardArgumentDefinitions.CONTIG_MARKER_LONG_NAME,
            doc = "Prefix of the new contig names; defaults to the configured value",
            optional = true)
    public String contigMarker = null;

    @Override
    protected String[] customCommandLineValidation() {
        if (minContigLength != null && minContigLength < 0) {
            return new String[]{"--" + StandardArgumentDefinitions.MIN_CONTIG_LENGTH_LONG_NAME + " cannot be negative"};
        }
        return null;
    }

    @Override
    protected Object doWork() {
        final ContigCurator curator = new ContigCurator(
                minContigLength != null ? minContigLength : getConfig().contigs_min_length(),
                contigMarker != null ? contigMarker : getConfig().contigs_marker());
        return curator.curate(input.toPath(), output.toPath()).getRecordsKept();
    }
}
