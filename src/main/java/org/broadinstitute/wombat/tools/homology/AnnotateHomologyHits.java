package org.broadinstitute.wombat.tools.homology;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.wombat.cmdline.CommandLineProgram;
import org.broadinstitute.wombat.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.wombat.cmdline.programgroups.AssemblyPipelineProgramGroup;

import java.io.File;
import java.nio.file.Path;

/**
 * Filters a tabular tblastn result by percent identity and adds the query length and protein coverage of each hit.
 * The result is written to {@value HomologyHitPostProcessor#FILTERED_TABLE_FILE_NAME} in the output directory.
 *
 * Sample Usage:
 *
 * wombat AnnotateHomologyHits \
 *   -I BLAST_results.tab \
 *   --protein-database proteins.faa \
 *   -O BLAST_homology_search
 */
@CommandLineProgramProperties(
        summary = "Drops protein hits at or below an identity threshold and adds query length and coverage columns",
        oneLineSummary = "Filter protein hits and compute their coverage",
        programGroup = AssemblyPipelineProgramGroup.class
)
public final class AnnotateHomologyHits extends CommandLineProgram {

    @Argument(fullName = StandardArgumentDefinitions.INPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
            doc = "Tab-separated hit table with a header line")
    public File input;

    @Argument(fullName = StandardArgumentDefinitions.PROTEIN_DATABASE_LONG_NAME,
            doc = "FASTA file of the query proteins")
    public File proteinDatabase;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Output directory")
    public File outputDirectory;

    @Argument(fullName = StandardArgumentDefinitions.MIN_PERCENT_IDENTITY_LONG_NAME,
            doc = "Hits with this percent identity or less are dropped",
            optional = true)
    public double minPercentIdentity = HomologyHitPostProcessor.DEFAULT_MIN_PERCENT_IDENTITY;

    @Override
    protected String[] customCommandLineValidation() {
        if (minPercentIdentity < 0 || minPercentIdentity > 100) {
            return new String[]{"--" + StandardArgumentDefinitions.MIN_PERCENT_IDENTITY_LONG_NAME + " must be between 0 and 100"};
        }
        return null;
    }

    @Override
    protected Object doWork() {
        final Path output = outputDirectory.toPath().resolve(HomologyHitPostProcessor.FILTERED_TABLE_FILE_NAME);
        final HomologyHitPostProcessor processor = new HomologyHitPostProcessor(
                ProteinLengthIndex.fromFasta(proteinDatabase.toPath()), minPercentIdentity);
        final HomologyHitPostProcessor.PostProcessingResult result = processor.process(input.toPath(), output);
        logger.info(String.format("Wrote %d hits to %s", result.getRowsWritten(), output));
        return result.getRowsWritten();
    }
}
