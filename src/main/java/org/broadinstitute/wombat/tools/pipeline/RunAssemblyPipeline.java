package org.broadinstitute.wombat.tools.pipeline;

import com.google.common.annotations.VisibleForTesting;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.wombat.cmdline.CommandLineProgram;
import org.broadinstitute.wombat.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.wombat.cmdline.programgroups.AssemblyPipelineProgramGroup;
import org.broadinstitute.wombat.engine.*;
import org.broadinstitute.wombat.engine.layout.ArtifactLayout;
import org.broadinstitute.wombat.engine.tools.ExternalToolRunner;
import org.broadinstitute.wombat.engine.tools.ProcessToolRunner;
import org.broadinstitute.wombat.utils.config.WombatConfig;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Assembles and annotates every sample of a manifest, then compares them.
 *
 * <p>Each sample goes through adapter trimming (Trimmomatic), quality filtering (Prinseq), assembly (SPAdes),
 * contig curation, assembly statistics (QUAST) and annotation (Prokka or DFAST). The cross-sample stages then
 * type the samples (mlst), screen them for virulence and resistance genes (ABRicate), optionally search them for
 * the proteins of a reference database (BLAST), and infer and plot their pan-genome (Roary).</p>
 *
 * <p>The sample manifest is a tab-separated table with columns Read1, Read2 and Samples. The auxiliary manifest has a
 * single column, Route, and three rows: the adapter sequences, the reference genome (or NA) and the reference
 * protein database.</p>
 *
 * Sample Usage:
 *
 * wombat RunAssemblyPipeline \
 *   --sample-manifest samples.tsv \
 *   --auxiliary-manifest routes.tsv \
 *   --output run1 \
 *   --annotator prokka
 */
@CommandLineProgramProperties(
        summary = "Runs the assembly and annotation pipeline over every sample of a manifest, then the cross-sample comparisons",
        oneLineSummary = "Assemble, annotate and compare bacterial genomes",
        programGroup = AssemblyPipelineProgramGroup.class
)
public final class RunAssemblyPipeline extends CommandLineProgram {

    @Argument(fullName = StandardArgumentDefinitions.SAMPLE_MANIFEST_LONG_NAME,
            shortName = StandardArgumentDefinitions.SAMPLE_MANIFEST_SHORT_NAME,
            doc = "Tab-separated sample manifest with columns Read1, Read2 and Samples")
    public File sampleManifest;

    @Argument(fullName = StandardArgumentDefinitions.AUXILIARY_MANIFEST_LONG_NAME,
            shortName = StandardArgumentDefinitions.AUXILIARY_MANIFEST_SHORT_NAME,
            doc = "Tab-separated manifest with the adapter, reference genome and protein database routes")
    public File auxiliaryManifest;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Output root directory; defaults to Workflow_OUTPUT_<date>_<time> in the working directory",
            optional = true)
    public File output = null;

    @Argument(fullName = StandardArgumentDefinitions.ANNOTATOR_LONG_NAME,
            doc = "Annotation tool, prokka or dfast; defaults to the configured one",
            optional = true)
    public String annotator = null;

    @Argument(fullName = StandardArgumentDefinitions.RUN_HOMOLOGY_SEARCH_LONG_NAME,
            doc = "Whether to search the contigs for the reference proteins; defaults to the configured value",
            optional = true)
    public Boolean runHomologySearch = null;

    @Argument(fullName = StandardArgumentDefinitions.SAMPLE_PARALLELISM_LONG_NAME,
            doc = "How many samples to process at the same time; defaults to the configured value",
            optional = true)
    public Integer sampleParallelism = null;

    @Argument(fullName = StandardArgumentDefinitions.RESUME_LONG_NAME,
            doc = "Reuse an existing output directory, skipping the samples that were already annotated",
            optional = true)
    public boolean resume = false;

    private ExternalToolRunner toolRunner = new ProcessToolRunner();

    @VisibleForTesting
    void setToolRunner(final ExternalToolRunner toolRunner) {
        this.toolRunner = toolRunner;
    }

    @Override
    protected String[] customCommandLineValidation() {
        if (sampleParallelism != null && sampleParallelism < 1) {
            return new String[]{"--" + StandardArgumentDefinitions.SAMPLE_PARALLELISM_LONG_NAME + " must be at least 1"};
        }
        return null;
    }

    @Override
    protected Object doWork() {
        final WombatConfig config = getConfig();
        final PipelineParameters parameters = new PipelineParameters(config);
        final boolean homologySearch = runHomologySearch != null ? runHomologySearch : config.homology_enabled();
        final AnnotatorVariant variant = AnnotatorVariant.fromConfigName(annotator != null ? annotator : config.annotator());
        final int parallelism = sampleParallelism != null ? sampleParallelism : config.pipeline_sample_parallelism();

        final List<Sample> samples = SampleManifest.read(sampleManifest.toPath());
        final AuxiliaryFiles auxiliaryFiles = AuxiliaryFiles.read(auxiliaryManifest.toPath(),
                parameters.isTrimmingEnabled(), homologySearch);
        final Path root = output != null ? output.toPath() :
                ArtifactLayout.defaultRoot(Paths.get("").toAbsolutePath(), LocalDateTime.now());
        logger.info(String.format("Read %d samples from %s; writing to %s", samples.size(), sampleManifest, root));

        final RunContext context = new RunContext(new ArtifactLayout(root), variant, homologySearch, parallelism, resume,
                auxiliaryFiles, parameters);
        return new PipelineOrchestrator(context, toolRunner).run(samples);
    }
}
