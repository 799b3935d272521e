package org.broadinstitute.wombat.tools.pipeline;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.wombat.engine.PipelineParameters;
import org.broadinstitute.wombat.engine.RunContext;
import org.broadinstitute.wombat.engine.Sample;
import org.broadinstitute.wombat.engine.SampleManifest;
import org.broadinstitute.wombat.engine.layout.ArtifactLayout;
import org.broadinstitute.wombat.engine.layout.ArtifactRole;
import org.broadinstitute.wombat.engine.layout.Stage;
import org.broadinstitute.wombat.engine.tools.ExternalToolRunner;
import org.broadinstitute.wombat.engine.tools.StageExecutor;
import org.broadinstitute.wombat.engine.tools.ToolCommands;
import org.broadinstitute.wombat.engine.tools.ToolInvocation;
import org.broadinstitute.wombat.exceptions.StageFailedException;
import org.broadinstitute.wombat.exceptions.UserException;
import org.broadinstitute.wombat.exceptions.WombatException;
import org.broadinstitute.wombat.tools.curation.ContigCurator;
import org.broadinstitute.wombat.tools.curation.FilteredReadReclassifier;
import org.broadinstitute.wombat.tools.curation.ReadFileRoleRegistry;
import org.broadinstitute.wombat.tools.homology.HomologyHitPostProcessor;
import org.broadinstitute.wombat.tools.homology.ProteinLengthIndex;
import org.broadinstitute.wombat.tools.pipeline.PipelineResult.SampleResult;
import org.broadinstitute.wombat.tools.pipeline.annotation.Annotator;
import org.broadinstitute.wombat.tools.pipeline.annotation.Annotators;
import org.broadinstitute.wombat.utils.Utils;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Drives a whole run.
 * <p>
 * Phase one takes every sample through trim, filter, assemble, curate_contigs, stats and annotate, on up to
 * {@link RunContext#getSampleParallelism()} worker threads. Any failure ends that sample's chain; no new chain
 * starts after a failure, the running ones finish, and the first failure in manifest order is rethrown. The
 * reference genome, if any, is then annotated as the pseudo-sample {@value SampleManifest#REFERENCE_SAMPLE_ID}.
 * </p>
 * <p>
 * Phase two starts only once every chain is annotated, and runs the cross-sample stages in order: typing, the
 * virulence and resistance scans, the optional homology search, the pan-genome and its plots.
 * </p>
 * <p>
 * A sample whose completion marker exists is not run again when resuming. Without resume the output root must be
 * missing or empty.
 * </p>
 */
public final class PipelineOrchestrator {
    private static final Logger logger = LogManager.getLogger(PipelineOrchestrator.class);

    /**
     * States a sample chain goes through, one transition per per-sample stage.
     */
    public enum SampleState {
        RAW, TRIMMED, FILTERED, ASSEMBLED, CURATED, STATS_DONE, ANNOTATED
    }

    /**
     * Field names of tblastn's default tabular format, used when the configured format lists none.
     */
    @VisibleForTesting
    static final List<String> DEFAULT_HIT_FIELDS = Collections.unmodifiableList(Arrays.asList(
            "qseqid", "sseqid", "pident", "length", "mismatch", "gapopen",
            "qstart", "qend", "sstart", "send", "evalue", "bitscore"));

    private static final List<Stage> PER_SAMPLE_STAGES = Collections.unmodifiableList(Arrays.stream(Stage.values())
            .filter(Stage::isPerSample).collect(Collectors.toList()));

    private final RunContext context;
    private final ArtifactLayout layout;
    private final PipelineParameters parameters;
    private final StageExecutor executor;
    private final Annotator annotator;
    private final ContigCurator curator;
    private final FilteredReadReclassifier reclassifier;

    public PipelineOrchestrator(final RunContext context, final ExternalToolRunner runner) {
        this.context = Utils.nonNull(context, "the run context cannot be null");
        this.layout = context.getLayout();
        this.parameters = context.getParameters();
        this.executor = new StageExecutor(runner);
        this.annotator = Annotators.create(context.getAnnotatorVariant(), layout, parameters);
        this.curator = new ContigCurator(parameters.getContigMinLength(), parameters.getContigMarker());
        this.reclassifier = new FilteredReadReclassifier(ReadFileRoleRegistry.PRINSEQ);
    }

    /**
     * Runs both phases over {@code samples}, in the given order.
     *
     * @throws StageFailedException if a tool fails or does not produce its output
     * @throws UserException if the output tree cannot be used or the data is malformed
     */
    public PipelineResult run(final List<Sample> samples) {
        Utils.nonEmpty(samples, "there must be at least one sample");
        final Set<String> ids = new HashSet<>();
        for (final Sample sample : samples) {
            ArtifactLayout.validateSampleId(sample.getId());
            Utils.validateArg(ids.add(sample.getId()), () -> "duplicate sample id " + sample.getId());
        }
        prepareOutputRoot();

        logger.info(String.format("Processing %d samples with %s, %d at a time", samples.size(),
                annotator.getVariant().getConfigName(), context.getSampleParallelism()));
        final List<SampleResult> sampleResults = runSampleChains(samples);
        final SampleResult reference = context.getAuxiliaryFiles().getReferenceGenome()
                .map(this::annotateReference)
                .orElse(null);

        final Map<ArtifactRole, Path> reports = runCrossSampleStages(sampleResults, reference);
        final PipelineResult result = new PipelineResult(layout.getRoot(), sampleResults, reference, reports);
        logger.info("Pipeline finished. " + result);
        return result;
    }

    private void prepareOutputRoot() {
        final Path root = layout.getRoot();
        try {
            if (Files.isDirectory(root) && !context.isResume()) {
                try (final Stream<Path> entries = Files.list(root)) {
                    if (entries.findAny().isPresent()) {
                        throw new UserException.OutputDirectoryExists(root);
                    }
                }
            }
            Files.createDirectories(root);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(root, "cannot create the output directory", e);
        }
    }

    private List<SampleResult> runSampleChains(final List<Sample> samples) {
        final ExecutorService pool = Executors.newFixedThreadPool(context.getSampleParallelism(),
                new ThreadFactoryBuilder().setNameFormat("WombatSample-%d").setDaemon(true).build());
        final AtomicBoolean failed = new AtomicBoolean(false);
        try {
            final List<Future<SampleResult>> futures = new ArrayList<>(samples.size());
            for (final Sample sample : samples) {
                futures.add(pool.submit(() -> {
                    if (failed.get()) {
                        logger.info(String.format("Not starting sample %s after an earlier failure", sample.getId()));
                        return null;
                    }
                    try {
                        return processSample(sample);
                    } catch (final RuntimeException e) {
                        failed.set(true);
                        logger.error(e.getMessage());
                        throw e;
                    }
                }));
            }

            final List<SampleResult> results = new ArrayList<>(samples.size());
            RuntimeException firstFailure = null;
            for (final Future<SampleResult> future : futures) {
                try {
                    results.add(future.get());
                } catch (final ExecutionException e) {
                    if (firstFailure == null) {
                        firstFailure = e.getCause() instanceof RuntimeException ?
                                (RuntimeException) e.getCause() : new WombatException("sample chain failed", e.getCause());
                    }
                }
            }
            if (firstFailure != null) {
                throw firstFailure;
            }
            return results;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WombatException("interrupted while waiting for the sample chains", e);
        } finally {
            pool.shutdownNow();
        }
    }

    @VisibleForTesting
    SampleResult processSample(final Sample sample) {
        final String id = sample.getId();
        final Path marker = layout.pathFor(Stage.ANNOTATE, id, ArtifactRole.COMPLETION_MARKER);
        final Path curated = layout.pathFor(Stage.CURATE_CONTIGS, id, ArtifactRole.CONTIGS_CURATED);
        final Path annotation = layout.pathFor(Stage.ANNOTATE, id, ArtifactRole.ANNOTATION_GFF);
        if (context.isResume() && Files.isRegularFile(marker) && Files.isRegularFile(curated) && Files.isRegularFile(annotation)) {
            logger.info(String.format("Sample %s is already %s; skipping it", id, stateName(SampleState.ANNOTATED)));
            return new SampleResult(id, curated, annotation, true);
        }

        SampleState state = SampleState.RAW;
        final Map<ArtifactRole, Path> trimmed = trim(sample);
        state = advance(id, state, SampleState.TRIMMED);
        final Map<ArtifactRole, Path> filtered = filter(id, trimmed);
        state = advance(id, state, SampleState.FILTERED);
        final Path assembled = assemble(id, filtered);
        state = advance(id, state, SampleState.ASSEMBLED);
        curate(id, assembled, curated);
        state = advance(id, state, SampleState.CURATED);
        computeStatistics(id, curated);
        state = advance(id, state, SampleState.STATS_DONE);
        final Path record = annotate(id, curated);
        advance(id, state, SampleState.ANNOTATED);
        return new SampleResult(id, curated, record, false);
    }

    private static SampleState advance(final String sampleId, final SampleState from, final SampleState to) {
        Utils.validate(to.ordinal() == from.ordinal() + 1, () -> "illegal transition from " + from + " to " + to);
        logger.debug(String.format("Sample %s is now %s", sampleId, stateName(to)));
        return to;
    }

    private static String stateName(final SampleState state) {
        return state.name().toLowerCase(Locale.ROOT);
    }

    private void startStep(final Stage stage, final String sampleId) {
        final int step = PER_SAMPLE_STAGES.indexOf(stage) + 1;
        logger.info(String.format("Step %d for sample %s: %s", step, sampleId, stage.getName()));
        createDirectory(layout.directoryFor(stage, sampleId));
    }

    private void startStep(final Stage stage) {
        logger.info(String.format("Step %d: %s", stage.ordinal() + 1, stage.getName()));
        createDirectory(layout.directoryFor(stage));
    }

    private static void createDirectory(final Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(directory, "cannot create the stage directory", e);
        }
    }

    private Map<ArtifactRole, Path> trim(final Sample sample) {
        final String id = sample.getId();
        startStep(Stage.TRIM, id);
        final Path forwardPaired = layout.pathFor(Stage.TRIM, id, ArtifactRole.R1_PAIRED);
        final Path reversePaired = layout.pathFor(Stage.TRIM, id, ArtifactRole.R2_PAIRED);
        if (parameters.isTrimmingEnabled()) {
            executor.run(Stage.TRIM, id, ToolCommands.trimmomatic(parameters,
                    sample.getForwardReads(), sample.getReverseReads(),
                    forwardPaired, layout.pathFor(Stage.TRIM, id, ArtifactRole.R1_UNPAIRED),
                    reversePaired, layout.pathFor(Stage.TRIM, id, ArtifactRole.R2_UNPAIRED),
                    context.getAuxiliaryFiles().getAdapters().get()));
        } else {
            logger.info(String.format("Trimming is disabled; using the raw reads of sample %s", id));
            try {
                Files.copy(sample.getForwardReads(), forwardPaired, StandardCopyOption.REPLACE_EXISTING);
                Files.copy(sample.getReverseReads(), reversePaired, StandardCopyOption.REPLACE_EXISTING);
            } catch (final IOException e) {
                throw new StageFailedException(Stage.TRIM, id, "cannot copy the raw reads", e);
            }
        }
        final Map<ArtifactRole, Path> result = new EnumMap<>(ArtifactRole.class);
        result.put(ArtifactRole.R1_PAIRED, StageExecutor.requireArtifact(Stage.TRIM, id, forwardPaired));
        result.put(ArtifactRole.R2_PAIRED, StageExecutor.requireArtifact(Stage.TRIM, id, reversePaired));
        return result;
    }

    private Map<ArtifactRole, Path> filter(final String id, final Map<ArtifactRole, Path> trimmed) {
        startStep(Stage.FILTER, id);
        executor.run(Stage.FILTER, id, ToolCommands.prinseq(parameters,
                trimmed.get(ArtifactRole.R1_PAIRED), trimmed.get(ArtifactRole.R2_PAIRED),
                layout.pathFor(Stage.FILTER, id, ArtifactRole.FILTER_LOG)));
        final Map<ArtifactRole, Path> filtered = reclassifier.reclassify(layout.directoryFor(Stage.TRIM, id), id,
                layout.directoryFor(Stage.FILTER, id));
        for (final ArtifactRole role : ReadFileRoleRegistry.PRINSEQ.getRoles()) {
            if (!filtered.containsKey(role)) {
                throw new StageFailedException(Stage.FILTER, id, "no filtered reads were found for role " + role.getName());
            }
        }
        return filtered;
    }

    private Path assemble(final String id, final Map<ArtifactRole, Path> filtered) {
        startStep(Stage.ASSEMBLE, id);
        executor.run(Stage.ASSEMBLE, id, ToolCommands.spades(parameters,
                filtered.get(ArtifactRole.R1_PAIRED), filtered.get(ArtifactRole.R2_PAIRED),
                layout.directoryFor(Stage.ASSEMBLE, id)));
        return StageExecutor.requireArtifact(Stage.ASSEMBLE, id, layout.pathFor(Stage.ASSEMBLE, id, ArtifactRole.CONTIGS_RAW));
    }

    private void curate(final String id, final Path assembled, final Path curated) {
        startStep(Stage.CURATE_CONTIGS, id);
        curator.curate(assembled, curated);
    }

    private void computeStatistics(final String id, final Path curated) {
        startStep(Stage.STATS, id);
        executor.run(Stage.STATS, id, ToolCommands.quast(parameters, curated, layout.directoryFor(Stage.STATS, id)));
        StageExecutor.requireArtifact(Stage.STATS, id, layout.pathFor(Stage.STATS, id, ArtifactRole.STATS_REPORT));
    }

    /**
     * Annotates and writes the completion marker once the record is in place.
     */
    private Path annotate(final String id, final Path contigs) {
        startStep(Stage.ANNOTATE, id);
        final Path record = annotator.annotate(id, contigs, executor);
        final Path marker = layout.pathFor(Stage.ANNOTATE, id, ArtifactRole.COMPLETION_MARKER);
        try {
            Files.write(marker, (record.getFileName() + System.lineSeparator()).getBytes(StandardCharsets.UTF_8));
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(marker, "cannot write the completion marker", e);
        }
        return record;
    }

    private SampleResult annotateReference(final Path referenceGenome) {
        final String id = SampleManifest.REFERENCE_SAMPLE_ID;
        final Path marker = layout.pathFor(Stage.ANNOTATE, id, ArtifactRole.COMPLETION_MARKER);
        final Path annotation = layout.pathFor(Stage.ANNOTATE, id, ArtifactRole.ANNOTATION_GFF);
        if (context.isResume() && Files.isRegularFile(marker) && Files.isRegularFile(annotation)) {
            logger.info("The reference genome is already annotated; skipping it");
            return new SampleResult(id, referenceGenome, annotation, true);
        }
        return new SampleResult(id, referenceGenome, annotate(id, referenceGenome), false);
    }

    private Map<ArtifactRole, Path> runCrossSampleStages(final List<SampleResult> samples, final SampleResult reference) {
        final List<Path> contigs = samples.stream().map(SampleResult::getContigs).collect(Collectors.toList());
        final Map<ArtifactRole, Path> reports = new EnumMap<>(ArtifactRole.class);

        startStep(Stage.CROSS_SAMPLE_TYPING);
        reports.put(ArtifactRole.TYPING_REPORT, runReport(Stage.CROSS_SAMPLE_TYPING, ArtifactRole.TYPING_REPORT,
                report -> ToolCommands.mlst(contigs, report)));

        startStep(Stage.CROSS_SAMPLE_VIRULENCE);
        reports.put(ArtifactRole.VIRULENCE_REPORT, runReport(Stage.CROSS_SAMPLE_VIRULENCE, ArtifactRole.VIRULENCE_REPORT,
                report -> ToolCommands.abricate(contigs, parameters.getVirulenceDatabase(), report)));

        startStep(Stage.CROSS_SAMPLE_RESISTANCE);
        reports.put(ArtifactRole.RESISTANCE_REPORT, runReport(Stage.CROSS_SAMPLE_RESISTANCE, ArtifactRole.RESISTANCE_REPORT,
                report -> ToolCommands.abricate(contigs, parameters.getResistanceDatabase(), report)));

        if (context.isHomologySearchEnabled()) {
            startStep(Stage.HOMOLOGY_SEARCH);
            reports.put(ArtifactRole.HOMOLOGY_REPORT, searchHomologs(contigs));
        } else {
            logger.info("The homology search is disabled");
        }

        final List<Path> annotations = samples.stream().map(SampleResult::getAnnotation).collect(Collectors.toCollection(ArrayList::new));
        if (reference != null) {
            annotations.add(reference.getAnnotation());
        }
        reports.putAll(inferPangenome(annotations));
        return reports;
    }

    private Path runReport(final Stage stage, final ArtifactRole role,
                           final Function<Path, ToolInvocation> command) {
        final Path report = layout.pathFor(stage, role);
        executor.run(stage, null, command.apply(report));
        return StageExecutor.requireArtifact(stage, null, report);
    }

    /**
     * Builds a nucleotide database from every sample's contigs, searches it with the reference proteins and
     * post-processes the hits.
     */
    private Path searchHomologs(final List<Path> contigs) {
        final Stage stage = Stage.HOMOLOGY_SEARCH;
        final Path proteins = context.getAuxiliaryFiles().getProteinDatabase().get();
        final Path database = layout.pathFor(stage, ArtifactRole.HOMOLOGY_DATABASE);
        final Path rawHits = layout.pathFor(stage, ArtifactRole.HOMOLOGY_RAW);
        try {
            try (final OutputStream out = Files.newOutputStream(database)) {
                for (final Path contigFile : contigs) {
                    Files.copy(contigFile, out);
                }
            }
            Files.write(rawHits, (String.join("\t", hitTableFields(parameters.getBlastOutputFormat())) + "\n")
                    .getBytes(StandardCharsets.UTF_8));
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(layout.directoryFor(stage), "cannot prepare the homology search inputs", e);
        }

        executor.run(stage, null, ToolCommands.makeBlastDatabase(parameters, database));
        executor.run(stage, null, ToolCommands.tblastn(parameters, proteins, database, rawHits));

        final Path report = layout.pathFor(stage, ArtifactRole.HOMOLOGY_REPORT);
        new HomologyHitPostProcessor(ProteinLengthIndex.fromFasta(proteins), parameters.getMinPercentIdentity())
                .process(rawHits, report);
        return report;
    }

    /**
     * @return the column names of a tabular BLAST output format string such as {@code "6 qseqid sseqid"}
     */
    @VisibleForTesting
    static List<String> hitTableFields(final String outputFormat) {
        final List<String> tokens = Arrays.stream(outputFormat.trim().split("\\s+"))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toList());
        return tokens.size() <= 1 ? DEFAULT_HIT_FIELDS : tokens.subList(1, tokens.size());
    }

    private Map<ArtifactRole, Path> inferPangenome(final List<Path> annotations) {
        final Map<ArtifactRole, Path> reports = new EnumMap<>(ArtifactRole.class);
        logger.info(String.format("Step %d: %s", Stage.PANGENOME.ordinal() + 1, Stage.PANGENOME.getName()));
        final Path pangenomeDirectory = layout.directoryFor(Stage.PANGENOME);
        if (Files.exists(pangenomeDirectory)) {
            logger.info("Removing the previous pan-genome output " + pangenomeDirectory);
            try {
                FileUtils.deleteDirectory(pangenomeDirectory.toFile());
            } catch (final IOException e) {
                throw new UserException.CouldNotCreateOutputFile(pangenomeDirectory, "cannot remove the previous pan-genome output", e);
            }
        }
        executor.run(Stage.PANGENOME, null, ToolCommands.roary(parameters, pangenomeDirectory, annotations));
        final Path matrix = StageExecutor.requireArtifact(Stage.PANGENOME, null,
                layout.pathFor(Stage.PANGENOME, ArtifactRole.PANGENOME_MATRIX));
        final Path tree = StageExecutor.requireArtifact(Stage.PANGENOME, null,
                layout.pathFor(Stage.PANGENOME, ArtifactRole.PANGENOME_TREE));
        reports.put(ArtifactRole.PANGENOME_MATRIX, matrix);
        reports.put(ArtifactRole.PANGENOME_TREE, tree);

        startStep(Stage.PANGENOME_PLOTS);
        executor.run(Stage.PANGENOME_PLOTS, null,
                ToolCommands.roaryPlots(tree, matrix, layout.directoryFor(Stage.PANGENOME_PLOTS)));
        reports.put(ArtifactRole.PANGENOME_PLOTS, StageExecutor.requireArtifact(Stage.PANGENOME_PLOTS, null,
                layout.pathFor(Stage.PANGENOME_PLOTS, ArtifactRole.PANGENOME_PLOTS)));
        return reports;
    }
}
