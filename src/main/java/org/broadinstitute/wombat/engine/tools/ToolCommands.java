package org.broadinstitute.wombat.engine.tools;

import org.broadinstitute.wombat.engine.PipelineParameters;
import org.broadinstitute.wombat.utils.Utils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Argument lists of the external programs driven by the pipeline. Only builds {@link ToolInvocation}s; nothing is run.
 */
public final class ToolCommands {

    public static final String TRIMMOMATIC = "trimmomatic";
    public static final String PRINSEQ = "prinseq-lite.pl";
    public static final String SPADES = "spades.py";
    public static final String QUAST = "quast";
    public static final String MLST = "mlst";
    public static final String ABRICATE = "abricate";
    public static final String PROKKA = "prokka";
    public static final String DFAST = "dfast";
    public static final String MAKEBLASTDB = "makeblastdb";
    public static final String TBLASTN = "tblastn";
    public static final String ROARY = "roary";
    public static final String ROARY_PLOTS = "roary_plots.py";

    private ToolCommands() {}

    /**
     * Paired-end adapter and quality trimming.
     */
    public static ToolInvocation trimmomatic(final PipelineParameters parameters,
                                             final Path forwardReads, final Path reverseReads,
                                             final Path forwardPaired, final Path forwardUnpaired,
                                             final Path reversePaired, final Path reverseUnpaired,
                                             final Path adapters) {
        return ToolInvocation.of(TRIMMOMATIC, "PE", parameters.getTrimmingPhred(),
                str(forwardReads), str(reverseReads),
                str(forwardPaired), str(forwardUnpaired), str(reversePaired), str(reverseUnpaired),
                "ILLUMINACLIP:" + adapters + ":" + parameters.getTrimmingIlluminaClip());
    }

    /**
     * Quality filtering of the trimmed read pairs. Prinseq writes its outputs next to its inputs.
     */
    public static ToolInvocation prinseq(final PipelineParameters parameters,
                                         final Path forwardReads, final Path reverseReads, final Path logFile) {
        return ToolInvocation.of(PRINSEQ, "-verbose",
                "-fastq", str(forwardReads),
                "-fastq2", str(reverseReads),
                "-min_len", Integer.toString(parameters.getPrinseqMinLength()),
                "-min_qual_mean", Integer.toString(parameters.getPrinseqMinQualityMean()),
                "-trim_qual_right", Integer.toString(parameters.getPrinseqTrimQualityRight()),
                "-trim_qual_window", Integer.toString(parameters.getPrinseqTrimQualityWindow()),
                "-trim_qual_type", parameters.getPrinseqTrimQualityType(),
                "-out_format", Integer.toString(parameters.getPrinseqOutFormat()),
                "-out_bad", parameters.getPrinseqOutBad(),
                "-log", str(logFile));
    }

    public static ToolInvocation spades(final PipelineParameters parameters,
                                        final Path forwardReads, final Path reverseReads, final Path outputDirectory) {
        final List<String> arguments = new ArrayList<>(Arrays.asList("-1", str(forwardReads), "-2", str(reverseReads)));
        if (!parameters.getSpadesMode().trim().isEmpty()) {
            arguments.add(parameters.getSpadesMode().trim());
        }
        if (!parameters.getSpadesCoverageCutoff().isEmpty()) {
            arguments.add("--cov-cutoff");
            arguments.add(parameters.getSpadesCoverageCutoff());
        }
        arguments.add("-o");
        arguments.add(str(outputDirectory));
        return ToolInvocation.of(SPADES, arguments);
    }

    public static ToolInvocation quast(final PipelineParameters parameters, final Path contigs, final Path outputDirectory) {
        final List<String> arguments = new ArrayList<>(Arrays.asList(str(contigs), "-o", str(outputDirectory),
                "--min-contig", Integer.toString(parameters.getQuastMinContig())));
        addIfPresent(arguments, parameters.getQuastIcarus());
        addIfPresent(arguments, parameters.getQuastMode());
        return ToolInvocation.of(QUAST, arguments);
    }

    /**
     * Sequence typing of every contig set; the report is mlst's standard output.
     */
    public static ToolInvocation mlst(final List<Path> contigs, final Path report) {
        Utils.nonEmpty(contigs, "mlst needs at least one contig file");
        return ToolInvocation.of(MLST, strings(contigs)).withStdoutTo(report, false);
    }

    /**
     * Screens every contig set against one ABRicate database; the report is abricate's standard output.
     */
    public static ToolInvocation abricate(final List<Path> contigs, final String database, final Path report) {
        Utils.nonEmpty(contigs, "abricate needs at least one contig file");
        final List<String> arguments = strings(contigs);
        arguments.add("--db");
        arguments.add(database);
        return ToolInvocation.of(ABRICATE, arguments).withStdoutTo(report, false);
    }

    /**
     * Writes {@code <outputDirectory>/<sampleId>.gff} among other files.
     */
    public static ToolInvocation prokka(final PipelineParameters parameters, final String sampleId,
                                        final Path contigs, final Path outputDirectory) {
        return ToolInvocation.of(PROKKA,
                "--locustag", sampleId + "_L",
                "--outdir", str(outputDirectory),
                "--prefix", sampleId,
                "--kingdom", parameters.getProkkaKingdom(),
                "--gcode", Integer.toString(parameters.getProkkaGeneticCode()),
                "--force",
                str(contigs));
    }

    /**
     * Writes {@code <outputDirectory>/genome.gff} among other files.
     */
    public static ToolInvocation dfast(final PipelineParameters parameters, final String sampleId,
                                       final Path contigs, final Path outputDirectory) {
        return ToolInvocation.of(DFAST,
                "--genome", str(contigs),
                "--out", str(outputDirectory),
                "--minimum_length", Integer.toString(parameters.getDfastMinLength()),
                "--use_original_name", parameters.isDfastUseOriginalName() ? "t" : "f",
                "--locus_tag_prefix", sampleId,
                "--force");
    }

    public static ToolInvocation makeBlastDatabase(final PipelineParameters parameters, final Path sequences) {
        return ToolInvocation.of(MAKEBLASTDB, "-in", str(sequences), "-dbtype", parameters.getBlastDatabaseType(),
                "-out", str(sequences));
    }

    /**
     * Protein queries against the translated contig database; rows are appended to {@code rawTable}.
     */
    public static ToolInvocation tblastn(final PipelineParameters parameters, final Path proteinQueries,
                                         final Path database, final Path rawTable) {
        return ToolInvocation.of(TBLASTN, "-query", str(proteinQueries), "-db", str(database),
                "-evalue", parameters.getBlastEvalue(), "-outfmt", parameters.getBlastOutputFormat())
                .withStdoutTo(rawTable, true);
    }

    /**
     * Roary refuses to reuse an existing output directory, so {@code outputDirectory} must not exist yet.
     */
    public static ToolInvocation roary(final PipelineParameters parameters, final Path outputDirectory,
                                       final List<Path> annotations) {
        Utils.nonEmpty(annotations, "roary needs at least one annotation file");
        final List<String> arguments = new ArrayList<>(Arrays.asList("-f", str(outputDirectory)));
        arguments.addAll(parameters.getRoaryOptions());
        arguments.addAll(strings(annotations));
        return ToolInvocation.of(ROARY, arguments);
    }

    /**
     * roary_plots.py writes its images to the current directory.
     */
    public static ToolInvocation roaryPlots(final Path tree, final Path presenceAbsenceMatrix, final Path outputDirectory) {
        return ToolInvocation.of(ROARY_PLOTS, str(tree), str(presenceAbsenceMatrix)).inDirectory(outputDirectory);
    }

    private static void addIfPresent(final List<String> arguments, final String flag) {
        if (flag != null && !flag.trim().isEmpty()) {
            arguments.add(flag.trim());
        }
    }

    private static List<String> strings(final List<Path> paths) {
        final List<String> result = new ArrayList<>(paths.size());
        for (final Path path : paths) {
            result.add(str(path));
        }
        return result;
    }

    private static String str(final Path path) {
        return Utils.nonNull(path, "paths given to external tools cannot be null").toString();
    }
}
