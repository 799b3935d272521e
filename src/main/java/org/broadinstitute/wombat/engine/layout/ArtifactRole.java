package org.broadinstitute.wombat.engine.layout;

/**
 * What an artifact is to the stages that consume it. Each role knows the file name it takes inside its stage
 * directory; per-sample roles are named after the sample unless the producing tool fixes the name itself.
 */
public enum ArtifactRole {
    R1_PAIRED("R1_paired", Stage.Scope.PER_SAMPLE, "%s_R1_paired.fastq"),
    R2_PAIRED("R2_paired", Stage.Scope.PER_SAMPLE, "%s_R2_paired.fastq"),
    R1_UNPAIRED("R1_unpaired", Stage.Scope.PER_SAMPLE, "%s_R1_unpaired.fastq"),
    R2_UNPAIRED("R2_unpaired", Stage.Scope.PER_SAMPLE, "%s_R2_unpaired.fastq"),
    FILTER_LOG("filter_log", Stage.Scope.PER_SAMPLE, "%s.log"),
    // named by SPAdes
    CONTIGS_RAW("contigs_raw", Stage.Scope.PER_SAMPLE, "contigs.fasta"),
    CONTIGS_CURATED("contigs_curated", Stage.Scope.PER_SAMPLE, "%s_contigs.fasta"),
    // named by QUAST
    STATS_REPORT("stats_report", Stage.Scope.PER_SAMPLE, "report.tsv"),
    ANNOTATION_GFF("annotation_gff", Stage.Scope.PER_SAMPLE, "%s.gff"),
    COMPLETION_MARKER("completion_marker", Stage.Scope.PER_SAMPLE, "%s.complete"),
    TYPING_REPORT("typing_report", Stage.Scope.CROSS_SAMPLE, "MLST.txt"),
    VIRULENCE_REPORT("virulence_report", Stage.Scope.CROSS_SAMPLE, "SampleVirulenceGenes.tab"),
    RESISTANCE_REPORT("resistance_report", Stage.Scope.CROSS_SAMPLE, "SampleAntibioticResistanceGenes.tab"),
    // every curated contig set concatenated; also the BLAST database name
    HOMOLOGY_DATABASE("homology_database", Stage.Scope.CROSS_SAMPLE, "contigs_db.fasta"),
    HOMOLOGY_RAW("homology_raw", Stage.Scope.CROSS_SAMPLE, "BLAST_results.tab"),
    HOMOLOGY_REPORT("homology_report", Stage.Scope.CROSS_SAMPLE, "BLAST_results_filtered.tab"),
    // named by Roary
    PANGENOME_MATRIX("pangenome_matrix", Stage.Scope.CROSS_SAMPLE, "gene_presence_absence.csv"),
    PANGENOME_TREE("pangenome_tree", Stage.Scope.CROSS_SAMPLE, "accessory_binary_genes.fa.newick"),
    // named by roary_plots.py
    PANGENOME_PLOTS("pangenome_plots", Stage.Scope.CROSS_SAMPLE, "pangenome_matrix.png");

    private final String name;
    private final Stage.Scope scope;
    private final String fileNamePattern;

    ArtifactRole(final String name, final Stage.Scope scope, final String fileNamePattern) {
        this.name = name;
        this.scope = scope;
        this.fileNamePattern = fileNamePattern;
    }

    public String getName() {
        return name;
    }

    public Stage.Scope getScope() {
        return scope;
    }

    /**
     * @param sampleId the owning sample, ignored by cross-sample roles and tool-named files
     * @return the file name of this role's artifact inside its stage (and sample) directory
     */
    String fileName(final String sampleId) {
        return fileNamePattern.contains("%s") ? String.format(fileNamePattern, sampleId) : fileNamePattern;
    }
}
