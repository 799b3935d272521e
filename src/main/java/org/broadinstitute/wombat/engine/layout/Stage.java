package org.broadinstitute.wombat.engine.layout;

/**
 * The steps of the pipeline in execution order. Per-sample stages form one chain per sample; cross-sample stages
 * run once over every sample after all chains are done.
 */
public enum Stage {
    TRIM("trim", "Trimmomatic_filtering1", Scope.PER_SAMPLE),
    FILTER("filter", "Prinseq_filtering2", Scope.PER_SAMPLE),
    ASSEMBLE("assemble", "SPAdes_assembly", Scope.PER_SAMPLE),
    CURATE_CONTIGS("curate_contigs", "Contigs_renamed_shorten", Scope.PER_SAMPLE),
    STATS("stats", "Sample_assembly_statistics", Scope.PER_SAMPLE),
    ANNOTATE("annotate", "Prokka_annotation", Scope.PER_SAMPLE),
    CROSS_SAMPLE_TYPING("cross_sample_typing", "MLST", Scope.CROSS_SAMPLE),
    CROSS_SAMPLE_VIRULENCE("cross_sample_virulence", "ABRicate_virulence_genes", Scope.CROSS_SAMPLE),
    CROSS_SAMPLE_RESISTANCE("cross_sample_resistance", "ABRicateAntibioticResistanceGenes", Scope.CROSS_SAMPLE),
    HOMOLOGY_SEARCH("homology_search", "BLAST_homology_search", Scope.CROSS_SAMPLE),
    PANGENOME("pangenome", "Roary_pangenome", Scope.CROSS_SAMPLE),
    PANGENOME_PLOTS("pangenome_plots", "Roary_plots", Scope.CROSS_SAMPLE);

    public enum Scope {
        PER_SAMPLE, CROSS_SAMPLE
    }

    private final String name;
    private final String directoryName;
    private final Scope scope;

    Stage(final String name, final String directoryName, final Scope scope) {
        this.name = name;
        this.directoryName = directoryName;
        this.scope = scope;
    }

    /**
     * @return the stage name used in logs and error messages, e.g. {@code curate_contigs}
     */
    public String getName() {
        return name;
    }

    /**
     * @return the name of the directory holding this stage's artifacts under the run root
     */
    public String getDirectoryName() {
        return directoryName;
    }

    public Scope getScope() {
        return scope;
    }

    public boolean isPerSample() {
        return scope == Scope.PER_SAMPLE;
    }
}
