package org.broadinstitute.wombat.cmdline;

/**
 * A set of String constants in which the name of the constant (minus the _SHORT_NAME suffix)
 * is the standard long Name, and the value of the constant is the standard shortName.
 */
public final class StandardArgumentDefinitions {
    private StandardArgumentDefinitions(){}

    public static final String INPUT_LONG_NAME = "input";
    public static final String OUTPUT_LONG_NAME = "output";
    public static final String VERBOSITY_NAME = "verbosity";
    public static final String QUIET_NAME = "QUIET";
    public static final String WOMBAT_CONFIG_FILE_OPTION = "wombat-config-file";

    public static final String SAMPLE_MANIFEST_LONG_NAME = "sample-manifest";
    public static final String AUXILIARY_MANIFEST_LONG_NAME = "auxiliary-manifest";
    public static final String ANNOTATOR_LONG_NAME = "annotator";
    public static final String RUN_HOMOLOGY_SEARCH_LONG_NAME = "run-homology-search";
    public static final String SAMPLE_PARALLELISM_LONG_NAME = "sample-parallelism";
    public static final String RESUME_LONG_NAME = "resume";
    public static final String PROTEIN_DATABASE_LONG_NAME = "protein-database";
    public static final String MIN_PERCENT_IDENTITY_LONG_NAME = "min-percent-identity";
    public static final String MIN_CONTIG_LENGTH_LONG_NAME = "min-contig-length";
    public static final String CONTIG_MARKER_LONG_NAME = "contig-marker";

    public static final String INPUT_SHORT_NAME = "I";
    public static final String OUTPUT_SHORT_NAME = "O";
    public static final String SAMPLE_MANIFEST_SHORT_NAME = "S";
    public static final String AUXILIARY_MANIFEST_SHORT_NAME = "A";
}
