package org.broadinstitute.wombat.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.aeonbits.owner.Mutable;

import java.util.List;

/**
 * Configuration file for the parameters handed to the external tools of the assembly pipeline.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is always resolved "top-down" by declaration order in the @Sources annotation.
 *
 * In this case, the load order is:
 *        1)   "file:${" + WombatConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "file:WombatConfig.properties",
 *        3)   "classpath:org/broadinstitute/wombat/utils/config/WombatConfig.properties"
 *        4)   hard-coded values specified by @DefaultValue
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + WombatConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",                  // Variable for file loading
        "file:WombatConfig.properties",                                                 // Default path
        "classpath:org/broadinstitute/wombat/utils/config/WombatConfig.properties"      // Class path
})
public interface WombatConfig extends Mutable, Accessible {

    // =================================================================================================================
    // Meta Options:
    // =================================================================================================================

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link WombatConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "WombatConfig.pathToConfig";

    // =================================================================================================================
    // Pipeline Options:
    // =================================================================================================================

    @Key("pipeline.sample_parallelism")
    @DefaultValue("1")
    int pipeline_sample_parallelism();

    @Key("wombat_stacktrace_on_user_exception")
    @ConverterClass(CustomBooleanConverter.class)
    @DefaultValue("false")
    Boolean wombat_stacktrace_on_user_exception();

    // ----------------------------------------------------------
    // Trimming (Trimmomatic):
    // ----------------------------------------------------------

    @Key("trimming.enabled")
    @ConverterClass(CustomBooleanConverter.class)
    @DefaultValue("false")
    Boolean trimming_enabled();

    @Key("trimming.phred")
    @DefaultValue("-phred33")
    String trimming_phred();

    /**
     * seed mismatches : palindrome clip threshold : simple clip threshold, appended to {@code ILLUMINACLIP:<adapters>:}
     */
    @Key("trimming.illuminaclip")
    @DefaultValue("1:30:11")
    String trimming_illuminaclip();

    // ----------------------------------------------------------
    // Filtering (Prinseq):
    // ----------------------------------------------------------

    @Key("prinseq.min_len")
    @DefaultValue("40")
    int prinseq_min_len();

    @Key("prinseq.min_qual_mean")
    @DefaultValue("25")
    int prinseq_min_qual_mean();

    @Key("prinseq.trim_qual_right")
    @DefaultValue("25")
    int prinseq_trim_qual_right();

    @Key("prinseq.trim_qual_window")
    @DefaultValue("15")
    int prinseq_trim_qual_window();

    @Key("prinseq.trim_qual_type")
    @DefaultValue("mean")
    String prinseq_trim_qual_type();

    /**
     * 1 (FASTA only), 2 (FASTA and QUAL), 3 (FASTQ), 4 (FASTQ and FASTA), 5 (FASTQ, FASTA and QUAL)
     */
    @Key("prinseq.out_format")
    @DefaultValue("3")
    int prinseq_out_format();

    @Key("prinseq.out_bad")
    @DefaultValue("null")
    String prinseq_out_bad();

    // ----------------------------------------------------------
    // Assembly (SPAdes) and curation:
    // ----------------------------------------------------------

    @Key("spades.mode")
    @DefaultValue("--careful")
    String spades_mode();

    /**
     * Passed as {@code --cov-cutoff} when not empty.
     */
    @Key("spades.cov_cutoff")
    @DefaultValue("auto")
    String spades_cov_cutoff();

    @Key("contigs.min_length")
    @DefaultValue("200")
    int contigs_min_length();

    @Key("contigs.marker")
    @DefaultValue("C")
    String contigs_marker();

    // ----------------------------------------------------------
    // Statistics (QUAST):
    // ----------------------------------------------------------

    @Key("quast.min_contig")
    @DefaultValue("200")
    int quast_min_contig();

    @Key("quast.icarus")
    @DefaultValue("--no-icarus")
    String quast_icarus();

    @Key("quast.mode")
    @DefaultValue("--silent")
    String quast_mode();

    // ----------------------------------------------------------
    // Annotation (Prokka / DFAST):
    // ----------------------------------------------------------

    /**
     * prokka or dfast
     */
    @Key("annotator")
    @DefaultValue("prokka")
    String annotator();

    @Key("prokka.kingdom")
    @DefaultValue("Bacteria")
    String prokka_kingdom();

    @Key("prokka.gcode")
    @DefaultValue("11")
    int prokka_gcode();

    @Key("dfast.min_length")
    @DefaultValue("0")
    int dfast_min_length();

    @Key("dfast.use_original_name")
    @ConverterClass(CustomBooleanConverter.class)
    @DefaultValue("true")
    Boolean dfast_use_original_name();

    // ----------------------------------------------------------
    // Homology scans (ABRicate):
    // ----------------------------------------------------------

    @Key("abricate.virulence_database")
    @DefaultValue("vfdb")
    String abricate_virulence_database();

    @Key("abricate.resistance_database")
    @DefaultValue("resfinder")
    String abricate_resistance_database();

    // ----------------------------------------------------------
    // Custom reference homology search (BLAST):
    // ----------------------------------------------------------

    @Key("homology.enabled")
    @ConverterClass(CustomBooleanConverter.class)
    @DefaultValue("true")
    Boolean homology_enabled();

    @Key("blast.dbtype")
    @DefaultValue("nucl")
    String blast_dbtype();

    @Key("blast.evalue")
    @DefaultValue("0.001")
    String blast_evalue();

    @Key("blast.outfmt")
    @DefaultValue("6 qseqid sseqid pident length mismatch gapopen qstart qend sstart send evalue bitscore sseq")
    String blast_outfmt();

    @Key("blast.min_percent_identity")
    @DefaultValue("50.0")
    double blast_min_percent_identity();

    // ----------------------------------------------------------
    // Pan-genome (Roary):
    // ----------------------------------------------------------

    @Key("roary.options")
    @DefaultValue("-e,-n,-v")
    List<String> roary_options();
}
