package org.broadinstitute.wombat.engine;

import org.broadinstitute.wombat.utils.Utils;
import org.broadinstitute.wombat.utils.config.WombatConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of the tool parameters in a {@link WombatConfig}, taken once when a run starts.
 */
public final class PipelineParameters {

    private final boolean trimmingEnabled;
    private final String trimmingPhred;
    private final String trimmingIlluminaClip;

    private final int prinseqMinLength;
    private final int prinseqMinQualityMean;
    private final int prinseqTrimQualityRight;
    private final int prinseqTrimQualityWindow;
    private final String prinseqTrimQualityType;
    private final int prinseqOutFormat;
    private final String prinseqOutBad;

    private final String spadesMode;
    private final String spadesCoverageCutoff;

    private final int contigMinLength;
    private final String contigMarker;

    private final int quastMinContig;
    private final String quastIcarus;
    private final String quastMode;

    private final String prokkaKingdom;
    private final int prokkaGeneticCode;
    private final int dfastMinLength;
    private final boolean dfastUseOriginalName;

    private final String virulenceDatabase;
    private final String resistanceDatabase;

    private final String blastDatabaseType;
    private final String blastEvalue;
    private final String blastOutputFormat;
    private final double minPercentIdentity;

    private final List<String> roaryOptions;

    public PipelineParameters(final WombatConfig config) {
        Utils.nonNull(config, "the configuration cannot be null");
        trimmingEnabled = config.trimming_enabled();
        trimmingPhred = config.trimming_phred();
        trimmingIlluminaClip = config.trimming_illuminaclip();

        prinseqMinLength = config.prinseq_min_len();
        prinseqMinQualityMean = config.prinseq_min_qual_mean();
        prinseqTrimQualityRight = config.prinseq_trim_qual_right();
        prinseqTrimQualityWindow = config.prinseq_trim_qual_window();
        prinseqTrimQualityType = config.prinseq_trim_qual_type();
        prinseqOutFormat = config.prinseq_out_format();
        prinseqOutBad = config.prinseq_out_bad();

        spadesMode = config.spades_mode();
        spadesCoverageCutoff = config.spades_cov_cutoff().trim();

        contigMinLength = config.contigs_min_length();
        contigMarker = Utils.nonEmpty(config.contigs_marker().trim(), "contigs.marker");
        Utils.validateArg(contigMinLength >= 0, "contigs.min_length cannot be negative");

        quastMinContig = config.quast_min_contig();
        quastIcarus = config.quast_icarus();
        quastMode = config.quast_mode();

        prokkaKingdom = config.prokka_kingdom();
        prokkaGeneticCode = config.prokka_gcode();
        dfastMinLength = config.dfast_min_length();
        dfastUseOriginalName = config.dfast_use_original_name();

        virulenceDatabase = config.abricate_virulence_database();
        resistanceDatabase = config.abricate_resistance_database();

        blastDatabaseType = config.blast_dbtype();
        blastEvalue = config.blast_evalue();
        blastOutputFormat = config.blast_outfmt();
        minPercentIdentity = config.blast_min_percent_identity();

        final List<String> options = new ArrayList<>();
        for (final String option : config.roary_options()) {
            if (!option.trim().isEmpty()) {
                options.add(option.trim());
            }
        }
        roaryOptions = Collections.unmodifiableList(options);
    }

    public boolean isTrimmingEnabled() {
        return trimmingEnabled;
    }

    public String getTrimmingPhred() {
        return trimmingPhred;
    }

    public String getTrimmingIlluminaClip() {
        return trimmingIlluminaClip;
    }

    public int getPrinseqMinLength() {
        return prinseqMinLength;
    }

    public int getPrinseqMinQualityMean() {
        return prinseqMinQualityMean;
    }

    public int getPrinseqTrimQualityRight() {
        return prinseqTrimQualityRight;
    }

    public int getPrinseqTrimQualityWindow() {
        return prinseqTrimQualityWindow;
    }

    public String getPrinseqTrimQualityType() {
        return prinseqTrimQualityType;
    }

    public int getPrinseqOutFormat() {
        return prinseqOutFormat;
    }

    public String getPrinseqOutBad() {
        return prinseqOutBad;
    }

    public String getSpadesMode() {
        return spadesMode;
    }

    /**
     * @return the SPAdes coverage cutoff, empty when it should not be passed
     */
    public String getSpadesCoverageCutoff() {
        return spadesCoverageCutoff;
    }

    public int getContigMinLength() {
        return contigMinLength;
    }

    public String getContigMarker() {
        return contigMarker;
    }

    public int getQuastMinContig() {
        return quastMinContig;
    }

    public String getQuastIcarus() {
        return quastIcarus;
    }

    public String getQuastMode() {
        return quastMode;
    }

    public String getProkkaKingdom() {
        return prokkaKingdom;
    }

    public int getProkkaGeneticCode() {
        return prokkaGeneticCode;
    }

    public int getDfastMinLength() {
        return dfastMinLength;
    }

    public boolean isDfastUseOriginalName() {
        return dfastUseOriginalName;
    }

    public String getVirulenceDatabase() {
        return virulenceDatabase;
    }

    public String getResistanceDatabase() {
        return resistanceDatabase;
    }

    public String getBlastDatabaseType() {
        return blastDatabaseType;
    }

    public String getBlastEvalue() {
        return blastEvalue;
    }

    public String getBlastOutputFormat() {
        return blastOutputFormat;
    }

    public double getMinPercentIdentity() {
        return minPercentIdentity;
    }

    public List<String> getRoaryOptions() {
        return roaryOptions;
    }
}
