package org.broadinstitute.wombat.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that run or take part in the assembly and annotation pipeline.
 */
public final class AssemblyPipelineProgramGroup implements CommandLineProgramGroup {
    public static final String NAME = "Assembly Pipeline";
    public static final String SUMMARY = "Tools that assemble, curate and annotate bacterial genomes";

    @Override
    public String getName() { return NAME; }
    @Override
    public String getDescription() { return SUMMARY; }
}
