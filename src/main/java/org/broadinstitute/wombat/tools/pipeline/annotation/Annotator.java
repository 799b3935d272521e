package org.broadinstitute.wombat.tools.pipeline.annotation;

import org.broadinstitute.wombat.engine.AnnotatorVariant;
import org.broadinstitute.wombat.engine.tools.StageExecutor;

import java.nio.file.Path;

/**
 * Produces the GFF3 annotation record of one genome.
 * <p>
 * Whatever the tool, the record ends up at the layout's {@code annotation_gff} path of the annotate stage for the
 * sample, so downstream stages need not know which annotator ran.
 * </p>
 */
public interface Annotator {

    AnnotatorVariant getVariant();

    /**
     * @param sampleId sample the contigs belong to, also used as locus tag and file prefix
     * @param contigs assembled sequences to annotate
     * @param executor runs the tool and checks its exit code
     * @return the annotation record, which exists on return
     */
    Path annotate(String sampleId, Path contigs, StageExecutor executor);
}
