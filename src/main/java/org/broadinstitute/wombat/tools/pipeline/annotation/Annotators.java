package org.broadinstitute.wombat.tools.pipeline.annotation;

import org.broadinstitute.wombat.engine.AnnotatorVariant;
import org.broadinstitute.wombat.engine.PipelineParameters;
import org.broadinstitute.wombat.engine.layout.ArtifactLayout;
import org.broadinstitute.wombat.exceptions.WombatException;

public final class Annotators {

    private Annotators() {}

    public static Annotator create(final AnnotatorVariant variant, final ArtifactLayout layout, final PipelineParameters parameters) {
        switch (variant) {
            case PROKKA:
                return new ProkkaAnnotator(layout, parameters);
            case DFAST:
                return new DfastAnnotator(layout, parameters);
            default:
                throw new WombatException.ShouldNeverReachHereException("unknown annotator variant " + variant);
        }
    }
}
