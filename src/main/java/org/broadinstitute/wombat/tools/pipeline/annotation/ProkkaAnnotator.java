package org.broadinstitute.wombat.tools.pipeline.annotation;

import org.broadinstitute.wombat.engine.AnnotatorVariant;
import org.broadinstitute.wombat.engine.PipelineParameters;
import org.broadinstitute.wombat.engine.layout.ArtifactLayout;
import org.broadinstitute.wombat.engine.layout.ArtifactRole;
import org.broadinstitute.wombat.engine.layout.Stage;
import org.broadinstitute.wombat.engine.tools.StageExecutor;
import org.broadinstitute.wombat.engine.tools.ToolCommands;
import org.broadinstitute.wombat.utils.Utils;

import java.nio.file.Path;

/**
 * Prokka names its outputs after {@code --prefix}, which is the sample id, so the record is already in place.
 */
public final class ProkkaAnnotator implements Annotator {

    private final ArtifactLayout layout;
    private final PipelineParameters parameters;

    public ProkkaAnnotator(final ArtifactLayout layout, final PipelineParameters parameters) {
        this.layout = Utils.nonNull(layout);
        this.parameters = Utils.nonNull(parameters);
    }

    @Override
    public AnnotatorVariant getVariant() {
        return AnnotatorVariant.PROKKA;
    }

    @Override
    public Path annotate(final String sampleId, final Path contigs, final StageExecutor executor) {
        executor.run(Stage.ANNOTATE, sampleId,
                ToolCommands.prokka(parameters, sampleId, contigs, layout.directoryFor(Stage.ANNOTATE, sampleId)));
        return StageExecutor.requireArtifact(Stage.ANNOTATE, sampleId,
                layout.pathFor(Stage.ANNOTATE, sampleId, ArtifactRole.ANNOTATION_GFF));
    }
}
