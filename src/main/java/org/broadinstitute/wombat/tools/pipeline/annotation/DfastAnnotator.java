package org.broadinstitute.wombat.tools.pipeline.annotation;

import org.broadinstitute.wombat.engine.AnnotatorVariant;
import org.broadinstitute.wombat.engine.PipelineParameters;
import org.broadinstitute.wombat.engine.layout.ArtifactLayout;
import org.broadinstitute.wombat.engine.layout.ArtifactRole;
import org.broadinstitute.wombat.engine.layout.Stage;
import org.broadinstitute.wombat.engine.tools.StageExecutor;
import org.broadinstitute.wombat.engine.tools.ToolCommands;
import org.broadinstitute.wombat.exceptions.StageFailedException;
import org.broadinstitute.wombat.utils.Utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * DFAST always writes {@value #DFAST_GFF_NAME}; it is renamed to the sample's annotation record.
 */
public final class DfastAnnotator implements Annotator {

    public static final String DFAST_GFF_NAME = "genome.gff";

    private final ArtifactLayout layout;
    private final PipelineParameters parameters;

    public DfastAnnotator(final ArtifactLayout layout, final PipelineParameters parameters) {
        this.layout = Utils.nonNull(layout);
        this.parameters = Utils.nonNull(parameters);
    }

    @Override
    public AnnotatorVariant getVariant() {
        return AnnotatorVariant.DFAST;
    }

    @Override
    public Path annotate(final String sampleId, final Path contigs, final StageExecutor executor) {
        final Path outputDirectory = layout.directoryFor(Stage.ANNOTATE, sampleId);
        executor.run(Stage.ANNOTATE, sampleId, ToolCommands.dfast(parameters, sampleId, contigs, outputDirectory));
        final Path produced = StageExecutor.requireArtifact(Stage.ANNOTATE, sampleId, outputDirectory.resolve(DFAST_GFF_NAME));
        final Path record = layout.pathFor(Stage.ANNOTATE, sampleId, ArtifactRole.ANNOTATION_GFF);
        try {
            Files.move(produced, record, StandardCopyOption.REPLACE_EXISTING);
        } catch (final IOException e) {
            throw new StageFailedException(Stage.ANNOTATE, sampleId, "cannot rename " + produced + " to " + record, e);
        }
        return record;
    }
}
