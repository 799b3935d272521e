package org.broadinstitute.wombat.engine;

import org.broadinstitute.wombat.engine.layout.ArtifactLayout;
import org.broadinstitute.wombat.utils.Utils;

/**
 * Everything a run needs to know besides its samples, fixed when the run starts and handed explicitly to the
 * orchestrator and the stages.
 */
public final class RunContext {
    private final ArtifactLayout layout;
    private final AnnotatorVariant annotatorVariant;
    private final boolean homologySearchEnabled;
    private final int sampleParallelism;
    private final boolean resume;
    private final AuxiliaryFiles auxiliaryFiles;
    private final PipelineParameters parameters;

    public RunContext(final ArtifactLayout layout,
                      final AnnotatorVariant annotatorVariant,
                      final boolean homologySearchEnabled,
                      final int sampleParallelism,
                      final boolean resume,
                      final AuxiliaryFiles auxiliaryFiles,
                      final PipelineParameters parameters) {
        this.layout = Utils.nonNull(layout, "the layout cannot be null");
        this.annotatorVariant = Utils.nonNull(annotatorVariant, "the annotator variant cannot be null");
        Utils.validateArg(sampleParallelism >= 1, "sample parallelism must be at least 1");
        this.homologySearchEnabled = homologySearchEnabled;
        this.sampleParallelism = sampleParallelism;
        this.resume = resume;
        this.auxiliaryFiles = Utils.nonNull(auxiliaryFiles, "the auxiliary files cannot be null");
        this.parameters = Utils.nonNull(parameters, "the parameters cannot be null");
        Utils.validateArg(!homologySearchEnabled || auxiliaryFiles.getProteinDatabase().isPresent(),
                "the homology search needs a reference protein database");
        Utils.validateArg(!parameters.isTrimmingEnabled() || auxiliaryFiles.getAdapters().isPresent(),
                "trimming needs an adapter sequence file");
    }

    public ArtifactLayout getLayout() {
        return layout;
    }

    public AnnotatorVariant getAnnotatorVariant() {
        return annotatorVariant;
    }

    public boolean isHomologySearchEnabled() {
        return homologySearchEnabled;
    }

    public int getSampleParallelism() {
        return sampleParallelism;
    }

    public boolean isResume() {
        return resume;
    }

    public AuxiliaryFiles getAuxiliaryFiles() {
        return auxiliaryFiles;
    }

    public PipelineParameters getParameters() {
        return parameters;
    }
}
