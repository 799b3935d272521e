package org.broadinstitute.wombat.engine.tools;

import org.broadinstitute.wombat.engine.layout.Stage;
import org.broadinstitute.wombat.exceptions.StageFailedException;
import org.broadinstitute.wombat.utils.Utils;
import org.broadinstitute.wombat.utils.runtime.ProcessOutput;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs the external tools of a stage and turns a non-zero exit code or a missing output into a
 * {@link StageFailedException} naming the stage and sample.
 */
public final class StageExecutor {

    private final ExternalToolRunner runner;

    public StageExecutor(final ExternalToolRunner runner) {
        this.runner = Utils.nonNull(runner, "the tool runner cannot be null");
    }

    /**
     * @param sampleId {@code null} for cross-sample stages
     */
    public ProcessOutput run(final Stage stage, final String sampleId, final ToolInvocation invocation) {
        Utils.nonNull(stage);
        Utils.nonNull(invocation);
        final ProcessOutput output = runner.run(invocation);
        if (output.getExitValue() != 0) {
            throw new StageFailedException(stage, sampleId, output.getExitValue(),
                    " running " + invocation.getProgram() + output.getStatusSummary(false));
        }
        return output;
    }

    /**
     * @return {@code artifact}, once checked to be a regular file
     */
    public static Path requireArtifact(final Stage stage, final String sampleId, final Path artifact) {
        if (!Files.isRegularFile(artifact)) {
            throw new StageFailedException(stage, sampleId, "expected output " + artifact + " was not produced");
        }
        return artifact;
    }
}
