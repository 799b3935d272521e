package org.broadinstitute.wombat.exceptions;

import org.broadinstitute.wombat.engine.layout.Stage;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Raised when a pipeline stage either exits with a non-zero status or claims success without leaving its expected
 * artifacts behind. Fatal for the sample's remaining chain, and for the run once every running chain has stopped.
 */
public class StageFailedException extends WombatException {
    private static final long serialVersionUID = 0L;

    private final Stage stage;
    private final String sampleId;
    private final Integer exitCode;

    public StageFailedException(final Stage stage, final String sampleId, final int exitCode, final String details) {
        super(formatMessage(stage, sampleId, "exited with code " + exitCode + details));
        this.stage = stage;
        this.sampleId = sampleId;
        this.exitCode = exitCode;
    }

    public StageFailedException(final Stage stage, final String sampleId, final String reason) {
        super(formatMessage(stage, sampleId, reason));
        this.stage = stage;
        this.sampleId = sampleId;
        this.exitCode = null;
    }

    public StageFailedException(final Stage stage, final String sampleId, final String reason, final Throwable cause) {
        super(formatMessage(stage, sampleId, reason), cause);
        this.stage = stage;
        this.sampleId = sampleId;
        this.exitCode = null;
    }

    private static String formatMessage(final Stage stage, final String sampleId, final String reason) {
        return sampleId == null ?
                String.format("Stage %s failed: %s", stage.getName(), reason) :
                String.format("Stage %s failed for sample %s: %s", stage.getName(), sampleId, reason);
    }

    public Stage getStage() {
        return stage;
    }

    /**
     * @return the failing sample, or empty for a cross-sample stage
     */
    public Optional<String> getSampleId() {
        return Optional.ofNullable(sampleId);
    }

    public OptionalInt getExitCode() {
        return exitCode == null ? OptionalInt.empty() : OptionalInt.of(exitCode);
    }
}
