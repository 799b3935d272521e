package org.broadinstitute.wombat.engine.layout;

import com.google.common.annotations.VisibleForTesting;
import org.broadinstitute.wombat.exceptions.UserException;
import org.broadinstitute.wombat.utils.Utils;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 * Maps (stage, sample, role) to the canonical location of an artifact under one run root.
 * <p>
 * Per-sample artifacts live at {@code <root>/<stage directory>/<sample>/<file>}, cross-sample artifacts at
 * {@code <root>/<stage directory>/<file>}. Stage directory names are distinct, role file names are distinct within a
 * scope, and sample ids are restricted to {@link #SAMPLE_ID_PATTERN}, so two different triples never share a path.
 * Ids outside that pattern are rejected rather than escaped.
 * </p>
 * <p>
 * Nothing here touches the file system.
 * </p>
 */
public final class ArtifactLayout {

    /**
     * Letters, digits, '_' and '-', not starting with a separator. Excludes '.', path separators and whitespace.
     */
    public static final Pattern SAMPLE_ID_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]*");

    public static final String DEFAULT_ROOT_PREFIX = "Workflow_OUTPUT_";

    private static final DateTimeFormatter ROOT_TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path root;

    public ArtifactLayout(final Path root) {
        this.root = Utils.nonNull(root, "the output root cannot be null").toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    /**
     * @return the default run root under {@code baseDirectory}, stamped with {@code now}
     */
    public static Path defaultRoot(final Path baseDirectory, final LocalDateTime now) {
        Utils.nonNull(baseDirectory);
        Utils.nonNull(now);
        return baseDirectory.resolve(DEFAULT_ROOT_PREFIX + ROOT_TIMESTAMP_FORMAT.format(now));
    }

    /**
     * Canonical path of a per-sample artifact.
     *
     * @throws UserException.InvalidSampleIdentifier if {@code sampleId} could escape or share a directory
     * @throws IllegalArgumentException if the stage or the role is not per-sample
     */
    public Path pathFor(final Stage stage, final String sampleId, final ArtifactRole role) {
        Utils.nonNull(role, "the role cannot be null");
        Utils.validateArg(role.getScope() == Stage.Scope.PER_SAMPLE,
                () -> "role " + role.getName() + " is not a per-sample artifact");
        return directoryFor(stage, sampleId).resolve(role.fileName(sampleId));
    }

    /**
     * Canonical path of a cross-sample artifact.
     *
     * @throws IllegalArgumentException if the stage or the role is per-sample
     */
    public Path pathFor(final Stage stage, final ArtifactRole role) {
        Utils.nonNull(role, "the role cannot be null");
        Utils.validateArg(role.getScope() == Stage.Scope.CROSS_SAMPLE,
                () -> "role " + role.getName() + " is a per-sample artifact; a sample id is required");
        return directoryFor(stage).resolve(role.fileName(null));
    }

    /**
     * Directory holding one sample's artifacts of a per-sample stage.
     */
    public Path directoryFor(final Stage stage, final String sampleId) {
        Utils.nonNull(stage, "the stage cannot be null");
        Utils.validateArg(stage.isPerSample(), () -> "stage " + stage.getName() + " does not have per-sample directories");
        return root.resolve(stage.getDirectoryName()).resolve(validateSampleId(sampleId));
    }

    /**
     * Directory of a stage; for per-sample stages it is the parent of the sample directories.
     */
    public Path directoryFor(final Stage stage) {
        Utils.nonNull(stage, "the stage cannot be null");
        return root.resolve(stage.getDirectoryName());
    }

    /**
     * @return {@code sampleId} if it can be used as a directory name without colliding with any other id
     * @throws UserException.InvalidSampleIdentifier otherwise
     */
    public static String validateSampleId(final String sampleId) {
        if (sampleId == null || sampleId.isEmpty()) {
            throw new UserException.InvalidSampleIdentifier(String.valueOf(sampleId), "sample identifiers cannot be empty");
        }
        if (!isValidSampleId(sampleId)) {
            throw new UserException.InvalidSampleIdentifier(sampleId,
                    "only letters, digits, '_' and '-' are allowed, and the first character must be a letter or a digit");
        }
        return sampleId;
    }

    @VisibleForTesting
    static boolean isValidSampleId(final String sampleId) {
        return SAMPLE_ID_PATTERN.matcher(sampleId).matches();
    }
}
