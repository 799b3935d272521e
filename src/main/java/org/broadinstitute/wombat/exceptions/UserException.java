package org.broadinstitute.wombat.exceptions;

import java.io.File;
import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are the user's responsibility: malformed manifests, missing input files,
 * bad sample identifiers, output directories that would be silently merged, and the like.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /*
      Subtypes of UserException for common kinds of errors
     */

    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(String message, Exception e) {
            super(String.format("Couldn't read file. Error was: %s with exception: %s", message, getMessage(e)), e);
        }

        public CouldNotReadInputFile(Path file) {
            super(String.format("Couldn't read file %s", file.toAbsolutePath().toUri()));
        }

        public CouldNotReadInputFile(Path file, String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message));
        }

        public CouldNotReadInputFile(Path file, String message, Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message), cause);
        }

        public CouldNotReadInputFile(Path path, Exception e) {
            this(path, getMessage(e), e);
        }
    }

    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(File file, String message) {
            super(String.format("Couldn't write file %s because %s", file.getAbsolutePath(), message));
        }

        public CouldNotCreateOutputFile(Path file, String message) {
            super(String.format("Couldn't write file %s because %s", file.toAbsolutePath(), message));
        }

        public CouldNotCreateOutputFile(Path file, String message, Exception e) {
            super(String.format("Couldn't write file %s because %s with exception %s", file.toAbsolutePath(), message, getMessage(e)), e);
        }

        public CouldNotCreateOutputFile(String message, Exception e) {
            super(message, e);
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(String message, Throwable cause){
            super(String.format("Bad input: %s", message), cause);
        }

        public BadInput(String message) {
            super(String.format("Bad input: %s", message));
        }
    }

    /**
     * A sample or auxiliary manifest that cannot be turned into a run; always raised before any stage runs.
     */
    public static class MalformedManifest extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedManifest(final Path manifest, final String message) {
            super(String.format("Manifest %s is malformed: %s", manifest.toAbsolutePath(), message));
        }

        public MalformedManifest(final Path manifest, final String message, final Throwable cause) {
            super(String.format("Manifest %s is malformed: %s", manifest.toAbsolutePath(), message), cause);
        }
    }

    public static class MalformedSequenceFile extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedSequenceFile(final Path file, final String message, final Throwable cause) {
            super(String.format("Sequence file %s is malformed: %s", file.toAbsolutePath(), message), cause);
        }

        public MalformedSequenceFile(final Path file, final String message) {
            super(String.format("Sequence file %s is malformed: %s", file.toAbsolutePath(), message));
        }
    }

    public static class InvalidSampleIdentifier extends UserException {
        private static final long serialVersionUID = 0L;

        public InvalidSampleIdentifier(final String sampleId, final String message) {
            super(String.format("Invalid sample identifier '%s': %s", sampleId, message));
        }
    }

    public static class OutputDirectoryExists extends UserException {
        private static final long serialVersionUID = 0L;

        public OutputDirectoryExists(final Path directory) {
            super(String.format("Output directory %s already exists and is not empty. Choose a new output directory " +
                    "or pass --resume to continue a previous run in place.", directory.toAbsolutePath()));
        }
    }

    public static class CannotExecuteProgram extends UserException {
        private static final long serialVersionUID = 0L;

        public CannotExecuteProgram(final String program, final String message) {
            super(String.format("Unable to execute %s. %s", program, message));
        }
    }
}
