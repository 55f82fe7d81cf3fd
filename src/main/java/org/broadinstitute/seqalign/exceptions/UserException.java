package org.broadinstitute.seqalign.exceptions;

import java.nio.file.Path;
import java.util.Collection;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to caller mistakes, such as empty sequences, positive gap penalties
 * or names of scoring matrices that do not exist.
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

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(Path file) {
            super(String.format("Couldn't read file %s", file.toAbsolutePath().toUri()));
        }

        public CouldNotReadInputFile(Path file, String message, Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s with exception: %s", file.toAbsolutePath().toUri(), message, getMessage(cause)), cause);
        }
    }

    /**
     * A sequence argument was missing altogether.
     */
    public static class InvalidInputType extends UserException {
        private static final long serialVersionUID = 0L;

        public InvalidInputType(final String argumentName) {
            super(String.format("%s must be a character sequence but was null", argumentName));
        }
    }

    /**
     * A sequence has no residues left once surrounding whitespace is removed.
     */
    public static class EmptySequence extends UserException {
        private static final long serialVersionUID = 0L;

        public EmptySequence(final String message) {
            super(message);
        }
    }

    public static class InvalidGapPenalty extends UserException {
        private static final long serialVersionUID = 0L;

        public InvalidGapPenalty(final String penaltyName, final double value) {
            super(String.format("%s must be <= 0 but got %s", penaltyName, value));
        }
    }

    public static class UnknownScoringMatrix extends UserException {
        private static final long serialVersionUID = 0L;

        public UnknownScoringMatrix(final String name, final Collection<String> availableNames) {
            super(String.format("Unknown scoring matrix: %s. Available matrices: %s", name, String.join(", ", availableNames)));
        }
    }

    /**
     * The requested band cannot contain an alignment of the two sequences.
     */
    public static class BandConstraintViolated extends UserException {
        private static final long serialVersionUID = 0L;

        public BandConstraintViolated(final String message) {
            super(message);
        }
    }

    public static class MalformedScoringMatrix extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedScoringMatrix(final String source, final String message) {
            super(String.format("Scoring matrix %s is malformed: %s", source, message));
        }
    }
}
