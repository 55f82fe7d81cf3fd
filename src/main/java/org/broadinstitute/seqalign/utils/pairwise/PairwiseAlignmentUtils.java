package org.broadinstitute.seqalign.utils.pairwise;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.seqalign.exceptions.UserException;
import org.broadinstitute.seqalign.utils.Utils;
import org.broadinstitute.seqalign.utils.scoring.ScoringMatrix;

import java.util.Locale;

/**
 * Input preparation, scoring and logging shared by the aligners.
 */
public final class PairwiseAlignmentUtils {

    static final String GOTOH_EMPTY_SEQUENCE_MESSAGE = "sequences cannot be empty";

    private PairwiseAlignmentUtils(){}

    /**
     * Checks a sequence argument and optionally strips surrounding whitespace and upper-cases it.
     *
     * @param sequence the caller's input
     * @param argumentName used in the error for a null sequence
     * @param normalize if true the sequence is stripped and upper-cased, otherwise it is used as given
     * @param emptyMessage message of the error raised for a blank sequence
     */
    static String prepareSequence(final CharSequence sequence, final String argumentName, final boolean normalize, final String emptyMessage) {
        if ( sequence == null ) {
            throw new UserException.InvalidInputType(argumentName);
        }
        final String stripped = StringUtils.strip(sequence.toString());
        if ( stripped.isEmpty() ) {
            throw new UserException.EmptySequence(emptyMessage);
        }
        return normalize ? stripped.toUpperCase(Locale.ROOT) : sequence.toString();
    }

    static String emptyOrWhitespaceMessage(final String argumentName) {
        return argumentName + " is empty or contains only whitespace";
    }

    /**
     * Applies the options that act on a finished alignment.
     */
    static AlignmentResult finish(final AlignmentResult result, final AlignmentOptions options) {
        return options.isScoreNormalize() ? result.withLengthNormalizedScore() : result;
    }

    /**
     * Scores a finished alignment column by column under an affine gap model: the first column of a gap run in
     * either sequence costs {@code gapOpen}, each further column costs {@code gapExtend}. With both penalties
     * equal this is the linear model.
     */
    public static double scoreAlignment(final String alignedSeq1, final String alignedSeq2, final ScoringMatrix matrix,
                                        final double gapOpen, final double gapExtend) {
        Utils.nonNull(alignedSeq1, "alignedSeq1");
        Utils.nonNull(alignedSeq2, "alignedSeq2");
        Utils.nonNull(matrix, "matrix");
        Utils.validateArg(alignedSeq1.length() == alignedSeq2.length(), "aligned sequences must have the same length");

        double score = 0;
        boolean inGap1 = false;
        boolean inGap2 = false;
        for ( int i = 0; i < alignedSeq1.length(); i++ ) {
            final char a = alignedSeq1.charAt(i);
            final char b = alignedSeq2.charAt(i);
            if ( a == AlignmentResult.GAP ) {
                score += inGap1 ? gapExtend : gapOpen;
                inGap1 = true;
                inGap2 = false;
            } else if ( b == AlignmentResult.GAP ) {
                score += inGap2 ? gapExtend : gapOpen;
                inGap2 = true;
                inGap1 = false;
            } else {
                score += matrix.score(a, b);
                inGap1 = false;
                inGap2 = false;
            }
        }
        return score;
    }

    static void logAlignment(final Logger logger, final String alignerName, final String seq1, final String seq2,
                             final AlignmentResult result, final long startTimeNanos) {
        if ( logger.isDebugEnabled() ) {
            logger.debug(String.format("%s alignment of %d x %d residues: score %s, %d columns in %.3f ms",
                    alignerName, seq1.length(), seq2.length(), result.getScore(), result.getAlignmentLength(),
                    (System.nanoTime() - startTimeNanos) * 1e-6));
        }
    }
}
