package org.broadinstitute.seqalign.utils.pairwise;

import org.broadinstitute.seqalign.utils.Utils;

/**
 * Needleman-Wunsch global alignment: every residue of both sequences is aligned, and leading or trailing gaps are
 * charged like any other gap.
 *
 * Scores with the exact affine model by default. {@link GapModel#DIRECTION_REMEMBERED} selects the single matrix
 * approximation instead.
 */
public final class GlobalAligner implements PairwiseAligner {
    private static final GlobalAligner ALIGNER = new GlobalAligner();

    /**
     * return the stateless singleton instance of GlobalAligner
     */
    public static GlobalAligner getInstance() {
        return ALIGNER;
    }

    private GlobalAligner(){}

    @Override
    public AlignmentResult align(final CharSequence seq1, final CharSequence seq2, final AlignmentOptions options) {
        final long startTime = System.nanoTime();
        Utils.nonNull(options, "options cannot be null");

        final String s1 = PairwiseAlignmentUtils.prepareSequence(seq1, "seq1", options.isCaseNormalize(),
                PairwiseAlignmentUtils.emptyOrWhitespaceMessage("seq1"));
        final String s2 = PairwiseAlignmentUtils.prepareSequence(seq2, "seq2", options.isCaseNormalize(),
                PairwiseAlignmentUtils.emptyOrWhitespaceMessage("seq2"));
        final int m = s1.length();
        final int n = s2.length();

        final double score;
        final Traceback traceback;
        if ( options.getGapModel() == GapModel.AFFINE ) {
            final AffineGapMatrix matrix = new FullAffineGapMatrix(s1, s2, options,
                    AffineGapMatrix.Boundary.PENALIZED, AffineGapMatrix.Boundary.PENALIZED, false).fill();
            score = matrix.getBestScore(m, n);
            traceback = matrix.traceback(m, n);
        } else {
            final DirectionRememberedMatrix matrix = new DirectionRememberedMatrix(s1, s2, options, false).fill();
            score = matrix.getScore(m, n);
            traceback = matrix.traceback(m, n);
        }
        Utils.validate(traceback.reachedOrigin(), () -> "global traceback stopped at (" + traceback.getStopRow() + ", " + traceback.getStopColumn() + ")");

        final AlignmentResult result = PairwiseAlignmentUtils.finish(
                new AlignmentResult(traceback.getAlignedSeq1(), traceback.getAlignedSeq2(), score, 0, m, 0, n), options);
        PairwiseAlignmentUtils.logAlignment(logger, "Global", s1, s2, result, startTime);
        return result;
    }
}
