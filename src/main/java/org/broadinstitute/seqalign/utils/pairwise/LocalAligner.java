package org.broadinstitute.seqalign.utils.pairwise;

import org.broadinstitute.seqalign.utils.Utils;

/**
 * Smith-Waterman local alignment: the highest scoring pair of substrings.
 *
 * Cells are floored at 0. When several cells share the maximum score, the first one in row-major order is the end
 * of the reported alignment. If the maximum is below {@link AlignmentOptions#getMinScore()} the result is
 * {@link AlignmentResult#empty()}.
 */
public final class LocalAligner implements PairwiseAligner {
    private static final LocalAligner ALIGNER = new LocalAligner();

    /**
     * return the stateless singleton instance of LocalAligner
     */
    public static LocalAligner getInstance() {
        return ALIGNER;
    }

    private LocalAligner(){}

    @Override
    public AlignmentResult align(final CharSequence seq1, final CharSequence seq2, final AlignmentOptions options) {
        final long startTime = System.nanoTime();
        Utils.nonNull(options, "options cannot be null");

        final String s1 = PairwiseAlignmentUtils.prepareSequence(seq1, "seq1", options.isCaseNormalize(),
                PairwiseAlignmentUtils.emptyOrWhitespaceMessage("seq1"));
        final String s2 = PairwiseAlignmentUtils.prepareSequence(seq2, "seq2", options.isCaseNormalize(),
                PairwiseAlignmentUtils.emptyOrWhitespaceMessage("seq2"));

        final double maxScore;
        final int maxRow;
        final int maxColumn;
        final Traceback traceback;
        if ( options.getGapModel() == GapModel.AFFINE ) {
            final AffineGapMatrix matrix = new FullAffineGapMatrix(s1, s2, options,
                    AffineGapMatrix.Boundary.FREE, AffineGapMatrix.Boundary.FREE, true).fill();
            maxScore = matrix.getMaxScore();
            maxRow = matrix.getMaxRow();
            maxColumn = matrix.getMaxColumn();
            traceback = matrix.traceback(maxRow, maxColumn);
        } else {
            final DirectionRememberedMatrix matrix = new DirectionRememberedMatrix(s1, s2, options, true).fill();
            maxScore = matrix.getMaxScore();
            maxRow = matrix.getMaxRow();
            maxColumn = matrix.getMaxColumn();
            traceback = matrix.traceback(maxRow, maxColumn);
        }

        final AlignmentResult result;
        if ( maxScore < options.getMinScore() ) {
            logger.debug("Local alignment score {} is below the minimum {}", maxScore, options.getMinScore());
            result = AlignmentResult.empty();
        } else {
            result = PairwiseAlignmentUtils.finish(new AlignmentResult(traceback.getAlignedSeq1(), traceback.getAlignedSeq2(), maxScore,
                    traceback.getStopRow(), maxRow, traceback.getStopColumn(), maxColumn), options);
        }
        PairwiseAlignmentUtils.logAlignment(logger, "Local", s1, s2, result, startTime);
        return result;
    }
}
