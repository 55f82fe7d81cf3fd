package org.broadinstitute.seqalign.utils.pairwise;

import org.broadinstitute.seqalign.utils.Utils;

/**
 * Overlap alignment of a suffix of sequence 1 with a prefix of sequence 2, as when joining two reads end to end.
 *
 * Gaps facing the start of sequence 2 and the end of sequence 1 are free. Leading gaps in sequence 1 are charged
 * like any other gap, and sequence 2 is aligned to its last residue. The best end cell is the first maximal cell of
 * the last column. The reported intervals cover the scored core of the alignment.
 */
public final class OverlapAligner implements PairwiseAligner {
    private static final OverlapAligner ALIGNER = new OverlapAligner();

    /**
     * return the stateless singleton instance of OverlapAligner
     */
    public static OverlapAligner getInstance() {
        return ALIGNER;
    }

    private OverlapAligner(){}

    @Override
    public AlignmentResult align(final CharSequence seq1, final CharSequence seq2, final AlignmentOptions options) {
        final long startTime = System.nanoTime();
        Utils.nonNull(options, "options cannot be null");

        final String s1 = PairwiseAlignmentUtils.prepareSequence(seq1, "seq1", true, PairwiseAlignmentUtils.GOTOH_EMPTY_SEQUENCE_MESSAGE);
        final String s2 = PairwiseAlignmentUtils.prepareSequence(seq2, "seq2", true, PairwiseAlignmentUtils.GOTOH_EMPTY_SEQUENCE_MESSAGE);
        final int m = s1.length();
        final int n = s2.length();

        final AffineGapMatrix matrix = new FullAffineGapMatrix(s1, s2, options,
                AffineGapMatrix.Boundary.PENALIZED, AffineGapMatrix.Boundary.FREE, false).fill();

        double bestScore = AffineGapMatrix.UNREACHABLE;
        int endRow = m;
        for ( int i = 0; i <= m; i++ ) {
            if ( matrix.getBestScore(i, n) > bestScore ) {
                bestScore = matrix.getBestScore(i, n);
                endRow = i;
            }
        }

        final Traceback traceback = matrix.traceback(endRow, n);
        // column 0 is penalized, so the walk can only stop on row 0
        Utils.validate(traceback.getStopRow() == 0, () -> "overlap traceback stopped inside sequence 1 at row " + traceback.getStopRow());
        final int startColumn = traceback.getStopColumn();

        final String aligned1 = Utils.dupChar(AlignmentResult.GAP, startColumn) + traceback.getAlignedSeq1() + s1.substring(endRow);
        final String aligned2 = s2.substring(0, startColumn) + traceback.getAlignedSeq2() + Utils.dupChar(AlignmentResult.GAP, m - endRow);

        final AlignmentResult result = PairwiseAlignmentUtils.finish(
                new AlignmentResult(aligned1, aligned2, bestScore, 0, endRow, startColumn, n), options);
        PairwiseAlignmentUtils.logAlignment(logger, "Overlap", s1, s2, result, startTime);
        return result;
    }
}
