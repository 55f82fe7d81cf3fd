package org.broadinstitute.seqalign.utils.pairwise;

import org.broadinstitute.seqalign.utils.Utils;

/**
 * Semi-global alignment: every residue of both sequences appears in the result, but gaps before the start or after
 * the end of either sequence cost nothing. Suited to finding one sequence inside another or overlapping reads.
 *
 * The best end cell is searched in the last row, then the last column; the first maximal cell wins. The reported
 * interval of each sequence covers the scored core of the alignment, the columns between the free leading and the
 * free trailing gaps.
 */
public final class SemiGlobalAligner implements PairwiseAligner {
    private static final SemiGlobalAligner ALIGNER = new SemiGlobalAligner();

    /**
     * return the stateless singleton instance of SemiGlobalAligner
     */
    public static SemiGlobalAligner getInstance() {
        return ALIGNER;
    }

    private SemiGlobalAligner(){}

    @Override
    public AlignmentResult align(final CharSequence seq1, final CharSequence seq2, final AlignmentOptions options) {
        final long startTime = System.nanoTime();
        Utils.nonNull(options, "options cannot be null");

        final String s1 = PairwiseAlignmentUtils.prepareSequence(seq1, "seq1", true, PairwiseAlignmentUtils.GOTOH_EMPTY_SEQUENCE_MESSAGE);
        final String s2 = PairwiseAlignmentUtils.prepareSequence(seq2, "seq2", true, PairwiseAlignmentUtils.GOTOH_EMPTY_SEQUENCE_MESSAGE);
        final int m = s1.length();
        final int n = s2.length();

        final AffineGapMatrix matrix = new FullAffineGapMatrix(s1, s2, options,
                AffineGapMatrix.Boundary.FREE, AffineGapMatrix.Boundary.FREE, false).fill();

        double bestScore = AffineGapMatrix.UNREACHABLE;
        int endRow = m;
        int endColumn = n;
        for ( int j = 0; j <= n; j++ ) {
            if ( matrix.getBestScore(m, j) > bestScore ) {
                bestScore = matrix.getBestScore(m, j);
                endRow = m;
                endColumn = j;
            }
        }
        for ( int i = 0; i <= m; i++ ) {
            if ( matrix.getBestScore(i, n) > bestScore ) {
                bestScore = matrix.getBestScore(i, n);
                endRow = i;
                endColumn = n;
            }
        }

        final Traceback traceback = matrix.traceback(endRow, endColumn);
        final int startRow = traceback.getStopRow();
        final int startColumn = traceback.getStopColumn();
        // the traceback ends on a free boundary, so at most one sequence has an unaligned prefix, and the end cell is
        // on the last row or column, so at most one has an unaligned suffix
        final String aligned1 = s1.substring(0, startRow) + Utils.dupChar(AlignmentResult.GAP, startColumn)
                + traceback.getAlignedSeq1()
                + s1.substring(endRow) + Utils.dupChar(AlignmentResult.GAP, n - endColumn);
        final String aligned2 = Utils.dupChar(AlignmentResult.GAP, startRow) + s2.substring(0, startColumn)
                + traceback.getAlignedSeq2()
                + Utils.dupChar(AlignmentResult.GAP, m - endRow) + s2.substring(endColumn);

        final AlignmentResult result = PairwiseAlignmentUtils.finish(
                new AlignmentResult(aligned1, aligned2, bestScore, startRow, endRow, startColumn, endColumn), options);
        PairwiseAlignmentUtils.logAlignment(logger, "Semi-global", s1, s2, result, startTime);
        return result;
    }
}
