package org.broadinstitute.seqalign.utils.pairwise;

import org.broadinstitute.seqalign.exceptions.UserException;
import org.broadinstitute.seqalign.utils.Utils;

/**
 * Global alignment restricted to the diagonal band {@code |j - i| <= k}, {@code k} being
 * {@link AlignmentOptions#getBandwidth()}. Time and memory are {@code O(m * k)}, so it suits long, similar sequences
 * with few indels. Scores equal {@link GlobalAligner} whenever the optimal alignment stays in the band.
 */
public final class BandedAligner implements PairwiseAligner {
    private static final BandedAligner ALIGNER = new BandedAligner();

    /**
     * return the stateless singleton instance of BandedAligner
     */
    public static BandedAligner getInstance() {
        return ALIGNER;
    }

    private BandedAligner(){}

    /**
     * @throws UserException.BandConstraintViolated if the bandwidth is negative, if the lengths differ by more than
     * the bandwidth, or if no alignment inside the band reaches the end of both sequences
     */
    @Override
    public AlignmentResult align(final CharSequence seq1, final CharSequence seq2, final AlignmentOptions options) {
        final long startTime = System.nanoTime();
        Utils.nonNull(options, "options cannot be null");

        final String s1 = PairwiseAlignmentUtils.prepareSequence(seq1, "seq1", true, PairwiseAlignmentUtils.GOTOH_EMPTY_SEQUENCE_MESSAGE);
        final String s2 = PairwiseAlignmentUtils.prepareSequence(seq2, "seq2", true, PairwiseAlignmentUtils.GOTOH_EMPTY_SEQUENCE_MESSAGE);
        final int m = s1.length();
        final int n = s2.length();
        final int bandwidth = options.getBandwidth();

        if ( bandwidth < 0 ) {
            throw new UserException.BandConstraintViolated("bandwidth must be >= 0 but got " + bandwidth);
        }
        if ( Math.abs(m - n) > bandwidth ) {
            throw new UserException.BandConstraintViolated(String.format(
                    "sequence lengths %d and %d differ by more than the bandwidth %d, so no alignment in the band can reach the end of both",
                    m, n, bandwidth));
        }

        final AffineGapMatrix matrix = new BandedAffineGapMatrix(s1, s2, options, bandwidth).fill();
        final double score = matrix.getBestScore(m, n);
        if ( score == AffineGapMatrix.UNREACHABLE ) {
            throw new UserException.BandConstraintViolated(String.format(
                    "no alignment within bandwidth %d reaches the end of both sequences, increase the bandwidth", bandwidth));
        }

        final Traceback traceback = matrix.traceback(m, n);
        if ( !traceback.reachedOrigin() ) {
            throw new UserException.BandConstraintViolated(String.format(
                    "traceback found no direction at cell (%d, %d) within bandwidth %d, increase the bandwidth",
                    traceback.getStopRow(), traceback.getStopColumn(), bandwidth));
        }

        final AlignmentResult result = PairwiseAlignmentUtils.finish(
                new AlignmentResult(traceback.getAlignedSeq1(), traceback.getAlignedSeq2(), score, 0, m, 0, n), options);
        PairwiseAlignmentUtils.logAlignment(logger, "Banded", s1, s2, result, startTime);
        return result;
    }
}
