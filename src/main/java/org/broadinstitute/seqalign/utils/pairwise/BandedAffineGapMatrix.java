package org.broadinstitute.seqalign.utils.pairwise;

/**
 * Affine gap matrices restricted to the diagonal band {@code |j - i| <= k}.
 *
 * Row {@code i} keeps its {@code 2k+1} band cells contiguously, addressed by the diagonal offset {@code j - i + k},
 * so the matrices take {@code (m+1) * (2k+1)} slots. Cells outside the band read as unreachable. Both leading
 * boundaries are penalized.
 */
final class BandedAffineGapMatrix extends AffineGapMatrix {
    private final int bandwidth;
    private final int width;

    BandedAffineGapMatrix(final String seq1, final String seq2, final AlignmentOptions options, final int bandwidth) {
        super(Math.multiplyExact(seq1.length() + 1, 2 * effectiveBandwidth(seq1, seq2, bandwidth) + 1),
                seq1, seq2, options, Boundary.PENALIZED, Boundary.PENALIZED, false);
        this.bandwidth = effectiveBandwidth(seq1, seq2, bandwidth);
        this.width = 2 * this.bandwidth + 1;
    }

    // a band wider than the longer sequence holds no extra cells
    private static int effectiveBandwidth(final String seq1, final String seq2, final int bandwidth) {
        return Math.min(bandwidth, Math.max(seq1.length(), seq2.length()));
    }

    @Override
    protected int index(final int i, final int j) {
        final int offset = j - i + bandwidth;
        if ( i < 0 || j < 0 || i > seq1.length() || j > seq2.length() || offset < 0 || offset >= width ) {
            return -1;
        }
        return i * width + offset;
    }

    @Override
    protected int firstColumn(final int i) {
        return Math.max(0, i - bandwidth);
    }

    @Override
    protected int lastColumn(final int i) {
        return Math.min(seq2.length(), i + bandwidth);
    }
}
