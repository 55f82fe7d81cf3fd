package org.broadinstitute.seqalign.utils.pairwise;

/**
 * Affine gap matrices over every cell, stored row-major in {@code (m+1) * (n+1)} slots.
 */
final class FullAffineGapMatrix extends AffineGapMatrix {
    private final int columns;

    FullAffineGapMatrix(final String seq1, final String seq2, final AlignmentOptions options,
                        final Boundary seq1Prefix, final Boundary seq2Prefix, final boolean local) {
        super(Math.multiplyExact(seq1.length() + 1, seq2.length() + 1), seq1, seq2, options, seq1Prefix, seq2Prefix, local);
        this.columns = seq2.length() + 1;
    }

    @Override
    protected int index(final int i, final int j) {
        if ( i < 0 || j < 0 || i > seq1.length() || j >= columns ) {
            return -1;
        }
        return i * columns + j;
    }

    @Override
    protected int firstColumn(final int i) {
        return 0;
    }

    @Override
    protected int lastColumn(final int i) {
        return columns - 1;
    }
}
