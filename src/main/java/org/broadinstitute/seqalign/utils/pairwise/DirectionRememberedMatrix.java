package org.broadinstitute.seqalign.utils.pairwise;

import org.broadinstitute.seqalign.utils.scoring.ScoringMatrix;

/**
 * Single score matrix approximation of affine gaps.
 *
 * A gap step into cell {@code (i, j)} costs {@code gapExtend} when the direction stored in the cell it comes from
 * is a gap of the same orientation, and {@code gapOpen} otherwise:
 * <pre>
 *     diagonal = H(i-1, j-1) + score(seq1[i-1], seq2[j-1])
 *     up       = H(i-1, j) + (dir(i-1, j) == UP ? gapExtend : gapOpen)
 *     left     = H(i, j-1) + (dir(i, j-1) == LEFT ? gapExtend : gapOpen)
 * </pre>
 * Only the single best path into a cell is considered for extension, so gap runs can be priced differently than
 * under {@link AffineGapMatrix}.
 *
 * In global mode row and column 0 carry the ramp {@code gapOpen + (k-1) * gapExtend} and ties go to the diagonal,
 * then up, then left. In local mode every cell is floored at 0 with no direction, and the first maximal cell in
 * row-major order is remembered.
 */
final class DirectionRememberedMatrix {

    private final String seq1;
    private final String seq2;
    private final ScoringMatrix matrix;
    private final double gapOpen;
    private final double gapExtend;
    private final boolean local;
    private final int columns;

    private final double[] scores;
    private final byte[] directions;

    private double maxScore = 0;
    private int maxRow = 0;
    private int maxColumn = 0;

    DirectionRememberedMatrix(final String seq1, final String seq2, final AlignmentOptions options, final boolean local) {
        this.seq1 = seq1;
        this.seq2 = seq2;
        this.matrix = options.getMatrix();
        this.gapOpen = options.getGapOpen();
        this.gapExtend = options.getGapExtend();
        this.local = local;
        this.columns = seq2.length() + 1;

        final int cellCount = Math.multiplyExact(seq1.length() + 1, columns);
        this.scores = new double[cellCount];
        this.directions = new byte[cellCount];
    }

    DirectionRememberedMatrix fill() {
        final int rows = seq1.length() + 1;
        if ( !local ) {
            for ( int i = 1; i < rows; i++ ) {
                scores[i * columns] = gapOpen + gapExtend * (i - 1);
                directions[i * columns] = TracebackDirection.UP.toByte();
            }
            for ( int j = 1; j < columns; j++ ) {
                scores[j] = gapOpen + gapExtend * (j - 1);
                directions[j] = TracebackDirection.LEFT.toByte();
            }
        }

        final byte upCode = TracebackDirection.UP.toByte();
        final byte leftCode = TracebackDirection.LEFT.toByte();
        for ( int i = 1; i < rows; i++ ) {
            final char a = seq1.charAt(i - 1);
            final int row = i * columns;
            final int previousRow = row - columns;
            for ( int j = 1; j < columns; j++ ) {
                final double diagonal = scores[previousRow + j - 1] + matrix.score(a, seq2.charAt(j - 1));
                final double up = scores[previousRow + j] + (directions[previousRow + j] == upCode ? gapExtend : gapOpen);
                final double left = scores[row + j - 1] + (directions[row + j - 1] == leftCode ? gapExtend : gapOpen);

                if ( local ) {
                    double bestScore = 0;
                    TracebackDirection direction = TracebackDirection.NONE;
                    if ( diagonal > bestScore ) {
                        bestScore = diagonal;
                        direction = TracebackDirection.DIAGONAL;
                    }
                    if ( up > bestScore ) {
                        bestScore = up;
                        direction = TracebackDirection.UP;
                    }
                    if ( left > bestScore ) {
                        bestScore = left;
                        direction = TracebackDirection.LEFT;
                    }
                    scores[row + j] = bestScore;
                    directions[row + j] = direction.toByte();
                    if ( bestScore > maxScore ) {
                        maxScore = bestScore;
                        maxRow = i;
                        maxColumn = j;
                    }
                } else if ( diagonal >= up && diagonal >= left ) {
                    scores[row + j] = diagonal;
                    directions[row + j] = TracebackDirection.DIAGONAL.toByte();
                } else if ( up >= left ) {
                    scores[row + j] = up;
                    directions[row + j] = upCode;
                } else {
                    scores[row + j] = left;
                    directions[row + j] = leftCode;
                }
            }
        }
        return this;
    }

    double getScore(final int i, final int j) {
        return scores[i * columns + j];
    }

    TracebackDirection getDirection(final int i, final int j) {
        return TracebackDirection.fromByte(directions[i * columns + j]);
    }

    double getMaxScore() {
        return maxScore;
    }

    int getMaxRow() {
        return maxRow;
    }

    int getMaxColumn() {
        return maxColumn;
    }

    /**
     * Follows the stored directions from {@code (endRow, endColumn)} until the origin, a cell without a direction
     * or, in local mode, a cell scoring 0.
     */
    Traceback traceback(final int endRow, final int endColumn) {
        final StringBuilder aligned1 = new StringBuilder();
        final StringBuilder aligned2 = new StringBuilder();
        int i = endRow;
        int j = endColumn;
        while ( i > 0 || j > 0 ) {
            if ( local && getScore(i, j) <= 0 ) {
                break;
            }
            final TracebackDirection direction = getDirection(i, j);
            if ( direction == TracebackDirection.DIAGONAL ) {
                aligned1.append(seq1.charAt(i - 1));
                aligned2.append(seq2.charAt(j - 1));
                i--;
                j--;
            } else if ( direction == TracebackDirection.UP ) {
                aligned1.append(seq1.charAt(i - 1));
                aligned2.append(AlignmentResult.GAP);
                i--;
            } else if ( direction == TracebackDirection.LEFT ) {
                aligned1.append(AlignmentResult.GAP);
                aligned2.append(seq2.charAt(j - 1));
                j--;
            } else {
                break;
            }
        }
        return new Traceback(aligned1, aligned2, i, j);
    }
}
