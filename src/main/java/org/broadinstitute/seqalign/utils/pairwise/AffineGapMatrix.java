package org.broadinstitute.seqalign.utils.pairwise;

import org.broadinstitute.seqalign.exceptions.SeqAlignException;
import org.broadinstitute.seqalign.utils.scoring.ScoringMatrix;

/**
 * Dynamic programming matrices of the three-state (Gotoh) affine gap recurrence.
 *
 * For every cell {@code (i, j)}, {@code i} residues of sequence 1 against {@code j} residues of sequence 2:
 * <pre>
 *     up(i, j)   = max(best(i-1, j) + gapOpen, up(i-1, j) + gapExtend)       alignment ends with seq1[i-1] over a gap
 *     left(i, j) = max(best(i, j-1) + gapOpen, left(i, j-1) + gapExtend)     alignment ends with seq2[j-1] over a gap
 *     best(i, j) = max(best(i-1, j-1) + score(seq1[i-1], seq2[j-1]), up(i, j), left(i, j))
 * </pre>
 * Ties in {@code best} go to the diagonal, then up, then left. Ties between opening and extending a gap go to
 * opening. Each gap matrix remembers whether its value came from extending, so the traceback walks a gap run back
 * to the cell where it was opened and the traced alignment scores exactly {@code best} at its end cell.
 *
 * Row 0 and column 0 are either free (score 0, nothing to trace) or penalized with the affine ramp
 * {@code gapOpen + (k-1) * gapExtend}. In local mode every cell is floored at 0 and the maximum cell is tracked.
 *
 * Subclasses decide which cells exist and where they are stored. Cells that do not exist read as unreachable.
 */
abstract class AffineGapMatrix {

    static final double UNREACHABLE = Double.NEGATIVE_INFINITY;

    /**
     * How the first row or column of the matrix is initialized.
     */
    enum Boundary {
        /** leading gaps cost the affine ramp */
        PENALIZED,
        /** leading gaps cost nothing */
        FREE
    }

    private enum State {
        BEST,
        UP_GAP,
        LEFT_GAP
    }

    protected final String seq1;
    protected final String seq2;
    private final ScoringMatrix matrix;
    private final double gapOpen;
    private final double gapExtend;
    private final Boundary seq1Prefix;
    private final Boundary seq2Prefix;
    private final boolean local;

    private final double[] best;
    private final double[] up;
    private final double[] left;
    private final byte[] directions;
    private final boolean[] upExtends;
    private final boolean[] leftExtends;

    private double maxScore = 0;
    private int maxRow = 0;
    private int maxColumn = 0;

    /**
     * @param cellCount number of cells the subclass addresses through {@link #index(int, int)}
     * @param seq1Prefix initialization of column 0, where a prefix of sequence 1 faces gaps
     * @param seq2Prefix initialization of row 0, where a prefix of sequence 2 faces gaps
     */
    protected AffineGapMatrix(final int cellCount, final String seq1, final String seq2, final AlignmentOptions options,
                              final Boundary seq1Prefix, final Boundary seq2Prefix, final boolean local) {
        this.seq1 = seq1;
        this.seq2 = seq2;
        this.matrix = options.getMatrix();
        this.gapOpen = options.getGapOpen();
        this.gapExtend = options.getGapExtend();
        this.seq1Prefix = seq1Prefix;
        this.seq2Prefix = seq2Prefix;
        this.local = local;

        this.best = new double[cellCount];
        this.up = new double[cellCount];
        this.left = new double[cellCount];
        this.directions = new byte[cellCount];
        this.upExtends = new boolean[cellCount];
        this.leftExtends = new boolean[cellCount];
    }

    /**
     * @return storage offset of cell {@code (i, j)}, or -1 if this matrix does not hold that cell
     */
    protected abstract int index(int i, int j);

    /**
     * @return the first column held in row {@code i}
     */
    protected abstract int firstColumn(int i);

    /**
     * @return the last column held in row {@code i}
     */
    protected abstract int lastColumn(int i);

    /**
     * Runs the forward recurrence over every cell this matrix holds, row by row.
     * @return this matrix
     */
    AffineGapMatrix fill() {
        final int rows = seq1.length();
        for ( int i = 0; i <= rows; i++ ) {
            for ( int j = firstColumn(i), last = lastColumn(i); j <= last; j++ ) {
                final int cell = index(i, j);
                if ( i == 0 && j == 0 ) {
                    set(cell, 0, TracebackDirection.NONE, UNREACHABLE, false, UNREACHABLE, false);
                } else if ( j == 0 ) {
                    if ( seq1Prefix == Boundary.FREE ) {
                        set(cell, 0, TracebackDirection.NONE, UNREACHABLE, false, UNREACHABLE, false);
                    } else {
                        final double ramp = gapOpen + gapExtend * (i - 1);
                        set(cell, ramp, TracebackDirection.UP, ramp, i > 1, UNREACHABLE, false);
                    }
                } else if ( i == 0 ) {
                    if ( seq2Prefix == Boundary.FREE ) {
                        set(cell, 0, TracebackDirection.NONE, UNREACHABLE, false, UNREACHABLE, false);
                    } else {
                        final double ramp = gapOpen + gapExtend * (j - 1);
                        set(cell, ramp, TracebackDirection.LEFT, UNREACHABLE, false, ramp, j > 1);
                    }
                } else {
                    fillCell(cell, i, j);
                }
            }
        }
        return this;
    }

    private void fillCell(final int cell, final int i, final int j) {
        final double upOpen = getBestScore(i - 1, j) + gapOpen;
        final double upExtend = getUpGapScore(i - 1, j) + gapExtend;
        final double upScore = Math.max(upOpen, upExtend);

        final double leftOpen = getBestScore(i, j - 1) + gapOpen;
        final double leftExtend = getLeftGapScore(i, j - 1) + gapExtend;
        final double leftScore = Math.max(leftOpen, leftExtend);

        final double diagonal = getBestScore(i - 1, j - 1) + matrix.score(seq1.charAt(i - 1), seq2.charAt(j - 1));

        double bestScore = Math.max(diagonal, Math.max(upScore, leftScore));
        TracebackDirection direction;
        if ( bestScore == UNREACHABLE ) {
            direction = TracebackDirection.NONE;
        } else if ( bestScore == diagonal ) {
            direction = TracebackDirection.DIAGONAL;
        } else if ( bestScore == upScore ) {
            direction = TracebackDirection.UP;
        } else {
            direction = TracebackDirection.LEFT;
        }

        if ( local && bestScore <= 0 ) {
            bestScore = 0;
            direction = TracebackDirection.NONE;
        }

        set(cell, bestScore, direction, upScore, upExtend > upOpen, leftScore, leftExtend > leftOpen);

        // strict: the first maximal cell in row-major order is kept
        if ( local && bestScore > maxScore ) {
            maxScore = bestScore;
            maxRow = i;
            maxColumn = j;
        }
    }

    private void set(final int cell, final double bestScore, final TracebackDirection direction,
                     final double upScore, final boolean upExtended, final double leftScore, final boolean leftExtended) {
        best[cell] = bestScore;
        directions[cell] = direction.toByte();
        up[cell] = upScore;
        upExtends[cell] = upExtended;
        left[cell] = leftScore;
        leftExtends[cell] = leftExtended;
    }

    double getBestScore(final int i, final int j) {
        final int cell = index(i, j);
        return cell < 0 ? UNREACHABLE : best[cell];
    }

    double getUpGapScore(final int i, final int j) {
        final int cell = index(i, j);
        return cell < 0 ? UNREACHABLE : up[cell];
    }

    double getLeftGapScore(final int i, final int j) {
        final int cell = index(i, j);
        return cell < 0 ? UNREACHABLE : left[cell];
    }

    TracebackDirection getDirection(final int i, final int j) {
        final int cell = index(i, j);
        return cell < 0 ? TracebackDirection.NONE : TracebackDirection.fromByte(directions[cell]);
    }

    /**
     * @return the highest cell score seen in local mode, 0 otherwise
     */
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
     * Walks back from {@code (endRow, endColumn)} until the origin, a cell with no recorded predecessor, or
     * (in local mode) a cell scoring 0.
     */
    Traceback traceback(final int endRow, final int endColumn) {
        final StringBuilder aligned1 = new StringBuilder();
        final StringBuilder aligned2 = new StringBuilder();
        int i = endRow;
        int j = endColumn;
        State state = State.BEST;

        while ( i > 0 || j > 0 ) {
            if ( state == State.BEST ) {
                final int cell = index(i, j);
                if ( cell < 0 ) {
                    break;
                }
                final TracebackDirection direction = TracebackDirection.fromByte(directions[cell]);
                if ( direction == TracebackDirection.NONE || (local && best[cell] <= 0) ) {
                    break;
                }
                if ( direction == TracebackDirection.DIAGONAL ) {
                    aligned1.append(seq1.charAt(i - 1));
                    aligned2.append(seq2.charAt(j - 1));
                    i--;
                    j--;
                    continue;
                }
                state = direction == TracebackDirection.UP ? State.UP_GAP : State.LEFT_GAP;
            }

            final int cell = index(i, j);
            if ( cell < 0 ) {
                throw new SeqAlignException.ShouldNeverReachHereException(
                        String.format("gap run traced to cell (%d, %d) which is not held by the matrix", i, j));
            }
            if ( state == State.UP_GAP ) {
                final boolean extended = upExtends[cell];
                aligned1.append(seq1.charAt(i - 1));
                aligned2.append(AlignmentResult.GAP);
                i--;
                state = extended ? State.UP_GAP : State.BEST;
            } else {
                final boolean extended = leftExtends[cell];
                aligned1.append(AlignmentResult.GAP);
                aligned2.append(seq2.charAt(j - 1));
                j--;
                state = extended ? State.LEFT_GAP : State.BEST;
            }
        }
        return new Traceback(aligned1, aligned2, i, j);
    }
}
