package org.broadinstitute.seqalign.utils.pairwise;

/**
 * The aligned strings recovered by walking back through a filled matrix, and the cell where the walk stopped.
 * The walk started at a cell chosen by the caller, so together they delimit the traced region.
 */
final class Traceback {
    private final String alignedSeq1;
    private final String alignedSeq2;
    private final int stopRow;
    private final int stopColumn;

    Traceback(final StringBuilder reversedSeq1, final StringBuilder reversedSeq2, final int stopRow, final int stopColumn) {
        this.alignedSeq1 = reversedSeq1.reverse().toString();
        this.alignedSeq2 = reversedSeq2.reverse().toString();
        this.stopRow = stopRow;
        this.stopColumn = stopColumn;
    }

    String getAlignedSeq1() {
        return alignedSeq1;
    }

    String getAlignedSeq2() {
        return alignedSeq2;
    }

    /**
     * @return number of residues of sequence 1 before the traced region
     */
    int getStopRow() {
        return stopRow;
    }

    /**
     * @return number of residues of sequence 2 before the traced region
     */
    int getStopColumn() {
        return stopColumn;
    }

    boolean reachedOrigin() {
        return stopRow == 0 && stopColumn == 0;
    }
}
