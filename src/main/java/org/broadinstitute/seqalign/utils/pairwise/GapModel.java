package org.broadinstitute.seqalign.utils.pairwise;

/**
 * How the global and local aligners price runs of gaps.
 */
public enum GapModel {
    /**
     * Three-state Gotoh recurrence. Exact affine pricing: a run of k gaps costs {@code gapOpen + (k-1) * gapExtend}.
     */
    AFFINE,

    /**
     * Single score matrix where a gap step is charged {@code gapExtend} only if the best path into the neighbouring
     * cell already ended in a gap of the same orientation. Cheaper, but it can misprice gaps when the best path into
     * a cell is not the best path to extend. Kept to reproduce scores from earlier releases.
     */
    DIRECTION_REMEMBERED
}
