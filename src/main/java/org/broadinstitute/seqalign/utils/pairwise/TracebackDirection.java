package org.broadinstitute.seqalign.utils.pairwise;

/**
 * The predecessor recorded for a dynamic programming cell.
 */
public enum TracebackDirection {
    /** no predecessor: the origin, a free boundary, or a local alignment restart */
    NONE,
    /** residue of sequence 1 paired with residue of sequence 2 */
    DIAGONAL,
    /** residue of sequence 1 against a gap */
    UP,
    /** residue of sequence 2 against a gap */
    LEFT;

    private static final TracebackDirection[] VALUES = values();

    byte toByte() {
        return (byte) ordinal();
    }

    static TracebackDirection fromByte(final byte b) {
        return VALUES[b];
    }
}
