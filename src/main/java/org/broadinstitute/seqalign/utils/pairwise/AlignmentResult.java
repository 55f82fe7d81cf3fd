package org.broadinstitute.seqalign.utils.pairwise;

import htsjdk.samtools.Cigar;
import htsjdk.samtools.CigarElement;
import htsjdk.samtools.CigarOperator;
import org.broadinstitute.seqalign.utils.Utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The outcome of a pairwise alignment.
 *
 * The two aligned strings have the same length and use {@link #GAP} for gap columns. Coordinates are 0-based and
 * half-open into the sequences as the aligner saw them (after trimming), and delimit the residues that take part in
 * the alignment: {@code [startPos1, endPos1)} of sequence 1 and {@code [startPos2, endPos2)} of sequence 2.
 */
public final class AlignmentResult {

    public static final char GAP = '-';

    private static final AlignmentResult EMPTY = new AlignmentResult("", "", 0, 0, 0, 0, 0);

    private final String alignedSeq1;
    private final String alignedSeq2;
    private final double score;
    private final int startPos1;
    private final int startPos2;
    private final int endPos1;
    private final int endPos2;
    private final int identity;

    public AlignmentResult(final String alignedSeq1, final String alignedSeq2, final double score,
                           final int startPos1, final int endPos1, final int startPos2, final int endPos2) {
        Utils.nonNull(alignedSeq1, "alignedSeq1");
        Utils.nonNull(alignedSeq2, "alignedSeq2");
        Utils.validateArg(alignedSeq1.length() == alignedSeq2.length(), () ->
                "aligned sequences must have the same length but were " + alignedSeq1.length() + " and " + alignedSeq2.length());
        Utils.validateArg(0 <= startPos1 && startPos1 <= endPos1, () -> "bad sequence 1 interval [" + startPos1 + ", " + endPos1 + ")");
        Utils.validateArg(0 <= startPos2 && startPos2 <= endPos2, () -> "bad sequence 2 interval [" + startPos2 + ", " + endPos2 + ")");

        this.alignedSeq1 = alignedSeq1;
        this.alignedSeq2 = alignedSeq2;
        this.score = score;
        this.startPos1 = startPos1;
        this.startPos2 = startPos2;
        this.endPos1 = endPos1;
        this.endPos2 = endPos2;
        this.identity = countIdentity(alignedSeq1, alignedSeq2);
    }

    /**
     * @return the result reported when a local alignment scores below the requested minimum
     */
    public static AlignmentResult empty() {
        return EMPTY;
    }

    private static int countIdentity(final String alignedSeq1, final String alignedSeq2) {
        int identity = 0;
        for ( int i = 0; i < alignedSeq1.length(); i++ ) {
            final char a = alignedSeq1.charAt(i);
            if ( a != GAP && a == alignedSeq2.charAt(i) ) {
                identity++;
            }
        }
        return identity;
    }

    /**
     * Returns a copy of this result with the score divided by the alignment length, or 0 for an empty alignment.
     */
    AlignmentResult withLengthNormalizedScore() {
        final double normalized = getAlignmentLength() == 0 ? 0 : score / getAlignmentLength();
        return new AlignmentResult(alignedSeq1, alignedSeq2, normalized, startPos1, endPos1, startPos2, endPos2);
    }

    public String getAlignedSeq1() {
        return alignedSeq1;
    }

    public String getAlignedSeq2() {
        return alignedSeq2;
    }

    public double getScore() {
        return score;
    }

    public int getStartPos1() {
        return startPos1;
    }

    public int getStartPos2() {
        return startPos2;
    }

    public int getEndPos1() {
        return endPos1;
    }

    public int getEndPos2() {
        return endPos2;
    }

    /**
     * @return the number of columns where both sequences have the same residue
     */
    public int getIdentity() {
        return identity;
    }

    /**
     * @return {@code 100 * identity / alignmentLength}, or 0 for an empty alignment
     */
    public double getIdentityPercent() {
        return alignedSeq1.isEmpty() ? 0 : 100.0 * identity / alignedSeq1.length();
    }

    public int getAlignmentLength() {
        return alignedSeq1.length();
    }

    public boolean isEmpty() {
        return alignedSeq1.isEmpty();
    }

    /**
     * Describes the alignment as a CIGAR with sequence 1 as the reference: paired columns are {@code M}, a gap in
     * sequence 2 is {@code D} and a gap in sequence 1 is {@code I}.
     */
    public Cigar getCigar() {
        final List<CigarElement> elements = new ArrayList<>();
        CigarOperator current = null;
        int length = 0;
        for ( int i = 0; i < alignedSeq1.length(); i++ ) {
            final CigarOperator op = alignedSeq2.charAt(i) == GAP ? CigarOperator.D
                    : alignedSeq1.charAt(i) == GAP ? CigarOperator.I
                    : CigarOperator.M;
            if ( op == current ) {
                length++;
            } else {
                if ( current != null ) {
                    elements.add(new CigarElement(length, current));
                }
                current = op;
                length = 1;
            }
        }
        if ( current != null ) {
            elements.add(new CigarElement(length, current));
        }
        return new Cigar(elements);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final AlignmentResult that = (AlignmentResult) o;

        if (Double.compare(that.score, score) != 0) return false;
        if (startPos1 != that.startPos1) return false;
        if (startPos2 != that.startPos2) return false;
        if (endPos1 != that.endPos1) return false;
        if (endPos2 != that.endPos2) return false;
        if (!alignedSeq1.equals(that.alignedSeq1)) return false;
        return alignedSeq2.equals(that.alignedSeq2);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alignedSeq1, alignedSeq2, score, startPos1, startPos2, endPos1, endPos2);
    }

    @Override
    public String toString() {
        return String.format("AlignmentResult{%s / %s, score=%s, seq1=[%d, %d), seq2=[%d, %d), identity=%d/%d}",
                alignedSeq1, alignedSeq2, score, startPos1, endPos1, startPos2, endPos2, identity, getAlignmentLength());
    }
}
