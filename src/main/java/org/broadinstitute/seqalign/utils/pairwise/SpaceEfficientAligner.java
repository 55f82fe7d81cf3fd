package org.broadinstitute.seqalign.utils.pairwise;

import com.google.common.annotations.VisibleForTesting;
import org.broadinstitute.seqalign.utils.Utils;
import org.broadinstitute.seqalign.utils.config.ConfigFactory;
import org.broadinstitute.seqalign.utils.scoring.ScoringMatrix;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Hirschberg's divide and conquer global alignment, in linear space.
 *
 * Gaps are linear: every gap column costs {@link AlignmentOptions#getGapOpen()} and the extension penalty is not
 * used. Each step splits sequence 1 in half and finds where to split sequence 2 by combining the last row of a
 * forward pass over the first half with the last row of a pass over the reversed second half. Only two rows are kept
 * at a time, and pending subproblems sit on an explicit stack instead of the call stack.
 *
 * The reported score is recomputed from the assembled alignment.
 */
public final class SpaceEfficientAligner implements PairwiseAligner {
    private static final SpaceEfficientAligner ALIGNER = new SpaceEfficientAligner();

    /**
     * return the stateless singleton instance of SpaceEfficientAligner
     */
    public static SpaceEfficientAligner getInstance() {
        return ALIGNER;
    }

    private SpaceEfficientAligner(){}

    /**
     * A half-open slice of each sequence still to be aligned.
     */
    private static final class Subproblem {
        final int start1;
        final int end1;
        final int start2;
        final int end2;

        Subproblem(final int start1, final int end1, final int start2, final int end2) {
            this.start1 = start1;
            this.end1 = end1;
            this.start2 = start2;
            this.end2 = end2;
        }
    }

    /**
     * The shared defaults, with the gap penalty replaced by
     * {@link org.broadinstitute.seqalign.utils.config.SeqAlignConfig#space_efficient_default_gap_penalty()}.
     */
    @Override
    public AlignmentOptions getDefaultOptions() {
        return AlignmentOptions.builder()
                .gapOpen(ConfigFactory.getInstance().getSeqAlignConfig().space_efficient_default_gap_penalty())
                .build();
    }

    @Override
    public AlignmentResult align(final CharSequence seq1, final CharSequence seq2, final AlignmentOptions options) {
        final long startTime = System.nanoTime();
        Utils.nonNull(options, "options cannot be null");

        final String s1 = PairwiseAlignmentUtils.prepareSequence(seq1, "seq1", true, PairwiseAlignmentUtils.GOTOH_EMPTY_SEQUENCE_MESSAGE);
        final String s2 = PairwiseAlignmentUtils.prepareSequence(seq2, "seq2", true, PairwiseAlignmentUtils.GOTOH_EMPTY_SEQUENCE_MESSAGE);
        final ScoringMatrix matrix = options.getMatrix();
        final double gap = options.getGapOpen();

        final StringBuilder aligned1 = new StringBuilder(s1.length() + s2.length());
        final StringBuilder aligned2 = new StringBuilder(s1.length() + s2.length());
        final Deque<Subproblem> work = new ArrayDeque<>();
        work.push(new Subproblem(0, s1.length(), 0, s2.length()));

        // left halves are pushed last, so pieces come off the stack in alignment order
        while ( !work.isEmpty() ) {
            final Subproblem problem = work.pop();
            final int length1 = problem.end1 - problem.start1;
            final int length2 = problem.end2 - problem.start2;

            if ( length1 == 0 ) {
                aligned1.append(Utils.dupChar(AlignmentResult.GAP, length2));
                aligned2.append(s2, problem.start2, problem.end2);
            } else if ( length2 == 0 ) {
                aligned1.append(s1, problem.start1, problem.end1);
                aligned2.append(Utils.dupChar(AlignmentResult.GAP, length1));
            } else if ( length1 == 1 ) {
                alignSingleResidue(s1.charAt(problem.start1), s2.substring(problem.start2, problem.end2), matrix, gap, aligned1, aligned2);
            } else {
                final int middle1 = problem.start1 + length1 / 2;
                final double[] forward = lastRowScores(s1, problem.start1, middle1, s2, problem.start2, problem.end2, matrix, gap, false);
                final double[] backward = lastRowScores(s1, middle1, problem.end1, s2, problem.start2, problem.end2, matrix, gap, true);

                int split = 0;
                double bestTotal = Double.NEGATIVE_INFINITY;
                for ( int j = 0; j <= length2; j++ ) {
                    final double total = forward[j] + backward[length2 - j];
                    if ( total > bestTotal ) {
                        bestTotal = total;
                        split = j;
                    }
                }

                work.push(new Subproblem(middle1, problem.end1, problem.start2 + split, problem.end2));
                work.push(new Subproblem(problem.start1, middle1, problem.start2, problem.start2 + split));
            }
        }

        final String alignedSeq1 = aligned1.toString();
        final String alignedSeq2 = aligned2.toString();
        final double score = PairwiseAlignmentUtils.scoreAlignment(alignedSeq1, alignedSeq2, matrix, gap, gap);

        final AlignmentResult result = PairwiseAlignmentUtils.finish(
                new AlignmentResult(alignedSeq1, alignedSeq2, score, 0, s1.length(), 0, s2.length()), options);
        PairwiseAlignmentUtils.logAlignment(logger, "Space-efficient", s1, s2, result, startTime);
        return result;
    }

    /**
     * Last row of the linear gap Needleman-Wunsch matrix of {@code seq1[start1, end1)} against
     * {@code seq2[start2, end2)}, or of both slices reversed. Entry {@code j} scores the whole first slice against
     * the first {@code j} residues (in pass order) of the second.
     */
    @VisibleForTesting
    static double[] lastRowScores(final String seq1, final int start1, final int end1,
                                  final String seq2, final int start2, final int end2,
                                  final ScoringMatrix matrix, final double gap, final boolean reverse) {
        final int length2 = end2 - start2;
        double[] previous = new double[length2 + 1];
        double[] current = new double[length2 + 1];
        for ( int j = 0; j <= length2; j++ ) {
            previous[j] = j * gap;
        }

        for ( int i = 1; i <= end1 - start1; i++ ) {
            final char a = reverse ? seq1.charAt(end1 - i) : seq1.charAt(start1 + i - 1);
            current[0] = i * gap;
            for ( int j = 1; j <= length2; j++ ) {
                final char b = reverse ? seq2.charAt(end2 - j) : seq2.charAt(start2 + j - 1);
                final double diagonal = previous[j - 1] + matrix.score(a, b);
                current[j] = Math.max(diagonal, Math.max(previous[j] + gap, current[j - 1] + gap));
            }
            final double[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous;
    }

    /**
     * Places a single residue against {@code seq2}. The residue is paired at the lowest-offset best position unless
     * leaving it unpaired scores strictly better.
     */
    private static void alignSingleResidue(final char residue, final String seq2, final ScoringMatrix matrix, final double gap,
                                           final StringBuilder aligned1, final StringBuilder aligned2) {
        final int length2 = seq2.length();
        int bestOffset = 0;
        double bestScore = Double.NEGATIVE_INFINITY;
        for ( int offset = 0; offset < length2; offset++ ) {
            final double score = offset * gap + matrix.score(residue, seq2.charAt(offset)) + (length2 - offset - 1) * gap;
            if ( score > bestScore ) {
                bestScore = score;
                bestOffset = offset;
            }
        }

        if ( (length2 + 1) * gap > bestScore ) {
            aligned1.append(residue).append(Utils.dupChar(AlignmentResult.GAP, length2));
            aligned2.append(AlignmentResult.GAP).append(seq2);
        } else {
            aligned1.append(Utils.dupChar(AlignmentResult.GAP, bestOffset)).append(residue)
                    .append(Utils.dupChar(AlignmentResult.GAP, length2 - bestOffset - 1));
            aligned2.append(seq2);
        }
    }
}
