package org.broadinstitute.seqalign.utils.pairwise;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.seqalign.exceptions.UserException;

import java.util.function.Supplier;

/**
 * Interface and factory for pairwise sequence aligners.
 *
 * Implementations are stateless: every call allocates its own matrices, so a single instance can be shared by any
 * number of threads aligning independent inputs.
 */
public interface PairwiseAligner {
    Logger logger = LogManager.getLogger(PairwiseAligner.class);

    /**
     * Aligns {@code seq1} against {@code seq2}.
     *
     * @param seq1 residues of the first sequence, case-insensitive
     * @param seq2 residues of the second sequence, case-insensitive
     * @param options scoring and variant parameters
     * @throws UserException.InvalidInputType if either sequence is null
     * @throws UserException.EmptySequence if either sequence is empty once whitespace is removed
     */
    AlignmentResult align(final CharSequence seq1, final CharSequence seq2, final AlignmentOptions options);

    /**
     * Aligns with {@link #getDefaultOptions()}.
     */
    default AlignmentResult align(final CharSequence seq1, final CharSequence seq2) {
        return align(seq1, seq2, getDefaultOptions());
    }

    /**
     * @return the options used when none are given
     */
    default AlignmentOptions getDefaultOptions() {
        return AlignmentOptions.defaults();
    }

    enum Implementation {
        /**
         * Needleman-Wunsch: end to end over both sequences
         */
        GLOBAL(GlobalAligner::getInstance),

        /**
         * Smith-Waterman: the best scoring pair of substrings
         */
        LOCAL(LocalAligner::getInstance),

        /**
         * end to end, but gaps before or after either sequence are free
         */
        SEMI_GLOBAL(SemiGlobalAligner::getInstance),

        /**
         * free leading gaps in sequence 2 and free trailing gaps in sequence 1, for suffix/prefix overlaps
         */
        OVERLAP(OverlapAligner::getInstance),

        /**
         * global alignment restricted to a diagonal band
         */
        BANDED(BandedAligner::getInstance),

        /**
         * Hirschberg: global alignment with a linear gap cost in linear space
         */
        SPACE_EFFICIENT(SpaceEfficientAligner::getInstance);

        private final Supplier<PairwiseAligner> alignerSupplier;

        Implementation(final Supplier<PairwiseAligner> alignerSupplier) {
            this.alignerSupplier = alignerSupplier;
        }

        private PairwiseAligner createAligner() {
            return alignerSupplier.get();
        }
    }

    /**
     * Factory method to get an instance of an aligner corresponding to the given implementation
     */
    static PairwiseAligner getAligner(final Implementation type) {
        return type.createAligner();
    }
}
