package org.broadinstitute.seqalign.utils.pairwise;

import org.broadinstitute.seqalign.exceptions.UserException;
import org.broadinstitute.seqalign.utils.Utils;
import org.broadinstitute.seqalign.utils.config.ConfigFactory;
import org.broadinstitute.seqalign.utils.config.SeqAlignConfig;
import org.broadinstitute.seqalign.utils.scoring.ScoringMatrix;
import org.broadinstitute.seqalign.utils.scoring.ScoringMatrixRegistry;

import java.util.Objects;

/**
 * Parameters of a pairwise alignment. Immutable; use {@link #builder()} to make one.
 *
 * Gap penalties are costs added to the score, so they must be zero or negative. This is checked when the options
 * are built and holds for every aligner.
 *
 * Not every aligner reads every field:
 * <ul>
 *     <li>{@code caseNormalize} is read by the global and local aligners only; the others always trim and upper-case.</li>
 *     <li>{@code gapModel} is read by the global and local aligners only.</li>
 *     <li>{@code bandwidth} is read by the banded aligner and {@code minScore} by the local aligner.</li>
 *     <li>The space-efficient aligner charges {@code gapOpen} per gap position and ignores {@code gapExtend}.</li>
 * </ul>
 */
public final class AlignmentOptions {

    private final ScoringMatrix matrix;
    private final double gapOpen;
    private final double gapExtend;
    private final boolean caseNormalize;
    private final boolean scoreNormalize;
    private final int bandwidth;
    private final double minScore;
    private final GapModel gapModel;

    private AlignmentOptions(final Builder builder) {
        this.matrix = builder.matrix;
        this.gapOpen = builder.gapOpen;
        this.gapExtend = builder.gapExtend;
        this.caseNormalize = builder.caseNormalize;
        this.scoreNormalize = builder.scoreNormalize;
        this.bandwidth = builder.bandwidth;
        this.minScore = builder.minScore;
        this.gapModel = builder.gapModel;
    }

    /**
     * @return a builder preloaded with the defaults from {@link SeqAlignConfig}
     */
    public static Builder builder() {
        return new Builder(ConfigFactory.getInstance().getSeqAlignConfig());
    }

    /**
     * @return a builder preloaded with the defaults from the given configuration
     */
    public static Builder builder(final SeqAlignConfig config) {
        return new Builder(Utils.nonNull(config, "config cannot be null"));
    }

    public static AlignmentOptions defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public ScoringMatrix getMatrix() {
        return matrix;
    }

    public double getGapOpen() {
        return gapOpen;
    }

    public double getGapExtend() {
        return gapExtend;
    }

    public boolean isCaseNormalize() {
        return caseNormalize;
    }

    public boolean isScoreNormalize() {
        return scoreNormalize;
    }

    public int getBandwidth() {
        return bandwidth;
    }

    public double getMinScore() {
        return minScore;
    }

    public GapModel getGapModel() {
        return gapModel;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final AlignmentOptions that = (AlignmentOptions) o;
        return Double.compare(that.gapOpen, gapOpen) == 0 &&
                Double.compare(that.gapExtend, gapExtend) == 0 &&
                caseNormalize == that.caseNormalize &&
                scoreNormalize == that.scoreNormalize &&
                bandwidth == that.bandwidth &&
                Double.compare(that.minScore, minScore) == 0 &&
                matrix.equals(that.matrix) &&
                gapModel == that.gapModel;
    }

    @Override
    public int hashCode() {
        return Objects.hash(matrix, gapOpen, gapExtend, caseNormalize, scoreNormalize, bandwidth, minScore, gapModel);
    }

    @Override
    public String toString() {
        return "AlignmentOptions{" +
                "matrix=" + matrix.getName() +
                ", gapOpen=" + gapOpen +
                ", gapExtend=" + gapExtend +
                ", caseNormalize=" + caseNormalize +
                ", scoreNormalize=" + scoreNormalize +
                ", bandwidth=" + bandwidth +
                ", minScore=" + minScore +
                ", gapModel=" + gapModel +
                '}';
    }

    public static final class Builder {
        private ScoringMatrix matrix;
        private double gapOpen;
        private double gapExtend;
        private boolean caseNormalize;
        private boolean scoreNormalize;
        private int bandwidth;
        private double minScore;
        private GapModel gapModel;

        private Builder(final SeqAlignConfig config) {
            this.matrix = ScoringMatrixRegistry.getMatrix(config.default_scoring_matrix());
            this.gapOpen = config.default_gap_open();
            this.gapExtend = config.default_gap_extend();
            this.caseNormalize = config.default_case_normalize();
            this.scoreNormalize = config.default_score_normalize();
            this.bandwidth = config.default_bandwidth();
            this.minScore = config.default_min_score();
            this.gapModel = config.default_gap_model();
        }

        private Builder(final AlignmentOptions options) {
            this.matrix = options.matrix;
            this.gapOpen = options.gapOpen;
            this.gapExtend = options.gapExtend;
            this.caseNormalize = options.caseNormalize;
            this.scoreNormalize = options.scoreNormalize;
            this.bandwidth = options.bandwidth;
            this.minScore = options.minScore;
            this.gapModel = options.gapModel;
        }

        /**
         * Selects a built-in matrix by name, ignoring case.
         * @throws UserException.UnknownScoringMatrix if there is no such matrix
         */
        public Builder matrix(final String name) {
            this.matrix = ScoringMatrixRegistry.getMatrix(name);
            return this;
        }

        public Builder matrix(final ScoringMatrix matrix) {
            this.matrix = Utils.nonNull(matrix, "matrix cannot be null");
            return this;
        }

        public Builder gapOpen(final double gapOpen) {
            this.gapOpen = gapOpen;
            return this;
        }

        public Builder gapExtend(final double gapExtend) {
            this.gapExtend = gapExtend;
            return this;
        }

        /**
         * Sets both gap penalties to the same value, which gives a linear gap model.
         */
        public Builder linearGap(final double gapPenalty) {
            return gapOpen(gapPenalty).gapExtend(gapPenalty);
        }

        public Builder caseNormalize(final boolean caseNormalize) {
            this.caseNormalize = caseNormalize;
            return this;
        }

        public Builder scoreNormalize(final boolean scoreNormalize) {
            this.scoreNormalize = scoreNormalize;
            return this;
        }

        public Builder bandwidth(final int bandwidth) {
            this.bandwidth = bandwidth;
            return this;
        }

        public Builder minScore(final double minScore) {
            this.minScore = minScore;
            return this;
        }

        public Builder gapModel(final GapModel gapModel) {
            this.gapModel = Utils.nonNull(gapModel, "gapModel cannot be null");
            return this;
        }

        /**
         * @throws UserException.InvalidGapPenalty if either gap penalty is positive or not a number
         */
        public AlignmentOptions build() {
            validateGapPenalty("gapOpen", gapOpen);
            validateGapPenalty("gapExtend", gapExtend);
            Utils.validateArg(!Double.isNaN(minScore), "minScore cannot be NaN");
            return new AlignmentOptions(this);
        }

        private static void validateGapPenalty(final String name, final double value) {
            if ( !(value <= 0) ) {
                throw new UserException.InvalidGapPenalty(name, value);
            }
        }
    }
}
