package org.broadinstitute.seqalign.utils.pairwise;

import org.broadinstitute.seqalign.exceptions.UserException;
import org.broadinstitute.seqalign.testutils.BaseTest;
import org.broadinstitute.seqalign.utils.config.ConfigFactory;
import org.broadinstitute.seqalign.utils.config.SeqAlignConfig;
import org.broadinstitute.seqalign.utils.scoring.ScoringMatrix;
import org.broadinstitute.seqalign.utils.scoring.ScoringMatrixRegistry;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class AlignmentOptionsUnitTest extends BaseTest {

    @Test
    public void testDefaults() {
        final AlignmentOptions defaults = AlignmentOptions.defaults();
        Assert.assertEquals(defaults.getMatrix().getName(), ScoringMatrixRegistry.BLOSUM62);
        assertEqualsDoubleSmart(defaults.getGapOpen(), -10.0);
        assertEqualsDoubleSmart(defaults.getGapExtend(), -1.0);
        Assert.assertTrue(defaults.isCaseNormalize());
        Assert.assertFalse(defaults.isScoreNormalize());
        Assert.assertEquals(defaults.getBandwidth(), 10);
        assertEqualsDoubleSmart(defaults.getMinScore(), 0.0);
        Assert.assertEquals(defaults.getGapModel(), GapModel.AFFINE);
        Assert.assertEquals(defaults, AlignmentOptions.defaults());
    }

    @Test
    public void testBuilderFromConfig() {
        ConfigFactory.getInstance().getSeqAlignConfig();
        final SeqAlignConfig config = org.aeonbits.owner.ConfigFactory.create(SeqAlignConfig.class);
        config.setProperty("default_scoring_matrix", "pam250");
        config.setProperty("default_gap_open", "-8");
        config.setProperty("default_gap_model", "DIRECTION_REMEMBERED");

        final AlignmentOptions options = AlignmentOptions.builder(config).build();
        Assert.assertEquals(options.getMatrix().getName(), ScoringMatrixRegistry.PAM250);
        assertEqualsDoubleSmart(options.getGapOpen(), -8.0);
        Assert.assertEquals(options.getGapModel(), GapModel.DIRECTION_REMEMBERED);
    }

    @Test
    public void testToBuilder() {
        final AlignmentOptions options = AlignmentOptions.builder()
                .matrix("dna_simple").linearGap(-3).bandwidth(4).minScore(12).caseNormalize(false).scoreNormalize(true).build();
        Assert.assertEquals(options.toBuilder().build(), options);
        Assert.assertEquals(options.toBuilder().build().hashCode(), options.hashCode());

        final AlignmentOptions changed = options.toBuilder().gapExtend(-1).build();
        Assert.assertNotEquals(changed, options);
        assertEqualsDoubleSmart(changed.getGapOpen(), -3.0);
        assertEqualsDoubleSmart(changed.getGapExtend(), -1.0);
        Assert.assertEquals(changed.getBandwidth(), 4);
        assertEqualsDoubleSmart(changed.getMinScore(), 12.0);
        Assert.assertFalse(changed.isCaseNormalize());
        Assert.assertTrue(changed.isScoreNormalize());
        Assert.assertTrue(changed.toString().contains("DNA_SIMPLE"), changed.toString());
    }

    @Test
    public void testCustomMatrix() {
        final ScoringMatrix matrix = ScoringMatrix.matchMismatch("AB", 2, -1);
        final AlignmentOptions options = AlignmentOptions.builder().matrix(matrix).linearGap(-2).build();
        Assert.assertSame(options.getMatrix(), matrix);
        final AlignmentResult result = GlobalAligner.getInstance().align("ABBA", "ABA", options);
        assertEqualsDoubleSmart(result.getScore(), 4.0);
    }

    @DataProvider(name = "badGapPenalties")
    public Object[][] badGapPenalties() {
        return new Object[][] {{1.0, -1.0}, {-1.0, 0.5}, {Double.NaN, -1.0}, {-10.0, Double.NaN}};
    }

    @Test(dataProvider = "badGapPenalties", expectedExceptions = UserException.InvalidGapPenalty.class)
    public void testBadGapPenalty(final double gapOpen, final double gapExtend) {
        AlignmentOptions.builder().gapOpen(gapOpen).gapExtend(gapExtend).build();
    }

    @Test
    public void testGapPenaltyMessage() {
        try {
            AlignmentOptions.builder().gapOpen(2).build();
            Assert.fail("expected an InvalidGapPenalty error");
        } catch (final UserException.InvalidGapPenalty e) {
            Assert.assertEquals(e.getMessage(), "gapOpen must be <= 0 but got 2.0");
        }
    }

    @Test
    public void testZeroGapPenaltyIsAllowed() {
        final AlignmentOptions options = AlignmentOptions.builder().linearGap(0).build();
        assertEqualsDoubleSmart(options.getGapOpen(), 0.0);
    }

    @Test(expectedExceptions = UserException.UnknownScoringMatrix.class)
    public void testUnknownMatrix() {
        AlignmentOptions.builder().matrix("BLOSUM99");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNaNMinScore() {
        AlignmentOptions.builder().minScore(Double.NaN).build();
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullGapModel() {
        AlignmentOptions.builder().gapModel(null);
    }
}
