package org.broadinstitute.seqalign.utils.pairwise;

import org.broadinstitute.seqalign.exceptions.UserException;
import org.broadinstitute.seqalign.testutils.BaseTest;
import org.broadinstitute.seqalign.utils.scoring.ScoringMatrixRegistry;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Random;

public final class BandedAlignerUnitTest extends BaseTest {

    private static final AlignmentOptions DNA = AlignmentOptions.builder()
            .matrix(ScoringMatrixRegistry.DNA_SIMPLE).gapOpen(-5).gapExtend(-2).build();

    private static final AlignmentOptions PROTEIN = AlignmentOptions.builder()
            .matrix(ScoringMatrixRegistry.BLOSUM50).gapOpen(-5).gapExtend(-2).build();

    private static AlignmentResult align(final String seq1, final String seq2, final AlignmentOptions options, final int bandwidth) {
        return BandedAligner.getInstance().align(seq1, seq2, options.toBuilder().bandwidth(bandwidth).build());
    }

    @DataProvider(name = "bandedAlignments")
    public Object[][] bandedAlignments() {
        return new Object[][] {
                {"ACGTACGTAC", "ACGTCGTAC", DNA, 1, "ACGTACGTAC", "ACGT-CGTAC", 40.0},
                {"ACGTACGTAC", "ACGTCGTAC", DNA, 2, "ACGTACGTAC", "ACGT-CGTAC", 40.0},
                {"ACGTACGT", "ACGTTCGT", DNA, 1, "ACGTACGT", "ACGTTCGT", 31.0},
                {"HEAGAWGHEE", "PAWHEAE", PROTEIN, 3, "HEAGAWGHEE", "---PAWHEAE", 12.0},
                {"HEAGAWGHEE", "PAWHEAE", PROTEIN, 10, "HEAGAWGHE-E", "---PAW-HEAE", 21.0},
        };
    }

    @Test(dataProvider = "bandedAlignments")
    public void testBandedAlignments(final String seq1, final String seq2, final AlignmentOptions options, final int bandwidth,
                                     final String expected1, final String expected2, final double expectedScore) {
        final AlignmentResult result = align(seq1, seq2, options, bandwidth);
        Assert.assertEquals(result.getAlignedSeq1(), expected1);
        Assert.assertEquals(result.getAlignedSeq2(), expected2);
        assertEqualsDoubleSmart(result.getScore(), expectedScore);
        Assert.assertEquals(result.getEndPos1(), seq1.length());
        Assert.assertEquals(result.getEndPos2(), seq2.length());
    }

    @Test
    public void testNarrowBandCostsScore() {
        final double narrow = align("HEAGAWGHEE", "PAWHEAE", PROTEIN, 3).getScore();
        final double global = GlobalAligner.getInstance().align("HEAGAWGHEE", "PAWHEAE", PROTEIN).getScore();
        Assert.assertTrue(narrow < global);
    }

    @Test
    public void testZeroBandwidth() {
        final AlignmentResult result = align("ACGTAC", "acgtac", DNA, 0);
        Assert.assertEquals(result.getAlignedSeq1(), "ACGTAC");
        Assert.assertEquals(result.getAlignedSeq2(), "ACGTAC");
        assertEqualsDoubleSmart(result.getScore(), 30.0);

        final AlignmentResult mismatched = align("AAAA", "ATTA", DNA, 0);
        Assert.assertEquals(mismatched.getAlignedSeq2(), "ATTA");
        assertEqualsDoubleSmart(mismatched.getScore(), 2.0);
    }

    @Test
    public void testWideBandMatchesGlobal() {
        final Random random = new Random(17);
        for ( int trial = 0; trial < 50; trial++ ) {
            final String seq1 = randomBases(random, 1 + random.nextInt(30));
            final String seq2 = randomBases(random, 1 + random.nextInt(30));
            final AlignmentResult banded = align(seq1, seq2, DNA, 1000);
            final AlignmentResult global = GlobalAligner.getInstance().align(seq1, seq2, DNA);
            assertEqualsDoubleSmart(banded.getScore(), global.getScore());
            Assert.assertEquals(banded.getAlignedSeq1(), global.getAlignedSeq1());
            Assert.assertEquals(banded.getAlignedSeq2(), global.getAlignedSeq2());
        }
    }

    @Test
    public void testBandedResultsAreConsistent() {
        final Random random = new Random(19);
        for ( int trial = 0; trial < 50; trial++ ) {
            final String seq1 = randomBases(random, 10 + random.nextInt(30));
            final String seq2 = seq1.substring(0, seq1.length() - 2) + randomBases(random, random.nextInt(5));
            final int bandwidth = Math.abs(seq1.length() - seq2.length()) + random.nextInt(3);
            final AlignmentResult result = align(seq1, seq2, DNA, bandwidth);
            Assert.assertEquals(ungapped(result.getAlignedSeq1()), seq1);
            Assert.assertEquals(ungapped(result.getAlignedSeq2()), seq2);
            assertEqualsDoubleSmart(PairwiseAlignmentUtils.scoreAlignment(result.getAlignedSeq1(), result.getAlignedSeq2(),
                    DNA.getMatrix(), DNA.getGapOpen(), DNA.getGapExtend()), result.getScore());
            Assert.assertTrue(result.getScore() <= GlobalAligner.getInstance().align(seq1, seq2, DNA).getScore() + 1e-9);
        }
    }

    @Test
    public void testScoreNormalization() {
        final AlignmentResult result = align("ACGTACGTAC", "ACGTCGTAC", DNA.toBuilder().scoreNormalize(true).build(), 1);
        Assert.assertEquals(result.getAlignedSeq2(), "ACGT-CGTAC");
        assertEqualsDoubleSmart(result.getScore(), 4.0);
    }

    @Test
    public void testLengthDifferenceExceedsBand() {
        try {
            align("ACGTACGT", "ACGT", DNA, 3);
            Assert.fail("expected a BandConstraintViolated error");
        } catch (final UserException.BandConstraintViolated e) {
            Assert.assertTrue(e.getMessage().contains("bandwidth 3"), e.getMessage());
        }
    }

    @Test(expectedExceptions = UserException.BandConstraintViolated.class)
    public void testNegativeBandwidth() {
        align("ACGT", "ACGT", DNA, -1);
    }

    @Test(expectedExceptions = UserException.EmptySequence.class)
    public void testEmptySequence() {
        align("ACGT", "\n", DNA, 2);
    }
}
