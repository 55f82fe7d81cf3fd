package org.broadinstitute.seqalign.utils.pairwise;

import org.broadinstitute.seqalign.exceptions.UserException;
import org.broadinstitute.seqalign.testutils.BaseTest;
import org.broadinstitute.seqalign.utils.scoring.ScoringMatrixRegistry;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Random;

public final class OverlapAlignerUnitTest extends BaseTest {

    private static final AlignmentOptions DNA = AlignmentOptions.builder()
            .matrix(ScoringMatrixRegistry.DNA_SIMPLE).gapOpen(-5).gapExtend(-2).build();

    private static AlignmentResult align(final String seq1, final String seq2) {
        return OverlapAligner.getInstance().align(seq1, seq2, DNA);
    }

    @DataProvider(name = "overlaps")
    public Object[][] overlaps() {
        return new Object[][] {
                // seq1, seq2, aligned1, aligned2, score, end1, start2
                {"ACGT", "ACGT", "ACGT", "ACGT", 20.0, 4, 0},
                {"ACGTACGT", "ACGTTTTT", "ACGTACGT", "ACGTTTTT", 13.0, 8, 0},
                {"ACGT", "ACGTACGT", "----ACGT", "ACGTACGT", 20.0, 4, 4},
                {"ACGTACGT", "ACGT", "ACGTACGT", "ACGT----", 20.0, 4, 0},
                {"ACGTGGGG", "TTTTACGT", "----ACGTGGGG", "TTTTACGT----", 20.0, 4, 4},
                {"ACGTACGT", "TACG", "-ACGTACGT", "TACG-----", 15.0, 3, 1},
                {"TTTTACGT", "ACGTGGGG", "--------TTTTACGT", "ACGTGGGG--------", 0.0, 0, 8},
        };
    }

    @Test(dataProvider = "overlaps")
    public void testOverlaps(final String seq1, final String seq2, final String expected1, final String expected2,
                             final double expectedScore, final int end1, final int start2) {
        final AlignmentResult result = align(seq1, seq2);
        Assert.assertEquals(result.getAlignedSeq1(), expected1);
        Assert.assertEquals(result.getAlignedSeq2(), expected2);
        assertEqualsDoubleSmart(result.getScore(), expectedScore);
        Assert.assertEquals(result.getStartPos1(), 0);
        Assert.assertEquals(result.getEndPos1(), end1);
        Assert.assertEquals(result.getStartPos2(), start2);
        Assert.assertEquals(result.getEndPos2(), seq2.length());
    }

    @Test
    public void testOverlapIsNotSymmetric() {
        // only a suffix of sequence 2 may overlap a prefix of sequence 1
        assertEqualsDoubleSmart(align("ACGTGGGG", "TTTTACGT").getScore(), 20.0);
        assertEqualsDoubleSmart(align("TTTTACGT", "ACGTGGGG").getScore(), 0.0);
    }

    @Test
    public void testFullSequencesAreKept() {
        final Random random = new Random(5);
        for ( int trial = 0; trial < 50; trial++ ) {
            final String seq1 = randomBases(random, 1 + random.nextInt(30));
            final String seq2 = randomBases(random, 1 + random.nextInt(30));
            final AlignmentResult result = align(seq1, seq2);
            Assert.assertEquals(ungapped(result.getAlignedSeq1()), seq1);
            Assert.assertEquals(ungapped(result.getAlignedSeq2()), seq2);
            Assert.assertTrue(result.getScore() >= 0);
            Assert.assertTrue(result.getScore() <= SemiGlobalAligner.getInstance().align(seq1, seq2, DNA).getScore());
        }
    }

    @Test
    public void testScoreNormalization() {
        final AlignmentResult result = OverlapAligner.getInstance().align("ACGTACGT", "TACG",
                DNA.toBuilder().scoreNormalize(true).build());
        Assert.assertEquals(result.getAlignedSeq2(), "TACG-----");
        Assert.assertEquals(result.getAlignmentLength(), 9);
        assertEqualsDoubleSmart(result.getScore(), 15.0 / 9);
    }

    @Test
    public void testEmptySequence() {
        try {
            align("", "ACGT");
            Assert.fail("expected an EmptySequence error");
        } catch (final UserException.EmptySequence e) {
            Assert.assertEquals(e.getMessage(), PairwiseAlignmentUtils.GOTOH_EMPTY_SEQUENCE_MESSAGE);
        }
    }

    @Test(expectedExceptions = UserException.InvalidInputType.class)
    public void testNullSequence() {
        align("ACGT", null);
    }
}
