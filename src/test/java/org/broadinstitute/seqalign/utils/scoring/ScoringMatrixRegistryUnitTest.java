package org.broadinstitute.seqalign.utils.scoring;

import org.broadinstitute.seqalign.exceptions.UserException;
import org.broadinstitute.seqalign.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

public final class ScoringMatrixRegistryUnitTest extends BaseTest {

    @Test
    public void testMatrixNames() {
        Assert.assertEquals(ScoringMatrixRegistry.getMatrixNames(), Arrays.asList(
                "BLOSUM45", "BLOSUM50", "BLOSUM62", "BLOSUM80", "BLOSUM90",
                "PAM30", "PAM70", "PAM120", "PAM250",
                "DNA_SIMPLE", "DNA_FULL"));
    }

    @DataProvider(name = "names")
    public Object[][] names() {
        return ScoringMatrixRegistry.getMatrixNames().stream().map(name -> new Object[]{name}).toArray(Object[][]::new);
    }

    @Test(dataProvider = "names")
    public void testEveryBuiltInMatrixLoadsAndIsSymmetric(final String name) {
        final ScoringMatrix matrix = ScoringMatrixRegistry.getMatrix(name);
        Assert.assertEquals(matrix.getName(), name);
        Assert.assertTrue(matrix.isSymmetric(), name + " is not symmetric");
        final int expectedResidues = name.startsWith("DNA") ? 6 : 20;
        Assert.assertEquals(matrix.getResidues().size(), expectedResidues);
        for ( final char residue : matrix.getResidues() ) {
            Assert.assertTrue(matrix.score(residue, residue) > 0 || residue == 'N', name + " diagonal for " + residue);
        }
    }

    @Test
    public void testLookupIgnoresCaseAndWhitespace() {
        Assert.assertSame(ScoringMatrixRegistry.getMatrix("blosum62"), ScoringMatrixRegistry.getMatrix("BLOSUM62"));
        Assert.assertSame(ScoringMatrixRegistry.getMatrix(" Pam250 "), ScoringMatrixRegistry.getMatrix("PAM250"));
        Assert.assertTrue(ScoringMatrixRegistry.containsMatrix("dna_full"));
        Assert.assertFalse(ScoringMatrixRegistry.containsMatrix("BLOSUM100"));
        Assert.assertFalse(ScoringMatrixRegistry.containsMatrix(null));
    }

    @Test
    public void testUnknownMatrixListsAvailableNames() {
        try {
            ScoringMatrixRegistry.getMatrix("BLOSUM100");
            Assert.fail("expected an exception for an unknown matrix");
        } catch ( final UserException.UnknownScoringMatrix e ) {
            Assert.assertTrue(e.getMessage().contains("BLOSUM100"));
            for ( final String name : ScoringMatrixRegistry.getMatrixNames() ) {
                Assert.assertTrue(e.getMessage().contains(name), "message does not list " + name);
            }
        }
    }

    @DataProvider(name = "scores")
    public Object[][] scores() {
        return new Object[][] {
                {"BLOSUM62", 'A', 'A', 4},
                {"BLOSUM62", 'A', 'R', -1},
                {"BLOSUM62", 'R', 'A', -1},
                {"BLOSUM62", 'a', 'r', -1},
                {"BLOSUM62", 'W', 'W', 11},
                {"BLOSUM62", 'X', 'Z', 0},
                {"BLOSUM62", 'A', '*', 0},
                {"BLOSUM50", 'H', 'H', 10},
                {"BLOSUM50", 'E', 'E', 6},
                {"BLOSUM45", 'C', 'C', 12},
                {"BLOSUM80", 'W', 'W', 16},
                {"BLOSUM90", 'A', 'A', 5},
                {"PAM30", 'W', 'W', 13},
                {"PAM250", 'W', 'W', 17},
                {"PAM250", 'C', 'C', 12},
                {"DNA_SIMPLE", 'A', 'A', 5},
                {"DNA_SIMPLE", 'A', 'C', -4},
                {"DNA_SIMPLE", 'T', 'U', 5},
                {"DNA_SIMPLE", 'N', 'N', -4},
                {"DNA_SIMPLE", 'A', 'G', -4},
                {"DNA_SIMPLE", 'A', 'X', 0},
                {"DNA_FULL", 'A', 'G', -1},
                {"DNA_FULL", 'C', 'T', -1},
                {"DNA_FULL", 'C', 'U', -1},
                {"DNA_FULL", 'A', 'T', -4},
                {"DNA_FULL", 'g', 'g', 5},
        };
    }

    @Test(dataProvider = "scores")
    public void testGetScore(final String name, final char a, final char b, final double expected) {
        assertEqualsDoubleSmart(ScoringMatrixRegistry.getScore(ScoringMatrixRegistry.getMatrix(name), a, b), expected);
    }

    @Test
    public void testLiteralMatrix() {
        final Map<Character, Map<Character, Integer>> table = new HashMap<>();
        table.put('x', new HashMap<>());
        table.get('x').put('x', 3);
        table.get('x').put('Y', -2);
        final ScoringMatrix matrix = ScoringMatrix.fromMap(table);
        assertEqualsDoubleSmart(matrix.score('X', 'x'), 3);
        assertEqualsDoubleSmart(matrix.score('x', 'y'), -2);
        assertEqualsDoubleSmart(matrix.score('y', 'x'), 0);
        Assert.assertFalse(matrix.isSymmetric());
        Assert.assertEquals(matrix.getName(), "custom");
    }

    @Test
    public void testNonAsciiResidues() {
        final Map<Character, Map<Character, Double>> table = new HashMap<>();
        table.put('é', new HashMap<>());
        table.get('é').put('é', 1.5);
        final ScoringMatrix matrix = ScoringMatrix.fromMap("accented", table);
        assertEqualsDoubleSmart(matrix.score('é', 'é'), 1.5);
        assertEqualsDoubleSmart(matrix.score('É', 'é'), 1.5);
        assertEqualsDoubleSmart(matrix.score('é', 'A'), 0);
    }

    @Test
    public void testMatchMismatch() {
        final ScoringMatrix matrix = ScoringMatrix.matchMismatch("acgt", 5, -4);
        assertEqualsDoubleSmart(matrix.score('A', 'A'), 5);
        assertEqualsDoubleSmart(matrix.score('a', 'T'), -4);
        assertEqualsDoubleSmart(matrix.score('A', 'N'), 0);
        Assert.assertTrue(matrix.isSymmetric());
        Assert.assertEquals(matrix.getResidues().size(), 4);
    }

    @Test
    public void testEquality() {
        Assert.assertEquals(ScoringMatrix.matchMismatch("ACGT", 1, -1), ScoringMatrix.matchMismatch("acgt", 1, -1));
        Assert.assertNotEquals(ScoringMatrix.matchMismatch("ACGT", 1, -1), ScoringMatrix.matchMismatch("ACGT", 2, -1));
        Assert.assertNotEquals(ScoringMatrixRegistry.getMatrix("DNA_SIMPLE"), ScoringMatrixRegistry.getMatrix("DNA_FULL"));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullMatrix() {
        ScoringMatrixRegistry.getScore(null, 'A', 'A');
    }
}
