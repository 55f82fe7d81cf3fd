package org.broadinstitute.seqalign.utils.scoring;

import com.google.common.collect.ImmutableMap;
import org.broadinstitute.seqalign.utils.Utils;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A table of pairwise residue scores used in place of plain match/mismatch constants.
 *
 * Residues are stored upper-cased and every lookup upper-cases its arguments, so {@code score('a', 'C')} and
 * {@code score('A', 'c')} are the same query. A pair that is not in the table scores 0. Symmetry is conventional
 * but not enforced: {@code score(a, b)} reads the row of {@code a}.
 *
 * Instances are immutable and safe to share between threads.
 */
public final class ScoringMatrix {

    private static final int ASCII_SIZE = 128;

    private final String name;
    private final ImmutableMap<Character, ImmutableMap<Character, Double>> scores;

    // Dense copy of the table for ASCII residues, row-major on (a, b).
    private final double[] asciiScores = new double[ASCII_SIZE * ASCII_SIZE];

    private ScoringMatrix(final String name, final Map<Character, ? extends Map<Character, ? extends Number>> table) {
        this.name = Utils.nonNull(name, "matrix name");
        Utils.nonNull(table, "scoring table cannot be null");

        final ImmutableMap.Builder<Character, ImmutableMap<Character, Double>> rows = ImmutableMap.builder();
        for ( final Map.Entry<Character, ? extends Map<Character, ? extends Number>> row : table.entrySet() ) {
            final char a = Character.toUpperCase(Utils.nonNull(row.getKey(), "row residue cannot be null"));
            final ImmutableMap.Builder<Character, Double> columns = ImmutableMap.builder();
            for ( final Map.Entry<Character, ? extends Number> cell : Utils.nonNull(row.getValue(), () -> "row " + a + " is null").entrySet() ) {
                final char b = Character.toUpperCase(Utils.nonNull(cell.getKey(), "column residue cannot be null"));
                final double value = Utils.nonNull(cell.getValue(), () -> "score for " + a + "/" + b + " is null").doubleValue();
                Utils.validateArg(!Double.isNaN(value), () -> "score for " + a + "/" + b + " is NaN");
                columns.put(b, value);
                if ( a < ASCII_SIZE && b < ASCII_SIZE ) {
                    asciiScores[a * ASCII_SIZE + b] = value;
                }
            }
            rows.put(a, columns.build());
        }
        this.scores = rows.build();
    }

    /**
     * Wraps a literal nested mapping of residue to residue to score.
     * @param name a label for logging and {@link #toString()}
     * @param table rows keyed by the first residue, columns by the second. Keys are upper-cased; duplicate keys after
     *              upper-casing are rejected.
     */
    public static ScoringMatrix fromMap(final String name, final Map<Character, ? extends Map<Character, ? extends Number>> table) {
        return new ScoringMatrix(name, table);
    }

    public static ScoringMatrix fromMap(final Map<Character, ? extends Map<Character, ? extends Number>> table) {
        return new ScoringMatrix("custom", table);
    }

    /**
     * Builds the simple scheme where every identical pair of residues in {@code alphabet} scores {@code match}
     * and every other pair scores {@code mismatch}.
     */
    public static ScoringMatrix matchMismatch(final String alphabet, final double match, final double mismatch) {
        Utils.nonEmpty(alphabet, "alphabet");
        final String residues = alphabet.toUpperCase();
        final ImmutableMap.Builder<Character, Map<Character, Double>> table = ImmutableMap.builder();
        for ( int i = 0; i < residues.length(); i++ ) {
            final ImmutableMap.Builder<Character, Double> row = ImmutableMap.builder();
            for ( int j = 0; j < residues.length(); j++ ) {
                row.put(residues.charAt(j), i == j ? match : mismatch);
            }
            table.put(residues.charAt(i), row.build());
        }
        return new ScoringMatrix(String.format("match%s/mismatch%s", match, mismatch), table.build());
    }

    /**
     * @return the score of aligning {@code a} against {@code b}, or 0 when the pair is not in this matrix.
     */
    public double score(final char a, final char b) {
        final char ua = Character.toUpperCase(a);
        final char ub = Character.toUpperCase(b);
        if ( ua < ASCII_SIZE && ub < ASCII_SIZE ) {
            return asciiScores[ua * ASCII_SIZE + ub];
        }
        final Map<Character, Double> row = scores.get(ua);
        if ( row == null ) {
            return 0;
        }
        final Double value = row.get(ub);
        return value == null ? 0 : value;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the residues that have a row in this matrix, in table order
     */
    public Set<Character> getResidues() {
        return scores.keySet();
    }

    public ImmutableMap<Character, ImmutableMap<Character, Double>> asMap() {
        return scores;
    }

    /**
     * @return true if {@code score(a, b) == score(b, a)} for every pair present in the table
     */
    public boolean isSymmetric() {
        for ( final Map.Entry<Character, ImmutableMap<Character, Double>> row : scores.entrySet() ) {
            for ( final Map.Entry<Character, Double> cell : row.getValue().entrySet() ) {
                if ( score(cell.getKey(), row.getKey()) != cell.getValue() ) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final ScoringMatrix that = (ScoringMatrix) o;
        return name.equals(that.name) && scores.equals(that.scores);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, scores);
    }

    @Override
    public String toString() {
        return "ScoringMatrix{" + name + ", residues=" + scores.keySet() + "}";
    }
}
