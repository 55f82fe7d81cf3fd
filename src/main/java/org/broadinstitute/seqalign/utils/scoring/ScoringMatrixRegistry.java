package org.broadinstitute.seqalign.utils.scoring;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.seqalign.exceptions.SeqAlignException;
import org.broadinstitute.seqalign.exceptions.UserException;
import org.broadinstitute.seqalign.utils.Utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * The built-in substitution matrices, looked up by name.
 *
 * Protein matrices cover the 20 standard amino acids. Ambiguity codes (B, Z, X) and stop ('*') are not in the
 * tables and score 0 against everything. The nucleotide matrices cover A, C, G, T, U and N, with T and U
 * interchangeable and N scored as a mismatch against every residue, itself included.
 */
public final class ScoringMatrixRegistry {

    private static final Logger logger = LogManager.getLogger(ScoringMatrixRegistry.class);

    public static final String BLOSUM45 = "BLOSUM45";
    public static final String BLOSUM50 = "BLOSUM50";
    public static final String BLOSUM62 = "BLOSUM62";
    public static final String BLOSUM80 = "BLOSUM80";
    public static final String BLOSUM90 = "BLOSUM90";
    public static final String PAM30 = "PAM30";
    public static final String PAM70 = "PAM70";
    public static final String PAM120 = "PAM120";
    public static final String PAM250 = "PAM250";
    public static final String DNA_SIMPLE = "DNA_SIMPLE";
    public static final String DNA_FULL = "DNA_FULL";

    private static final String RESOURCE_DIRECTORY = "matrices/";
    private static final String RESOURCE_EXTENSION = ".txt";

    private static final ImmutableList<String> MATRIX_NAMES = ImmutableList.of(
            BLOSUM45, BLOSUM50, BLOSUM62, BLOSUM80, BLOSUM90,
            PAM30, PAM70, PAM120, PAM250,
            DNA_SIMPLE, DNA_FULL);

    private static final ImmutableMap<String, ScoringMatrix> MATRICES;
    static {
        final ImmutableMap.Builder<String, ScoringMatrix> builder = ImmutableMap.builder();
        for ( final String name : MATRIX_NAMES ) {
            builder.put(name, loadBundledMatrix(name));
        }
        MATRICES = builder.build();
        logger.info("Loaded {} built-in scoring matrices", MATRICES.size());
    }

    private ScoringMatrixRegistry(){}

    private static ScoringMatrix loadBundledMatrix(final String name) {
        final String resource = RESOURCE_DIRECTORY + name + RESOURCE_EXTENSION;
        final InputStream stream = ScoringMatrixRegistry.class.getResourceAsStream(resource);
        if ( stream == null ) {
            throw new SeqAlignException.MissingBundledResource(resource);
        }
        try ( final BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8)) ) {
            final ScoringMatrix matrix = ScoringMatrixReader.readMatrix(name, resource, reader);
            logger.debug("Loaded scoring matrix {} over residues {}", name, matrix.getResidues());
            return matrix;
        } catch ( final IOException | UserException e ) {
            throw new SeqAlignException.MissingBundledResource(resource, e);
        }
    }

    /**
     * Case-insensitive lookup of a built-in matrix.
     * @throws UserException.UnknownScoringMatrix if {@code name} is not one of {@link #getMatrixNames()}
     */
    public static ScoringMatrix getMatrix(final String name) {
        Utils.nonNull(name, "matrix name cannot be null");
        final ScoringMatrix matrix = MATRICES.get(name.trim().toUpperCase(Locale.ROOT));
        if ( matrix == null ) {
            throw new UserException.UnknownScoringMatrix(name, MATRIX_NAMES);
        }
        return matrix;
    }

    public static boolean containsMatrix(final String name) {
        return name != null && MATRICES.containsKey(name.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Scores the pair {@code (a, b)} in {@code matrix}. Never throws for unknown residues; they score 0.
     */
    public static double getScore(final ScoringMatrix matrix, final char a, final char b) {
        return Utils.nonNull(matrix, "matrix cannot be null").score(a, b);
    }

    /**
     * @return the names of the built-in matrices, in a fixed order
     */
    public static ImmutableList<String> getMatrixNames() {
        return MATRIX_NAMES;
    }
}
