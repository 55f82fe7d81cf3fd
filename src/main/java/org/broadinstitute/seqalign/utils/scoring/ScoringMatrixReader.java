package org.broadinstitute.seqalign.utils.scoring;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.seqalign.exceptions.UserException;
import org.broadinstitute.seqalign.utils.Utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads substitution matrices in the NCBI text layout:
 *
 * <pre>
 * #  comment lines start with '#'
 *    A  R  N
 * A  4 -1 -2
 * R -1  5  0
 * N -2  0  6
 * </pre>
 *
 * The first non-comment line names the columns, one residue per token. Each following line starts with the row
 * residue and has one numeric score per column. Blank lines are ignored.
 *
 * Score rows are read number by number rather than split on whitespace: fixed-width NCBI files run a two-digit
 * negative score into the one before it ({@code -1-13}).
 */
public final class ScoringMatrixReader {

    private static final Logger logger = LogManager.getLogger(ScoringMatrixReader.class);

    private static final String COMMENT_PREFIX = "#";

    private static final Pattern SCORE_PATTERN = Pattern.compile("[-+]?\\d+(\\.\\d+)?");

    private ScoringMatrixReader(){}

    /**
     * Reads a matrix from a file. The matrix is named after the file, minus its extension.
     */
    public static ScoringMatrix readMatrix(final Path path) {
        Utils.nonNull(path, "path cannot be null");
        if ( !Files.isReadable(path) ) {
            throw new UserException.CouldNotReadInputFile(path);
        }
        final String fileName = path.getFileName().toString();
        final String name = fileName.contains(".") ? fileName.substring(0, fileName.lastIndexOf('.')) : fileName;
        try ( final BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8) ) {
            return readMatrix(name, path.toString(), reader);
        } catch ( final IOException e ) {
            throw new UserException.CouldNotReadInputFile(path, "error while reading scoring matrix", e);
        }
    }

    /**
     * Parses a matrix from {@code reader}, which is not closed.
     * @param name the name given to the resulting matrix
     * @param source a description of where the text came from, used in error messages
     * @throws IOException if the reader fails
     * @throws UserException.MalformedScoringMatrix if the text is not a well formed matrix
     */
    public static ScoringMatrix readMatrix(final String name, final String source, final BufferedReader reader) throws IOException {
        Utils.nonNull(name, "name cannot be null");
        Utils.nonNull(reader, "reader cannot be null");

        char[] columns = null;
        final Map<Character, Map<Character, Double>> table = new LinkedHashMap<>();
        String line;
        int lineNumber = 0;
        while ( (line = reader.readLine()) != null ) {
            lineNumber++;
            if ( StringUtils.isBlank(line) || line.trim().startsWith(COMMENT_PREFIX) ) {
                continue;
            }
            if ( columns == null ) {
                columns = parseHeader(source, lineNumber, StringUtils.split(line));
                continue;
            }
            final String[] rowAndScores = StringUtils.split(line, null, 2);
            final char row = parseResidue(source, lineNumber, rowAndScores[0]);
            final List<Double> rowScores = parseScores(source, lineNumber, rowAndScores.length > 1 ? rowAndScores[1] : "");
            if ( rowScores.size() != columns.length ) {
                throw new UserException.MalformedScoringMatrix(source, String.format(
                        "line %d has %d scores but the header names %d residues", lineNumber, rowScores.size(), columns.length));
            }
            if ( table.containsKey(row) ) {
                throw new UserException.MalformedScoringMatrix(source, String.format("line %d repeats row %s", lineNumber, row));
            }
            final Map<Character, Double> scores = new LinkedHashMap<>();
            for ( int i = 0; i < columns.length; i++ ) {
                scores.put(columns[i], rowScores.get(i));
            }
            table.put(row, scores);
        }

        if ( columns == null || table.isEmpty() ) {
            throw new UserException.MalformedScoringMatrix(source, "no header line and score rows found");
        }
        logger.debug("Read scoring matrix {} with {} rows from {}", name, table.size(), source);
        return ScoringMatrix.fromMap(name, table);
    }

    private static char[] parseHeader(final String source, final int lineNumber, final String[] tokens) {
        final char[] columns = new char[tokens.length];
        for ( int i = 0; i < tokens.length; i++ ) {
            columns[i] = parseResidue(source, lineNumber, tokens[i]);
        }
        return columns;
    }

    private static char parseResidue(final String source, final int lineNumber, final String token) {
        if ( token.length() != 1 ) {
            throw new UserException.MalformedScoringMatrix(source, String.format("line %d: expected a single residue but found '%s'", lineNumber, token));
        }
        return Character.toUpperCase(token.charAt(0));
    }

    private static List<Double> parseScores(final String source, final int lineNumber, final String text) {
        final List<Double> scores = new ArrayList<>();
        final Matcher matcher = SCORE_PATTERN.matcher(text);
        int previousEnd = 0;
        while ( matcher.find() ) {
            checkNoJunk(source, lineNumber, text.substring(previousEnd, matcher.start()));
            scores.add(Double.parseDouble(matcher.group()));
            previousEnd = matcher.end();
        }
        checkNoJunk(source, lineNumber, text.substring(previousEnd));
        return scores;
    }

    private static void checkNoJunk(final String source, final int lineNumber, final String between) {
        if ( !StringUtils.isBlank(between) ) {
            throw new UserException.MalformedScoringMatrix(source, String.format("line %d: '%s' is not a number", lineNumber, StringUtils.strip(between)));
        }
    }
}
