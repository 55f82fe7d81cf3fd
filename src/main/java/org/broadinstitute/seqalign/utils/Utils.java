package org.broadinstitute.seqalign.utils;

import java.util.Arrays;
import java.util.function.Supplier;

public final class Utils {

    private Utils(){}

    /**
     * Create a new string that's n copies of c
     * @param c the char to duplicate
     * @param nCopies how many copies?
     * @return a string
     */
    public static String dupChar(final char c, final int nCopies) {
        final char[] chars = new char[nCopies];
        Arrays.fill(chars, c);
        return new String(chars);
    }

    /**
     * Returns a new string with the characters of {@code s} in reverse order.
     */
    public static String reverse(final CharSequence s) {
        return new StringBuilder(nonNull(s)).reverse().toString();
    }

    /**
     * Checks that an Object {@code object} is not null and returns the same object or throws an {@link IllegalArgumentException}
     * @param object any Object
     * @return the same object
     * @throws IllegalArgumentException if a {@code o == null}
     */
    public static <T> T nonNull(final T object) {
        return Utils.nonNull(object, "Null object is not allowed here.");
    }

    /**
     * Checks that an {@link Object} is not {@code null} and returns the same object or throws an {@link IllegalArgumentException}
     * @param object any Object
     * @param message the text message that would be passed to the exception thrown when {@code o == null}.
     * @return the same object
     * @throws IllegalArgumentException if a {@code o == null}
     */
    public static <T> T nonNull(final T object, final String message) {
        if (object == null) {
            throw new IllegalArgumentException(message);
        }
        return object;
    }

    /**
     * Checks that an {@link Object} is not {@code null} and returns the same object or throws an {@link IllegalArgumentException}
     * @param object any Object
     * @param message the text message that would be passed to the exception thrown when {@code o == null}.
     * @return the same object
     * @throws IllegalArgumentException if a {@code o == null}
     */
    public static <T> T nonNull(final T object, final Supplier<String> message) {
        if (object == null) {
            throw new IllegalArgumentException(message.get());
        }
        return object;
    }

    /**
     * Checks that a {@link String} is not {@code null} and that it is not empty.
     * If it's non-null and non-empty it returns the input, otherwise it throws an {@link IllegalArgumentException}
     * @param string any String
     * @param message a message to include in the output
     * @return the original string
     * @throws IllegalArgumentException if string is null or empty
     */
    public static String nonEmpty(String string, String message){
        nonNull(string, "The string is null: " + message);
        if(string.isEmpty()){
            throw new IllegalArgumentException("The string is empty: " + message);
        } else {
            return string;
        }
    }

    public static void validateArg(final boolean condition, final String msg){
        if (!condition){
            throw new IllegalArgumentException(msg);
        }
    }

    public static void validateArg(final boolean condition, final Supplier<String> msg){
        if (!condition){
            throw new IllegalArgumentException(msg.get());
        }
    }

    /**
     * Check a condition that should always be true and throw an {@link IllegalStateException} if false.  If msg is not a
     * String literal i.e. if it requires computation, use the Supplier<String> version, below.
     */
    public static void validate(final boolean condition, final String msg){
        if (!condition){
            throw new IllegalStateException(msg);
        }
    }

    /**
     * Check a condition that should always be true and throw an {@link IllegalStateException} if false.
     */
    public static void validate(final boolean condition, final Supplier<String> msg){
        if (!condition){
            throw new IllegalStateException(msg.get());
        }
    }
}
