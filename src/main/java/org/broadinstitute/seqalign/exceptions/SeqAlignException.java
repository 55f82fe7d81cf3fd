package org.broadinstitute.seqalign.exceptions;

/**
 * <p/>
 * Class SeqAlignException.
 * <p/>
 * This exception is for errors that are beyond the caller's control, such as internal pre/post condition failures,
 * broken bundled resources and "this should never happen" kinds of scenarios.
 */
public class SeqAlignException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public SeqAlignException( String msg ) {
        super(msg);
    }

    public SeqAlignException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /*
      Subtypes of SeqAlignException for common kinds of errors
     */

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends SeqAlignException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException( final String s ) {
            super(s);
        }
        public ShouldNeverReachHereException( final String s, final Throwable throwable ) {
            super(s, throwable);
        }
        public ShouldNeverReachHereException( final Throwable throwable) {this("Should never reach here.", throwable);}
    }

    /**
     * A scoring matrix shipped inside the jar could not be loaded.
     */
    public static class MissingBundledResource extends SeqAlignException {
        private static final long serialVersionUID = 0L;

        public MissingBundledResource( final String resourcePath ) {
            super(String.format("Bundled resource %s is not on the class path", resourcePath));
        }

        public MissingBundledResource( final String resourcePath, final Throwable cause ) {
            super(String.format("Bundled resource %s could not be read", resourcePath), cause);
        }
    }
}
