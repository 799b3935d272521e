package org.broadinstitute.wombat.exceptions;

/**
 * <p/>
 * Class WombatException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures,
 * external programs that fail for reasons the pipeline cannot fix, and "this should never happen" kinds of scenarios.
 */
public class WombatException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public WombatException( String msg ) {
        super(msg);
    }

    public WombatException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /*
      Subtypes of WombatException for common kinds of errors
     */

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends WombatException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException( final String s ) {
            super(s);
        }
        public ShouldNeverReachHereException( final String s, final Throwable throwable ) {
            super(s, throwable);
        }
        public ShouldNeverReachHereException( final Throwable throwable) {this("Should never reach here.", throwable);}
    }
}
