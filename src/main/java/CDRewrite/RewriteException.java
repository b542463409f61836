package CDRewrite;

/**
 * A compiled rule could not be applied to an input as requested.
 */
public class RewriteException extends RuntimeException {

    public RewriteException(String message) {
        super(message);
    }
}
