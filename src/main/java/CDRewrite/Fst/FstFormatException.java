package CDRewrite.Fst;

/**
 * Malformed FST text.
 */
public class FstFormatException extends Exception {
    public FstFormatException(String message) {
        super(message);
    }

    public FstFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
