package CDRewrite.Model;

public enum MarkerType {
    /** Insert (or delete) markers after each match. */
    MARK,
    /** Each marker must be preceded by a match. */
    CHECK,
    /** No marker may be preceded by a match. */
    CHECK_COMPLEMENT
}
