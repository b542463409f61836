package CDRewrite.Model;

/**
 * Why a rule could not be compiled.
 * @param kind - contract violation or propagated engine error
 * @param operand - phi, psi, lambda, rho, sigma or tau; or the stage whose result was erroneous
 * @param message - human readable description
 */
public record CompileError(Kind kind, String operand, String message) {

    public enum Kind {
        /** An input automaton fails an acceptor/weight precondition. */
        CONTRACT_VIOLATION,
        /** An engine operation reported an error on its result. */
        PROPAGATED
    }

    public static CompileError contractViolation(String operand, String message) {
        return new CompileError(Kind.CONTRACT_VIOLATION, operand, message);
    }

    public static CompileError propagated(String operand, String message) {
        return new CompileError(Kind.PROPAGATED, operand, message);
    }

    @Override
    public String toString() {
        return kind + " (" + operand + "): " + message;
    }
}
