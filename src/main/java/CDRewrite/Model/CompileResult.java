package CDRewrite.Model;

import CDRewrite.Fst.Fst;

/**
 * Outcome of compiling a rule: a transducer or an error, never both.
 */
public sealed interface CompileResult<W> permits CompileResult.Success, CompileResult.Failure {

    record Success<W>(Fst<W> fst) implements CompileResult<W> { }

    record Failure<W>(CompileError error) implements CompileResult<W> { }

    static <W> CompileResult<W> success(Fst<W> fst) {
        return new Success<>(fst);
    }

    static <W> CompileResult<W> failure(CompileError error) {
        return new Failure<>(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * @return the compiled transducer
     * @throws IllegalStateException if compilation failed
     */
    default Fst<W> orElseThrow() {
        if (this instanceof Success<W> success) {
            return success.fst();
        }
        throw new IllegalStateException("Rule compilation failed: " + ((Failure<W>) this).error());
    }
}
