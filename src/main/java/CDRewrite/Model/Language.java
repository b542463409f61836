package CDRewrite.Model;

import CDRewrite.Fst.Fst;

/**
 * Input of the marker construction: either an explicit acceptor, or the complement of sigma, which has no
 * useful explicit form.
 */
public sealed interface Language<W> permits Language.Explicit, Language.ComplementOfSigma {

    static <W> Language<W> explicit(Fst<W> acceptor) {
        return new Explicit<>(acceptor);
    }

    static <W> Language<W> complementOfSigma() {
        return new ComplementOfSigma<>();
    }

    record Explicit<W>(Fst<W> acceptor) implements Language<W> { }

    record ComplementOfSigma<W>() implements Language<W> { }
}
