package CDRewrite.Fst;

/**
 * Generic FST optimization: epsilon removal, then determinization and minimization of the FST encoded as an
 * unweighted acceptor over (ilabel, olabel, weight) triples. In semirings that are not idempotent this also removes
 * duplicate paths, which keeps the weights of ambiguous constructions such as closures from being counted twice.
 */
public class Optimize {

    private Optimize() {}

    public static <W> Fst<W> optimize(Fst<W> fst) {
        if (fst.hasError()) {
            return Fst.errorFst(fst.getSemiring());
        }
        final Fst<W> epsilonFree = RmEpsilon.rmEpsilon(fst);
        if (epsilonFree.hasError()) {
            return epsilonFree;
        }
        return Determinizer.determinizeAndMinimize(epsilonFree);
    }
}
