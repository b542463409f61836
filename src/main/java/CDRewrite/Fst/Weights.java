package CDRewrite.Fst;

import java.util.List;

/**
 * Moves automata between a weighted semiring and the boolean semiring, where only acceptance matters.
 */
public class Weights {

    private Weights() {}

    /**
     * Maps every arc weight to true and every final weight to whether the state is final.
     */
    public static <W> Fst<Boolean> erase(Fst<W> fst) {
        return convert(fst, Semiring.bool());
    }

    /**
     * Maps an unweighted automaton into the target semiring with identity weights.
     */
    public static <W> Fst<W> restoreIdentity(Fst<Boolean> fst, Semiring<W> semiring) {
        return convert(fst, semiring);
    }

    /**
     * Drops the weights of fst while staying in its semiring.
     */
    public static <W> Fst<W> removeWeights(Fst<W> fst) {
        return convert(fst, fst.getSemiring());
    }

    private static <V, W> Fst<W> convert(Fst<V> fst, Semiring<W> target) {
        final Semiring<V> source = fst.getSemiring();
        final Fst<W> out = new Fst<>(target);
        out.propagateError(fst);
        for (int s = 0; s < fst.numStates(); s++) {
            out.addState();
        }
        if (fst.getStart() != Fst.NO_STATE) {
            out.setStart(fst.getStart());
        }
        for (int s = 0; s < fst.numStates(); s++) {
            out.setFinal(s, source.isZero(fst.getFinal(s)) ? target.zero() : target.one());
            final List<Arc<V>> arcs = fst.getArcs(s);
            for (Arc<V> arc : arcs) {
                if (!source.isZero(arc.weight())) {
                    out.addArc(s, arc.ilabel(), arc.olabel(), target.one(), arc.nextState());
                }
            }
        }
        return out;
    }
}
