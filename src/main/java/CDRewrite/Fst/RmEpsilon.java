package CDRewrite.Fst;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * Epsilon removal. An epsilon arc here is one with epsilon on both sides; arcs that are epsilon on one side only
 * are ordinary transducer arcs and are kept.
 */
public class RmEpsilon {
    /** Lower bound on the relaxations per source state before the distance counts as divergent. */
    static final int MIN_RELAXATIONS = 1 << 16;

    private RmEpsilon() {}

    /**
     * Replaces every epsilon path s ~> q followed by a non-epsilon arc q -> t by a direct arc s -> t, weighted by
     * the epsilon-distance from s to q. Final weights are folded the same way.
     * @param fst - input FST
     * @return equivalent epsilon-free FST, connected; an FST with the error bit if some epsilon-distance does not
     * converge
     */
    public static <W> Fst<W> rmEpsilon(Fst<W> fst) {
        if (fst.isEpsilonFree()) {
            return FstOps.connect(fst);
        }
        final Semiring<W> sr = fst.getSemiring();
        Fst<W> out = new Fst<>(sr);
        out.propagateError(fst);
        for (int s = 0; s < fst.numStates(); s++) {
            out.addState();
        }
        out.setStart(fst.getStart());

        for (int s = 0; s < fst.numStates(); s++) {
            final Int2ObjectMap<W> distances = epsilonDistance(fst, s);
            if (distances == null) {
                return Fst.errorFst(sr);
            }
            W fin = sr.zero();
            for (Int2ObjectMap.Entry<W> entry : distances.int2ObjectEntrySet()) {
                final int q = entry.getIntKey();
                final W distance = entry.getValue();
                for (Arc<W> arc : fst.getArcs(q)) {
                    if (!arc.isEpsilon()) {
                        out.addArc(s, arc.withWeight(sr.times(distance, arc.weight())));
                    }
                }
                fin = sr.plus(fin, sr.times(distance, fst.getFinal(q)));
            }
            out.setFinal(s, fin);
        }
        return FstOps.connect(out);
    }

    /**
     * Single-source shortest distance over the epsilon arcs leaving source (generic relaxation with residuals).
     * Converges for k-closed semirings; real-valued weights are compared up to {@link Semiring#DELTA}.
     * @return distances by state, or null if the relaxation does not settle
     */
    static <W> Int2ObjectMap<W> epsilonDistance(Fst<W> fst, int source) {
        final Semiring<W> sr = fst.getSemiring();
        final Int2ObjectMap<W> distance = new Int2ObjectLinkedOpenHashMap<>();
        final Int2ObjectMap<W> residual = new Int2ObjectLinkedOpenHashMap<>();
        distance.defaultReturnValue(sr.zero());
        residual.defaultReturnValue(sr.zero());

        final Deque<Integer> queue = new ArrayDeque<>();
        final IntSet enqueued = new IntOpenHashSet();
        distance.put(source, sr.one());
        residual.put(source, sr.one());
        queue.add(source);
        enqueued.add(source);

        final long limit = Math.max(MIN_RELAXATIONS, (long) fst.numStates() * fst.numStates());
        long relaxations = 0;
        while (!queue.isEmpty()) {
            if (++relaxations > limit) {
                return null;
            }
            final int q = queue.poll();
            enqueued.remove(q);
            final W r = residual.get(q);
            residual.put(q, sr.zero());
            final List<Arc<W>> arcs = fst.getArcs(q);
            for (Arc<W> arc : arcs) {
                if (!arc.isEpsilon()) {
                    continue;
                }
                final int t = arc.nextState();
                final W old = distance.get(t);
                final W relaxed = sr.plus(old, sr.times(r, arc.weight()));
                if (!sr.approxEqual(old, relaxed)) {
                    distance.put(t, relaxed);
                    residual.put(t, sr.plus(residual.get(t), sr.times(r, arc.weight())));
                    if (enqueued.add(t)) {
                        queue.add(t);
                    }
                }
            }
        }
        return distance;
    }
}
