package CDRewrite.Fst;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Weighted composition with an epsilon-sequencing filter: on any path, epsilon moves of the left FST are taken
 * before epsilon moves of the right FST, so every pair of matching paths is produced exactly once.
 */
public class Compose {
    private static final int MISSING_ELEMENT = -1;

    private Compose() {}

    /**
     * Composes left with right: the result maps x to z with weight w1*w2 whenever left maps x to y with w1 and
     * right maps y to z with w2.
     * @param left - left operand
     * @param right - right operand
     * @return connected composition
     */
    public static <W> Fst<W> compose(Fst<W> left, Fst<W> right) {
        final Semiring<W> sr = left.getSemiring();
        if (left.hasError() || right.hasError()) {
            return Fst.errorFst(sr);
        }
        Fst<W> out = new Fst<>(sr);
        if (left.getStart() == Fst.NO_STATE || right.getStart() == Fst.NO_STATE) {
            return out;
        }

        final RightIndex<W> index = new RightIndex<>(right);
        final Object2IntMap<ComposeState> stateMap = new Object2IntOpenHashMap<>();
        stateMap.defaultReturnValue(MISSING_ELEMENT);
        final Deque<ComposeState> queue = new ArrayDeque<>();

        final ComposeState init = new ComposeState(left.getStart(), right.getStart(), 0);
        out.setStart(addState(out, stateMap, queue, init));

        while (!queue.isEmpty()) {
            final ComposeState curr = queue.poll();
            final int outState = stateMap.getInt(curr);

            out.setFinal(outState, sr.times(left.getFinal(curr.left()), right.getFinal(curr.right())));

            for (Arc<W> arc1 : left.getArcs(curr.left())) {
                if (arc1.olabel() == Fst.EPSILON) {
                    // left moves alone; only before any right epsilon move
                    if (curr.filter() == 0) {
                        ComposeState next = new ComposeState(arc1.nextState(), curr.right(), 0);
                        out.addArc(outState, arc1.ilabel(), Fst.EPSILON, arc1.weight(),
                            addState(out, stateMap, queue, next));
                    }
                    continue;
                }
                for (Arc<W> arc2 : index.matches(curr.right(), arc1.olabel())) {
                    ComposeState next = new ComposeState(arc1.nextState(), arc2.nextState(), 0);
                    out.addArc(outState, arc1.ilabel(), arc2.olabel(), sr.times(arc1.weight(), arc2.weight()),
                        addState(out, stateMap, queue, next));
                }
            }

            final int filter = index.hasOutputEpsilon(left, curr.left()) ? 1 : 0;
            for (Arc<W> arc2 : index.matches(curr.right(), Fst.EPSILON)) {
                // right moves alone
                ComposeState next = new ComposeState(curr.left(), arc2.nextState(), filter);
                out.addArc(outState, Fst.EPSILON, arc2.olabel(), arc2.weight(),
                    addState(out, stateMap, queue, next));
            }
        }
        return FstOps.connect(out);
    }

    private static <W> int addState(Fst<W> out, Object2IntMap<ComposeState> stateMap,
                                    Deque<ComposeState> queue, ComposeState state) {
        int id = stateMap.getInt(state);
        if (id == MISSING_ELEMENT) {
            id = out.addState();
            stateMap.put(state, id);
            queue.add(state);
        }
        return id;
    }

    private record ComposeState(int left, int right, int filter) { }

    /**
     * Arcs of the right operand grouped by input label, built lazily per state.
     */
    private static final class RightIndex<W> {
        private final Fst<W> fst;
        private final List<Int2ObjectMap<List<Arc<W>>>> byState;

        RightIndex(Fst<W> fst) {
            this.fst = fst;
            this.byState = new ArrayList<>(Collections.nCopies(fst.numStates(), null));
        }

        List<Arc<W>> matches(int state, int ilabel) {
            Int2ObjectMap<List<Arc<W>>> arcs = byState.get(state);
            if (arcs == null) {
                arcs = new Int2ObjectOpenHashMap<>();
                for (Arc<W> arc : fst.getArcs(state)) {
                    List<Arc<W>> group = arcs.get(arc.ilabel());
                    if (group == null) {
                        group = new ArrayList<>();
                        arcs.put(arc.ilabel(), group);
                    }
                    group.add(arc);
                }
                byState.set(state, arcs);
            }
            final List<Arc<W>> group = arcs.get(ilabel);
            return group == null ? Collections.emptyList() : group;
        }

        boolean hasOutputEpsilon(Fst<W> left, int state) {
            for (Arc<W> arc : left.getArcs(state)) {
                if (arc.olabel() == Fst.EPSILON) {
                    return true;
                }
            }
            return false;
        }
    }
}
