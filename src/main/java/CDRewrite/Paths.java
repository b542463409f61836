package CDRewrite;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import CDRewrite.Fst.Arc;
import CDRewrite.Fst.Fst;
import CDRewrite.Fst.FstOps;
import CDRewrite.Fst.Semiring;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * All successful paths of an acyclic automaton.
 */
public class Paths {

    private Paths() {}

    /**
     * @param labels - non-epsilon output labels along the path
     * @param weight - product of arc weights and the final weight
     */
    public record Path<W>(IntList labels, W weight) {

        /**
         * Labels as code points; a label that is a lone UTF-16 surrogate stays one char.
         * @throws RewriteException if a label is not a code point
         */
        public String string() {
            final StringBuilder sb = new StringBuilder(labels.size());
            for (int i = 0; i < labels.size(); i++) {
                final int label = labels.getInt(i);
                if (!Character.isValidCodePoint(label)) {
                    throw new RewriteException("Label is not a code point: " + label);
                }
                sb.appendCodePoint(label);
            }
            return sb.toString();
        }
    }

    private record Frame<W>(int state, IntList labels, W weight) { }

    /**
     * @param fst - acyclic automaton
     * @return paths in depth-first order
     * @throws RewriteException if fst is cyclic
     */
    public static <W> List<Path<W>> paths(Fst<W> fst) {
        if (!FstOps.isAcyclic(fst)) {
            throw new RewriteException("Cannot enumerate the paths of a cyclic automaton");
        }
        final Semiring<W> sr = fst.getSemiring();
        final List<Path<W>> result = new ArrayList<>();
        if (fst.getStart() == Fst.NO_STATE) {
            return result;
        }
        final Deque<Frame<W>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(fst.getStart(), new IntArrayList(), sr.one()));
        while (!stack.isEmpty()) {
            final Frame<W> curr = stack.pop();
            if (fst.isFinal(curr.state())) {
                result.add(new Path<>(curr.labels(), sr.times(curr.weight(), fst.getFinal(curr.state()))));
            }
            final List<Arc<W>> arcs = fst.getArcs(curr.state());
            for (int i = arcs.size() - 1; i >= 0; i--) {
                final Arc<W> arc = arcs.get(i);
                final IntList labels = new IntArrayList(curr.labels());
                if (arc.olabel() != Fst.EPSILON) {
                    labels.add(arc.olabel());
                }
                stack.push(new Frame<>(arc.nextState(), labels, sr.times(curr.weight(), arc.weight())));
            }
        }
        return result;
    }
}
