package CDRewrite.Fst;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Rational and structural operations on {@link Fst}s. Every operation returns a new FST and leaves its operands
 * untouched; the error bit of any operand is carried over to the result.
 */
public class FstOps {

    public enum ClosureType { STAR, PLUS }

    public enum ProjectType { INPUT, OUTPUT }

    private FstOps() {}

    /**
     * Concatenation: every final state of first gets an epsilon arc (with its final weight) to the start of second.
     */
    public static <W> Fst<W> concat(Fst<W> first, Fst<W> second) {
        final Semiring<W> sr = first.getSemiring();
        Fst<W> out = new Fst<>(sr);
        out.propagateError(first);
        out.propagateError(second);
        if (first.getStart() == Fst.NO_STATE) {
            return out;
        }
        final int offset = appendStates(out, first);
        final int secondOffset = appendStates(out, second);
        out.setStart(first.getStart() + offset);
        for (int s = 0; s < first.numStates(); s++) {
            W fin = first.getFinal(s);
            if (sr.isZero(fin)) {
                continue;
            }
            out.setFinal(s + offset, sr.zero());
            if (second.getStart() != Fst.NO_STATE) {
                out.addArc(s + offset, Fst.EPSILON, Fst.EPSILON, fin, second.getStart() + secondOffset);
            }
        }
        return out;
    }

    /**
     * Union through a new start state with epsilon arcs to both operands' start states.
     */
    public static <W> Fst<W> union(Fst<W> first, Fst<W> second) {
        final Semiring<W> sr = first.getSemiring();
        Fst<W> out = new Fst<>(sr);
        out.propagateError(first);
        out.propagateError(second);
        final int start = out.addState();
        out.setStart(start);
        final int offset = appendStates(out, first);
        final int secondOffset = appendStates(out, second);
        if (first.getStart() != Fst.NO_STATE) {
            out.addArc(start, Fst.EPSILON, Fst.EPSILON, sr.one(), first.getStart() + offset);
        }
        if (second.getStart() != Fst.NO_STATE) {
            out.addArc(start, Fst.EPSILON, Fst.EPSILON, sr.one(), second.getStart() + secondOffset);
        }
        return out;
    }

    /**
     * Kleene closure. STAR additionally accepts the empty string through a new final start state.
     * <p>
     * Instead of epsilon arcs back to the start state, every final state gets a copy of the start state's arcs,
     * weighted by its final weight. The empty string is then accepted only once, even when the start state is
     * final, so closures stay free of epsilon cycles in every semiring.
     */
    public static <W> Fst<W> closure(Fst<W> fst, ClosureType type) {
        final Semiring<W> sr = fst.getSemiring();
        Fst<W> out = fst.copy();
        final int oldStart = out.getStart();
        if (oldStart == Fst.NO_STATE) {
            if (type == ClosureType.STAR) {
                final int start = out.addState();
                out.setFinal(start);
                out.setStart(start);
            }
            return out;
        }
        final List<Arc<W>> startArcs = new ArrayList<>(out.getArcs(oldStart));
        for (int s = 0; s < out.numStates(); s++) {
            final W fin = out.getFinal(s);
            if (sr.isZero(fin) || s == oldStart) {
                continue;
            }
            for (Arc<W> arc : startArcs) {
                out.addArc(s, arc.withWeight(sr.times(fin, arc.weight())));
            }
        }
        if (type == ClosureType.STAR) {
            final int start = out.addState();
            out.setFinal(start);
            for (Arc<W> arc : startArcs) {
                out.addArc(start, arc);
            }
            out.setStart(start);
        }
        return out;
    }

    /**
     * Reversal. State 0 of the result is a new start state with epsilon arcs, weighted by the final weights, to
     * the former final states; the former start state becomes the only final state.
     */
    public static <W> Fst<W> reverse(Fst<W> fst) {
        final Semiring<W> sr = fst.getSemiring();
        Fst<W> out = new Fst<>(sr);
        out.propagateError(fst);
        if (fst.getStart() == Fst.NO_STATE) {
            return out;
        }
        final int superInitial = out.addState();
        for (int s = 0; s < fst.numStates(); s++) {
            out.addState();
        }
        out.setStart(superInitial);
        out.setFinal(fst.getStart() + 1);
        for (int s = 0; s < fst.numStates(); s++) {
            W fin = fst.getFinal(s);
            if (!sr.isZero(fin)) {
                out.addArc(superInitial, Fst.EPSILON, Fst.EPSILON, fin, s + 1);
            }
            for (Arc<W> arc : fst.getArcs(s)) {
                out.addArc(arc.nextState() + 1, arc.ilabel(), arc.olabel(), arc.weight(), s + 1);
            }
        }
        return out;
    }

    /**
     * Projects onto the input or output labels, producing an acceptor.
     */
    public static <W> Fst<W> project(Fst<W> fst, ProjectType type) {
        return mapArcs(fst, arc -> type == ProjectType.INPUT
            ? arc.withLabels(arc.ilabel(), arc.ilabel())
            : arc.withLabels(arc.olabel(), arc.olabel()));
    }

    /**
     * Swaps input and output labels.
     */
    public static <W> Fst<W> invert(Fst<W> fst) {
        return mapArcs(fst, arc -> arc.withLabels(arc.olabel(), arc.ilabel()));
    }

    /**
     * Applies the mapper to every arc; the mapper must not change the next state.
     */
    public static <W> Fst<W> mapArcs(Fst<W> fst, UnaryOperator<Arc<W>> mapper) {
        Fst<W> out = fst.copy();
        for (int s = 0; s < out.numStates(); s++) {
            List<Arc<W>> mapped = new ArrayList<>(out.numArcs(s));
            for (Arc<W> arc : out.getArcs(s)) {
                mapped.add(mapper.apply(arc));
            }
            out.setArcs(s, mapped);
        }
        return out;
    }

    /**
     * Cross product of two acceptors: pairs every string of upper with every string of lower.
     */
    public static <W> Fst<W> cross(Fst<W> upper, Fst<W> lower) {
        final Fst<W> deleter = RmEpsilon.rmEpsilon(mapArcs(upper, arc -> arc.withLabels(arc.ilabel(), Fst.EPSILON)));
        final Fst<W> inserter = RmEpsilon.rmEpsilon(mapArcs(lower, arc -> arc.withLabels(Fst.EPSILON, arc.olabel())));
        return Compose.compose(deleter, inserter);
    }

    /**
     * A single-state acceptor of the empty string.
     */
    public static <W> Fst<W> epsilonMachine(Semiring<W> semiring) {
        Fst<W> out = new Fst<>(semiring);
        final int start = out.addState();
        out.setStart(start);
        out.setFinal(start);
        return out;
    }

    /**
     * Removes states that are not both accessible and co-accessible. If the start state is removed, the result
     * has no states.
     * @param fst - input FST
     * @return trimmed FST
     */
    public static <W> Fst<W> connect(Fst<W> fst) {
        final Semiring<W> sr = fst.getSemiring();
        Fst<W> out = new Fst<>(sr);
        out.propagateError(fst);
        if (fst.getStart() == Fst.NO_STATE) {
            return out;
        }
        final BitSet states = accessibleStates(fst);
        states.and(coaccessibleStates(fst));
        if (!states.get(fst.getStart())) {
            return out;
        }

        final int[] mapping = new int[fst.numStates()];
        for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
            mapping[s] = out.addState();
            out.setFinal(mapping[s], fst.getFinal(s));
        }
        out.setStart(mapping[fst.getStart()]);

        for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
            for (Arc<W> arc : fst.getArcs(s)) {
                if (states.get(arc.nextState()) && !sr.isZero(arc.weight())) {
                    out.addArc(mapping[s], arc.withNextState(mapping[arc.nextState()]));
                }
            }
        }
        return out;
    }

    /**
     * Combines arcs leaving the same state with the same labels and destination by summing their weights.
     */
    public static <W> Fst<W> sumArcs(Fst<W> fst) {
        final Semiring<W> sr = fst.getSemiring();
        Fst<W> out = fst.copy();
        for (int s = 0; s < out.numStates(); s++) {
            Map<Arc<W>, W> summed = new LinkedHashMap<>();
            for (Arc<W> arc : out.getArcs(s)) {
                summed.merge(arc.withWeight(null), arc.weight(), sr::plus);
            }
            if (summed.size() == out.numArcs(s)) {
                continue;
            }
            List<Arc<W>> merged = new ArrayList<>(summed.size());
            summed.forEach((key, weight) -> merged.add(key.withWeight(weight)));
            out.setArcs(s, merged);
        }
        return out;
    }

    /**
     * Is the FST free of cycles reachable from the start state?
     */
    public static <W> boolean isAcyclic(Fst<W> fst) {
        if (fst.getStart() == Fst.NO_STATE) {
            return true;
        }
        // 0 = unvisited, 1 = on stack, 2 = done
        final byte[] color = new byte[fst.numStates()];
        final Deque<int[]> stack = new ArrayDeque<>();
        stack.push(new int[] {fst.getStart(), 0});
        color[fst.getStart()] = 1;
        while (!stack.isEmpty()) {
            int[] frame = stack.peek();
            List<Arc<W>> stateArcs = fst.getArcs(frame[0]);
            if (frame[1] == stateArcs.size()) {
                color[frame[0]] = 2;
                stack.pop();
                continue;
            }
            int next = stateArcs.get(frame[1]++).nextState();
            if (color[next] == 1) {
                return false;
            }
            if (color[next] == 0) {
                color[next] = 1;
                stack.push(new int[] {next, 0});
            }
        }
        return true;
    }

    private static <W> int appendStates(Fst<W> out, Fst<W> fst) {
        final int offset = out.numStates();
        for (int s = 0; s < fst.numStates(); s++) {
            out.setFinal(out.addState(), fst.getFinal(s));
        }
        for (int s = 0; s < fst.numStates(); s++) {
            for (Arc<W> arc : fst.getArcs(s)) {
                out.addArc(s + offset, arc.withNextState(arc.nextState() + offset));
            }
        }
        return offset;
    }

    private static <W> BitSet accessibleStates(Fst<W> fst) {
        final BitSet seen = new BitSet(fst.numStates());
        final IntList queue = new IntArrayList();
        seen.set(fst.getStart());
        queue.add(fst.getStart());
        for (int i = 0; i < queue.size(); i++) {
            for (Arc<W> arc : fst.getArcs(queue.getInt(i))) {
                if (!seen.get(arc.nextState())) {
                    seen.set(arc.nextState());
                    queue.add(arc.nextState());
                }
            }
        }
        return seen;
    }

    private static <W> BitSet coaccessibleStates(Fst<W> fst) {
        final int n = fst.numStates();
        final List<IntList> predecessors = new ArrayList<>(n);
        for (int s = 0; s < n; s++) {
            predecessors.add(new IntArrayList());
        }
        final BitSet seen = new BitSet(n);
        final IntList queue = new IntArrayList();
        for (int s = 0; s < n; s++) {
            for (Arc<W> arc : fst.getArcs(s)) {
                predecessors.get(arc.nextState()).add(s);
            }
            if (fst.isFinal(s)) {
                seen.set(s);
                queue.add(s);
            }
        }
        for (int i = 0; i < queue.size(); i++) {
            for (int pred : predecessors.get(queue.getInt(i))) {
                if (!seen.get(pred)) {
                    seen.set(pred);
                    queue.add(pred);
                }
            }
        }
        return seen;
    }
}
