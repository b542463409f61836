package CDRewrite.Fst;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.MutableDFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.ts.AcceptorPowersetViewTS;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;

/**
 * Determinization and minimization of an epsilon-free FST viewed as an unweighted acceptor.
 * <p>
 * Every distinct (ilabel, olabel, weight) triple is encoded as one symbol of a {@link CompactNFA}; a final weight
 * other than one is encoded as an arc with the triple (epsilon, epsilon, weight) to a super-final state. The
 * encoded NFA goes through subset construction into a partial DFA, Hopcroft minimization of that partial DFA, and
 * is decoded back. The result is equivalent to the input whenever the semiring is idempotent; otherwise paths with
 * the same triples are merged into one instead of being summed.
 */
public class Determinizer {
    public static boolean DEBUG = false;

    private Determinizer() {}

    /**
     * @param fst - epsilon-free FST
     * @return deterministic (over encoded triples), minimal and connected equivalent FST
     */
    public static <W> Fst<W> determinizeAndMinimize(Fst<W> fst) {
        final Semiring<W> sr = fst.getSemiring();
        if (fst.hasError()) {
            return Fst.errorFst(sr);
        }
        if (!fst.isEpsilonFree()) {
            throw new IllegalArgumentException("Determinizer requires an epsilon-free FST");
        }
        if (fst.getStart() == Fst.NO_STATE) {
            return new Fst<>(sr);
        }

        final EncodeTable<W> table = new EncodeTable<>(sr);
        final CompactNFA<Integer> nfa = table.encode(fst);
        if (table.size() == 0) {
            // no arcs left after encoding: only the start state matters
            return FstOps.connect(startOnly(fst));
        }
        final Alphabet<Integer> alphabet = nfa.getInputAlphabet();

        final CompactDFA<Integer> dfa = new CompactDFA<>(alphabet);
        doDeterminize(nfa.powersetView(), alphabet, dfa);
        final DFA<Integer, Integer> minimized = HopcroftMinimizer.minimizePartialDFA(dfa, alphabet);
        if (DEBUG) {
            System.out.println("DEBUG: encoded NFA " + nfa.size() + " states, " + alphabet.size() + " symbols -> DFA "
                + dfa.size() + " -> minimal " + minimized.size());
        }
        return FstOps.sumArcs(FstOps.connect(table.decode(minimized, alphabet)));
    }

    private static <W> Fst<W> startOnly(Fst<W> fst) {
        final Fst<W> out = new Fst<>(fst.getSemiring());
        final int start = out.addState();
        out.setStart(start);
        out.setFinal(start, fst.getFinal(fst.getStart()));
        return out;
    }

    /**
     * Subset construction producing a partial DFA: empty successor sets get no state.
     */
    private static <I, SO> void doDeterminize(AcceptorPowersetViewTS<BitSet, I, ?> powerset,
                                              Collection<? extends I> inputs,
                                              MutableDFA<SO, I> out) {

        Map<BitSet, SO> outStateMap = new HashMap<>();
        Deque<DeterminizeRecord<SO>> stack = new ArrayDeque<>();

        BitSet init = powerset.getInitialState();
        boolean initAcc = powerset.isAccepting(init);
        SO initOut = out.addInitialState(initAcc);

        outStateMap.put(init, initOut);

        stack.push(new DeterminizeRecord<>(init, initOut));

        while (!stack.isEmpty()) {
            DeterminizeRecord<SO> curr = stack.pop();

            BitSet inState = curr.inputState();
            SO outState = curr.outputState();

            for (I sym : inputs) {
                BitSet succ = powerset.getSuccessor(inState, sym);

                if (succ != null && !succ.isEmpty()) {
                    SO outSucc = outStateMap.get(succ);
                    if (outSucc == null) {
                        // add new state to DFA and to stack
                        outSucc = out.addState(powerset.isAccepting(succ));
                        outStateMap.put(succ, outSucc);
                        stack.push(new DeterminizeRecord<>(succ, outSucc));
                    }
                    out.setTransition(outState, sym, outSucc);
                }
            }
        }
    }

    private record DeterminizeRecord<SO>(BitSet inputState, SO outputState) { }

    private record Triple<W>(int ilabel, int olabel, W weight) {
        boolean isFinalWeight() {
            return ilabel == Fst.EPSILON && olabel == Fst.EPSILON;
        }
    }

    /**
     * Bijection between arc triples and the integer symbols of the encoded acceptor.
     */
    private static final class EncodeTable<W> {
        private final Semiring<W> semiring;
        private final Object2IntMap<Triple<W>> symbols = new Object2IntOpenHashMap<>();
        private final List<Triple<W>> triples = new ArrayList<>();

        EncodeTable(Semiring<W> semiring) {
            this.semiring = semiring;
            this.symbols.defaultReturnValue(-1);
        }

        int size() {
            return triples.size();
        }

        int symbolOf(int ilabel, int olabel, W weight) {
            final Triple<W> triple = new Triple<>(ilabel, olabel, weight);
            int symbol = symbols.getInt(triple);
            if (symbol < 0) {
                symbol = triples.size();
                symbols.put(triple, symbol);
                triples.add(triple);
            }
            return symbol;
        }

        CompactNFA<Integer> encode(Fst<W> fst) {
            final int n = fst.numStates();
            // first pass fixes the alphabet
            boolean needsSuperFinal = false;
            for (int s = 0; s < n; s++) {
                for (Arc<W> arc : fst.getArcs(s)) {
                    symbolOf(arc.ilabel(), arc.olabel(), arc.weight());
                }
                W fin = fst.getFinal(s);
                if (!semiring.isZero(fin) && !semiring.isOne(fin)) {
                    symbolOf(Fst.EPSILON, Fst.EPSILON, fin);
                    needsSuperFinal = true;
                }
            }

            final Alphabet<Integer> alphabet = Alphabets.integers(0, Math.max(triples.size(), 1) - 1);
            final CompactNFA<Integer> nfa = new CompactNFA<>(alphabet, n + 1);
            for (int s = 0; s < n; s++) {
                nfa.addState(semiring.isOne(fst.getFinal(s)));
            }
            final int superFinal = needsSuperFinal ? nfa.addState(true) : -1;
            nfa.setInitial(fst.getStart(), true);

            for (int s = 0; s < n; s++) {
                for (Arc<W> arc : fst.getArcs(s)) {
                    int symbol = symbolOf(arc.ilabel(), arc.olabel(), arc.weight());
                    nfa.addTransition(s, symbol, arc.nextState());
                }
                W fin = fst.getFinal(s);
                if (!semiring.isZero(fin) && !semiring.isOne(fin)) {
                    int symbol = symbolOf(Fst.EPSILON, Fst.EPSILON, fin);
                    nfa.addTransition(s, symbol, superFinal);
                }
            }
            return nfa;
        }

        /**
         * Decodes the minimal DFA. Arcs carrying a final-weight symbol lead to the super-final class, which has
         * no outgoing arcs; they are folded into the final weight of their source.
         */
        Fst<W> decode(DFA<Integer, Integer> dfa, Alphabet<Integer> alphabet) {
            final Fst<W> out = new Fst<>(semiring);
            final Integer init = dfa.getInitialState();
            if (init == null) {
                return out;
            }
            final int size = dfa.size();
            for (int q = 0; q < size; q++) {
                out.addState();
            }
            out.setStart(init);
            for (Integer q : dfa.getStates()) {
                W fin = dfa.isAccepting(q) ? semiring.one() : semiring.zero();
                for (Integer sym : alphabet) {
                    Integer succ = dfa.getTransition(q, sym);
                    if (succ == null) {
                        continue;
                    }
                    final Triple<W> triple = triples.get(sym);
                    if (triple.isFinalWeight()) {
                        fin = semiring.plus(fin, triple.weight());
                    } else {
                        out.addArc(q, triple.ilabel(), triple.olabel(), triple.weight(), succ);
                    }
                }
                out.setFinal(q, fin);
            }
            return out;
        }
    }
}
