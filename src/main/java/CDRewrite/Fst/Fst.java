package CDRewrite.Fst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Mutable weighted finite-state transducer. States are int handles into an arena owned by this object and are
 * created with {@link #addState()}. A state is final iff its final weight is not the semiring zero.
 * <p>
 * An FST with no start state denotes the empty language. The error bit is set by operations that could not be
 * carried out and is propagated by every operation in this package.
 *
 * @param <W> - weight type
 */
public class Fst<W> {
    public static final int NO_STATE = -1;
    public static final int NO_LABEL = -1;
    public static final int EPSILON = 0;

    private final Semiring<W> semiring;
    private final List<List<Arc<W>>> arcs;
    private final List<W> finals;
    private int start = NO_STATE;
    private boolean error;

    public Fst(Semiring<W> semiring) {
        this.semiring = semiring;
        this.arcs = new ArrayList<>();
        this.finals = new ArrayList<>();
    }

    public Fst(Fst<W> other) {
        this.semiring = other.semiring;
        this.arcs = new ArrayList<>(other.arcs.size());
        for (List<Arc<W>> stateArcs : other.arcs) {
            this.arcs.add(new ArrayList<>(stateArcs));
        }
        this.finals = new ArrayList<>(other.finals);
        this.start = other.start;
        this.error = other.error;
    }

    /**
     * An empty FST in the given semiring with the error bit set.
     */
    public static <W> Fst<W> errorFst(Semiring<W> semiring) {
        Fst<W> fst = new Fst<>(semiring);
        fst.setError();
        return fst;
    }

    public Fst<W> copy() {
        return new Fst<>(this);
    }

    public Semiring<W> getSemiring() {
        return semiring;
    }

    public int addState() {
        arcs.add(new ArrayList<>());
        finals.add(semiring.zero());
        return arcs.size() - 1;
    }

    public int numStates() {
        return arcs.size();
    }

    public int numArcs(int state) {
        return arcs.get(checkState(state)).size();
    }

    public int numArcs() {
        int total = 0;
        for (List<Arc<W>> stateArcs : arcs) {
            total += stateArcs.size();
        }
        return total;
    }

    public int getStart() {
        return start;
    }

    public void setStart(int state) {
        this.start = state == NO_STATE ? NO_STATE : checkState(state);
    }

    public W getFinal(int state) {
        return finals.get(checkState(state));
    }

    public boolean isFinal(int state) {
        return !semiring.isZero(getFinal(state));
    }

    public void setFinal(int state, W weight) {
        finals.set(checkState(state), weight);
    }

    public void setFinal(int state) {
        setFinal(state, semiring.one());
    }

    public List<Arc<W>> getArcs(int state) {
        return Collections.unmodifiableList(arcs.get(checkState(state)));
    }

    public void addArc(int state, Arc<W> arc) {
        checkState(arc.nextState());
        arcs.get(checkState(state)).add(arc);
    }

    public void addArc(int state, int ilabel, int olabel, W weight, int nextState) {
        addArc(state, new Arc<>(ilabel, olabel, weight, nextState));
    }

    public void addArc(int state, int ilabel, int olabel, int nextState) {
        addArc(state, new Arc<>(ilabel, olabel, semiring.one(), nextState));
    }

    public void setArcs(int state, List<Arc<W>> newArcs) {
        List<Arc<W>> stateArcs = arcs.get(checkState(state));
        stateArcs.clear();
        for (Arc<W> arc : newArcs) {
            checkState(arc.nextState());
            stateArcs.add(arc);
        }
    }

    public void deleteArcs(int state) {
        arcs.get(checkState(state)).clear();
    }

    public void deleteStates() {
        arcs.clear();
        finals.clear();
        start = NO_STATE;
    }

    /**
     * Sorts the arcs of every state, e.g. with {@link Arc#ilabelOrder()}.
     */
    public void sortArcs(Comparator<Arc<W>> order) {
        for (List<Arc<W>> stateArcs : arcs) {
            stateArcs.sort(order);
        }
    }

    public boolean hasError() {
        return error;
    }

    public void setError() {
        this.error = true;
    }

    public void propagateError(Fst<?> other) {
        this.error |= other.error;
    }

    public boolean isAcceptor() {
        for (List<Arc<W>> stateArcs : arcs) {
            for (Arc<W> arc : stateArcs) {
                if (arc.ilabel() != arc.olabel()) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * All arc weights are one and all final weights are zero or one.
     */
    public boolean isUnweighted() {
        for (int s = 0; s < numStates(); s++) {
            W fin = getFinal(s);
            if (!semiring.isZero(fin) && !semiring.isOne(fin)) {
                return false;
            }
            for (Arc<W> arc : arcs.get(s)) {
                if (!semiring.isOne(arc.weight())) {
                    return false;
                }
            }
        }
        return true;
    }

    public boolean isEpsilonFree() {
        for (List<Arc<W>> stateArcs : arcs) {
            for (Arc<W> arc : stateArcs) {
                if (arc.isEpsilon()) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Largest input or output label, or {@link #NO_LABEL} if there are no arcs.
     */
    public int maxLabel() {
        int max = NO_LABEL;
        for (List<Arc<W>> stateArcs : arcs) {
            for (Arc<W> arc : stateArcs) {
                max = Math.max(max, Math.max(arc.ilabel(), arc.olabel()));
            }
        }
        return max;
    }

    /**
     * Does some arc carry this label on either side?
     */
    public boolean hasLabel(int label) {
        if (label == NO_LABEL) {
            return false;
        }
        for (List<Arc<W>> stateArcs : arcs) {
            for (Arc<W> arc : stateArcs) {
                if (arc.ilabel() == label || arc.olabel() == label) {
                    return true;
                }
            }
        }
        return false;
    }

    private int checkState(int state) {
        if (state < 0 || state >= arcs.size()) {
            throw new IllegalArgumentException("Unknown state: " + state);
        }
        return state;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Fst(").append(semiring.getName()).append(", start=").append(start);
        if (error) {
            sb.append(", error");
        }
        sb.append(")\n");
        for (int s = 0; s < numStates(); s++) {
            for (Arc<W> arc : arcs.get(s)) {
                sb.append(s).append(' ').append(arc).append('\n');
            }
            if (isFinal(s)) {
                sb.append(s).append(" final ").append(semiring.format(getFinal(s))).append('\n');
            }
        }
        return sb.toString();
    }
}
