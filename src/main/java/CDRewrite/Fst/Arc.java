package CDRewrite.Fst;

import java.util.Comparator;

/**
 * Labeled, weighted transition. Label {@link Fst#EPSILON} is the empty string.
 */
public record Arc<W>(int ilabel, int olabel, W weight, int nextState) {

    public Arc {
        if (ilabel < 0 || olabel < 0) {
            throw new IllegalArgumentException("Negative label on arc: " + ilabel + ":" + olabel);
        }
    }

    public Arc<W> withLabels(int ilabel, int olabel) {
        return new Arc<>(ilabel, olabel, weight, nextState);
    }

    public Arc<W> withWeight(W weight) {
        return new Arc<>(ilabel, olabel, weight, nextState);
    }

    public Arc<W> withNextState(int nextState) {
        return new Arc<>(ilabel, olabel, weight, nextState);
    }

    public boolean isEpsilon() {
        return ilabel == Fst.EPSILON && olabel == Fst.EPSILON;
    }

    public static <W> Comparator<Arc<W>> ilabelOrder() {
        return Comparator.<Arc<W>>comparingInt(Arc::ilabel).thenComparingInt(Arc::olabel);
    }

    public static <W> Comparator<Arc<W>> olabelOrder() {
        return Comparator.<Arc<W>>comparingInt(Arc::olabel).thenComparingInt(Arc::ilabel);
    }

    @Override
    public String toString() {
        return ilabel + ":" + olabel + "/" + weight + " -> " + nextState;
    }
}
