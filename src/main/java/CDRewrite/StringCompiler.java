package CDRewrite;

import CDRewrite.Fst.Fst;
import CDRewrite.Fst.FstOps;
import CDRewrite.Fst.Semiring;

/**
 * Compiles strings into linear automata. Every UTF-16 char is one label, its char code.
 */
public class StringCompiler {

    private StringCompiler() {}

    public static <W> Fst<W> acceptor(String string, Semiring<W> semiring) {
        return acceptor(string, semiring.one(), semiring);
    }

    /**
     * @param string - labels as chars
     * @param weight - final weight of the single path
     * @param semiring - weights of the result
     */
    public static <W> Fst<W> acceptor(String string, W weight, Semiring<W> semiring) {
        return acceptor(semiring, weight, toLabels(string));
    }

    public static <W> Fst<W> acceptor(Semiring<W> semiring, int... labels) {
        return acceptor(semiring, semiring.one(), labels);
    }

    public static <W> Fst<W> acceptor(Semiring<W> semiring, W weight, int... labels) {
        final Fst<W> fst = new Fst<>(semiring);
        int state = fst.addState();
        fst.setStart(state);
        for (int label : labels) {
            if (label <= Fst.EPSILON) {
                throw new IllegalArgumentException("Label must be positive: " + label);
            }
            final int next = fst.addState();
            fst.addArc(state, label, label, next);
            state = next;
        }
        fst.setFinal(state, weight);
        return fst;
    }

    /**
     * The single pair (input, output), padded with epsilons on the shorter side.
     */
    public static <W> Fst<W> transducer(String input, String output, Semiring<W> semiring) {
        return transducer(input, output, semiring.one(), semiring);
    }

    public static <W> Fst<W> transducer(String input, String output, W weight, Semiring<W> semiring) {
        final int[] in = toLabels(input);
        final int[] out = toLabels(output);
        final Fst<W> fst = new Fst<>(semiring);
        int state = fst.addState();
        fst.setStart(state);
        for (int i = 0; i < Math.max(in.length, out.length); i++) {
            final int next = fst.addState();
            fst.addArc(state, i < in.length ? in[i] : Fst.EPSILON, i < out.length ? out[i] : Fst.EPSILON, next);
            state = next;
        }
        fst.setFinal(state, weight);
        return fst;
    }

    /**
     * Acceptor of the given strings.
     */
    public static <W> Fst<W> union(Semiring<W> semiring, String... strings) {
        Fst<W> fst = new Fst<>(semiring);
        for (String string : strings) {
            fst = FstOps.union(fst, acceptor(string, semiring));
        }
        return fst;
    }

    /**
     * One final state with a self-loop per char of the alphabet.
     */
    public static <W> Fst<W> sigmaStar(String alphabet, Semiring<W> semiring) {
        final Fst<W> fst = new Fst<>(semiring);
        final int state = fst.addState();
        fst.setStart(state);
        fst.setFinal(state);
        for (int label : toLabels(alphabet)) {
            if (label <= Fst.EPSILON) {
                throw new IllegalArgumentException("Label must be positive: " + label);
            }
            fst.addArc(state, label, label, state);
        }
        return fst;
    }

    /**
     * Adds the given labels as further self-loops of a single-state sigma^*.
     */
    public static <W> Fst<W> sigmaStar(Semiring<W> semiring, int... labels) {
        final Fst<W> fst = sigmaStar("", semiring);
        for (int label : labels) {
            if (label <= Fst.EPSILON) {
                throw new IllegalArgumentException("Label must be positive: " + label);
            }
            fst.addArc(fst.getStart(), label, label, fst.getStart());
        }
        return fst;
    }

    public static int[] toLabels(String string) {
        final int[] labels = new int[string.length()];
        for (int i = 0; i < string.length(); i++) {
            labels[i] = string.charAt(i);
        }
        return labels;
    }
}
