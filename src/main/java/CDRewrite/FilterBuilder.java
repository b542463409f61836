package CDRewrite;

import java.util.List;

import CDRewrite.Fst.Arc;
import CDRewrite.Fst.Determinizer;
import CDRewrite.Fst.Fst;
import CDRewrite.Fst.FstOps;
import CDRewrite.Fst.RmEpsilon;
import CDRewrite.Fst.Semiring;
import CDRewrite.Fst.Weights;
import CDRewrite.Model.Language;
import CDRewrite.Model.MarkerPair;
import CDRewrite.Model.MarkerType;

/**
 * Builds the marker transducer for sigma^* beta, or, when reversed, the reverse of the marker transducer for
 * sigma^* reverse(beta).
 * <p>
 * Filters only depend on which strings are accepted, so the construction runs in the boolean semiring and the
 * result is mapped back with identity weights.
 */
public class FilterBuilder {
    public static boolean DEBUG = false;

    private FilterBuilder() {}

    /**
     * @param beta - context or match acceptor
     * @param sigma - alphabet closure
     * @param type - MARK, CHECK or CHECK_COMPLEMENT
     * @param markers - marker arcs
     * @param reverse - build the right-to-left filter
     * @return unweighted filter in the semiring of beta, sorted by input label
     */
    public static <W> Fst<W> makeFilter(Fst<W> beta, Fst<W> sigma, MarkerType type, List<MarkerPair> markers,
                                        boolean reverse) {
        final Semiring<W> sr = beta.getSemiring();
        Fst<Boolean> filter = Weights.erase(beta);
        final Fst<Boolean> usigma = Weights.erase(sigma);
        if (filter.getStart() == Fst.NO_STATE) {
            filter.setStart(filter.addState());
        }
        if (reverse) {
            final Fst<Boolean> reversedSigma = RmEpsilon.rmEpsilon(FstOps.reverse(usigma));
            filter = MarkerBuilder.prependSigmaStar(FstOps.reverse(filter), reversedSigma);
        } else {
            filter = MarkerBuilder.prependSigmaStar(filter, usigma);
        }
        filter = Determinizer.determinizeAndMinimize(RmEpsilon.rmEpsilon(filter));

        final Language<Boolean> language = filter.numStates() == 0
            ? Language.complementOfSigma()
            : Language.explicit(filter);
        filter = MarkerBuilder.makeMarker(language, usigma, type, markers);
        if (reverse) {
            filter = FstOps.reverse(filter);
        }
        filter.sortArcs(Arc.ilabelOrder());
        if (DEBUG) {
            System.out.println("DEBUG: " + type + (reverse ? " reversed" : "") + " filter " + filter.numStates()
                + " states, " + filter.numArcs() + " arcs");
        }
        return Weights.restoreIdentity(filter, sr);
    }
}
