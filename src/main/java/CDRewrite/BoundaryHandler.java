package CDRewrite;

import CDRewrite.Fst.Arc;
import CDRewrite.Fst.Fst;
import CDRewrite.Fst.FstOps;
import CDRewrite.Fst.Optimize;

/**
 * Inserts boundary markers around the input before the rule applies, and deletes them afterwards.
 */
public class BoundaryHandler {
    private final int initialMarker;
    private final int finalMarker;
    private final boolean useInitial;
    private final boolean useFinal;

    /**
     * @param initialMarker - label of the beginning-of-string marker
     * @param finalMarker - label of the end-of-string marker
     * @param useInitial - is the initial marker referenced by the rule?
     * @param useFinal - is the final marker referenced by the rule?
     */
    public BoundaryHandler(int initialMarker, int finalMarker, boolean useInitial, boolean useFinal) {
        this.initialMarker = initialMarker;
        this.finalMarker = finalMarker;
        this.useInitial = useInitial;
        this.useFinal = useFinal;
    }

    public boolean isActive() {
        return useInitial || useFinal;
    }

    /**
     * (eps:initial)? sigma (eps:final)?, optimized and sorted by output label.
     */
    public <W> Fst<W> inserter(Fst<W> sigma) {
        final Fst<W> fst = Optimize.optimize(build(sigma, false));
        fst.sortArcs(Arc.olabelOrder());
        return fst;
    }

    /**
     * (initial:eps)? sigma (final:eps)?, optimized and sorted by input label. Anything the rule inserted before
     * the initial marker or after the final marker is deleted as well.
     */
    public <W> Fst<W> deleter(Fst<W> sigma) {
        Fst<W> fst = build(sigma, true);
        if (isActive()) {
            final Fst<W> deleteSigma = FstOps.mapArcs(sigma, arc -> arc.withLabels(arc.ilabel(), Fst.EPSILON));
            final Fst<W> empty = FstOps.epsilonMachine(sigma.getSemiring());
            fst = FstOps.concat(FstOps.concat(useInitial ? deleteSigma : empty, fst), useFinal ? deleteSigma : empty);
        }
        fst = Optimize.optimize(fst);
        fst.sortArcs(Arc.ilabelOrder());
        return fst;
    }

    private <W> Fst<W> build(Fst<W> sigma, boolean delete) {
        final Fst<W> initial = boundary(sigma, initialMarker, useInitial, delete);
        final Fst<W> last = boundary(sigma, finalMarker, useFinal, delete);
        return FstOps.concat(FstOps.concat(initial, sigma), last);
    }

    private static <W> Fst<W> boundary(Fst<W> sigma, int marker, boolean use, boolean delete) {
        if (!use) {
            return FstOps.epsilonMachine(sigma.getSemiring());
        }
        final Fst<W> fst = new Fst<>(sigma.getSemiring());
        final int start = fst.addState();
        final int end = fst.addState();
        fst.setStart(start);
        fst.setFinal(end);
        fst.addArc(start, delete ? marker : Fst.EPSILON, delete ? Fst.EPSILON : marker, end);
        return fst;
    }
}
