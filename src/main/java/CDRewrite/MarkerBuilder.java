package CDRewrite;

import java.util.List;

import CDRewrite.Fst.Arc;
import CDRewrite.Fst.Fst;
import CDRewrite.Fst.FstOps;
import CDRewrite.Fst.RmEpsilon;
import CDRewrite.Fst.Semiring;
import CDRewrite.Model.Language;
import CDRewrite.Model.MarkerPair;
import CDRewrite.Model.MarkerType;

/**
 * Marker transducers and the small marker-wiring helpers of the rule compiler.
 */
public class MarkerBuilder {

    private MarkerBuilder() {}

    /**
     * Turns an acceptor into a marker transducer of the given type for the language it represents.
     * @param language - explicit acceptor, or the complement of sigma
     * @param sigma - alphabet closure, used when language is the complement of sigma
     * @param type - MARK, CHECK or CHECK_COMPLEMENT
     * @param markers - marker arcs to insert or check
     * @return marker transducer; carries the error bit if an explicit language is not an acceptor
     */
    public static <W> Fst<W> makeMarker(Language<W> language, Fst<W> sigma, MarkerType type,
                                        List<MarkerPair> markers) {
        if (language instanceof Language.Explicit<W> explicit) {
            final Fst<W> acceptor = explicit.acceptor();
            if (!acceptor.isAcceptor()) {
                return Fst.errorFst(acceptor.getSemiring());
            }
            return markExplicit(acceptor.copy(), type, markers);
        }
        // Complement(Complement(sigma)) == sigma
        final Fst<W> fst = sigma.copy();
        if (type == MarkerType.CHECK_COMPLEMENT) {
            for (int s = 0; s < fst.numStates(); s++) {
                if (fst.isFinal(s)) {
                    addLoops(fst, s, markers);
                }
            }
        }
        return fst;
    }

    private static <W> Fst<W> markExplicit(Fst<W> fst, MarkerType type, List<MarkerPair> markers) {
        final Semiring<W> sr = fst.getSemiring();
        final int numStates = fst.numStates();
        switch (type) {
            case MARK -> {
                for (int s = 0; s < numStates; s++) {
                    if (!fst.isFinal(s)) {
                        fst.setFinal(s);
                        continue;
                    }
                    // s keeps only the marker arcs; the match continues from i
                    final int i = fst.addState();
                    fst.setFinal(i, fst.getFinal(s));
                    for (Arc<W> arc : fst.getArcs(s)) {
                        fst.addArc(i, arc);
                    }
                    fst.setFinal(s, sr.zero());
                    fst.deleteArcs(s);
                    for (MarkerPair marker : markers) {
                        fst.addArc(s, marker.ilabel(), marker.olabel(), i);
                    }
                }
            }
            case CHECK -> {
                for (int s = 0; s < numStates; s++) {
                    if (!fst.isFinal(s)) {
                        fst.setFinal(s);
                    } else {
                        addLoops(fst, s, markers);
                    }
                }
            }
            case CHECK_COMPLEMENT -> {
                for (int s = 0; s < numStates; s++) {
                    if (!fst.isFinal(s)) {
                        fst.setFinal(s);
                        addLoops(fst, s, markers);
                    }
                }
            }
        }
        return fst;
    }

    /**
     * Adds marker self-loops at every state, so the markers pass through anywhere.
     */
    public static <W> Fst<W> ignoreMarkers(Fst<W> fst, List<MarkerPair> markers) {
        final Fst<W> out = fst.copy();
        for (int s = 0; s < out.numStates(); s++) {
            addLoops(out, s, markers);
        }
        return out;
    }

    /**
     * Turns sigma^* into (sigma union markers)^*: every final state gets marker arcs back to the start.
     */
    public static <W> Fst<W> addMarkersToSigma(Fst<W> sigma, List<MarkerPair> markers) {
        final Fst<W> out = sigma.copy();
        if (out.getStart() == Fst.NO_STATE) {
            return out;
        }
        for (int s = 0; s < out.numStates(); s++) {
            if (out.isFinal(s)) {
                for (MarkerPair marker : markers) {
                    out.addArc(s, marker.ilabel(), marker.olabel(), out.getStart());
                }
            }
        }
        return out;
    }

    /**
     * Concatenates one transition per marker pair after fst.
     */
    public static <W> Fst<W> appendMarkers(Fst<W> fst, List<MarkerPair> markers) {
        final Fst<W> markerFst = new Fst<>(fst.getSemiring());
        final int start = markerFst.addState();
        final int end = markerFst.addState();
        markerFst.setStart(start);
        markerFst.setFinal(end);
        for (MarkerPair marker : markers) {
            markerFst.addArc(start, marker.ilabel(), marker.olabel(), end);
        }
        return FstOps.concat(fst, markerFst);
    }

    /**
     * Adds a new start state with one transition per marker pair to the old start.
     */
    public static <W> Fst<W> prependMarkers(Fst<W> fst, List<MarkerPair> markers) {
        final Fst<W> out = fst.copy();
        if (out.getStart() == Fst.NO_STATE) {
            out.setStart(out.addState());
        }
        final int oldStart = out.getStart();
        final int newStart = out.addState();
        out.setStart(newStart);
        for (MarkerPair marker : markers) {
            out.addArc(newStart, marker.ilabel(), marker.olabel(), oldStart);
        }
        return out;
    }

    /**
     * Prepends sigma^* to fst: concatenation followed by epsilon removal.
     */
    public static <W> Fst<W> prependSigmaStar(Fst<W> fst, Fst<W> sigma) {
        return RmEpsilon.rmEpsilon(FstOps.concat(sigma, fst));
    }

    private static <W> void addLoops(Fst<W> fst, int state, List<MarkerPair> markers) {
        for (MarkerPair marker : markers) {
            fst.addArc(state, marker.ilabel(), marker.olabel(), state);
        }
    }
}
