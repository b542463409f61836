package CDRewrite;

import java.util.List;

import CDRewrite.Fst.Arc;
import CDRewrite.Fst.Fst;
import CDRewrite.Fst.FstOps;
import CDRewrite.Fst.Optimize;
import CDRewrite.Fst.Semiring;
import CDRewrite.Model.Direction;
import CDRewrite.Model.MarkerPair;
import CDRewrite.Model.Markers;
import CDRewrite.Model.Mode;

/**
 * Turns the phi x psi relation into the replace transducer, which rewrites the marked occurrences of phi and
 * consumes the markers around them.
 */
public class ReplaceBuilder {

    /**
     * Marker arcs used to wire the replace transducer.
     * @param initialPair - from the new start state into the relation
     * @param finalPair - from each final state of the relation to the new final state
     * @param initialLoops - extra marker loops on sigma between rewrites
     * @param allLoops - markers passed through at every state of the relation
     */
    record Wiring(MarkerPair initialPair, MarkerPair finalPair, List<MarkerPair> initialLoops,
                  List<MarkerPair> allLoops) {

        static Wiring of(Direction direction, Mode mode, Markers m) {
            final int eps = Fst.EPSILON;
            return switch (mode) {
                case OBLIGATORY -> {
                    final List<MarkerPair> allLoops = List.of(new MarkerPair(m.lbrace1(), eps),
                        new MarkerPair(m.lbrace2(), eps), new MarkerPair(m.rbrace(), eps));
                    yield switch (direction) {
                        case LEFT_TO_RIGHT -> new Wiring(MarkerPair.identity(m.lbrace1()),
                            new MarkerPair(m.rbrace(), eps),
                            List.of(MarkerPair.identity(m.lbrace2()), new MarkerPair(m.rbrace(), eps)), allLoops);
                        case RIGHT_TO_LEFT -> new Wiring(new MarkerPair(m.rbrace(), eps),
                            MarkerPair.identity(m.lbrace1()),
                            List.of(MarkerPair.identity(m.lbrace2()), new MarkerPair(m.rbrace(), eps)), allLoops);
                        case SIMULTANEOUS -> new Wiring(new MarkerPair(m.lbrace1(), eps),
                            new MarkerPair(m.rbrace(), eps),
                            List.of(new MarkerPair(m.lbrace2(), eps), new MarkerPair(m.rbrace(), eps)), allLoops);
                    };
                }
                case OPTIONAL -> {
                    final List<MarkerPair> loops = MarkerPair.of(m.rbrace(), eps);
                    yield switch (direction) {
                        case LEFT_TO_RIGHT -> new Wiring(new MarkerPair(eps, m.lbrace1()),
                            new MarkerPair(m.rbrace(), eps), loops, loops);
                        case RIGHT_TO_LEFT -> new Wiring(new MarkerPair(m.rbrace(), eps),
                            new MarkerPair(eps, m.lbrace1()), loops, loops);
                        case SIMULTANEOUS -> new Wiring(new MarkerPair(m.lbrace1(), eps),
                            new MarkerPair(m.rbrace(), eps), loops, loops);
                    };
                }
            };
        }
    }

    private ReplaceBuilder() {}

    /**
     * @param relation - phi x psi, possibly weighted
     * @param sigma - alphabet closure, including active boundary markers
     * @param markers - allocated markers
     * @param direction - rule direction
     * @param mode - rule mode
     * @return replace transducer, optimized and sorted by input label
     */
    public static <W> Fst<W> makeReplace(Fst<W> relation, Fst<W> sigma, Markers markers, Direction direction,
                                         Mode mode) {
        final Semiring<W> sr = relation.getSemiring();
        final Wiring wiring = Wiring.of(direction, mode, markers);

        Fst<W> fst = Optimize.optimize(relation);
        if (fst.getStart() == Fst.NO_STATE) {
            fst.setStart(fst.addState());
        }
        fst = MarkerBuilder.ignoreMarkers(fst, wiring.allLoops());

        final int start = fst.addState();
        final int end = fst.addState();
        fst.addArc(start, wiring.initialPair().ilabel(), wiring.initialPair().olabel(), fst.getStart());
        for (int s = 0; s < start; s++) {
            if (!fst.isFinal(s)) {
                continue;
            }
            fst.addArc(s, wiring.finalPair().ilabel(), wiring.finalPair().olabel(), fst.getFinal(s), end);
            fst.setFinal(s, sr.zero());
        }
        fst.setFinal(end);
        fst.setFinal(start);
        fst.setStart(start);

        final Fst<W> sigmaM = MarkerBuilder.addMarkersToSigma(sigma, wiring.initialLoops());
        fst = MarkerBuilder.prependSigmaStar(fst, sigmaM);
        fst = Optimize.optimize(FstOps.closure(fst, FstOps.ClosureType.STAR));
        fst.sortArcs(Arc.ilabelOrder());
        return fst;
    }
}
