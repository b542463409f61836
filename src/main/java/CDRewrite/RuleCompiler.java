package CDRewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import CDRewrite.Fst.Arc;
import CDRewrite.Fst.Compose;
import CDRewrite.Fst.Fst;
import CDRewrite.Fst.FstOps;
import CDRewrite.Fst.Optimize;
import CDRewrite.Fst.Weights;
import CDRewrite.Model.CompileError;
import CDRewrite.Model.CompilePlan;
import CDRewrite.Model.CompileResult;
import CDRewrite.Model.Direction;
import CDRewrite.Model.MarkerPair;
import CDRewrite.Model.MarkerType;
import CDRewrite.Model.Markers;
import CDRewrite.Model.Mode;
import CDRewrite.Model.RuleSpec;

/**
 * Compiles the context-dependent rewrite rule phi -&gt; psi / lambda __ rho into a single transducer over sigma^*,
 * following the marker construction of Mohri and Sproat (1996).
 * <p>
 * sigma must be an unweighted acceptor for the closure of the alphabet, and should represent a bifix code; the
 * latter is not checked. Contract violations and engine errors are reported through {@link CompileResult}.
 */
public class RuleCompiler {
    public static boolean DEBUG = false;

    private RuleCompiler() {}

    public static <W> CompileResult<W> compile(Fst<W> phi, Fst<W> psi, Fst<W> lambda, Fst<W> rho, Fst<W> sigma,
                                               Direction direction, Mode mode) {
        return compile(phi, psi, lambda, rho, sigma, direction, mode, false, OptionalInt.empty(),
            OptionalInt.empty());
    }

    /**
     * @param phi - unweighted acceptor, strings to rewrite
     * @param psi - replacement acceptor, or the phi x psi transducer if phiXpsi is set; may be weighted
     * @param lambda - unweighted acceptor, left context
     * @param rho - unweighted acceptor, right context
     * @param sigma - unweighted acceptor, alphabet closure
     * @param direction - left-to-right, right-to-left or simultaneous
     * @param mode - obligatory or optional
     * @param phiXpsi - is psi the phi x psi transducer?
     * @param initialBoundaryMarker - label matching the beginning of the string in lambda or phi
     * @param finalBoundaryMarker - label matching the end of the string in rho or phi
     */
    public static <W> CompileResult<W> compile(Fst<W> phi, Fst<W> psi, Fst<W> lambda, Fst<W> rho, Fst<W> sigma,
                                               Direction direction, Mode mode, boolean phiXpsi,
                                               OptionalInt initialBoundaryMarker,
                                               OptionalInt finalBoundaryMarker) {
        return compile(new RuleSpec<>(phi, psi, lambda, rho, phiXpsi, initialBoundaryMarker, finalBoundaryMarker),
            sigma, direction, mode);
    }

    public static <W> CompileResult<W> compile(Fst<W> tau, Fst<W> lambda, Fst<W> rho, Fst<W> sigma,
                                               Direction direction, Mode mode) {
        return compile(tau, lambda, rho, sigma, direction, mode, OptionalInt.empty(), OptionalInt.empty());
    }

    /**
     * Compiles tau / lambda __ rho, where tau is the phi x psi transducer. phi is the unweighted input projection
     * of tau.
     */
    public static <W> CompileResult<W> compile(Fst<W> tau, Fst<W> lambda, Fst<W> rho, Fst<W> sigma,
                                               Direction direction, Mode mode,
                                               OptionalInt initialBoundaryMarker,
                                               OptionalInt finalBoundaryMarker) {
        if (tau.hasError()) {
            return CompileResult.failure(CompileError.propagated("tau", "Transducer carries the error bit"));
        }
        final Fst<W> phi = Optimize.optimize(Weights.removeWeights(FstOps.project(tau, FstOps.ProjectType.INPUT)));
        return compile(phi, tau, lambda, rho, sigma, direction, mode, true, initialBoundaryMarker,
            finalBoundaryMarker);
    }

    public static <W> CompileResult<W> compile(RuleSpec<W> rule, Fst<W> sigma, Direction direction, Mode mode) {
        final CompileError violation = checkPreconditions(rule, sigma);
        if (violation != null) {
            if (DEBUG) {
                System.out.println("DEBUG: " + violation);
            }
            return CompileResult.failure(violation);
        }
        final boolean useInitial = rule.usesInitialBoundaryMarker();
        final boolean useFinal = rule.usesFinalBoundaryMarker();

        Fst<W> augmentedSigma = sigma;
        if (useInitial) {
            augmentedSigma = MarkerBuilder.addMarkersToSigma(augmentedSigma,
                List.of(MarkerPair.identity(rule.initialBoundaryMarker().getAsInt())));
        }
        if (useFinal) {
            augmentedSigma = MarkerBuilder.addMarkersToSigma(augmentedSigma,
                List.of(MarkerPair.identity(rule.finalBoundaryMarker().getAsInt())));
        }
        final Markers markers = MarkerAllocator.allocate(augmentedSigma);
        final CompilePlan plan = CompilePlan.of(direction, mode);
        if (DEBUG) {
            System.out.println("DEBUG: markers " + markers + ", plan " + plan);
        }

        final Stages<W> stages = new Stages<>(rule, augmentedSigma, markers, direction, mode);
        Fst<W> result = null;
        for (CompilePlan.Stage stage : plan.stages()) {
            final Fst<W> next = stages.build(stage);
            if (next.hasError()) {
                return CompileResult.failure(CompileError.propagated(stage.name().toLowerCase(),
                    "Stage " + stage + " carries the error bit"));
            }
            result = result == null ? next : Compose.compose(result, next);
            if (DEBUG) {
                System.out.println("DEBUG: after " + stage + ": " + result.numStates() + " states, "
                    + result.numArcs() + " arcs");
            }
        }

        if (useInitial || useFinal) {
            final BoundaryHandler boundaries = new BoundaryHandler(rule.initialBoundaryMarker().orElse(Fst.NO_LABEL),
                rule.finalBoundaryMarker().orElse(Fst.NO_LABEL), useInitial, useFinal);
            // built over the caller's sigma, without the boundary markers
            result.sortArcs(Arc.ilabelOrder());
            result = Compose.compose(Compose.compose(boundaries.inserter(sigma), result), boundaries.deleter(sigma));
        }
        result = Optimize.optimize(result);
        if (result.hasError()) {
            return CompileResult.failure(CompileError.propagated("result", "Composition carries the error bit"));
        }
        result.sortArcs(Arc.ilabelOrder());
        return CompileResult.success(result);
    }

    private static <W> CompileError checkPreconditions(RuleSpec<W> rule, Fst<W> sigma) {
        CompileError error = checkUnweightedAcceptor(rule.phi(), "phi");
        if (error == null) {
            error = checkUnweightedAcceptor(rule.lambda(), "lambda");
        }
        if (error == null) {
            error = checkUnweightedAcceptor(rule.rho(), "rho");
        }
        if (error == null && !rule.phiXpsi() && !rule.psi().isAcceptor()) {
            error = CompileError.contractViolation("psi", "psi must be an acceptor or phiXpsi must be set");
        }
        if (error == null && rule.psi().hasError()) {
            error = CompileError.propagated("psi", "psi carries the error bit");
        }
        if (error == null) {
            error = checkUnweightedAcceptor(sigma, "sigma");
        }
        return error;
    }

    private static CompileError checkUnweightedAcceptor(Fst<?> fst, String operand) {
        if (fst.hasError()) {
            return CompileError.propagated(operand, operand + " carries the error bit");
        }
        if (!fst.isAcceptor()) {
            return CompileError.contractViolation(operand, operand + " must be an acceptor");
        }
        if (!fst.isUnweighted()) {
            return CompileError.contractViolation(operand, operand + " must be unweighted");
        }
        return null;
    }

    /**
     * Builds the transducers named by a {@link CompilePlan}.
     */
    private static final class Stages<W> {
        private final RuleSpec<W> rule;
        private final Fst<W> sigma;
        private final Markers markers;
        private final Direction direction;
        private final Mode mode;

        Stages(RuleSpec<W> rule, Fst<W> sigma, Markers markers, Direction direction, Mode mode) {
            this.rule = rule;
            this.sigma = sigma;
            this.markers = markers;
            this.direction = direction;
            this.mode = mode;
        }

        Fst<W> build(CompilePlan.Stage stage) {
            return switch (stage) {
                case REPLACE -> ReplaceBuilder.makeReplace(
                    rule.phiXpsi() ? rule.psi() : FstOps.cross(rule.phi(), rule.psi()), sigma, markers, direction,
                    mode);
                case R -> rightContextFilter();
                case L -> leftContextFilter();
                case F -> matchFilter();
                case L1 -> direction == Direction.SIMULTANEOUS
                    ? ignoring(filter(rule.lambda(), MarkerType.CHECK, markers.lbrace1(), markers.lbrace1(), false),
                        markers.lbrace2(), markers.rbrace())
                    : ignoring(filter(rule.lambda(), MarkerType.CHECK, markers.lbrace1(), Fst.EPSILON, false),
                        markers.lbrace2());
                case L2 -> direction == Direction.SIMULTANEOUS
                    ? ignoring(filter(rule.lambda(), MarkerType.CHECK_COMPLEMENT, markers.lbrace2(), markers.lbrace2(),
                        false), markers.lbrace1(), markers.rbrace())
                    : filter(rule.lambda(), MarkerType.CHECK_COMPLEMENT, markers.lbrace2(), Fst.EPSILON, false);
                case R1 -> ignoring(filter(rule.rho(), MarkerType.CHECK, markers.lbrace1(), Fst.EPSILON, true),
                    markers.lbrace2());
                case R2 -> filter(rule.rho(), MarkerType.CHECK_COMPLEMENT, markers.lbrace2(), Fst.EPSILON, true);
            };
        }

        private Fst<W> rightContextFilter() {
            if (direction == Direction.RIGHT_TO_LEFT) {
                return filter(rule.rho(), MarkerType.CHECK, markers.lbrace1(), Fst.EPSILON, true);
            }
            return filter(rule.rho(), MarkerType.MARK, Fst.EPSILON, markers.rbrace(), true);
        }

        private Fst<W> leftContextFilter() {
            return switch (direction) {
                case LEFT_TO_RIGHT -> filter(rule.lambda(), MarkerType.CHECK, markers.lbrace1(), Fst.EPSILON, false);
                case RIGHT_TO_LEFT -> filter(rule.lambda(), MarkerType.MARK, Fst.EPSILON, markers.rbrace(), false);
                case SIMULTANEOUS -> ignoring(
                    filter(rule.lambda(), MarkerType.CHECK, Fst.EPSILON, markers.lbrace1(), false), markers.rbrace());
            };
        }

        private Fst<W> filter(Fst<W> beta, MarkerType type, int ilabel, int olabel, boolean reverse) {
            return FilterBuilder.makeFilter(beta, sigma, type, MarkerPair.of(ilabel, olabel), reverse);
        }

        /**
         * Lets the given markers pass through every state of the filter.
         */
        private Fst<W> ignoring(Fst<W> filter, int... labels) {
            final List<MarkerPair> loops = new ArrayList<>(labels.length);
            for (int label : labels) {
                loops.add(MarkerPair.identity(label));
            }
            final Fst<W> fst = MarkerBuilder.ignoreMarkers(filter, loops);
            fst.sortArcs(Arc.ilabelOrder());
            return fst;
        }

        /**
         * Marks the start of each occurrence of phi, with the rbrace markers inserted by r (or l) passed through.
         */
        private Fst<W> matchFilter() {
            final List<MarkerPair> rbraceLoop = List.of(MarkerPair.identity(markers.rbrace()));
            final Fst<W> sigmaRbrace = MarkerBuilder.addMarkersToSigma(sigma, rbraceLoop);
            Fst<W> phi = MarkerBuilder.ignoreMarkers(rule.phi(), rbraceLoop);
            final boolean reverse = direction != Direction.RIGHT_TO_LEFT;
            phi = reverse ? MarkerBuilder.appendMarkers(phi, rbraceLoop) : MarkerBuilder.prependMarkers(phi, rbraceLoop);
            return FilterBuilder.makeFilter(phi, sigmaRbrace, MarkerType.MARK,
                List.of(new MarkerPair(Fst.EPSILON, markers.lbrace1()), new MarkerPair(Fst.EPSILON, markers.lbrace2())),
                reverse);
        }
    }
}
