package CDRewrite;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import CDRewrite.Fst.Compose;
import CDRewrite.Fst.Fst;
import CDRewrite.Fst.FstOps;
import CDRewrite.Fst.Optimize;
import CDRewrite.Fst.RmEpsilon;
import CDRewrite.Fst.Semiring;

/**
 * Applies a compiled rule to strings.
 */
public class Rewriter {

    private Rewriter() {}

    /**
     * Epsilon-free acceptor of the outputs of rule on input.
     * @throws RewriteException if the rule does not accept the input
     */
    public static <W> Fst<W> rewriteLattice(Fst<W> input, Fst<W> rule) {
        if (rule.hasError()) {
            throw new RewriteException("Rule carries the error bit");
        }
        final Fst<W> lattice = Compose.compose(input, rule);
        if (lattice.getStart() == Fst.NO_STATE) {
            throw new RewriteException("Composition failure");
        }
        return RmEpsilon.rmEpsilon(FstOps.project(lattice, FstOps.ProjectType.OUTPUT));
    }

    public static <W> Fst<W> rewriteLattice(String input, Fst<W> rule) {
        return rewriteLattice(StringCompiler.acceptor(input, rule.getSemiring()), rule);
    }

    /**
     * @return all distinct outputs, sorted
     */
    public static <W> List<String> rewrites(String input, Fst<W> rule) {
        final TreeSet<String> outputs = new TreeSet<>();
        for (Paths.Path<W> path : Paths.paths(Optimize.optimize(rewriteLattice(input, rule)))) {
            outputs.add(path.string());
        }
        return new ArrayList<>(outputs);
    }

    /**
     * @return an output with the best weight; ties go to the first in path order
     */
    public static <W> String topRewrite(String input, Fst<W> rule) {
        final Semiring<W> sr = rule.getSemiring();
        final Map<String, W> weights = outputWeights(input, rule);
        String best = null;
        for (Map.Entry<String, W> entry : weights.entrySet()) {
            if (best == null || sr.better(entry.getValue(), weights.get(best))) {
                best = entry.getKey();
            }
        }
        return best;
    }

    /**
     * @return the output with the best weight
     * @throws RewriteException if another output has the same weight
     */
    public static <W> String oneTopRewrite(String input, Fst<W> rule) {
        final Semiring<W> sr = rule.getSemiring();
        final Map<String, W> weights = outputWeights(input, rule);
        final String best = topRewrite(input, rule);
        for (Map.Entry<String, W> entry : weights.entrySet()) {
            if (!entry.getKey().equals(best) && sr.approxEqual(entry.getValue(), weights.get(best))) {
                throw new RewriteException("Multiple top rewrites found: '" + best + "' and '" + entry.getKey()
                    + "' (weight: " + sr.format(entry.getValue()) + ")");
            }
        }
        return best;
    }

    /**
     * Does rule map input to output?
     * @throws RewriteException if the rule does not accept the input
     */
    public static <W> boolean matches(String input, String output, Fst<W> rule) {
        final Fst<W> lattice = rewriteLattice(input, rule);
        final Fst<W> outputs = Compose.compose(lattice, StringCompiler.acceptor(output, rule.getSemiring()));
        return outputs.getStart() != Fst.NO_STATE;
    }

    private static <W> Map<String, W> outputWeights(String input, Fst<W> rule) {
        final Semiring<W> sr = rule.getSemiring();
        final Map<String, W> weights = new LinkedHashMap<>();
        for (Paths.Path<W> path : Paths.paths(rewriteLattice(input, rule))) {
            weights.merge(path.string(), path.weight(), sr::plus);
        }
        return weights;
    }
}
