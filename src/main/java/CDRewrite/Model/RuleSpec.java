package CDRewrite.Model;

import java.util.OptionalInt;

import CDRewrite.Fst.Fst;
import CDRewrite.RuleCompiler;

/**
 * The rule phi -&gt; psi / lambda __ rho. If phiXpsi is set, psi is a transducer with input domain phi, otherwise an
 * acceptor. The automata are private copies taken at construction, and the accessors hand out further copies, so
 * a rule never changes once built.
 */
public record RuleSpec<W>(Fst<W> phi, Fst<W> psi, Fst<W> lambda, Fst<W> rho, boolean phiXpsi,
                          OptionalInt initialBoundaryMarker, OptionalInt finalBoundaryMarker) {

    public RuleSpec {
        phi = phi.copy();
        psi = psi.copy();
        lambda = lambda.copy();
        rho = rho.copy();
    }

    public RuleSpec(Fst<W> phi, Fst<W> psi, Fst<W> lambda, Fst<W> rho, boolean phiXpsi) {
        this(phi, psi, lambda, rho, phiXpsi, OptionalInt.empty(), OptionalInt.empty());
    }

    @Override
    public Fst<W> phi() {
        return phi.copy();
    }

    @Override
    public Fst<W> psi() {
        return psi.copy();
    }

    @Override
    public Fst<W> lambda() {
        return lambda.copy();
    }

    @Override
    public Fst<W> rho() {
        return rho.copy();
    }

    /**
     * Is the initial boundary marker referenced by phi or lambda?
     */
    public boolean usesInitialBoundaryMarker() {
        return initialBoundaryMarker.isPresent()
            && (lambda.hasLabel(initialBoundaryMarker.getAsInt()) || phi.hasLabel(initialBoundaryMarker.getAsInt()));
    }

    /**
     * Is the final boundary marker referenced by phi or rho?
     */
    public boolean usesFinalBoundaryMarker() {
        return finalBoundaryMarker.isPresent()
            && (rho.hasLabel(finalBoundaryMarker.getAsInt()) || phi.hasLabel(finalBoundaryMarker.getAsInt()));
    }

    public CompileResult<W> compile(Fst<W> sigma, Direction direction, Mode mode) {
        return RuleCompiler.compile(this, sigma, direction, mode);
    }
}
