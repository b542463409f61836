package CDRewrite;

import CDRewrite.Fst.Fst;
import CDRewrite.Fst.FstOps;
import CDRewrite.Fst.Semiring;
import CDRewrite.Model.CompileError;
import CDRewrite.Model.CompileResult;
import CDRewrite.Model.Direction;
import CDRewrite.Model.Mode;
import CDRewrite.Model.RuleSpec;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

public class RuleCompilerTest {
  private static final Semiring<Double> TROPICAL = Semiring.tropical();
  private static final int BOS = 1000;
  private static final int EOS = 1001;

  private static final Fst<Double> SIGMA = StringCompiler.sigmaStar("abc", TROPICAL);
  private static final Fst<Double> EMPTY = StringCompiler.acceptor("", TROPICAL);

  @Test
  void testIdentityRule() {
    Fst<Double> a = acceptor("a");
    Fst<Double> rule = compile(a, a, EMPTY, EMPTY, Direction.LEFT_TO_RIGHT, Mode.OBLIGATORY);
    for (String input : List.of("", "a", "abc", "cba", "aaab")) {
      Assertions.assertEquals(List.of(input), Rewriter.rewrites(input, rule));
    }
    Assertions.assertTrue(rule.maxLabel() <= 'c'); // no markers left

    for (Direction direction : Direction.values()) {
      for (Mode mode : Mode.values()) {
        Fst<Double> withContexts = compile(a, a, SIGMA, SIGMA, direction, mode);
        for (String input : List.of("", "a", "abba", "cacb")) {
          Assertions.assertEquals(List.of(input), Rewriter.rewrites(input, withContexts), direction + "/" + mode);
        }
      }
    }
  }

  @Test
  void testDirections() {
    Fst<Double> ltr = compile(acceptor("aa"), acceptor("b"), EMPTY, EMPTY, Direction.LEFT_TO_RIGHT,
        Mode.OBLIGATORY);
    Fst<Double> rtl = compile(acceptor("aa"), acceptor("b"), EMPTY, EMPTY, Direction.RIGHT_TO_LEFT,
        Mode.OBLIGATORY);
    Assertions.assertEquals(List.of("ba"), Rewriter.rewrites("aaa", ltr));
    Assertions.assertEquals(List.of("ab"), Rewriter.rewrites("aaa", rtl));
    Assertions.assertEquals(List.of("bb"), Rewriter.rewrites("aaaa", ltr));
    Assertions.assertEquals(List.of("cbc"), Rewriter.rewrites("caac", rtl));
  }

  @Test
  void testOptionalIncludesObligatory() {
    Fst<Double> obligatory = compile(acceptor("a"), acceptor("b"), EMPTY, EMPTY, Direction.LEFT_TO_RIGHT,
        Mode.OBLIGATORY);
    Fst<Double> optional = compile(acceptor("a"), acceptor("b"), EMPTY, EMPTY, Direction.LEFT_TO_RIGHT,
        Mode.OPTIONAL);
    Assertions.assertEquals(List.of("bb"), Rewriter.rewrites("aa", obligatory));
    Assertions.assertEquals(List.of("aa", "ab", "ba", "bb"), Rewriter.rewrites("aa", optional));
    Assertions.assertEquals(List.of("c"), Rewriter.rewrites("c", optional));

    for (Direction direction : Direction.values()) {
      Fst<Double> opt = compile(acceptor("a"), acceptor("b"), acceptor("c"), EMPTY, direction, Mode.OPTIONAL);
      Fst<Double> obl = compile(acceptor("a"), acceptor("b"), acceptor("c"), EMPTY, direction, Mode.OBLIGATORY);
      List<String> optionalOutputs = Rewriter.rewrites("cacab", opt);
      Assertions.assertTrue(optionalOutputs.contains("cacab"), direction.toString());
      Assertions.assertTrue(optionalOutputs.containsAll(Rewriter.rewrites("cacab", obl)), direction.toString());
    }
  }

  @Test
  void testLeftContext() {
    for (Direction direction : Direction.values()) {
      Fst<Double> rule = compile(acceptor("a"), acceptor("b"), acceptor("c"), EMPTY, direction, Mode.OBLIGATORY);
      Assertions.assertEquals(List.of("cbcba"), Rewriter.rewrites("cacaa", rule), direction.toString());
      Assertions.assertEquals(List.of("bbb"), Rewriter.rewrites("bbb", rule), direction.toString());
    }
  }

  @Test
  void testRightContext() {
    for (Direction direction : Direction.values()) {
      Fst<Double> rule = compile(acceptor("a"), acceptor("b"), EMPTY, acceptor("c"), direction, Mode.OBLIGATORY);
      Assertions.assertEquals(List.of("abcbc"), Rewriter.rewrites("aacac", rule), direction.toString());
    }
  }

  @Test
  void testBothContexts() {
    Fst<Double> rule = compile(acceptor("a"), acceptor("b"), acceptor("c"), acceptor("c"), Direction.LEFT_TO_RIGHT,
        Mode.OBLIGATORY);
    Assertions.assertEquals(List.of("cbcbc"), Rewriter.rewrites("cacac", rule));
    Assertions.assertEquals(List.of("cbcaa"), Rewriter.rewrites("cacaa", rule));
  }

  @Test
  void testSimultaneousVersusSequential() {
    // left context seen on the output for left-to-right, on the input for simultaneous
    Fst<Double> ltr = compile(acceptor("a"), acceptor("b"), acceptor("a"), EMPTY, Direction.LEFT_TO_RIGHT,
        Mode.OBLIGATORY);
    Fst<Double> sim = compile(acceptor("a"), acceptor("b"), acceptor("a"), EMPTY, Direction.SIMULTANEOUS,
        Mode.OBLIGATORY);
    Assertions.assertEquals(List.of("aba"), Rewriter.rewrites("aaa", ltr));
    Assertions.assertEquals(List.of("abb"), Rewriter.rewrites("aaa", sim));

    // right context seen on the output for right-to-left
    Fst<Double> rtl = compile(acceptor("a"), acceptor("b"), EMPTY, acceptor("a"), Direction.RIGHT_TO_LEFT,
        Mode.OBLIGATORY);
    sim = compile(acceptor("a"), acceptor("b"), EMPTY, acceptor("a"), Direction.SIMULTANEOUS, Mode.OBLIGATORY);
    Assertions.assertEquals(List.of("aba"), Rewriter.rewrites("aaa", rtl));
    Assertions.assertEquals(List.of("bba"), Rewriter.rewrites("aaa", sim));
  }

  @Test
  void testNonIdempotentSemirings() {
    for (Semiring<Double> sr : List.of(Semiring.log(), Semiring.real())) {
      Fst<Double> sigma = StringCompiler.sigmaStar("ab", sr);
      Fst<Double> empty = StringCompiler.acceptor("", sr);
      CompileResult<Double> result = RuleCompiler.compile(StringCompiler.acceptor("a", sr),
          StringCompiler.acceptor("b", sr), empty, empty, sigma, Direction.LEFT_TO_RIGHT, Mode.OBLIGATORY);
      Assertions.assertTrue(result.isSuccess(), sr.getName());
      Fst<Double> rule = result.orElseThrow();
      Assertions.assertEquals(List.of("bbb"), Rewriter.rewrites("aba", rule), sr.getName());

      // an unweighted rule rewrites with weight one
      List<Paths.Path<Double>> paths = Paths.paths(Rewriter.rewriteLattice("aba", rule));
      Assertions.assertEquals(1, paths.size(), sr.getName());
      Assertions.assertEquals(sr.one(), paths.get(0).weight(), Semiring.DELTA, sr.getName());
    }
  }

  @Test
  void testWeightedReplacement() {
    Fst<Double> psi = FstOps.union(StringCompiler.acceptor("b", 1.0, TROPICAL),
        StringCompiler.acceptor("c", 2.0, TROPICAL));
    Fst<Double> optional = compile(acceptor("a"), psi, EMPTY, EMPTY, Direction.LEFT_TO_RIGHT, Mode.OPTIONAL);
    Assertions.assertEquals(List.of("a", "b", "c"), Rewriter.rewrites("a", optional));
    Assertions.assertEquals("a", Rewriter.topRewrite("a", optional));

    Fst<Double> obligatory = compile(acceptor("a"), psi, EMPTY, EMPTY, Direction.LEFT_TO_RIGHT, Mode.OBLIGATORY);
    Assertions.assertEquals(List.of("b", "c"), Rewriter.rewrites("a", obligatory));
    Assertions.assertEquals("b", Rewriter.oneTopRewrite("a", obligatory));
    Assertions.assertEquals("bb", Rewriter.topRewrite("aa", obligatory));

    Fst<Double> lattice = Rewriter.rewriteLattice("a", obligatory);
    double best = Double.POSITIVE_INFINITY;
    for (Paths.Path<Double> path : Paths.paths(lattice)) {
      best = Math.min(best, path.weight());
    }
    Assertions.assertEquals(1.0, best, Semiring.DELTA);
  }

  @Test
  void testInitialBoundaryMarker() {
    Fst<Double> rule = compileWithBoundaries(acceptor("a"), acceptor("b"), StringCompiler.acceptor(TROPICAL, BOS),
        EMPTY, Mode.OBLIGATORY);
    Assertions.assertEquals(List.of("ba"), Rewriter.rewrites("aa", rule));
    Assertions.assertEquals(List.of("bba"), Rewriter.rewrites("aba", rule));
    Assertions.assertEquals(List.of("cab"), Rewriter.rewrites("cab", rule));
    Assertions.assertTrue(rule.maxLabel() <= 'c');
  }

  @Test
  void testFinalBoundaryMarker() {
    Fst<Double> rule = compileWithBoundaries(acceptor("a"), acceptor("b"), EMPTY,
        StringCompiler.acceptor(TROPICAL, EOS), Mode.OBLIGATORY);
    Assertions.assertEquals(List.of("ab"), Rewriter.rewrites("aa", rule));
    Assertions.assertEquals(List.of("bab"), Rewriter.rewrites("bab", rule));
    Assertions.assertTrue(rule.maxLabel() <= 'c');
  }

  @Test
  void testBoundaryMarkersInPhi() {
    // a at the very start of the string
    Fst<Double> phi = StringCompiler.acceptor(TROPICAL, BOS, 'a');
    Fst<Double> psi = StringCompiler.acceptor(TROPICAL, BOS, 'c');
    Fst<Double> rule = compileWithBoundaries(phi, psi, EMPTY, EMPTY, Mode.OBLIGATORY);
    Assertions.assertEquals(List.of("cab"), Rewriter.rewrites("aab", rule));
  }

  @Test
  void testInsertionBetweenBoundaries() {
    Fst<Double> sigma = StringCompiler.sigmaStar("abx", TROPICAL);
    Fst<Double> lambda = FstOps.union(StringCompiler.acceptor(TROPICAL, BOS), EMPTY);
    Fst<Double> rho = FstOps.union(StringCompiler.acceptor(TROPICAL, EOS), EMPTY);
    CompileResult<Double> result = RuleCompiler.compile(EMPTY, acceptor("x"), lambda, rho, sigma,
        Direction.LEFT_TO_RIGHT, Mode.OPTIONAL, false, OptionalInt.of(BOS), OptionalInt.of(EOS));
    Assertions.assertTrue(result.isSuccess());
    Fst<Double> rule = result.orElseThrow();

    List<String> outputs = Rewriter.rewrites("ab", rule);
    Assertions.assertEquals(List.of("ab", "abx", "axb", "axbx", "xab", "xabx", "xaxb", "xaxbx"), outputs);
    Assertions.assertTrue(rule.maxLabel() <= 'x');
  }

  @Test
  void testTauOverload() {
    Fst<Double> tau = StringCompiler.transducer("aa", "b", TROPICAL);
    for (Direction direction : Direction.values()) {
      for (Mode mode : Mode.values()) {
        Fst<Double> fromTau = RuleCompiler.compile(tau, EMPTY, acceptor("c"), SIGMA, direction, mode).orElseThrow();
        Fst<Double> fromPair = compile(acceptor("aa"), acceptor("b"), EMPTY, acceptor("c"), direction, mode);
        for (String input : List.of("aac", "aaac", "caaaac", "abc")) {
          Assertions.assertEquals(Rewriter.rewrites(input, fromPair), Rewriter.rewrites(input, fromTau),
              direction + " " + mode + " " + input);
        }
      }
    }
  }

  @Test
  void testRuleSpecCompile() {
    RuleSpec<Double> ruleSpec = new RuleSpec<>(acceptor("a"), acceptor("b"), EMPTY, EMPTY, false);
    Fst<Double> rule = ruleSpec.compile(SIGMA, Direction.SIMULTANEOUS, Mode.OBLIGATORY).orElseThrow();
    Assertions.assertEquals(List.of("bcb"), Rewriter.rewrites("acb", rule));
  }

  @Test
  void testRuleSpecUnchangedByAccessorMutation() {
    RuleSpec<Double> ruleSpec = new RuleSpec<>(acceptor("a"), acceptor("b"), EMPTY, EMPTY, false);
    Fst<Double> phi = ruleSpec.phi();
    phi.setFinal(phi.getStart(), 0.0);
    ruleSpec.lambda().addArc(0, 'c', 'c', 0);

    Assertions.assertFalse(ruleSpec.phi().isFinal(ruleSpec.phi().getStart()));
    Assertions.assertEquals(0, ruleSpec.lambda().numArcs());
    Fst<Double> rule = ruleSpec.compile(SIGMA, Direction.LEFT_TO_RIGHT, Mode.OBLIGATORY).orElseThrow();
    Assertions.assertEquals(List.of("bcb"), Rewriter.rewrites("acb", rule));
  }

  @Test
  void testDeterministicOutput() {
    Fst<Double> first = compile(acceptor("a"), acceptor("b"), acceptor("c"), EMPTY, Direction.LEFT_TO_RIGHT,
        Mode.OBLIGATORY);
    Fst<Double> second = compile(acceptor("a"), acceptor("b"), acceptor("c"), EMPTY, Direction.LEFT_TO_RIGHT,
        Mode.OBLIGATORY);
    Assertions.assertEquals(first.numStates(), second.numStates());
    Assertions.assertEquals(first.numArcs(), second.numArcs());
    Assertions.assertEquals(first.toString(), second.toString());
  }

  @Test
  void testInputsUntouched() {
    Fst<Double> phi = acceptor("a");
    Fst<Double> lambda = acceptor("c");
    Fst<Double> sigma = StringCompiler.sigmaStar("abc", TROPICAL);
    String before = phi.toString() + lambda + sigma;
    compile(phi, acceptor("b"), lambda, EMPTY, sigma, Direction.RIGHT_TO_LEFT, Mode.OBLIGATORY);
    Assertions.assertEquals(before, phi.toString() + lambda + sigma);
  }

  @Test
  void testPreconditions() {
    Fst<Double> a = acceptor("a");
    Fst<Double> weighted = StringCompiler.acceptor("a", 1.0, TROPICAL);
    Fst<Double> transducer = StringCompiler.transducer("a", "b", TROPICAL);

    assertViolation("phi", RuleCompiler.compile(weighted, a, EMPTY, EMPTY, SIGMA, Direction.LEFT_TO_RIGHT,
        Mode.OBLIGATORY));
    assertViolation("phi", RuleCompiler.compile(transducer, a, EMPTY, EMPTY, SIGMA, Direction.LEFT_TO_RIGHT,
        Mode.OBLIGATORY));
    assertViolation("lambda", RuleCompiler.compile(a, a, transducer, EMPTY, SIGMA, Direction.LEFT_TO_RIGHT,
        Mode.OBLIGATORY));
    assertViolation("rho", RuleCompiler.compile(a, a, EMPTY, weighted, SIGMA, Direction.RIGHT_TO_LEFT,
        Mode.OPTIONAL));
    assertViolation("psi", RuleCompiler.compile(a, transducer, EMPTY, EMPTY, SIGMA, Direction.SIMULTANEOUS,
        Mode.OBLIGATORY));
    assertViolation("sigma", RuleCompiler.compile(a, a, EMPTY, EMPTY, weightedSigma(), Direction.LEFT_TO_RIGHT,
        Mode.OBLIGATORY));

    // phi is checked first
    assertViolation("phi", RuleCompiler.compile(weighted, transducer, transducer, transducer, weightedSigma(),
        Direction.LEFT_TO_RIGHT, Mode.OBLIGATORY));

    // a weighted psi is fine, a transducer psi needs phiXpsi
    Assertions.assertTrue(RuleCompiler.compile(a, weighted, EMPTY, EMPTY, SIGMA, Direction.LEFT_TO_RIGHT,
        Mode.OBLIGATORY).isSuccess());
    Assertions.assertTrue(RuleCompiler.compile(a, transducer, EMPTY, EMPTY, SIGMA, Direction.LEFT_TO_RIGHT,
        Mode.OBLIGATORY, true, OptionalInt.empty(), OptionalInt.empty()).isSuccess());
  }

  @Test
  void testErrorBitPropagates() {
    CompileResult<Double> result = RuleCompiler.compile(Fst.errorFst(TROPICAL), acceptor("b"), EMPTY, EMPTY, SIGMA,
        Direction.LEFT_TO_RIGHT, Mode.OBLIGATORY);
    Assertions.assertFalse(result.isSuccess());
    CompileError error = ((CompileResult.Failure<Double>) result).error();
    Assertions.assertEquals(CompileError.Kind.PROPAGATED, error.kind());
    Assertions.assertEquals("phi", error.operand());

    result = RuleCompiler.compile(Fst.errorFst(TROPICAL), EMPTY, EMPTY, SIGMA, Direction.LEFT_TO_RIGHT,
        Mode.OBLIGATORY);
    Assertions.assertFalse(result.isSuccess());
  }

  private static void assertViolation(String operand, CompileResult<Double> result) {
    Assertions.assertFalse(result.isSuccess(), operand);
    CompileError error = ((CompileResult.Failure<Double>) result).error();
    Assertions.assertEquals(CompileError.Kind.CONTRACT_VIOLATION, error.kind());
    Assertions.assertEquals(operand, error.operand());
  }

  private static Fst<Double> weightedSigma() {
    Fst<Double> sigma = StringCompiler.sigmaStar("abc", TROPICAL);
    sigma.setFinal(sigma.getStart(), 0.5);
    return sigma;
  }

  private static Fst<Double> acceptor(String string) {
    return StringCompiler.acceptor(string, TROPICAL);
  }

  private static Fst<Double> compile(Fst<Double> phi, Fst<Double> psi, Fst<Double> lambda, Fst<Double> rho,
                                     Direction direction, Mode mode) {
    return compile(phi, psi, lambda, rho, SIGMA, direction, mode);
  }

  private static Fst<Double> compile(Fst<Double> phi, Fst<Double> psi, Fst<Double> lambda, Fst<Double> rho,
                                     Fst<Double> sigma, Direction direction, Mode mode) {
    CompileResult<Double> result = RuleCompiler.compile(phi, psi, lambda, rho, sigma, direction, mode);
    Assertions.assertTrue(result.isSuccess(), () -> result.toString());
    return result.orElseThrow();
  }

  private static Fst<Double> compileWithBoundaries(Fst<Double> phi, Fst<Double> psi, Fst<Double> lambda,
                                                   Fst<Double> rho, Mode mode) {
    return RuleCompiler.compile(phi, psi, lambda, rho, SIGMA, Direction.LEFT_TO_RIGHT, mode, false,
        OptionalInt.of(BOS), OptionalInt.of(EOS)).orElseThrow();
  }
}
