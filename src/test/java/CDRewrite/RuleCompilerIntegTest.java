package CDRewrite;

import CDRewrite.Fst.Fst;
import CDRewrite.Fst.Semiring;
import CDRewrite.Model.CompileResult;
import CDRewrite.Model.Direction;
import CDRewrite.Model.Mode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

@Tag("IntegTest")
public class RuleCompilerIntegTest {
  private static final Semiring<Double> TROPICAL = Semiring.tropical();
  private static final Fst<Double> SIGMA = StringCompiler.sigmaStar(RandomRules.ALPHABET, TROPICAL);

  @Test
  void testRandomRules() {
    for (int randomSeed = 0; randomSeed < 60; randomSeed++) {
      Random r = new Random(randomSeed);
      Fst<Double> phi = StringCompiler.acceptor(RandomRules.randomString(r, 1, 2), TROPICAL);
      Fst<Double> psi = StringCompiler.acceptor(RandomRules.randomString(r, 0, 2), TROPICAL);
      Fst<Double> lambda = RandomRules.randomContext(r, TROPICAL);
      Fst<Double> rho = RandomRules.randomContext(r, TROPICAL);
      List<String> inputs = List.of(RandomRules.randomString(r, 0, 5), RandomRules.randomString(r, 3, 6));

      for (Direction direction : Direction.values()) {
        String debug = randomSeed + "; " + direction;
        Fst<Double> obligatory = compile(phi, psi, lambda, rho, direction, Mode.OBLIGATORY, debug);
        Fst<Double> optional = compile(phi, psi, lambda, rho, direction, Mode.OPTIONAL, debug);

        // compilation is deterministic
        Assertions.assertEquals(obligatory.toString(),
            compile(phi, psi, lambda, rho, direction, Mode.OBLIGATORY, debug).toString(), debug);
        // markers never survive into the compiled rule
        Assertions.assertTrue(obligatory.maxLabel() <= 'c', debug);
        Assertions.assertTrue(optional.maxLabel() <= 'c', debug);

        for (String input : inputs) {
          List<String> obligatoryOutputs = Rewriter.rewrites(input, obligatory);
          List<String> optionalOutputs = Rewriter.rewrites(input, optional);
          Assertions.assertFalse(obligatoryOutputs.isEmpty(), debug + "; " + input);
          Assertions.assertTrue(optionalOutputs.contains(input), debug + "; " + input);
          Assertions.assertTrue(optionalOutputs.containsAll(obligatoryOutputs), debug + "; " + input);
          for (String output : optionalOutputs) {
            Assertions.assertTrue(output.chars().allMatch(c -> RandomRules.ALPHABET.indexOf(c) >= 0),
                debug + "; " + input + " -> " + output);
          }
        }
      }
    }
  }

  private static Fst<Double> compile(Fst<Double> phi, Fst<Double> psi, Fst<Double> lambda, Fst<Double> rho,
                                     Direction direction, Mode mode, String debug) {
    CompileResult<Double> result = RuleCompiler.compile(phi, psi, lambda, rho, SIGMA, direction, mode);
    Assertions.assertTrue(result.isSuccess(), debug);
    return result.orElseThrow();
  }
}
