package CDRewrite.Fst;

import CDRewrite.Paths;
import CDRewrite.StringCompiler;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static CDRewrite.FstAssertions.assertStrings;

public class RmEpsilonTest {
  private static final Semiring<Double> TROPICAL = Semiring.tropical();

  @Test
  void testUnion() {
    Fst<Double> union = StringCompiler.union(TROPICAL, "ab", "c", "");
    Assertions.assertFalse(union.isEpsilonFree());
    Fst<Double> removed = RmEpsilon.rmEpsilon(union);
    Assertions.assertTrue(removed.isEpsilonFree());
    assertStrings(removed, "", "ab", "c");
  }

  @Test
  void testWeightedEpsilonCycle() {
    Fst<Double> fst = new Fst<>(TROPICAL);
    for (int i = 0; i < 3; i++) {
      fst.addState();
    }
    fst.setStart(0);
    fst.addArc(0, Fst.EPSILON, Fst.EPSILON, 1.0, 1);
    fst.addArc(1, Fst.EPSILON, Fst.EPSILON, 1.0, 0);
    fst.addArc(1, 'a', 'a', 0.5, 2);
    fst.setFinal(2, 2.0);

    Fst<Double> removed = RmEpsilon.rmEpsilon(fst);
    Assertions.assertTrue(removed.isEpsilonFree());
    List<Paths.Path<Double>> paths = Paths.paths(removed);
    Assertions.assertEquals(1, paths.size());
    Assertions.assertEquals("a", paths.get(0).string());
    Assertions.assertEquals(3.5, paths.get(0).weight());
  }

  @Test
  void testKeepsOneSidedEpsilons() {
    Fst<Double> t = StringCompiler.transducer("ab", "x", TROPICAL);
    Fst<Double> removed = RmEpsilon.rmEpsilon(t);
    Assertions.assertEquals(t.numArcs(), removed.numArcs());
    assertStrings(removed, "x");
  }

  @Test
  void testRealSemiringSumsPaths() {
    Semiring<Double> real = Semiring.real();
    // two epsilon paths of probability 0.25 and 0.5 into the same final state
    Fst<Double> fst = new Fst<>(real);
    for (int i = 0; i < 3; i++) {
      fst.addState();
    }
    fst.setStart(0);
    fst.addArc(0, Fst.EPSILON, Fst.EPSILON, 0.25, 2);
    fst.addArc(0, Fst.EPSILON, Fst.EPSILON, 0.5, 1);
    fst.addArc(1, Fst.EPSILON, Fst.EPSILON, 1.0, 2);
    fst.setFinal(2);

    Fst<Double> removed = RmEpsilon.rmEpsilon(fst);
    Assertions.assertEquals(0.75, removed.getFinal(removed.getStart()), Semiring.DELTA);
  }

  @Test
  void testDivergentDistanceSetsError() {
    Semiring<Double> real = Semiring.real();
    Fst<Double> fst = new Fst<>(real);
    fst.setStart(fst.addState());
    fst.setFinal(0);
    fst.addArc(0, Fst.EPSILON, Fst.EPSILON, 1.0, 0);

    Assertions.assertTrue(RmEpsilon.rmEpsilon(fst).hasError());
    Assertions.assertTrue(Optimize.optimize(fst).hasError());

    // the same loop converges in the tropical semiring
    Fst<Double> tropical = new Fst<>(TROPICAL);
    tropical.setStart(tropical.addState());
    tropical.setFinal(0);
    tropical.addArc(0, Fst.EPSILON, Fst.EPSILON, 0.0, 0);
    Fst<Double> removed = RmEpsilon.rmEpsilon(tropical);
    Assertions.assertFalse(removed.hasError());
    Assertions.assertEquals(0.0, removed.getFinal(removed.getStart()));
  }
}
