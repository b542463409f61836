package CDRewrite;

import CDRewrite.Fst.Fst;
import CDRewrite.Model.Markers;

/**
 * Allocates the three marker labels of one compilation, strictly above every label of sigma.
 */
public class MarkerAllocator {

    private MarkerAllocator() {}

    /**
     * @param sigma - alphabet closure, with any active boundary markers already folded in
     * @return fresh markers; never epsilon, never a label of sigma
     */
    public static Markers allocate(Fst<?> sigma) {
        // an arc-less sigma has maxLabel() == NO_LABEL; markers must still stay clear of epsilon
        final int max = Math.max(sigma.maxLabel(), Fst.EPSILON);
        return new Markers(max + 1, max + 2, max + 3);
    }
}
