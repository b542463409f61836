package CDRewrite.Model;

import java.util.List;

/**
 * (ilabel, olabel) of a marker arc; either side may be epsilon.
 */
public record MarkerPair(int ilabel, int olabel) {

    public static List<MarkerPair> of(int ilabel, int olabel) {
        return List.of(new MarkerPair(ilabel, olabel));
    }

    public static MarkerPair identity(int label) {
        return new MarkerPair(label, label);
    }
}
