package CDRewrite.Model;

/**
 * The labels written &gt;, &lt;1 and &lt;2 by Mohri and Sproat. For left-to-right obligatory rules, lbrace1 marks the
 * start of an occurrence of phi to be rewritten, lbrace2 the start of one that is left alone, and rbrace the end of
 * occurrences of phi.
 */
public record Markers(int rbrace, int lbrace1, int lbrace2) {

    public boolean contains(int label) {
        return label == rbrace || label == lbrace1 || label == lbrace2;
    }
}
