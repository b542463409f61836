package CDRewrite.Fst;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * AT&amp;T text format with numeric labels:
 * <pre>
 *   src dst ilabel olabel [weight]
 *   state [weight]
 * </pre>
 * The source state of the first arc line (or the first final line, if it comes first) is the start state. Omitted
 * weights are one.
 */
public class AttFormat {

    private AttFormat() {}

    public static <W> Fst<W> read(InputStream is, Semiring<W> semiring) throws IOException, FstFormatException {
        final Fst<W> fst = new Fst<>(semiring);
        final BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            final String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            final String[] fields = trimmed.split("\\s+");
            try {
                switch (fields.length) {
                    case 1, 2 -> {
                        final int state = ensureState(fst, Integer.parseInt(fields[0]));
                        final W weight = fields.length == 2 ? semiring.parse(fields[1]) : semiring.one();
                        fst.setFinal(state, weight);
                    }
                    case 4, 5 -> {
                        final int src = ensureState(fst, Integer.parseInt(fields[0]));
                        final int dst = ensureState(fst, Integer.parseInt(fields[1]));
                        final int ilabel = Integer.parseInt(fields[2]);
                        final int olabel = Integer.parseInt(fields[3]);
                        final W weight = fields.length == 5 ? semiring.parse(fields[4]) : semiring.one();
                        fst.addArc(src, ilabel, olabel, weight, dst);
                    }
                    default -> throw new FstFormatException(
                        "Line " + lineNumber + ": expected 1, 2, 4 or 5 fields but found " + fields.length);
                }
            } catch (IllegalArgumentException e) {
                // NumberFormatException and negative labels/states
                throw new FstFormatException("Line " + lineNumber + ": " + e.getMessage(), e);
            }
        }
        return fst;
    }

    public static <W> void write(OutputStream os, Fst<W> fst) {
        final Semiring<W> semiring = fst.getSemiring();
        final PrintWriter writer = new PrintWriter(new OutputStreamWriter(os, StandardCharsets.UTF_8));
        final int start = fst.getStart();
        if (start != Fst.NO_STATE) {
            writeState(writer, fst, semiring, start);
            for (int s = 0; s < fst.numStates(); s++) {
                if (s != start) {
                    writeState(writer, fst, semiring, s);
                }
            }
        }
        writer.flush();
    }

    public static <W> Fst<W> readFile(String filePath, Semiring<W> semiring) throws IOException, FstFormatException {
        try (InputStream is = new FileInputStream(filePath)) {
            return read(is, semiring);
        }
    }

    public static <W> void writeFile(String filePath, Fst<W> fst) throws IOException {
        try (OutputStream os = new FileOutputStream(filePath)) {
            write(os, fst);
        }
    }

    private static <W> void writeState(PrintWriter writer, Fst<W> fst, Semiring<W> semiring, int s) {
        for (Arc<W> arc : fst.getArcs(s)) {
            writer.print(s + "\t" + arc.nextState() + "\t" + arc.ilabel() + "\t" + arc.olabel());
            if (!semiring.isOne(arc.weight())) {
                writer.print("\t" + semiring.format(arc.weight()));
            }
            writer.println();
        }
        if (fst.isFinal(s)) {
            writer.print(s);
            if (!semiring.isOne(fst.getFinal(s))) {
                writer.print("\t" + semiring.format(fst.getFinal(s)));
            }
            writer.println();
        }
    }

    private static <W> int ensureState(Fst<W> fst, int state) {
        if (state < 0) {
            throw new IllegalArgumentException("Negative state: " + state);
        }
        while (fst.numStates() <= state) {
            fst.addState();
        }
        if (fst.getStart() == Fst.NO_STATE) {
            fst.setStart(state);
        }
        return state;
    }
}
