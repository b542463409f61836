package CDRewrite.Model;

import java.util.List;

/**
 * The chain of transducers whose left-to-right composition implements a rule in a given direction and mode.
 * Stage names follow Mohri and Sproat: r and l are the context markers, f marks occurrences of phi, l1/l2 and
 * r1/r2 check the left and right context of the obligatory markers.
 */
public record CompilePlan(Direction direction, Mode mode, List<Stage> stages) {

    public enum Stage { R, L, F, REPLACE, L1, L2, R1, R2 }

    public static CompilePlan of(Direction direction, Mode mode) {
        final List<Stage> stages = switch (direction) {
            case LEFT_TO_RIGHT -> switch (mode) {
                case OBLIGATORY -> List.of(Stage.R, Stage.F, Stage.REPLACE, Stage.L1, Stage.L2);
                case OPTIONAL -> List.of(Stage.R, Stage.REPLACE, Stage.L);
            };
            case RIGHT_TO_LEFT -> switch (mode) {
                case OBLIGATORY -> List.of(Stage.L, Stage.F, Stage.REPLACE, Stage.R1, Stage.R2);
                case OPTIONAL -> List.of(Stage.L, Stage.REPLACE, Stage.R);
            };
            case SIMULTANEOUS -> switch (mode) {
                case OBLIGATORY -> List.of(Stage.R, Stage.F, Stage.L1, Stage.L2, Stage.REPLACE);
                case OPTIONAL -> List.of(Stage.R, Stage.L, Stage.REPLACE);
            };
        };
        return new CompilePlan(direction, mode, stages);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Stage stage : stages) {
            if (sb.length() > 0) {
                sb.append(" o ");
            }
            sb.append(stage.name().toLowerCase());
        }
        return direction + "/" + mode + ": " + sb;
    }
}
