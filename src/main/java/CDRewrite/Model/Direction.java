package CDRewrite.Model;

import java.util.Optional;

/**
 * Order in which rule applications are found in the input.
 */
public enum Direction {
    LEFT_TO_RIGHT("ltr"),
    RIGHT_TO_LEFT("rtl"),
    SIMULTANEOUS("sim");

    private final String shortName;

    Direction(String shortName) {
        this.shortName = shortName;
    }

    public String getShortName() {
        return shortName;
    }

    /**
     * @param name - ltr, rtl or sim
     */
    public static Optional<Direction> fromShortName(String name) {
        for (Direction direction : values()) {
            if (direction.shortName.equals(name)) {
                return Optional.of(direction);
            }
        }
        return Optional.empty();
    }
}
