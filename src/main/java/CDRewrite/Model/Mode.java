package CDRewrite.Model;

import java.util.Optional;

/**
 * Whether every match in context must be rewritten.
 */
public enum Mode {
    OBLIGATORY("obl"),
    OPTIONAL("opt");

    private final String shortName;

    Mode(String shortName) {
        this.shortName = shortName;
    }

    public String getShortName() {
        return shortName;
    }

    /**
     * @param name - obl or opt
     */
    public static Optional<Mode> fromShortName(String name) {
        for (Mode mode : values()) {
            if (mode.shortName.equals(name)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
