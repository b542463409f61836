package CDRewrite.Fst;

/**
 * Weight algebra of an {@link Fst}: plus, times and their identities.
 * @param <W> - weight type
 */
public interface Semiring<W> {
    /** Tolerance used when comparing real-valued weights for convergence. */
    double DELTA = 1.0 / 1024;

    W zero();

    W one();

    W plus(W a, W b);

    W times(W a, W b);

    /**
     * Whether w + w = w for every weight. Only idempotent semirings are determinized by {@link Optimize}.
     */
    boolean isIdempotent();

    /**
     * Path order used to pick the best rewrite; "better" means closer to one.
     */
    boolean better(W a, W b);

    String getName();

    W parse(String weight);

    default String format(W weight) {
        return String.valueOf(weight);
    }

    default boolean isZero(W weight) {
        return zero().equals(weight);
    }

    default boolean isOne(W weight) {
        return one().equals(weight);
    }

    default boolean approxEqual(W a, W b) {
        return a.equals(b);
    }

    /**
     * tropical(): min, +, +INF, 0
     */
    static Semiring<Double> tropical() {
        return new RealValued() {
            @Override
            public Double zero() {
                return Double.POSITIVE_INFINITY;
            }

            @Override
            public Double one() {
                return 0.0;
            }

            @Override
            public Double plus(Double a, Double b) {
                return Math.min(a, b);
            }

            @Override
            public Double times(Double a, Double b) {
                return normalize(a + b);
            }

            @Override
            public boolean isIdempotent() {
                return true;
            }

            @Override
            public boolean better(Double a, Double b) {
                return a < b;
            }

            @Override
            public String getName() {
                return "tropical";
            }
        };
    }

    /**
     * log(): -log(e^-a + e^-b), +, +INF, 0
     */
    static Semiring<Double> log() {
        return new RealValued() {
            @Override
            public Double zero() {
                return Double.POSITIVE_INFINITY;
            }

            @Override
            public Double one() {
                return 0.0;
            }

            @Override
            public Double plus(Double a, Double b) {
                if (a == Double.POSITIVE_INFINITY) {
                    return b;
                }
                if (b == Double.POSITIVE_INFINITY) {
                    return a;
                }
                double min = Math.min(a, b);
                return normalize(min - Math.log1p(Math.exp(-Math.abs(a - b))));
            }

            @Override
            public Double times(Double a, Double b) {
                return normalize(a + b);
            }

            @Override
            public boolean isIdempotent() {
                return false;
            }

            @Override
            public boolean better(Double a, Double b) {
                return a < b;
            }

            @Override
            public String getName() {
                return "log";
            }
        };
    }

    /**
     * real(): +, *, 0, 1 (probabilities)
     */
    static Semiring<Double> real() {
        return new RealValued() {
            @Override
            public Double zero() {
                return 0.0;
            }

            @Override
            public Double one() {
                return 1.0;
            }

            @Override
            public Double plus(Double a, Double b) {
                return normalize(a + b);
            }

            @Override
            public Double times(Double a, Double b) {
                return normalize(a * b);
            }

            @Override
            public boolean isIdempotent() {
                return false;
            }

            @Override
            public boolean better(Double a, Double b) {
                return a > b;
            }

            @Override
            public String getName() {
                return "real";
            }
        };
    }

    /**
     * bool(): or, and, false, true. Used for unweighted computations.
     */
    static Semiring<Boolean> bool() {
        return new Semiring<>() {
            @Override
            public Boolean zero() {
                return Boolean.FALSE;
            }

            @Override
            public Boolean one() {
                return Boolean.TRUE;
            }

            @Override
            public Boolean plus(Boolean a, Boolean b) {
                return a || b;
            }

            @Override
            public Boolean times(Boolean a, Boolean b) {
                return a && b;
            }

            @Override
            public boolean isIdempotent() {
                return true;
            }

            @Override
            public boolean better(Boolean a, Boolean b) {
                return a && !b;
            }

            @Override
            public String getName() {
                return "boolean";
            }

            @Override
            public Boolean parse(String weight) {
                return Boolean.parseBoolean(weight);
            }
        };
    }

    /**
     * Looks up a semiring by name, as used on the command line.
     * @param name - tropical, log, real or boolean
     * @return the semiring
     */
    static Semiring<?> forName(String name) {
        return switch (name.toLowerCase()) {
            case "tropical", "standard" -> tropical();
            case "log" -> log();
            case "real" -> real();
            case "boolean" -> bool();
            default -> throw new IllegalArgumentException("Unknown semiring: " + name);
        };
    }

    /**
     * Shared parts of the double-valued semirings.
     */
    abstract class RealValued implements Semiring<Double> {
        // -0.0 and 0.0 must encode to the same weight
        static Double normalize(double value) {
            return value == 0.0 ? 0.0 : value;
        }

        @Override
        public boolean isZero(Double weight) {
            return weight.doubleValue() == zero();
        }

        @Override
        public boolean isOne(Double weight) {
            return weight.doubleValue() == one();
        }

        @Override
        public boolean approxEqual(Double a, Double b) {
            if (a.equals(b)) {
                return true;
            }
            return Math.abs(a - b) <= DELTA;
        }

        @Override
        public Double parse(String weight) {
            if ("Infinity".equals(weight) || "inf".equalsIgnoreCase(weight)) {
                return Double.POSITIVE_INFINITY;
            }
            return normalize(Double.parseDouble(weight));
        }

        @Override
        public String format(Double weight) {
            if (weight == Math.rint(weight) && !Double.isInfinite(weight)) {
                return String.valueOf(weight.longValue());
            }
            return String.valueOf(weight);
        }

        @Override
        public String toString() {
            return getName();
        }
    }
}
