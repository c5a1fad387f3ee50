package Coxeter.Model;

import java.util.Locale;

/**
 * Which canonical words the automaton recognizes.
 */
public enum Mode {
    /** All reduced words, i.e. every shortest expression of every group element. */
    REDUCED,
    /** Exactly one word per group element: the lexicographically smallest reduced word. */
    SHORTLEX;

    /**
     * In shortlex mode the successor label under generator i also contains the images s_i(alpha_j) for j &lt; i.
     */
    public boolean addsLowerSimpleRoots() {
        return this == SHORTLEX;
    }

    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Mode parse(String name) {
        if (name != null) {
            for (Mode mode : values()) {
                if (mode.getName().equalsIgnoreCase(name.trim())) {
                    return mode;
                }
            }
        }
        throw new CoxeterConfigurationException(
            "Unknown type of automaton '" + name + "', must be 'reduced' or 'shortlex'");
    }
}
