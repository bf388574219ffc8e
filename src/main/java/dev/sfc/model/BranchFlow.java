package dev.sfc.model;

import java.util.Locale;

/**
 * Direction of a branch: fan-out from one point (diverge) or fan-in to one point (converge).
 */
public enum BranchFlow {
    DIVERGE,
    CONVERGE,
    UNSPECIFIED;

    /**
     * Normalise a {@code BranchFlow} attribute value. Anything that is not
     * "Diverge" or "Converge" (in any case) is UNSPECIFIED.
     */
    public static BranchFlow parse(String value) {
        if (value == null) {
            return UNSPECIFIED;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "diverge" -> DIVERGE;
            case "converge" -> CONVERGE;
            default -> UNSPECIFIED;
        };
    }
}
