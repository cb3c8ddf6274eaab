package com.raditha.sweep.cli;

/**
 * Enumeration of run modes for the sweeper CLI.
 */
public enum RunMode {
    /**
     * Apply mode - Rewrite files in place.
     */
    APPLY,

    /**
     * Dry-run mode - Preview changes without making modifications.
     * Shows a unified diff of what would be removed.
     */
    DRY_RUN;

    /**
     * Convert a string value to RunMode enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding RunMode
     * @throws IllegalArgumentException if the value is not a valid mode
     */
    public static RunMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("RunMode value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "apply" -> APPLY;
            case "dry-run" -> DRY_RUN;
            default -> throw new IllegalArgumentException(
                    "Invalid run mode: " + value + ". Must be: apply or dry-run");
        };
    }

    /**
     * Get the string representation of this mode for CLI usage.
     *
     * @return lowercase string representation
     */
    public String toCliString() {
        return switch (this) {
            case APPLY -> "apply";
            case DRY_RUN -> "dry-run";
        };
    }
}
