package com.raditha.sweep.rewrite;

import com.raditha.sweep.model.Binding;
import com.raditha.sweep.model.WriteSite;

import java.util.List;

/**
 * Which writes of a dead binding are deleted.
 */
public enum ReassignmentPolicy {
    /**
     * Delete every write of the binding. A second run finds nothing left to remove.
     */
    ALL_WRITES,

    /**
     * Delete only the final write, the one the binding's declaration line refers to.
     * Earlier writes become dead on the next run.
     */
    LAST_WRITE_WINS;

    /**
     * Convert a string value to ReassignmentPolicy enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding policy
     * @throws IllegalArgumentException if the value is not a valid policy
     */
    public static ReassignmentPolicy fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("ReassignmentPolicy value cannot be null");
        }

        return switch (value.trim().toLowerCase().replace('_', '-')) {
            case "all-writes" -> ALL_WRITES;
            case "last-write-wins" -> LAST_WRITE_WINS;
            default -> throw new IllegalArgumentException(
                    "Invalid reassignment policy: " + value + ". Must be: all-writes or last-write-wins");
        };
    }

    public String toCliString() {
        return switch (this) {
            case ALL_WRITES -> "all-writes";
            case LAST_WRITE_WINS -> "last-write-wins";
        };
    }

    List<WriteSite> sitesToRemove(Binding binding) {
        return switch (this) {
            case ALL_WRITES -> binding.getWrites();
            case LAST_WRITE_WINS -> List.of(binding.lastWrite());
        };
    }
}
