package com.raditha.sweep.model;

/**
 * An occurrence of a name.
 *
 * @param name    the referenced name
 * @param line    line of the occurrence (1-indexed)
 * @param scope   scope in which the occurrence textually appears
 * @param context read or write
 */
public record Reference(
        String name,
        int line,
        Scope scope,
        ReferenceContext context) {

    public boolean isLoad() {
        return context == ReferenceContext.LOAD;
    }

    @Override
    public String toString() {
        return context + " " + name + "@L" + line;
    }
}
