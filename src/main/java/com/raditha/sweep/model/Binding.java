package com.raditha.sweep.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A name declared in a scope.
 * <p>
 * Repeated assignment to the same name within one scope is one binding; its
 * declaration line is the line of the last write.
 */
public final class Binding {

    private final String name;
    private final BindingKind kind;
    private final Scope scope;
    private final int introducedAtLine;
    private final List<WriteSite> writes = new ArrayList<>();

    Binding(String name, BindingKind kind, Scope scope, int introducedAtLine) {
        this.name = name;
        this.kind = kind;
        this.scope = scope;
        this.introducedAtLine = introducedAtLine;
    }

    public String getName() {
        return name;
    }

    public BindingKind getKind() {
        return kind;
    }

    public Scope getScope() {
        return scope;
    }

    /**
     * Line of the last write, or the declaration line for parameters.
     */
    public int declaredAtLine() {
        return writes.isEmpty() ? introducedAtLine : lastWrite().startLine();
    }

    /**
     * Line of the first write, or the declaration line for parameters.
     */
    public int firstWriteLine() {
        return writes.isEmpty() ? introducedAtLine : writes.get(0).startLine();
    }

    public boolean isParameter() {
        return kind == BindingKind.PARAMETER;
    }

    public boolean isWrittenInLoop() {
        return writes.stream().anyMatch(WriteSite::inLoop);
    }

    public List<WriteSite> getWrites() {
        return Collections.unmodifiableList(writes);
    }

    public WriteSite lastWrite() {
        if (writes.isEmpty()) {
            throw new IllegalStateException("Binding '" + name + "' has no writes");
        }
        return writes.get(writes.size() - 1);
    }

    void addWrite(WriteSite site) {
        writes.add(site);
    }

    @Override
    public String toString() {
        return kind + " " + name + "@L" + declaredAtLine();
    }
}
