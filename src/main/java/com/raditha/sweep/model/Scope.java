package com.raditha.sweep.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A nested region of visibility holding bindings and references.
 * <p>
 * Scopes are created by the scope graph builder through {@link #root(int)} and
 * {@link #openChild(int, ScopeKind, int)}, so the tree is acyclic by construction.
 */
public final class Scope {

    private final int id;
    private final ScopeKind kind;
    private final Scope parent;
    private final int startLine;
    private final Map<String, Binding> bindings = new LinkedHashMap<>();
    private final List<Reference> references = new ArrayList<>();
    private final List<Scope> children = new ArrayList<>();
    private final Set<String> outerNames = new HashSet<>();

    private Scope(int id, ScopeKind kind, Scope parent, int startLine) {
        this.id = id;
        this.kind = kind;
        this.parent = parent;
        this.startLine = startLine;
    }

    public static Scope root(int id) {
        return new Scope(id, ScopeKind.MODULE, null, 1);
    }

    public Scope openChild(int childId, ScopeKind childKind, int line) {
        if (childKind == ScopeKind.MODULE) {
            throw new IllegalArgumentException("Only the root scope may be a module scope");
        }
        Scope child = new Scope(childId, childKind, this, line);
        children.add(child);
        return child;
    }

    public int getId() {
        return id;
    }

    public ScopeKind getKind() {
        return kind;
    }

    public Optional<Scope> getParent() {
        return Optional.ofNullable(parent);
    }

    public int getStartLine() {
        return startLine;
    }

    public Collection<Binding> getBindings() {
        return Collections.unmodifiableCollection(bindings.values());
    }

    public Optional<Binding> getBinding(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    public List<Reference> getReferences() {
        return Collections.unmodifiableList(references);
    }

    public List<Scope> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * This scope and every scope nested in it, depth first.
     */
    public Stream<Scope> selfAndDescendants() {
        return Stream.concat(Stream.of(this), children.stream().flatMap(Scope::selfAndDescendants));
    }

    /**
     * Names declared {@code global}/{@code nonlocal} here; writes to them bind in an outer scope.
     */
    public boolean isOuterName(String name) {
        return outerNames.contains(name);
    }

    public void declareOuterName(String name) {
        outerNames.add(name);
    }

    public Binding declareParameter(String name, int line) {
        return bindings.computeIfAbsent(name, n -> new Binding(n, BindingKind.PARAMETER, this, line));
    }

    /**
     * Records a write of {@code name}, creating the assignment binding on first use.
     *
     * @return the binding the write was attached to
     */
    public Binding recordWrite(String name, WriteSite site) {
        Binding binding = bindings.computeIfAbsent(name,
                n -> new Binding(n, BindingKind.ASSIGNMENT, this, site.startLine()));
        binding.addWrite(site);
        return binding;
    }

    public void addReference(String name, int line, ReferenceContext context) {
        references.add(new Reference(name, line, this, context));
    }

    @Override
    public String toString() {
        return kind + "#" + id + "@L" + startLine;
    }
}
