package com.raditha.sweep.model;

/**
 * How a name was introduced into its scope.
 */
public enum BindingKind {
    /**
     * Bound by an assignment-like statement ({@code name = expr}). Eligible for removal.
     */
    ASSIGNMENT,

    /**
     * Declared as a function, method or lambda parameter. Never removed since
     * callers depend on the signature.
     */
    PARAMETER
}
