package com.raditha.sweep.model;

/**
 * Whether an occurrence of a name reads or writes it.
 */
public enum ReferenceContext {
    LOAD,
    STORE
}
