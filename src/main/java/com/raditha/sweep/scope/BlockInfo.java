package com.raditha.sweep.scope;

/**
 * A statement block as seen by the rewrite planner.
 *
 * @param id                block identity within one file
 * @param statementCount    number of statements the block holds
 * @param requiresStatement true when deleting every statement would leave invalid syntax
 */
public record BlockInfo(
        int id,
        int statementCount,
        boolean requiresStatement) {
}
