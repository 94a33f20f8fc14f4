package com.dcruver.promptloom.store;

/**
 * The index is not in the state a write expected, e.g. a row id could not be resolved
 * right after its insert. Fatal to the current sync, which rolls back.
 */
public class IndexConsistencyException extends IllegalStateException {

    public IndexConsistencyException(String message) {
        super(message);
    }
}
