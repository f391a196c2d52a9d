package com.fintracker.recurring.enums;

/**
 * What happened to a template, deciding how its linked instances are reconciled.
 */
public enum ReconciliationMode {
    /** Template fields changed: future generated instances are dropped and regenerated. */
    EDIT_ALL_FUTURE,
    /** Template removed: future instances are dropped, past ones are unlinked. */
    DELETE_TEMPLATE
}
