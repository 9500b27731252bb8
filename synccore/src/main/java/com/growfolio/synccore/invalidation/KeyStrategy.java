package com.growfolio.synccore.invalidation;

/*
 * 10/01/2026 - 1:10 PM
 * @author Growfolio Engineering
 */

/**
 * How an invalidation edge picks the entries to drop from its target store.
 */
public enum KeyStrategy {
    CLEAR_SINGLETON,   // drop the store's one fixed key
    REMOVE_KEY,        // drop a key derived from the mutation, with everything nested under it
    CLEAR_COLLECTION   // drop the whole store
}
