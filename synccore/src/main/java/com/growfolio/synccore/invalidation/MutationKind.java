package com.growfolio.synccore.invalidation;

/*
 * 10/01/2026 - 1:16 PM
 * @author Growfolio Engineering
 */

/**
 * A kind of successful write that may stale cached data. Implemented by each domain's operation enum.
 */
public interface MutationKind {

    String name();

    String domain();
}
