package com.kmesh.fusion.pipeline.conflict;

/**
 * What happens to the losing items of a resolved conflict.
 */
public enum LoserPolicy {
    /** Loser stays in the result with its normalized score penalized going into ranking. */
    DEMOTE,
    /** Loser is dropped from the surviving set. */
    REMOVE
}
