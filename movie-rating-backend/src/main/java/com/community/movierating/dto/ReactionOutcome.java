package com.community.movierating.dto;

/**
 * Terminal state of a processed reaction event.
 */
public enum ReactionOutcome {

    /** First rating by this user for the item. */
    ACCEPTED,
    /** Existing rating replaced by a different value. */
    UPDATED,
    /** Rating deleted after the user withdrew their reaction. */
    REMOVED,

    REJECTED_INVALID_EMOJI,
    REJECTED_DUPLICATE,

    IGNORED_SELF_ACTION,
    IGNORED_UNTRACKED,
    IGNORED_INVALID_EMOJI,
    /** Removed reaction no longer matches the stored rating. */
    IGNORED_STALE,

    FAILED_PERSISTENCE
}
