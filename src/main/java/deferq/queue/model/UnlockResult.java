package deferq.queue.model;

/**
 * Result of releasing a job lock by hand.
 */
public enum UnlockResult {
    UNLOCKED,
    NOT_LOCKED,
    NOT_FOUND
}
