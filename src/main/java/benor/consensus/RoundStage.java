package benor.consensus;

/**
 * Stages of a single round, in the order they are entered.
 */
public enum RoundStage {
    IDLE,
    BROADCAST_R,
    AWAIT_R,
    BROADCAST_P,
    AWAIT_P,
    RESOLVE,
    /** Final: the node holds a decided value and runs no further rounds. */
    DECIDED,
    /** Round counter advanced; the next round may begin. */
    NEXT_ROUND
}
