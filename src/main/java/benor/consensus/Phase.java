package benor.consensus;

/**
 * The two message exchanges of a round.
 */
public enum Phase {
    /** Carries the sender's current estimate. */
    R,

    /** Carries the value the sender chose after counting the R messages. */
    P
}
