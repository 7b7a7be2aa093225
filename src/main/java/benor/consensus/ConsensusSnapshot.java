package benor.consensus;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Read-only view of a node's consensus state.
 * <p>
 * For a faulty node {@code currentValue}, {@code decided} and {@code round} are
 * null: it holds no estimate and takes no part in rounds.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ConsensusSnapshot(Value currentValue, Boolean decided, Integer round, boolean stopped) {

    public static ConsensusSnapshot ofFaulty(boolean stopped) {
        return new ConsensusSnapshot(null, null, null, stopped);
    }

    public boolean hasDecided() {
        return Boolean.TRUE.equals(decided);
    }
}
