package benor.consensus;

import java.util.Objects;

/**
 * Outcome of evaluating a round's P messages: the node's next estimate and
 * whether that estimate is final.
 */
public record Resolution(Value value, boolean decided) {

    public Resolution {
        Objects.requireNonNull(value, "Value cannot be null");
        if (decided && !value.isBinary()) {
            throw new IllegalArgumentException("Cannot decide on " + value);
        }
    }

    public static Resolution decided(Value value) {
        return new Resolution(value, true);
    }

    public static Resolution adopt(Value value) {
        return new Resolution(value, false);
    }
}
