package benor.consensus;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A binary consensus value, or {@link #UNKNOWN} while no proposal has settled.
 * On the wire the values are written as {@code 0}, {@code 1} and {@code "?"}.
 */
public enum Value {
    ZERO(0),
    ONE(1),
    UNKNOWN("?");

    private final Object wireForm;

    Value(Object wireForm) {
        this.wireForm = wireForm;
    }

    @JsonValue
    public Object wireForm() {
        return wireForm;
    }

    public boolean isBinary() {
        return this != UNKNOWN;
    }

    public static Value ofBit(boolean bit) {
        return bit ? ONE : ZERO;
    }

    /**
     * Parses the wire form: the numbers 0 and 1, their string spellings, or "?".
     *
     * @throws IllegalArgumentException for anything else
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Value fromWire(Object raw) {
        if (raw instanceof Number number) {
            double bit = number.doubleValue();
            if (bit == 0.0) return ZERO;
            if (bit == 1.0) return ONE;
        } else if (raw instanceof String text) {
            switch (text.trim()) {
                case "0": return ZERO;
                case "1": return ONE;
                case "?": return UNKNOWN;
                default: break;
            }
        }
        throw new IllegalArgumentException("Not a consensus value: " + raw);
    }

    @Override
    public String toString() {
        return String.valueOf(wireForm);
    }
}
