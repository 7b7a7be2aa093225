package benor.consensus;

/**
 * Source of the fair coin used to break ties.
 */
@FunctionalInterface
public interface RandomBitSource {

    /**
     * @return the next fair bit
     */
    boolean nextBit();

    default Value nextValue() {
        return Value.ofBit(nextBit());
    }
}
