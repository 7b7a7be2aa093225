package benor.consensus;

import java.util.Random;

/**
 * Coin backed by a {@link Random}; seeding it makes a whole simulation repeatable.
 */
public class SeededRandomBitSource implements RandomBitSource {

    private final Random random;

    public SeededRandomBitSource(long seed) {
        this(new Random(seed));
    }

    public SeededRandomBitSource(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("Random cannot be null");
        }
        this.random = random;
    }

    @Override
    public boolean nextBit() {
        return random.nextBoolean();
    }
}
