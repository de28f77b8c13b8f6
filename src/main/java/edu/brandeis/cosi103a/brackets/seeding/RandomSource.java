package edu.brandeis.cosi103a.brackets.seeding;

/**
 * Source of uniform randomness for shuffles. Injected so tests and replays can
 * control the sequence.
 */
public interface RandomSource {

    /**
     * @return a value in [0, 1)
     */
    double nextDouble();

    /**
     * @return a uniformly chosen index in [0, bound)
     */
    default int nextIndex(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive, got " + bound);
        }
        int idx = (int) Math.floor(nextDouble() * bound);
        return Math.min(idx, bound - 1);
    }
}
