package edu.brandeis.cosi103a.brackets.seeding;

/**
 * Park-Miller minimal standard generator (multiplier 16807, modulus 2^31 - 1).
 * The same seed always yields the same sequence, on any platform.
 *
 * <p>Not thread-safe; create one per shuffle.
 */
public final class ParkMillerRandomSource implements RandomSource {

    static final long MODULUS = 2_147_483_647L;
    static final long MULTIPLIER = 16_807L;

    private long state;

    /**
     * @param seed any value; it is reduced into [1, 2^31 - 2], with 0 mapped to 1
     */
    public ParkMillerRandomSource(long seed) {
        long normalized = Math.floorMod(seed, MODULUS);
        this.state = normalized == 0 ? 1 : normalized;
    }

    @Override
    public double nextDouble() {
        state = (state * MULTIPLIER) % MODULUS;
        return (state - 1) / (double) (MODULUS - 1);
    }
}
