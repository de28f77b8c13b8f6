package edu.brandeis.cosi103a.brackets.seeding;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Unseeded randomness for when reproducibility is not requested.
 */
public final class LocalRandomSource implements RandomSource {
    @Override public double nextDouble() {
        return ThreadLocalRandom.current().nextDouble();
    }
}
