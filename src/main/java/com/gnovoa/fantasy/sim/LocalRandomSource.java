package com.gnovoa.fantasy.sim;

import java.util.concurrent.ThreadLocalRandom;

/** Thread-local randomness; safe to share between concurrent scoring calls. */
public final class LocalRandomSource implements RandomSource {
    @Override public int nextIntInclusive(int fromInclusive, int toInclusive) {
        return ThreadLocalRandom.current().nextInt(fromInclusive, toInclusive + 1);
    }
}
