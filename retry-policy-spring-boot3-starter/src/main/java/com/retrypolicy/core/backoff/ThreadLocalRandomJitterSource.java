package com.retrypolicy.core.backoff;

import com.retrypolicy.core.spi.JitterSource;

import java.util.concurrent.ThreadLocalRandom;

public class ThreadLocalRandomJitterSource implements JitterSource {

    @Override
    public long nextJitterMillis(long maxMillis) {
        if (maxMillis <= 0) {
            return 0;
        }
        return ThreadLocalRandom.current().nextLong(maxMillis);
    }
}
