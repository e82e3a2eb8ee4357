package org.red5.io.rtp.bitrate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Accumulates bits until at least one second elapsed, then publishes an exponentially smoothed bitrate:
 * {@code bitrate = previous + factor * (current - previous)}. A factor of 1 disables smoothing.
 */
public class BitrateManager implements BitrateEstimator {
    private static final Logger logger = LoggerFactory.getLogger(BitrateManager.class);

    private final BitrateListener listener;
    private final LongSupplier clock;

    private long bits;
    private long timeStamp;
    private long bitrateOld;
    private volatile float exponentialFactor = 1f;

    public BitrateManager(BitrateListener listener) {
        this(listener, System::currentTimeMillis);
    }

    /**
     * @param clock millisecond clock, replaceable for tests
     */
    public BitrateManager(BitrateListener listener, LongSupplier clock) {
        this.listener = Objects.requireNonNull(listener, "listener");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timeStamp = clock.getAsLong();
    }

    @Override
    public synchronized void calculateBitrate(long size) {
        bits += size;
        long now = clock.getAsLong();
        long timeDiff = now - timeStamp;
        if (timeDiff >= 1000) {
            long currentValue = (long) (bits / (timeDiff / 1000f));
            if (bitrateOld == 0L) {
                bitrateOld = currentValue;
            }
            bitrateOld = (long) (bitrateOld + exponentialFactor * (currentValue - bitrateOld));
            logger.trace("Bitrate sample: current={} smoothed={}", currentValue, bitrateOld);
            listener.onNewBitrate(bitrateOld);
            timeStamp = now;
            bits = 0;
        }
    }

    @Override
    public synchronized void reset() {
        bits = 0;
        bitrateOld = 0;
        timeStamp = clock.getAsLong();
    }

    @Override
    public synchronized long getBitrate() {
        return bitrateOld;
    }

    @Override
    public float getExponentialFactor() {
        return exponentialFactor;
    }

    @Override
    public void setExponentialFactor(float factor) {
        if (!(factor > 0f && factor <= 1f)) {
            throw new IllegalArgumentException("exponential factor must be in (0, 1]: " + factor);
        }
        this.exponentialFactor = factor;
    }
}
