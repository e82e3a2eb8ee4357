package org.red5.io.rtp.sender;

import org.red5.io.rtp.bitrate.BitrateEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic task draining the byte counter shared with the transmission loop into the bitrate estimator.
 */
final class BitrateSampler implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(BitrateSampler.class);

    private final AtomicLong bytesSent;
    private final BitrateEstimator estimator;

    BitrateSampler(AtomicLong bytesSent, BitrateEstimator estimator) {
        this.bytesSent = bytesSent;
        this.estimator = estimator;
    }

    @Override
    public void run() {
        try {
            sample();
        } catch (RuntimeException e) {
            // an exception would cancel the periodic schedule
            logger.warn("Bitrate sample failed", e);
        }
    }

    long sample() {
        long bytes = bytesSent.getAndSet(0);
        //bytes to bits
        long bits = bytes * 8;
        estimator.calculateBitrate(bits);
        return bits;
    }
}
