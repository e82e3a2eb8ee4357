package org.red5.io.rtp.bitrate;

/**
 * Turns the amount of data written per interval into a smoothed bits per second figure.
 */
public interface BitrateEstimator {

    void reset();

    /**
     * Feed the number of bits written since the previous call.
     */
    void calculateBitrate(long bits);

    /**
     * Last smoothed value, in bits per second.
     */
    long getBitrate();

    float getExponentialFactor();

    void setExponentialFactor(float factor);
}
