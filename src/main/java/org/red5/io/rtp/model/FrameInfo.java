package org.red5.io.rtp.model;

/**
 * Encoder metadata travelling with a frame payload.
 *
 * @param offset    index of the first payload byte
 * @param size      number of payload bytes
 * @param timestamp presentation timestamp in microseconds
 * @param isKeyFrame whether the frame is a sync point
 */
public record FrameInfo(int offset, int size, long timestamp, boolean isKeyFrame) {

    public FrameInfo {
        if (offset < 0 || size < 0) {
            throw new IllegalArgumentException("offset and size must be >= 0: offset=" + offset + ", size=" + size);
        }
    }

    public static FrameInfo of(int size, long timestamp) {
        return new FrameInfo(0, size, timestamp, false);
    }
}
