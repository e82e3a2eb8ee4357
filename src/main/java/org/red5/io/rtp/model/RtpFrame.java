package org.red5.io.rtp.model;

import java.util.Objects;

/**
 * A single RTP packet ready to be written to the wire.
 */
public class RtpFrame {
    private final byte[] buffer;
    private final long timeStamp;
    private final int length;
    private final int channelIdentifier;

    public RtpFrame(byte[] buffer, long timeStamp, int length, int channelIdentifier) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        if (length < 0 || length > buffer.length) {
            throw new IllegalArgumentException("Invalid length " + length + " for buffer of " + buffer.length + " bytes");
        }
        this.timeStamp = timeStamp;
        this.length = length;
        this.channelIdentifier = channelIdentifier;
    }

    public byte[] getBuffer() {
        return buffer;
    }

    /**
     * RTP timestamp, in clock-rate units.
     */
    public long getTimeStamp() {
        return timeStamp;
    }

    public int getLength() {
        return length;
    }

    /**
     * Interleaved channel the packet belongs to.
     */
    public int getChannelIdentifier() {
        return channelIdentifier;
    }

    public boolean isVideoFrame() {
        return channelIdentifier == MediaType.VIDEO.getRtpChannel();
    }

    public MediaType getMediaType() {
        return isVideoFrame() ? MediaType.VIDEO : MediaType.AUDIO;
    }

    @Override
    public String toString() {
        return "RtpFrame{" +
                "channel=" + channelIdentifier +
                ", timeStamp=" + timeStamp +
                ", length=" + length +
                '}';
    }
}
