package org.red5.io.rtp.model;

/**
 * Kind of media carried by a frame. Each kind owns a pair of interleaved channels
 * (RTP on the even one, RTCP on the next) when streaming over the RTSP connection.
 */
public enum MediaType {
    VIDEO("video", 0),
    AUDIO("audio", 2);

    private final String value;
    private final int rtpChannel;

    MediaType(String value, int rtpChannel) {
        this.value = value;
        this.rtpChannel = rtpChannel;
    }

    @Override
    public String toString() {
        return value;
    }

    public int getRtpChannel() {
        return rtpChannel;
    }

    public int getRtcpChannel() {
        return rtpChannel + 1;
    }
}
