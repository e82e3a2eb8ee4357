package org.red5.io.rtp.transport;

/**
 * Transport used for RTP/RTCP. TCP means interleaved on the RTSP connection.
 */
public enum Protocol {
    TCP,
    UDP
}
