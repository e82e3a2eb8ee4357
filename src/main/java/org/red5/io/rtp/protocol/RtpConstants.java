package org.red5.io.rtp.protocol;

/**
 * RTP/RTCP constants shared by packetizers, transports and byte accounting.
 *
 * @see <a href="https://www.rfc-editor.org/rfc/rfc3550">RFC 3550</a>
 * @see <a href="https://www.rfc-editor.org/rfc/rfc2326#section-10.12">RFC 2326 Section 10.12</a>
 */
public final class RtpConstants {

    public static final int RTP_VERSION = 2;

    // Fixed RTP header without CSRC list or extension
    public static final int RTP_HEADER_LENGTH = 12;

    public static final int MTU = 1500;

    // IPv4 + UDP headers, subtracted from the MTU to size packets
    public static final int IP_UDP_HEADER_LENGTH = 28;

    // Sender report (28 bytes) as written by the RTCP generator
    public static final int REPORT_PACKET_LENGTH = 28;

    // '$' + channel + 16-bit length prepended to every packet on an interleaved RTSP connection
    public static final int TCP_HEADER_LENGTH = 4;

    public static final int INTERLEAVED_MAGIC = 0x24;

    public static final int MAX_INTERLEAVED_LENGTH = 0xFFFF;

    public static final long CLOCK_VIDEO_FREQUENCY = 90000L;

    public static final int PAYLOAD_TYPE_VIDEO = 96;
    public static final int PAYLOAD_TYPE_AUDIO = 97;
    // Static payload type for PCMA
    public static final int PAYLOAD_TYPE_G711 = 8;

    private RtpConstants() {
        // Utility class, prevent instantiation
    }
}
