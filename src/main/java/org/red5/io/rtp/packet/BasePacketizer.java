package org.red5.io.rtp.packet;

import org.red5.io.rtp.model.MediaType;
import org.red5.io.rtp.protocol.RtpConstants;

/**
 * Writes the RFC 3550 fixed header and keeps the per-stream sequence counter.
 *
 * <pre>
 *  0                   1                   2                   3
 *  0 1 2 3 4 5 6 7 8 9 0 1 2 3 4 5 6 7 8 9 0 1 2 3 4 5 6 7 8 9 0 1
 * |V=2|P|X|  CC   |M|     PT      |       sequence number         |
 * |                           timestamp                           |
 * |           synchronization source (SSRC) identifier            |
 * </pre>
 */
public abstract class BasePacketizer implements Packetizer {

    protected final MediaType mediaType;
    protected final int payloadType;
    protected long clock;
    protected final int maxPacketSize;

    private long ssrc;
    private int seq;

    protected BasePacketizer(MediaType mediaType, int payloadType, long clock, int mtu) {
        if (clock <= 0) {
            throw new IllegalArgumentException("clock must be > 0: " + clock);
        }
        if (mtu <= RtpConstants.IP_UDP_HEADER_LENGTH + RtpConstants.RTP_HEADER_LENGTH) {
            throw new IllegalArgumentException("mtu too small: " + mtu);
        }
        this.mediaType = mediaType;
        this.payloadType = payloadType;
        this.clock = clock;
        this.maxPacketSize = mtu - RtpConstants.IP_UDP_HEADER_LENGTH;
    }

    @Override
    public void setSSRC(long ssrc) {
        this.ssrc = ssrc & 0xFFFFFFFFL;
    }

    public long getSSRC() {
        return ssrc;
    }

    @Override
    public void reset() {
        seq = 0;
    }

    /**
     * Allocate a packet of the given total size with version, payload type and SSRC already written.
     */
    protected byte[] getBuffer(int size) {
        byte[] buffer = new byte[size];
        buffer[0] = (byte) (RtpConstants.RTP_VERSION << 6);
        buffer[1] = (byte) (payloadType & 0x7F);
        setLong(buffer, ssrc, 8, 12);
        return buffer;
    }

    protected void updateSeq(byte[] buffer) {
        setLong(buffer, seq, 2, 4);
        seq = (seq + 1) & 0xFFFF;
    }

    /**
     * Convert a presentation time in microseconds to clock units and write it.
     */
    protected long updateTimeStamp(byte[] buffer, long timestampUs) {
        long ts = (timestampUs * clock / 1_000_000L) & 0xFFFFFFFFL;
        setLong(buffer, ts, 4, 8);
        return ts;
    }

    protected void markPacket(byte[] buffer) {
        buffer[1] |= (byte) 0x80;
    }

    private static void setLong(byte[] buffer, long value, int begin, int end) {
        for (int i = end - 1; i >= begin; i--) {
            buffer[i] = (byte) (value & 0xFF);
            value >>>= 8;
        }
    }
}
