package org.red5.io.rtp.rtcp;

import io.netty.channel.Channel;
import org.red5.io.rtp.model.RtpFrame;
import org.red5.io.rtp.protocol.RtpConstants;

import java.io.IOException;

/**
 * Emits RTCP sender reports alongside the RTP stream. It sees every RTP packet sent and decides by itself when
 * a report is due.
 */
public interface SenderReportGenerator {

    void setSSRC(long ssrcVideo, long ssrcAudio);

    /**
     * Account one RTP packet and write a report if one is due.
     *
     * @return true when a report was written during this call
     * @throws IOException if writing the report failed
     */
    boolean update(RtpFrame frame) throws IOException;

    /**
     * Size of one report as written on the wire, before transport framing.
     */
    default int getReportPacketLength() {
        return RtpConstants.REPORT_PACKET_LENGTH;
    }

    /**
     * Hand over the RTSP connection used for interleaved transport.
     */
    default void setChannel(Channel channel) throws IOException {
    }

    void reset();

    void close();
}
