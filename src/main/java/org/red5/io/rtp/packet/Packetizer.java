package org.red5.io.rtp.packet;

import io.netty.buffer.ByteBuf;
import org.red5.io.rtp.model.FrameInfo;
import org.red5.io.rtp.model.RtpFrame;

import java.util.List;

/**
 * Turns encoded frames of one media kind into RTP packets.
 * <p>
 * A packetizer is long-lived for the whole session: sequence numbers and other per-stream state
 * survive from one frame to the next until {@link #reset()} is called.
 */
public interface Packetizer {

    void configure(CodecConfig config);

    void setSSRC(long ssrc);

    /**
     * Split one frame into packets, in the order they must be sent. May return an empty list.
     */
    List<RtpFrame> createPackets(ByteBuf payload, FrameInfo info);

    void reset();
}
