package org.red5.io.rtp.packet;

import io.netty.buffer.ByteBuf;
import org.red5.io.rtp.model.FrameInfo;
import org.red5.io.rtp.model.MediaType;
import org.red5.io.rtp.model.RtpFrame;
import org.red5.io.rtp.protocol.RtpConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Payload-format agnostic packetizer: the frame bytes are cut into MTU sized fragments, each behind an
 * RTP header, with the marker bit set on the last fragment of the frame.
 */
public class FragmentingPacketizer extends BasePacketizer {
    private static final Logger logger = LoggerFactory.getLogger(FragmentingPacketizer.class);

    public FragmentingPacketizer(MediaType mediaType, int payloadType, long clock) {
        this(mediaType, payloadType, clock, RtpConstants.MTU);
    }

    public FragmentingPacketizer(MediaType mediaType, int payloadType, long clock, int mtu) {
        super(mediaType, payloadType, clock, mtu);
    }

    @Override
    public void configure(CodecConfig config) {
        if (config instanceof CodecConfig.Audio audio) {
            if (mediaType != MediaType.AUDIO) {
                throw new IllegalArgumentException("Audio configuration for a " + mediaType + " packetizer");
            }
            clock = audio.sampleRate();
        } else if (mediaType != MediaType.VIDEO) {
            throw new IllegalArgumentException("Video configuration for a " + mediaType + " packetizer");
        }
        logger.debug("Configured {} packetizer: {}, clock={}", mediaType, config, clock);
    }

    @Override
    public List<RtpFrame> createPackets(ByteBuf payload, FrameInfo info) {
        int start = payload.readerIndex() + info.offset();
        int size = Math.min(info.size(), payload.writerIndex() - start);
        if (size <= 0) {
            return Collections.emptyList();
        }
        int maxPayload = maxPacketSize - RtpConstants.RTP_HEADER_LENGTH;
        List<RtpFrame> frames = new ArrayList<>((size + maxPayload - 1) / maxPayload);
        int sent = 0;
        while (sent < size) {
            int length = Math.min(maxPayload, size - sent);
            byte[] buffer = getBuffer(length + RtpConstants.RTP_HEADER_LENGTH);
            long ts = updateTimeStamp(buffer, info.timestamp());
            payload.getBytes(start + sent, buffer, RtpConstants.RTP_HEADER_LENGTH, length);
            sent += length;
            if (sent == size) {
                markPacket(buffer);
            }
            updateSeq(buffer);
            frames.add(new RtpFrame(buffer, ts, buffer.length, mediaType.getRtpChannel()));
        }
        return frames;
    }
}
