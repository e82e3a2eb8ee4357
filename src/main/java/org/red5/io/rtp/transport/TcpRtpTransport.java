package org.red5.io.rtp.transport;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.channel.Channel;
import org.red5.io.rtp.model.RtpFrame;
import org.red5.io.rtp.protocol.RtpConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * RTP interleaved on the RTSP connection (RFC 2326 Section 10.12).
 * <p>
 * Every packet is prefixed by the 4 byte header:
 * <pre>
 * '$' (0x24) | channel (8) | length (16, big-endian) | RTP packet
 * </pre>
 * The channel is owned by the RTSP client; closing this transport does not close it.
 */
public class TcpRtpTransport extends NettyRtpTransport {
    private static final Logger logger = LoggerFactory.getLogger(TcpRtpTransport.class);

    private volatile Channel channel;

    public TcpRtpTransport(long writeTimeoutMillis) {
        super(writeTimeoutMillis);
    }

    @Override
    public Protocol getProtocol() {
        return Protocol.TCP;
    }

    @Override
    public void setChannel(Channel channel) {
        this.channel = channel;
        logger.debug("Interleaved RTP channel set: {}", channel);
    }

    @Override
    public void sendFrame(RtpFrame frame) throws IOException {
        Channel ch = requireChannel();
        ByteBuf message = encode(ch.alloc(), frame.getChannelIdentifier(), frame.getBuffer(), frame.getLength());
        track(ch.write(message));
    }

    @Override
    public void flush() throws IOException {
        requireChannel().flush();
        awaitPendingWrite();
    }

    @Override
    public void close() {
        forgetPendingWrite();
        channel = null;
    }

    /**
     * Build an interleaved frame for {@code length} bytes of {@code data}.
     */
    public static ByteBuf encode(ByteBufAllocator alloc, int channelId, byte[] data, int length) {
        if (length > RtpConstants.MAX_INTERLEAVED_LENGTH) {
            throw new IllegalArgumentException("Packet too large for interleaved framing: " + length);
        }
        ByteBuf out = alloc.buffer(RtpConstants.TCP_HEADER_LENGTH + length);
        out.writeByte(RtpConstants.INTERLEAVED_MAGIC);
        out.writeByte(channelId);
        out.writeShort(length);
        out.writeBytes(data, 0, length);
        return out;
    }

    private Channel requireChannel() throws IOException {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw new IOException("RTSP connection is not available");
        }
        return ch;
    }
}
