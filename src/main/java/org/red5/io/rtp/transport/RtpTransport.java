package org.red5.io.rtp.transport;

import io.netty.channel.Channel;
import org.red5.io.rtp.model.RtpFrame;
import org.red5.io.rtp.protocol.RtpConstants;

import java.io.IOException;

/**
 * Writes RTP packets to the network.
 * <p>
 * {@link #sendFrame(RtpFrame)} may buffer; packets are guaranteed to be on the wire, in the order they were
 * sent, once {@link #flush()} returns. A failure of either call means the session is broken.
 */
public interface RtpTransport {

    static RtpTransport getInstance(RtpEndpoints endpoints, long writeTimeoutMillis) {
        return endpoints.protocol() == Protocol.TCP
                ? new TcpRtpTransport(writeTimeoutMillis)
                : new UdpRtpTransport(endpoints, writeTimeoutMillis);
    }

    Protocol getProtocol();

    /**
     * Bytes added on the wire to every packet by the transport framing.
     */
    default int getHeaderOverhead() {
        return getProtocol() == Protocol.TCP ? RtpConstants.TCP_HEADER_LENGTH : 0;
    }

    /**
     * Hand over the RTSP connection used for interleaved transport. Ignored by datagram transports.
     */
    default void setChannel(Channel channel) throws IOException {
    }

    void sendFrame(RtpFrame frame) throws IOException;

    void flush() throws IOException;

    void close();
}
