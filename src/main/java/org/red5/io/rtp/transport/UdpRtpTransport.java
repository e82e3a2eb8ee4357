package org.red5.io.rtp.transport;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import org.red5.io.rtp.model.RtpFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * RTP over UDP: one datagram channel per media kind, bound to the client port negotiated in SETUP and
 * sending to the matching server port. Channels are bound on first use.
 */
public class UdpRtpTransport extends NettyRtpTransport {
    private static final Logger logger = LoggerFactory.getLogger(UdpRtpTransport.class);

    private final RtpEndpoints endpoints;
    private final long bindTimeoutMillis;

    private EventLoopGroup group;
    private Channel videoChannel;
    private Channel audioChannel;
    private InetSocketAddress videoDestination;
    private InetSocketAddress audioDestination;
    private boolean closed;

    public UdpRtpTransport(RtpEndpoints endpoints, long writeTimeoutMillis) {
        super(writeTimeoutMillis);
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
        this.bindTimeoutMillis = writeTimeoutMillis;
    }

    @Override
    public Protocol getProtocol() {
        return Protocol.UDP;
    }

    @Override
    public synchronized void sendFrame(RtpFrame frame) throws IOException {
        open();
        boolean video = frame.isVideoFrame();
        Channel ch = video ? videoChannel : audioChannel;
        InetSocketAddress destination = video ? videoDestination : audioDestination;
        DatagramPacket packet = new DatagramPacket(
                Unpooled.wrappedBuffer(frame.getBuffer(), 0, frame.getLength()), destination);
        track(ch.write(packet));
    }

    @Override
    public synchronized void flush() throws IOException {
        if (closed) {
            throw new IOException("Transport closed");
        }
        if (videoChannel == null) {
            return;
        }
        videoChannel.flush();
        audioChannel.flush();
        awaitPendingWrite();
    }

    @Override
    public synchronized void close() {
        closed = true;
        forgetPendingWrite();
        if (videoChannel != null) {
            videoChannel.close();
        }
        if (audioChannel != null) {
            audioChannel.close();
        }
        if (group != null) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        }
        videoChannel = null;
        audioChannel = null;
        group = null;
        logger.debug("UDP transport closed");
    }

    private void open() throws IOException {
        if (closed) {
            throw new IOException("Transport closed");
        }
        if (videoChannel != null) {
            return;
        }
        videoDestination = new InetSocketAddress(endpoints.host(), endpoints.videoServerPort());
        audioDestination = new InetSocketAddress(endpoints.host(), endpoints.audioServerPort());
        if (videoDestination.isUnresolved()) {
            throw new IOException("Unknown host: " + endpoints.host());
        }
        group = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .handler(new ChannelInboundHandlerAdapter());
        try {
            videoChannel = bind(bootstrap, endpoints.videoSourcePort());
            audioChannel = bind(bootstrap, endpoints.audioSourcePort());
        } catch (IOException e) {
            close();
            throw e;
        }
        logger.info("UDP transport ready: video {} -> {}, audio {} -> {}",
                videoChannel.localAddress(), videoDestination, audioChannel.localAddress(), audioDestination);
    }

    private Channel bind(Bootstrap bootstrap, int port) throws IOException {
        ChannelFuture future = bootstrap.bind(port);
        try {
            if (!future.await(bindTimeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new IOException("Timed out binding UDP port " + port);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while binding UDP port " + port, e);
        }
        if (!future.isSuccess()) {
            throw new IOException("Unable to bind UDP port " + port, future.cause());
        }
        return future.channel();
    }
}
