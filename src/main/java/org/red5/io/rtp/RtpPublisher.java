package org.red5.io.rtp;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.red5.io.rtp.config.SenderConfig;
import org.red5.io.rtp.model.MediaFrame;
import org.red5.io.rtp.packet.GenericPacketizerFactory;
import org.red5.io.rtp.rtcp.SenderReportFactory;
import org.red5.io.rtp.sender.ConnectionChecker;
import org.red5.io.rtp.sender.RtpSender;
import org.red5.io.rtp.transport.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Red5 RTP Publisher - pushes raw input as RTP video frames, mostly to exercise links and receivers.
 */
@Command(
        name = "rtppub",
        description = "Red5 RTP Publisher - Sends an input stream as RTP video frames over UDP or interleaved TCP",
        mixinStandardHelpOptions = true,
        version = "0.2.0"
)
public class RtpPublisher implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(RtpPublisher.class);

    @Option(names = {"--host"}, description = "Receiver host", defaultValue = "127.0.0.1")
    private String host;

    @Option(names = {"--protocol"}, description = "Transport: ${COMPLETION-CANDIDATES}", defaultValue = "UDP")
    private Protocol protocol;

    @Option(names = {"--video-port"}, description = "Receiver RTP port for video (RTCP is port + 1)", defaultValue = "5004")
    private int videoPort;

    @Option(names = {"--audio-port"}, description = "Receiver RTP port for audio (RTCP is port + 1)", defaultValue = "5006")
    private int audioPort;

    @Option(names = {"--tcp-port"}, description = "Receiver port for interleaved TCP", defaultValue = "554")
    private int tcpPort;

    @Option(names = {"--input-source"}, description = "Input source: stdin or a file path", defaultValue = "stdin")
    private String inputSource;

    @Option(names = {"--chunk-size"}, description = "Bytes per frame", defaultValue = "4096")
    private int chunkSize;

    @Option(names = {"--fps"}, description = "Frames per second", defaultValue = "30")
    private int fps;

    @Option(names = {"--duration"}, description = "Seconds to run, 0 to stop at end of input", defaultValue = "0")
    private int duration;

    @Option(names = {"--config"}, description = "JSON sender configuration")
    private Path configPath;

    private final AtomicBoolean running = new AtomicBoolean(true);

    @Override
    public Integer call() throws Exception {
        logger.info("Starting Red5 RTP Publisher");
        logger.info("Target: {} {} video={} audio={}", protocol, host, videoPort, audioPort);
        logger.info("Input source: {}", inputSource);
        if (chunkSize <= 0 || fps <= 0) {
            logger.error("chunk-size and fps must be > 0");
            return 2;
        }

        SenderConfig config = configPath != null ? SenderConfig.load(configPath) : SenderConfig.defaults();
        logger.info("Sender config: {}", config);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            running.set(false);
        }));

        ConnectionChecker checker = new ConnectionChecker() {
            @Override
            public void onConnectionFailed(String reason) {
                logger.error("Connection failed: {}", reason);
                running.set(false);
            }

            @Override
            public void onNewBitrate(long bitrate) {
                logger.debug("Bitrate: {} bps", bitrate);
            }
        };
        RtpSender sender = new RtpSender(checker, new GenericPacketizerFactory(config.getMtu()),
                SenderReportFactory.NONE, config);
        sender.setSocketsInfo(protocol, host,
                new int[]{0, 0}, new int[]{0, 0},
                new int[]{videoPort, videoPort + 1}, new int[]{audioPort, audioPort + 1});

        EventLoopGroup group = null;
        try {
            if (protocol == Protocol.TCP) {
                group = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
                sender.setSocket(connect(group));
            }
            sender.start();
            try (InputStream in = openInput()) {
                publish(sender, in);
            }
        } finally {
            sender.stop();
            logger.info("Final statistics: {}", sender.getStatistics().toJson());
            if (group != null) {
                group.shutdownGracefully();
            }
        }

        logger.info("Processing complete");
        return 0;
    }

    private void publish(RtpSender sender, InputStream in) throws IOException {
        long frameIntervalNanos = TimeUnit.SECONDS.toNanos(1) / fps;
        long startNanos = System.nanoTime();
        long deadlineNanos = duration > 0 ? startNanos + TimeUnit.SECONDS.toNanos(duration) : Long.MAX_VALUE;
        long lastStats = startNanos;
        long frameCount = 0;

        while (running.get() && System.nanoTime() < deadlineNanos) {
            byte[] chunk = in.readNBytes(chunkSize);
            if (chunk.length == 0) {
                logger.info("End of input after {} frames", frameCount);
                break;
            }
            long pts = TimeUnit.NANOSECONDS.toMicros(frameCount * frameIntervalNanos);
            sender.sendMediaFrame(MediaFrame.video(Unpooled.wrappedBuffer(chunk), pts, frameCount % fps == 0));
            if (sender.hasCongestion()) {
                logger.debug("Sender queue congested: {} frames buffered", sender.getItemsInCache());
            }
            frameCount++;

            long now = System.nanoTime();
            if (now - lastStats >= TimeUnit.SECONDS.toNanos(1)) {
                logger.info("Statistics: {}", sender.getStatistics().toJson());
                lastStats = now;
            }
            long sleepNanos = startNanos + frameCount * frameIntervalNanos - now;
            if (sleepNanos > 0) {
                try {
                    TimeUnit.NANOSECONDS.sleep(sleepNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.info("Publisher interrupted");
                    break;
                }
            }
        }
    }

    private InputStream openInput() throws IOException {
        if ("stdin".equalsIgnoreCase(inputSource)) {
            return System.in;
        }
        return Files.newInputStream(Path.of(inputSource));
    }

    private Channel connect(EventLoopGroup group) throws IOException, InterruptedException {
        logger.info("Connecting to {}:{} for interleaved RTP", host, tcpPort);
        ChannelFuture future = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .handler(new ChannelInboundHandlerAdapter())
                .connect(host, tcpPort)
                .await();
        if (!future.isSuccess()) {
            throw new IOException("Unable to connect to " + host + ":" + tcpPort, future.cause());
        }
        logger.info("Connected to {}", future.channel().remoteAddress());
        return future.channel();
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new RtpPublisher()).execute(args);
        System.exit(exitCode);
    }

}
