package org.red5.io.rtp.sender;

import io.netty.channel.Channel;
import org.red5.io.rtp.bitrate.BitrateEstimator;
import org.red5.io.rtp.bitrate.BitrateManager;
import org.red5.io.rtp.config.SenderConfig;
import org.red5.io.rtp.model.MediaFrame;
import org.red5.io.rtp.model.MediaType;
import org.red5.io.rtp.packet.AudioCodec;
import org.red5.io.rtp.packet.CodecConfig;
import org.red5.io.rtp.packet.GenericPacketizerFactory;
import org.red5.io.rtp.packet.Packetizer;
import org.red5.io.rtp.packet.PacketizerFactory;
import org.red5.io.rtp.packet.VideoCodec;
import org.red5.io.rtp.rtcp.NullSenderReport;
import org.red5.io.rtp.rtcp.SenderReportFactory;
import org.red5.io.rtp.rtcp.SenderReportGenerator;
import org.red5.io.rtp.transport.Protocol;
import org.red5.io.rtp.transport.RtpEndpoints;
import org.red5.io.rtp.transport.RtpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sends encoded audio and video frames as RTP over an RTSP session.
 * <p>
 * Frames handed to {@link #sendMediaFrame(MediaFrame)} are buffered in a bounded queue and written by a
 * background transmission loop, while a second task samples the outgoing bitrate. When the queue is full
 * new frames are discarded and counted as dropped; callers can watch {@link #hasCongestion(float)} to slow
 * their encoder down.
 * <p>
 * Lifecycle methods ({@code start}, {@code stop}, configuration setters) are expected to be called from one
 * controlling thread; {@code sendMediaFrame} and the diagnostics getters may be called from any thread.
 */
public class RtpSender {
    private static final Logger logger = LoggerFactory.getLogger(RtpSender.class);

    private static final AtomicInteger SESSION_IDS = new AtomicInteger();

    private final ConnectionChecker connectChecker;
    private final PacketizerFactory packetizerFactory;
    private final SenderReportFactory senderReportFactory;
    private final SenderConfig config;
    private final BitrateEstimator bitrateManager;

    private final FrameQueue queue;
    private final FrameCounters counters = new FrameCounters();
    private final ReentrantLock lifecycle = new ReentrantLock();
    private final Set<Thread> senderThreads = ConcurrentHashMap.newKeySet();

    private VideoCodec videoCodec = VideoCodec.H264;
    private AudioCodec audioCodec = AudioCodec.AAC;
    private Packetizer videoPacketizer;
    private Packetizer audioPacketizer;
    private RtpTransport rtpTransport;
    private SenderReportGenerator senderReport = NullSenderReport.INSTANCE;

    private volatile boolean running;
    private volatile boolean isEnableLogs;

    private Session session;

    public RtpSender(ConnectionChecker connectChecker) {
        this(connectChecker, new GenericPacketizerFactory(), SenderReportFactory.NONE, SenderConfig.defaults());
    }

    public RtpSender(ConnectionChecker connectChecker, PacketizerFactory packetizerFactory,
                     SenderReportFactory senderReportFactory, SenderConfig config) {
        this(connectChecker, packetizerFactory, senderReportFactory, config, new BitrateManager(connectChecker));
    }

    public RtpSender(ConnectionChecker connectChecker, PacketizerFactory packetizerFactory,
                     SenderReportFactory senderReportFactory, SenderConfig config, BitrateEstimator bitrateEstimator) {
        this.connectChecker = Objects.requireNonNull(connectChecker, "connectChecker");
        this.packetizerFactory = Objects.requireNonNull(packetizerFactory, "packetizerFactory");
        this.senderReportFactory = Objects.requireNonNull(senderReportFactory, "senderReportFactory");
        this.config = Objects.requireNonNull(config, "config").validate();
        this.bitrateManager = Objects.requireNonNull(bitrateEstimator, "bitrateEstimator");
        this.bitrateManager.setExponentialFactor(config.getBitrateExponentialFactor());
        this.queue = new FrameQueue(config.getCacheSize());
        this.isEnableLogs = config.isLogsEnabled();
        this.videoPacketizer = packetizerFactory.createVideoPacketizer(videoCodec);
        this.audioPacketizer = packetizerFactory.createAudioPacketizer(audioCodec);
    }

    /**
     * Create the RTP transport and the sender report generator from the ports negotiated in SETUP.
     * Index 0 of every array is the RTP port, index 1 the RTCP port.
     */
    public void setSocketsInfo(Protocol protocol, String host,
                               int[] videoSourcePorts, int[] audioSourcePorts,
                               int[] videoServerPorts, int[] audioServerPorts) {
        requireStopped("change sockets");
        RtpEndpoints rtp = RtpEndpoints.fromPortPairs(protocol, host, 0,
                videoSourcePorts, audioSourcePorts, videoServerPorts, audioServerPorts);
        RtpEndpoints rtcp = RtpEndpoints.fromPortPairs(protocol, host, 1,
                videoSourcePorts, audioSourcePorts, videoServerPorts, audioServerPorts);
        rtpTransport = RtpTransport.getInstance(rtp, config.getWriteTimeoutMillis());
        senderReport = Objects.requireNonNull(senderReportFactory.create(rtcp), "senderReport");
        logger.debug("Sockets configured: rtp={}, rtcp={}", rtp, rtcp);
    }

    /**
     * Use an already built transport instead of {@link #setSocketsInfo}.
     */
    public void setTransport(RtpTransport transport) {
        requireStopped("change transport");
        this.rtpTransport = Objects.requireNonNull(transport, "transport");
    }

    public void setSenderReport(SenderReportGenerator senderReport) {
        requireStopped("change sender report");
        this.senderReport = Objects.requireNonNull(senderReport, "senderReport");
    }

    /**
     * Hand over the RTSP connection, used when RTP is interleaved on it.
     */
    public void setSocket(Channel channel) throws IOException {
        if (rtpTransport == null) {
            throw new IllegalStateException("Sockets info must be set before the socket");
        }
        rtpTransport.setChannel(channel);
        senderReport.setChannel(channel);
    }

    public void setVideoCodec(VideoCodec videoCodec) {
        this.videoCodec = Objects.requireNonNull(videoCodec, "videoCodec");
    }

    public void setAudioCodec(AudioCodec audioCodec) {
        this.audioCodec = Objects.requireNonNull(audioCodec, "audioCodec");
    }

    public VideoCodec getVideoCodec() {
        return videoCodec;
    }

    public AudioCodec getAudioCodec() {
        return audioCodec;
    }

    /**
     * Select and configure the video packetizer for the current video codec.
     *
     * @throws IllegalArgumentException if a parameter set required by the codec is missing
     */
    public void setVideoInfo(byte[] sps, byte[] pps, byte[] vps) {
        requireStopped("change video info");
        if (sps == null) {
            throw new IllegalArgumentException("sps can't be null");
        }
        switch (videoCodec) {
            case H264:
                if (pps == null) {
                    throw new IllegalArgumentException("pps can't be null with h264");
                }
                break;
            case H265:
                if (vps == null || pps == null) {
                    throw new IllegalArgumentException("pps or vps can't be null with h265");
                }
                break;
            default:
                break;
        }
        Packetizer packetizer = packetizerFactory.createVideoPacketizer(videoCodec);
        packetizer.configure(new CodecConfig.Video(videoCodec, sps, pps, vps));
        videoPacketizer = packetizer;
    }

    /**
     * Select and configure the audio packetizer for the current audio codec.
     */
    public void setAudioInfo(int sampleRate) {
        requireStopped("change audio info");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be > 0: " + sampleRate);
        }
        Packetizer packetizer = packetizerFactory.createAudioPacketizer(audioCodec);
        packetizer.configure(new CodecConfig.Audio(audioCodec, sampleRate));
        audioPacketizer = packetizer;
    }

    /**
     * Queue a frame for transmission. Never blocks; ignored while the sender is not running.
     * <p>
     * The sender takes ownership of the frame payload and releases it once it is sent, discarded or cleared.
     */
    public void sendMediaFrame(MediaFrame mediaFrame) {
        if (!running) {
            mediaFrame.release();
            return;
        }
        if (!queue.offer(mediaFrame)) {
            MediaType type = mediaFrame.getType();
            counters.dropped(type);
            mediaFrame.release();
            logger.info("{} frame discarded", type == MediaType.VIDEO ? "Video" : "Audio");
        }
    }

    public void start() {
        lifecycle.lock();
        try {
            doStart();
        } finally {
            lifecycle.unlock();
        }
    }

    private void doStart() {
        if (session != null) {
            throw new IllegalStateException("Sender already started, stop it first");
        }
        if (rtpTransport == null) {
            throw new IllegalStateException("Transport not configured, call setSocketsInfo first");
        }
        bitrateManager.reset();
        queue.clear();
        long ssrcVideo = ThreadLocalRandom.current().nextInt() & 0xFFFFFFFFL;
        long ssrcAudio = ThreadLocalRandom.current().nextInt() & 0xFFFFFFFFL;
        senderReport.setSSRC(ssrcVideo, ssrcAudio);
        videoPacketizer.setSSRC(ssrcVideo);
        audioPacketizer.setSSRC(ssrcAudio);
        running = true;

        Session s = new Session(senderThreads);
        TransmissionLoop loop = new TransmissionLoop(queue, videoPacketizer, audioPacketizer, rtpTransport,
                senderReport, counters, s.bytesSent, config.getPollTimeoutMillis(),
                () -> running, () -> isEnableLogs, reason -> onTransmissionFailure(s, reason));
        long interval = config.getBitrateIntervalMillis();
        s.transmission = s.executor.submit(loop);
        s.sampling = s.executor.scheduleAtFixedRate(new BitrateSampler(s.bytesSent, bitrateManager),
                interval, interval, TimeUnit.MILLISECONDS);
        session = s;
        logger.info("RTP sender started: ssrcVideo={}, ssrcAudio={}, protocol={}",
                ssrcVideo, ssrcAudio, rtpTransport.getProtocol());
    }

    /**
     * Stop sending. When this returns both background tasks have ended, the transport is closed and all
     * counters are reset. Calling it while stopped only resets state.
     * <p>
     * From a {@link ConnectionChecker} callback this returns without waiting when another thread is already
     * stopping the sender; that thread joins the callback thread.
     */
    public void stop() {
        if (senderThreads.contains(Thread.currentThread())) {
            if (!lifecycle.tryLock()) {
                running = false;
                logger.debug("Stop already in progress on another thread");
                return;
            }
        } else {
            lifecycle.lock();
        }
        try {
            doStop();
        } finally {
            lifecycle.unlock();
        }
    }

    private void doStop() {
        running = false;
        Session s = session;
        session = null;
        // closing first unblocks a loop stuck writing to a stalled connection
        senderReport.close();
        if (rtpTransport != null) {
            rtpTransport.close();
        }
        if (s != null) {
            s.cancelAndJoin(config.getPollTimeoutMillis() + config.getWriteTimeoutMillis());
        }
        senderReport.reset();
        audioPacketizer.reset();
        videoPacketizer.reset();
        counters.resetAll();
        queue.clear();
        if (s != null) {
            logger.info("RTP sender stopped");
        }
    }

    public boolean isRunning() {
        return running;
    }

    private void onTransmissionFailure(Session s, String reason) {
        running = false;
        s.sampling.cancel(false);
        connectChecker.onConnectionFailed(reason);
    }

    public boolean hasCongestion() {
        return hasCongestion(20f);
    }

    /**
     * @param percentUsed occupancy threshold, 0 to 100
     * @throws IllegalArgumentException if the threshold is out of range
     */
    public boolean hasCongestion(float percentUsed) {
        return queue.hasCongestion(percentUsed);
    }

    /**
     * @throws IllegalStateException if more frames are buffered than {@code newSize}
     */
    public void resizeCache(int newSize) {
        queue.resize(newSize);
        logger.debug("Cache resized to {}", newSize);
    }

    public int getCacheSize() {
        return queue.capacity();
    }

    public int getItemsInCache() {
        return queue.size();
    }

    public void clearCache() {
        queue.clear();
    }

    public long getSentAudioFrames() {
        return counters.getAudioFramesSent();
    }

    public long getSentVideoFrames() {
        return counters.getVideoFramesSent();
    }

    public long getDroppedAudioFrames() {
        return counters.getDroppedAudioFrames();
    }

    public long getDroppedVideoFrames() {
        return counters.getDroppedVideoFrames();
    }

    public void resetSentAudioFrames() {
        counters.resetSentAudio();
    }

    public void resetSentVideoFrames() {
        counters.resetSentVideo();
    }

    public void resetDroppedAudioFrames() {
        counters.resetDroppedAudio();
    }

    public void resetDroppedVideoFrames() {
        counters.resetDroppedVideo();
    }

    public void setLogs(boolean enable) {
        isEnableLogs = enable;
    }

    public void setBitrateExponentialFactor(float factor) {
        bitrateManager.setExponentialFactor(factor);
    }

    public float getBitrateExponentialFactor() {
        return bitrateManager.getExponentialFactor();
    }

    public SenderStatistics getStatistics() {
        return new SenderStatistics(running, getCacheSize(), getItemsInCache(),
                getSentVideoFrames(), getSentAudioFrames(),
                getDroppedVideoFrames(), getDroppedAudioFrames(),
                bitrateManager.getBitrate());
    }

    private void requireStopped(String action) {
        lifecycle.lock();
        try {
            if (session != null) {
                throw new IllegalStateException("Can't " + action + " while the sender is started");
            }
        } finally {
            lifecycle.unlock();
        }
    }

    /**
     * Background work of one start/stop cycle.
     */
    private static final class Session {
        final ScheduledExecutorService executor;
        final AtomicLong bytesSent = new AtomicLong();
        final Set<Thread> threads;
        Future<?> transmission;
        ScheduledFuture<?> sampling;

        Session(Set<Thread> threads) {
            this.threads = threads;
            int id = SESSION_IDS.incrementAndGet();
            AtomicInteger count = new AtomicInteger();
            ThreadFactory factory = r -> {
                Thread t = new Thread(() -> {
                    try {
                        r.run();
                    } finally {
                        threads.remove(Thread.currentThread());
                    }
                }, "rtp-sender-" + id + "-" + count.incrementAndGet());
                t.setDaemon(true);
                threads.add(t);
                return t;
            };
            this.executor = Executors.newScheduledThreadPool(2, factory);
        }

        void cancelAndJoin(long timeoutMillis) {
            sampling.cancel(true);
            transmission.cancel(true);
            executor.shutdownNow();
            if (threads.contains(Thread.currentThread())) {
                // stop() called from a callback on one of our own threads, it ends when the callback returns
                logger.debug("Stop requested from a sender thread, not waiting for it");
                return;
            }
            try {
                while (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                    logger.warn("Still waiting for sender tasks to finish");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for sender tasks to finish");
            }
        }
    }
}
