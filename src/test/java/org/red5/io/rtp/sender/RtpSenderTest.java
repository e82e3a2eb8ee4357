package org.red5.io.rtp.sender;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.red5.io.rtp.config.SenderConfig;
import org.red5.io.rtp.model.MediaFrame;
import org.red5.io.rtp.model.RtpFrame;
import org.red5.io.rtp.packet.AudioCodec;
import org.red5.io.rtp.packet.CodecConfig;
import org.red5.io.rtp.packet.VideoCodec;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class RtpSenderTest {

    private FakeRtpTransport transport;
    private RecordingPacketizerFactory packetizers;
    private RecordingSenderReport senderReport;
    private RecordingConnectionChecker checker;
    private RecordingBitrateEstimator estimator;
    private RtpSender sender;

    @BeforeEach
    void setUp() {
        transport = new FakeRtpTransport();
        packetizers = new RecordingPacketizerFactory(1);
        senderReport = new RecordingSenderReport(1000);
        checker = new RecordingConnectionChecker();
        estimator = new RecordingBitrateEstimator();
        sender = newSender(checker, new SenderConfig().setPollTimeoutMillis(100).setLogsEnabled(false));
    }

    @AfterEach
    void tearDown() {
        transport.release();
        sender.stop();
    }

    private RtpSender newSender(ConnectionChecker connectionChecker, SenderConfig config) {
        RtpSender s = new RtpSender(connectionChecker, packetizers, endpoints -> senderReport, config, estimator);
        s.setTransport(transport);
        s.setSenderReport(senderReport);
        return s;
    }

    private static MediaFrame video(int marker) {
        return MediaFrame.video(Unpooled.wrappedBuffer(new byte[]{(byte) marker, 1, 2, 3}), marker * 33_333L, false);
    }

    private static MediaFrame audio(int marker) {
        return MediaFrame.audio(Unpooled.wrappedBuffer(new byte[]{(byte) marker, 9}), marker * 21_333L);
    }

    private static void await(BooleanSupplier condition, String message) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting: " + message);
            }
            Thread.sleep(10);
        }
    }

    @Test
    void framesOfferedWhileStoppedAreIgnored() {
        sender.sendMediaFrame(video(1));
        sender.sendMediaFrame(audio(1));

        assertEquals(0, sender.getItemsInCache());
        assertEquals(0, sender.getDroppedVideoFrames());
        assertEquals(0, sender.getDroppedAudioFrames());
    }

    @Test
    void startRequiresTransportAndIdleState() {
        RtpSender unconfigured = new RtpSender(checker, packetizers, endpoints -> senderReport,
                SenderConfig.defaults(), estimator);
        assertThrows(IllegalStateException.class, unconfigured::start);

        sender.start();
        assertThrows(IllegalStateException.class, sender::start);
        assertThrows(IllegalStateException.class, () -> sender.setTransport(new FakeRtpTransport()));
    }

    @Test
    void stopWhileIdleIsHarmless() {
        sender.stop();
        sender.stop();
        assertFalse(sender.isRunning());
    }

    @Test
    void transmitsFramesInFifoOrderAndPacketsInPacketizerOrder() throws Exception {
        packetizers = new RecordingPacketizerFactory(2);
        sender = newSender(checker, new SenderConfig().setPollTimeoutMillis(100).setLogsEnabled(false));
        sender.start();

        for (int i = 0; i < 5; i++) {
            sender.sendMediaFrame(video(i));
        }
        await(() -> transport.sent().size() == 10, "10 packets");

        List<RtpFrame> sent = transport.sent();
        for (int k = 0; k < sent.size(); k++) {
            byte[] buffer = sent.get(k).getBuffer();
            assertEquals(k % 2, buffer[0], "packet index within frame");
            assertEquals(k / 2, buffer[1], "frame order");
        }
        await(() -> sender.getSentVideoFrames() == 5, "5 frames counted");
        assertEquals(5, transport.flushes(), "one flush per frame");
    }

    @Test
    void countsSentFramesPerMediaType() throws Exception {
        sender.start();
        sender.sendMediaFrame(video(0));
        sender.sendMediaFrame(audio(0));
        sender.sendMediaFrame(video(1));
        sender.sendMediaFrame(audio(1));
        sender.sendMediaFrame(video(2));

        await(() -> sender.getSentVideoFrames() + sender.getSentAudioFrames() == 5, "5 frames sent");
        assertEquals(3, sender.getSentVideoFrames());
        assertEquals(2, sender.getSentAudioFrames());
        assertTrue(transport.sent().get(1).getLength() > 0);
        assertFalse(transport.sent().get(1).isVideoFrame());
    }

    @Test
    void dropsOverflowWhenTransportStalls() throws Exception {
        transport.stall();
        sender.start();

        for (int i = 0; i < 250; i++) {
            sender.sendMediaFrame(video(i));
        }

        long dropped = sender.getDroppedVideoFrames();
        int buffered = sender.getItemsInCache();
        assertTrue(dropped >= 0 && dropped <= 50, "dropped=" + dropped);
        assertTrue(buffered <= 200, "buffered=" + buffered);
        // at most one frame is held by the stalled transmission loop
        long accounted = dropped + buffered;
        assertTrue(accounted == 250 || accounted == 249, "accounted=" + accounted);
        assertEquals(0, sender.getDroppedAudioFrames());

        assertTrue(transport.awaitFirstSend(5, TimeUnit.SECONDS));
        while (sender.getItemsInCache() < 200) {
            sender.sendMediaFrame(video(250));
        }
        long droppedVideo = sender.getDroppedVideoFrames();
        sender.sendMediaFrame(audio(0));
        assertEquals(1, sender.getDroppedAudioFrames());
        assertEquals(droppedVideo, sender.getDroppedVideoFrames());
    }

    @Test
    void stopJoinsTasksAndResetsEverything() throws Exception {
        transport.stall();
        sender.start();
        for (int i = 0; i < 10; i++) {
            sender.sendMediaFrame(video(i));
        }
        assertTrue(transport.awaitFirstSend(5, TimeUnit.SECONDS));
        await(() -> sender.getItemsInCache() == 9, "first frame taken");
        sender.resizeCache(10);
        assertThrows(IllegalStateException.class, () -> sender.resizeCache(5));
        sender.sendMediaFrame(video(99));

        sender.stop();

        assertFalse(sender.isRunning());
        assertEquals(0, sender.getItemsInCache());
        assertEquals(0, sender.getSentVideoFrames());
        assertEquals(0, sender.getSentAudioFrames());
        assertEquals(0, sender.getDroppedVideoFrames());
        assertEquals(0, sender.getDroppedAudioFrames());
        assertEquals(1, transport.closes());
        assertEquals(1, senderReport.closes());
        assertTrue(senderReport.resets() >= 1);
        assertEquals(1, packetizers.lastVideo().resets());
        assertEquals(1, packetizers.lastAudio().resets());
        assertTrue(checker.failures().isEmpty(), "stop must not be reported as a failure");

        int sentAtStop = transport.sent().size();
        sender.sendMediaFrame(video(100));
        Thread.sleep(250);
        assertEquals(sentAtStop, transport.sent().size());
        assertEquals(0, sender.getItemsInCache());
    }

    @Test
    void resizePreservesBufferedFramesInOrder() throws Exception {
        transport.stall();
        sender.start();
        sender.sendMediaFrame(video(0));
        assertTrue(transport.awaitFirstSend(5, TimeUnit.SECONDS));
        for (int i = 1; i <= 10; i++) {
            sender.sendMediaFrame(video(i));
        }
        assertEquals(10, sender.getItemsInCache());

        assertThrows(IllegalStateException.class, () -> sender.resizeCache(5));
        assertEquals(200, sender.getCacheSize());
        sender.resizeCache(10);
        sender.resizeCache(50);
        assertEquals(50, sender.getCacheSize());
        assertEquals(10, sender.getItemsInCache());

        transport.release();
        await(() -> transport.sent().size() == 11, "11 packets");
        List<RtpFrame> sent = transport.sent();
        for (int i = 0; i < sent.size(); i++) {
            assertEquals(i, sent.get(i).getBuffer()[1]);
        }
    }

    @Test
    void congestionFollowsOccupancy() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> sender.hasCongestion(-1f));
        assertThrows(IllegalArgumentException.class, () -> sender.hasCongestion(100.5f));
        assertFalse(sender.hasCongestion());
        assertTrue(sender.hasCongestion(0f));

        transport.stall();
        sender.start();
        sender.sendMediaFrame(video(0));
        assertTrue(transport.awaitFirstSend(5, TimeUnit.SECONDS));
        for (int i = 1; i <= 40; i++) {
            sender.sendMediaFrame(video(i));
        }
        // 40 of 200
        assertTrue(sender.hasCongestion(20f));
        assertFalse(sender.hasCongestion(21f));
    }

    @Test
    void transmissionFailureIsReportedOnceAndStopsTheSession() throws Exception {
        transport.failSends(true);
        sender.start();
        sender.sendMediaFrame(video(0));

        assertTrue(checker.awaitFailure(5, TimeUnit.SECONDS));
        await(() -> !sender.isRunning(), "sender stopped");
        sender.sendMediaFrame(video(1));
        sender.sendMediaFrame(video(2));
        Thread.sleep(250);

        assertEquals(List.of("Error send packet, Broken pipe"), checker.failures());
        assertEquals(0, sender.getItemsInCache());
        assertThrows(IllegalStateException.class, sender::start, "explicit stop required");

        sender.stop();
        transport.reopen();
        sender.start();
        sender.sendMediaFrame(video(3));
        await(() -> sender.getSentVideoFrames() == 1, "frame sent after restart");
        assertEquals(1, checker.failures().size());
    }

    @Test
    void stopFromTheFailureCallbackWhileAnotherThreadIsStopping() throws Exception {
        AtomicReference<RtpSender> ref = new AtomicReference<>();
        CountDownLatch callbackEntered = new CountDownLatch(1);
        ConnectionChecker slowStopping = reason -> {
            callbackEntered.countDown();
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ref.get().stop();
        };
        RtpSender s = newSender(slowStopping, new SenderConfig().setPollTimeoutMillis(100).setLogsEnabled(false));
        ref.set(s);
        transport.failSends(true);

        s.start();
        s.sendMediaFrame(video(0));
        assertTrue(callbackEntered.await(5, TimeUnit.SECONDS));

        Thread stopper = new Thread(s::stop, "test-stopper");
        stopper.start();
        stopper.join(5000);

        assertFalse(stopper.isAlive(), "stop() must return");
        assertFalse(s.isRunning());
        transport.reopen();
        s.start();
        s.stop();
    }

    @Test
    void payloadsAreReleasedWhenSentDroppedOrCleared() throws Exception {
        sender = newSender(checker, new SenderConfig()
                .setCacheSize(1)
                .setPollTimeoutMillis(100)
                .setLogsEnabled(false));
        ByteBuf ignored = pooled();
        sender.sendMediaFrame(MediaFrame.video(ignored, 0, true));
        assertEquals(0, ignored.refCnt(), "offered while stopped");

        transport.stall();
        sender.start();
        ByteBuf sent = pooled();
        sender.sendMediaFrame(MediaFrame.video(sent, 0, true));
        assertTrue(transport.awaitFirstSend(5, TimeUnit.SECONDS));
        ByteBuf buffered = pooled();
        sender.sendMediaFrame(MediaFrame.video(buffered, 1, false));
        ByteBuf dropped = pooled();
        sender.sendMediaFrame(MediaFrame.video(dropped, 2, false));

        assertEquals(0, sent.refCnt(), "packetized");
        assertEquals(0, dropped.refCnt(), "dropped");
        assertEquals(1, buffered.refCnt());
        assertEquals(1, sender.getDroppedVideoFrames());

        sender.stop();
        assertEquals(0, buffered.refCnt(), "cleared on stop");
    }

    private static ByteBuf pooled() {
        ByteBuf buf = PooledByteBufAllocator.DEFAULT.directBuffer(64);
        buf.writeBytes(new byte[]{1, 2, 3, 4});
        return buf;
    }

    @Test
    void countersSurviveAFailedSessionUntilStop() throws Exception {
        sender = newSender(checker, new SenderConfig()
                .setCacheSize(1)
                .setPollTimeoutMillis(100)
                .setLogsEnabled(false));
        sender.start();
        sender.sendMediaFrame(video(0));
        await(() -> sender.getSentVideoFrames() == 1, "video sent");
        sender.sendMediaFrame(audio(0));
        await(() -> sender.getSentAudioFrames() == 1, "audio sent");

        transport.stall();
        sender.sendMediaFrame(video(1));
        await(() -> transport.sendAttempts() == 3, "loop blocked on the transport");
        sender.sendMediaFrame(video(2));
        sender.sendMediaFrame(video(3));
        sender.sendMediaFrame(audio(1));
        transport.failSends(true);
        transport.release();
        assertTrue(checker.awaitFailure(5, TimeUnit.SECONDS));

        // a rejected start leaves the totals alone
        assertThrows(IllegalStateException.class, sender::start);
        assertEquals(1, sender.getSentVideoFrames());
        assertEquals(1, sender.getSentAudioFrames());
        assertEquals(1, sender.getDroppedVideoFrames());
        assertEquals(1, sender.getDroppedAudioFrames());

        sender.stop();
        assertEquals(0, sender.getSentVideoFrames());
        assertEquals(0, sender.getDroppedAudioFrames());

        transport.reopen();
        sender.start();
        assertEquals(0, sender.getSentVideoFrames());
        assertEquals(0, sender.getDroppedVideoFrames());
    }

    @Test
    void droppedCountersResetIndividually() throws Exception {
        sender = newSender(checker, new SenderConfig()
                .setCacheSize(1)
                .setPollTimeoutMillis(100)
                .setLogsEnabled(false));
        transport.stall();
        sender.start();
        sender.sendMediaFrame(video(0));
        assertTrue(transport.awaitFirstSend(5, TimeUnit.SECONDS));
        sender.sendMediaFrame(video(1));
        sender.sendMediaFrame(video(2));
        sender.sendMediaFrame(audio(0));
        sender.sendMediaFrame(audio(1));
        assertEquals(1, sender.getDroppedVideoFrames());
        assertEquals(2, sender.getDroppedAudioFrames());

        sender.resetDroppedVideoFrames();
        assertEquals(0, sender.getDroppedVideoFrames());
        assertEquals(2, sender.getDroppedAudioFrames());

        sender.sendMediaFrame(video(3));
        sender.resetDroppedAudioFrames();
        assertEquals(0, sender.getDroppedAudioFrames());
        assertEquals(1, sender.getDroppedVideoFrames());
    }

    @Test
    void stopCanBeCalledFromTheFailureCallback() throws Exception {
        AtomicReference<RtpSender> ref = new AtomicReference<>();
        CountDownLatch stopped = new CountDownLatch(1);
        ConnectionChecker stopping = reason -> {
            ref.get().stop();
            stopped.countDown();
        };
        RtpSender s = newSender(stopping, new SenderConfig().setPollTimeoutMillis(100).setLogsEnabled(false));
        ref.set(s);
        transport.failSends(true);

        s.start();
        s.sendMediaFrame(audio(0));

        assertTrue(stopped.await(5, TimeUnit.SECONDS));
        assertFalse(s.isRunning());
        transport.reopen();
        s.start();
        s.stop();
    }

    @Test
    void startPropagatesTheSameSsrcToPacketizersAndReports() {
        sender.start();

        long video = packetizers.lastVideo().ssrc();
        long audio = packetizers.lastAudio().ssrc();
        assertEquals(video, senderReport.ssrcVideo());
        assertEquals(audio, senderReport.ssrcAudio());
        assertTrue(video >= 0 && video <= 0xFFFFFFFFL);
        assertTrue(audio >= 0 && audio <= 0xFFFFFFFFL);
        assertEquals(1, estimator.resets());
    }

    @Test
    void videoInfoIsValidatedForTheSelectedCodec() {
        byte[] sps = {0x67, 0x42};
        byte[] pps = {0x68, 0x01};
        byte[] vps = {0x40, 0x01};

        sender.setVideoCodec(VideoCodec.H264);
        assertThrows(IllegalArgumentException.class, () -> sender.setVideoInfo(sps, null, null));
        sender.setVideoInfo(sps, pps, null);
        assertEquals(new CodecConfig.Video(VideoCodec.H264, sps, pps, null), packetizers.lastVideo().config());

        sender.setVideoCodec(VideoCodec.H265);
        assertThrows(IllegalArgumentException.class, () -> sender.setVideoInfo(sps, pps, null));
        assertThrows(IllegalArgumentException.class, () -> sender.setVideoInfo(sps, null, vps));
        sender.setVideoInfo(sps, pps, vps);

        sender.setVideoCodec(VideoCodec.AV1);
        sender.setVideoInfo(sps, null, null);
        assertEquals(VideoCodec.AV1, ((CodecConfig.Video) packetizers.lastVideo().config()).codec());
    }

    @Test
    void audioInfoConfiguresTheSelectedCodec() {
        sender.setAudioCodec(AudioCodec.OPUS);
        sender.setAudioInfo(48000);
        assertEquals(new CodecConfig.Audio(AudioCodec.OPUS, 48000), packetizers.lastAudio().config());

        assertThrows(IllegalArgumentException.class, () -> sender.setAudioInfo(0));
    }

    @Test
    void codecInfoCannotChangeWhileStarted() {
        sender.start();
        assertThrows(IllegalStateException.class, () -> sender.setAudioInfo(44100));
        assertThrows(IllegalStateException.class,
                () -> sender.setVideoInfo(new byte[]{1}, new byte[]{2}, null));
    }

    @Test
    void bytesWrittenReachTheBitrateEstimator() throws Exception {
        sender = newSender(checker, new SenderConfig()
                .setPollTimeoutMillis(100)
                .setBitrateIntervalMillis(50)
                .setLogsEnabled(false));
        sender.start();

        for (int i = 0; i < 10; i++) {
            // 124 payload bytes + 1 byte added by the packetizer
            sender.sendMediaFrame(MediaFrame.video(Unpooled.wrappedBuffer(new byte[124]), i, false));
        }

        await(() -> estimator.totalBits() == 10 * 125 * 8, "10000 bits sampled");
    }

    @Test
    void countersCanBeResetIndividually() throws Exception {
        sender.start();
        sender.sendMediaFrame(video(0));
        sender.sendMediaFrame(audio(0));
        await(() -> sender.getSentVideoFrames() == 1 && sender.getSentAudioFrames() == 1, "both sent");

        sender.resetSentVideoFrames();
        assertEquals(0, sender.getSentVideoFrames());
        assertEquals(1, sender.getSentAudioFrames());
        sender.resetSentAudioFrames();
        assertEquals(0, sender.getSentAudioFrames());
    }

    @Test
    void tuningAccessors() {
        sender.setBitrateExponentialFactor(0.5f);
        assertEquals(0.5f, sender.getBitrateExponentialFactor());
        assertEquals(200, sender.getCacheSize());

        String json = sender.getStatistics().toJson();
        assertTrue(json.contains("\"cacheSize\":200"), json);
        assertTrue(json.contains("\"running\":false"), json);
    }
}
