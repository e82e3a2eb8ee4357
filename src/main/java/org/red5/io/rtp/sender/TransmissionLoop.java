package org.red5.io.rtp.sender;

import org.red5.io.rtp.model.MediaFrame;
import org.red5.io.rtp.model.MediaType;
import org.red5.io.rtp.model.RtpFrame;
import org.red5.io.rtp.packet.Packetizer;
import org.red5.io.rtp.rtcp.SenderReportGenerator;
import org.red5.io.rtp.transport.RtpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Single consumer of the frame queue: packetizes each frame, writes the packets, flushes once per frame
 * and feeds the sender report generator. Ends on stop or on the first write failure.
 */
final class TransmissionLoop implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(TransmissionLoop.class);

    private final FrameQueue queue;
    private final Packetizer videoPacketizer;
    private final Packetizer audioPacketizer;
    private final RtpTransport transport;
    private final SenderReportGenerator senderReport;
    private final FrameCounters counters;
    private final AtomicLong bytesSent;
    private final long pollTimeoutMillis;
    private final BooleanSupplier running;
    private final BooleanSupplier logsEnabled;
    private final Consumer<String> onFailure;

    TransmissionLoop(FrameQueue queue, Packetizer videoPacketizer, Packetizer audioPacketizer,
                     RtpTransport transport, SenderReportGenerator senderReport, FrameCounters counters,
                     AtomicLong bytesSent, long pollTimeoutMillis, BooleanSupplier running,
                     BooleanSupplier logsEnabled, Consumer<String> onFailure) {
        this.queue = queue;
        this.videoPacketizer = videoPacketizer;
        this.audioPacketizer = audioPacketizer;
        this.transport = transport;
        this.senderReport = senderReport;
        this.counters = counters;
        this.bytesSent = bytesSent;
        this.pollTimeoutMillis = pollTimeoutMillis;
        this.running = running;
        this.logsEnabled = logsEnabled;
        this.onFailure = onFailure;
    }

    @Override
    public void run() {
        logger.debug("Transmission loop started");
        while (running.getAsBoolean() && !Thread.currentThread().isInterrupted()) {
            MediaFrame frame;
            try {
                frame = queue.poll(pollTimeoutMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (frame == null) {
                continue;
            }
            try {
                send(frame);
            } catch (IOException | RuntimeException e) {
                if (!running.getAsBoolean()) {
                    // transport closed by stop()
                    logger.debug("Send interrupted by stop: {}", describe(e));
                    break;
                }
                logger.error("send error: ", e);
                onFailure.accept("Error send packet, " + describe(e));
                return;
            }
        }
        logger.debug("Transmission loop stopped");
    }

    void send(MediaFrame frame) throws IOException {
        MediaType type = frame.getType();
        Packetizer packetizer = type == MediaType.VIDEO ? videoPacketizer : audioPacketizer;
        List<RtpFrame> rtpFrames;
        try {
            rtpFrames = packetizer.createPackets(frame.getPayload(), frame.getInfo());
        } finally {
            // packets own a copy of the payload
            frame.release();
        }
        int overhead = transport.getHeaderOverhead();
        int size = 0;
        for (RtpFrame rtpFrame : rtpFrames) {
            transport.sendFrame(rtpFrame);
            int packetSize = rtpFrame.getLength() + overhead;
            bytesSent.addAndGet(packetSize);
            size += packetSize;
            if (senderReport.update(rtpFrame)) {
                bytesSent.addAndGet(senderReport.getReportPacketLength() + overhead);
                if (logsEnabled.getAsBoolean()) {
                    logger.info("wrote report");
                }
            }
        }
        if (!rtpFrames.isEmpty()) {
            transport.flush();
        }
        counters.sent(type);
        if (logsEnabled.getAsBoolean()) {
            logger.info("wrote {} packet, size {}", type == MediaType.VIDEO ? "Video" : "Audio", size);
        }
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isEmpty() ? message : error.getClass().getSimpleName();
    }
}
