package org.red5.io.rtp.rtcp;

import org.red5.io.rtp.model.RtpFrame;

/**
 * Sender report generator that never reports.
 */
public final class NullSenderReport implements SenderReportGenerator {
    public static final NullSenderReport INSTANCE = new NullSenderReport();

    private NullSenderReport() {}

    @Override
    public void setSSRC(long ssrcVideo, long ssrcAudio) {}

    @Override
    public boolean update(RtpFrame frame) {
        return false;
    }

    @Override
    public void reset() {}

    @Override
    public void close() {}
}
