package org.red5.io.rtp.rtcp;

import org.red5.io.rtp.transport.RtpEndpoints;

/**
 * Creates the sender report generator for the RTCP flow of a session.
 */
@FunctionalInterface
public interface SenderReportFactory {

    SenderReportFactory NONE = endpoints -> NullSenderReport.INSTANCE;

    SenderReportGenerator create(RtpEndpoints rtcpEndpoints);
}
