package org.red5.io.rtp.transport;

import java.util.Objects;

/**
 * Addresses negotiated for one flow (RTP or RTCP) of a session.
 */
public record RtpEndpoints(Protocol protocol, String host,
                           int videoSourcePort, int audioSourcePort,
                           int videoServerPort, int audioServerPort) {

    public RtpEndpoints {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(host, "host");
    }

    /**
     * Pick the RTP (index 0) or RTCP (index 1) flow out of the port pairs returned by SETUP.
     */
    public static RtpEndpoints fromPortPairs(Protocol protocol, String host, int index,
                                             int[] videoSourcePorts, int[] audioSourcePorts,
                                             int[] videoServerPorts, int[] audioServerPorts) {
        return new RtpEndpoints(protocol, host,
                port(videoSourcePorts, index, "videoSourcePorts"), port(audioSourcePorts, index, "audioSourcePorts"),
                port(videoServerPorts, index, "videoServerPorts"), port(audioServerPorts, index, "audioServerPorts"));
    }

    private static int port(int[] ports, int index, String name) {
        Objects.requireNonNull(ports, name);
        if (ports.length <= index) {
            throw new IllegalArgumentException(name + " must contain RTP and RTCP ports, got " + ports.length);
        }
        return ports[index];
    }
}
