package org.red5.io.rtp.packet;

import java.util.Arrays;

/**
 * Codec specific parameters handed to a {@link Packetizer} when it is configured.
 */
public sealed interface CodecConfig permits CodecConfig.Video, CodecConfig.Audio {

    /**
     * Parameter sets of a video stream. {@code pps} and {@code vps} are absent for codecs that do not use them.
     */
    record Video(VideoCodec codec, byte[] sps, byte[] pps, byte[] vps) implements CodecConfig {
        @Override
        public String toString() {
            return "Video{codec=" + codec +
                    ", sps=" + (sps != null ? sps.length : 0) +
                    ", pps=" + (pps != null ? pps.length : 0) +
                    ", vps=" + (vps != null ? vps.length : 0) + '}';
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Video other)) {
                return false;
            }
            return codec == other.codec && Arrays.equals(sps, other.sps)
                    && Arrays.equals(pps, other.pps) && Arrays.equals(vps, other.vps);
        }

        @Override
        public int hashCode() {
            int result = codec.hashCode();
            result = 31 * result + Arrays.hashCode(sps);
            result = 31 * result + Arrays.hashCode(pps);
            result = 31 * result + Arrays.hashCode(vps);
            return result;
        }
    }

    record Audio(AudioCodec codec, int sampleRate) implements CodecConfig {}
}
