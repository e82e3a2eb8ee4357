package org.red5.io.rtp.transport;

import io.netty.channel.ChannelFuture;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Base for transports writing through Netty channels. Writes are queued on the channel and the last
 * pending write is awaited on flush, so a broken connection surfaces as an {@link IOException} to the caller.
 */
abstract class NettyRtpTransport implements RtpTransport {

    private final long writeTimeoutMillis;
    private ChannelFuture lastWrite;

    protected NettyRtpTransport(long writeTimeoutMillis) {
        if (writeTimeoutMillis <= 0) {
            throw new IllegalArgumentException("writeTimeoutMillis must be > 0: " + writeTimeoutMillis);
        }
        this.writeTimeoutMillis = writeTimeoutMillis;
    }

    protected void track(ChannelFuture future) throws IOException {
        // fail fast when an earlier write of the same batch already failed
        if (future.isDone() && !future.isSuccess()) {
            throw new IOException("Write failed: " + future.cause().getMessage(), future.cause());
        }
        lastWrite = future;
    }

    protected void awaitPendingWrite() throws IOException {
        ChannelFuture future = lastWrite;
        lastWrite = null;
        if (future == null) {
            return;
        }
        boolean done;
        try {
            done = future.await(writeTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while flushing", e);
        }
        if (!done) {
            throw new IOException("Write timed out after " + writeTimeoutMillis + " ms");
        }
        if (!future.isSuccess()) {
            Throwable cause = future.cause();
            throw new IOException("Write failed: " + (cause != null ? cause.getMessage() : "cancelled"), cause);
        }
    }

    protected void forgetPendingWrite() {
        lastWrite = null;
    }
}
