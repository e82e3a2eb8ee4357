package org.red5.io.rtp.sender;

import org.red5.io.rtp.model.MediaFrame;

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO between the encoder and the transmission loop.
 * <p>
 * Offers never wait: a full queue rejects the frame. The capacity can be changed while frames are flowing;
 * the backing buffer is swapped under the same lock that guards {@link #poll(long, TimeUnit)}.
 */
public class FrameQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    private ArrayDeque<MediaFrame> buffer;
    private int capacity;

    public FrameQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0: " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
    }

    /**
     * Insert a frame if there is room.
     *
     * @return false when the queue is full, the frame is not kept
     */
    public boolean offer(MediaFrame frame) {
        lock.lock();
        try {
            if (buffer.size() >= capacity) {
                return false;
            }
            buffer.addLast(frame);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the oldest frame, waiting up to the given time for one to arrive.
     *
     * @return the frame or null on timeout
     */
    public MediaFrame poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty()) {
                if (nanos <= 0L) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return buffer.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Change the capacity, keeping every buffered frame in order.
     *
     * @throws IllegalStateException if more frames are buffered than {@code newCapacity}
     */
    public void resize(int newCapacity) {
        if (newCapacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0: " + newCapacity);
        }
        lock.lock();
        try {
            if (newCapacity < buffer.size()) {
                throw new IllegalStateException("Can't fit current cache inside new cache size: buffered="
                        + buffer.size() + ", requested=" + newCapacity);
            }
            ArrayDeque<MediaFrame> resized = new ArrayDeque<>(newCapacity);
            MediaFrame frame;
            while ((frame = buffer.pollFirst()) != null) {
                resized.addLast(frame);
            }
            buffer = resized;
            capacity = newCapacity;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether at least {@code percentUsed} percent of the capacity is occupied.
     *
     * @throws IllegalArgumentException if {@code percentUsed} is outside [0, 100]
     */
    public boolean hasCongestion(float percentUsed) {
        if (percentUsed < 0f || percentUsed > 100f || Float.isNaN(percentUsed)) {
            throw new IllegalArgumentException("the value must be in range 0 to 100: " + percentUsed);
        }
        lock.lock();
        try {
            float size = buffer.size();
            float remaining = capacity - buffer.size();
            return size >= (size + remaining) * (percentUsed / 100f);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public int remainingCapacity() {
        lock.lock();
        try {
            return capacity - buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        lock.lock();
        try {
            return capacity;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discard every buffered frame, releasing its payload.
     */
    public void clear() {
        lock.lock();
        try {
            MediaFrame frame;
            while ((frame = buffer.pollFirst()) != null) {
                frame.release();
            }
        } finally {
            lock.unlock();
        }
    }
}
