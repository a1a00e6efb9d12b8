package org.agenticscript.runtime.bus;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The inbox of one agent. It keeps asks and tells in separate FIFO lanes and always serves
 * queued asks first.
 */
public class Mailbox {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Deque<Message> asks = new ArrayDeque<>();
    private final Deque<Message> tells = new ArrayDeque<>();

    /**
     * Adds a message to the lane of its kind and wakes a waiting consumer.
     * @param message The message to enqueue.
     */
    public void put(Message message) {
        lock.lock();
        try {
            (message.getKind() == MessageKind.ASK ? asks : tells).addLast(message);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the next message, blocking until one is available.
     * @return The oldest ask if any is queued, otherwise the oldest tell.
     * @throws InterruptedException if interrupted while waiting.
     */
    public Message take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (asks.isEmpty() && tells.isEmpty()) {
                notEmpty.await();
            }
            return next();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the next message, waiting at most the given time.
     * @return The next message, or null if none arrived in time.
     * @throws InterruptedException if interrupted while waiting.
     */
    public Message poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (asks.isEmpty() && tells.isEmpty()) {
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return next();
        } finally {
            lock.unlock();
        }
    }

    private Message next() {
        return asks.isEmpty() ? tells.pollFirst() : asks.pollFirst();
    }

    public int size() {
        lock.lock();
        try {
            return asks.size() + tells.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
