package tether.core.util;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * An unbounded, thread-safe queue between one producer and its consumers that the producer closes when it is done.
 *
 * Closing the queue lets a consumer tell "nothing yet" apart from "nothing ever again": once the queue is closed and
 * drained, {@link #take()} returns null immediately. An interrupted consumer never removes an element, whether it was
 * blocked in {@link #take()} or called it with its interrupt already pending.
 */
public final class CloseableBlockingQueue<E> {
    private final Object monitor = new Object();
    private final Deque<E> elements = new ArrayDeque<>();
    private boolean isClosed = false;

    private CloseableBlockingQueue() {}

    public static <E> CloseableBlockingQueue<E> unbounded() {
        return new CloseableBlockingQueue<>();
    }

    /**
     * Appends the element unless the queue is closed.
     *
     * @param element The element to append.
     * @return true iff the element was appended.
     */
    public boolean add(E element) {
        ObjectChecker.assertNonNull(element);

        synchronized (this.monitor) {
            if (this.isClosed) {
                return false;
            }
            this.elements.addLast(element);
            this.monitor.notifyAll();
            return true;
        }
    }

    /**
     * Removes and returns the oldest element, blocking while the queue is empty and open.
     *
     * Elements added before the queue was closed are still returned after it is closed. Once this returns null it
     * always returns null.
     *
     * @return the oldest element, or null if the queue is closed and empty.
     * @throws InterruptedException If interrupted before or while waiting, even when elements are available. Nothing is
     * removed.
     */
    public E take() throws InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException("interrupted before taking an element.");
        }
        synchronized (this.monitor) {
            while (this.elements.isEmpty() && !this.isClosed) {
                this.monitor.wait();
            }
            return this.elements.pollFirst();
        }
    }

    /**
     * Returns true iff this queue is closed and holds no more elements.
     */
    public boolean isExhausted() {
        synchronized (this.monitor) {
            return this.isClosed && this.elements.isEmpty();
        }
    }

    /**
     * Closes this queue for good, waking every blocked consumer.
     */
    public void close() {
        synchronized (this.monitor) {
            this.isClosed = true;
            this.monitor.notifyAll();
        }
    }

    @Override
    public String toString() {
        synchronized (this.monitor) {
            return this.getClass().getSimpleName() + " { size: " + this.elements.size() + ", closed: " + this.isClosed + " }";
        }
    }
}
