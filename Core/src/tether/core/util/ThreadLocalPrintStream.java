package tether.core.util;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

/**
 * A print stream that delegates to an underlying {@link ThreadLocal} print stream, so that each thread has its own
 * print stream.
 *
 * Every thread initially prints to the stream this one replaced. A suite worker that is about to run a test case sets
 * its own private stream so that whatever the case prints is captured with its result rather than written over the
 * live results on the console, and restores the initial stream once the case is done.
 */
public final class ThreadLocalPrintStream extends PrintStream {
    private final ThreadLocal<PrintStream> stream;
    private final PrintStream initialStream;

    private ThreadLocalPrintStream(PrintStream initialStream) {
        super(new ByteArrayOutputStream());

        if (initialStream == null) {
            throw new NullPointerException("initialStream must be non-null.");
        }

        this.stream = ThreadLocal.withInitial(() -> initialStream);
        this.initialStream = initialStream;
    }

    /**
     * Constructs a new thread local print stream. Every thread will inherit the specified stream as their initial
     * print stream that they will output to.
     *
     * @param stream The initial stream.
     * @return the new stream.
     */
    public static ThreadLocalPrintStream withInitialStream(PrintStream stream) {
        return new ThreadLocalPrintStream(stream);
    }

    /**
     * Sets the stream for this specific thread.
     *
     * @param stream The new stream for this thread.
     */
    public void setStream(PrintStream stream) {
        ObjectChecker.assertNonNull(stream);
        this.stream.set(stream);
    }

    /**
     * Restores the initial stream for this specific thread.
     */
    public void restoreInitialStream() {
        this.stream.set(this.initialStream);
    }

    @Override
    public void write(int b) {
        this.stream.get().write(b);
    }

    @Override
    public void write(byte[] buf, int off, int len) {
        this.stream.get().write(buf, off, len);
    }

    @Override
    public void flush() {
        this.stream.get().flush();
    }

    @Override
    public void close() {
        // The shared initial stream belongs to the JVM and is never closed through here.
        PrintStream current = this.stream.get();
        if (current != this.initialStream) {
            current.close();
        }
    }
}
