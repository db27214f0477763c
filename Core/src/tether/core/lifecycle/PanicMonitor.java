package tether.core.lifecycle;

import tether.core.util.ObjectChecker;

/**
 * A monitor shared by every suite worker of a run, through which a worker reports an unexpected error that escaped
 * everything it knows how to handle. Such an error is a defect of the harness itself, not a failing test, and the run
 * is treated as broken once it is reported.
 *
 * Only the first panic is kept, since any subsequent panics will be handled the same way.
 *
 * This class is thread-safe and is intended to be used by multiple classes.
 */
public final class PanicMonitor {
    private final Object monitor = new Object();
    private Throwable panic = null;

    /**
     * Registers the given error as a panic unless one was already registered.
     *
     * @param error the fatal error.
     */
    public void panic(Throwable error) {
        ObjectChecker.assertNonNull(error);

        synchronized (this.monitor) {
            if (this.panic == null) {
                this.panic = error;
                this.monitor.notifyAll();
            }
        }
    }

    /**
     * Returns true if and only if a panic was registered with this monitor.
     */
    public boolean hasPanicked() {
        synchronized (this.monitor) {
            return this.panic != null;
        }
    }

    /**
     * Returns the cause of the panic if a panic was registered with this monitor, null otherwise.
     */
    public Throwable getCauseOfPanic() {
        synchronized (this.monitor) {
            return this.panic;
        }
    }
}
