package tether.core.engine;

import tether.core.exception.EndOfStreamException;
import tether.core.exception.EngineNotRunningException;
import tether.core.exception.EngineNotStartedException;
import tether.core.exception.ProcessException;
import tether.core.util.CloseableBlockingQueue;
import tether.core.util.Logger;
import tether.core.util.ObjectChecker;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Owns one external engine process and exposes a line-oriented channel to it.
 *
 * Commands are written to the engine's standard input, newline-terminated and flushed immediately. The engine's
 * standard output (with standard error merged into it) is read one line at a time, strictly forward; every line that
 * is read is appended to a transcript that is never truncated.
 *
 * An engine process is owned by whichever suite or case created it, and that owner must call {@link #terminate()} on
 * every exit path, including failure paths. Terminating is idempotent.
 *
 * This class is thread-safe, but the output is meant to be consumed by one reader at a time.
 */
public final class EngineProcess implements AutoCloseable {
    private static final Logger LOGGER = Logger.forClass(EngineProcess.class);
    public static final int LAUNCH_FAILURE_EXIT_CODE = -1;
    private static final long PUMP_JOIN_MILLIS = 1_000;
    private final Object monitor = new Object();
    private final Object terminateMonitor = new Object();
    private final EngineInvocation invocation;
    private final List<String> transcript = new ArrayList<>();
    private final CloseableBlockingQueue<String> lines = CloseableBlockingQueue.unbounded();
    private EngineMode mode = null;
    private EngineState state = EngineState.UNSTARTED;
    private Process process = null;
    private BufferedWriter input = null;
    private Thread pumpThread = null;
    private Integer exitCode = null;
    private boolean isTerminating = false;
    private boolean closedOutputOnItsOwn = false;

    private EngineProcess(EngineInvocation invocation) {
        ObjectChecker.assertNonNull(invocation);
        this.invocation = invocation;
    }

    /**
     * Constructs a new, unstarted engine process for the given invocation.
     *
     * @param invocation How to launch the engine.
     * @return the engine process.
     */
    public static EngineProcess forInvocation(EngineInvocation invocation) {
        return new EngineProcess(invocation);
    }

    /**
     * Constructs and starts a new engine process in interactive mode.
     *
     * @param invocation How to launch the engine.
     * @return the running engine process.
     * @throws ProcessException If the engine could not be launched.
     */
    public static EngineProcess interactive(EngineInvocation invocation) throws ProcessException {
        EngineProcess engine = new EngineProcess(invocation);
        try {
            engine.start(EngineMode.INTERACTIVE);
        } catch (InterruptedException e) {
            // Interactive start never waits on the process.
            Thread.currentThread().interrupt();
            throw new ProcessException("interrupted while starting engine", e);
        }
        return engine;
    }

    /**
     * Constructs a new engine process and runs it to completion in batch mode.
     *
     * @param invocation How to launch the engine.
     * @return the exited engine process, holding its exit code and full output.
     * @throws ProcessException If the engine could not be launched or its output could not be read.
     */
    public static EngineProcess batch(EngineInvocation invocation) throws ProcessException, InterruptedException {
        EngineProcess engine = new EngineProcess(invocation);
        engine.start(EngineMode.BATCH);
        return engine;
    }

    /**
     * Launches the engine.
     *
     * In interactive mode this returns as soon as the process is running. In batch mode the input channel is closed
     * immediately and this blocks until the engine exits, capturing all of its output into the transcript.
     *
     * @param mode The mode to run the engine in.
     * @throws ProcessException If the engine could not be launched, or in batch mode its output could not be read.
     * @throws InterruptedException If interrupted while waiting on a batch engine. The engine is killed.
     */
    public void start(EngineMode mode) throws ProcessException, InterruptedException {
        ObjectChecker.assertNonNull(mode);
        List<String> command = this.invocation.command();

        synchronized (this.monitor) {
            if (this.state != EngineState.UNSTARTED) {
                throw new IllegalStateException("engine was already started: " + this.state);
            }
            this.mode = mode;

            ProcessBuilder builder = new ProcessBuilder(command);
            builder.redirectErrorStream(true);
            if (this.invocation.workingDirectory != null) {
                builder.directory(this.invocation.workingDirectory);
            }
            builder.environment().putAll(this.invocation.environment);

            try {
                this.process = builder.start();
            } catch (IOException e) {
                this.state = EngineState.CRASHED;
                this.exitCode = LAUNCH_FAILURE_EXIT_CODE;
                throw new ProcessException("failed to start engine: " + String.join(" ", command), e);
            }
            this.state = EngineState.RUNNING;
            LOGGER.log("Started " + mode + " engine (pid " + this.process.pid() + "): " + String.join(" ", command));

            if (mode == EngineMode.INTERACTIVE) {
                this.input = new BufferedWriter(new OutputStreamWriter(this.process.getOutputStream(), StandardCharsets.UTF_8));
                this.pumpThread = new Thread(OutputPump.intoQueue(this.process.getInputStream(), this.lines, this::onOutputClosed), "OutputPump-" + this.process.pid());
                this.pumpThread.setDaemon(true);
                this.pumpThread.start();
            }
        }

        if (mode == EngineMode.BATCH) {
            runToCompletion();
        }
    }

    /**
     * Writes the given command to the engine followed by a line terminator and flushes it.
     *
     * @param text The command.
     * @throws EngineNotStartedException If the engine was never started.
     * @throws EngineNotRunningException If the engine runs in batch mode, its input is closed or it has exited.
     */
    public void sendCommand(String text) throws ProcessException {
        ObjectChecker.assertNonNull(text);
        BufferedWriter writer;

        synchronized (this.monitor) {
            if (this.state == EngineState.UNSTARTED) {
                throw new EngineNotStartedException("cannot send '" + text + "': engine was never started.");
            }
            if (this.mode == EngineMode.BATCH) {
                throw new EngineNotRunningException("cannot send '" + text + "': batch engines take no commands.");
            }
            if ((this.input == null) || (this.state.isTerminal()) || (this.isTerminating) || (!this.process.isAlive())) {
                throw new EngineNotRunningException("cannot send '" + text + "': engine is not running.");
            }
            writer = this.input;
        }

        try {
            writer.write(text);
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            throw new EngineNotRunningException("cannot send '" + text + "': input channel closed.", e);
        }
    }

    /**
     * Returns the next line of engine output, blocking until one is available.
     *
     * The line terminator is removed, the line is otherwise returned as the engine wrote it, and it is appended to the
     * transcript. If interrupted while waiting no line is consumed.
     *
     * @return the next line.
     * @throws EngineNotStartedException If the engine was never started.
     * @throws EngineNotRunningException If the engine runs in batch mode.
     * @throws EndOfStreamException If the output channel has closed and every line has been read.
     */
    public String readLine() throws ProcessException, InterruptedException {
        synchronized (this.monitor) {
            if (this.state == EngineState.UNSTARTED) {
                throw new EngineNotStartedException("cannot read: engine was never started.");
            }
            if (this.mode == EngineMode.BATCH) {
                throw new EngineNotRunningException("cannot read: batch engine output is only available as a transcript.");
            }
        }

        String line = this.lines.take();
        if (line == null) {
            throw new EndOfStreamException("engine output closed.");
        }

        synchronized (this.transcript) {
            this.transcript.add(line);
        }
        return line;
    }

    /**
     * Terminates the engine and returns its exit code.
     *
     * The shutdown command (if the invocation has one) is sent and the input channel closed. If the engine has not
     * exited within the grace period it is destroyed, and if it still has not exited after another grace period it is
     * destroyed forcibly. This always returns once an exit code is available.
     *
     * Calling this again returns the already recorded exit code without waiting. Terminating an engine that was never
     * started returns 0.
     *
     * @return the exit code.
     */
    public int terminate() {
        synchronized (this.terminateMonitor) {
            Process process;
            BufferedWriter writer;
            Thread pump;
            synchronized (this.monitor) {
                if (this.exitCode != null) {
                    return this.exitCode;
                }
                if (this.state == EngineState.UNSTARTED) {
                    return 0;
                }
                this.isTerminating = true;
                process = this.process;
                writer = this.input;
                pump = this.pumpThread;
            }

            if (writer != null) {
                closeInput(writer);
            }

            int code = awaitExit(process, this.invocation.terminateGraceMillis);
            closeOutput(process);
            joinPump(pump);

            synchronized (this.monitor) {
                // The engine closing its output on its own and then reporting failure means it died underneath us.
                boolean crashed = this.closedOutputOnItsOwn && (code != 0) && (this.mode == EngineMode.INTERACTIVE);
                this.exitCode = code;
                this.state = crashed ? EngineState.CRASHED : EngineState.EXITED;
                LOGGER.log("Engine (pid " + process.pid() + ") " + this.state + " with code " + code);
                return code;
            }
        }
    }

    @Override
    public void close() {
        terminate();
    }

    /**
     * Returns a copy of every line read from the engine so far, in the order they were read.
     *
     * @return the transcript.
     */
    public List<String> getTranscript() {
        synchronized (this.transcript) {
            return new ArrayList<>(this.transcript);
        }
    }

    public EngineState getState() {
        synchronized (this.monitor) {
            return this.state;
        }
    }

    /**
     * Returns the recorded exit code. This method always returns null until the engine has been terminated, has run to
     * completion in batch mode, or failed to launch.
     *
     * @return the exit code or null.
     */
    public Integer getExitCode() {
        synchronized (this.monitor) {
            return this.exitCode;
        }
    }

    /**
     * Returns true iff the engine process has been launched and has not exited yet.
     *
     * @return whether or not the engine process is alive.
     */
    public boolean isAlive() {
        synchronized (this.monitor) {
            return (this.process != null) && (this.process.isAlive());
        }
    }

    public EngineInvocation getInvocation() {
        return this.invocation;
    }

    @Override
    public String toString() {
        synchronized (this.monitor) {
            return this.getClass().getSimpleName() + " { " + this.invocation.executable + ", mode: " + this.mode + ", state: " + this.state
                    + (this.exitCode == null ? "" : ", exit code: " + this.exitCode) + " }";
        }
    }

    private void runToCompletion() throws ProcessException, InterruptedException {
        Process process;
        synchronized (this.monitor) {
            process = this.process;
        }

        try {
            process.getOutputStream().close();
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (this.transcript) {
                        this.transcript.add(line);
                    }
                }
            }
        } catch (IOException e) {
            process.destroyForcibly();
            int code = awaitExit(process, 0);
            synchronized (this.monitor) {
                this.exitCode = code;
                this.state = EngineState.CRASHED;
            }
            throw new ProcessException("failed to read batch engine output", e);
        }

        int code;
        try {
            code = process.waitFor();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            synchronized (this.monitor) {
                this.exitCode = awaitExit(process, 0);
                this.state = EngineState.CRASHED;
            }
            throw e;
        }

        synchronized (this.monitor) {
            this.exitCode = code;
            this.state = EngineState.EXITED;
        }
        LOGGER.log("Batch engine (pid " + process.pid() + ") exited with code " + code);
    }

    private void closeInput(BufferedWriter writer) {
        if (this.invocation.shutdownCommand != null) {
            try {
                writer.write(this.invocation.shutdownCommand);
                writer.write('\n');
                writer.flush();
            } catch (IOException e) {
                LOGGER.log("Could not send shutdown command, engine input already closed: " + e.getMessage());
            }
        }
        try {
            writer.close();
        } catch (IOException e) {
            LOGGER.log("Engine input channel failed to close cleanly: " + e.getMessage());
        }
    }

    private static int awaitExit(Process process, long graceMillis) {
        boolean interrupted = false;
        try {
            if (!process.waitFor(graceMillis, TimeUnit.MILLISECONDS)) {
                LOGGER.log("Engine (pid " + process.pid() + ") still alive after " + graceMillis + "ms, destroying it.");
                process.destroy();
                if (!process.waitFor(graceMillis, TimeUnit.MILLISECONDS)) {
                    LOGGER.log("Engine (pid " + process.pid() + ") ignored destroy, destroying it forcibly.");
                    process.destroyForcibly();
                }
            }
        } catch (InterruptedException e) {
            interrupted = true;
            process.destroyForcibly();
        }

        try {
            while (true) {
                try {
                    return process.waitFor();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static void closeOutput(Process process) {
        try {
            process.getInputStream().close();
        } catch (IOException e) {
            LOGGER.log("Engine output channel failed to close cleanly: " + e.getMessage());
        }
    }

    private static void joinPump(Thread pump) {
        if (pump == null) {
            return;
        }
        try {
            pump.join(PUMP_JOIN_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (pump.isAlive()) {
            LOGGER.log(pump.getName() + " is still draining output after the engine exited.");
        }
    }

    private void onOutputClosed() {
        synchronized (this.monitor) {
            if (!this.isTerminating) {
                this.closedOutputOnItsOwn = true;
                LOGGER.log("Engine closed its output before it was asked to terminate.");
            }
        }
    }
}
