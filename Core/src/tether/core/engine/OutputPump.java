package tether.core.engine;

import tether.core.util.CloseableBlockingQueue;
import tether.core.util.Logger;
import tether.core.util.ObjectChecker;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Moves the lines an engine writes to its output channel into a queue, so that readers can block on the queue instead
 * of on the channel itself.
 *
 * A reader blocked on the queue can be interrupted without losing a line. The queue is closed when the channel reaches
 * end of stream or fails, after which the listener is told the output is gone.
 */
final class OutputPump implements Runnable {
    private static final Logger LOGGER = Logger.forClass(OutputPump.class);
    private final InputStream output;
    private final CloseableBlockingQueue<String> lines;
    private final Runnable onClosed;

    private OutputPump(InputStream output, CloseableBlockingQueue<String> lines, Runnable onClosed) {
        ObjectChecker.assertNonNull(output, lines, onClosed);
        this.output = output;
        this.lines = lines;
        this.onClosed = onClosed;
    }

    /**
     * Constructs a new pump that reads from the given stream into the given queue and runs the given callback once the
     * stream has closed.
     *
     * @param output The engine's output channel.
     * @param lines The queue to fill.
     * @param onClosed Invoked once, after the queue is closed.
     * @return the pump.
     */
    static OutputPump intoQueue(InputStream output, CloseableBlockingQueue<String> lines, Runnable onClosed) {
        return new OutputPump(output, lines, onClosed);
    }

    @Override
    public void run() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(this.output, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!this.lines.add(line)) {
                    LOGGER.log("Line queue closed underneath the pump, dropping remaining output.");
                    break;
                }
            }
            LOGGER.log("Reached end of engine output.");
        } catch (IOException e) {
            LOGGER.log("Engine output channel failed: " + e.getMessage());
        } finally {
            this.lines.close();
            this.onClosed.run();
        }
    }
}
