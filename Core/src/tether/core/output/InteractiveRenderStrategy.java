package tether.core.output;

import java.io.PrintStream;
import java.util.List;

/**
 * Redraws the whole report every time it changes: the physical lines drawn last time are moved over and cleared with
 * ANSI cursor control, then every line is drawn again. This gives a live dashboard on a terminal, and garbage anywhere
 * else.
 *
 * The number of lines drawn last time belongs to this instance, so use one instance per output.
 */
public final class InteractiveRenderStrategy implements RenderStrategy {
    static final String LINE_UP = "\033[1A";
    static final String LINE_CLEAR = "\033[2K";
    private int printedLines = 0;

    @Override
    public synchronized void render(PrintStream out, String suiteName, String line, List<String> allLines) {
        StringBuilder frame = new StringBuilder();
        for (int i = 0; i < this.printedLines; i++) {
            frame.append(LINE_UP).append(LINE_CLEAR);
        }

        int physicalLines = 0;
        for (String reportLine : allLines) {
            frame.append(reportLine).append('\n');
            physicalLines += countPhysicalLines(reportLine);
        }

        out.print(frame);
        out.flush();
        this.printedLines = physicalLines;
    }

    static int countPhysicalLines(String line) {
        int count = 1;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
