package tether.core.output;

import java.io.PrintStream;
import java.util.List;

/**
 * Writes each new line once, tagged with its suite, and never moves the cursor. Lines of concurrently running suites
 * interleave in the order they were produced.
 */
public final class AppendOnlyRenderStrategy implements RenderStrategy {

    @Override
    public void render(PrintStream out, String suiteName, String line, List<String> allLines) {
        String tag = "[" + suiteName + "] ";
        for (String physicalLine : line.split("\n", -1)) {
            out.println(tag + physicalLine);
        }
        out.flush();
    }
}
