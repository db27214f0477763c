package tether.core.output;

import java.io.PrintStream;
import java.util.List;

/**
 * How the {@link Reporter} puts result lines on its output.
 */
public interface RenderStrategy {

    /**
     * Renders the report after a line was added to it.
     *
     * @param out The output.
     * @param suiteName The suite the new line belongs to.
     * @param line The new line.
     * @param allLines Every line of the report so far.
     */
    public void render(PrintStream out, String suiteName, String line, List<String> allLines);
}
