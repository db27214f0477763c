package tether.core.output;

import java.util.List;

/**
 * A listener that is told about every new result line of a {@link RunReport}.
 *
 * The listener is called while the report's lock is held, so calls never overlap and arrive in the order the lines were
 * added. A listener must not block on anything other than writing its output.
 */
public interface ReportListener {

    /**
     * Notifies the listener that a line was added to the results of a suite.
     *
     * @param suiteName The suite the line belongs to.
     * @param line The new line. It may span several physical lines.
     * @param allLines Every line of the report so far, suites in registration order.
     */
    public void lineAdded(String suiteName, String line, List<String> allLines);
}
