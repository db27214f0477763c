package tether.core.output;

import tether.core.config.ReporterMode;
import tether.core.util.ObjectChecker;

import java.io.PrintStream;
import java.util.List;

/**
 * Renders a {@link RunReport} as it changes and prints the final summary.
 */
public final class Reporter implements ReportListener {
    private final PrintStream out;
    private final RenderStrategy strategy;
    private final ResultFormatter formatter;

    private Reporter(PrintStream out, RenderStrategy strategy, ResultFormatter formatter) {
        ObjectChecker.assertNonNull(out, strategy, formatter);
        this.out = out;
        this.strategy = strategy;
        this.formatter = formatter;
    }

    /**
     * Constructs a reporter writing to the given output with the given strategy and formatter.
     */
    public static Reporter withStrategy(PrintStream out, RenderStrategy strategy, ResultFormatter formatter) {
        return new Reporter(out, strategy, formatter);
    }

    /**
     * Constructs a reporter writing to the given output in the given mode.
     *
     * @param out The output.
     * @param mode How progress is rendered.
     * @param colors Whether ANSI colors are used.
     * @return the reporter.
     */
    public static Reporter forMode(PrintStream out, ReporterMode mode, boolean colors) {
        ObjectChecker.assertNonNull(mode);
        RenderStrategy strategy = (mode == ReporterMode.INTERACTIVE) ? new InteractiveRenderStrategy() : new AppendOnlyRenderStrategy();
        return new Reporter(out, strategy, colors ? ResultFormatter.colored() : ResultFormatter.plain());
    }

    @Override
    public void lineAdded(String suiteName, String line, List<String> allLines) {
        this.strategy.render(this.out, suiteName, line, allLines);
    }

    public void printSummary(RunSummary summary) {
        for (String line : this.formatter.summary(summary)) {
            this.out.println(line);
        }
        this.out.flush();
    }

    public ResultFormatter getFormatter() {
        return this.formatter;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { strategy: " + this.strategy.getClass().getSimpleName() + ", colors: " + this.formatter.isColored() + " }";
    }
}
