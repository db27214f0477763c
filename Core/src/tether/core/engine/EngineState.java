package tether.core.engine;

/**
 * The life-cycle state of an {@link EngineProcess}.
 *
 * UNSTARTED moves to RUNNING once the process is launched. RUNNING moves to EXITED when the process is terminated, or
 * to CRASHED when it failed to launch or closed its output before anyone asked it to stop. EXITED and CRASHED are
 * terminal.
 */
public enum EngineState {
    UNSTARTED,
    RUNNING,
    EXITED,
    CRASHED;

    public boolean isTerminal() {
        return (this == EXITED) || (this == CRASHED);
    }
}
