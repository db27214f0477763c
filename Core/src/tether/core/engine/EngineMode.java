package tether.core.engine;

/**
 * How an engine process is run.
 */
public enum EngineMode {

    /**
     * The input channel stays open and output is read line by line as the engine produces it.
     */
    INTERACTIVE,

    /**
     * The engine runs to completion, all of its output is captured and its exit code recorded.
     */
    BATCH
}
