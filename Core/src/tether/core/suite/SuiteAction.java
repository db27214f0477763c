package tether.core.suite;

/**
 * A test case body or a lifecycle hook of a suite.
 */
@FunctionalInterface
public interface SuiteAction {

    /**
     * Runs the action.
     *
     * A case fails by throwing an {@link AssertionError} or any other exception. A hook that throws fails its suite.
     *
     * @param context The context of the suite the action belongs to.
     */
    public void execute(SuiteContext context) throws Exception;
}
