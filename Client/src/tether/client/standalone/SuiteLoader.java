package tether.client.standalone;

import tether.core.engine.EngineLauncher;
import tether.core.suite.SuiteDefinition;
import tether.core.suite.TestSuite;
import tether.core.util.Logger;
import tether.core.util.ObjectChecker;

import java.io.File;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.List;

/**
 * Loads suite classes by name from a classpath of jar files and class directories, and has them declare their suites.
 */
public final class SuiteLoader implements AutoCloseable {
    private static final Logger LOGGER = Logger.forClass(SuiteLoader.class);
    private final URLClassLoader classLoader;

    private SuiteLoader(URLClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    /**
     * Constructs a loader over the given classpath entries, falling back to this program's own classpath.
     *
     * @param entries Paths to jar files or directories of class files.
     * @return the loader.
     */
    public static SuiteLoader forClasspath(List<String> entries) throws MalformedURLException {
        ObjectChecker.assertNonNull(entries);

        URL[] urls = new URL[entries.size()];
        for (int i = 0; i < entries.size(); i++) {
            urls[i] = new File(entries.get(i)).toURI().toURL();
            LOGGER.log("Suite classpath entry: " + urls[i]);
        }
        return new SuiteLoader(new URLClassLoader(urls, SuiteLoader.class.getClassLoader()));
    }

    /**
     * Loads the named class, which must implement {@link SuiteDefinition} and have a public no-argument constructor,
     * and returns the suite it declares.
     *
     * @param className The binary name of the suite class.
     * @param launcher The launcher the suite creates its engines with.
     * @return the declared suite.
     * @throws ReflectiveOperationException If the class could not be loaded or instantiated.
     */
    public TestSuite load(String className, EngineLauncher launcher) throws ReflectiveOperationException {
        ObjectChecker.assertNonNull(className, launcher);

        Class<?> suiteClass = this.classLoader.loadClass(className);
        if (!SuiteDefinition.class.isAssignableFrom(suiteClass)) {
            throw new IllegalArgumentException(className + " does not implement " + SuiteDefinition.class.getName());
        }

        SuiteDefinition definition = (SuiteDefinition) suiteClass.getConstructor().newInstance();
        TestSuite suite = definition.define(launcher);
        if (suite == null) {
            throw new IllegalStateException(className + " declared no suite.");
        }
        LOGGER.log("Loaded " + suite);
        return suite;
    }

    @Override
    public void close() throws IOException {
        this.classLoader.close();
    }
}
