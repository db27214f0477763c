package tether.core.suite;

import tether.core.util.ObjectChecker;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * What a running suite knows about itself: its name and its scratch directory.
 *
 * The scratch directory exists from before the suite's beforeAll hook runs until after its afterAll hook has run, and is
 * private to the suite. Cases use it for ancillary fixture files such as opening books or position lists.
 */
public final class SuiteContext {
    public final String suiteName;
    private final File scratchDirectory;

    private SuiteContext(String suiteName, File scratchDirectory) {
        ObjectChecker.assertNonNull(suiteName, scratchDirectory);
        this.suiteName = suiteName;
        this.scratchDirectory = scratchDirectory;
    }

    public static SuiteContext forSuite(String suiteName, File scratchDirectory) {
        return new SuiteContext(suiteName, scratchDirectory);
    }

    public File getScratchDirectory() {
        return this.scratchDirectory;
    }

    /**
     * Writes the given content as UTF-8 to a file of the given name inside the scratch directory, replacing any file of
     * that name, and returns the file.
     *
     * @param name The plain file name, which may not contain a path separator.
     * @param content The file content.
     * @return the written file.
     */
    public File writeScratchFile(String name, String content) throws IOException {
        ObjectChecker.assertNonEmpty(name);
        ObjectChecker.assertNonNull(content);
        if (name.contains("/") || name.contains(File.separator) || name.equals("..") || name.equals(".")) {
            throw new IllegalArgumentException("scratch file name must be a plain file name but was: " + name);
        }

        Path file = this.scratchDirectory.toPath().resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file.toFile();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { suite: " + this.suiteName + ", scratch: " + this.scratchDirectory + " }";
    }
}
