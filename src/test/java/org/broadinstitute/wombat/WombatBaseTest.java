package org.broadinstitute.wombat;

import htsjdk.samtools.util.Log;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.wombat.utils.LoggingUtils;
import org.testng.Assert;
import org.testng.annotations.BeforeSuite;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * This is the base test class for all of our test cases.  All test cases should extend from this
 * class; it sets up the logger, and resolves the location of directories that we might use for test data.
 */
public abstract class WombatBaseTest {

    public static final Logger logger = LogManager.getLogger("org.broadinstitute.wombat");

    private static final String CURRENT_DIRECTORY = System.getProperty("user.dir");
    public static final String wombatDirectory = System.getProperty("wombatdir", CURRENT_DIRECTORY) + "/";

    private static final String publicTestDirRelative = "src/test/resources/";
    public static final String publicTestDir = new File(wombatDirectory, publicTestDirRelative).getAbsolutePath() + "/";
    public static final String packageRootTestDir = publicTestDir + "org/broadinstitute/wombat/";

    @BeforeSuite
    public void setTestVerbosity() {
        LoggingUtils.setLoggingLevel(Log.LogLevel.WARNING);
    }

    /**
     * @return the test data directory of the class under test, derived from the name of the test class
     */
    public String getToolTestDataDir() {
        return publicTestDir + getClass().getPackage().getName().replace('.', '/') + "/" + getTestedClassName() + "/";
    }

    /**
     * Returns the location of the resource directory for the class under test. The default
     * implementation strips "UnitTest" or "IntegrationTest" off the test class name.
     */
    public String getTestedClassName() {
        if (getClass().getSimpleName().contains("IntegrationTest")) {
            return getClass().getSimpleName().replaceAll("IntegrationTest$", "");
        } else if (getClass().getSimpleName().contains("UnitTest")) {
            return getClass().getSimpleName().replaceAll("UnitTest$", "");
        } else {
            return getClass().getSimpleName().replaceAll("Test$", "");
        }
    }

    /**
     * @return a {@link Path} to the test data file {@code fileName} of the class under test
     */
    public Path getTestDataFile(final String fileName) {
        return new File(getToolTestDataDir(), fileName).toPath();
    }

    /**
     * Creates a temp dir that is deleted when the JVM exits.
     */
    public static Path createTempDir(final String prefix) {
        try {
            final Path dir = Files.createTempDirectory(prefix);
            FileUtils.forceDeleteOnExit(dir.toFile());
            return dir;
        } catch (final IOException e) {
            throw new UncheckedIOException("cannot create a temporary directory", e);
        }
    }

    /**
     * Writes {@code lines}, each followed by a newline, to {@code file}, creating its parent directories.
     */
    public static Path writeLines(final Path file, final String... lines) {
        return writeLines(file, Arrays.asList(lines));
    }

    public static Path writeLines(final Path file, final List<String> lines) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            return Files.write(file, lines, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException("cannot write test file " + file, e);
        }
    }

    public static List<String> readLines(final Path file) {
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException("cannot read test file " + file, e);
        }
    }

    public static void assertContains(final String actual, final String expectedSubstring) {
        Assert.assertTrue(actual.contains(expectedSubstring), expectedSubstring + " was not found in " + actual + ".");
    }
}
