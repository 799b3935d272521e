package org.broadinstitute.wombat.utils.runtime;

import org.broadinstitute.wombat.WombatBaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

public final class ProcessControllerUnitTest extends WombatBaseTest {

    @Test
    public void testCaptureStdout() {
        final ProcessSettings settings = new ProcessSettings(new String[]{"echo", "Hello World"});
        settings.getStdoutSettings().setBufferSize(1024);
        final ProcessOutput output = new ProcessController().exec(settings);
        Assert.assertEquals(output.getExitValue(), 0);
        Assert.assertEquals(output.getStdout().getBufferString(), "Hello World\n");
        Assert.assertFalse(output.getStdout().isBufferTruncated());
    }

    @Test
    public void testExitValueAndStderr() {
        final ProcessSettings settings = new ProcessSettings(new String[]{"sh", "-c", "echo oops 1>&2; exit 3"});
        settings.getStderrSettings().setBufferSize(1024);
        final ProcessOutput output = new ProcessController().exec(settings);
        Assert.assertEquals(output.getExitValue(), 3);
        Assert.assertEquals(output.getStderr().getBufferString(), "oops\n");
        assertContains(output.getStatusSummary(false), "Stderr: oops");
    }

    @Test
    public void testBufferIsTruncated() {
        final ProcessSettings settings = new ProcessSettings(new String[]{"echo", "0123456789"});
        settings.getStdoutSettings().setBufferSize(4);
        final ProcessOutput output = new ProcessController().exec(settings);
        Assert.assertEquals(output.getStdout().getBufferString(), "0123");
        Assert.assertTrue(output.getStdout().isBufferTruncated());
    }

    @Test
    public void testStdoutToFile() {
        final Path file = createTempDir("process").resolve("out.txt");
        for (final String word : Arrays.asList("first", "second")) {
            final ProcessSettings settings = new ProcessSettings(new String[]{"echo", word});
            settings.getStdoutSettings().setOutputFile(file.toFile(), true);
            Assert.assertEquals(new ProcessController().exec(settings).getExitValue(), 0);
        }
        Assert.assertEquals(readLines(file), Arrays.asList("first", "second"));

        final ProcessSettings overwrite = new ProcessSettings(new String[]{"echo", "third"});
        overwrite.getStdoutSettings().setOutputFile(file.toFile());
        new ProcessController().exec(overwrite);
        Assert.assertEquals(readLines(file), Collections.singletonList("third"));
    }

    @Test
    public void testWorkingDirectory() {
        final File dir = createTempDir("process").toFile();
        final ProcessSettings settings = new ProcessSettings(new String[]{"sh", "-c", "touch made_here"});
        settings.setDirectory(dir);
        Assert.assertEquals(new ProcessController().exec(settings).getExitValue(), 0);
        Assert.assertTrue(new File(dir, "made_here").isFile());
    }

    @Test
    public void testThreadLocalControllerIsReused() {
        Assert.assertSame(ProcessController.getThreadLocal(), ProcessController.getThreadLocal());
    }
}
