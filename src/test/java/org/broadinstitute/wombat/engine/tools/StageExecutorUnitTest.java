package org.broadinstitute.wombat.engine.tools;

import org.broadinstitute.wombat.WombatBaseTest;
import org.broadinstitute.wombat.engine.layout.Stage;
import org.broadinstitute.wombat.exceptions.StageFailedException;
import org.broadinstitute.wombat.exceptions.UserException;
import org.broadinstitute.wombat.utils.runtime.ProcessOutput;
import org.broadinstitute.wombat.utils.runtime.StreamOutput;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class StageExecutorUnitTest extends WombatBaseTest {

    @Test
    public void testSuccessfulRun() {
        final List<ToolInvocation> calls = new ArrayList<>();
        final StageExecutor executor = new StageExecutor(invocation -> {
            calls.add(invocation);
            return new ProcessOutput(0, StreamOutput.EMPTY, StreamOutput.EMPTY);
        });
        final ProcessOutput output = executor.run(Stage.STATS, "S1", ToolInvocation.of("quast", "c.fasta"));
        Assert.assertEquals(output.getExitValue(), 0);
        Assert.assertEquals(calls.size(), 1);
        Assert.assertEquals(calls.get(0).getProgram(), "quast");
    }

    @Test
    public void testNonZeroExitNamesStageAndSample() {
        final StageExecutor executor = new StageExecutor(invocation -> new ProcessOutput(2, StreamOutput.EMPTY, StreamOutput.EMPTY));
        try {
            executor.run(Stage.ASSEMBLE, "S2", ToolInvocation.of("spades.py"));
            Assert.fail("a non-zero exit value should fail the stage");
        } catch (final StageFailedException e) {
            Assert.assertEquals(e.getStage(), Stage.ASSEMBLE);
            Assert.assertEquals(e.getSampleId().get(), "S2");
            Assert.assertEquals(e.getExitCode().getAsInt(), 2);
            assertContains(e.getMessage(), "Stage assemble failed for sample S2");
            assertContains(e.getMessage(), "spades.py");
        }
    }

    @Test
    public void testCrossSampleFailureHasNoSample() {
        final StageExecutor executor = new StageExecutor(invocation -> new ProcessOutput(1, StreamOutput.EMPTY, StreamOutput.EMPTY));
        try {
            executor.run(Stage.PANGENOME, null, ToolInvocation.of("roary"));
            Assert.fail("a non-zero exit value should fail the stage");
        } catch (final StageFailedException e) {
            Assert.assertFalse(e.getSampleId().isPresent());
            assertContains(e.getMessage(), "Stage pangenome failed");
        }
    }

    @Test(expectedExceptions = UserException.CannotExecuteProgram.class)
    public void testMissingProgramIsAUserError() {
        new StageExecutor(new ProcessToolRunner()).run(Stage.TRIM, "S1", ToolInvocation.of("no-such-wombat-tool-on-the-path"));
    }

    @Test
    public void testProcessToolRunner() {
        final Path out = createTempDir("executor").resolve("report.txt");
        new StageExecutor(new ProcessToolRunner()).run(Stage.CROSS_SAMPLE_TYPING, null,
                ToolInvocation.of("echo", "ST", "11").withStdoutTo(out, false));
        Assert.assertEquals(readLines(out).get(0), "ST 11");
    }

    @Test
    public void testRequireArtifact() {
        final Path present = writeLines(createTempDir("executor").resolve("contigs.fasta"), ">c", "ACGT");
        Assert.assertEquals(StageExecutor.requireArtifact(Stage.ASSEMBLE, "S1", present), present);
        try {
            StageExecutor.requireArtifact(Stage.ASSEMBLE, "S1", present.resolveSibling("missing.fasta"));
            Assert.fail("a missing artifact should fail the stage");
        } catch (final StageFailedException e) {
            Assert.assertFalse(e.getExitCode().isPresent());
            assertContains(e.getMessage(), "was not produced");
        }
    }
}
