package org.broadinstitute.wombat.tools.pipeline;

import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.wombat.WombatBaseTest;
import org.broadinstitute.wombat.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.wombat.engine.layout.ArtifactLayout;
import org.broadinstitute.wombat.engine.layout.ArtifactRole;
import org.broadinstitute.wombat.engine.layout.Stage;
import org.broadinstitute.wombat.engine.tools.ToolCommands;
import org.broadinstitute.wombat.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.nio.file.Files;
import java.nio.file.Path;

public final class RunAssemblyPipelineIntegrationTest extends WombatBaseTest {

    private Path inputs;
    private Path sampleManifest;
    private Path output;

    @BeforeMethod
    public void writeManifests() {
        inputs = createTempDir("runPipeline");
        output = createTempDir("runPipelineOutput").resolve("run1");
        for (final String id : new String[]{"S1", "S2"}) {
            writeLines(inputs.resolve(id + "_1.fastq"), "@r1", "ACGT", "+", "IIII");
            writeLines(inputs.resolve(id + "_2.fastq"), "@r1", "ACGT", "+", "IIII");
        }
        sampleManifest = writeLines(inputs.resolve("samples.tsv"),
                "Read1\tRead2\tSamples",
                inputs.resolve("S1_1.fastq") + "\t" + inputs.resolve("S1_2.fastq") + "\tS1",
                inputs.resolve("S2_1.fastq") + "\t" + inputs.resolve("S2_2.fastq") + "\tS2");
        writeLines(inputs.resolve("adapters.fa"), ">adapter", "AGATCGGAAGAGC");
        writeLines(inputs.resolve("proteins.faa"), ">P1", "MKVLAAGIVG");
    }

    private Path auxiliaryManifest(final String reference) {
        return writeLines(inputs.resolve("routes.tsv"),
                "Route",
                inputs.resolve("adapters.fa").toString(),
                reference,
                inputs.resolve("proteins.faa").toString());
    }

    private static RunAssemblyPipeline tool(final FakeToolRunner runner) {
        final RunAssemblyPipeline tool = new RunAssemblyPipeline();
        tool.setToolRunner(runner);
        return tool;
    }

    @Test
    public void testRunFromManifests() {
        final FakeToolRunner runner = new FakeToolRunner();
        final Object result = tool(runner).instanceMain(new String[]{
                "-" + StandardArgumentDefinitions.SAMPLE_MANIFEST_SHORT_NAME, sampleManifest.toString(),
                "-" + StandardArgumentDefinitions.AUXILIARY_MANIFEST_SHORT_NAME, auxiliaryManifest("NA").toString(),
                "-" + StandardArgumentDefinitions.OUTPUT_SHORT_NAME, output.toString(),
                "--" + StandardArgumentDefinitions.ANNOTATOR_LONG_NAME, "dfast",
                "--" + StandardArgumentDefinitions.RUN_HOMOLOGY_SEARCH_LONG_NAME, "false",
                "--" + StandardArgumentDefinitions.QUIET_NAME});

        final PipelineResult pipelineResult = (PipelineResult) result;
        Assert.assertEquals(pipelineResult.getOutputRoot(), output);
        Assert.assertEquals(pipelineResult.getSamples().size(), 2);
        Assert.assertFalse(pipelineResult.getReference().isPresent());
        Assert.assertEquals(runner.invocationsOf(ToolCommands.DFAST).size(), 2);
        Assert.assertTrue(runner.invocationsOf(ToolCommands.TBLASTN).isEmpty());
        Assert.assertTrue(Files.isRegularFile(new ArtifactLayout(output).pathFor(Stage.ANNOTATE, "S2", ArtifactRole.ANNOTATION_GFF)));
    }

    @Test
    public void testResumeFromTheCommandLine() {
        final String[] args = {
                "-" + StandardArgumentDefinitions.SAMPLE_MANIFEST_SHORT_NAME, sampleManifest.toString(),
                "-" + StandardArgumentDefinitions.AUXILIARY_MANIFEST_SHORT_NAME, auxiliaryManifest("NA").toString(),
                "-" + StandardArgumentDefinitions.OUTPUT_SHORT_NAME, output.toString(),
                "--" + StandardArgumentDefinitions.QUIET_NAME};
        tool(new FakeToolRunner()).instanceMain(args);

        try {
            tool(new FakeToolRunner()).instanceMain(args);
            Assert.fail("a second run into the same directory should need --resume");
        } catch (final UserException.OutputDirectoryExists e) {
            assertContains(e.getMessage(), output.toString());
        }

        final FakeToolRunner rerun = new FakeToolRunner();
        final String[] resumeArgs = new String[args.length + 1];
        System.arraycopy(args, 0, resumeArgs, 0, args.length);
        resumeArgs[args.length] = "--" + StandardArgumentDefinitions.RESUME_LONG_NAME;
        final PipelineResult result = (PipelineResult) tool(rerun).instanceMain(resumeArgs);
        Assert.assertTrue(result.getSamples().get(0).isResumed());
        Assert.assertTrue(rerun.invocationsOf(ToolCommands.SPADES).isEmpty());
    }

    @Test(expectedExceptions = UserException.MalformedManifest.class)
    public void testHomologySearchNeedsAProteinDatabase() {
        final Path routes = writeLines(inputs.resolve("routes.tsv"),
                "Route", inputs.resolve("adapters.fa").toString(), "NA", "NA");
        tool(new FakeToolRunner()).instanceMain(new String[]{
                "-" + StandardArgumentDefinitions.SAMPLE_MANIFEST_SHORT_NAME, sampleManifest.toString(),
                "-" + StandardArgumentDefinitions.AUXILIARY_MANIFEST_SHORT_NAME, routes.toString(),
                "-" + StandardArgumentDefinitions.OUTPUT_SHORT_NAME, output.toString(),
                "--" + StandardArgumentDefinitions.RUN_HOMOLOGY_SEARCH_LONG_NAME, "true",
                "--" + StandardArgumentDefinitions.QUIET_NAME});
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testParallelismMustBePositive() {
        tool(new FakeToolRunner()).instanceMain(new String[]{
                "-" + StandardArgumentDefinitions.SAMPLE_MANIFEST_SHORT_NAME, sampleManifest.toString(),
                "-" + StandardArgumentDefinitions.AUXILIARY_MANIFEST_SHORT_NAME, auxiliaryManifest("NA").toString(),
                "--" + StandardArgumentDefinitions.SAMPLE_PARALLELISM_LONG_NAME, "0",
                "--" + StandardArgumentDefinitions.QUIET_NAME});
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testUnknownAnnotator() {
        tool(new FakeToolRunner()).instanceMain(new String[]{
                "-" + StandardArgumentDefinitions.SAMPLE_MANIFEST_SHORT_NAME, sampleManifest.toString(),
                "-" + StandardArgumentDefinitions.AUXILIARY_MANIFEST_SHORT_NAME, auxiliaryManifest("NA").toString(),
                "-" + StandardArgumentDefinitions.OUTPUT_SHORT_NAME, output.toString(),
                "--" + StandardArgumentDefinitions.ANNOTATOR_LONG_NAME, "glimmer",
                "--" + StandardArgumentDefinitions.QUIET_NAME});
    }
}
