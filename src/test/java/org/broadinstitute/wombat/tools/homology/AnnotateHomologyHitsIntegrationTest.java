package org.broadinstitute.wombat.tools.homology;

import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.wombat.WombatBaseTest;
import org.broadinstitute.wombat.cmdline.StandardArgumentDefinitions;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.util.List;

public final class AnnotateHomologyHitsIntegrationTest extends WombatBaseTest {

    private static final String TEST_DATA = publicTestDir + "org/broadinstitute/wombat/tools/homology/HomologyHitPostProcessor/";

    private static String[] args(final Path outputDirectory, final String... extra) {
        final String[] base = {
                "-" + StandardArgumentDefinitions.INPUT_SHORT_NAME, TEST_DATA + "hits.tab",
                "--" + StandardArgumentDefinitions.PROTEIN_DATABASE_LONG_NAME, TEST_DATA + "proteins.faa",
                "-" + StandardArgumentDefinitions.OUTPUT_SHORT_NAME, outputDirectory.toString(),
                "--" + StandardArgumentDefinitions.QUIET_NAME};
        final String[] all = new String[base.length + extra.length];
        System.arraycopy(base, 0, all, 0, base.length);
        System.arraycopy(extra, 0, all, base.length, extra.length);
        return all;
    }

    @Test
    public void testDefaultThreshold() {
        final Path outputDirectory = createTempDir("homology").resolve("filtered");
        Assert.assertEquals(new AnnotateHomologyHits().instanceMain(args(outputDirectory)), 2L);
        final List<String> lines = readLines(outputDirectory.resolve(HomologyHitPostProcessor.FILTERED_TABLE_FILE_NAME));
        Assert.assertEquals(lines.size(), 3);
        Assert.assertTrue(lines.get(1).startsWith("P1\tC_1_length_900\t10\t100.0\t"));
    }

    @Test
    public void testCustomThreshold() {
        final Path outputDirectory = createTempDir("homology");
        Assert.assertEquals(new AnnotateHomologyHits().instanceMain(
                args(outputDirectory, "--" + StandardArgumentDefinitions.MIN_PERCENT_IDENTITY_LONG_NAME, "10")), 4L);
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testThresholdOutOfRange() {
        new AnnotateHomologyHits().instanceMain(
                args(createTempDir("homology"), "--" + StandardArgumentDefinitions.MIN_PERCENT_IDENTITY_LONG_NAME, "120"));
    }
}
