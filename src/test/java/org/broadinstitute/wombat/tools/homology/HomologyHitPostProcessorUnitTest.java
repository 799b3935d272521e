package org.broadinstitute.wombat.tools.homology;

import org.broadinstitute.wombat.WombatBaseTest;
import org.broadinstitute.wombat.exceptions.UserException;
import org.broadinstitute.wombat.utils.tsv.TableColumnCollection;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class HomologyHitPostProcessorUnitTest extends WombatBaseTest {

    @DataProvider(name = "coverages")
    public Object[][] coverages() {
        return new Object[][]{
                {1, 10, 10, 100.0},
                {1, 6, 3, 200.0},
                {5, 9, 10, 50.0},
                {3, 3, 4, 25.0}
        };
    }

    @Test(dataProvider = "coverages")
    public void testProteinCoverage(final int start, final int end, final int length, final double expected) {
        Assert.assertEquals(HomologyHitPostProcessor.proteinCoverage(start, end, length), expected, 1e-9);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testZeroLengthProtein() {
        HomologyHitPostProcessor.proteinCoverage(1, 3, 0);
    }

    @Test
    public void testProteinLengthIndex() {
        final ProteinLengthIndex index = ProteinLengthIndex.fromFasta(getTestDataFile("proteins.faa"));
        Assert.assertEquals(index.size(), 2);
        Assert.assertEquals(index.lengthOf("P1").getAsInt(), 10);
        Assert.assertEquals(index.lengthOf("P2").getAsInt(), 3);
        Assert.assertFalse(index.lengthOf("P3").isPresent());
    }

    @Test
    public void testOutputColumns() {
        final TableColumnCollection columns = HomologyHitPostProcessor.outputColumns(
                new TableColumnCollection("qseqid", "sseqid", "pident", "qstart", "qend", "sseq"));
        Assert.assertEquals(columns.names(), Arrays.asList("qseqid", "sseqid", "qlen", "pcov", "pident", "qstart", "qend", "sseq"));
    }

    @Test
    public void testProcess() {
        final Path output = createTempDir("homology").resolve(HomologyHitPostProcessor.FILTERED_TABLE_FILE_NAME);
        final HomologyHitPostProcessor processor =
                new HomologyHitPostProcessor(ProteinLengthIndex.fromFasta(getTestDataFile("proteins.faa")));

        final HomologyHitPostProcessor.PostProcessingResult result = processor.process(getTestDataFile("hits.tab"), output);

        Assert.assertEquals(result.getRowsRead(), 4);
        Assert.assertEquals(result.getRowsWritten(), 2);
        Assert.assertEquals(readLines(output), Arrays.asList(
                "qseqid\tsseqid\tqlen\tpcov\tpident\tlength\tqstart\tqend\tevalue",
                "P1\tC_1_length_900\t10\t100.0\t98.5\t10\t1\t10\t1e-20",
                "P2\tC_1_length_900\t3\t200.0\t50.01\t6\t1\t6\t1e-2"));
    }

    @Test
    public void testIdentityThresholdIsStrict() {
        final Path dir = createTempDir("homology");
        final Path hits = writeLines(dir.resolve("hits.tab"),
                "qseqid\tsseqid\tpident\tqstart\tqend",
                "P1\tC_1\t80.0\t1\t10",
                "P1\tC_2\t80.01\t1\t10");
        final Path output = dir.resolve("filtered.tab");
        new HomologyHitPostProcessor(new ProteinLengthIndex(Collections.singletonMap("P1", 10)), 80.0).process(hits, output);

        final List<String> lines = readLines(output);
        Assert.assertEquals(lines.size(), 2);
        Assert.assertTrue(lines.get(1).startsWith("P1\tC_2\t"));
    }

    @Test
    public void testNoSurvivingHitsGivesAHeaderOnlyTable() {
        final Path dir = createTempDir("homology");
        final Path hits = writeLines(dir.resolve("hits.tab"), "qseqid\tsseqid\tpident\tqstart\tqend");
        final Path output = dir.resolve("filtered.tab");
        new HomologyHitPostProcessor(new ProteinLengthIndex(Collections.emptyMap())).process(hits, output);
        Assert.assertEquals(readLines(output), Collections.singletonList("qseqid\tsseqid\tqlen\tpcov\tpident\tqstart\tqend"));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testUnknownProtein() {
        final Path dir = createTempDir("homology");
        final Path hits = writeLines(dir.resolve("hits.tab"),
                "qseqid\tsseqid\tpident\tqstart\tqend",
                "P9\tC_1\t99.0\t1\t10");
        new HomologyHitPostProcessor(new ProteinLengthIndex(Collections.singletonMap("P1", 10))).process(hits, dir.resolve("out.tab"));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testMissingMandatoryColumn() {
        final Path dir = createTempDir("homology");
        final Path hits = writeLines(dir.resolve("hits.tab"), "qseqid\tsseqid\tqstart\tqend", "P1\tC_1\t1\t10");
        new HomologyHitPostProcessor(new ProteinLengthIndex(Collections.singletonMap("P1", 10))).process(hits, dir.resolve("out.tab"));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testThresholdOutOfRange() {
        new HomologyHitPostProcessor(new ProteinLengthIndex(Collections.emptyMap()), 101.0);
    }
}
