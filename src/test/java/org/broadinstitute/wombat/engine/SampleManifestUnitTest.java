package org.broadinstitute.wombat.engine;

import org.broadinstitute.wombat.WombatBaseTest;
import org.broadinstitute.wombat.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.util.List;

public final class SampleManifestUnitTest extends WombatBaseTest {

    private Path dir;

    @BeforeMethod
    public void createReads() {
        dir = createTempDir("sampleManifest");
        for (final String name : new String[]{"S1_1.fastq.gz", "S1_2.fastq.gz", "S2_1.fastq.gz", "S2_2.fastq.gz"}) {
            writeLines(dir.resolve("reads").resolve(name), "@r1", "ACGT", "+", "IIII");
        }
    }

    @Test
    public void testReadsSamplesInManifestOrder() {
        final Path manifest = writeLines(dir.resolve("samples.tsv"),
                "Read1\tRead2\tSamples",
                "reads/S2_1.fastq.gz\treads/S2_2.fastq.gz\tS2",
                "reads/S1_1.fastq.gz\treads/S1_2.fastq.gz\tS1");

        final List<Sample> samples = SampleManifest.read(manifest);
        Assert.assertEquals(samples.size(), 2);
        Assert.assertEquals(samples.get(0).getId(), "S2");
        Assert.assertEquals(samples.get(1).getId(), "S1");
        Assert.assertEquals(samples.get(1).getForwardReads(), dir.resolve("reads/S1_1.fastq.gz").toAbsolutePath());
        Assert.assertEquals(samples.get(1).getReverseReads(), dir.resolve("reads/S1_2.fastq.gz").toAbsolutePath());
    }

    @Test
    public void testExtraColumnsAndColumnOrderAreAllowed() {
        final Path manifest = writeLines(dir.resolve("samples.tsv"),
                "Samples\tNotes\tRead2\tRead1",
                "S1\tfirst isolate\treads/S1_2.fastq.gz\treads/S1_1.fastq.gz");

        final List<Sample> samples = SampleManifest.read(manifest);
        Assert.assertEquals(samples.size(), 1);
        Assert.assertEquals(samples.get(0).getForwardReads().getFileName().toString(), "S1_1.fastq.gz");
    }

    @DataProvider(name = "malformedManifests")
    public Object[][] malformedManifests() {
        return new Object[][]{
                // missing column
                {new String[]{"Read1\tSamples", "reads/S1_1.fastq.gz\tS1"}},
                // header only
                {new String[]{"Read1\tRead2\tSamples"}},
                // duplicate id
                {new String[]{"Read1\tRead2\tSamples",
                        "reads/S1_1.fastq.gz\treads/S1_2.fastq.gz\tS1",
                        "reads/S2_1.fastq.gz\treads/S2_2.fastq.gz\tS1"}},
                // ids differing only in case
                {new String[]{"Read1\tRead2\tSamples",
                        "reads/S1_1.fastq.gz\treads/S1_2.fastq.gz\tS1",
                        "reads/S2_1.fastq.gz\treads/S2_2.fastq.gz\ts1"}},
                // reserved id
                {new String[]{"Read1\tRead2\tSamples", "reads/S1_1.fastq.gz\treads/S1_2.fastq.gz\tReference"}},
                // id that would escape its directory
                {new String[]{"Read1\tRead2\tSamples", "reads/S1_1.fastq.gz\treads/S1_2.fastq.gz\t../S1"}},
                // empty id
                {new String[]{"Read1\tRead2\tSamples", "reads/S1_1.fastq.gz\treads/S1_2.fastq.gz\t "}},
                // missing read file
                {new String[]{"Read1\tRead2\tSamples", "reads/S1_1.fastq.gz\treads/S3_2.fastq.gz\tS1"}},
                // wrong number of values
                {new String[]{"Read1\tRead2\tSamples", "reads/S1_1.fastq.gz\tS1"}}
        };
    }

    @Test(dataProvider = "malformedManifests", expectedExceptions = UserException.MalformedManifest.class)
    public void testMalformedManifestIsRejected(final String[] lines) {
        SampleManifest.read(writeLines(dir.resolve("samples.tsv"), lines));
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingManifest() {
        SampleManifest.read(dir.resolve("absent.tsv"));
    }
}
