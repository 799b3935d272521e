package org.broadinstitute.wombat.engine;

import org.broadinstitute.wombat.WombatBaseTest;
import org.broadinstitute.wombat.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.nio.file.Path;

public final class AuxiliaryFilesUnitTest extends WombatBaseTest {

    private Path dir;

    @BeforeMethod
    public void createFiles() {
        dir = createTempDir("auxiliaryFiles");
        writeLines(dir.resolve("adapters.fa"), ">adapter", "AGATCGGAAGAGC");
        writeLines(dir.resolve("reference.fasta"), ">chr", "ACGTACGT");
        writeLines(dir.resolve("proteins.faa"), ">P1", "MKV");
    }

    @Test
    public void testAllRoutes() {
        final Path manifest = writeLines(dir.resolve("aux.tsv"), "Route", "adapters.fa", "reference.fasta", "proteins.faa");
        final AuxiliaryFiles files = AuxiliaryFiles.read(manifest, true, true);
        Assert.assertEquals(files.getAdapters().get(), dir.resolve("adapters.fa").toAbsolutePath());
        Assert.assertEquals(files.getReferenceGenome().get(), dir.resolve("reference.fasta").toAbsolutePath());
        Assert.assertEquals(files.getProteinDatabase().get(), dir.resolve("proteins.faa").toAbsolutePath());
    }

    @Test
    public void testAbsentReferenceGenome() {
        final Path manifest = writeLines(dir.resolve("aux.tsv"), "Route", "adapters.fa", "NA", "proteins.faa");
        final AuxiliaryFiles files = AuxiliaryFiles.read(manifest, true, true);
        Assert.assertFalse(files.getReferenceGenome().isPresent());
    }

    @Test
    public void testOptionalRoutesMayBeAbsentWhenNotNeeded() {
        final Path manifest = writeLines(dir.resolve("aux.tsv"), "Route", "-", "None", "NA");
        final AuxiliaryFiles files = AuxiliaryFiles.read(manifest, false, false);
        Assert.assertFalse(files.getAdapters().isPresent());
        Assert.assertFalse(files.getProteinDatabase().isPresent());
    }

    @Test(expectedExceptions = UserException.MalformedManifest.class)
    public void testAdaptersRequiredWhenTrimming() {
        AuxiliaryFiles.read(writeLines(dir.resolve("aux.tsv"), "Route", "NA", "NA", "proteins.faa"), true, false);
    }

    @Test(expectedExceptions = UserException.MalformedManifest.class)
    public void testProteinDatabaseRequiredForHomologySearch() {
        AuxiliaryFiles.read(writeLines(dir.resolve("aux.tsv"), "Route", "adapters.fa", "NA", "NA"), false, true);
    }

    @Test(expectedExceptions = UserException.MalformedManifest.class)
    public void testWrongNumberOfRoutes() {
        AuxiliaryFiles.read(writeLines(dir.resolve("aux.tsv"), "Route", "adapters.fa", "reference.fasta"), true, false);
    }

    @Test(expectedExceptions = UserException.MalformedManifest.class)
    public void testMissingFile() {
        AuxiliaryFiles.read(writeLines(dir.resolve("aux.tsv"), "Route", "adapters.fa", "missing.fasta", "proteins.faa"), true, true);
    }

    @Test(expectedExceptions = UserException.MalformedManifest.class)
    public void testMissingRouteColumn() {
        AuxiliaryFiles.read(writeLines(dir.resolve("aux.tsv"), "Path", "adapters.fa", "NA", "proteins.faa"), true, true);
    }
}
