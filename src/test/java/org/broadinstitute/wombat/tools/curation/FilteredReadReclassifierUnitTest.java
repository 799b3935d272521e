package org.broadinstitute.wombat.tools.curation;

import org.broadinstitute.wombat.WombatBaseTest;
import org.broadinstitute.wombat.engine.layout.ArtifactRole;
import org.broadinstitute.wombat.exceptions.WombatException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;

public final class FilteredReadReclassifierUnitTest extends WombatBaseTest {

    @Test
    public void testPrinseqRoles() {
        final ReadFileRoleRegistry registry = ReadFileRoleRegistry.PRINSEQ;
        Assert.assertTrue(registry.isProducedByTool("S1_R1_paired_prinseq_good_Ab3x.fastq"));
        Assert.assertFalse(registry.isProducedByTool("S1_R1_paired.fastq"));
        Assert.assertTrue(registry.isDiscarded("S1_R1_paired_prinseq_good_singletons_Ab3x.fastq"));
        Assert.assertEquals(registry.roleOf("S1_R1_paired_prinseq_good_Ab3x.fastq", "S1"), Optional.of(ArtifactRole.R1_PAIRED));
        Assert.assertEquals(registry.roleOf("S1_R2_paired_prinseq_good_Ab3x.fastq", "S1"), Optional.of(ArtifactRole.R2_PAIRED));
        Assert.assertEquals(registry.roleOf("S10_R1_paired_prinseq_good_Ab3x.fastq", "S1"), Optional.empty());
        Assert.assertEquals(registry.getRoles(), EnumSet.of(ArtifactRole.R1_PAIRED, ArtifactRole.R2_PAIRED));
    }

    @Test
    public void testReclassify() {
        final Path source = createTempDir("trim");
        final Path destination = createTempDir("filter").resolve("S1");
        writeLines(source.resolve("S1_R1_paired.fastq"), "@r", "ACGT", "+", "IIII");
        writeLines(source.resolve("S1_R1_paired_prinseq_good_Ab3x.fastq"), "@r", "ACGT", "+", "IIII");
        writeLines(source.resolve("S1_R2_paired_prinseq_good_Cd4y.fastq"), "@r", "ACGT", "+", "IIII");
        writeLines(source.resolve("S1_R1_paired_prinseq_good_singletons_Ef5z.fastq"), "@r", "ACGT", "+", "IIII");
        writeLines(source.resolve("nested").resolve("S1_R2_paired_prinseq_good_singletons_Gh6w.fastq"), "@r", "ACGT", "+", "IIII");

        final Map<ArtifactRole, Path> roles = new FilteredReadReclassifier(ReadFileRoleRegistry.PRINSEQ)
                .reclassify(source, "S1", destination);

        Assert.assertEquals(roles.size(), 2);
        Assert.assertEquals(roles.get(ArtifactRole.R1_PAIRED), destination.resolve("S1_R1_paired_prinseq_good_Ab3x.fastq"));
        Assert.assertEquals(roles.get(ArtifactRole.R2_PAIRED), destination.resolve("S1_R2_paired_prinseq_good_Cd4y.fastq"));
        Assert.assertTrue(Files.isRegularFile(roles.get(ArtifactRole.R1_PAIRED)));
        Assert.assertTrue(Files.isRegularFile(roles.get(ArtifactRole.R2_PAIRED)));

        // tool files are moved or deleted; the tool's inputs stay
        Assert.assertTrue(Files.exists(source.resolve("S1_R1_paired.fastq")));
        Assert.assertFalse(Files.exists(source.resolve("S1_R1_paired_prinseq_good_Ab3x.fastq")));
        Assert.assertFalse(Files.exists(source.resolve("S1_R1_paired_prinseq_good_singletons_Ef5z.fastq")));
        Assert.assertFalse(Files.exists(source.resolve("nested").resolve("S1_R2_paired_prinseq_good_singletons_Gh6w.fastq")));
        Assert.assertFalse(Files.exists(destination.resolve("S1_R1_paired_prinseq_good_singletons_Ef5z.fastq")));
    }

    @Test
    public void testDottedPrinseqNames() {
        final Path source = createTempDir("trim");
        final Path destination = createTempDir("filter");
        writeLines(source.resolve("S1_R1_paired.prinseq.fastq"), "@r", "ACGT", "+", "IIII");
        writeLines(source.resolve("S1_R2_paired.prinseq.fastq"), "@r", "ACGT", "+", "IIII");
        writeLines(source.resolve("S1_R1_singletons.prinseq.fastq"), "@r", "ACGT", "+", "IIII");

        final Map<ArtifactRole, Path> roles = new FilteredReadReclassifier(ReadFileRoleRegistry.PRINSEQ)
                .reclassify(source, "S1", destination);

        Assert.assertEquals(roles.get(ArtifactRole.R1_PAIRED).getFileName().toString(), "S1_R1_paired.prinseq.fastq");
        Assert.assertEquals(roles.get(ArtifactRole.R2_PAIRED).getFileName().toString(), "S1_R2_paired.prinseq.fastq");
        Assert.assertFalse(Files.exists(source.resolve("S1_R1_singletons.prinseq.fastq")));
        Assert.assertFalse(Files.exists(destination.resolve("S1_R1_singletons.prinseq.fastq")));
    }

    @Test
    public void testNoToolOutput() {
        final Path source = createTempDir("trim");
        writeLines(source.resolve("S1_R1_paired.fastq"), "@r", "ACGT", "+", "IIII");
        final Map<ArtifactRole, Path> roles = new FilteredReadReclassifier(ReadFileRoleRegistry.PRINSEQ)
                .reclassify(source, "S1", createTempDir("filter"));
        Assert.assertTrue(roles.isEmpty());
    }

    @Test(expectedExceptions = WombatException.class)
    public void testAmbiguousRole() {
        final Path source = createTempDir("trim");
        writeLines(source.resolve("S1_R1_paired_prinseq_good_Ab3x.fastq"), "@r", "ACGT", "+", "IIII");
        writeLines(source.resolve("S1_R1_paired_prinseq_good_Zz9z.fastq"), "@r", "ACGT", "+", "IIII");
        new FilteredReadReclassifier(ReadFileRoleRegistry.PRINSEQ).reclassify(source, "S1", createTempDir("filter"));
    }
}
