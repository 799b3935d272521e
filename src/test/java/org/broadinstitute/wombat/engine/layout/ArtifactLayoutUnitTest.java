package org.broadinstitute.wombat.engine.layout;

import org.broadinstitute.wombat.WombatBaseTest;
import org.broadinstitute.wombat.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

public final class ArtifactLayoutUnitTest extends WombatBaseTest {

    private static final Path ROOT = Paths.get("/data/run1");

    @Test
    public void testPathsAreDeterministic() {
        final ArtifactLayout layout = new ArtifactLayout(ROOT);
        final ArtifactLayout other = new ArtifactLayout(Paths.get("/data/./run1"));
        for (final Stage stage : Stage.values()) {
            if (stage.isPerSample()) {
                Assert.assertEquals(layout.directoryFor(stage, "S1"), other.directoryFor(stage, "S1"));
            } else {
                Assert.assertEquals(layout.directoryFor(stage), other.directoryFor(stage));
            }
        }
        Assert.assertEquals(layout.pathFor(Stage.CURATE_CONTIGS, "S1", ArtifactRole.CONTIGS_CURATED),
                ROOT.resolve("Contigs_renamed_shorten").resolve("S1").resolve("S1_contigs.fasta"));
        Assert.assertEquals(layout.pathFor(Stage.ANNOTATE, "S1", ArtifactRole.ANNOTATION_GFF),
                ROOT.resolve("Prokka_annotation").resolve("S1").resolve("S1.gff"));
        Assert.assertEquals(layout.pathFor(Stage.CROSS_SAMPLE_TYPING, ArtifactRole.TYPING_REPORT),
                ROOT.resolve("MLST").resolve("MLST.txt"));
    }

    @Test
    public void testDistinctSamplesNeverShareAFile() {
        final ArtifactLayout layout = new ArtifactLayout(ROOT);
        final Set<Path> seen = new HashSet<>();
        for (final String sampleId : new String[]{"S1", "S10", "S1_a", "s1"}) {
            for (final Stage stage : Stage.values()) {
                if (stage.isPerSample()) {
                    Assert.assertTrue(seen.add(layout.directoryFor(stage, sampleId)), stage + " " + sampleId);
                }
            }
        }
    }

    @Test
    public void testDistinctStagesHaveDistinctDirectories() {
        final ArtifactLayout layout = new ArtifactLayout(ROOT);
        final Set<Path> seen = new HashSet<>();
        for (final Stage stage : Stage.values()) {
            Assert.assertTrue(seen.add(layout.directoryFor(stage)), stage.getName());
        }
    }

    @DataProvider(name = "invalidSampleIds")
    public Object[][] invalidSampleIds() {
        return new Object[][]{
                {""},
                {"../S1"},
                {"S1/extra"},
                {"S 1"},
                {".hidden"},
                {"_S1"},
                {"S1.fastq"}
        };
    }

    @Test(dataProvider = "invalidSampleIds", expectedExceptions = UserException.InvalidSampleIdentifier.class)
    public void testInvalidSampleIdsAreRejected(final String sampleId) {
        new ArtifactLayout(ROOT).directoryFor(Stage.TRIM, sampleId);
    }

    @Test(expectedExceptions = UserException.InvalidSampleIdentifier.class)
    public void testNullSampleIdIsRejected() {
        ArtifactLayout.validateSampleId(null);
    }

    @Test
    public void testValidSampleIds() {
        Assert.assertTrue(ArtifactLayout.isValidSampleId("S1"));
        Assert.assertTrue(ArtifactLayout.isValidSampleId("isolate-2_b"));
        Assert.assertTrue(ArtifactLayout.isValidSampleId("7"));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testCrossSampleStageHasNoSampleDirectory() {
        new ArtifactLayout(ROOT).directoryFor(Stage.PANGENOME, "S1");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testPerSampleRoleNeedsASampleId() {
        new ArtifactLayout(ROOT).pathFor(Stage.ANNOTATE, ArtifactRole.ANNOTATION_GFF);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testCrossSampleRoleTakesNoSampleId() {
        new ArtifactLayout(ROOT).pathFor(Stage.ANNOTATE, "S1", ArtifactRole.TYPING_REPORT);
    }

    @Test
    public void testDefaultRoot() {
        final Path root = ArtifactLayout.defaultRoot(ROOT, LocalDateTime.of(2024, 3, 5, 14, 7, 9));
        Assert.assertEquals(root, ROOT.resolve("Workflow_OUTPUT_20240305_140709"));
    }
}
