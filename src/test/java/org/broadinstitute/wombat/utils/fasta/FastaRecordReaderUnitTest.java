package org.broadinstitute.wombat.utils.fasta;

import org.broadinstitute.wombat.WombatBaseTest;
import org.broadinstitute.wombat.exceptions.UserException;
import org.broadinstitute.wombat.tools.homology.ProteinLengthIndex;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.zip.GZIPOutputStream;

public final class FastaRecordReaderUnitTest extends WombatBaseTest {

    @DataProvider(name = "extensions")
    public Object[][] extensions() {
        return new Object[][]{{".fasta"}, {".fa"}, {".fna"}, {".faa"}, {".pep"}, {".txt"}, {""}};
    }

    @Test(dataProvider = "extensions")
    public void testFileNameDoesNotMatter(final String extension) {
        final Path fasta = writeLines(createTempDir("fasta").resolve("proteins" + extension), ">P1 toxin A", "MKVLA", "AGIVG");
        try (final FastaRecordReader reader = new FastaRecordReader(fasta)) {
            final List<SequenceRecord> records = reader.stream().collect(Collectors.toList());
            Assert.assertEquals(records, Arrays.asList(new SequenceRecord("P1", "toxin A", "MKVLAAGIVG")));
        }
        Assert.assertEquals(ProteinLengthIndex.fromFasta(fasta).lengthOf("P1").getAsInt(), 10);
    }

    @Test
    public void testMultiLineRecordsAndBlankLines() {
        final Path fasta = writeLines(createTempDir("fasta").resolve("contigs.fna"),
                "",
                ">NODE_1_length_8 ",
                "ACGT\r",
                "",
                "ACGT",
                ">NODE_2_length_0",
                ">NODE_3_length_2\tcomponent_1",
                "GG");
        try (final FastaRecordReader reader = new FastaRecordReader(fasta)) {
            Assert.assertEquals(reader.stream().collect(Collectors.toList()), Arrays.asList(
                    new SequenceRecord("NODE_1_length_8", "", "ACGTACGT"),
                    new SequenceRecord("NODE_2_length_0", "", ""),
                    new SequenceRecord("NODE_3_length_2", "component_1", "GG")));
        }
    }

    @Test
    public void testGzippedInput() throws IOException {
        final Path fasta = createTempDir("fasta").resolve("proteins.faa.gz");
        try (final OutputStream out = new GZIPOutputStream(Files.newOutputStream(fasta))) {
            out.write(">P1\nMKV\n>P2\nMK\n".getBytes(StandardCharsets.US_ASCII));
        }
        final ProteinLengthIndex index = ProteinLengthIndex.fromFasta(fasta);
        Assert.assertEquals(index.size(), 2);
        Assert.assertEquals(index.lengthOf("P2").getAsInt(), 2);
    }

    @Test
    public void testEmptyFileHasNoRecords() {
        final Path fasta = writeLines(createTempDir("fasta").resolve("empty.faa"));
        try (final FastaRecordReader reader = new FastaRecordReader(fasta)) {
            Assert.assertFalse(reader.iterator().hasNext());
        }
    }

    @Test(expectedExceptions = UserException.MalformedSequenceFile.class)
    public void testSequenceBeforeFirstHeader() {
        new FastaRecordReader(writeLines(createTempDir("fasta").resolve("bad.faa"), "MKVLAAGIVG", ">P1", "MK"));
    }

    @Test(expectedExceptions = UserException.MalformedSequenceFile.class)
    public void testEmptyHeader() {
        try (final FastaRecordReader reader = new FastaRecordReader(
                writeLines(createTempDir("fasta").resolve("bad.faa"), ">P1", "MK", ">", "MK"))) {
            reader.stream().collect(Collectors.toList());
        }
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingFile() {
        new FastaRecordReader(createTempDir("fasta").resolve("absent.faa"));
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testDirectoryIsNotAFastaFile() {
        new FastaRecordReader(createTempDir("fasta"));
    }
}
