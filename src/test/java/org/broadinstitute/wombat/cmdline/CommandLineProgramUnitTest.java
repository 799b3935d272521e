package org.broadinstitute.wombat.cmdline;

import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.SpecialArgumentsCollection;
import org.broadinstitute.wombat.WombatBaseTest;
import org.broadinstitute.wombat.utils.config.WombatConfig;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Path;

public class CommandLineProgramUnitTest extends WombatBaseTest {

    @Test
    public void testGetUsage(){
        final CommandLineProgram clp = getClp();
        String usage = clp.getUsage();
        WombatBaseTest.assertContains(usage, "Usage:");
    }

    @Test
    public void testGetCommandLine(){
        final CommandLineProgram clp = getClp();
        Assert.assertNull(clp.getCommandLine()); //should be null since no args were specified
        Assert.assertFalse(clp.parseArgs(new String[]{"--" + SpecialArgumentsCollection.HELP_FULLNAME}));
        assertContains(clp.getCommandLine(), SpecialArgumentsCollection.HELP_FULLNAME); //now it should be filled in
    }

    private static class ValidationFailer extends CommandLineProgram{
        public static final String ERROR1 = "first error";
        public static final String ERROR2 = "second error";

        @Override
        protected Object doWork() {
            return null;
        }

        @Override
        protected String[] customCommandLineValidation(){
            return new String[]{ERROR1, ERROR2};
        }
    }

    @Test
    public void testCustomValidationFailThrowsCommandLineException(){
        ValidationFailer clp = new ValidationFailer();
        try{
            clp.parseArgs(new String[] {});
            Assert.fail("Should have thrown an exception");
        } catch (final CommandLineException e){
            final String message = e.getMessage();
            assertContains(message, ValidationFailer.ERROR1);
            assertContains(message, ValidationFailer.ERROR2);
        }
    }

    private static final class ConfigReader extends CommandLineProgram {
        @Override
        protected Object doWork() {
            return getConfig();
        }
    }

    @Test
    public void testConfigFileOverridesDefaults() {
        final Path configFile = writeLines(createTempDir("clp").resolve("wombat.properties"),
                "contigs.min_length = 500",
                "annotator = dfast");
        final WombatConfig config = (WombatConfig) new ConfigReader().instanceMain(new String[]{
                "--" + StandardArgumentDefinitions.WOMBAT_CONFIG_FILE_OPTION, configFile.toString(),
                "--" + StandardArgumentDefinitions.QUIET_NAME});
        Assert.assertEquals(config.contigs_min_length(), 500);
        Assert.assertEquals(config.annotator(), "dfast");
        // untouched keys keep their bundled values
        Assert.assertEquals(config.contigs_marker(), "C");
    }

    @Test
    public void testBundledDefaults() {
        final WombatConfig config = (WombatConfig) new ConfigReader().instanceMain(new String[]{"--" + StandardArgumentDefinitions.QUIET_NAME});
        Assert.assertEquals(config.contigs_min_length(), 200);
        Assert.assertEquals(config.annotator(), "prokka");
        Assert.assertFalse(config.trimming_enabled());
        Assert.assertEquals(config.spades_cov_cutoff(), "auto");
    }

    private static CommandLineProgram getClp() {
        return new CommandLineProgram() {
            @Override
            protected Object doWork() {
                return null;
            }
        };
    }
}
