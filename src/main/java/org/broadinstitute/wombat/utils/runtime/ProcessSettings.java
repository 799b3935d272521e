package org.broadinstitute.wombat.utils.runtime;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.wombat.utils.Utils;

import java.io.File;
import java.util.Arrays;

/**
 * One external command and how its output streams are captured.
 */
public final class ProcessSettings {
    private final String[] command;
    private File directory;
    private final OutputStreamSettings stdoutSettings = new OutputStreamSettings();
    private final OutputStreamSettings stderrSettings = new OutputStreamSettings();

    /**
     * @param command Command line to run.
     */
    public ProcessSettings(final String[] command) {
        Utils.nonNull(command);
        Utils.validateArg(command.length > 0, "Command cannot be empty");
        Utils.containsNoNull(Arrays.asList(command), "Command is not allowed to contain nulls");
        this.command = command;
    }

    public String[] getCommand() {
        return command;
    }

    public String getCommandString() {
        return StringUtils.join(command, " ");
    }

    public File getDirectory() {
        return directory;
    }

    /**
     * @param directory The directory to run the command in, or null to run in the current directory.
     */
    public void setDirectory(final File directory) {
        this.directory = directory;
    }

    public OutputStreamSettings getStdoutSettings() {
        return stdoutSettings;
    }

    public OutputStreamSettings getStderrSettings() {
        return stderrSettings;
    }
}
