package org.broadinstitute.wombat.engine.tools;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.wombat.utils.Utils;

import java.nio.file.Path;
import java.util.*;

/**
 * One call of an external program: the executable, its arguments, and optionally where its standard output goes
 * and the directory it runs in. Instances are immutable; the {@code with} methods return modified copies.
 */
public final class ToolInvocation {
    private final String program;
    private final List<String> arguments;
    private final Path stdoutFile;
    private final boolean appendStdout;
    private final Path workingDirectory;

    private ToolInvocation(final String program, final List<String> arguments, final Path stdoutFile,
                           final boolean appendStdout, final Path workingDirectory) {
        this.program = Utils.nonEmpty(program, "program");
        Utils.containsNoNull(arguments, "arguments cannot contain null");
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        this.stdoutFile = stdoutFile;
        this.appendStdout = appendStdout;
        this.workingDirectory = workingDirectory;
    }

    public static ToolInvocation of(final String program, final List<String> arguments) {
        return new ToolInvocation(program, arguments, null, false, null);
    }

    public static ToolInvocation of(final String program, final String... arguments) {
        return of(program, Arrays.asList(arguments));
    }

    /**
     * @return a copy whose standard output is written to {@code file}, truncating it first unless {@code append}
     */
    public ToolInvocation withStdoutTo(final Path file, final boolean append) {
        return new ToolInvocation(program, arguments, Utils.nonNull(file), append, workingDirectory);
    }

    public ToolInvocation inDirectory(final Path directory) {
        return new ToolInvocation(program, arguments, stdoutFile, appendStdout, Utils.nonNull(directory));
    }

    public String getProgram() {
        return program;
    }

    public List<String> getArguments() {
        return arguments;
    }

    /**
     * @return the program followed by its arguments
     */
    public String[] getCommandLine() {
        final String[] commandLine = new String[arguments.size() + 1];
        commandLine[0] = program;
        for (int i = 0; i < arguments.size(); i++) {
            commandLine[i + 1] = arguments.get(i);
        }
        return commandLine;
    }

    public Optional<Path> getStdoutFile() {
        return Optional.ofNullable(stdoutFile);
    }

    public boolean isAppendStdout() {
        return appendStdout;
    }

    public Optional<Path> getWorkingDirectory() {
        return Optional.ofNullable(workingDirectory);
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder(StringUtils.join(getCommandLine(), " "));
        if (stdoutFile != null) {
            builder.append(appendStdout ? " >> " : " > ").append(stdoutFile);
        }
        return builder.toString();
    }
}
