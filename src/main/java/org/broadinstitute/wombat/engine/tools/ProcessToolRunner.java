package org.broadinstitute.wombat.engine.tools;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.wombat.exceptions.UserException;
import org.broadinstitute.wombat.utils.runtime.ProcessController;
import org.broadinstitute.wombat.utils.runtime.ProcessOutput;
import org.broadinstitute.wombat.utils.runtime.ProcessSettings;
import org.broadinstitute.wombat.utils.runtime.RuntimeUtils;

/**
 * Runs programs as child processes through the calling thread's {@link ProcessController}.
 * Captured stdout (when not sent to a file) and stderr are bounded to {@link #CAPTURE_BUFFER_SIZE} bytes each.
 */
public final class ProcessToolRunner implements ExternalToolRunner {
    private static final Logger logger = LogManager.getLogger(ProcessToolRunner.class);

    public static final int CAPTURE_BUFFER_SIZE = 64 * 1024;

    @Override
    public ProcessOutput run(final ToolInvocation invocation) {
        if (RuntimeUtils.which(invocation.getProgram()) == null) {
            throw new UserException.CannotExecuteProgram(invocation.getProgram(),
                    "It was not found on the PATH; install it or add its directory to the PATH.");
        }

        final ProcessSettings settings = new ProcessSettings(invocation.getCommandLine());
        settings.getStderrSettings().setBufferSize(CAPTURE_BUFFER_SIZE);
        if (invocation.getStdoutFile().isPresent()) {
            settings.getStdoutSettings().setOutputFile(invocation.getStdoutFile().get().toFile(), invocation.isAppendStdout());
        } else {
            settings.getStdoutSettings().setBufferSize(CAPTURE_BUFFER_SIZE);
        }
        invocation.getWorkingDirectory().ifPresent(directory -> settings.setDirectory(directory.toFile()));

        logger.debug("Executing: " + invocation);
        final ProcessOutput output = ProcessController.getThreadLocal().exec(settings);
        logger.debug(String.format("%s exited with code %d", invocation.getProgram(), output.getExitValue()));
        return output;
    }
}
