package org.broadinstitute.wombat.utils.runtime;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.wombat.exceptions.WombatException;
import org.broadinstitute.wombat.utils.Utils;

import java.io.IOException;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Facade to java.lang.ProcessBuilder and java.lang.Process.  Handles
 * running a process to completion and returns stdout and stderr
 * as captured by the {@link OutputStreamSettings} of the call.  Creates separate threads for reading stdout and
 * stderr so that neither pipe backs up and freezes the child.  Instances are not thread-safe; use
 * {@link #getThreadLocal()} from worker threads.
 */
public final class ProcessController {
    private static final Logger logger = LogManager.getLogger(ProcessController.class);

    private enum ProcessStream {STDOUT, STDERR}

    // Not a fixed pool: every blocking exec needs two capture threads of its own.
    private static final ExecutorService executorService = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("WombatProcessController-%d").setDaemon(true).build());

    /**
     * Thread local process controller container.
     */
    private static final ThreadLocal<ProcessController> threadProcessController = ThreadLocal.withInitial(ProcessController::new);

    private static final AtomicInteger nextControllerId = new AtomicInteger();
    private final int controllerId;

    private Process process;
    private Future<CapturedStreamOutput> stdOutFuture;
    private Future<CapturedStreamOutput> stdErrFuture;

    // When a caller destroys a controller a new thread local version will be created
    private boolean destroyed = false;

    public ProcessController() {
        controllerId = nextControllerId.getAndIncrement();
    }

    /**
     * Returns a thread local ProcessController.
     * Should NOT be closed when finished so it can be reused by the thread.
     *
     * @return a thread local ProcessController.
     */
    public static ProcessController getThreadLocal() {
        if (threadProcessController.get().destroyed)
            threadProcessController.remove();
        return threadProcessController.get();
    }

    /**
     * Executes a command line program with the settings and waits for it to return,
     * processing the output on background threads.
     *
     * @param settings Settings to be run.
     * @return The output of the command.
     */
    public ProcessOutput exec(final ProcessSettings settings) {
        Utils.nonNull(settings, "settings cannot be null");
        final StreamOutput stdout;
        final StreamOutput stderr;
        final int exitCode;

        launchProcess(settings);

        try {
            stdOutFuture = executorService.submit(new OutputCapture(
                    new CapturedStreamOutput(settings.getStdoutSettings(), process.getInputStream()),
                    ProcessStream.STDOUT));
            stdErrFuture = executorService.submit(new OutputCapture(
                    new CapturedStreamOutput(settings.getStderrSettings(), process.getErrorStream()),
                    ProcessStream.STDERR));

            try {
                // external tools here never read stdin
                process.getOutputStream().close();
                process.waitFor();
                stdout = stdOutFuture.get();
                stdOutFuture = null;
                stderr = stdErrFuture.get();
                stdErrFuture = null;
            } catch (final ExecutionException e) {
                throw new WombatException("Execution exception during process output retrieval", e);
            } catch (final IOException e) {
                throw new WombatException("Unable to close stdin on command: " + settings.getCommandString(), e);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                tryCleanShutdown();
                throw new WombatException("Process interrupted: " + settings.getCommandString(), e);
            }
        } finally {
            exitCode = process.isAlive() ? -1 : process.exitValue();
            process = null;
        }
        return new ProcessOutput(exitCode, stdout, stderr);
    }

    private void launchProcess(final ProcessSettings settings) {
        Utils.validate(!destroyed, "This controller was destroyed");

        final ProcessBuilder builder = new ProcessBuilder(settings.getCommand());
        builder.directory(settings.getDirectory());

        try {
            process = builder.start();
        } catch (final IOException e) {
            final String message = String.format("Unable to start command: %s\nReason: %s",
                    StringUtils.join(builder.command(), " "),
                    e.getMessage());
            throw new WombatException(message, e);
        }
    }

    /**
     * Stops the process from running and tries to ensure process is cleaned up properly.
     * NOTE: sub-processes started by process may be zombied with their parents set to pid 1.
     */
    public void tryCleanShutdown() {
        destroyed = true;

        if (stdErrFuture != null && !stdErrFuture.cancel(true)) {
            logger.error("Failure cancelling stderr task");
        }
        if (stdOutFuture != null && !stdOutFuture.cancel(true)) {
            logger.error("Failure cancelling stdout task");
        }
        if (process != null) {
            process.destroy();
            IOUtils.closeQuietly(process.getInputStream());
            IOUtils.closeQuietly(process.getErrorStream());
        }
    }

    private final class OutputCapture implements Callable<CapturedStreamOutput> {
        private final CapturedStreamOutput capturedProcessStream;
        private final String contextName;

        OutputCapture(final CapturedStreamOutput capturedProcessStream, final ProcessStream key) {
            this.capturedProcessStream = capturedProcessStream;
            this.contextName = String.format("OutputCapture-%d-%s", controllerId, key.name().toLowerCase());
        }

        @Override
        public CapturedStreamOutput call() {
            try {
                capturedProcessStream.read();
            } catch (final IOException e) {
                logger.error("Error reading process output in " + contextName, e);
            }
            return capturedProcessStream;
        }
    }
}
