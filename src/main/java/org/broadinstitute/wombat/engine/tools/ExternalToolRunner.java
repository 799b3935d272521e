package org.broadinstitute.wombat.engine.tools;

import org.broadinstitute.wombat.utils.runtime.ProcessOutput;

/**
 * Runs external programs on behalf of the pipeline stages. A call blocks until the program exits; the exit value
 * is reported, not interpreted, so deciding what a non-zero value means is left to the caller.
 * Implementations must be safe to call from several sample worker threads at once.
 */
@FunctionalInterface
public interface ExternalToolRunner {

    /**
     * @throws org.broadinstitute.wombat.exceptions.UserException.CannotExecuteProgram if the program cannot be found
     */
    ProcessOutput run(ToolInvocation invocation);
}
