package org.broadinstitute.wombat.utils.runtime;

import org.broadinstitute.wombat.utils.Utils;

import java.io.File;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Settings that define where the text of a process stream goes: a bounded in-memory buffer,
 * and/or a file (the usual target for tools that only write results to stdout).
 */
public final class OutputStreamSettings {
    private final EnumSet<StreamLocation> streamLocations = EnumSet.noneOf(StreamLocation.class);
    private int bufferSize;
    private File outputFile;
    private boolean appendFile;

    public Set<StreamLocation> getStreamLocations() {
        return Collections.unmodifiableSet(streamLocations);
    }

    public int getBufferSize() {
        return bufferSize;
    }

    /**
     * Capture at most {@code bufferSize} bytes into memory; anything beyond is dropped and the capture is
     * flagged as truncated.
     */
    public void setBufferSize(final int bufferSize) {
        Utils.validateArg(bufferSize >= 0, "the buffer size cannot be negative");
        this.streamLocations.add(StreamLocation.Buffer);
        this.bufferSize = bufferSize;
    }

    public File getOutputFile() {
        return outputFile;
    }

    public boolean isAppendFile() {
        return appendFile;
    }

    /**
     * Overwrites the outputFile with the process output.
     *
     * @param outputFile File to overwrite.
     */
    public void setOutputFile(final File outputFile) {
        setOutputFile(outputFile, false);
    }

    public void setOutputFile(final File outputFile, final boolean append) {
        Utils.nonNull(outputFile, "outputFile cannot be null");
        streamLocations.add(StreamLocation.File);
        this.outputFile = outputFile;
        this.appendFile = append;
    }

}
