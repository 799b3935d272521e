package org.broadinstitute.wombat.utils.runtime;

import org.apache.commons.io.IOUtils;
import org.broadinstitute.wombat.exceptions.UserException;

import java.io.*;

/**
 * Stream output captured from a process stream. Every configured {@link StreamLocation} receives the bytes
 * read; the in-memory buffer stops growing once it holds {@link OutputStreamSettings#getBufferSize()} bytes.
 */
public final class CapturedStreamOutput extends StreamOutput {
    // Size of buffers used to transfer data read from process streams
    public static final int STREAM_BLOCK_TRANSFER_SIZE = 4096;

    private final InputStream processStream;
    private final OutputStream fileStream;
    private final ByteArrayOutputStream bufferStream;
    private final int bufferLimit;
    private final boolean capturingBuffer;
    private boolean bufferTruncated = false;

    /**
     * @param settings       Settings that define what to capture.
     * @param processStream  Stream to capture output.
     */
    public CapturedStreamOutput(final OutputStreamSettings settings, final InputStream processStream) {
        this.processStream = processStream;
        this.capturingBuffer = settings.getStreamLocations().contains(StreamLocation.Buffer);
        this.bufferLimit = capturingBuffer ? settings.getBufferSize() : 0;
        this.bufferStream = new ByteArrayOutputStream(Math.min(bufferLimit, STREAM_BLOCK_TRANSFER_SIZE));

        // the buffer is handled separately so we can enforce the limit
        if (settings.getStreamLocations().contains(StreamLocation.File)) {
            try {
                fileStream = new BufferedOutputStream(new FileOutputStream(settings.getOutputFile(), settings.isAppendFile()));
            } catch (final IOException e) {
                throw new UserException.CouldNotCreateOutputFile(settings.getOutputFile(), e.getMessage());
            }
        } else {
            fileStream = null;
        }
    }

    @Override
    public byte[] getBufferBytes() {
        return bufferStream.toByteArray();
    }

    @Override
    public boolean isBufferTruncated() {
        return bufferTruncated;
    }

    /**
     * Drain the input stream to keep the process from backing up until it's empty.
     * File streams will be closed automatically when this method returns.
     *
     * @throws IOException When unable to read or write.
     */
    public void read() throws IOException {
        try {
            final byte[] buf = new byte[STREAM_BLOCK_TRANSFER_SIZE];
            int readCount;
            while ((readCount = processStream.read(buf)) >= 0) {
                captureIntoBuffer(buf, readCount);
                if (fileStream != null) {
                    fileStream.write(buf, 0, readCount);
                }
            }
        } finally {
            if (fileStream != null) {
                fileStream.flush();
                IOUtils.closeQuietly(fileStream);
            }
        }
    }

    private void captureIntoBuffer(final byte[] buf, final int readCount) {
        if (!capturingBuffer) {
            return;
        }
        final int room = bufferLimit - bufferStream.size();
        if (readCount > room) {
            bufferTruncated = true;
        }
        if (room > 0) {
            bufferStream.write(buf, 0, Math.min(room, readCount));
        }
    }
}
