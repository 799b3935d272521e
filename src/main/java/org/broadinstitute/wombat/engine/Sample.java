package org.broadinstitute.wombat.engine;

import org.broadinstitute.wombat.utils.Utils;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A sequenced isolate: its identifier and its raw paired-end read files.
 */
public final class Sample {
    private final String id;
    private final Path forwardReads;
    private final Path reverseReads;

    public Sample(final String id, final Path forwardReads, final Path reverseReads) {
        this.id = Utils.nonEmpty(id, "sample id");
        this.forwardReads = Utils.nonNull(forwardReads, "forward reads cannot be null");
        this.reverseReads = Utils.nonNull(reverseReads, "reverse reads cannot be null");
    }

    public String getId() {
        return id;
    }

    public Path getForwardReads() {
        return forwardReads;
    }

    public Path getReverseReads() {
        return reverseReads;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Sample sample = (Sample) o;
        return id.equals(sample.id) && forwardReads.equals(sample.forwardReads) && reverseReads.equals(sample.reverseReads);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, forwardReads, reverseReads);
    }

    @Override
    public String toString() {
        return id;
    }
}
