package org.broadinstitute.wombat.utils.fasta;

import org.broadinstitute.wombat.utils.Utils;

import java.util.Objects;

/**
 * A named sequence read from or written to a FASTA file: the identifier is the first whitespace-free token of the
 * header line, the description whatever follows it (possibly empty).
 */
public final class SequenceRecord {
    private final String id;
    private final String description;
    private final String residues;

    public SequenceRecord(final String id, final String description, final String residues) {
        this.id = Utils.nonEmpty(id, "the sequence id cannot be empty");
        this.description = Utils.nonNull(description, "the description cannot be null; use the empty string");
        this.residues = Utils.nonNull(residues, "the residues cannot be null");
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public String getResidues() {
        return residues;
    }

    public int length() {
        return residues.length();
    }

    /**
     * @return a copy of this record with a new identifier and no description.
     */
    public SequenceRecord renamedWithoutDescription(final String newId) {
        return new SequenceRecord(newId, "", residues);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final SequenceRecord that = (SequenceRecord) o;
        return id.equals(that.id) && description.equals(that.description) && residues.equals(that.residues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, description, residues);
    }

    @Override
    public String toString() {
        return "SequenceRecord{" + id + ", length=" + residues.length() + "}";
    }
}
