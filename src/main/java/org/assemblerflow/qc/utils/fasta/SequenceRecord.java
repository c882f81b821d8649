package org.assemblerflow.qc.utils.fasta;

import org.assemblerflow.qc.utils.Utils;

/**
 * One parsed FASTA record: the header text without its leading '>' and the concatenated sequence.
 */
public final class SequenceRecord {

    private final String id;
    private final String sequence;

    public SequenceRecord(final String id, final String sequence) {
        this.id = Utils.nonNull(id, "record id");
        this.sequence = Utils.nonNull(sequence, "record sequence");
    }

    public String getId() {
        return id;
    }

    public String getSequence() {
        return sequence;
    }

    public int length() {
        return sequence.length();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final SequenceRecord that = (SequenceRecord) o;
        return id.equals(that.id) && sequence.equals(that.sequence);
    }

    @Override
    public int hashCode() {
        return 31 * id.hashCode() + sequence.hashCode();
    }

    @Override
    public String toString() {
        return id + " (" + sequence.length() + " bp)";
    }
}
