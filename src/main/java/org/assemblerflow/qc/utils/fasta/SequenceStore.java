package org.assemblerflow.qc.utils.fasta;

import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.utils.Utils;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Immutable, insertion-ordered collection of {@link SequenceRecord}s keyed by identifier.
 *
 * Iteration order is the order in which the records appeared in the input and is the canonical order
 * for every downstream aggregation. Filtering never removes records from a store; {@link #subset(Collection)}
 * derives a new store instead so the unfiltered records stay available.
 */
public final class SequenceStore implements Iterable<SequenceRecord> {

    private final Map<String, SequenceRecord> records;

    public SequenceStore(final List<SequenceRecord> records) {
        Utils.containsNoNull(records, "records must not contain null");
        final Map<String, SequenceRecord> byId = new LinkedHashMap<>(records.size() * 2);
        for (final SequenceRecord record : records) {
            if (byId.put(record.getId(), record) != null) {
                throw new UserException.MalformedFile("duplicate record identifier '" + record.getId() + "'");
            }
        }
        this.records = Collections.unmodifiableMap(byId);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public boolean contains(final String id) {
        return records.containsKey(id);
    }

    /**
     * @return the record with the given identifier
     * @throws IllegalArgumentException if there is no such record
     */
    public SequenceRecord get(final String id) {
        final SequenceRecord record = records.get(id);
        Utils.validateArg(record != null, () -> "no record with identifier " + id);
        return record;
    }

    public List<String> getIds() {
        return new ArrayList<>(records.keySet());
    }

    public List<SequenceRecord> getRecords() {
        return new ArrayList<>(records.values());
    }

    /**
     * Identifier to sequence, in input order.
     */
    public Map<String, String> asSequenceMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        records.values().forEach(r -> map.put(r.getId(), r.getSequence()));
        return map;
    }

    /**
     * Sum of all sequence lengths.
     */
    public long getTotalLength() {
        return records.values().stream().mapToLong(SequenceRecord::length).sum();
    }

    /**
     * Derives the store holding only the records named in {@code keptIds}. Input order is preserved
     * regardless of the order of {@code keptIds}.
     */
    public SequenceStore subset(final Collection<String> keptIds) {
        Utils.nonNull(keptIds);
        final Set<String> kept = new HashSet<>(keptIds);
        for (final String id : kept) {
            Utils.validateArg(records.containsKey(id), () -> "no record with identifier " + id);
        }
        return new SequenceStore(records.values().stream().filter(r -> kept.contains(r.getId())).collect(Collectors.toList()));
    }

    @Override
    public Iterator<SequenceRecord> iterator() {
        return records.values().iterator();
    }
}
