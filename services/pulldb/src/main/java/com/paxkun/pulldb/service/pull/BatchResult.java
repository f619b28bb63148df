package com.paxkun.pulldb.service.pull;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-item classification of one batch call. Only the buckets the operation can produce are
 * reported, and those are always present even when empty.
 *
 * Author: Pax
 */
public final class BatchResult {

    private final Set<ClassificationBucket> declared;
    private final Map<ClassificationBucket, List<String>> entries = new EnumMap<>(ClassificationBucket.class);

    private BatchResult(Set<ClassificationBucket> declared) {
        this.declared = declared;
        for (ClassificationBucket bucket : declared) {
            entries.put(bucket, new ArrayList<>());
        }
    }

    public static BatchResult of(ClassificationBucket first, ClassificationBucket... rest) {
        return new BatchResult(EnumSet.of(first, rest));
    }

    public static BatchResult forUpdates() {
        return of(ClassificationBucket.UPDATED, ClassificationBucket.SKIPPED, ClassificationBucket.FAILED);
    }

    public static BatchResult forAdds() {
        return of(ClassificationBucket.ADDED, ClassificationBucket.SKIPPED, ClassificationBucket.FAILED);
    }

    public static BatchResult forRemovals() {
        return of(ClassificationBucket.REMOVED, ClassificationBucket.SKIPPED, ClassificationBucket.FAILED);
    }

    public BatchResult record(ClassificationBucket bucket, String id) {
        if (!declared.contains(bucket)) {
            throw new IllegalArgumentException("Bucket " + bucket + " is not reported by this operation");
        }
        entries.get(bucket).add(id);
        return this;
    }

    public BatchResult record(ClassificationBucket bucket, long id) {
        return record(bucket, String.valueOf(id));
    }

    /**
     * Appends another result's entries to this one.
     */
    public BatchResult merge(BatchResult other) {
        for (Map.Entry<ClassificationBucket, List<String>> entry : other.entries.entrySet()) {
            for (String id : entry.getValue()) {
                record(entry.getKey(), id);
            }
        }
        return this;
    }

    public List<String> get(ClassificationBucket bucket) {
        List<String> ids = entries.get(bucket);
        return ids == null ? List.of() : Collections.unmodifiableList(ids);
    }

    public int count(ClassificationBucket bucket) {
        return get(bucket).size();
    }

    @JsonValue
    public Map<String, List<String>> toMap() {
        Map<String, List<String>> view = new LinkedHashMap<>();
        for (Map.Entry<ClassificationBucket, List<String>> entry : entries.entrySet()) {
            view.put(entry.getKey().wireName(), List.copyOf(entry.getValue()));
        }
        return view;
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
