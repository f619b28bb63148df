package com.paxkun.pulldb.service.stream;

import com.paxkun.pulldb.concurrent.KeyedLocks;
import com.paxkun.pulldb.model.Pull;
import com.paxkun.pulldb.model.Stream;
import com.paxkun.pulldb.model.UserIdentity;
import com.paxkun.pulldb.model.Volume;
import com.paxkun.pulldb.service.LoggerService;
import com.paxkun.pulldb.service.page.Page;
import com.paxkun.pulldb.service.page.PageRequest;
import com.paxkun.pulldb.service.page.PagedQueryService;
import com.paxkun.pulldb.service.pull.BatchResult;
import com.paxkun.pulldb.service.pull.ClassificationBucket;
import com.paxkun.pulldb.store.EntityKey;
import com.paxkun.pulldb.store.EntityQuery;
import com.paxkun.pulldb.store.EntityStore;
import com.paxkun.pulldb.util.Identifiers;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * User-owned reading streams: named groups of publishers, volumes and issues.
 * <p>
 * Membership changes are reported per member as {@code stream/<name>/<kind>/<id>/add|del}.
 * Refreshing a stream groups the user's matching pulls under it and stores how many of them
 * are unread. A pull belongs to one stream at a time, the last refreshed one that includes it.
 *
 * Author: Pax
 */
@Service
@RequiredArgsConstructor
public class StreamService {

    private static final String TAG = "STREAMS";
    private static final int MAX_NAME_LENGTH = 100;

    private final EntityStore store;
    private final KeyedLocks locks;
    private final PagedQueryService pages;
    private final StreamContextLoader contextLoader;
    private final LoggerService logger;

    /**
     * Creates empty streams. Existing or repeated names are skipped, unusable names fail.
     */
    public BatchResult addStreams(UserIdentity user, List<?> rawNames) {
        BatchResult result = BatchResult.forAdds();
        List<String> names = new ArrayList<>();
        for (Object raw : rawNames) {
            Optional<String> name = parseName(raw);
            if (name.isPresent()) {
                names.add(name.get());
            } else {
                result.record(ClassificationBucket.FAILED, String.valueOf(raw));
            }
        }

        List<EntityKey> keys = new ArrayList<>(names.size());
        for (String name : names) {
            keys.add(Stream.keyFor(user.id(), name));
        }
        List<Stream> created = new ArrayList<>();
        try (KeyedLocks.Held held = locks.lockAll(keys)) {
            List<Stream> existing = store.getMany(keys, Stream.class);
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < names.size(); i++) {
                String name = names.get(i);
                if (existing.get(i) != null || !seen.add(name)) {
                    result.record(ClassificationBucket.SKIPPED, name);
                } else {
                    created.add(new Stream(user.id(), name));
                    result.record(ClassificationBucket.ADDED, name);
                }
            }
            if (!created.isEmpty()) {
                store.putMany(created);
            }
        }
        logger.info(TAG, "Added " + created.size() + " streams for " + Identifiers.sanitizeForLog(user.id()));
        return result;
    }

    public Optional<StreamContext> getStream(UserIdentity user, String name, boolean context) {
        return parseName(name)
                .flatMap(parsed -> store.get(Stream.keyFor(user.id(), parsed), Stream.class))
                .map(stream -> context ? contextLoader.hydrate(stream) : contextLoader.bare(stream));
    }

    public Page<StreamContext> listStreams(UserIdentity user, PageRequest page) {
        EntityQuery<Stream> query = EntityQuery.of(Stream.class, Stream.KIND)
                .ancestor(user.key())
                .orderBy("name", false);
        return pages.fetch(query, page, contextLoader);
    }

    /**
     * Applies membership changes. A missing stream fails as a whole; each member change is
     * updated, skipped (already in or already out) or failed (malformed id). Catalog records are
     * not looked up, so a stream may name records the catalog does not have yet.
     */
    public BatchResult updateStreams(UserIdentity user, List<StreamUpdate> updates) {
        BatchResult result = BatchResult.forUpdates();
        Map<String, EntityKey> keys = new LinkedHashMap<>();
        for (StreamUpdate update : updates) {
            Optional<String> name = parseName(update.name());
            if (name.isPresent()) {
                keys.putIfAbsent(name.get(), Stream.keyFor(user.id(), name.get()));
            } else {
                result.record(ClassificationBucket.FAILED, String.valueOf(update.name()));
            }
        }

        Map<String, Stream> changed = new LinkedHashMap<>();
        try (KeyedLocks.Held held = locks.lockAll(keys.values())) {
            List<String> names = new ArrayList<>(keys.keySet());
            List<Stream> loaded = store.getMany(new ArrayList<>(keys.values()), Stream.class);
            Map<String, Stream> streams = new HashMap<>();
            for (int i = 0; i < names.size(); i++) {
                if (loaded.get(i) != null) {
                    streams.put(names.get(i), loaded.get(i));
                }
            }

            for (StreamUpdate update : updates) {
                Optional<String> name = parseName(update.name());
                if (name.isEmpty()) {
                    continue;
                }
                Stream stream = streams.get(name.get());
                if (stream == null) {
                    result.record(ClassificationBucket.FAILED, name.get());
                    continue;
                }
                for (StreamMember member : StreamMember.values()) {
                    MembershipChange change = update.changeFor(member);
                    if (change != null && applyChange(stream, member, change, result)) {
                        changed.put(name.get(), stream);
                    }
                }
            }
            if (!changed.isEmpty()) {
                store.putMany(changed.values());
            }
        }
        logger.info(TAG, "Changed " + changed.size() + " streams for " + Identifiers.sanitizeForLog(user.id()));
        return result;
    }

    /**
     * Regroups the user's pulls under the stream and stores its unread count.
     *
     * @return the refreshed stream, or empty when the user has no stream of that name
     */
    public Optional<Stream> refreshStream(UserIdentity user, String name) {
        Optional<String> parsed = parseName(name);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        EntityKey streamKey = Stream.keyFor(user.id(), parsed.get());
        List<Pull> snapshot = store.fetchAll(EntityQuery.of(Pull.class, Pull.KIND).ancestor(user.key()));
        List<EntityKey> pullKeys = new ArrayList<>(snapshot.size());
        for (Pull pull : snapshot) {
            pullKeys.add(pull.key());
        }
        List<EntityKey> lockKeys = new ArrayList<>(pullKeys);
        lockKeys.add(streamKey);

        try (KeyedLocks.Held held = locks.lockAll(lockKeys)) {
            Optional<Stream> found = store.get(streamKey, Stream.class);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            Stream stream = found.get();
            String path = streamKey.path();

            List<Pull> pulls = store.getMany(pullKeys, Pull.class);
            Map<Long, Long> publishers = publishersByVolume(stream, pulls);
            List<Pull> regrouped = new ArrayList<>();
            for (Pull pull : pulls) {
                if (pull == null) {
                    continue;
                }
                Long volume = pull.getVolume();
                boolean member = stream.includes(pull.getIdentifier(), volume, volume != null ? publishers.get(volume) : null);
                if (member && !path.equals(pull.getStream())) {
                    pull.setStream(path);
                    regrouped.add(pull);
                } else if (!member && path.equals(pull.getStream())) {
                    pull.setStream(null);
                    regrouped.add(pull);
                }
            }
            if (!regrouped.isEmpty()) {
                store.putMany(regrouped);
            }

            stream.setLength(store.count(unreadQuery(user, path)));
            store.put(stream);
            logger.info(TAG, "Stream " + Identifiers.sanitizeForLog(stream.getName()) + " has " + stream.getLength()
                    + " unread pulls, " + regrouped.size() + " regrouped");
            return Optional.of(stream);
        }
    }

    static EntityQuery<Pull> unreadQuery(UserIdentity user, String streamPath) {
        return EntityQuery.of(Pull.class, Pull.KIND)
                .ancestor(user.key())
                .filterEq("stream", streamPath)
                .filterEq("pulled", true)
                .filterEq("ignored", false)
                .filterEq("read", false);
    }

    private Map<Long, Long> publishersByVolume(Stream stream, List<Pull> pulls) {
        if (stream.getPublishers().isEmpty()) {
            return Map.of();
        }
        Set<Long> volumeIds = new LinkedHashSet<>();
        for (Pull pull : pulls) {
            if (pull != null && pull.getVolume() != null) {
                volumeIds.add(pull.getVolume());
            }
        }
        List<EntityKey> keys = new ArrayList<>(volumeIds.size());
        for (Long volumeId : volumeIds) {
            keys.add(Volume.keyFor(volumeId));
        }
        Map<Long, Long> publishers = new HashMap<>();
        for (Volume volume : store.getMany(keys, Volume.class)) {
            if (volume != null && volume.getPublisher() != null) {
                publishers.put(volume.getIdentifier(), volume.getPublisher());
            }
        }
        return publishers;
    }

    private static boolean applyChange(Stream stream, StreamMember member, MembershipChange change, BatchResult result) {
        List<Long> members = member.membersOf(stream);
        boolean changed = false;
        for (Object raw : change.add()) {
            OptionalLong id = Identifiers.parseId(raw);
            if (id.isEmpty()) {
                result.record(ClassificationBucket.FAILED, label(stream, member, Identifiers.sanitizeForLog(raw), "add"));
            } else if (members.contains(id.getAsLong())) {
                result.record(ClassificationBucket.SKIPPED, label(stream, member, id.getAsLong(), "add"));
            } else {
                members.add(id.getAsLong());
                result.record(ClassificationBucket.UPDATED, label(stream, member, id.getAsLong(), "add"));
                changed = true;
            }
        }
        for (Object raw : change.delete()) {
            OptionalLong id = Identifiers.parseId(raw);
            if (id.isEmpty()) {
                result.record(ClassificationBucket.FAILED, label(stream, member, Identifiers.sanitizeForLog(raw), "del"));
            } else if (!members.remove(Long.valueOf(id.getAsLong()))) {
                result.record(ClassificationBucket.SKIPPED, label(stream, member, id.getAsLong(), "del"));
            } else {
                result.record(ClassificationBucket.UPDATED, label(stream, member, id.getAsLong(), "del"));
                changed = true;
            }
        }
        return changed;
    }

    private static String label(Stream stream, StreamMember member, Object id, String action) {
        return "stream/" + stream.getName() + "/" + member.wireName() + "/" + id + "/" + action;
    }

    /**
     * Stream names are trimmed, non-empty, at most {@value #MAX_NAME_LENGTH} characters and free of {@code /}.
     */
    static Optional<String> parseName(Object raw) {
        if (!(raw instanceof String text)) {
            return Optional.empty();
        }
        String name = text.trim();
        if (name.isEmpty() || name.length() > MAX_NAME_LENGTH || name.contains("/")) {
            return Optional.empty();
        }
        return Optional.of(name);
    }
}
