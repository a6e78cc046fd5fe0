package tech.tessera.identity.store;

import com.fasterxml.jackson.databind.JsonNode;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.tessera.identity.common.PagedResult;
import tech.tessera.identity.common.Paging;
import tech.tessera.identity.document.DynamicDocument;
import tech.tessera.identity.document.JsonValues;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Thread-safe in-memory store.
 *
 * <p>Good for development, tests and single-node deployments. Unique indexes are
 * checked and the write applied under the collection's write lock, so two
 * concurrent inserts of the same unique value cannot both succeed.
 */
@ApplicationScoped
@DefaultBean
public class InMemoryDocumentStore implements DocumentStore {

    private static final Logger LOG = Logger.getLogger(InMemoryDocumentStore.class);

    private final ConcurrentMap<String, InMemoryCollection> collections = new ConcurrentHashMap<>();

    @Override
    public DocumentCollection collection(String name) {
        return collections.computeIfAbsent(name, InMemoryCollection::new);
    }

    static final class InMemoryCollection implements DocumentCollection {

        private final String name;
        private final Map<String, DynamicDocument> documents = new LinkedHashMap<>();
        private final List<List<String>> uniqueIndexes = new CopyOnWriteArrayList<>();
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

        InMemoryCollection(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Optional<DynamicDocument> findOne(DocumentFilter filter) {
            lock.readLock().lock();
            try {
                return documents.values().stream()
                    .filter(document -> FilterEvaluator.matches(filter, document))
                    .findFirst()
                    .map(DynamicDocument::copy);
            } finally {
                lock.readLock().unlock();
            }
        }

        @Override
        public PagedResult<DynamicDocument> find(DocumentFilter filter, Paging paging) {
            List<DynamicDocument> matched;
            lock.readLock().lock();
            try {
                matched = documents.values().stream()
                    .filter(document -> FilterEvaluator.matches(filter, document))
                    .map(DynamicDocument::copy)
                    .collect(Collectors.toCollection(ArrayList::new));
            } finally {
                lock.readLock().unlock();
            }

            if (paging.sortField() != null) {
                Comparator<DynamicDocument> comparator = Comparator.comparing(
                    (DynamicDocument document) -> document.get(paging.sortField()).orElse(null),
                    JsonValues::compare);
                if (paging.direction() == Paging.SortDirection.DESC) {
                    comparator = comparator.reversed();
                }
                matched.sort(comparator);
            }

            int from = paging.skip() == null ? 0 : Math.min(paging.skip(), matched.size());
            int to = paging.limit() == null ? matched.size() : Math.min(from + paging.limit(), matched.size());
            Long count = paging.withCount() ? (long) matched.size() : null;
            return new PagedResult<>(matched.subList(from, to), count);
        }

        @Override
        public String insert(DynamicDocument document) {
            String id = document.id();
            if (id == null) {
                throw new IllegalArgumentException("Document must carry an " + DynamicDocument.ID + " before insert");
            }
            lock.writeLock().lock();
            try {
                if (documents.containsKey(id)) {
                    throw new DuplicateKeyException(name, List.of(DynamicDocument.ID),
                        "Duplicate " + DynamicDocument.ID + " '" + id + "' in " + name);
                }
                checkUniqueIndexes(id, document);
                documents.put(id, document.copy());
                LOG.debugf("Inserted %s into %s", id, name);
                return id;
            } finally {
                lock.writeLock().unlock();
            }
        }

        @Override
        public boolean replace(String id, DynamicDocument document) {
            lock.writeLock().lock();
            try {
                if (!documents.containsKey(id)) {
                    return false;
                }
                checkUniqueIndexes(id, document);
                DynamicDocument stored = document.copy();
                stored.set(DynamicDocument.ID, id);
                documents.put(id, stored);
                return true;
            } finally {
                lock.writeLock().unlock();
            }
        }

        @Override
        public boolean delete(String id) {
            lock.writeLock().lock();
            try {
                return documents.remove(id) != null;
            } finally {
                lock.writeLock().unlock();
            }
        }

        @Override
        public long count(DocumentFilter filter) {
            lock.readLock().lock();
            try {
                return documents.values().stream()
                    .filter(document -> FilterEvaluator.matches(filter, document))
                    .count();
            } finally {
                lock.readLock().unlock();
            }
        }

        @Override
        public void ensureUniqueIndex(List<String> fields) {
            List<String> index = List.copyOf(fields);
            lock.writeLock().lock();
            try {
                if (!uniqueIndexes.contains(index)) {
                    uniqueIndexes.add(index);
                    LOG.debugf("Created unique index %s on %s", index, name);
                }
            } finally {
                lock.writeLock().unlock();
            }
        }

        // Caller holds the write lock
        private void checkUniqueIndexes(String id, DynamicDocument candidate) {
            for (List<String> index : uniqueIndexes) {
                List<JsonNode> key = keyOf(candidate, index);
                if (key == null) {
                    continue;
                }
                for (Map.Entry<String, DynamicDocument> entry : documents.entrySet()) {
                    if (entry.getKey().equals(id)) {
                        continue;
                    }
                    List<JsonNode> other = keyOf(entry.getValue(), index);
                    if (other != null && sameKey(key, other)) {
                        throw new DuplicateKeyException(name, index,
                            "Duplicate value for unique index " + index + " in " + name);
                    }
                }
            }
        }

        private static List<JsonNode> keyOf(DynamicDocument document, List<String> index) {
            List<JsonNode> key = new ArrayList<>(index.size());
            for (String field : index) {
                Optional<JsonNode> value = document.get(field);
                if (value.isEmpty() || JsonValues.isNullish(value.get())) {
                    return null;
                }
                key.add(value.get());
            }
            return key;
        }

        private static boolean sameKey(List<JsonNode> a, List<JsonNode> b) {
            for (int i = 0; i < a.size(); i++) {
                if (!JsonValues.equivalent(a.get(i), b.get(i))) {
                    return false;
                }
            }
            return true;
        }
    }
}
