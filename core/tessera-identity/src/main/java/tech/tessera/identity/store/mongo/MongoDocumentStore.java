package tech.tessera.identity.store.mongo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoWriteException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Sorts;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Alternative;
import jakarta.inject.Inject;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import org.jboss.logging.Logger;
import tech.tessera.identity.common.Json;
import tech.tessera.identity.common.PagedResult;
import tech.tessera.identity.common.Paging;
import tech.tessera.identity.document.DynamicDocument;
import tech.tessera.identity.store.DocumentCollection;
import tech.tessera.identity.store.DocumentFilter;
import tech.tessera.identity.store.DocumentStore;
import tech.tessera.identity.store.DuplicateKeyException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MongoDB implementation of DocumentStore.
 *
 * <p>Documents round-trip through relaxed extended JSON, so stored values stay
 * plain JSON types. Unique indexes are partial (only documents carrying every
 * indexed field take part) and duplicate-key write errors surface as
 * {@link DuplicateKeyException}.
 */
@ApplicationScoped
@Alternative
public class MongoDocumentStore implements DocumentStore {

    private static final Logger LOG = Logger.getLogger(MongoDocumentStore.class);

    private static final JsonWriterSettings RELAXED = JsonWriterSettings.builder()
        .outputMode(JsonMode.RELAXED)
        .build();

    // E11000 duplicate key error collection: db.users index: uq_membership_id_username dup key: {...}
    private static final Pattern DUPLICATE_INDEX = Pattern.compile("index: (\\S+)");

    private final MongoClient mongoClient;
    private final MongoStoreConfig config;

    // "collection/index name" -> indexed fields, to name the fields of a duplicate-key error
    private final ConcurrentMap<String, List<String>> uniqueIndexFields = new ConcurrentHashMap<>();

    @Inject
    public MongoDocumentStore(MongoClient mongoClient, MongoStoreConfig config) {
        this.mongoClient = mongoClient;
        this.config = config;
    }

    @Override
    public DocumentCollection collection(String name) {
        return new MongoDocumentCollection(
            mongoClient.getDatabase(config.database()).getCollection(name), uniqueIndexFields);
    }

    static final class MongoDocumentCollection implements DocumentCollection {

        private final MongoCollection<Document> collection;
        private final ConcurrentMap<String, List<String>> uniqueIndexFields;

        MongoDocumentCollection(MongoCollection<Document> collection, ConcurrentMap<String, List<String>> uniqueIndexFields) {
            this.collection = collection;
            this.uniqueIndexFields = uniqueIndexFields;
        }

        @Override
        public String name() {
            return collection.getNamespace().getCollectionName();
        }

        @Override
        public Optional<DynamicDocument> findOne(DocumentFilter filter) {
            Document found = collection.find(MongoFilterTranslator.translate(filter)).first();
            return Optional.ofNullable(found).map(MongoDocumentCollection::toDynamic);
        }

        @Override
        public PagedResult<DynamicDocument> find(DocumentFilter filter, Paging paging) {
            Bson bson = MongoFilterTranslator.translate(filter);
            FindIterable<Document> iterable = collection.find(bson);
            if (paging.sortField() != null) {
                iterable = iterable.sort(paging.direction() == Paging.SortDirection.DESC
                    ? Sorts.descending(paging.sortField())
                    : Sorts.ascending(paging.sortField()));
            }
            if (paging.skip() != null) {
                iterable = iterable.skip(paging.skip());
            }
            if (paging.limit() != null) {
                iterable = iterable.limit(paging.limit());
            }

            List<DynamicDocument> items = new ArrayList<>();
            try (MongoCursor<Document> cursor = iterable.iterator()) {
                while (cursor.hasNext()) {
                    items.add(toDynamic(cursor.next()));
                }
            }
            Long count = paging.withCount() ? collection.countDocuments(bson) : null;
            return new PagedResult<>(items, count);
        }

        @Override
        public String insert(DynamicDocument document) {
            String id = document.id();
            if (id == null) {
                throw new IllegalArgumentException("Document must carry an " + DynamicDocument.ID + " before insert");
            }
            try {
                collection.insertOne(toBson(document));
                LOG.debugf("Inserted %s into %s", id, name());
                return id;
            } catch (MongoWriteException e) {
                throw translateWriteError(e);
            }
        }

        @Override
        public boolean replace(String id, DynamicDocument document) {
            Document replacement = toBson(document);
            replacement.put(DynamicDocument.ID, id);
            try {
                return collection.replaceOne(Filters.eq(DynamicDocument.ID, id), replacement).getMatchedCount() > 0;
            } catch (MongoWriteException e) {
                throw translateWriteError(e);
            }
        }

        @Override
        public boolean delete(String id) {
            return collection.deleteOne(Filters.eq(DynamicDocument.ID, id)).getDeletedCount() > 0;
        }

        @Override
        public long count(DocumentFilter filter) {
            return collection.countDocuments(MongoFilterTranslator.translate(filter));
        }

        @Override
        public void ensureUniqueIndex(List<String> fields) {
            List<Bson> present = new ArrayList<>(fields.size());
            fields.forEach(field -> present.add(Filters.exists(field)));
            String indexName = "uq_" + String.join("_", fields);
            collection.createIndex(
                Indexes.ascending(fields),
                new IndexOptions()
                    .name(indexName)
                    .unique(true)
                    .partialFilterExpression(present.size() == 1 ? present.get(0) : Filters.and(present)));
            uniqueIndexFields.put(name() + "/" + indexName, List.copyOf(fields));
            LOG.debugf("Ensured unique index %s on %s", indexName, name());
        }

        private RuntimeException translateWriteError(MongoWriteException e) {
            if (ErrorCategory.fromErrorCode(e.getError().getCode()) == ErrorCategory.DUPLICATE_KEY) {
                String message = e.getError().getMessage();
                return new DuplicateKeyException(name(), duplicatedFields(message), message, e);
            }
            return e;
        }

        List<String> duplicatedFields(String message) {
            Matcher matcher = DUPLICATE_INDEX.matcher(message == null ? "" : message);
            if (!matcher.find()) {
                return List.of();
            }
            String indexName = matcher.group(1);
            if ("_id_".equals(indexName)) {
                return List.of(DynamicDocument.ID);
            }
            return uniqueIndexFields.getOrDefault(name() + "/" + indexName, List.of());
        }

        static Document toBson(DynamicDocument document) {
            return Document.parse(document.toJson());
        }

        static DynamicDocument toDynamic(Document document) {
            try {
                return new DynamicDocument((ObjectNode) Json.MAPPER.readTree(document.toJson(RELAXED)));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Stored document is not valid JSON", e);
            }
        }
    }
}
