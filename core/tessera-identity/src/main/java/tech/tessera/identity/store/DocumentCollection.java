package tech.tessera.identity.store;

import tech.tessera.identity.common.PagedResult;
import tech.tessera.identity.common.Paging;
import tech.tessera.identity.document.DynamicDocument;

import java.util.List;
import java.util.Optional;

/**
 * One collection of schema-free documents keyed by {@code _id}.
 *
 * <p>Implementations are tenant-agnostic; callers add the membership clause.
 * Returned documents are detached copies.
 */
public interface DocumentCollection {

    String name();

    Optional<DynamicDocument> findOne(DocumentFilter filter);

    PagedResult<DynamicDocument> find(DocumentFilter filter, Paging paging);

    /**
     * Insert a document carrying an {@code _id}.
     *
     * @return the id of the inserted document
     * @throws DuplicateKeyException if the id or a unique index value is taken
     */
    String insert(DynamicDocument document);

    /**
     * Replace the document with the given id.
     *
     * @return false if no document had the id
     * @throws DuplicateKeyException if the replacement collides on a unique index
     */
    boolean replace(String id, DynamicDocument document);

    boolean delete(String id);

    long count(DocumentFilter filter);

    /**
     * Declare a unique index over the given fields. Only documents carrying every
     * field take part, so optional unique fields may be absent on many documents.
     * Idempotent.
     */
    void ensureUniqueIndex(List<String> fields);
}
