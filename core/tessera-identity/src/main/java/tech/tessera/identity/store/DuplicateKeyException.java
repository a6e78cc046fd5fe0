package tech.tessera.identity.store;

import java.util.List;

/**
 * A write was rejected by a unique index of the store.
 */
public class DuplicateKeyException extends RuntimeException {

    private final String collection;
    private final List<String> fields;

    public DuplicateKeyException(String collection, List<String> fields, String message) {
        this(collection, fields, message, null);
    }

    public DuplicateKeyException(String collection, List<String> fields, String message, Throwable cause) {
        super(message, cause);
        this.collection = collection;
        this.fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public String collection() {
        return collection;
    }

    /**
     * Fields of the violated index, empty when the adapter cannot tell.
     */
    public List<String> fields() {
        return fields;
    }
}
