package tech.tessera.identity.store.mongo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.TextSearchOptions;
import org.bson.Document;
import org.bson.conversions.Bson;
import tech.tessera.identity.store.DocumentFilter;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates {@link DocumentFilter} trees and JSON values to BSON.
 */
final class MongoFilterTranslator {

    private static final String VALUE = "v";

    static Bson translate(DocumentFilter filter) {
        if (filter instanceof DocumentFilter.Eq eq) {
            return Filters.eq(eq.field(), toBsonValue(eq.value()));
        }
        if (filter instanceof DocumentFilter.In in) {
            List<Object> values = new ArrayList<>(in.values().size());
            in.values().forEach(value -> values.add(toBsonValue(value)));
            return Filters.in(in.field(), values);
        }
        if (filter instanceof DocumentFilter.Range range) {
            return range(range);
        }
        if (filter instanceof DocumentFilter.And and) {
            List<DocumentFilter> filters = and.filters();
            if (filters.isEmpty()) {
                return new Document();
            }
            return filters.size() == 1 ? translate(filters.get(0)) : Filters.and(translateAll(filters));
        }
        if (filter instanceof DocumentFilter.Or or) {
            List<DocumentFilter> filters = or.filters();
            if (filters.isEmpty()) {
                // $or rejects an empty array; match nothing instead
                return Filters.in("_id", List.of());
            }
            return Filters.or(translateAll(filters));
        }
        if (filter instanceof DocumentFilter.FullText text) {
            TextSearchOptions options = new TextSearchOptions();
            if (text.language() != null) {
                options.language(text.language());
            }
            return Filters.text(text.keyword(), options);
        }
        if (filter instanceof DocumentFilter.Exists exists) {
            return Filters.exists(exists.field(), exists.exists());
        }
        throw new IllegalArgumentException("Unsupported filter: " + filter);
    }

    /**
     * JSON value to the Java value the driver encodes (String, Integer, Long,
     * Double, Boolean, Document, List, or null).
     */
    static Object toBsonValue(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        ObjectNode wrapper = JsonNodeFactory.instance.objectNode();
        wrapper.set(VALUE, value);
        return Document.parse(wrapper.toString()).get(VALUE);
    }

    private static Bson range(DocumentFilter.Range range) {
        List<Bson> bounds = new ArrayList<>(4);
        if (range.gt() != null) {
            bounds.add(Filters.gt(range.field(), toBsonValue(range.gt())));
        }
        if (range.gte() != null) {
            bounds.add(Filters.gte(range.field(), toBsonValue(range.gte())));
        }
        if (range.lt() != null) {
            bounds.add(Filters.lt(range.field(), toBsonValue(range.lt())));
        }
        if (range.lte() != null) {
            bounds.add(Filters.lte(range.field(), toBsonValue(range.lte())));
        }
        if (bounds.isEmpty()) {
            return Filters.exists(range.field());
        }
        return bounds.size() == 1 ? bounds.get(0) : Filters.and(bounds);
    }

    private static List<Bson> translateAll(List<DocumentFilter> filters) {
        List<Bson> translated = new ArrayList<>(filters.size());
        for (DocumentFilter filter : filters) {
            translated.add(translate(filter));
        }
        return translated;
    }

    private MongoFilterTranslator() {
        // Utility class
    }
}
