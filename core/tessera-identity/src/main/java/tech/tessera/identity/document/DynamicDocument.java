package tech.tessera.identity.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import tech.tessera.identity.common.Json;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Schema-free document: an ordered JSON object tree addressed by dotted paths.
 *
 * <p>Paths walk object keys; a numeric segment indexes into an array
 * ({@code "addresses.0.city"}). Setting a path creates missing intermediate
 * objects. Instances are mutable; {@link #copy()} returns a deep copy.
 */
public final class DynamicDocument {

    public static final String ID = "_id";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectNode root;

    public DynamicDocument() {
        this(JsonNodeFactory.instance.objectNode());
    }

    public DynamicDocument(ObjectNode root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    public static DynamicDocument parse(String json) {
        try {
            JsonNode node = Json.MAPPER.readTree(json);
            if (!(node instanceof ObjectNode object)) {
                throw new IllegalArgumentException("Document JSON must be an object");
            }
            return new DynamicDocument(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid document JSON", e);
        }
    }

    public static DynamicDocument from(Map<String, ?> values) {
        return new DynamicDocument(Json.MAPPER.<ObjectNode>valueToTree(values));
    }

    public static DynamicDocument fromObject(Object value) {
        JsonNode node = Json.MAPPER.<JsonNode>valueToTree(value);
        if (!(node instanceof ObjectNode object)) {
            throw new IllegalArgumentException("Value does not serialize to a JSON object");
        }
        return new DynamicDocument(object);
    }

    /**
     * The underlying tree. Mutations through it are visible on this document.
     */
    public ObjectNode node() {
        return root;
    }

    public String id() {
        return getString(ID);
    }

    // ========================================================================
    // Path access
    // ========================================================================

    public Optional<JsonNode> get(String path) {
        JsonNode current = root;
        for (String segment : segments(path)) {
            current = child(current, segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    public boolean contains(String path) {
        return get(path).isPresent();
    }

    /**
     * Text value at the path, or null when absent or not a string.
     */
    public String getString(String path) {
        return get(path).filter(JsonNode::isTextual).map(JsonNode::textValue).orElse(null);
    }

    /**
     * String elements of the array at the path, or null when absent, null or not an array.
     * Non-string elements are rendered as text.
     */
    public List<String> getStringList(String path) {
        Optional<JsonNode> node = get(path);
        if (node.isEmpty() || !node.get().isArray()) {
            return null;
        }
        List<String> values = new ArrayList<>(node.get().size());
        for (JsonNode element : node.get()) {
            values.add(element.isTextual() ? element.textValue() : element.toString());
        }
        return values;
    }

    public DynamicDocument set(String path, JsonNode value) {
        List<String> segments = segments(path);
        ObjectNode parent = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            JsonNode next = parent.get(segments.get(i));
            if (!(next instanceof ObjectNode)) {
                next = parent.putObject(segments.get(i));
            }
            parent = (ObjectNode) next;
        }
        parent.set(segments.get(segments.size() - 1), value == null ? JsonNodeFactory.instance.nullNode() : value);
        return this;
    }

    public DynamicDocument set(String path, Object value) {
        JsonNode node = value instanceof JsonNode ? (JsonNode) value : Json.MAPPER.<JsonNode>valueToTree(value);
        return set(path, node);
    }

    /**
     * Remove the value at the path.
     *
     * @return true if something was removed
     */
    public boolean remove(String path) {
        List<String> segments = segments(path);
        JsonNode parent = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            parent = child(parent, segments.get(i));
            if (parent == null) {
                return false;
            }
        }
        String last = segments.get(segments.size() - 1);
        if (parent instanceof ObjectNode object) {
            return object.remove(last) != null;
        }
        if (parent instanceof ArrayNode array && isIndex(last)) {
            int index = Integer.parseInt(last);
            if (index < array.size()) {
                array.remove(index);
                return true;
            }
        }
        return false;
    }

    // ========================================================================
    // Whole-document operations
    // ========================================================================

    public DynamicDocument copy() {
        return new DynamicDocument(root.deepCopy());
    }

    /**
     * Right-biased merge: a new document holding every top-level field of this
     * document, overridden by every top-level field present in {@code partial}.
     * Neither input is modified.
     */
    public DynamicDocument merge(DynamicDocument partial) {
        ObjectNode merged = root.deepCopy();
        Iterator<Map.Entry<String, JsonNode>> fields = partial.root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            merged.set(field.getKey(), field.getValue().deepCopy());
        }
        return new DynamicDocument(merged);
    }

    /**
     * Field projection. When any selection is {@code true} the result holds only
     * the selected paths (plus {@code _id} unless excluded); otherwise the
     * {@code false} paths are removed from a copy.
     */
    public DynamicDocument project(Map<String, Boolean> selection) {
        if (selection == null || selection.isEmpty()) {
            return copy();
        }
        boolean includeMode = selection.containsValue(Boolean.TRUE);
        if (!includeMode) {
            DynamicDocument projected = copy();
            selection.keySet().forEach(projected::remove);
            return projected;
        }
        DynamicDocument projected = new DynamicDocument();
        if (!Boolean.FALSE.equals(selection.get(ID))) {
            get(ID).ifPresent(id -> projected.set(ID, id.deepCopy()));
        }
        selection.forEach((path, include) -> {
            if (Boolean.TRUE.equals(include)) {
                get(path).ifPresent(value -> projected.set(path, value.deepCopy()));
            }
        });
        return projected;
    }

    /**
     * Numeric-tolerant structural equality.
     */
    public boolean isEquivalentTo(DynamicDocument other) {
        return other != null && JsonValues.equivalent(root, other.root);
    }

    public Map<String, Object> toMap() {
        return Json.MAPPER.convertValue(root, MAP_TYPE);
    }

    public <T> T toObject(Class<T> type) {
        return Json.MAPPER.convertValue(root, type);
    }

    public String toJson() {
        return root.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DynamicDocument other)) return false;
        return root.equals(other.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return toJson();
    }

    private static List<String> segments(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Path must not be empty");
        }
        return List.of(path.split("\\."));
    }

    private static JsonNode child(JsonNode node, String segment) {
        if (node instanceof ObjectNode) {
            return node.get(segment);
        }
        if (node instanceof ArrayNode && isIndex(segment)) {
            return node.get(Integer.parseInt(segment));
        }
        return null;
    }

    private static boolean isIndex(String segment) {
        return !segment.isEmpty() && segment.length() < 10 && segment.chars().allMatch(Character::isDigit);
    }
}
