// file: core/src/main/java/io/planbridge/core/schema/SchemaNode.java
package io.planbridge.core.schema;

import io.planbridge.core.path.PropertyPath;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable shape descriptor for one node of a resource schema.
 * <p>
 * Kinds:
 *  - SCALAR: a primitive leaf (see {@link ScalarType}).
 *  - LIST:   ordered collection of {@code elem}.
 *  - SET:    unordered, content-hash-identified collection of {@code elem}.
 *  - MAP:    string-keyed collection of {@code elem}.
 *  - BLOCK:  named fields, each with its own SchemaNode.
 * <p>
 * Flags:
 *  - singleton: a LIST/SET of BLOCK limited to one element. Values of such a node are
 *               written as a single object (or null), never as a one-element list.
 *  - required / optional / computed: who supplies the value.
 *  - forceNew:  any change reachable through this node replaces the owning resource.
 *  - sensitive: values at or below this node are always secret.
 * <p>
 * Nodes are built with the static factories and the copy-returning flag methods:
 * <pre>
 *   SchemaNode.string().optional().computed().forceNew()
 * </pre>
 * Thread safe by construction; one instance is shared by every diff of a resource type.
 */
public final class SchemaNode {

    public enum Kind { SCALAR, LIST, SET, MAP, BLOCK }

    private final Kind kind;
    private final ScalarType scalarType;        // SCALAR only
    private final SchemaNode elem;              // LIST, SET, MAP only
    private final Map<String, SchemaNode> fields; // BLOCK only, sorted by name
    private final boolean singleton;
    private final boolean required;
    private final boolean optional;
    private final boolean computed;
    private final boolean forceNew;
    private final boolean sensitive;

    private SchemaNode(
            Kind kind,
            ScalarType scalarType,
            SchemaNode elem,
            Map<String, SchemaNode> fields,
            boolean singleton,
            boolean required,
            boolean optional,
            boolean computed,
            boolean forceNew,
            boolean sensitive
    ) {
        this.kind = kind;
        this.scalarType = scalarType;
        this.elem = elem;
        this.fields = fields;
        this.singleton = singleton;
        this.required = required;
        this.optional = optional;
        this.computed = computed;
        this.forceNew = forceNew;
        this.sensitive = sensitive;
    }

    // ---------- factories ----------

    public static SchemaNode scalar(ScalarType type) {
        Objects.requireNonNull(type, "type");
        return new SchemaNode(Kind.SCALAR, type, null, Map.of(),
                false, false, false, false, false, false);
    }

    public static SchemaNode string() { return scalar(ScalarType.STRING); }

    public static SchemaNode number() { return scalar(ScalarType.NUMBER); }

    public static SchemaNode bool() { return scalar(ScalarType.BOOL); }

    public static SchemaNode list(SchemaNode elem) {
        return collection(Kind.LIST, elem);
    }

    public static SchemaNode set(SchemaNode elem) {
        return collection(Kind.SET, elem);
    }

    public static SchemaNode map(SchemaNode elem) {
        return collection(Kind.MAP, elem);
    }

    public static SchemaNode block(Map<String, SchemaNode> fields) {
        Objects.requireNonNull(fields, "fields");
        var sorted = new TreeMap<String, SchemaNode>();
        fields.forEach((name, node) -> {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("field name must not be blank");
            sorted.put(name, Objects.requireNonNull(node, "field " + name));
        });
        return new SchemaNode(Kind.BLOCK, null, null, Collections.unmodifiableMap(sorted),
                false, false, false, false, false, false);
    }

    private static SchemaNode collection(Kind kind, SchemaNode elem) {
        Objects.requireNonNull(elem, "elem");
        return new SchemaNode(kind, null, elem, Map.of(),
                false, false, false, false, false, false);
    }

    // ---------- flag copies ----------

    public SchemaNode required() {
        return new SchemaNode(kind, scalarType, elem, fields, singleton, true, optional, computed, forceNew, sensitive);
    }

    public SchemaNode optional() {
        return new SchemaNode(kind, scalarType, elem, fields, singleton, required, true, computed, forceNew, sensitive);
    }

    public SchemaNode computed() {
        return new SchemaNode(kind, scalarType, elem, fields, singleton, required, optional, true, forceNew, sensitive);
    }

    public SchemaNode forceNew() {
        return new SchemaNode(kind, scalarType, elem, fields, singleton, required, optional, computed, true, sensitive);
    }

    public SchemaNode sensitive() {
        return new SchemaNode(kind, scalarType, elem, fields, singleton, required, optional, computed, forceNew, true);
    }

    /**
     * Mark a LIST or SET of BLOCK as max-items-one.
     *
     * @throws IllegalArgumentException for any other shape
     */
    public SchemaNode singleton() {
        if ((kind != Kind.LIST && kind != Kind.SET) || elem.kind != Kind.BLOCK) {
            throw new IllegalArgumentException("singleton requires a list or set of blocks, got " + describe());
        }
        return new SchemaNode(kind, scalarType, elem, fields, true, required, optional, computed, forceNew, sensitive);
    }

    // ---------- accessors ----------

    public Kind kind() { return kind; }

    public ScalarType scalarType() { return scalarType; }

    public SchemaNode elem() { return elem; }

    public Map<String, SchemaNode> fields() { return fields; }

    public SchemaNode field(String name) { return fields.get(name); }

    public boolean isSingleton() { return singleton; }

    public boolean isRequired() { return required; }

    public boolean isOptional() { return optional; }

    public boolean isComputed() { return computed; }

    public boolean isForceNew() { return forceNew; }

    public boolean isSensitive() { return sensitive; }

    public boolean isBlock() { return kind == Kind.BLOCK; }

    /** Computed and not required: the provider fills the value when the user leaves it out. */
    public boolean isProviderFilled() { return computed && !required; }

    /**
     * Resolve one path segment to the child schema, honouring singleton collapse.
     * <p>
     *  - BLOCK:              name -> field
     *  - singleton LIST/SET: name -> field of the element block (the wrapper has no segment)
     *  - LIST/SET:           index -> elem
     *  - MAP:                name -> elem
     *
     * @return the child schema, or null when the segment does not exist in this shape
     */
    public SchemaNode child(Object segment) {
        return switch (kind) {
            case BLOCK -> segment instanceof String name ? fields.get(name) : null;
            case LIST, SET -> {
                if (singleton) {
                    yield segment instanceof String name ? elem.fields.get(name) : null;
                }
                yield segment instanceof Integer ? elem : null;
            }
            case MAP -> segment instanceof String ? elem : null;
            case SCALAR -> null;
        };
    }

    /**
     * Resolve a whole path starting at this node.
     *
     * @return the schema at the end of the path, or null if any segment is unknown
     */
    public SchemaNode lookup(PropertyPath path) {
        SchemaNode cur = this;
        for (Object segment : path.segments()) {
            cur = cur.child(segment);
            if (cur == null) return null;
        }
        return cur;
    }

    /** Short human-readable shape, used in error messages. */
    public String describe() {
        return switch (kind) {
            case SCALAR -> scalarType.name().toLowerCase();
            case LIST -> (singleton ? "singleton " : "") + "list<" + elem.describe() + ">";
            case SET -> (singleton ? "singleton " : "") + "set<" + elem.describe() + ">";
            case MAP -> "map<" + elem.describe() + ">";
            case BLOCK -> "block" + fields.keySet();
        };
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SchemaNode n)) return false;
        return kind == n.kind
                && scalarType == n.scalarType
                && singleton == n.singleton
                && required == n.required
                && optional == n.optional
                && computed == n.computed
                && forceNew == n.forceNew
                && sensitive == n.sensitive
                && Objects.equals(elem, n.elem)
                && fields.equals(n.fields);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, scalarType, elem, fields, singleton, required, optional, computed, forceNew, sensitive);
    }

    @Override public String toString() { return describe(); }
}
