package io.fieldtree.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.fieldtree.core.schema.NamedTypeKind;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named scalar -> {@link ScalarCoercion}.
 * <p>
 * Resolution order for a leaf type:
 *  - an explicitly registered coercion;
 *  - the built-in one for {@code Int}, {@code Float}, {@code String}, {@code Boolean}, {@code ID};
 *  - enums: the value's name as text;
 *  - anything else: Jackson passthrough to plain Java values (maps, lists, strings, numbers).
 * <p>
 * Immutable; {@link #with(String, ScalarCoercion)} returns a new registry.
 */
public final class ScalarRegistry {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final ScalarCoercion INT = ScalarCoercion.of(
            node -> {
                if (!node.isIntegralNumber() || !node.canConvertToInt()) {
                    throw new IllegalArgumentException("expected a 32-bit integer, got " + node);
                }
                return node.intValue();
            },
            value -> {
                if (!(value instanceof Integer || value instanceof Short || value instanceof Byte)) {
                    throw new IllegalArgumentException("expected an Integer, got " + describe(value));
                }
                return NODES.numberNode(((Number) value).intValue());
            });

    private static final ScalarCoercion FLOAT = ScalarCoercion.of(
            node -> {
                if (!node.isNumber()) throw new IllegalArgumentException("expected a number, got " + node);
                return node.doubleValue();
            },
            value -> {
                if (!(value instanceof Number n)) {
                    throw new IllegalArgumentException("expected a Number, got " + describe(value));
                }
                return NODES.numberNode(n.doubleValue());
            });

    private static final ScalarCoercion STRING = ScalarCoercion.of(
            node -> {
                if (!node.isTextual()) throw new IllegalArgumentException("expected a string, got " + node);
                return node.textValue();
            },
            value -> {
                if (!(value instanceof String s)) {
                    throw new IllegalArgumentException("expected a String, got " + describe(value));
                }
                return NODES.textNode(s);
            });

    private static final ScalarCoercion BOOLEAN = ScalarCoercion.of(
            node -> {
                if (!node.isBoolean()) throw new IllegalArgumentException("expected a boolean, got " + node);
                return node.booleanValue();
            },
            value -> {
                if (!(value instanceof Boolean b)) {
                    throw new IllegalArgumentException("expected a Boolean, got " + describe(value));
                }
                return NODES.booleanNode(b);
            });

    // IDs travel as strings; integral input is accepted and normalized.
    private static final ScalarCoercion ID = ScalarCoercion.of(
            node -> {
                if (node.isTextual()) return node.textValue();
                if (node.isIntegralNumber()) return node.asText();
                throw new IllegalArgumentException("expected a string or integer id, got " + node);
            },
            value -> {
                if (value instanceof String || value instanceof Integer || value instanceof Long) {
                    return NODES.textNode(value.toString());
                }
                throw new IllegalArgumentException("expected an id, got " + describe(value));
            });

    private static final ScalarCoercion ENUM = ScalarCoercion.of(
            node -> {
                if (!node.isTextual()) throw new IllegalArgumentException("expected an enum name, got " + node);
                return node.textValue();
            },
            value -> {
                if (value instanceof Enum<?> e) return NODES.textNode(e.name());
                if (value instanceof String s) return NODES.textNode(s);
                throw new IllegalArgumentException("expected an enum value, got " + describe(value));
            });

    private static final Map<String, ScalarCoercion> BUILT_INS = Map.of(
            "Int", INT,
            "Float", FLOAT,
            "String", STRING,
            "Boolean", BOOLEAN,
            "ID", ID
    );

    private final ObjectMapper mapper;
    private final Map<String, ScalarCoercion> custom;
    private final ScalarCoercion passthrough;

    private ScalarRegistry(ObjectMapper mapper, Map<String, ScalarCoercion> custom) {
        this.mapper = mapper;
        this.custom = Map.copyOf(custom);
        this.passthrough = ScalarCoercion.of(
                node -> {
                    try {
                        return mapper.treeToValue(node, Object.class);
                    } catch (JsonProcessingException e) {
                        throw new IllegalArgumentException("cannot read " + node, e);
                    }
                },
                mapper::valueToTree);
    }

    public static ScalarRegistry defaults() {
        return new ScalarRegistry(new ObjectMapper(), Map.of());
    }

    /**
     * Registry whose custom scalars are bound to Java classes by name, e.g.
     * {@code "Decimal" -> "java.math.BigDecimal"}. Values are converted by Jackson.
     *
     * @throws IllegalArgumentException if a class cannot be loaded
     */
    public static ScalarRegistry fromMapping(Map<String, String> scalarToClassName) {
        ObjectMapper mapper = new ObjectMapper();
        Map<String, ScalarCoercion> custom = new HashMap<>();
        for (var e : scalarToClassName.entrySet()) {
            custom.put(e.getKey(), jackson(mapper, e.getKey(), loadClass(e.getValue())));
        }
        return new ScalarRegistry(mapper, custom);
    }

    /** Copy of this registry with {@code scalarName} bound to {@code coercion}. */
    public ScalarRegistry with(String scalarName, ScalarCoercion coercion) {
        Objects.requireNonNull(scalarName, "scalarName");
        Objects.requireNonNull(coercion, "coercion");
        Map<String, ScalarCoercion> next = new HashMap<>(custom);
        next.put(scalarName, coercion);
        return new ScalarRegistry(mapper, next);
    }

    /** Coercion for a leaf named type of the given kind. */
    public ScalarCoercion coercion(String typeName, NamedTypeKind kind) {
        ScalarCoercion c = custom.get(typeName);
        if (c != null) return c;
        if (kind == NamedTypeKind.ENUM) return ENUM;
        c = BUILT_INS.get(typeName);
        return c != null ? c : passthrough;
    }

    public boolean isRegistered(String scalarName) {
        return custom.containsKey(scalarName);
    }

    ObjectMapper mapper() { return mapper; }

    // ---------- helpers ----------

    private static ScalarCoercion jackson(ObjectMapper mapper, String scalarName, Class<?> type) {
        return ScalarCoercion.of(
                node -> {
                    try {
                        return mapper.treeToValue(node, type);
                    } catch (JsonProcessingException e) {
                        throw new IllegalArgumentException(
                                "cannot read " + scalarName + " as " + type.getName() + ": " + node, e);
                    }
                },
                value -> {
                    if (!type.isInstance(value)) {
                        throw new IllegalArgumentException(
                                "expected " + type.getName() + " for " + scalarName + ", got " + describe(value));
                    }
                    return mapper.valueToTree(value);
                });
    }

    private static Class<?> loadClass(String className) {
        try {
            return Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("custom scalar class not found: " + className, e);
        }
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }
}
