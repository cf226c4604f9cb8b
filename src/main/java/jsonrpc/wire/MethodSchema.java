package jsonrpc.wire;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jsonrpc.codec.PackException;
import jsonrpc.codec.UnpackException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The closed set of methods an application exposes, declared once and shared by client
 * and server.
 * <p>
 * Each variant is a class (typically a record implementing a common interface) whose
 * properties are the method's named parameters, registered under its method tag:
 *
 * <pre>
 * MethodSchema&lt;Calculator&gt; schema = MethodSchema.builder(Calculator.class)
 *         .method("add", Calculator.Add.class)
 *         .method("reset", Calculator.Reset.class)
 *         .build();
 * </pre>
 *
 * The schema only knows how to split a method into {@code (tag, params)} and back; which
 * envelope fields carry them is up to the {@link WireFormat}.
 *
 * @param <M> the method union type
 */
public final class MethodSchema<M> {

    private final Class<M> methodType;
    private final Map<String, Class<? extends M>> variantsByTag;
    private final Map<Class<?>, String> tagsByVariant;

    private MethodSchema(Builder<M> builder) {
        this.methodType = builder.methodType;
        this.variantsByTag = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variantsByTag));
        this.tagsByVariant = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tagsByVariant));
    }

    public static <M> Builder<M> builder(Class<M> methodType) {
        return new Builder<>(methodType);
    }

    public Class<M> methodType() {
        return methodType;
    }

    /** Registered tags in registration order. */
    public Set<String> tags() {
        return variantsByTag.keySet();
    }

    public boolean isRegistered(String tag) {
        return variantsByTag.containsKey(tag);
    }

    /**
     * @throws PackException if the method's class was never registered
     */
    public String tagOf(M method) {
        Objects.requireNonNull(method, "method");
        String tag = tagsByVariant.get(method.getClass());
        if (tag == null) {
            throw new PackException("Method variant " + method.getClass().getName() + " is not registered");
        }
        return tag;
    }

    /**
     * Encodes the method's parameters as an object keyed by parameter name.
     *
     * @throws PackException if the parameters do not form an object
     */
    public ObjectNode paramsOf(M method) {
        tagOf(method);
        JsonNode params = TreeMapper.toTree(method);
        if (!params.isObject()) {
            throw new PackException("Parameters of " + tagOf(method) + " must encode as an object");
        }
        return (ObjectNode) params;
    }

    /**
     * Rebuilds a method from its tag and parameter object.
     *
     * @throws UnpackException for an unknown tag, non-object params, or parameters that
     *         do not match the variant (including unknown parameter names)
     */
    public M decode(String tag, JsonNode params) {
        Class<? extends M> variant = variantsByTag.get(tag);
        if (variant == null) {
            throw new UnpackException("unknown variant `" + tag + "`, expected one of " + tags());
        }
        JsonNode effective = params == null || params.isMissingNode() ? TreeMapper.NODES.objectNode() : params;
        if (!effective.isObject()) {
            throw new UnpackException("invalid params for `" + tag + "`: expected an object");
        }
        M method = TreeMapper.fromTree(effective, variant);
        if (method == null) {
            throw new UnpackException("invalid params for `" + tag + "`");
        }
        return method;
    }

    @Override
    public String toString() {
        return "MethodSchema{" + methodType.getSimpleName() + ", tags=" + tags() + "}";
    }

    /**
     * Builder for MethodSchema with fluent API.
     */
    public static final class Builder<M> {
        private final Class<M> methodType;
        private final Map<String, Class<? extends M>> variantsByTag = new LinkedHashMap<>();
        private final Map<Class<?>, String> tagsByVariant = new LinkedHashMap<>();

        private Builder(Class<M> methodType) {
            this.methodType = Objects.requireNonNull(methodType, "methodType");
        }

        public Builder<M> method(String tag, Class<? extends M> variant) {
            Objects.requireNonNull(tag, "tag");
            Objects.requireNonNull(variant, "variant");
            if (tag.isEmpty()) {
                throw new IllegalArgumentException("Method tag cannot be empty");
            }
            if (variantsByTag.containsKey(tag)) {
                throw new IllegalArgumentException("Method tag already registered: " + tag);
            }
            if (tagsByVariant.containsKey(variant)) {
                throw new IllegalArgumentException("Variant already registered: " + variant.getName());
            }
            variantsByTag.put(tag, variant);
            tagsByVariant.put(variant, tag);
            return this;
        }

        public MethodSchema<M> build() {
            if (variantsByTag.isEmpty()) {
                throw new IllegalArgumentException("A method schema needs at least one method");
            }
            return new MethodSchema<>(this);
        }
    }
}
