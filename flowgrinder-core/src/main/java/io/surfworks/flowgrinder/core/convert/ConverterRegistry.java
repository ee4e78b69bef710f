package io.surfworks.flowgrinder.core.convert;

import io.surfworks.flowgrinder.core.attr.Attribute;
import io.surfworks.flowgrinder.core.attr.AttributeMap;
import io.surfworks.flowgrinder.ir.Ops;
import io.surfworks.flowgrinder.ir.TensorIr.ArrayAttr;
import io.surfworks.flowgrinder.ir.TensorIr.Attr;
import io.surfworks.flowgrinder.ir.TensorIr.BoolAttr;
import io.surfworks.flowgrinder.ir.TensorIr.FloatAttr;
import io.surfworks.flowgrinder.ir.TensorIr.IntAttr;
import io.surfworks.flowgrinder.ir.TensorIr.StringAttr;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Operator type to converter table.
 *
 * <p>Besides converters, the registry knows a set of identity pass-through
 * operators whose framework name equals the IR operator name; those convert to
 * a shape-preserving call with their attributes copied over.
 *
 * <p>Immutable once built.
 */
public final class ConverterRegistry {

    private final Map<String, OpConverter> converters;
    private final Set<String> identityOps;

    private ConverterRegistry(Map<String, OpConverter> converters, Set<String> identityOps) {
        this.converters = Collections.unmodifiableMap(new LinkedHashMap<>(converters));
        this.identityOps = Collections.unmodifiableSet(new LinkedHashSet<>(identityOps));
    }

    /**
     * A new standard table covering every supported operator. Each call builds
     * its own instance; callers own its lifetime.
     */
    public static ConverterRegistry standard() {
        return Standard.create();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Converter for an operator type; identity pass-through operators get a generic one.
     */
    public Optional<OpConverter> get(String opType) {
        OpConverter converter = converters.get(opType);
        if (converter != null) {
            return Optional.of(converter);
        }
        if (identityOps.contains(opType)) {
            return Optional.of(identity(opType));
        }
        return Optional.empty();
    }

    public boolean isIdentity(String opType) {
        return !converters.containsKey(opType) && identityOps.contains(opType);
    }

    public boolean supports(String opType) {
        return converters.containsKey(opType) || identityOps.contains(opType);
    }

    /**
     * The operator types in {@code opTypes} this registry cannot convert, sorted.
     */
    public SortedSet<String> unsupported(Collection<String> opTypes) {
        SortedSet<String> missing = new TreeSet<>();
        for (String opType : opTypes) {
            if (!supports(opType)) {
                missing.add(opType);
            }
        }
        return missing;
    }

    /**
     * All operator types, sorted.
     */
    public List<String> supportedOps() {
        SortedSet<String> all = new TreeSet<>(converters.keySet());
        all.addAll(identityOps);
        return List.copyOf(all);
    }

    private static OpConverter identity(String opType) {
        return (inputs, attributes, parameters) ->
                List.of(Ops.call(opType, inputs.values(), toIrAttrs(attributes)));
    }

    /**
     * Copies normalized attributes into IR attributes, keeping their order.
     */
    static Map<String, Attr> toIrAttrs(AttributeMap attributes) {
        Map<String, Attr> attrs = new LinkedHashMap<>();
        attributes.asMap().forEach((name, value) -> attrs.put(name, toIrAttr(value)));
        return attrs;
    }

    private static Attr toIrAttr(Attribute value) {
        if (value instanceof Attribute.BoolAttr b) {
            return new BoolAttr(b.value());
        } else if (value instanceof Attribute.Int32Attr i) {
            return new IntAttr(i.value());
        } else if (value instanceof Attribute.Int64Attr l) {
            return new IntAttr(l.value());
        } else if (value instanceof Attribute.Float32Attr f) {
            return new FloatAttr(f.value());
        } else if (value instanceof Attribute.Float64Attr d) {
            return new FloatAttr(d.value());
        } else if (value instanceof Attribute.StringAttr s) {
            return new StringAttr(s.value());
        } else if (value instanceof Attribute.ShapeAttr s) {
            return ArrayAttr.ofInts(s.dims());
        } else if (value instanceof Attribute.Int32ListAttr l) {
            return ArrayAttr.ofInts(l.values());
        } else if (value instanceof Attribute.Int64ListAttr l) {
            List<Attr> items = new ArrayList<>();
            for (long v : l.values()) {
                items.add(new IntAttr(v));
            }
            return new ArrayAttr(items);
        } else if (value instanceof Attribute.FloatListAttr l) {
            List<Attr> items = new ArrayList<>();
            for (float v : l.values()) {
                items.add(new FloatAttr(v));
            }
            return new ArrayAttr(items);
        }
        throw new IllegalStateException("Unknown attribute kind: " + value.getClass().getName());
    }

    /**
     * Collects converters; later registrations replace earlier ones.
     */
    public static final class Builder {

        private final Map<String, OpConverter> converters = new LinkedHashMap<>();
        private final Set<String> identityOps = new LinkedHashSet<>();

        private Builder() {}

        public Builder register(String opType, OpConverter converter) {
            converters.put(opType, converter);
            return this;
        }

        public Builder identity(String... opTypes) {
            Collections.addAll(identityOps, opTypes);
            return this;
        }

        public ConverterRegistry build() {
            return new ConverterRegistry(converters, identityOps);
        }
    }

    private static final class Standard {

        private Standard() {}

        static ConverterRegistry create() {
            Builder b = builder();

            // Elementwise and broadcast
            ElementwiseConverters.registerAll(b);

            // Convolution, pooling, upsampling
            SpatialConverters.registerAll(b);

            // Reductions
            ReductionConverters.registerAll(b);

            // Normalization
            NormalizationConverters.registerAll(b);

            // Shape rewrites
            ShapeConverters.registerAll(b);

            // Dense and activations
            ActivationConverters.registerAll(b);

            // Identity pass-through
            b.identity("relu", "sigmoid", "tanh", "exp", "log", "sqrt", "rsqrt", "abs", "negative",
                    "floor", "ceil", "round", "sin", "cos", "tan", "asin", "acos", "atan",
                    "sinh", "cosh", "asinh", "acosh", "atanh", "erf");
            return b.build();
        }
    }
}
