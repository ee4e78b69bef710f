package io.surfworks.flowgrinder.core.attr;

import io.surfworks.flowgrinder.core.ConversionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable map of normalized attributes with typed accessors.
 *
 * <p>Accessors widen where the meaning is unambiguous: an int32 reads as a
 * long or double, an int64 list reads as an int list. Asking for a missing
 * attribute without a default, or for an attribute of an incompatible kind,
 * fails with a {@link ConversionException} naming the attribute.
 */
public final class AttributeMap {

    private static final AttributeMap EMPTY = new AttributeMap(Map.of());

    private final Map<String, Attribute> values;

    public AttributeMap(Map<String, Attribute> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static AttributeMap empty() {
        return EMPTY;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Optional<Attribute> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public Set<String> names() {
        return values.keySet();
    }

    public Map<String, Attribute> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    /**
     * Returns a copy with {@code name} set to {@code value}.
     */
    public AttributeMap with(String name, Attribute value) {
        Map<String, Attribute> copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        return new AttributeMap(copy);
    }

    // ==================== Scalars ====================

    public boolean getBool(String name, boolean defaultValue) {
        Attribute a = values.get(name);
        if (a == null) {
            return defaultValue;
        }
        if (a instanceof Attribute.BoolAttr b) {
            return b.value();
        }
        throw wrongKind(name, "boolean", a);
    }

    public int getInt(String name) {
        return Math.toIntExact(getLong(name));
    }

    public int getInt(String name, int defaultValue) {
        return has(name) ? getInt(name) : defaultValue;
    }

    public long getLong(String name) {
        Attribute a = require(name);
        if (a instanceof Attribute.Int32Attr i) {
            return i.value();
        }
        if (a instanceof Attribute.Int64Attr l) {
            return l.value();
        }
        throw wrongKind(name, "integer", a);
    }

    public double getDouble(String name) {
        Attribute a = require(name);
        if (a instanceof Attribute.Float32Attr f) {
            return f.value();
        }
        if (a instanceof Attribute.Float64Attr d) {
            return d.value();
        }
        if (a instanceof Attribute.Int32Attr i) {
            return i.value();
        }
        if (a instanceof Attribute.Int64Attr l) {
            return l.value();
        }
        throw wrongKind(name, "number", a);
    }

    public double getDouble(String name, double defaultValue) {
        return has(name) ? getDouble(name) : defaultValue;
    }

    public String getString(String name) {
        Attribute a = require(name);
        if (a instanceof Attribute.StringAttr s) {
            return s.value();
        }
        throw wrongKind(name, "string", a);
    }

    public String getString(String name, String defaultValue) {
        return has(name) ? getString(name) : defaultValue;
    }

    // ==================== Lists ====================

    public List<Integer> getInts(String name) {
        Attribute a = require(name);
        if (a instanceof Attribute.Int32ListAttr l) {
            return l.values();
        }
        if (a instanceof Attribute.ShapeAttr s) {
            return s.dims();
        }
        if (a instanceof Attribute.Int64ListAttr l) {
            List<Integer> ints = new ArrayList<>(l.values().size());
            for (long v : l.values()) {
                ints.add(Math.toIntExact(v));
            }
            return ints;
        }
        if (a instanceof Attribute.Int32Attr i) {
            return List.of(i.value());
        }
        throw wrongKind(name, "integer list", a);
    }

    public List<Integer> getInts(String name, List<Integer> defaultValue) {
        return has(name) ? getInts(name) : defaultValue;
    }

    public List<Float> getFloats(String name) {
        Attribute a = require(name);
        if (a instanceof Attribute.FloatListAttr f) {
            return f.values();
        }
        throw wrongKind(name, "float list", a);
    }

    private Attribute require(String name) {
        Attribute a = values.get(name);
        if (a == null) {
            throw new ConversionException("Missing required attribute '" + name + "'");
        }
        return a;
    }

    private static ConversionException wrongKind(String name, String expected, Attribute actual) {
        return new ConversionException(String.format("Attribute '%s' should be %s but is %s",
                name, expected, actual.getClass().getSimpleName()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeMap that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
