package io.surfworks.flowgrinder.core.attr;

import io.surfworks.flowgrinder.core.UnrecognizedAttributeKindException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts the exporter's tagged attribute values into an {@link AttributeMap}.
 *
 * <p>Known tags: {@code at_bool}, {@code at_int32}, {@code at_int64},
 * {@code at_float}, {@code at_double}, {@code at_string}, {@code at_shape},
 * {@code at_list_float}, {@code at_list_int32}, {@code at_list_int64}.
 * Any other tag, or a payload that does not fit its tag, fails the parse.
 */
public final class AttributeParser {

    private AttributeParser() {}

    public static AttributeMap parse(Map<String, RawAttribute> raw) {
        Map<String, Attribute> parsed = new LinkedHashMap<>();
        for (Map.Entry<String, RawAttribute> entry : raw.entrySet()) {
            parsed.put(entry.getKey(), parseOne(entry.getKey(), entry.getValue()));
        }
        return new AttributeMap(parsed);
    }

    static Attribute parseOne(String key, RawAttribute raw) {
        String tag = raw.tag();
        Object payload = raw.payload();
        return switch (tag) {
            case "at_bool" -> new Attribute.BoolAttr(asBoolean(key, tag, payload));
            case "at_int32" -> new Attribute.Int32Attr(toInt(key, tag, asNumber(key, tag, payload)));
            case "at_int64" -> new Attribute.Int64Attr(toLong(key, tag, asNumber(key, tag, payload)));
            case "at_float" -> new Attribute.Float32Attr(asNumber(key, tag, payload).floatValue());
            case "at_double" -> new Attribute.Float64Attr(asNumber(key, tag, payload).doubleValue());
            case "at_string" -> new Attribute.StringAttr(asString(key, tag, payload));
            case "at_shape" -> new Attribute.ShapeAttr(intList(key, tag, payload));
            case "at_list_float" -> new Attribute.FloatListAttr(floatList(key, tag, payload));
            case "at_list_int32" -> new Attribute.Int32ListAttr(intList(key, tag, payload));
            case "at_list_int64" -> new Attribute.Int64ListAttr(longList(key, tag, payload));
            default -> throw new UnrecognizedAttributeKindException(key, tag);
        };
    }

    private static boolean asBoolean(String key, String tag, Object payload) {
        if (payload instanceof Boolean b) {
            return b;
        }
        throw malformed(key, tag, payload, "a boolean");
    }

    private static Number asNumber(String key, String tag, Object payload) {
        if (payload instanceof Number n) {
            return n;
        }
        throw malformed(key, tag, payload, "a number");
    }

    private static String asString(String key, String tag, Object payload) {
        if (payload instanceof String s) {
            return s;
        }
        throw malformed(key, tag, payload, "a string");
    }

    private static List<?> asList(String key, String tag, Object payload) {
        if (payload instanceof List<?> list) {
            return list;
        }
        throw malformed(key, tag, payload, "a list");
    }

    private static List<Integer> intList(String key, String tag, Object payload) {
        List<Integer> values = new ArrayList<>();
        for (Object item : asList(key, tag, payload)) {
            values.add(toInt(key, tag, asNumber(key, tag, item)));
        }
        return values;
    }

    private static List<Long> longList(String key, String tag, Object payload) {
        List<Long> values = new ArrayList<>();
        for (Object item : asList(key, tag, payload)) {
            values.add(toLong(key, tag, asNumber(key, tag, item)));
        }
        return values;
    }

    private static List<Float> floatList(String key, String tag, Object payload) {
        List<Float> values = new ArrayList<>();
        for (Object item : asList(key, tag, payload)) {
            values.add(asNumber(key, tag, item).floatValue());
        }
        return values;
    }

    private static long toLong(String key, String tag, Number n) {
        double d = n.doubleValue();
        if (d != Math.rint(d)) {
            throw new UnrecognizedAttributeKindException(key, tag, "expected an integer, got " + n);
        }
        return n.longValue();
    }

    private static int toInt(String key, String tag, Number n) {
        long value = toLong(key, tag, n);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new UnrecognizedAttributeKindException(key, tag, value + " does not fit in 32 bits");
        }
        return (int) value;
    }

    private static UnrecognizedAttributeKindException malformed(String key, String tag, Object payload,
                                                                String expected) {
        String actual = payload == null ? "null" : payload.getClass().getSimpleName();
        return new UnrecognizedAttributeKindException(key, tag, "expected " + expected + ", got " + actual);
    }
}
