package io.surfworks.flowgrinder.core.attr;

import io.surfworks.flowgrinder.core.ConversionException;
import io.surfworks.flowgrinder.core.UnrecognizedAttributeKindException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AttributeParser")
class AttributeParserTest {

    private static AttributeMap parse(String key, String tag, Object payload) {
        return AttributeParser.parse(Map.of(key, new RawAttribute(tag, payload)));
    }

    @Nested
    @DisplayName("known tags")
    class KnownTags {

        @Test
        void scalarsKeepTheirKind() {
            Map<String, RawAttribute> raw = new LinkedHashMap<>();
            raw.put("use_bias", new RawAttribute("at_bool", true));
            raw.put("groups", new RawAttribute("at_int32", 2));
            raw.put("axis", new RawAttribute("at_int64", 3L));
            raw.put("epsilon", new RawAttribute("at_float", 1e-5));
            raw.put("scale", new RawAttribute("at_double", 0.5));
            raw.put("padding", new RawAttribute("at_string", "same_upper"));

            AttributeMap attrs = AttributeParser.parse(raw);

            assertEquals(new Attribute.BoolAttr(true), attrs.get("use_bias").orElseThrow());
            assertEquals(new Attribute.Int32Attr(2), attrs.get("groups").orElseThrow());
            assertEquals(new Attribute.Int64Attr(3L), attrs.get("axis").orElseThrow());
            assertEquals(new Attribute.Float32Attr(1e-5f), attrs.get("epsilon").orElseThrow());
            assertEquals(new Attribute.Float64Attr(0.5), attrs.get("scale").orElseThrow());
            assertEquals("same_upper", attrs.getString("padding"));
            assertEquals(List.of("use_bias", "groups", "axis", "epsilon", "scale", "padding"),
                    List.copyOf(attrs.names()));
        }

        @Test
        void listsAndShapes() {
            assertEquals(List.of(3, 3), parse("kernel_size", "at_list_int32", List.of(3, 3)).getInts("kernel_size"));
            assertEquals(List.of(1, 64), parse("shape", "at_shape", List.of(1L, 64L)).getInts("shape"));
            assertEquals(List.of(0.5f, 1.5f), parse("scales", "at_list_float", List.of(0.5, 1.5)).getFloats("scales"));
            assertEquals(new Attribute.Int64ListAttr(List.of(7L)),
                    parse("perm", "at_list_int64", List.of(7)).get("perm").orElseThrow());
        }

        @Test
        void integralDoublesAreAcceptedAsIntegers() {
            assertEquals(4, parse("groups", "at_int32", 4.0).getInt("groups"));
        }
    }

    @Nested
    @DisplayName("rejected input")
    class Rejected {

        @Test
        void unknownTagNamesKeyAndTag() {
            UnrecognizedAttributeKindException e = assertThrows(UnrecognizedAttributeKindException.class,
                    () -> parse("dtype", "at_data_type", 2));
            assertEquals("dtype", e.getKey());
            assertEquals("at_data_type", e.getTag());
            assertTrue(e.getMessage().contains("at_data_type"));
        }

        @Test
        void fractionalIntegerIsMalformed() {
            assertThrows(UnrecognizedAttributeKindException.class, () -> parse("axis", "at_int32", 1.5));
        }

        @Test
        void int32Overflow() {
            assertThrows(UnrecognizedAttributeKindException.class,
                    () -> parse("axis", "at_int32", 1L + Integer.MAX_VALUE));
        }

        @Test
        void payloadOfWrongShape() {
            assertThrows(UnrecognizedAttributeKindException.class, () -> parse("flag", "at_bool", "yes"));
            assertThrows(UnrecognizedAttributeKindException.class, () -> parse("dims", "at_shape", 3));
            assertThrows(UnrecognizedAttributeKindException.class,
                    () -> parse("dims", "at_list_int32", List.of("a")));
        }
    }

    @Nested
    @DisplayName("AttributeMap accessors")
    class Accessors {

        @Test
        void defaultsApplyOnlyWhenMissing() {
            AttributeMap attrs = parse("axis", "at_int32", -1);
            assertEquals(-1, attrs.getInt("axis", 1));
            assertEquals(1, attrs.getInt("begin_norm_axis", 1));
            assertFalse(attrs.getBool("keepdims", false));
        }

        @Test
        void integersWidenToDouble() {
            assertEquals(2.0, parse("scale", "at_int64", 2L).getDouble("scale"));
        }

        @Test
        void wrongKindNamesTheAttribute() {
            ConversionException e = assertThrows(ConversionException.class,
                    () -> parse("padding", "at_int32", 1).getString("padding"));
            assertTrue(e.getMessage().contains("'padding'"));
        }

        @Test
        void missingRequiredAttribute() {
            assertThrows(ConversionException.class, () -> AttributeMap.empty().getInts("shape"));
        }

        @Test
        void withReturnsACopy() {
            AttributeMap base = parse("axis", "at_int32", 0);
            AttributeMap changed = base.with("axis", new Attribute.Int32Attr(2));
            assertEquals(0, base.getInt("axis"));
            assertEquals(2, changed.getInt("axis"));
        }
    }
}
