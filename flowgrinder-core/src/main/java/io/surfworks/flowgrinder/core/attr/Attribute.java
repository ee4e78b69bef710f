package io.surfworks.flowgrinder.core.attr;

import java.util.List;

/**
 * Normalized, strongly typed operator attribute.
 */
public sealed interface Attribute permits Attribute.BoolAttr, Attribute.Int32Attr, Attribute.Int64Attr,
        Attribute.Float32Attr, Attribute.Float64Attr, Attribute.StringAttr, Attribute.ShapeAttr,
        Attribute.FloatListAttr, Attribute.Int32ListAttr, Attribute.Int64ListAttr {

    record BoolAttr(boolean value) implements Attribute {}

    record Int32Attr(int value) implements Attribute {}

    record Int64Attr(long value) implements Attribute {}

    record Float32Attr(float value) implements Attribute {}

    record Float64Attr(double value) implements Attribute {}

    record StringAttr(String value) implements Attribute {}

    record ShapeAttr(List<Integer> dims) implements Attribute {
        public ShapeAttr {
            dims = List.copyOf(dims);
        }
    }

    record FloatListAttr(List<Float> values) implements Attribute {
        public FloatListAttr {
            values = List.copyOf(values);
        }
    }

    record Int32ListAttr(List<Integer> values) implements Attribute {
        public Int32ListAttr {
            values = List.copyOf(values);
        }
    }

    record Int64ListAttr(List<Long> values) implements Attribute {
        public Int64ListAttr {
            values = List.copyOf(values);
        }
    }
}
