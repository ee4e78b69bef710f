package io.surfworks.flowgrinder.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Node classes for the FlowGrinder tensor IR.
 *
 * The IR is an expression tree: variables, constants, operator calls and
 * tuples, closed over by a {@link Function}. Every expression carries its
 * checked type; shapes use {@link TensorType#DYNAMIC} for extents only known
 * at run time.
 */
public final class TensorIr {

    private TensorIr() {}

    // ==================== Types ====================

    /**
     * Base interface for all IR types.
     */
    public sealed interface Type permits TensorType, TupleType {
        String toIrString();
    }

    /**
     * Scalar element types: float32, int64, etc.
     */
    public record ScalarType(String name, int byteSize) {
        public static final ScalarType F16 = new ScalarType("float16", 2);
        public static final ScalarType F32 = new ScalarType("float32", 4);
        public static final ScalarType F64 = new ScalarType("float64", 8);
        public static final ScalarType I8 = new ScalarType("int8", 1);
        public static final ScalarType I32 = new ScalarType("int32", 4);
        public static final ScalarType I64 = new ScalarType("int64", 8);
        public static final ScalarType U8 = new ScalarType("uint8", 1);
        public static final ScalarType BOOL = new ScalarType("bool", 1);

        public static ScalarType of(String name) {
            return switch (name) {
                case "float16", "f16" -> F16;
                case "float32", "f32" -> F32;
                case "float64", "f64" -> F64;
                case "int8", "i8" -> I8;
                case "int32", "i32" -> I32;
                case "int64", "i64" -> I64;
                case "uint8", "u8" -> U8;
                case "bool", "i1" -> BOOL;
                default -> throw new IrException("Unknown scalar type: " + name);
            };
        }

        public boolean isFloatingPoint() {
            return name.startsWith("float");
        }

        public boolean isInteger() {
            return name.startsWith("int") || name.startsWith("uint");
        }

        /**
         * Most negative representable value, the identity element of max.
         */
        public Number lowest() {
            return switch (name) {
                case "float16" -> -65504.0;
                case "float32" -> (double) -Float.MAX_VALUE;
                case "float64" -> -Double.MAX_VALUE;
                case "int8" -> (long) Byte.MIN_VALUE;
                case "int32" -> (long) Integer.MIN_VALUE;
                case "int64" -> Long.MIN_VALUE;
                case "uint8", "bool" -> 0L;
                default -> throw new IrException("No lowest value for " + name);
            };
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Tensor type: Tensor[(1, 3, 32, 32), float32]
     */
    public record TensorType(List<Integer> shape, ScalarType elementType) implements Type {

        public static final int DYNAMIC = -1;

        public TensorType {
            shape = List.copyOf(shape);
        }

        public static TensorType of(ScalarType elementType, int... dims) {
            List<Integer> shape = new ArrayList<>(dims.length);
            for (int d : dims) {
                shape.add(d);
            }
            return new TensorType(shape, elementType);
        }

        public static TensorType scalar(ScalarType elementType) {
            return new TensorType(List.of(), elementType);
        }

        public int rank() {
            return shape.size();
        }

        public int dim(int i) {
            return shape.get(i);
        }

        public boolean isStatic() {
            return shape.stream().noneMatch(d -> d == DYNAMIC);
        }

        public TensorType withShape(List<Integer> newShape) {
            return new TensorType(newShape, elementType);
        }

        public TensorType withElementType(ScalarType newElementType) {
            return new TensorType(shape, newElementType);
        }

        public long elementCount() {
            long count = 1;
            for (int d : shape) {
                if (d == DYNAMIC) {
                    return DYNAMIC;
                }
                count *= d;
            }
            return count;
        }

        @Override
        public String toIrString() {
            StringBuilder sb = new StringBuilder("Tensor[(");
            for (int i = 0; i < shape.size(); i++) {
                if (i > 0) sb.append(", ");
                int d = shape.get(i);
                sb.append(d == DYNAMIC ? "?" : String.valueOf(d));
            }
            if (shape.size() == 1) sb.append(",");
            sb.append("), ").append(elementType).append("]");
            return sb.toString();
        }
    }

    /**
     * Tuple type: (Tensor[...], Tensor[...])
     */
    public record TupleType(List<Type> fields) implements Type {

        public TupleType {
            fields = List.copyOf(fields);
        }

        public int size() {
            return fields.size();
        }

        @Override
        public String toIrString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(fields.get(i).toIrString());
            }
            sb.append(")");
            return sb.toString();
        }
    }

    // ==================== Attributes ====================

    /**
     * Base interface for operator call attributes.
     */
    public sealed interface Attr permits IntAttr, FloatAttr, BoolAttr, StringAttr, ArrayAttr {
        String toIrString();
    }

    public record IntAttr(long value) implements Attr {
        @Override
        public String toIrString() {
            return String.valueOf(value);
        }
    }

    public record FloatAttr(double value) implements Attr {
        @Override
        public String toIrString() {
            return String.valueOf(value);
        }
    }

    public record BoolAttr(boolean value) implements Attr {
        @Override
        public String toIrString() {
            return value ? "True" : "False";
        }
    }

    public record StringAttr(String value) implements Attr {
        @Override
        public String toIrString() {
            return "\"" + value + "\"";
        }
    }

    public record ArrayAttr(List<Attr> values) implements Attr {

        public ArrayAttr {
            values = List.copyOf(values);
        }

        public static ArrayAttr ofInts(List<Integer> ints) {
            return new ArrayAttr(ints.stream().<Attr>map(i -> new IntAttr(i)).toList());
        }

        public static ArrayAttr ofFloats(List<Double> floats) {
            return new ArrayAttr(floats.stream().<Attr>map(FloatAttr::new).toList());
        }

        public List<Integer> asIntList() {
            return values.stream()
                    .map(a -> (int) ((IntAttr) a).value())
                    .toList();
        }

        @Override
        public String toIrString() {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(values.get(i).toIrString());
            }
            sb.append("]");
            return sb.toString();
        }
    }

    // ==================== Expressions ====================

    /**
     * Base interface for all IR expressions.
     */
    public sealed interface Expr permits Var, Constant, Call, Tuple, TupleGetItem {
        Type type();

        /**
         * The checked type as a tensor type; fails for tuple-typed expressions.
         */
        default TensorType tensorType() {
            if (type() instanceof TensorType tt) {
                return tt;
            }
            throw new IrException("Expected a tensor-typed expression but got " + type().toIrString());
        }
    }

    /**
     * A free or bound variable: %Input_0
     */
    public record Var(String name, TensorType type) implements Expr {
        @Override
        public String toString() {
            return "%" + name + ": " + type.toIrString();
        }
    }

    /**
     * A constant tensor. Values are stored in row-major order; a single value
     * is broadcast over the whole shape.
     */
    public record Constant(List<Number> values, TensorType type) implements Expr {

        public Constant {
            values = List.copyOf(values);
            long count = type.elementCount();
            if (values.size() != 1 && count != values.size()) {
                throw new IrException("Constant of type " + type.toIrString()
                        + " needs " + count + " values, got " + values.size());
            }
        }

        public static Constant scalar(Number value, ScalarType elementType) {
            return new Constant(List.of(value), TensorType.scalar(elementType));
        }

        public static Constant filled(Number value, TensorType type) {
            return new Constant(List.of(value), type);
        }

        public static Constant ofLongs(List<Long> values) {
            return new Constant(new ArrayList<>(values), TensorType.of(ScalarType.I64, values.size()));
        }

        public boolean isSplat() {
            return values.size() == 1;
        }
    }

    /**
     * An operator application: nn.conv2d(%x, %w, padding=[1, 1, 1, 1])
     */
    public record Call(String op, List<Expr> args, Map<String, Attr> attrs, Type type) implements Expr {

        public Call {
            args = List.copyOf(args);
            attrs = Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
        }

        public Attr attr(String name) {
            return attrs.get(name);
        }

        public Expr arg(int i) {
            return args.get(i);
        }
    }

    /**
     * A tuple of values.
     */
    public record Tuple(List<Expr> fields, TupleType type) implements Expr {

        public Tuple {
            fields = List.copyOf(fields);
        }

        public static Tuple of(List<Expr> fields) {
            return new Tuple(fields, new TupleType(fields.stream().map(Expr::type).toList()));
        }
    }

    /**
     * Projection of one field out of a tuple-typed expression.
     */
    public record TupleGetItem(Expr tuple, int index, Type type) implements Expr {

        public static TupleGetItem of(Expr tuple, int index) {
            if (!(tuple.type() instanceof TupleType tt)) {
                throw new IrException("TupleGetItem on non-tuple " + tuple.type().toIrString());
            }
            if (index < 0 || index >= tt.size()) {
                throw new IrException("Tuple index " + index + " out of range for " + tt.toIrString());
            }
            return new TupleGetItem(tuple, index, tt.fields().get(index));
        }
    }

    // ==================== Function and Module ====================

    /**
     * An IR function: parameters in signature order and the body expression.
     */
    public record Function(List<Var> params, Expr body) {

        public Function {
            params = List.copyOf(params);
        }

        public Type returnType() {
            return body.type();
        }

        public List<String> paramNames() {
            return params.stream().map(Var::name).toList();
        }
    }

    /**
     * An IR module holding the entry function.
     */
    public record Module(String name, Function main) {}
}
