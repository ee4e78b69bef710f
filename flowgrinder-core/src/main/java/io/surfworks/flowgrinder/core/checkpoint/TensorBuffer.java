package io.surfworks.flowgrinder.core.checkpoint;

import io.surfworks.flowgrinder.ir.TensorIr.ScalarType;
import io.surfworks.flowgrinder.ir.TensorIr.TensorType;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A materialized tensor: element type, shape and little-endian raw bytes.
 *
 * @param dtype element type
 * @param shape static extents
 * @param data  raw bytes, row-major, little-endian
 */
public record TensorBuffer(ScalarType dtype, List<Integer> shape, byte[] data) {

    public TensorBuffer {
        Objects.requireNonNull(dtype, "dtype");
        Objects.requireNonNull(data, "data");
        shape = List.copyOf(shape);
        long expected = elementCount(shape) * dtype.byteSize();
        if (expected != data.length) {
            throw new IllegalArgumentException(String.format(
                    "Tensor %s %s needs %d bytes, got %d", dtype, shape, expected, data.length));
        }
    }

    /**
     * Builds a float32 tensor from values, for in-memory parameter stores.
     */
    public static TensorBuffer ofFloats(List<Integer> shape, float... values) {
        ByteBuffer buf = ByteBuffer.allocate(values.length * 4).order(ByteOrder.LITTLE_ENDIAN);
        for (float v : values) {
            buf.putFloat(v);
        }
        return new TensorBuffer(ScalarType.F32, shape, buf.array());
    }

    /**
     * Builds a zero-filled tensor.
     */
    public static TensorBuffer zeros(ScalarType dtype, List<Integer> shape) {
        return new TensorBuffer(dtype, shape, new byte[(int) (elementCount(shape) * dtype.byteSize())]);
    }

    public long elementCount() {
        return elementCount(shape);
    }

    public TensorType tensorType() {
        return new TensorType(shape, dtype);
    }

    /**
     * Read-only little-endian view of the bytes.
     */
    public ByteBuffer asByteBuffer() {
        return ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN).asReadOnlyBuffer();
    }

    public float[] toFloatArray() {
        if (!dtype.equals(ScalarType.F32)) {
            throw new IllegalStateException("Not a float32 tensor: " + dtype);
        }
        float[] out = new float[(int) elementCount()];
        asByteBuffer().asFloatBuffer().get(out);
        return out;
    }

    private static long elementCount(List<Integer> shape) {
        long count = 1;
        for (int d : shape) {
            if (d < 0) {
                throw new IllegalArgumentException("Tensor buffers need static extents: " + shape);
            }
            count *= d;
        }
        return count;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TensorBuffer other)) return false;
        return dtype.equals(other.dtype)
                && shape.equals(other.shape)
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        int result = dtype.hashCode();
        result = 31 * result + shape.hashCode();
        result = 31 * result + Arrays.hashCode(data);
        return result;
    }

    @Override
    public String toString() {
        return String.format("TensorBuffer[%s %s, %d bytes]", dtype, shape, data.length);
    }
}
