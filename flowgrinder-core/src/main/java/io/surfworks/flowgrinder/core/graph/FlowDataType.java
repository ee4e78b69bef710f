package io.surfworks.flowgrinder.core.graph;

import io.surfworks.flowgrinder.ir.TensorIr.ScalarType;

/**
 * Numeric data type codes used by the exporting framework's blob descriptors.
 */
public enum FlowDataType {

    FLOAT32(2, ScalarType.F32),
    FLOAT64(3, ScalarType.F64),
    INT8(4, ScalarType.I8),
    INT32(5, ScalarType.I32),
    INT64(6, ScalarType.I64),
    UINT8(7, ScalarType.U8),
    FLOAT16(9, ScalarType.F16);

    private final int code;
    private final ScalarType scalarType;

    FlowDataType(int code, ScalarType scalarType) {
        this.code = code;
        this.scalarType = scalarType;
    }

    public int code() {
        return code;
    }

    public ScalarType scalarType() {
        return scalarType;
    }

    public static FlowDataType fromCode(int code) {
        for (FlowDataType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown data type code: " + code);
    }

    public static FlowDataType fromScalarType(ScalarType scalarType) {
        for (FlowDataType type : values()) {
            if (type.scalarType.equals(scalarType)) {
                return type;
            }
        }
        throw new IllegalArgumentException("No data type code for: " + scalarType);
    }
}
