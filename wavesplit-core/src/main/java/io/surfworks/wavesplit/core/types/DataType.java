package io.surfworks.wavesplit.core.types;

import io.surfworks.wavesplit.core.DeclarationException;

/**
 * Scalar element types: f16, bf16, f32, f64, i1 ... i64.
 */
public record DataType(String name, int bitWidth) implements ValueType {
    public static final DataType F16 = new DataType("f16", 16);
    public static final DataType BF16 = new DataType("bf16", 16);
    public static final DataType F32 = new DataType("f32", 32);
    public static final DataType F64 = new DataType("f64", 64);
    public static final DataType I1 = new DataType("i1", 1);
    public static final DataType I8 = new DataType("i8", 8);
    public static final DataType I16 = new DataType("i16", 16);
    public static final DataType I32 = new DataType("i32", 32);
    public static final DataType I64 = new DataType("i64", 64);

    public static DataType of(String name) {
        return switch (name) {
            case "f16" -> F16;
            case "bf16" -> BF16;
            case "f32" -> F32;
            case "f64" -> F64;
            case "i1" -> I1;
            case "i8" -> I8;
            case "i16" -> I16;
            case "i32" -> I32;
            case "i64" -> I64;
            default -> throw new DeclarationException("Unknown data type: " + name);
        };
    }

    public boolean isFloatingPoint() {
        return name.startsWith("f") || name.equals("bf16");
    }

    public boolean isInteger() {
        return name.startsWith("i");
    }

    public int byteSize() {
        return Math.max(1, bitWidth / 8);
    }

    @Override
    public String toString() {
        return name;
    }
}
