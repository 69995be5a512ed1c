package io.surfworks.wavesplit.core.types;

import java.util.Arrays;
import java.util.List;

import io.surfworks.wavesplit.core.DeclarationException;
import io.surfworks.wavesplit.core.symbolic.IndexExpr;

/**
 * Virtual register value. Always lives in {@link AddressSpace#REGISTER}.
 */
public record RegisterType(List<IndexExpr> symbolicShape, DataType dtype) implements ShapedType {

    public RegisterType {
        symbolicShape = ShapedType.toShape(symbolicShape);
        if (dtype == null) {
            throw new DeclarationException("Expected dtype to be a DataType, got null");
        }
    }

    /**
     * Declares a register type from {@code shape..., dtype}. The shape may also
     * be passed as a single {@link List}.
     *
     * @throws DeclarationException if any argument has the wrong type
     */
    public static RegisterType declare(Object... shapeAndDtype) {
        if (shapeAndDtype.length < 2) {
            throw new DeclarationException("Expected at least 2 arguments, got: " + Arrays.toString(shapeAndDtype));
        }
        Object dtype = shapeAndDtype[shapeAndDtype.length - 1];
        List<?> shape = Arrays.asList(shapeAndDtype).subList(0, shapeAndDtype.length - 1);
        if (shape.size() == 1 && shape.get(0) instanceof List<?> list) {
            shape = list;
        }
        List<IndexExpr> symbolicShape = ShapedType.toShape(shape);
        if (!(dtype instanceof DataType dataType)) {
            throw new DeclarationException("Expected dtype to be a DataType, got " + dtype);
        }
        return new RegisterType(symbolicShape, dataType);
    }

    @Override
    public AddressSpace addressSpace() {
        return AddressSpace.REGISTER;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Register[");
        for (IndexExpr e : symbolicShape) {
            sb.append(e).append(", ");
        }
        return sb.append(dtype).append("]").toString();
    }
}
