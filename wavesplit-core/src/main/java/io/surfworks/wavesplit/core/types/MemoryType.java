package io.surfworks.wavesplit.core.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import io.surfworks.wavesplit.core.DeclarationException;
import io.surfworks.wavesplit.core.symbolic.IndexExpr;

/**
 * Storage anywhere in the memory hierarchy except registers.
 *
 * <p>The symbolic shape is the logical shape of the buffer. When the physical
 * shape differs, it is given as a {@link MemoryLayout}. For example, a GEMM
 * output of logical shape {@code (M, N)} stored as {@code (M', N')}:
 * <pre>{@code
 * MemoryType c = MemoryType.declare(M, N, AddressSpace.GLOBAL_MEMORY, DataType.F32,
 *         MemoryLayout.of(M2, N2));
 * }</pre>
 *
 * @param symbolicShape  logical shape, rank at least 1
 * @param addressSpace   any tier except {@link AddressSpace#REGISTER}
 * @param dtype          element type
 * @param physicalLayout physical shape, or null when it equals the logical shape
 * @param usage          usage tag
 */
public record MemoryType(
        List<IndexExpr> symbolicShape,
        AddressSpace addressSpace,
        DataType dtype,
        MemoryLayout physicalLayout,
        BufferUsage usage
) implements ShapedType {

    public MemoryType {
        symbolicShape = ShapedType.toShape(symbolicShape);
        if (addressSpace == null) {
            throw new DeclarationException("Expected addressSpace to be an AddressSpace, got null");
        }
        if (addressSpace == AddressSpace.REGISTER) {
            throw new DeclarationException("Memory does not support address space register, use Register instead");
        }
        if (dtype == null) {
            throw new DeclarationException("Expected dtype to be a DataType, got null");
        }
        if (usage == null) {
            usage = BufferUsage.NONE;
        }
    }

    public MemoryType(List<IndexExpr> symbolicShape, AddressSpace addressSpace, DataType dtype) {
        this(symbolicShape, addressSpace, dtype, null, BufferUsage.NONE);
    }

    /**
     * Declares a memory type from {@code shape..., addressSpace, dtype[, layout][, usage]}.
     * The shape may also be passed as a single {@link List}.
     *
     * @throws DeclarationException if any argument has the wrong type
     */
    public static MemoryType declare(Object... shapeAndDtype) {
        if (shapeAndDtype.length < 3) {
            throw new DeclarationException("Expected at least 3 arguments, got: " + Arrays.toString(shapeAndDtype));
        }
        List<Object> args = new ArrayList<>(Arrays.asList(shapeAndDtype));

        BufferUsage usage = BufferUsage.NONE;
        if (last(args) instanceof BufferUsage u) {
            usage = u;
            args.remove(args.size() - 1);
        }
        MemoryLayout layout = null;
        if (last(args) instanceof MemoryLayout l) {
            layout = l;
            args.remove(args.size() - 1);
        }
        if (args.size() < 3) {
            throw new DeclarationException("Expected shape, address space and dtype, got: " + args);
        }
        Object dtype = args.remove(args.size() - 1);
        Object addressSpace = args.remove(args.size() - 1);

        List<?> shape = args;
        if (shape.size() == 1 && shape.get(0) instanceof List<?> list) {
            shape = list;
        }
        List<IndexExpr> symbolicShape = ShapedType.toShape(shape);
        if (!(dtype instanceof DataType dataType)) {
            throw new DeclarationException("Expected dtype to be a DataType, got " + dtype);
        }
        if (!(addressSpace instanceof AddressSpace space)) {
            throw new DeclarationException("Expected addressSpace to be an AddressSpace, got " + addressSpace);
        }
        return new MemoryType(symbolicShape, space, dataType, layout, usage);
    }

    public boolean isShared() {
        return addressSpace == AddressSpace.SHARED_MEMORY;
    }

    private static Object last(List<Object> args) {
        return args.isEmpty() ? null : args.get(args.size() - 1);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Memory[");
        for (IndexExpr e : symbolicShape) {
            sb.append(e).append(", ");
        }
        sb.append(addressSpace).append(", ").append(dtype);
        if (physicalLayout != null) {
            sb.append(", layout=").append(physicalLayout.shape());
        }
        if (usage != BufferUsage.NONE) {
            sb.append(", ").append(usage);
        }
        return sb.append("]").toString();
    }
}
