package io.surfworks.wavesplit.expansion;

import java.util.Map;

import io.surfworks.wavesplit.core.graph.DimQuery;
import io.surfworks.wavesplit.core.graph.Node;
import io.surfworks.wavesplit.core.graph.WaveOps.MemoryAccess;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;
import io.surfworks.wavesplit.core.types.MemoryType;

/**
 * Diagnostic names of expanded clones, e.g. {@code read_shared_M:0_BLOC*:1}.
 */
public final class ExpansionNaming {

    private static final int MAX_DIM_CHARS = 4;

    private ExpansionNaming() {}

    public static String expandedName(Node node, DimQuery query) {
        StringBuilder name = new StringBuilder(node.name());
        if (node.op() instanceof MemoryAccess access
                && access.memory(node).type() instanceof MemoryType memory
                && memory.isShared()) {
            name.append("_shared");
        }
        for (Map.Entry<IndexSymbol, Integer> entry : query.values().entrySet()) {
            String dim = entry.getKey().name();
            if (dim.length() > MAX_DIM_CHARS) {
                dim = dim.substring(0, MAX_DIM_CHARS) + "*";
            }
            name.append('_').append(dim).append(':').append(entry.getValue());
        }
        return name.toString();
    }
}
