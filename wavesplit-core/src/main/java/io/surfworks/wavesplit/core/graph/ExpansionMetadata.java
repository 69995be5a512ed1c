package io.surfworks.wavesplit.core.graph;

/**
 * Expansion bookkeeping attached to a graph node.
 *
 * <p>Created fresh for each expansion request. Every clone left in the graph
 * after expansion carries one with the coordinate it stands for.
 */
public final class ExpansionMetadata {

    private final DimQuery dimQuery;
    private boolean doNotExpand;
    private boolean lastMmaNode;
    private DimQuery sourceDimQuery;
    private Integer numQueries;
    private Integer queryIndex;

    public ExpansionMetadata(DimQuery dimQuery) {
        this.dimQuery = dimQuery;
    }

    /**
     * Metadata for a node that is coordinate independent and passes through
     * expansion unchanged.
     */
    public static ExpansionMetadata doNotExpand() {
        ExpansionMetadata metadata = new ExpansionMetadata(DimQuery.EMPTY);
        metadata.doNotExpand = true;
        return metadata;
    }

    public DimQuery dimQuery() {
        return dimQuery;
    }

    public boolean isDoNotExpand() {
        return doNotExpand;
    }

    public boolean isLastMmaNode() {
        return lastMmaNode;
    }

    public void setLastMmaNode(boolean lastMmaNode) {
        this.lastMmaNode = lastMmaNode;
    }

    /**
     * Coordinate of the reshape clone that requested this node, or null.
     */
    public DimQuery sourceDimQuery() {
        return sourceDimQuery;
    }

    public Integer numQueries() {
        return numQueries;
    }

    public Integer queryIndex() {
        return queryIndex;
    }

    /**
     * Records which of the reshape's {@code numQueries} source operands this
     * node was requested as.
     */
    public void setReshapeSource(DimQuery sourceDimQuery, int numQueries, int queryIndex) {
        this.sourceDimQuery = sourceDimQuery;
        this.numQueries = numQueries;
        this.queryIndex = queryIndex;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ExpansionMetadata[dimQuery=").append(dimQuery);
        if (doNotExpand) sb.append(", doNotExpand");
        if (lastMmaNode) sb.append(", lastMmaNode");
        if (sourceDimQuery != null) {
            sb.append(", sourceDimQuery=").append(sourceDimQuery)
                    .append(", query=").append(queryIndex).append('/').append(numQueries);
        }
        return sb.append(']').toString();
    }
}
