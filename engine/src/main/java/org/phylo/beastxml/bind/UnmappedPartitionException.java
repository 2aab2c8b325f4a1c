package org.phylo.beastxml.bind;

/**
 * Thrown when a partition has no model, or a model outside the template catalogue.
 */
public class UnmappedPartitionException extends BindingException {

    private final String partition;

    public UnmappedPartitionException(String partition, String reason) {
        super("Partition '" + partition + "' cannot be mapped to a model: " + reason);
        this.partition = partition;
    }

    public String getPartition() {
        return partition;
    }
}
