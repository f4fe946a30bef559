package ingest.datanode.apis;

import static com.google.common.base.Preconditions.checkArgument;

public class ReplicaConfigurationBuilder {
    private long nodeId = 0L;
    private boolean fairLock = false;
    private int initialCollectionCapacity = 16;
    /**
     * Expected number of segments on one node. Default is 256.
     */
    private int initialSegmentCapacity = 256;

    /**
     * Set the id of the data node holding the replica.
     * @param nodeId node id, not negative.
     * @return the replica configuration builder instance.
     */
    public ReplicaConfigurationBuilder setNodeId(long nodeId) {
        checkArgument(nodeId >= 0, "nodeId should not be negative");
        this.nodeId = nodeId;
        return this;
    }

    /**
     * Set the fairness of the replica lock.
     * @param fairLock true to grant the lock in arrival order.
     * @return the replica configuration builder instance.
     */
    public ReplicaConfigurationBuilder setFairLock(boolean fairLock) {
        this.fairLock = fairLock;
        return this;
    }

    public ReplicaConfigurationBuilder setInitialCollectionCapacity(int initialCollectionCapacity) {
        checkArgument(initialCollectionCapacity > 0, "initialCollectionCapacity should be positive");
        this.initialCollectionCapacity = initialCollectionCapacity;
        return this;
    }

    public ReplicaConfigurationBuilder setInitialSegmentCapacity(int initialSegmentCapacity) {
        checkArgument(initialSegmentCapacity > 0, "initialSegmentCapacity should be positive");
        this.initialSegmentCapacity = initialSegmentCapacity;
        return this;
    }

    /**
     * Build the replica configuration.
     * @return the replica configuration.
     */
    public ReplicaConfiguration build() {
        return new ReplicaConfiguration(nodeId, fairLock, initialCollectionCapacity, initialSegmentCapacity);
    }
}
