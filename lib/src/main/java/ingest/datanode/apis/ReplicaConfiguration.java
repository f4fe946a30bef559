package ingest.datanode.apis;

public class ReplicaConfiguration {
    /**
     * Id of the data node holding the replica. Stamped on the statistics it reports.
     */
    private final long nodeId;
    /**
     * Whether the replica lock grants access in arrival order. Default is false.
     */
    private final boolean fairLock;
    private final int initialCollectionCapacity;
    private final int initialSegmentCapacity;

    ReplicaConfiguration(long nodeId, boolean fairLock, int initialCollectionCapacity, int initialSegmentCapacity) {
        this.nodeId = nodeId;
        this.fairLock = fairLock;
        this.initialCollectionCapacity = initialCollectionCapacity;
        this.initialSegmentCapacity = initialSegmentCapacity;
    }

    public static ReplicaConfigurationBuilder newBuilder() {
        return new ReplicaConfigurationBuilder();
    }

    public static ReplicaConfiguration defaultConfiguration() {
        return newBuilder().build();
    }

    public long getNodeId() {
        return nodeId;
    }

    public boolean isFairLock() {
        return fairLock;
    }

    public int getInitialCollectionCapacity() {
        return initialCollectionCapacity;
    }

    public int getInitialSegmentCapacity() {
        return initialSegmentCapacity;
    }
}
