package ingest.datanode.replica.impl;

import com.google.common.base.Preconditions;
import ingest.datanode.apis.CollectionReplica;
import ingest.datanode.apis.ReplicaConfiguration;
import ingest.datanode.apis.exception.NotFoundException;
import ingest.datanode.models.Collection;
import ingest.datanode.models.CollectionSchema;
import ingest.datanode.models.MsgPosition;
import ingest.datanode.models.Segment;
import ingest.datanode.models.SegmentStatisticsUpdates;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * CollectionReplicaImpl guards both registries with a single read/write lock.
 * <p>
 * Lookups share the read lock. Mutations, including the statistics snapshot which clears the new flag, take the
 * write lock. No method calls another locking method while holding the lock.
 */
public class CollectionReplicaImpl implements CollectionReplica {
    private final ReplicaConfiguration configuration;
    private final CollectionRegistry collections;
    private final SegmentRegistry segments;
    private final Lock readLock;
    private final Lock writeLock;

    public CollectionReplicaImpl(ReplicaConfiguration configuration) {
        Preconditions.checkArgument(configuration != null, "configuration is null");
        this.configuration = configuration;
        this.collections = new CollectionRegistry(configuration.getInitialCollectionCapacity());
        this.segments = new SegmentRegistry(configuration.getInitialSegmentCapacity());
        ReentrantReadWriteLock lock = new ReentrantReadWriteLock(configuration.isFairLock());
        this.readLock = lock.readLock();
        this.writeLock = lock.writeLock();
    }

    public CollectionReplicaImpl() {
        this(ReplicaConfiguration.defaultConfiguration());
    }

    public ReplicaConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public int getCollectionNum() {
        readLock.lock();
        try {
            return collections.count();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public void addCollection(long collectionId, CollectionSchema schema) {
        writeLock.lock();
        try {
            collections.add(collectionId, schema);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void removeCollection(long collectionId) {
        writeLock.lock();
        try {
            collections.remove(collectionId);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Collection getCollectionById(long collectionId) throws NotFoundException {
        readLock.lock();
        try {
            return collections.getById(collectionId);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Collection getCollectionByName(String collectionName) throws NotFoundException {
        readLock.lock();
        try {
            return collections.getByName(collectionName);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public long getCollectionIdByName(String collectionName) throws NotFoundException {
        readLock.lock();
        try {
            return collections.getIdByName(collectionName);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public boolean hasCollection(long collectionId) {
        readLock.lock();
        try {
            return collections.hasCollection(collectionId);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public List<Long> getCollectionIds() {
        readLock.lock();
        try {
            return collections.getCollectionIds();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public void addSegment(long segmentId, long collectionId, long partitionId, long createTime,
        List<MsgPosition> startPositions) {
        writeLock.lock();
        try {
            segments.add(segmentId, collectionId, partitionId, createTime, startPositions);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void removeSegment(long segmentId) throws NotFoundException {
        writeLock.lock();
        try {
            segments.remove(segmentId);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean hasSegment(long segmentId) {
        readLock.lock();
        try {
            return segments.hasSegment(segmentId);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int getSegmentNum() {
        readLock.lock();
        try {
            return segments.count();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public List<Long> getSegmentIds() {
        readLock.lock();
        try {
            return segments.getSegmentIds();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public List<Long> getSegmentIdsOfCollection(long collectionId) {
        readLock.lock();
        try {
            return segments.getSegmentIdsOfCollection(collectionId);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public void updateStatistics(long segmentId, long numRows, long endTime, List<MsgPosition> endPositions)
        throws NotFoundException {
        writeLock.lock();
        try {
            segments.updateStatistics(segmentId, numRows, endTime, endPositions);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public SegmentStatisticsUpdates getSegmentStatisticsUpdates(long segmentId) throws NotFoundException {
        writeLock.lock();
        try {
            return segments.snapshotAndAcknowledge(segmentId);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Segment getSegmentById(long segmentId) throws NotFoundException {
        readLock.lock();
        try {
            return segments.getById(segmentId);
        } finally {
            readLock.unlock();
        }
    }
}
