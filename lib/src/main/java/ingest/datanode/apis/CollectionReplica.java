package ingest.datanode.apis;

import ingest.datanode.apis.exception.NotFoundException;
import ingest.datanode.models.Collection;
import ingest.datanode.models.CollectionSchema;
import ingest.datanode.models.MsgPosition;
import ingest.datanode.models.Segment;
import ingest.datanode.models.SegmentStatisticsUpdates;
import java.util.List;

/**
 * The in-memory registry of collections and segments owned by one data node.
 * <p>
 * All methods are thread safe. Readers share access, every mutation is exclusive, and an operation that throws
 * has changed nothing. Nothing here is persisted: the replica is rebuilt from external sources on restart.
 */
public interface CollectionReplica {

    /**
     * Get the number of live collections.
     *
     * @return collection count.
     */
    int getCollectionNum();

    /**
     * Register a collection. The collection name is taken from the schema.
     * If the id is already registered, the existing collection is kept.
     *
     * @param collectionId collection id.
     * @param schema       validated schema of the collection.
     */
    void addCollection(long collectionId, CollectionSchema schema);

    /**
     * Drop a collection. Dropping an unknown collection is a no-op.
     *
     * @param collectionId collection id.
     */
    void removeCollection(long collectionId);

    /**
     * Get a collection by id.
     *
     * @param collectionId collection id.
     * @return the collection.
     * @throws NotFoundException if the collection is not owned by this node.
     */
    Collection getCollectionById(long collectionId) throws NotFoundException;

    /**
     * Get a collection by name. If several collections share the name, the earliest registered one is returned.
     *
     * @param collectionName collection name.
     * @return the collection.
     * @throws NotFoundException if no collection has the name.
     */
    Collection getCollectionByName(String collectionName) throws NotFoundException;

    /**
     * Get the id of the collection with the given name.
     *
     * @param collectionName collection name.
     * @return collection id.
     * @throws NotFoundException if no collection has the name.
     */
    long getCollectionIdByName(String collectionName) throws NotFoundException;

    boolean hasCollection(long collectionId);

    /**
     * Get the ids of all live collections in registration order.
     *
     * @return collection ids.
     */
    List<Long> getCollectionIds();

    /**
     * Register a new segment. It starts with no rows, no memory and the new flag set.
     * The collection is not required to be registered. If the id is already registered, the existing segment is kept.
     *
     * @param segmentId      segment id.
     * @param collectionId   id of the owning collection.
     * @param partitionId    id of the owning partition.
     * @param createTime     creation timestamp.
     * @param startPositions message-queue positions the segment starts from, one per channel.
     */
    void addSegment(long segmentId, long collectionId, long partitionId, long createTime,
        List<MsgPosition> startPositions);

    /**
     * Remove a segment.
     *
     * @param segmentId segment id.
     * @throws NotFoundException if the segment is not owned by this node.
     */
    void removeSegment(long segmentId) throws NotFoundException;

    boolean hasSegment(long segmentId);

    int getSegmentNum();

    /**
     * Get the ids of all live segments in registration order.
     *
     * @return segment ids.
     */
    List<Long> getSegmentIds();

    /**
     * Get the ids of the live segments that reference the given collection.
     *
     * @param collectionId collection id.
     * @return segment ids, empty if there are none.
     */
    List<Long> getSegmentIdsOfCollection(long collectionId);

    /**
     * Record newly ingested data of a segment.
     * The row count grows by {@code numRows}, the end time and end positions are replaced, and the memory size is
     * reset to zero.
     *
     * @param segmentId    segment id.
     * @param numRows      number of rows ingested since the last update, must not be negative.
     * @param endTime      timestamp of the latest ingested data.
     * @param endPositions message-queue positions consumed so far, replacing the previous ones.
     * @throws NotFoundException if the segment is not owned by this node.
     */
    void updateStatistics(long segmentId, long numRows, long endTime, List<MsgPosition> endPositions)
        throws NotFoundException;

    /**
     * Take a statistics snapshot of a segment and acknowledge it.
     * This is not a pure read: the first call after the segment was added reports it as new and clears that flag, so
     * every later call reports it as not new.
     *
     * @param segmentId segment id.
     * @return the snapshot.
     * @throws NotFoundException if the segment is not owned by this node.
     */
    SegmentStatisticsUpdates getSegmentStatisticsUpdates(long segmentId) throws NotFoundException;

    /**
     * Get a read-only view of a segment.
     *
     * @param segmentId segment id.
     * @return the segment view.
     * @throws NotFoundException if the segment is not owned by this node.
     */
    Segment getSegmentById(long segmentId) throws NotFoundException;
}
