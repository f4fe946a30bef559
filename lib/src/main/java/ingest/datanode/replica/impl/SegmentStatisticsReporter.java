package ingest.datanode.replica.impl;

import com.google.common.base.Preconditions;
import ingest.datanode.apis.CollectionReplica;
import ingest.datanode.apis.ReplicaConfiguration;
import ingest.datanode.apis.StatisticsPublisher;
import ingest.datanode.apis.exception.NotFoundException;
import ingest.datanode.models.SegmentStatistics;
import ingest.datanode.models.SegmentStatisticsUpdates;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Snapshots segment statistics from the replica and publishes them as one batch.
 * <p>
 * Each snapshot acknowledges the segment, so a segment is reported as new only in the first batch containing it.
 * The acknowledgement happens while the batch is collected, before it is published. If publishing fails, or
 * collecting fails part way, the new flag of the segments already snapshotted stays cleared and a retry reports them
 * as not new.
 */
public class SegmentStatisticsReporter {
    private static final Logger log = LoggerFactory.getLogger(SegmentStatisticsReporter.class);

    private final CollectionReplica replica;
    private final StatisticsPublisher publisher;
    private final long nodeId;
    private final Clock clock;

    /**
     * Create a reporter stamping batches with the node id of the given configuration.
     *
     * @param replica       replica to snapshot.
     * @param publisher     where batches go.
     * @param configuration configuration of the replica's node.
     * @param clock         source of the report timestamp.
     */
    public SegmentStatisticsReporter(CollectionReplica replica, StatisticsPublisher publisher,
        ReplicaConfiguration configuration, Clock clock) {
        Preconditions.checkArgument(replica != null, "replica is null");
        Preconditions.checkArgument(publisher != null, "publisher is null");
        Preconditions.checkArgument(configuration != null, "configuration is null");
        Preconditions.checkArgument(clock != null, "clock is null");
        this.replica = replica;
        this.publisher = publisher;
        this.nodeId = configuration.getNodeId();
        this.clock = clock;
    }

    public SegmentStatisticsReporter(CollectionReplicaImpl replica, StatisticsPublisher publisher) {
        this(replica, publisher, replica.getConfiguration(), Clock.systemUTC());
    }

    /**
     * Report the given segments. Segments no longer owned by the node are skipped.
     *
     * @param segmentIds segments to report.
     * @return the publish future, or a completed one if there was nothing to publish.
     */
    public CompletableFuture<Void> report(Iterable<Long> segmentIds) {
        SegmentStatistics statistics;
        try {
            statistics = collect(segmentIds);
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
        if (statistics.getSegStats().isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        log.debug("Publish statistics of {} segments, node {}", statistics.getSegStats().size(), nodeId);
        return publish(statistics).whenComplete((v, ex) -> {
            if (ex != null) {
                log.error("Failed to publish statistics of {} segments, node {}", statistics.getSegStats().size(),
                    nodeId, ex);
            }
        });
    }

    /**
     * Report every live segment of a collection.
     *
     * @param collectionId collection id.
     * @return the publish future.
     */
    public CompletableFuture<Void> reportCollection(long collectionId) {
        return report(replica.getSegmentIdsOfCollection(collectionId));
    }

    /**
     * Report every live segment.
     *
     * @return the publish future.
     */
    public CompletableFuture<Void> reportAll() {
        return report(replica.getSegmentIds());
    }

    private CompletableFuture<Void> publish(SegmentStatistics statistics) {
        CompletableFuture<Void> future;
        try {
            future = publisher.publish(statistics);
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
        if (future == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("publisher returned no future"));
        }
        return future;
    }

    private SegmentStatistics collect(Iterable<Long> segmentIds) {
        Preconditions.checkArgument(segmentIds != null, "segmentIds is null");
        List<SegmentStatisticsUpdates> updates = new ArrayList<>();
        for (Long segmentId : segmentIds) {
            try {
                updates.add(replica.getSegmentStatisticsUpdates(segmentId));
            } catch (NotFoundException e) {
                log.warn("Skip statistics of segment {}: {}", segmentId, e.getMessage());
            }
        }
        return new SegmentStatistics(nodeId, clock.millis(), updates);
    }
}
