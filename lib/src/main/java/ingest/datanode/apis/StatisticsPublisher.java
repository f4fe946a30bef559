package ingest.datanode.apis;

import ingest.datanode.models.SegmentStatistics;
import java.util.concurrent.CompletableFuture;

/**
 * Hands segment statistics to the flush decision side, e.g. over a message stream.
 */
public interface StatisticsPublisher {
    /**
     * Publish a batch of segment statistics.
     *
     * @param statistics the batch to publish.
     * @return a future completed once the batch is accepted.
     */
    CompletableFuture<Void> publish(SegmentStatistics statistics);
}
