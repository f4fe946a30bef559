package ingest.datanode.models;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SegmentStatisticsUpdatesTest {

    @Test
    void positionsAreCopied() {
        List<MsgPosition> endPositions = new ArrayList<>();
        endPositions.add(MsgPosition.of("insert-channel-0", "100", 7L));

        SegmentStatisticsUpdates updates = SegmentStatisticsUpdates.newBuilder()
            .setSegmentId(5L)
            .setNumRows(17L)
            .setEndPositions(endPositions)
            .build();
        endPositions.add(MsgPosition.of("insert-channel-1", "200", 8L));

        assertEquals(1, updates.getEndPositions().size());
        assertTrue(updates.getStartPositions().isEmpty());
        assertThrows(UnsupportedOperationException.class,
            () -> updates.getEndPositions().add(MsgPosition.of("insert-channel-2", "300", 9L)));
    }

    @Test
    void defaultsToNotNew() {
        SegmentStatisticsUpdates updates = SegmentStatisticsUpdates.newBuilder().setSegmentId(1L).build();
        assertFalse(updates.isNewSegment());
        assertEquals(0L, updates.getMemorySize());
        assertEquals(0L, updates.getEndTime());
    }

    @Test
    void nullPositionsRejected() {
        assertThrows(NullPointerException.class, () -> SegmentStatisticsUpdates.newBuilder().setStartPositions(null));
        assertThrows(NullPointerException.class, () -> MsgPosition.of(null, "1", 0L));
    }

    @Test
    void collectionNameComesFromSchema() {
        Collection collection = new Collection(9L, new CollectionSchema("books", null, true));
        assertEquals("books", collection.getName());
        assertEquals("", collection.getSchema().getDescription());
        assertTrue(collection.getSchema().isAutoId());
    }
}
