package ingest.datanode.benchmark;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MainTest {

    @Test
    void testDefaults() {
        Main.ContentionOptions options = Main.parseOptions(new String[0]);

        Assertions.assertNotNull(options);
        Assertions.assertEquals(Main.ContentionOptions.DEFAULT_COLLECTION_COUNT, options.getCollectionCount());
        Assertions.assertEquals(Main.ContentionOptions.DEFAULT_READ_THREADS, options.getReadThreads());
        Assertions.assertFalse(options.isFairLock());
    }

    @Test
    void testParse() {
        Main.ContentionOptions options = Main.parseOptions(new String[] {
            "--collection-count", "2", "--segments-per-collection", "8", "--fair-lock", "-wrt", "3", "-mt", "5"
        });

        Assertions.assertNotNull(options);
        Assertions.assertEquals(2, options.getCollectionCount());
        Assertions.assertEquals(8, options.getSegmentsPerCollection());
        Assertions.assertTrue(options.isFairLock());
        Assertions.assertEquals(3, options.getWriteThreads());
        Assertions.assertEquals(5, options.getMeasurementTimeSeconds());
    }

    @Test
    void testInvalid() {
        Assertions.assertNull(Main.parseOptions(new String[] {"--collection-count", "many"}));
        Assertions.assertNull(Main.parseOptions(new String[] {"--unknown"}));
    }
}
