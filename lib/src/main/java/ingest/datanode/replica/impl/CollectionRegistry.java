package ingest.datanode.replica.impl;

import com.google.common.collect.ImmutableList;
import ingest.datanode.apis.exception.NotFoundException;
import ingest.datanode.models.Collection;
import ingest.datanode.models.CollectionSchema;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * CollectionRegistry keeps the collections owned by the node, in registration order.
 * <p>
 * Not thread safe, callers guard it with the replica lock.
 */
class CollectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(CollectionRegistry.class);

    private final Map<Long, Collection> collections;

    CollectionRegistry(int initialCapacity) {
        this.collections = new LinkedHashMap<>(initialCapacity);
    }

    int count() {
        return collections.size();
    }

    /**
     * Register a collection. An already registered id keeps its current collection.
     *
     * @param collectionId collection id
     * @param schema       collection schema
     */
    void add(long collectionId, CollectionSchema schema) {
        checkNotNull(schema, "schema should not be null");
        Collection collection = new Collection(collectionId, schema);
        Collection existing = collections.putIfAbsent(collectionId, collection);
        if (existing != null) {
            log.warn("Collection {} already exists with name {}, ignore the new one named {}", collectionId,
                existing.getName(), collection.getName());
            return;
        }
        log.info("Create collection {}, id {}", collection.getName(), collectionId);
    }

    /**
     * Drop a collection. Unknown ids are ignored.
     *
     * @param collectionId collection id
     */
    void remove(long collectionId) {
        Collection removed = collections.remove(collectionId);
        if (removed != null) {
            log.info("Drop collection {}, id {}", removed.getName(), collectionId);
        }
    }

    Collection getById(long collectionId) throws NotFoundException {
        Collection collection = collections.get(collectionId);
        if (collection == null) {
            throw NotFoundException.collection(collectionId);
        }
        return collection;
    }

    /**
     * Find a collection by name. The earliest registered match wins.
     *
     * @param collectionName collection name
     * @return the collection
     * @throws NotFoundException if no collection has the name
     */
    Collection getByName(String collectionName) throws NotFoundException {
        for (Collection collection : collections.values()) {
            if (collection.getName().equals(collectionName)) {
                return collection;
            }
        }
        throw NotFoundException.collection(collectionName);
    }

    long getIdByName(String collectionName) throws NotFoundException {
        return getByName(collectionName).getId();
    }

    boolean hasCollection(long collectionId) {
        return collections.containsKey(collectionId);
    }

    List<Long> getCollectionIds() {
        return ImmutableList.copyOf(collections.keySet());
    }
}
