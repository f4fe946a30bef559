package ingest.datanode.models;

import com.google.common.base.MoreObjects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A logical collection owned by this node. Never mutated after creation.
 */
public class Collection {
    private final long id;
    private final CollectionSchema schema;

    public Collection(long id, CollectionSchema schema) {
        checkNotNull(schema, "schema should not be null");
        this.id = id;
        this.schema = schema;
    }

    public long getId() {
        return id;
    }

    /**
     * Get the collection name, which is the name of its schema.
     *
     * @return collection name
     */
    public String getName() {
        return schema.getName();
    }

    public CollectionSchema getSchema() {
        return schema;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("id", id)
            .add("name", getName())
            .toString();
    }
}
