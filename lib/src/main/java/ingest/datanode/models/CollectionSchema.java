package ingest.datanode.models;

import com.google.common.base.MoreObjects;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Schema of a collection, already validated by the control plane.
 * The replica only reads its name.
 */
public class CollectionSchema {
    private final String name;
    private final String description;
    private final boolean autoId;

    public CollectionSchema(String name, String description, boolean autoId) {
        checkNotNull(name, "name should not be null");
        this.name = name;
        this.description = description == null ? "" : description;
        this.autoId = autoId;
    }

    public static CollectionSchema of(String name) {
        return new CollectionSchema(name, "", false);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public boolean isAutoId() {
        return autoId;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        CollectionSchema other = (CollectionSchema) obj;
        return autoId == other.autoId && name.equals(other.name) && description.equals(other.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, autoId);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("name", name)
            .add("autoId", autoId)
            .toString();
    }
}
