package ingest.datanode.apis.exception;

/**
 * Thrown when a segment id, collection id or collection name is not owned by this node.
 */
public class NotFoundException extends ReplicaException {

    private static final long serialVersionUID = 2871360925467113504L;

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(Throwable cause) {
        super(cause);
    }

    public NotFoundException() {
        super();
    }

    public static NotFoundException segment(long segmentId) {
        return new NotFoundException("There is no segment " + segmentId);
    }

    public static NotFoundException collection(long collectionId) {
        return new NotFoundException("Cannot find collection, id = " + collectionId);
    }

    public static NotFoundException collection(String collectionName) {
        return new NotFoundException("There is no collection name = " + collectionName);
    }
}
