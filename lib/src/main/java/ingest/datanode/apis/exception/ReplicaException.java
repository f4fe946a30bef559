package ingest.datanode.apis.exception;

/**
 * The exception thrown when an operation on the replica cannot be applied.
 * <p>
 * It's the base class for all replica exceptions. An operation that throws it has applied none of its effect.
 */
public class ReplicaException extends Exception {

    private static final long serialVersionUID = -4512368023815762311L;

    public ReplicaException(String message, Throwable cause) {
        super(message, cause);
    }

    public ReplicaException(String message) {
        super(message);
    }

    public ReplicaException(Throwable cause) {
        super(cause);
    }

    public ReplicaException() {
        super();
    }

}
