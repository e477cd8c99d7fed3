package io.github.drompincen.fieldsync.runtime.remote;

/** A failed call to the field server or to object storage: transport error, non-2xx, or unreadable body. */
public class RemoteCallException extends RuntimeException {

    private final Integer httpStatus;

    public RemoteCallException(String message) {
        this(message, null, null);
    }

    public RemoteCallException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public RemoteCallException(String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
