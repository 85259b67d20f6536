package fr.lapetina.resilientfetch.domain.error;

/**
 * Wraps a network-level failure of the raw call so that callers only ever see
 * classified errors.
 */
public final class TransportException extends FetchException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRANSPORT;
    }
}
