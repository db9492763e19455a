package borg.objsearch;

/**
 * Thrown when a search is configured in a way that cannot produce a result. The whole search is aborted, there are no
 * partial results.
 */
public class ObjectSearchException extends RuntimeException {

	private static final long serialVersionUID = 3518427709815302154L;

	public ObjectSearchException(String message) {
		super(message);
	}

	public ObjectSearchException(String message, Throwable cause) {
		super(message, cause);
	}

}
