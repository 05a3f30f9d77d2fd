package org.qondense.collect;

/**
 * Thrown when an intern pool could not be compacted. Compaction is all-or-nothing: when this is thrown, the pool and any collection
 * using it are left exactly as they were before the attempt.
 */
public class CompactionFailedException extends RuntimeException {
	private static final long serialVersionUID = -2735130406623409427L;

	/**
	 * @param message The message for the exception
	 * @param cause The failure that prevented the compaction
	 */
	public CompactionFailedException(String message, Throwable cause) {
		super(message, cause);
	}
}
