package org.qondense.collect;

/**
 * Thrown when an interning structure detects that its internal bookkeeping is inconsistent, e.g. a reference count would go negative or
 * a code does not resolve to a pooled value. A typical cause is earlier multi-threaded access where a modification was made without an
 * exclusive lock. The structure that threw it is not guaranteed to be consistent afterward and should not be used further.
 */
public class InternalCorruptionException extends IllegalStateException {
	private static final long serialVersionUID = 4131958466216617203L;

	/** @param message The message for the exception */
	public InternalCorruptionException(String message) {
		super(message);
	}
}
