package scopegen.locate;

import scopegen.ScopegenException;

/**
 * Failure to resolve the declaration a generator was triggered for
 *
 */
public abstract class LocatorException extends ScopegenException {

	private static final long serialVersionUID = -2318004576342617706L;
	private static final String prefix = "Locator Error";

	public LocatorException(String msg) {
		super(prefix, msg);
	}

	public LocatorException(String msg, Throwable cause) {
		super(prefix, msg, cause);
	}
}
