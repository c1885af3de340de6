package scopegen;

/**
 * A scopegen exception consisting of a prefix (type of error) and a message
 * describing the offending input
 *
 */
public abstract class ScopegenException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public ScopegenException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public ScopegenException(String prefix, String msg, Throwable cause) {
		super(prefix + ": " + msg, cause);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
