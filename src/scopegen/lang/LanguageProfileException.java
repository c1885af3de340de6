package scopegen.lang;

import scopegen.ScopegenException;

/**
 * Exception while reading or validating a language profile
 *
 */
public class LanguageProfileException extends ScopegenException {

	private static final long serialVersionUID = 3170562118423871635L;
	private static final String prefix = "Language Profile Error";

	public LanguageProfileException(String msg) {
		super(prefix, msg);
	}

	public LanguageProfileException(String msg, Throwable cause) {
		super(prefix, msg, cause);
	}
}
