package scopegen.naming;

import scopegen.lang.IdentifierChars;
import scopegen.lang.LanguageProfile;

/**
 * Sanitizes names according to a {@link LanguageProfile}: characters outside
 * the identifier set are dropped, reserved and predeclared words get a '_'
 * prefix, as does anything not starting with a letter or '_'.
 */
public class ProfileNameSanitizer implements SafeNameFunction {
	public static final String FALLBACK = "v";

	private final LanguageProfile profile;

	public ProfileNameSanitizer(LanguageProfile profile) {
		this.profile = profile;
	}

	@Override
	public String safeName(String name) {
		StringBuilder b = new StringBuilder(name.length());
		name.codePoints()
				.filter(IdentifierChars::isSanitizedPart)
				.forEach(b::appendCodePoint);
		String ret = b.toString();

		if (ret.isEmpty()) {
			return FALLBACK;
		}

		if (profile.isReserved(ret) || profile.isPredeclared(ret)) {
			ret = "_" + ret;
		}

		if (!IdentifierChars.isIdentifierStart(ret.codePointAt(0))) {
			ret = "_" + ret;
		}

		return ret;
	}
}
