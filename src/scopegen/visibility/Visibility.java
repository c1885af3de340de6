package scopegen.visibility;

import scopegen.lang.LanguageProfile;
import scopegen.lang.LanguageProfiles;
import scopegen.lang.VisibilityConvention;

/**
 * Converts identifiers between their public and private forms. The overloads
 * without a profile use Go's convention.
 */
public final class Visibility {

	private Visibility() {}

	public static String toPublic(String name) {
		return toPublic(LanguageProfiles.go(), name);
	}

	public static String toPrivate(String name) {
		return toPrivate(LanguageProfiles.go(), name);
	}

	/**
	 * Makes the leading letter of name public. Leading code points that cannot
	 * be made public are dropped: {@code _x -> X}.
	 *
	 * @throws InvalidIdentifierException if name is not a legal identifier
	 * @throws NoPublicFormException if no code point of name can be made public
	 */
	public static String toPublic(LanguageProfile profile, String name) {
		requireIdentifier(profile, name);

		VisibilityConvention convention = profile.getVisibility();
		String rest = name;
		while (!rest.isEmpty()) {
			if (convention.isPublic(rest)) {
				return rest;
			}
			String capitalized = convention.capitalize(rest);
			if (convention.isPublic(capitalized)) {
				return capitalized;
			}
			rest = capitalized.substring(Character.charCount(capitalized.codePointAt(0)));
		}
		throw new NoPublicFormException(name);
	}

	/**
	 * @throws InvalidIdentifierException if name is not a legal identifier
	 */
	public static String toPrivate(LanguageProfile profile, String name) {
		requireIdentifier(profile, name);

		VisibilityConvention convention = profile.getVisibility();
		if (!convention.isPublic(name)) {
			return name;
		}
		return convention.makePrivate(name);
	}

	private static void requireIdentifier(LanguageProfile profile, String name) {
		if (!profile.isIdentifier(name)) {
			throw new InvalidIdentifierException(name);
		}
	}
}
