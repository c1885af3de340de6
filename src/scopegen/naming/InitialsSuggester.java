package scopegen.naming;

import scopegen.lang.IdentifierChars;

/**
 * Suggests a variable name made of the lowercased initials of the words in the
 * input, where a word starts at the first code point or at any uppercase code
 * point: {@code aPerson -> ap}, {@code HttpRequest -> hr}.
 *
 * Acronym-like input (two uppercase code points in a row) and malformed input
 * fall back to the first letter of the input, lowercased.
 */
public class InitialsSuggester implements SuggestVarNameFunction {

	private final SafeNameFunction safeName;

	public InitialsSuggester(SafeNameFunction safeName) {
		this.safeName = safeName;
	}

	@Override
	public String suggest(String input) {
		String ret = initials(input);
		if (ret.equals("_")) {
			ret = ProfileNameSanitizer.FALLBACK;
		}
		return safeName.safeName(ret);
	}

	private static String initials(String input) {
		int first = input.isEmpty() ? 0xFFFD : input.codePointAt(0);

		StringBuilder b = new StringBuilder();
		b.appendCodePoint(Character.toLowerCase(first));

		boolean prevUpper = IdentifierChars.isUpper(first);
		int i = input.isEmpty() ? 0 : Character.charCount(first);
		while (i < input.length()) {
			int cp = input.codePointAt(i);
			if (IdentifierChars.isDecodingError(cp)) {
				return firstLetter(input);
			}
			boolean upper = IdentifierChars.isUpper(cp);
			if (prevUpper && upper) {
				return firstLetter(input);
			}
			if (upper) {
				b.appendCodePoint(Character.toLowerCase(cp));
			}
			prevUpper = upper;
			i += Character.charCount(cp);
		}
		return b.toString();
	}

	private static String firstLetter(String input) {
		for (int i = 0; i < input.length(); ) {
			int cp = input.codePointAt(i);
			if (IdentifierChars.isLetter(cp)) {
				return new StringBuilder().appendCodePoint(Character.toLowerCase(cp)).toString();
			}
			i += Character.charCount(cp);
		}
		return ProfileNameSanitizer.FALLBACK;
	}
}
