package scopegen.lang;

/**
 * Unicode character classes shared by every language profile.
 */
public final class IdentifierChars {

	public static final int CONNECTOR = '_';

	private IdentifierChars() {}

	public static boolean isLetter(int codePoint) {
		return Character.isLetter(codePoint);
	}

	// any Unicode number: decimal digits, letter numbers and other numbers
	public static boolean isNumber(int codePoint) {
		switch (Character.getType(codePoint)) {
			case Character.DECIMAL_DIGIT_NUMBER:
			case Character.LETTER_NUMBER:
			case Character.OTHER_NUMBER:
				return true;
			default:
				return false;
		}
	}

	// category Lu only; Character.isUpperCase also accepts Other_Uppercase symbols such as U+2163
	public static boolean isUpper(int codePoint) {
		return Character.getType(codePoint) == Character.UPPERCASE_LETTER;
	}

	public static boolean isDigit(int codePoint) {
		return Character.getType(codePoint) == Character.DECIMAL_DIGIT_NUMBER;
	}

	/**
	 * Code points kept by sanitization.
	 */
	public static boolean isSanitizedPart(int codePoint) {
		return codePoint == CONNECTOR || isLetter(codePoint) || isNumber(codePoint);
	}

	public static boolean isIdentifierStart(int codePoint) {
		return codePoint == CONNECTOR || isLetter(codePoint);
	}

	public static boolean isIdentifierPart(int codePoint) {
		return codePoint == CONNECTOR || isLetter(codePoint) || isDigit(codePoint);
	}

	// unpaired surrogates decode as themselves; the replacement character marks input that was already malformed
	public static boolean isDecodingError(int codePoint) {
		return codePoint == 0xFFFD || Character.isBmpCodePoint(codePoint) && Character.isSurrogate((char) codePoint);
	}
}
