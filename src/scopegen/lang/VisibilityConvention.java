package scopegen.lang;

/**
 * The rule by which an identifier signals public or private accessibility.
 */
public enum VisibilityConvention {
	/**
	 * Go's convention: an identifier is exported iff its leading code point is an
	 * uppercase letter.
	 */
	LEADING_UPPERCASE("leading-uppercase") {
		@Override
		public boolean isPublic(String name) {
			return !name.isEmpty() && IdentifierChars.isUpper(name.codePointAt(0));
		}

		@Override
		public String capitalize(String name) {
			int first = name.codePointAt(0);
			return new StringBuilder()
					.appendCodePoint(Character.toUpperCase(first))
					.append(name, Character.charCount(first), name.length())
					.toString();
		}

		@Override
		public String makePrivate(String name) {
			int first = name.codePointAt(0);
			return new StringBuilder()
					.appendCodePoint(Character.toLowerCase(first))
					.append(name, Character.charCount(first), name.length())
					.toString();
		}
	},
	/**
	 * An identifier is private iff it starts with the connector character.
	 */
	LEADING_UNDERSCORE_PRIVATE("leading-underscore-private") {
		@Override
		public boolean isPublic(String name) {
			return !name.isEmpty() && name.codePointAt(0) != IdentifierChars.CONNECTOR;
		}

		@Override
		public String capitalize(String name) {
			return name;
		}

		@Override
		public String makePrivate(String name) {
			return "_" + name;
		}
	};

	private final String configName;

	VisibilityConvention(String configName) {
		this.configName = configName;
	}

	public String getConfigName() {
		return configName;
	}

	public abstract boolean isPublic(String name);

	/**
	 * Rewrites the leading code point of a non-empty name into its public casing, if it has one.
	 */
	public abstract String capitalize(String name);

	/**
	 * Rewrites a non-empty public name into its private form.
	 */
	public abstract String makePrivate(String name);

	public static VisibilityConvention fromConfigName(String configName) throws LanguageProfileException {
		for (VisibilityConvention convention : values()) {
			if (convention.configName.equals(configName)) {
				return convention;
			}
		}
		throw new LanguageProfileException("unknown visibility convention \"" + configName + "\"");
	}
}
