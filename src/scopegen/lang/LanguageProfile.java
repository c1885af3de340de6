package scopegen.lang;

import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The lexical policy of a target language: which words are reserved, which
 * identifiers are predeclared, and how visibility is expressed.
 */
public class LanguageProfile {
	private final String name;
	private final Set<String> reserved;
	private final Set<String> predeclared;
	private final VisibilityConvention visibility;

	public LanguageProfile(String name, Set<String> reserved, Set<String> predeclared, VisibilityConvention visibility) {
		this.name = Objects.requireNonNull(name);
		this.reserved = Collections.unmodifiableSet(new HashSet<>(reserved));
		this.predeclared = Collections.unmodifiableSet(new HashSet<>(predeclared));
		this.visibility = Objects.requireNonNull(visibility);
	}

	public String getName() {
		return name;
	}

	public Set<String> getReserved() {
		return reserved;
	}

	public Set<String> getPredeclared() {
		return predeclared;
	}

	public VisibilityConvention getVisibility() {
		return visibility;
	}

	public boolean isReserved(String word) {
		return reserved.contains(word);
	}

	public boolean isPredeclared(String word) {
		return predeclared.contains(word);
	}

	/**
	 * Whether name is a syntactically legal identifier: a letter or '_' followed
	 * by letters, decimal digits or '_', and not a reserved word. Predeclared
	 * identifiers are legal; they can be shadowed.
	 */
	public boolean isIdentifier(String name) {
		if (name.isEmpty()) {
			return false;
		}
		int first = name.codePointAt(0);
		if (!IdentifierChars.isIdentifierStart(first)) {
			return false;
		}
		for (int i = Character.charCount(first); i < name.length(); ) {
			int cp = name.codePointAt(i);
			if (!IdentifierChars.isIdentifierPart(cp)) {
				return false;
			}
			i += Character.charCount(cp);
		}
		return !isReserved(name);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		LanguageProfile that = (LanguageProfile) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(reserved, that.reserved) &&
				Objects.equals(predeclared, that.predeclared) &&
				visibility == that.visibility;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, reserved, predeclared, visibility);
	}

	@Override
	public String toString() {
		return "LanguageProfile(" + name + ")";
	}
}
