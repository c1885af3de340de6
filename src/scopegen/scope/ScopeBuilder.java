package scopegen.scope;

import scopegen.lang.LanguageProfile;
import scopegen.lang.LanguageProfiles;
import scopegen.naming.SafeNameFunction;
import scopegen.naming.SuggestVarNameFunction;
import scopegen.naming.UniqueNameFunction;

/**
 * Builds a root {@link Scope}, or a child scope via {@link Scope#childBuilder()}.
 * Policies left unset are inherited.
 */
public class ScopeBuilder {
	private final Scope parent;
	private LanguageProfile profile;
	private SafeNameFunction safeNameFunction;
	private UniqueNameFunction uniqueNameFunction;
	private SuggestVarNameFunction suggestVarNameFunction;

	public ScopeBuilder() {
		this(null);
	}

	ScopeBuilder(Scope parent) {
		this.parent = parent;
	}

	/**
	 * Sets the profile backing the default policies. Only a root scope has one.
	 */
	public ScopeBuilder withLanguageProfile(LanguageProfile profile) {
		if (parent != null) {
			throw new IllegalStateException("only a root scope can set its language profile");
		}
		this.profile = profile;
		return this;
	}

	public ScopeBuilder withSafeNameFunction(SafeNameFunction f) {
		this.safeNameFunction = f;
		return this;
	}

	public ScopeBuilder withUniqueNameFunction(UniqueNameFunction f) {
		this.uniqueNameFunction = f;
		return this;
	}

	public ScopeBuilder withSuggestVarNameFunction(SuggestVarNameFunction f) {
		this.suggestVarNameFunction = f;
		return this;
	}

	public Scope build() {
		LanguageProfile p = profile;
		if (parent == null && p == null) {
			p = LanguageProfiles.go();
		}
		return new Scope(parent, p, safeNameFunction, uniqueNameFunction, suggestVarNameFunction);
	}
}
