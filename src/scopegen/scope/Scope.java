package scopegen.scope;

import java.util.HashSet;
import java.util.Set;
import java.util.logging.Logger;

import scopegen.InternalCompilerError;
import scopegen.lang.LanguageProfile;
import scopegen.naming.InitialsSuggester;
import scopegen.naming.NumericSuffixUniqueNames;
import scopegen.naming.ProfileNameSanitizer;
import scopegen.naming.SafeNameFunction;
import scopegen.naming.SuggestVarNameFunction;
import scopegen.naming.UniqueNameFunction;

/**
 * A node in a tree of naming scopes.
 *
 * {@link #claim(String)} reserves a name in this scope only, so a child scope
 * may shadow a name claimed by one of its ancestors. {@link #claimGlobal(String)}
 * avoids every name claimed along the ancestor chain and then reserves the
 * result in this scope and in every ancestor, up to the root.
 *
 * Naming policies not overridden by a scope are inherited from its nearest
 * ancestor that overrides them, or else are the defaults of the root's
 * {@link LanguageProfile}. Scopes link to their parent only; a tree is meant
 * to be used from a single thread for one generation pass.
 */
public class Scope {
	private static final Logger logger = Logger.getLogger(Scope.class.getName());

	private final Scope parent;
	private final Set<String> definitions;

	// only set on the root
	private final LanguageProfile profile;
	private final SafeNameFunction defaultSafeNameFunction;
	private final UniqueNameFunction defaultUniqueNameFunction;
	private final SuggestVarNameFunction defaultSuggestVarNameFunction;

	// null means inherited
	private final SafeNameFunction safeNameFunction;
	private final UniqueNameFunction uniqueNameFunction;
	private final SuggestVarNameFunction suggestVarNameFunction;

	Scope(Scope parent, LanguageProfile profile, SafeNameFunction safeNameFunction,
	      UniqueNameFunction uniqueNameFunction, SuggestVarNameFunction suggestVarNameFunction) {
		this.parent = parent;
		this.definitions = new HashSet<>();
		this.safeNameFunction = safeNameFunction;
		this.uniqueNameFunction = uniqueNameFunction;
		this.suggestVarNameFunction = suggestVarNameFunction;
		if (parent == null) {
			ProfileNameSanitizer sanitizer = new ProfileNameSanitizer(profile);
			this.profile = profile;
			this.defaultSafeNameFunction = sanitizer;
			this.defaultUniqueNameFunction = new NumericSuffixUniqueNames();
			this.defaultSuggestVarNameFunction = new InitialsSuggester(sanitizer);
		} else {
			this.profile = null;
			this.defaultSafeNameFunction = null;
			this.defaultUniqueNameFunction = null;
			this.defaultSuggestVarNameFunction = null;
		}
	}

	/**
	 * A new root scope using the Go language profile and default policies.
	 */
	public static Scope newRoot() {
		return new ScopeBuilder().build();
	}

	public static Scope newRoot(LanguageProfile profile) {
		return new ScopeBuilder().withLanguageProfile(profile).build();
	}

	/**
	 * A new scope nested in this one, inheriting all naming policies.
	 */
	public Scope child() {
		return childBuilder().build();
	}

	public ScopeBuilder childBuilder() {
		return new ScopeBuilder(this);
	}

	public Scope getParent() {
		return parent;
	}

	public LanguageProfile getLanguageProfile() {
		if (parent != null) {
			return parent.getLanguageProfile();
		}
		return profile;
	}

	/**
	 * Claims a safe version of name in this scope only, adding a numeric suffix
	 * if this scope already claimed it. Ancestors are neither consulted nor
	 * modified.
	 *
	 * @return the name actually claimed
	 */
	public String claim(String name) {
		return define(safeName(name), false);
	}

	/**
	 * Claims a safe version of name that no scope on the path to the root has
	 * claimed, and records it in every one of those scopes.
	 *
	 * @return the name actually claimed
	 */
	public String claimGlobal(String name) {
		return define(safeName(name), true);
	}

	public String suggest(String input) {
		return suggestVarName(input);
	}

	/**
	 * Whether this scope claimed name itself.
	 */
	public boolean isClaimed(String name) {
		return isClaimed(name, false);
	}

	/**
	 * Whether this scope or any of its ancestors claimed name.
	 */
	public boolean isClaimedGlobally(String name) {
		return isClaimed(name, true);
	}

	/**
	 * Once the lookup reaches the parent it always continues to the root.
	 */
	public boolean isClaimed(String name, boolean recursive) {
		if (definitions.contains(name)) {
			return true;
		}
		if (!recursive || parent == null) {
			return false;
		}
		return parent.isClaimed(name, true);
	}

	public String safeName(String name) {
		if (safeNameFunction != null) {
			return safeNameFunction.safeName(name);
		}
		if (parent != null) {
			return parent.safeName(name);
		}
		return defaultSafeNameFunction.safeName(name);
	}

	private String uniqueName(String name, boolean recursive) {
		return resolveUniqueNameFunction().uniqueName(this, name, recursive);
	}

	private UniqueNameFunction resolveUniqueNameFunction() {
		if (uniqueNameFunction != null) {
			return uniqueNameFunction;
		}
		if (parent != null) {
			return parent.resolveUniqueNameFunction();
		}
		return defaultUniqueNameFunction;
	}

	private String suggestVarName(String input) {
		if (suggestVarNameFunction != null) {
			return suggestVarNameFunction.suggest(input);
		}
		if (parent != null) {
			return parent.suggestVarName(input);
		}
		return defaultSuggestVarNameFunction.suggest(input);
	}

	private String define(String safeName, boolean recursive) {
		String candidate = safeName;
		int attempts = 0;
		while (isClaimed(candidate, recursive)) {
			// bounds overrides that keep returning claimed names
			if (attempts++ >= NumericSuffixUniqueNames.MAX_ATTEMPTS) {
				String msg = "unique name policy keeps returning claimed names for root \"" + safeName + "\"";
				logger.severe(msg);
				throw new InternalCompilerError(msg);
			}
			String next = uniqueName(candidate, recursive);
			logger.finer("\"" + candidate + "\" already claimed, trying \"" + next + "\"");
			candidate = next;
		}

		definitions.add(candidate);
		if (recursive) {
			for (Scope s = parent; s != null; s = s.parent) {
				s.definitions.add(candidate);
			}
		}
		return candidate;
	}
}
