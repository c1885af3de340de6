package scopegen.naming;

import scopegen.scope.Scope;

/**
 * Derives the next candidate for a name that is already claimed in scope.
 *
 * Implementations must return a name that is not claimed according to
 * {@link Scope#isClaimed(String, boolean)} with the same recursive flag.
 */
@FunctionalInterface
public interface UniqueNameFunction {
	String uniqueName(Scope scope, String name, boolean recursive);
}
