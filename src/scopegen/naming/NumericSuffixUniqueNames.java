package scopegen.naming;

import java.util.logging.Logger;

import scopegen.InternalCompilerError;
import scopegen.scope.Scope;

/**
 * Appends 0, 1, 2, ... to a name until the result is free in the scope.
 */
public class NumericSuffixUniqueNames implements UniqueNameFunction {
	public static final int MAX_ATTEMPTS = 999;

	private static final Logger logger = Logger.getLogger(NumericSuffixUniqueNames.class.getName());

	@Override
	public String uniqueName(Scope scope, String name, boolean recursive) {
		String safeName = scope.safeName(name);

		for (int i = 0; i < MAX_ATTEMPTS; i++) {
			String candidate = safeName + i;
			if (!scope.isClaimed(candidate, recursive)) {
				return candidate;
			}
		}

		String msg = "failed to find safe, unique, name for root \"" + name + "\" after " + MAX_ATTEMPTS + " attempts";
		logger.severe(msg);
		throw new InternalCompilerError(msg);
	}
}
