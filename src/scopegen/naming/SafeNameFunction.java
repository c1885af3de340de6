package scopegen.naming;

/**
 * Turns an arbitrary string into a legal, non-reserved identifier. Must be
 * total and deterministic.
 */
@FunctionalInterface
public interface SafeNameFunction {
	String safeName(String name);
}
