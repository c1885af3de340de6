package scopegen.naming;

/**
 * Proposes a short variable name for an arbitrary input, such as a type name.
 */
@FunctionalInterface
public interface SuggestVarNameFunction {
	String suggest(String input);
}
