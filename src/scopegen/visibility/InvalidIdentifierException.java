package scopegen.visibility;

import scopegen.ScopegenException;

/**
 * The input of a visibility transform is not a legal identifier
 *
 */
public class InvalidIdentifierException extends ScopegenException {

	private static final long serialVersionUID = -4315926006717251883L;
	private static final String prefix = "Invalid Identifier";

	private final String name;

	public InvalidIdentifierException(String name) {
		super(prefix, "\"" + name + "\" is not a valid identifier");
		this.name = name;
	}

	public String getName() {
		return name;
	}
}
