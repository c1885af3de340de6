package scopegen.visibility;

import scopegen.ScopegenException;

/**
 * A legal identifier has no letter that can be cased into a public name
 *
 */
public class NoPublicFormException extends ScopegenException {

	private static final long serialVersionUID = 7739140529015648870L;
	private static final String prefix = "No Public Form";

	private final String name;

	public NoPublicFormException(String name) {
		super(prefix, "failed to create public identifier for \"" + name + "\": no letter has a public casing");
		this.name = name;
	}

	public String getName() {
		return name;
	}
}
