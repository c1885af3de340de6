package scopegen.locate;

public class AmbiguousDeclarationException extends LocatorException {

	private static final long serialVersionUID = -6082394750149021853L;

	public AmbiguousDeclarationException(String msg) {
		super(msg);
	}
}
