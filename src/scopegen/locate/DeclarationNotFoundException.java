package scopegen.locate;

public class DeclarationNotFoundException extends LocatorException {

	private static final long serialVersionUID = 5412968832150441127L;

	public DeclarationNotFoundException(String msg) {
		super(msg);
	}
}
