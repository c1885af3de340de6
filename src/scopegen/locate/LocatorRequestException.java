package scopegen.locate;

/**
 * The generator environment does not describe a usable locator request
 *
 */
public class LocatorRequestException extends LocatorException {

	private static final long serialVersionUID = 1094716301935538452L;

	public LocatorRequestException(String msg) {
		super(msg);
	}

	public LocatorRequestException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
