package scopegen.locate;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * The hints a code generator receives from the build tool that triggered it:
 * the triggering file, its package and, optionally, the line of the trigger.
 */
public class GeneratorEnvironment {
	public static final String ENV_FILE = "GOFILE";
	public static final String ENV_PACKAGE = "GOPACKAGE";
	public static final String ENV_LINE = "GOLINE";

	private final Map<String, String> env;

	public GeneratorEnvironment(Map<String, String> env) {
		this.env = Collections.unmodifiableMap(new HashMap<>(env));
	}

	public static GeneratorEnvironment fromSystem() {
		return new GeneratorEnvironment(System.getenv());
	}

	public LocatorRequest toRequest() throws LocatorRequestException {
		String file = env.get(ENV_FILE);
		if (file == null || file.isEmpty()) {
			throw new LocatorRequestException("failed to determine input file: " + ENV_FILE + " is not set");
		}

		String pkg = env.get(ENV_PACKAGE);
		if (pkg == null || pkg.isEmpty()) {
			throw new LocatorRequestException("failed to determine package name: " + ENV_PACKAGE + " is not set");
		}

		int line = 0;
		String lineStr = env.get(ENV_LINE);
		if (lineStr != null && !lineStr.isEmpty()) {
			try {
				line = Integer.parseInt(lineStr.trim());
			} catch (NumberFormatException e) {
				throw new LocatorRequestException("failed to determine source line: " + e.getMessage(), e);
			}
		}

		return new LocatorRequest(pkg, file, line);
	}
}
