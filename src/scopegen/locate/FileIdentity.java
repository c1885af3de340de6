package scopegen.locate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decides whether two paths name the same source file.
 */
@FunctionalInterface
public interface FileIdentity {

	boolean sameFile(Path a, Path b);

	FileIdentity PATH_EQUALITY = (a, b) ->
			a.toAbsolutePath().normalize().equals(b.toAbsolutePath().normalize());

	// follows links; both files must exist
	FileIdentity FILESYSTEM = (a, b) -> {
		try {
			return Files.isSameFile(a, b);
		} catch (IOException e) {
			throw new LocatorRequestException("cannot compare " + a + " and " + b + ": " + e.getMessage(), e);
		}
	};
}
