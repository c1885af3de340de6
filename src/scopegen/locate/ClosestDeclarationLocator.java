package scopegen.locate;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Locates the declaration closest to, and not before, the trigger line within
 * one indexed build unit. That declaration has to be a named type.
 */
public class ClosestDeclarationLocator implements DeclarationLocator<Path, Declaration> {
	private static final Logger logger = Logger.getLogger(ClosestDeclarationLocator.class.getName());

	private final String buildDescription;
	private final List<Declaration> declarations;
	private final FileIdentity fileIdentity;

	public ClosestDeclarationLocator(String buildDescription, List<Declaration> declarations) {
		this(buildDescription, declarations, FileIdentity.PATH_EQUALITY);
	}

	public ClosestDeclarationLocator(String buildDescription, List<Declaration> declarations, FileIdentity fileIdentity) {
		this.buildDescription = buildDescription;
		this.declarations = Collections.unmodifiableList(new ArrayList<>(declarations));
		this.fileIdentity = fileIdentity;
	}

	@Override
	public LocatedDeclaration<Path, Declaration> locate(LocatorRequest request)
			throws DeclarationNotFoundException, AmbiguousDeclarationException {
		if (!buildDescription.equals(request.getBuildDescription())) {
			throw new DeclarationNotFoundException("no build unit found with name " + request.getBuildDescription());
		}

		Path hint = Paths.get(request.getFileHint());
		int closest = Integer.MAX_VALUE;
		List<Declaration> atClosest = new ArrayList<>();
		for (Declaration d : declarations) {
			if (d.getLine() < request.getLineHint() || closest < d.getLine()) {
				continue;
			}
			if (!fileIdentity.sameFile(d.getFile(), hint)) {
				continue;
			}
			if (d.getLine() < closest) {
				// we found something closer than our current closest thing
				closest = d.getLine();
				atClosest.clear();
			}
			atClosest.add(d);
		}

		if (atClosest.isEmpty()) {
			throw new DeclarationNotFoundException("failed to determine type after " + request);
		}

		List<Declaration> types = new ArrayList<>();
		Set<Path> files = new LinkedHashSet<>();
		for (Declaration d : atClosest) {
			if (d.isNamedType()) {
				types.add(d);
				files.add(d.getFile());
			}
		}

		if (types.isEmpty()) {
			throw new DeclarationNotFoundException(
					"failed to determine type: closest declaration is not a named type: " + atClosest.get(0));
		}
		if (files.size() > 1) {
			throw new AmbiguousDeclarationException("multiple files found for position " + request + ": " + files);
		}

		Declaration ret = types.get(0);
		logger.fine("Located " + ret + " for " + request);
		return new LocatedDeclaration<>(ret.getFile(), ret);
	}
}
