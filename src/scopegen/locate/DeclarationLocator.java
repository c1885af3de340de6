package scopegen.locate;

/**
 * Resolves a generator trigger position to the named type declared at or
 * after it.
 *
 * @param <F> file handle type
 * @param <T> type declaration handle type
 */
public interface DeclarationLocator<F, T> {
	LocatedDeclaration<F, T> locate(LocatorRequest request)
			throws DeclarationNotFoundException, AmbiguousDeclarationException;
}
