package scopegen.locate;

import java.util.Objects;

/**
 * @param <F> the locator's file handle type
 * @param <T> the locator's type declaration handle type
 */
public class LocatedDeclaration<F, T> {
	private final F file;
	private final T type;

	public LocatedDeclaration(F file, T type) {
		this.file = file;
		this.type = type;
	}

	public F getFile() {
		return file;
	}

	public T getType() {
		return type;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		LocatedDeclaration<?, ?> that = (LocatedDeclaration<?, ?>) o;
		return Objects.equals(file, that.file) &&
				Objects.equals(type, that.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, type);
	}
}
