package scopegen.locate;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A declaration in an indexed source file.
 */
public class Declaration {
	private final Path file;
	private final int line;
	private final String name;
	private final boolean namedType;

	public Declaration(Path file, int line, String name, boolean namedType) {
		this.file = Objects.requireNonNull(file);
		this.line = line;
		this.name = Objects.requireNonNull(name);
		this.namedType = namedType;
	}

	public static Declaration type(Path file, int line, String name) {
		return new Declaration(file, line, name, true);
	}

	public static Declaration other(Path file, int line, String name) {
		return new Declaration(file, line, name, false);
	}

	public Path getFile() {
		return file;
	}

	public int getLine() {
		return line;
	}

	public String getName() {
		return name;
	}

	public boolean isNamedType() {
		return namedType;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Declaration that = (Declaration) o;
		return line == that.line &&
				namedType == that.namedType &&
				Objects.equals(file, that.file) &&
				Objects.equals(name, that.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, line, name, namedType);
	}

	@Override
	public String toString() {
		return name + " (" + file + ":" + line + ")";
	}
}
