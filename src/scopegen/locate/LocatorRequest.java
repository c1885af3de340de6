package scopegen.locate;

import java.util.Objects;

/**
 * Where a generator was triggered from: the build unit to load, the file
 * containing the trigger, and the trigger's line (0 when unknown).
 */
public class LocatorRequest {
	private final String buildDescription;
	private final String fileHint;
	private final int lineHint;

	public LocatorRequest(String buildDescription, String fileHint, int lineHint) {
		this.buildDescription = Objects.requireNonNull(buildDescription);
		this.fileHint = Objects.requireNonNull(fileHint);
		this.lineHint = lineHint;
	}

	public String getBuildDescription() {
		return buildDescription;
	}

	public String getFileHint() {
		return fileHint;
	}

	public int getLineHint() {
		return lineHint;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		LocatorRequest that = (LocatorRequest) o;
		return lineHint == that.lineHint &&
				Objects.equals(buildDescription, that.buildDescription) &&
				Objects.equals(fileHint, that.fileHint);
	}

	@Override
	public int hashCode() {
		return Objects.hash(buildDescription, fileHint, lineHint);
	}

	@Override
	public String toString() {
		return buildDescription + ":" + fileHint + ":" + lineHint;
	}
}
