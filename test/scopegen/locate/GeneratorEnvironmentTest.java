package scopegen.locate;

import static org.junit.Assert.*;

import java.util.HashMap;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

public class GeneratorEnvironmentTest {

	private Map<String, String> env;

	@Before
	public void setup() {
		env = new HashMap<>();
		env.put(GeneratorEnvironment.ENV_FILE, "model.go");
		env.put(GeneratorEnvironment.ENV_PACKAGE, "model");
		env.put(GeneratorEnvironment.ENV_LINE, "42");
	}

	@Test
	public void testRequest() {
		assertEquals(new LocatorRequest("model", "model.go", 42), new GeneratorEnvironment(env).toRequest());
	}

	// the line defaults to the start of the file
	@Test
	public void testNoLine() {
		env.remove(GeneratorEnvironment.ENV_LINE);
		assertEquals(0, new GeneratorEnvironment(env).toRequest().getLineHint());
	}

	@Test(expected = LocatorRequestException.class)
	public void testNoFile() {
		env.remove(GeneratorEnvironment.ENV_FILE);
		new GeneratorEnvironment(env).toRequest();
	}

	@Test(expected = LocatorRequestException.class)
	public void testNoPackage() {
		env.put(GeneratorEnvironment.ENV_PACKAGE, "");
		new GeneratorEnvironment(env).toRequest();
	}

	@Test(expected = LocatorRequestException.class)
	public void testBadLine() {
		env.put(GeneratorEnvironment.ENV_LINE, "forty-two");
		new GeneratorEnvironment(env).toRequest();
	}

	@Test
	public void testEnvironmentIsCopied() {
		GeneratorEnvironment ge = new GeneratorEnvironment(env);
		env.clear();
		assertEquals("model", ge.toRequest().getBuildDescription());
	}
}
