package scopegen.lang;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import scopegen.scope.Scope;

public class LanguageProfilesTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testGo() {
		LanguageProfile go = LanguageProfiles.go();
		assertEquals("go", go.getName());
		assertEquals(VisibilityConvention.LEADING_UPPERCASE, go.getVisibility());
		assertEquals(25, go.getReserved().size());
		assertTrue(go.isReserved("fallthrough"));
		assertTrue(go.isPredeclared("any"));
		assertTrue(go.isPredeclared("uintptr"));
		assertFalse(go.isReserved("panic"));
		assertSame(go, LanguageProfiles.go());
	}

	@Test
	public void testGoIdentifiers() {
		LanguageProfile go = LanguageProfiles.go();
		assertTrue(go.isIdentifier("x"));
		assertTrue(go.isIdentifier("_"));
		assertTrue(go.isIdentifier("漢字1"));
		assertTrue(go.isIdentifier("panic"));
		assertFalse(go.isIdentifier(""));
		assertFalse(go.isIdentifier("1x"));
		assertFalse(go.isIdentifier("x²"));
		assertFalse(go.isIdentifier("range"));
	}

	@Test
	public void testFromResource() {
		LanguageProfile profile = LanguageProfiles.fromResource("/profiles/underscore.json");
		assertEquals("underscore", profile.getName());
		assertEquals(VisibilityConvention.LEADING_UNDERSCORE_PRIVATE, profile.getVisibility());
		assertTrue(profile.isReserved("lambda"));
		assertTrue(profile.isPredeclared("len"));
	}

	@Test
	public void testDefaults() {
		LanguageProfile profile = LanguageProfiles.fromResource("/profiles/minimal.json");
		assertEquals(VisibilityConvention.LEADING_UPPERCASE, profile.getVisibility());
		assertTrue(profile.getReserved().isEmpty());
		assertTrue(profile.getPredeclared().isEmpty());
	}

	@Test
	public void testFromFile() throws IOException {
		File f = folder.newFile("custom.json");
		FileUtils.writeStringToFile(f, "{\"name\": \"custom\", \"reserved\": [\"when\"]}", StandardCharsets.UTF_8);
		LanguageProfile profile = LanguageProfiles.fromFile(f.toPath());
		assertEquals("custom", profile.getName());
		assertTrue(profile.isReserved("when"));
	}

	@Test
	public void testScopeUsesProfile() {
		Scope s = Scope.newRoot(LanguageProfiles.fromResource("/profiles/underscore.json"));
		assertEquals("_def", s.claim("def"));
		assertEquals("_print", s.claim("print"));
		assertEquals("func", s.claim("func"));
		assertEquals("_class", s.suggest("CxLxAxSxS"));
	}

	@Test
	public void testMissingResource() {
		try {
			LanguageProfiles.fromResource("/profiles/nope.json");
			fail("expected LanguageProfileException");
		} catch (LanguageProfileException e) {
			assertThat(e.getMessage(), containsString("/profiles/nope.json"));
		}
	}

	@Test
	public void testMissingFile() {
		try {
			LanguageProfiles.fromFile(folder.getRoot().toPath().resolve("nope.json"));
			fail("expected LanguageProfileException");
		} catch (LanguageProfileException e) {
			assertThat(e.getPrefix(), is("Language Profile Error"));
		}
	}

	@Test
	public void testMalformed() {
		try {
			LanguageProfiles.fromJSON("{\"name\": ", "inline");
			fail("expected LanguageProfileException");
		} catch (LanguageProfileException e) {
			assertThat(e.getMessage(), containsString("inline: parsing error"));
		}
	}

	@Test(expected = LanguageProfileException.class)
	public void testMissingName() {
		LanguageProfiles.fromJSON("{\"reserved\": []}", "inline");
	}

	@Test(expected = LanguageProfileException.class)
	public void testReservedNotAnArrayOfStrings() {
		LanguageProfiles.fromJSON("{\"name\": \"x\", \"reserved\": [1, {}]}", "inline");
	}

	@Test
	public void testUnknownVisibility() {
		try {
			LanguageProfiles.fromResource("/profiles/bad-visibility.json");
			fail("expected LanguageProfileException");
		} catch (LanguageProfileException e) {
			assertThat(e.getMessage(), containsString("shouting"));
		}
	}
}
