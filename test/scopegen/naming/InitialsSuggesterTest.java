package scopegen.naming;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import scopegen.lang.LanguageProfiles;

@RunWith(Parameterized.class)
public class InitialsSuggesterTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{"a", "a"},
				{"aPerson", "ap"},
				{"Person", "p"},
				{"TypeName", "tn"},
				{"HttpRequest", "hr"},
				{"_", "v"},
				{"", "v"},
				{"*Foo", "f"},

				// acronyms fall back to the first letter
				{"HTTP", "h"},
				{"IO", "i"},
				{"9HTTP", "h"},
				{"__URLs", "u"},
				{"XY12", "x"},

				// only Lu counts as uppercase, not Roman numerals or circled letters
				{"HenryⅣ", "h"},
				{"aⒶb", "a"},
				{"XⅣ", "x"},

				// malformed input falls back to the first letter
				{"ab\uD800", "a"},
				{"x�y", "x"},
				{"1\uD800", "v"},

				// initials that spell a reserved word are sanitized
				{"FxUxNxC", "_func"},
				{"GoOn", "_go"},
				{"123abc", "_1"},
		});
	}

	private final String input;
	private final String expected;

	public InitialsSuggesterTest(String input, String expected) {
		this.input = input;
		this.expected = expected;
	}

	@Test
	public void testSuggest() {
		InitialsSuggester suggester = new InitialsSuggester(new ProfileNameSanitizer(LanguageProfiles.go()));
		assertEquals(expected, suggester.suggest(input));
	}
}
