package scopegen.lang;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Loads {@link LanguageProfile}s from their JSON description.
 */
public final class LanguageProfiles {
	public static final String GO_RESOURCE = "/scopegen/lang/go.json";

	static final String NAME_FIELD = "name";
	static final String RESERVED_FIELD = "reserved";
	static final String PREDECLARED_FIELD = "predeclared";
	static final String VISIBILITY_FIELD = "visibility";

	private static final Logger logger = Logger.getLogger(LanguageProfiles.class.getName());

	private static LanguageProfile go;

	private LanguageProfiles() {}

	/**
	 * The bundled Go profile, loaded on first use.
	 */
	public static synchronized LanguageProfile go() {
		if (go == null) {
			go = fromResource(GO_RESOURCE);
		}
		return go;
	}

	public static LanguageProfile fromResource(String resource) throws LanguageProfileException {
		try (InputStream is = LanguageProfiles.class.getResourceAsStream(resource)) {
			if (is == null) {
				throw new LanguageProfileException("resource " + resource + " not found");
			}
			return fromJSON(IOUtils.toString(is, StandardCharsets.UTF_8), resource);
		} catch (IOException e) {
			throw new LanguageProfileException("error reading resource " + resource + ": " + e.getMessage(), e);
		}
	}

	public static LanguageProfile fromFile(Path path) throws LanguageProfileException {
		String s;
		try {
			s = FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new LanguageProfileException("error reading profile file: " + e.getMessage(), e);
		}
		return fromJSON(s, path.toString());
	}

	/**
	 * @param source where the JSON came from, for error messages
	 */
	public static LanguageProfile fromJSON(String json, String source) throws LanguageProfileException {
		JSONObject config;
		try {
			config = new JSONObject(json);
		} catch (JSONException e) {
			throw new LanguageProfileException(source + ": parsing error: " + e.getMessage(), e);
		}

		if (!config.has(NAME_FIELD)) {
			throw new LanguageProfileException(source + ": missing \"" + NAME_FIELD + "\"");
		}

		try {
			String name = config.getString(NAME_FIELD);
			VisibilityConvention visibility = VisibilityConvention.fromConfigName(
					config.optString(VISIBILITY_FIELD, VisibilityConvention.LEADING_UPPERCASE.getConfigName()));
			Set<String> reserved = words(config, RESERVED_FIELD);
			Set<String> predeclared = words(config, PREDECLARED_FIELD);

			logger.fine("Loaded language profile " + name + " from " + source + " (" + reserved.size()
					+ " reserved, " + predeclared.size() + " predeclared)");
			return new LanguageProfile(name, reserved, predeclared, visibility);
		} catch (JSONException e) {
			throw new LanguageProfileException(source + ": " + e.getMessage(), e);
		}
	}

	private static Set<String> words(JSONObject config, String field) {
		Set<String> ret = new HashSet<>();
		JSONArray array = config.optJSONArray(field);
		if (array == null) {
			return ret;
		}
		for (int i = 0; i < array.length(); i++) {
			ret.add(array.getString(i));
		}
		return ret;
	}
}
