package org.springaicommunity.github.releasenotes;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves environment variables by checking a {@code .env} file first, then falling back
 * to the system environment. The {@code .env} file is loaded once and cached for the
 * lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>System environment variable ({@link System#getenv})</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 *
 * <p>
 * Also interprets the variables GitHub Actions sets for a workflow run.
 */
public final class EnvironmentSupport {

	public static final String GITHUB_TOKEN = "GITHUB_TOKEN";

	public static final String GITHUB_REPOSITORY = "GITHUB_REPOSITORY";

	public static final String GITHUB_REF = "GITHUB_REF";

	public static final String GITHUB_OUTPUT = "GITHUB_OUTPUT";

	private static final String TAG_REF_PREFIX = "refs/tags/";

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null) {
			value = HOME_DOTENV.get(name);
		}
		return value;
	}

	/**
	 * Extract the tag name of a fully qualified ref.
	 * @param ref a ref such as {@code refs/tags/v1.2.0}
	 * @return the tag name, or {@code null} if the ref is not a tag ref
	 */
	@Nullable
	static String tagName(@Nullable String ref) {
		if (ref == null || !ref.startsWith(TAG_REF_PREFIX) || ref.length() == TAG_REF_PREFIX.length()) {
			return null;
		}
		return ref.substring(TAG_REF_PREFIX.length());
	}

}
