package org.springaicommunity.github.releasenotes;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Command-line argument parser for the release notes generator. Pure Java implementation
 * with no framework dependencies for maximum testability.
 *
 * <p>
 * Options not given on the command line default to the variables GitHub Actions sets:
 * {@code GITHUB_TOKEN}, {@code GITHUB_REPOSITORY} and, for tag builds, {@code GITHUB_REF}.
 */
public class ArgumentParser {

	private static final String NAME_PATTERN = "^[a-zA-Z0-9._-]+$";

	private final Function<String, @Nullable String> environment;

	public ArgumentParser() {
		this(EnvironmentSupport::get);
	}

	/**
	 * @param environment variable lookup used for defaults
	 */
	public ArgumentParser(Function<String, @Nullable String> environment) {
		this.environment = environment;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration();
		applyEnvironmentDefaults(config);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "--token":
					config.token = getRequiredValue(args, i, "token");
					i++; // Skip next argument since we consumed it
					break;

				case "--owner":
					config.owner = getRequiredValue(args, i, "owner");
					i++;
					break;

				case "-r", "--repo":
					String repository = getRequiredValue(args, i, "repo");
					int slash = repository.indexOf('/');
					if (slash >= 0) {
						config.owner = repository.substring(0, slash);
						config.repo = repository.substring(slash + 1);
					}
					else {
						config.repo = repository;
					}
					i++;
					break;

				case "--base-ref":
					config.baseRef = getRequiredValue(args, i, "base-ref");
					i++;
					break;

				case "--head-ref":
					config.headRef = getRequiredValue(args, i, "head-ref");
					i++;
					break;

				case "--release-version":
					config.releaseVersion = getRequiredValue(args, i, "release-version");
					i++;
					break;

				case "-o", "--output-file":
					config.outputFile = getRequiredValue(args, i, "output-file");
					i++;
					break;

				case "--github-output":
					config.githubOutput = true;
					break;

				case "--output-name":
					config.outputName = getRequiredValue(args, i, "output-name");
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		if (!config.helpRequested) {
			validateConfiguration(config);
		}

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: github-release-notes [OPTIONS]\n");
		help.append("\n");
		help.append("Generate categorized release notes from the commits between two refs of a GitHub repository.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                  Show this help message\n");
		help.append("    --token TOKEN               GitHub token (default: $GITHUB_TOKEN)\n");
		help.append("    --owner OWNER               Repository owner (default: owner part of $GITHUB_REPOSITORY)\n");
		help.append("    -r, --repo REPO             Repository name or owner/repo (default: $GITHUB_REPOSITORY)\n");
		help.append("    --base-ref REF              Ref to compare from (default: latest release tag)\n");
		help.append("    --head-ref REF              Ref to compare to (default: repository default branch)\n");
		help.append("    --release-version VERSION   Version being released (default: tag of $GITHUB_REF)\n");
		help.append("    -v, --verbose               Enable verbose logging\n");
		help.append("\n");
		help.append("OUTPUT OPTIONS:\n");
		help.append("    -o, --output-file FILE      Also write the release notes to FILE\n");
		help.append("    --github-output             Append the release notes to $GITHUB_OUTPUT\n");
		help.append("    --output-name NAME          Output name used with --github-output (default: ")
			.append(ParsedConfiguration.DEFAULT_OUTPUT_NAME)
			.append(")\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN           GitHub token (required unless --token is given)\n");
		help.append("    GITHUB_REPOSITORY      owner/repo of the workflow run\n");
		help.append("    GITHUB_REF             Ref of the workflow run; refs/tags/<version> sets the version\n");
		help.append("    GITHUB_OUTPUT          Step output file used by --github-output\n");
		help.append("    Variables may also be defined in a .env file in the working or home directory\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    # Notes for v1.2.0 since the latest release\n");
		help.append("    github-release-notes --repo spring-projects/spring-ai --release-version v1.2.0\n");
		help.append("\n");
		help.append("    # Explicit window, written to a file\n");
		help.append("    github-release-notes --repo owner/repo --base-ref v1.1.0 --head-ref main \\\n");
		help.append("        --release-version v1.2.0 --output-file CHANGELOG.md\n");
		help.append("\n");
		help.append("    # Inside a GitHub Actions workflow triggered by a tag push\n");
		help.append("    github-release-notes --github-output\n");
		help.append("\n");

		return help.toString();
	}

	private void applyEnvironmentDefaults(ParsedConfiguration config) {
		config.token = environment.apply(EnvironmentSupport.GITHUB_TOKEN);

		String repository = environment.apply(EnvironmentSupport.GITHUB_REPOSITORY);
		if (repository != null && repository.indexOf('/') > 0) {
			config.owner = repository.substring(0, repository.indexOf('/'));
			config.repo = repository.substring(repository.indexOf('/') + 1);
		}

		config.releaseVersion = EnvironmentSupport.tagName(environment.apply(EnvironmentSupport.GITHUB_REF));
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.token == null || config.token.trim().isEmpty()) {
			errors.add("GitHub token is required (--token or GITHUB_TOKEN)");
		}

		if (config.owner == null || config.owner.trim().isEmpty()) {
			errors.add("Repository owner is required (--owner, --repo owner/repo or GITHUB_REPOSITORY)");
		}
		else if (!config.owner.matches(NAME_PATTERN)) {
			errors.add("Invalid repository owner: " + config.owner);
		}

		if (config.repo == null || config.repo.trim().isEmpty()) {
			errors.add("Repository name is required (--repo or GITHUB_REPOSITORY)");
		}
		else if (!config.repo.matches(NAME_PATTERN)) {
			errors.add("Invalid repository name: " + config.repo);
		}

		if (config.releaseVersion == null || config.releaseVersion.trim().isEmpty()) {
			errors.add("Release version is required (--release-version or a tag GITHUB_REF)");
		}

		if (config.outputName.trim().isEmpty()) {
			errors.add("Output name cannot be empty");
		}

		// Report validation errors
		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
