package org.springaicommunity.github.releasenotes.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.releasenotes.*;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * GitHub Release Notes CLI Application
 *
 * Plain Java command-line application that generates categorized release notes for a
 * GitHub repository. No framework dependencies - uses ReleaseNotesBuilder for service
 * wiring. The release notes go to standard output, logs to standard error.
 *
 * Usage: java -jar github-release-notes-cli.jar [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN, GITHUB_REPOSITORY, GITHUB_REF, GITHUB_OUTPUT
 *
 * Examples: java -jar github-release-notes-cli.jar --repo spring-projects/spring-ai
 * --release-version v1.2.0 java -jar github-release-notes-cli.jar --base-ref v1.1.0
 * --release-version v1.2.0 --output-file CHANGELOG.md java -jar
 * github-release-notes-cli.jar --github-output
 */
public class GitHubReleaseNotesCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubReleaseNotesCli.class);

	public static void main(String[] args) {
		int exitCode = run(args);
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}

	public static int run(String[] args) {
		return run(args, new ArgumentParser(), System.out);
	}

	static int run(String[] args, ArgumentParser argumentParser, PrintStream out) {
		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error("{}", e.getMessage());
			logger.error("Use --help for usage information");
			return 1;
		}

		if (config.verbose) {
			enableVerboseLogging();
		}
		logConfiguration(config);

		try {
			ReleaseNotesBuilder builder = ReleaseNotesBuilder.create();
			if (config.token != null) {
				builder.token(config.token);
			}
			String releaseNotes = builder.buildService().generate(config.toRequest());
			for (ReleaseNotesSink sink : createSinks(config, out)) {
				sink.write(releaseNotes);
			}
			logger.info("Release notes generated successfully!");
			return 0;
		}
		catch (ReleaseNotesException e) {
			logger.error("Release notes generation failed ({}): {}", e.getKind(), e.getMessage());
			return 1;
		}
		catch (RuntimeException e) {
			logger.error("Release notes generation failed: {}", e.getMessage(), e);
			return 1;
		}
	}

	static List<ReleaseNotesSink> createSinks(ParsedConfiguration config, PrintStream out) {
		List<ReleaseNotesSink> sinks = new ArrayList<>();
		sinks.add(new ConsoleReleaseNotesSink(out));
		if (config.outputFile != null) {
			sinks.add(new FileReleaseNotesSink(Path.of(config.outputFile)));
		}
		if (config.githubOutput) {
			sinks.add(GitHubOutputReleaseNotesSink.fromEnvironment(config.outputName));
		}
		return sinks;
	}

	static void enableVerboseLogging() {
		Logger root = LoggerFactory.getLogger("org.springaicommunity.github.releasenotes");
		if (root instanceof ch.qos.logback.classic.Logger) {
			((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Repository: {}/{}", config.owner, config.repo);
		logger.info("  Base ref: {}", config.baseRef != null ? config.baseRef : "(latest release)");
		logger.info("  Head ref: {}", config.headRef != null ? config.headRef : "(default branch)");
		logger.info("  Release version: {}", config.releaseVersion);
		logger.info("  Output file: {}", config.outputFile != null ? config.outputFile : "(not set)");
		logger.info("  GitHub output: {}", config.githubOutput ? config.outputName : "(disabled)");
		logger.info("  Verbose: {}", config.verbose);
	}

}
