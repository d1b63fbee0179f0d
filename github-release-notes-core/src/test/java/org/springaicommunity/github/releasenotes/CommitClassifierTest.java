package org.springaicommunity.github.releasenotes;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CommitClassifier Tests")
class CommitClassifierTest {

	private CommitClassifier classifier;

	@BeforeEach
	void setUp() {
		ReleaseNotesProperties properties = new ReleaseNotesProperties();
		classifier = new CommitClassifier(
				PrefixCategoryIndex.of(properties.getOtherCategoryName(), properties.getCategories()),
				properties.getBotCategoryOverrides());
	}

	private static CommitInfo commit(String sha, String message) {
		return new CommitInfo(sha, message, "alice", "web-flow", "Alice", "GitHub");
	}

	private static CommitInfo commitBy(String login, String message) {
		return new CommitInfo("abc", message, login, null, null, null);
	}

	@Nested
	@DisplayName("Classification Tests")
	class ClassificationTest {

		@Test
		@DisplayName("Should classify by message prefix")
		void shouldClassifyByMessagePrefix() {
			assertThat(classifier.classify(commit("1", "feat: add button"))).isEqualTo(new CategoryMatch(2, "Features"));
		}

		@Test
		@DisplayName("Should classify dependency bots as Dependencies regardless of message")
		void shouldClassifyBotsByLogin() {
			assertThat(classifier.classify(commitBy("dependabot[bot]", "bump deps")))
				.isEqualTo(new CategoryMatch(10, "Dependencies"));
			assertThat(classifier.classify(commitBy("renovate[bot]", "feat: not really a feature")).category())
				.isEqualTo("Dependencies");
		}

		@Test
		@DisplayName("Should match bot logins case-insensitively")
		void shouldMatchBotLoginsIgnoringCase() {
			assertThat(classifier.classify(commitBy("Dependabot", "Bump x from 1 to 2")).category())
				.isEqualTo("Dependencies");
		}

		@Test
		@DisplayName("Should use the committer login when the author login is missing")
		void shouldFallBackToCommitterLogin() {
			CommitInfo commit = new CommitInfo("abc", "Bump x", null, "renovate[bot]", "Renovate Bot", null);

			assertThat(classifier.classify(commit).category()).isEqualTo("Dependencies");
		}

		@Test
		@DisplayName("Should classify by message when the author is not an overridden bot")
		void shouldIgnoreCommitterWhenAuthorIsHuman() {
			CommitInfo commit = new CommitInfo("abc", "fix: crash", "alice", "dependabot[bot]", null, null);

			assertThat(classifier.classify(commit).category()).isEqualTo("Fixes");
		}

		@Test
		@DisplayName("Should classify other bots by message")
		void shouldClassifyUnlistedBotsByMessage() {
			assertThat(classifier.classify(commitBy("github-actions[bot]", "chore: release 1.2.0")).category())
				.isEqualTo("General Changes");
		}

	}

	@Nested
	@DisplayName("Grouping Tests")
	class GroupingTest {

		@Test
		@DisplayName("Should order groups by category priority, not by size")
		void shouldOrderGroupsByPriority() {
			List<CommitInfo> commits = List.of(commit("1", "fix: first"), commit("2", "fix: second"),
					commit("3", "feat: only feature"));

			Map<String, List<CommitInfo>> grouped = classifier.group(commits);

			assertThat(grouped.keySet()).containsExactly("Features", "Fixes");
			assertThat(grouped.get("Fixes")).extracting(CommitInfo::sha).containsExactly("1", "2");
			assertThat(grouped.get("Features")).extracting(CommitInfo::sha).containsExactly("3");
		}

		@Test
		@DisplayName("Should put unmatched commits last")
		void shouldPutOtherLast() {
			List<CommitInfo> commits = List.of(commit("1", "Merge branch 'main'"), commit("2", "docs: readme"),
					commitBy("dependabot[bot]", "Bump y"), commit("3", "break: drop java 11"));

			Map<String, List<CommitInfo>> grouped = classifier.group(commits);

			assertThat(grouped.keySet()).containsExactly("Breaking Changes", "Documentation", "Dependencies",
					"Other");
		}

		@Test
		@DisplayName("Should group classified commits with the same ordering")
		void shouldGroupClassifiedCommits() {
			CommitInfo fix = commit("1", "fix: a");
			CommitInfo perf = commit("2", "perf: b");
			List<ClassifiedCommit> classified = List.of(
					ClassifiedCommit.of(fix, classifier.classify(fix), AuthorIdentityResolver.newIdentitySet()),
					ClassifiedCommit.of(perf, classifier.classify(perf), AuthorIdentityResolver.newIdentitySet()));

			Map<String, List<ClassifiedCommit>> grouped = classifier.groupClassified(classified);

			assertThat(grouped.keySet()).containsExactly("Fixes", "Performance");
		}

		@Test
		@DisplayName("Should return an empty grouping for no commits")
		void shouldHandleEmptyInput() {
			assertThat(classifier.group(List.of())).isEmpty();
		}

	}

}
