package org.springaicommunity.github.releasenotes.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springaicommunity.github.releasenotes.*;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration test against the real GitHub API.
 *
 * No strict assertions about commit counts - just verify a real repository can be
 * aggregated and rendered end to end.
 *
 * Requires GITHUB_TOKEN environment variable to be set.
 */
@DisplayName("Release Notes Integration Tests")
@EnabledIf("isGitHubTokenAvailable")
class ReleaseNotesIT {

	static boolean isGitHubTokenAvailable() {
		String token = EnvironmentSupport.get("GITHUB_TOKEN");
		return token != null && !token.isBlank();
	}

	@Test
	@DisplayName("Should generate release notes for a public repository")
	void shouldGenerateReleaseNotes() {
		ReleaseNotesProperties properties = new ReleaseNotesProperties();
		properties.setMaxHistoryPages(2);
		properties.setMaxRetries(1);

		ReleaseNotesService service = ReleaseNotesBuilder.create().tokenFromEnv().properties(properties).buildService();

		String notes = service
			.generate(new ReleaseNotesRequest("spring-ai-community", "github-collector", null, null, "next"));

		assertThat(notes).startsWith("## 🗺️ What's Changed").contains("🔗 **Full Changelog**: ");
	}

}
