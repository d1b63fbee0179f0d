package org.springaicommunity.github.releasenotes;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules and layering.
 *
 * <p>
 * This project uses a flat package with interface boundaries at the remote seams:
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link GitHubClient} - HTTP operations for GitHub API</li>
 * <li>{@link CommitHistoryProvider} - Repository, release and commit history queries</li>
 * <li>{@link ReleaseNotesSink} - Output destinations</li>
 * </ul>
 *
 * <h3>Implementations</h3>
 * <ul>
 * <li>{@link GitHubHttpClient} - Default HTTP implementation (includes logging)</li>
 * <li>{@link GitHubRestService} - REST implementation of the history provider</li>
 * <li>{@link RetryingCommitHistoryProvider} - Retry decorator with backoff</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Aggregation → CommitHistoryProvider (NOT the REST or HTTP implementation)
 *   Classification and rendering → Models only (no HTTP, no JSON)
 *   Decorators → Interface they decorate
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.github.releasenotes",
		importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule release_notes_service_should_depend_on_provider_interface = noClasses().that()
		.haveSimpleName("ReleaseNotesService")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubRestService")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("The aggregation should depend on CommitHistoryProvider, not on its GitHub implementations");

	@ArchTest
	static final ArchRule rest_service_should_depend_on_client_interface = noClasses().that()
		.haveSimpleNameEndingWith("Service")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("Services should depend on GitHubClient interface, not the concrete GitHubHttpClient");

	// ========== Pure Domain Rules ==========

	@ArchTest
	static final ArchRule classification_should_not_depend_on_infrastructure = noClasses().that()
		.haveSimpleName("PrefixCategoryIndex")
		.or()
		.haveSimpleName("CommitClassifier")
		.or()
		.haveSimpleName("AuthorIdentityResolver")
		.or()
		.haveSimpleName("ReleaseNotesFormatter")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Client")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Provider")
		.orShould()
		.dependOnClassesThat()
		.resideInAPackage("com.fasterxml.jackson..")
		.because("Classification and rendering work on models only and must stay testable without I/O");

	@ArchTest
	static final ArchRule models_should_not_depend_on_services = noClasses().that()
		.haveSimpleName("CommitInfo")
		.or()
		.haveSimpleName("ClassifiedCommit")
		.or()
		.haveSimpleName("Release")
		.or()
		.haveSimpleName("RepositoryInfo")
		.or()
		.haveSimpleName("ReleaseWindow")
		.or()
		.haveSimpleName("CommitComparison")
		.or()
		.haveSimpleNameEndingWith("Request")
		.or()
		.haveSimpleNameEndingWith("Result")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Client")
		.because("Model classes should be pure data without service dependencies");

	// ========== Decorator Rules ==========

	@ArchTest
	static final ArchRule retrying_provider_should_implement_provider_interface = classes().that()
		.haveSimpleName("RetryingCommitHistoryProvider")
		.should()
		.implement(CommitHistoryProvider.class)
		.because("RetryingCommitHistoryProvider is a decorator and must implement CommitHistoryProvider");

	@ArchTest
	static final ArchRule sinks_should_implement_sink_interface = classes().that()
		.haveSimpleNameEndingWith("ReleaseNotesSink")
		.and()
		.areNotInterfaces()
		.should()
		.implement(ReleaseNotesSink.class)
		.because("Output destinations are used through ReleaseNotesSink");

	// ========== Framework Independence ==========

	@ArchTest
	static final ArchRule no_framework_dependencies = noClasses().should()
		.dependOnClassesThat()
		.resideInAnyPackage("org.springframework..", "org.kohsuke.github..")
		.because("The core is wired by ReleaseNotesBuilder without a framework");

	// ========== Naming Conventions ==========

	@ArchTest
	static final ArchRule builder_should_be_named_correctly = classes().that()
		.haveSimpleNameEndingWith("Builder")
		.and()
		.doNotHaveSimpleName("Builder")
		.should()
		.haveSimpleNameStartingWith("ReleaseNotes")
		.because("ReleaseNotesBuilder is the single wiring entry point");

}
