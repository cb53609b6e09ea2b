package com.ryuqq.repoup.testkit.contract;

import com.ryuqq.repoup.adapter.runner.RepositoryUpdateOrchestrator;
import com.ryuqq.repoup.application.engine.UpdateOptions;
import com.ryuqq.repoup.application.engine.UpdateReport;
import com.ryuqq.repoup.core.error.ErrorCode;
import com.ryuqq.repoup.core.model.PackageArtifact;
import com.ryuqq.repoup.core.model.RepositoryPrefix;
import com.ryuqq.repoup.core.outcome.EntryAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for multi-repository routing.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>One batch fans out to every matching repository</li>
 *   <li>Unroutable package aborts the batch unless best effort is requested</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
@DisplayName("Routing Contract Tests")
class RoutingContractTest extends AbstractContractTest {

    private static final String ARCH_RULES = "["
        + "{\"match\": {\"arch\": \"aarch64\"}, \"target_prefix\": \"/arm\"},"
        + "{\"match\": {\"arch\": \"*\"}, \"target_prefix\": \"/default\"}"
        + "]";
    private static final String ARM_ONLY_RULES = "[{\"match\": {\"arch\": \"aarch64\"}, \"target_prefix\": \"/arm\"}]";

    private static final RepositoryPrefix ARM = RepositoryPrefix.of("/arm");
    private static final RepositoryPrefix DEFAULT = RepositoryPrefix.of("/default");

    @Test
    @DisplayName("Batch is split across matching repositories")
    void testAdd_WhenBatchSpansArchitectures_ThenEachRepositoryUpdated() {
        // Given
        RepositoryUpdateOrchestrator routed = newEngine(ARCH_RULES);
        PackageArtifact arm = rpm("foo-1.0-1.el8.aarch64.rpm");
        PackageArtifact x86 = rpm("foo-1.0-1.el8.x86_64.rpm");

        // When
        UpdateReport report = routed.add(List.of(arm, x86), UpdateOptions.defaults());

        // Then
        assertAction(report.getEntries().get(0), EntryAction.ADDED);
        assertAction(report.getEntries().get(1), EntryAction.ADDED);
        assertEquals(ARM, report.getEntries().get(0).repository());
        assertEquals(DEFAULT, report.getEntries().get(1).repository());
        assertTrue(snapshot(ARM).findByHash(arm.contentHash()).isPresent());
        assertTrue(snapshot(DEFAULT).findByHash(x86.contentHash()).isPresent());
        assertEquals(1, snapshot(ARM).packages().size());
        assertEquals(1, snapshot(DEFAULT).packages().size());
        assertNoDanglingReferences(ARM);
        assertNoDanglingReferences(DEFAULT);
    }

    @Test
    @DisplayName("Unroutable package aborts the whole batch")
    void testAdd_WhenPackageUnroutable_ThenBatchAborted() {
        // Given
        RepositoryUpdateOrchestrator routed = newEngine(ARM_ONLY_RULES);

        // When
        UpdateReport report = routed.add(
            List.of(rpm("foo-1.0-1.el8.aarch64.rpm"), rpm("foo-1.0-1.el8.x86_64.rpm")),
            UpdateOptions.defaults());

        // Then
        assertFailure(report.getEntries().get(0), ErrorCode.BATCH_ABORTED);
        assertFailure(report.getEntries().get(1), ErrorCode.NO_MATCHING_REPOSITORY);
        assertEquals(0, storage.size(), "An aborted batch must not write anything");
    }

    @Test
    @DisplayName("Best effort publishes the routable part of the batch")
    void testAdd_WhenBestEffort_ThenRoutablePackagesPublished() {
        // Given
        RepositoryUpdateOrchestrator routed = newEngine(ARM_ONLY_RULES);

        // When
        UpdateReport report = routed.add(
            List.of(rpm("foo-1.0-1.el8.aarch64.rpm"), rpm("foo-1.0-1.el8.x86_64.rpm")),
            UpdateOptions.defaults().withBestEffort(true));

        // Then
        assertAction(report.getEntries().get(0), EntryAction.ADDED);
        assertFailure(report.getEntries().get(1), ErrorCode.NO_MATCHING_REPOSITORY);
        assertEquals(1, snapshot(ARM).packages().size());
        assertNotEquals(0, report.exitStatus());
    }
}
