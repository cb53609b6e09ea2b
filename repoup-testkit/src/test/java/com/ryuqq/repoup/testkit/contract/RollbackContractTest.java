package com.ryuqq.repoup.testkit.contract;

import com.ryuqq.repoup.application.engine.UpdateOptions;
import com.ryuqq.repoup.application.engine.UpdateReport;
import com.ryuqq.repoup.core.error.ErrorCode;
import com.ryuqq.repoup.core.model.PackageArtifact;
import com.ryuqq.repoup.core.model.RepositoryPrefix;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for rollback of failed updates.
 *
 * <p>A failure before the manifest is published must leave the repository exactly as it was:
 * same manifest, no staged objects, lock released, signing sessions closed.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Metadata generation failure</li>
 *   <li>Manifest signing failure</li>
 *   <li>Signature verification failure</li>
 *   <li>Recovery with a later successful update</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
@DisplayName("Rollback Contract Tests")
class RollbackContractTest extends AbstractContractTest {

    private static final RepositoryPrefix X86 = RepositoryPrefix.of("/x86_64");

    private byte[] manifestBefore;
    private List<String> objectsBefore;
    private PackageArtifact bar;

    @BeforeEach
    void publishInitialState() {
        engine.add(List.of(rpm("foo-1.0-1.el8.x86_64.rpm")), UpdateOptions.defaults());
        manifestBefore = manifestBytes(X86);
        objectsBefore = repositoryObjects(X86);
        bar = rpm("bar-2.0-1.el8.x86_64.rpm");
    }

    @Test
    @DisplayName("Metadata generation failure rolls back staged packages")
    void testAdd_WhenMetadataGenerationFails_ThenRolledBack() {
        // Given
        generator.setFailing(true);

        // When
        UpdateReport report = engine.add(List.of(bar), UpdateOptions.defaults());

        // Then
        assertFailure(only(report), ErrorCode.METADATA_BUILD_FAILED);
        assertRepositoryUnchanged();
    }

    @Test
    @DisplayName("Manifest signing failure rolls back staged objects")
    void testAdd_WhenManifestSigningFails_ThenRolledBack() {
        // Given
        signingTool.failManifestSigning(true);

        // When
        UpdateReport report = engine.add(List.of(bar), UpdateOptions.defaults());

        // Then
        assertFailure(only(report), ErrorCode.SIGNING_FAILED);
        assertRepositoryUnchanged();
    }

    @Test
    @DisplayName("Rejected signature verification publishes nothing")
    void testAdd_WhenVerificationRejected_ThenRolledBack() {
        // Given
        signingTool.rejectVerification(true);

        // When
        UpdateReport report = engine.add(List.of(bar), UpdateOptions.defaults());

        // Then
        assertFailure(only(report), ErrorCode.VERIFICATION_FAILED);
        assertRepositoryUnchanged();
    }

    @Test
    @DisplayName("Repository accepts updates again after a rollback")
    void testAdd_WhenRetriedAfterRollback_ThenPublished() {
        // Given
        generator.setFailing(true);
        engine.add(List.of(bar), UpdateOptions.defaults());
        generator.setFailing(false);

        // When
        UpdateReport report = engine.add(List.of(bar), UpdateOptions.defaults());

        // Then
        assertFalse(report.hasFailures(), report.summary());
        assertEquals(2, snapshot(X86).packages().size());
        assertEquals(2, snapshot(X86).metadataVersion());
        assertNoDanglingReferences(X86);
    }

    private void assertRepositoryUnchanged() {
        assertArrayEquals(manifestBefore, manifestBytes(X86), "Manifest must not change");
        assertEquals(objectsBefore, repositoryObjects(X86), "Staged objects must be deleted");
        assertFalse(snapshot(X86).findByHash(bar.contentHash()).isPresent());
        assertLockReleased(X86);
        assertEquals(signingTool.openedSessions(), signingTool.closedSessions(), "Signing sessions must be closed");
        assertNoDanglingReferences(X86);
    }
}
