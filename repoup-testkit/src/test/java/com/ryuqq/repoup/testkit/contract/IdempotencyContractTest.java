package com.ryuqq.repoup.testkit.contract;

import com.ryuqq.repoup.application.engine.UpdateOptions;
import com.ryuqq.repoup.application.engine.UpdateReport;
import com.ryuqq.repoup.core.model.PackageArtifact;
import com.ryuqq.repoup.core.model.PackageFormat;
import com.ryuqq.repoup.core.model.RepositoryPrefix;
import com.ryuqq.repoup.core.outcome.EntryAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for idempotent updates.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Re-adding an indexed package publishes nothing</li>
 *   <li>The same package twice in one batch is indexed once</li>
 *   <li>Re-initializing an initialized repository changes nothing</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
@DisplayName("Idempotency Contract Tests")
class IdempotencyContractTest extends AbstractContractTest {

    private static final RepositoryPrefix X86 = RepositoryPrefix.of("/x86_64");

    @Test
    @DisplayName("Re-adding an indexed package only touches the lock")
    void testAdd_WhenPackageAlreadyIndexed_ThenNothingIsPublished() {
        // Given
        PackageArtifact foo = rpm("foo-1.0-1.el8.x86_64.rpm");
        engine.add(List.of(foo), UpdateOptions.defaults());
        byte[] before = manifestBytes(X86);
        int generatorRuns = generator.invocations();
        storage.resetCounters();

        // When
        UpdateReport report = engine.add(List.of(foo), UpdateOptions.defaults());

        // Then
        assertAction(only(report), EntryAction.UNCHANGED);
        assertFalse(report.hasFailures());
        assertArrayEquals(before, manifestBytes(X86));
        assertTrue(storage.writtenKeys().stream().allMatch(X86.lockKey()::equals),
            "Only the lock may be written, but was " + storage.writtenKeys());
        assertEquals(generatorRuns, generator.invocations(), "Metadata must not be regenerated");
        assertLockReleased(X86);
    }

    @Test
    @DisplayName("Duplicate artifact in one batch is indexed once")
    void testAdd_WhenSameArtifactTwiceInBatch_ThenIndexedOnce() {
        // Given
        PackageArtifact foo = rpm("foo-1.0-1.el8.x86_64.rpm");

        // When
        UpdateReport report = engine.add(List.of(foo, foo), UpdateOptions.defaults());

        // Then
        assertEquals(2, report.getEntries().size());
        assertAction(report.getEntries().get(0), EntryAction.ADDED);
        assertAction(report.getEntries().get(1), EntryAction.UNCHANGED);
        assertEquals(1, snapshot(X86).packages().size());
        assertEquals(1, snapshot(X86).metadataVersion());
    }

    @Test
    @DisplayName("Re-initializing keeps the manifest")
    void testInit_WhenAlreadyInitialized_ThenUnchanged() {
        // Given
        assertAction(only(engine.init(X86, PackageFormat.RPM)), EntryAction.INITIALIZED);
        byte[] before = manifestBytes(X86);

        // When
        UpdateReport report = engine.init(X86, PackageFormat.RPM);

        // Then
        assertAction(only(report), EntryAction.UNCHANGED);
        assertArrayEquals(before, manifestBytes(X86));
    }
}
