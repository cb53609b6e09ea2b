package com.ryuqq.repoup.testkit.contract;

import com.ryuqq.repoup.adapter.inmemory.storage.InMemoryObjectStorage;
import com.ryuqq.repoup.adapter.runner.EngineConfig;
import com.ryuqq.repoup.adapter.runner.RepositoryUpdateOrchestrator;
import com.ryuqq.repoup.adapter.runner.lock.LockConfig;
import com.ryuqq.repoup.adapter.runner.metadata.RepositoryCatalog;
import com.ryuqq.repoup.adapter.runner.metadata.RepositorySnapshot;
import com.ryuqq.repoup.adapter.runner.signing.KeyringGuard;
import com.ryuqq.repoup.adapter.runner.signing.RepositorySigner;
import com.ryuqq.repoup.adapter.runner.signing.SignerConfig;
import com.ryuqq.repoup.adapter.runner.storage.StorageRetryConfig;
import com.ryuqq.repoup.application.engine.ReportEntry;
import com.ryuqq.repoup.application.engine.UpdateReport;
import com.ryuqq.repoup.core.descriptor.DescriptorExtractors;
import com.ryuqq.repoup.core.error.ErrorCode;
import com.ryuqq.repoup.core.model.PackageArtifact;
import com.ryuqq.repoup.core.model.RepositoryPrefix;
import com.ryuqq.repoup.core.outcome.EntryAction;
import com.ryuqq.repoup.core.outcome.Fail;
import com.ryuqq.repoup.core.outcome.Ok;
import com.ryuqq.repoup.core.routing.RepositoryLocator;
import com.ryuqq.repoup.core.routing.RoutingRules;
import com.ryuqq.repoup.core.spi.CacheInvalidator;
import com.ryuqq.repoup.core.spi.KeyReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>Wires a complete engine against in-memory storage and fake external capabilities, so
 * ordering, atomicity and rollback can be asserted on the resulting object store.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryObjectStorage: versioned object store with conditional puts and failure injection</li>
 *   <li>FakeSigningTool: deterministic package / manifest signatures</li>
 *   <li>ListingMetadataGenerator: one text component listing the package set</li>
 *   <li>MutableClock: lease expiry without sleeping</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         UpdateReport report = engine.add(List.of(rpm("foo-1.0-1.x86_64.rpm")), UpdateOptions.defaults());
 *         assertAction(report.getEntries().get(0), EntryAction.ADDED);
 *     }
 * }
 * </pre>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    protected static final Duration LEASE_DURATION = Duration.ofSeconds(60);
    protected static final String DEFAULT_RULES = "[{\"match\": {\"arch\": \"*\"}, \"target_prefix\": \"/$basearch\"}]";

    protected InMemoryObjectStorage storage;
    protected FakeSigningTool signingTool;
    protected ListingMetadataGenerator generator;
    protected MutableClock clock;
    protected RepositoryUpdateOrchestrator engine;

    private final List<RepositoryUpdateOrchestrator> engines = new ArrayList<>();

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates a fresh store, fakes and a signing engine routed by {@link #DEFAULT_RULES}.</p>
     */
    @BeforeEach
    void setUp() {
        storage = new InMemoryObjectStorage();
        signingTool = new FakeSigningTool();
        generator = new ListingMetadataGenerator();
        clock = new MutableClock(START);
        engine = newEngine(DEFAULT_RULES);
    }

    /**
     * Shuts down every engine created by the test.
     */
    @AfterEach
    void tearDown() throws InterruptedException {
        for (RepositoryUpdateOrchestrator created : engines) {
            created.shutdown();
        }
        engines.clear();
        if (storage != null) {
            storage.clear();
        }
    }

    /**
     * Creates an engine sharing this test's storage, fakes and clock.
     *
     * <p>Every engine gets its own engine ID, like a separate process.</p>
     *
     * @param rulesJson routing rules JSON
     * @return new engine
     */
    protected RepositoryUpdateOrchestrator newEngine(String rulesJson) {
        return newEngine(rulesJson, contractConfig());
    }

    protected RepositoryUpdateOrchestrator newEngine(String rulesJson, EngineConfig config) {
        RepositorySigner signer = new RepositorySigner(signingTool,
            SignerConfig.signingWith(KeyReference.of("file:///secrets/repo-signing.asc")).withVerify(true),
            new KeyringGuard());
        RepositoryUpdateOrchestrator created = new RepositoryUpdateOrchestrator(
            storage,
            DescriptorExtractors.defaults(),
            new RepositoryLocator(RoutingRules.fromJson(rulesJson)),
            generator,
            signer,
            CacheInvalidator.noOp(),
            config,
            clock
        );
        engines.add(created);
        return created;
    }

    /**
     * Engine configuration with short backoffs so contention tests finish quickly.
     *
     * @return engine config
     */
    protected EngineConfig contractConfig() {
        return new EngineConfig()
            .withLockConfig(new LockConfig(LEASE_DURATION, 5, Duration.ofMillis(5), Duration.ofMillis(20), 0.5))
            .withStorageRetryConfig(new StorageRetryConfig(2, 1, 5, 0.0));
    }

    /**
     * Creates an RPM artifact identified by its file name; the body makes the content hash unique.
     *
     * @param filename RPM file name following the NEVRA convention
     * @param body artifact body
     * @return artifact
     */
    protected PackageArtifact rpm(String filename, String body) {
        return PackageArtifact.of(filename, body.getBytes(StandardCharsets.UTF_8));
    }

    protected PackageArtifact rpm(String filename) {
        return rpm(filename, "content of " + filename);
    }

    /**
     * Reads the currently published state of a repository.
     *
     * @param prefix repository prefix
     * @return snapshot (uninitialized if no manifest exists)
     */
    protected RepositorySnapshot snapshot(RepositoryPrefix prefix) {
        return new RepositoryCatalog(storage).snapshot(prefix);
    }

    /**
     * Bytes of the published manifest, or null if there is none.
     */
    protected byte[] manifestBytes(RepositoryPrefix prefix) {
        return snapshot(prefix).manifestBytes();
    }

    /**
     * Every object of the repository except its lock object.
     */
    protected List<String> repositoryObjects(RepositoryPrefix prefix) {
        return storage.list(prefix.rootKey()).stream()
            .filter(key -> !key.equals(prefix.lockKey()))
            .toList();
    }

    protected boolean exists(String key) {
        return storage.list(key).contains(key);
    }

    /**
     * Asserts that the entry succeeded with the expected action.
     *
     * @param entry report entry
     * @param expected expected action
     */
    protected void assertAction(ReportEntry entry, EntryAction expected) {
        Ok ok = assertInstanceOf(Ok.class, entry.outcome(),
            String.format("Expected %s for %s but was %s", expected, entry.subject(), entry.outcome()));
        assertEquals(expected, ok.action(),
            String.format("Expected action %s for %s but was %s", expected, entry.subject(), ok.action()));
    }

    /**
     * Asserts that the entry failed with the expected error code.
     *
     * @param entry report entry
     * @param expected expected error code
     */
    protected void assertFailure(ReportEntry entry, ErrorCode expected) {
        Fail fail = assertInstanceOf(Fail.class, entry.outcome(),
            String.format("Expected %s for %s but was %s", expected, entry.subject(), entry.outcome()));
        assertEquals(expected, fail.errorCode(),
            String.format("Expected error %s for %s but was %s (%s)", expected, entry.subject(), fail.errorCode(), fail.message()));
    }

    /**
     * Asserts that every object referenced by the published manifest exists.
     *
     * @param prefix repository prefix
     */
    protected void assertNoDanglingReferences(RepositoryPrefix prefix) {
        RepositorySnapshot snapshot = snapshot(prefix);
        assertTrue(snapshot.isInitialized(), "Expected a published manifest for " + prefix);
        for (String key : snapshot.manifest().componentKeys()) {
            assertTrue(exists(key), "Manifest of " + prefix + " references missing component " + key);
        }
        snapshot.packages().forEach(indexed -> assertTrue(exists(indexed.objectKey()),
            "Index of " + prefix + " references missing package " + indexed.objectKey()));
    }

    protected void assertLockReleased(RepositoryPrefix prefix) {
        assertTrue(!exists(prefix.lockKey()), "Expected lock of " + prefix + " to be released");
    }

    protected static ReportEntry only(UpdateReport report) {
        assertEquals(1, report.getEntries().size(), "Expected exactly one report entry: " + report);
        return report.getEntries().get(0);
    }
}
