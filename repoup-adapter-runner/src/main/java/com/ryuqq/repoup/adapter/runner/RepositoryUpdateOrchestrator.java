package com.ryuqq.repoup.adapter.runner;

import com.ryuqq.repoup.adapter.runner.lock.LeaseLockManager;
import com.ryuqq.repoup.adapter.runner.metadata.MetadataBuilder;
import com.ryuqq.repoup.adapter.runner.metadata.RepositoryCatalog;
import com.ryuqq.repoup.adapter.runner.signing.RepositorySigner;
import com.ryuqq.repoup.adapter.runner.storage.RetryingObjectStorage;
import com.ryuqq.repoup.application.engine.ReportEntry;
import com.ryuqq.repoup.application.engine.RepositoryUpdateEngine;
import com.ryuqq.repoup.application.engine.UpdateOptions;
import com.ryuqq.repoup.application.engine.UpdateReport;
import com.ryuqq.repoup.core.descriptor.DescriptorExtractors;
import com.ryuqq.repoup.core.descriptor.DescriptorMismatch;
import com.ryuqq.repoup.core.descriptor.ExtractionResult;
import com.ryuqq.repoup.core.descriptor.PackageDescriptorExtractor;
import com.ryuqq.repoup.core.error.ErrorCode;
import com.ryuqq.repoup.core.error.RepoupException;
import com.ryuqq.repoup.core.error.UpdateTimeoutException;
import com.ryuqq.repoup.core.model.ContentHash;
import com.ryuqq.repoup.core.model.PackageArtifact;
import com.ryuqq.repoup.core.model.PackageFormat;
import com.ryuqq.repoup.core.model.RepositoryPrefix;
import com.ryuqq.repoup.core.outcome.EntryAction;
import com.ryuqq.repoup.core.outcome.Fail;
import com.ryuqq.repoup.core.outcome.Ok;
import com.ryuqq.repoup.core.routing.RepositoryLocator;
import com.ryuqq.repoup.core.spi.CacheInvalidator;
import com.ryuqq.repoup.core.spi.MetadataGenerator;
import com.ryuqq.repoup.core.spi.ObjectStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Repository Update Engine 구현체.
 *
 * <p>호출 하나를 RESOLVING 후 저장소별 {@link RepositoryUpdate}로 나누어 실행하고,
 * 결과를 입력 순서대로 하나의 {@link UpdateReport}에 모읍니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * add(artifacts)
 *   ↓
 * RESOLVING: 항목별 descriptor 추출 + 저장소 결정
 *   ├─ 실패 항목 있음 + bestEffort 아님 → 전체 중단 (스토리지 변경 없음)
 *   └─ 통과 → prefix별 RepositoryChangeSet (prefix 정렬)
 *   ↓
 * 저장소별 RepositoryUpdate.run()  (parallelism > 1이면 서로 다른 저장소 동시 처리)
 *   ↓
 * UpdateReport (입력 순서)
 * </pre>
 *
 * <p><strong>잠금 순서:</strong> 업데이트 하나는 lease를 한 번에 하나만 보유하고,
 * 저장소는 prefix 순으로 처리되므로 겹치는 호출 사이에 교착이 생기지 않습니다.</p>
 *
 * <p>스토리지는 {@link RetryingObjectStorage}로 감싸 일시 오류를 재시도합니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class RepositoryUpdateOrchestrator implements RepositoryUpdateEngine {

    private static final Logger log = LoggerFactory.getLogger(RepositoryUpdateOrchestrator.class);

    private final ObjectStorage storage;
    private final PackageDescriptorExtractor extractor;
    private final RepositoryLocator locator;
    private final EngineConfig config;
    private final Clock clock;
    private final Collaborators collaborators;
    private final ExecutorService workerPool;

    /**
     * 생성자 (기본 extractor, 서명 비활성화, 캐시 무효화 없음, 기본 설정).
     *
     * @param storage 오브젝트 스토리지
     * @param locator 저장소 결정기
     * @param generator 메타데이터 생성기
     */
    public RepositoryUpdateOrchestrator(ObjectStorage storage, RepositoryLocator locator, MetadataGenerator generator) {
        this(storage, DescriptorExtractors.defaults(), locator, generator, RepositorySigner.disabled(),
            CacheInvalidator.noOp(), new EngineConfig(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param storage 오브젝트 스토리지
     * @param extractor descriptor extractor
     * @param locator 저장소 결정기
     * @param generator 메타데이터 생성기
     * @param signer 서명기
     * @param cacheInvalidator 게시 후 캐시 무효화
     * @param config 엔진 설정
     * @param clock 시계 (lease 만료, deadline, 게시 시각)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RepositoryUpdateOrchestrator(
        ObjectStorage storage,
        PackageDescriptorExtractor extractor,
        RepositoryLocator locator,
        MetadataGenerator generator,
        RepositorySigner signer,
        CacheInvalidator cacheInvalidator,
        EngineConfig config,
        Clock clock
    ) {
        if (storage == null) {
            throw new IllegalArgumentException("storage cannot be null");
        }
        if (extractor == null) {
            throw new IllegalArgumentException("extractor cannot be null");
        }
        if (locator == null) {
            throw new IllegalArgumentException("locator cannot be null");
        }
        if (generator == null) {
            throw new IllegalArgumentException("generator cannot be null");
        }
        if (signer == null) {
            throw new IllegalArgumentException("signer cannot be null");
        }
        if (cacheInvalidator == null) {
            throw new IllegalArgumentException("cacheInvalidator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        this.storage = new RetryingObjectStorage(storage, config.storageRetryConfig());
        this.extractor = extractor;
        this.locator = locator;
        this.config = config;
        this.clock = clock;
        this.collaborators = new Collaborators(
            this.storage,
            new LeaseLockManager(this.storage, config.lockConfig(), clock),
            new RepositoryCatalog(this.storage),
            new MetadataBuilder(generator),
            signer,
            cacheInvalidator,
            config,
            clock,
            "repoup-" + UUID.randomUUID()
        );
        this.workerPool = config.parallelism() > 1 ? Executors.newFixedThreadPool(config.parallelism()) : null;
    }

    @Override
    public UpdateReport add(List<PackageArtifact> artifacts, UpdateOptions options) {
        if (artifacts == null) {
            throw new IllegalArgumentException("artifacts cannot be null");
        }
        UpdateOptions effective = options == null ? UpdateOptions.defaults() : options;
        Deadline deadline = deadlineFor(effective);

        List<Resolution> resolutions = new ArrayList<>();
        for (int i = 0; i < artifacts.size(); i++) {
            PackageArtifact artifact = artifacts.get(i);
            resolutions.add(resolveArtifact(i, artifact.getFilename(), artifact, null, effective));
        }
        return applyAdds(resolutions, effective, deadline);
    }

    @Override
    public UpdateReport addStored(List<String> sourceKeys, UpdateOptions options) {
        if (sourceKeys == null) {
            throw new IllegalArgumentException("sourceKeys cannot be null");
        }
        UpdateOptions effective = options == null ? UpdateOptions.defaults() : options;
        Deadline deadline = deadlineFor(effective);

        List<Resolution> resolutions = new ArrayList<>();
        for (int i = 0; i < sourceKeys.size(); i++) {
            String sourceKey = sourceKeys.get(i);
            try {
                PackageArtifact artifact = PackageArtifact.of(sourceKey, storage.get(sourceKey).content());
                resolutions.add(resolveArtifact(i, sourceKey, artifact, sourceKey, effective));
            } catch (RepoupException | IllegalArgumentException e) {
                log.error("Unable to read source object {}: {}", sourceKey, e.getMessage());
                resolutions.add(Resolution.failed(i, String.valueOf(sourceKey), e, List.of()));
            }
        }
        return applyAdds(resolutions, effective, deadline);
    }

    @Override
    public UpdateReport remove(List<ContentHash> contentHashes, UpdateOptions options) {
        if (contentHashes == null) {
            throw new IllegalArgumentException("contentHashes cannot be null");
        }
        UpdateOptions effective = options == null ? UpdateOptions.defaults() : options;
        Deadline deadline = deadlineFor(effective);

        // RESOLVING: 해시를 인덱싱한 저장소 탐색
        Map<ContentHash, List<RepositoryPrefix>> located;
        try {
            located = collaborators.catalog().locate(new LinkedHashSet<>(contentHashes));
        } catch (RepoupException e) {
            log.error("Unable to locate packages for removal: {}", e.getMessage());
            Fail fail = Fail.from(e);
            List<ReportEntry> entries = new ArrayList<>();
            for (ContentHash hash : contentHashes) {
                entries.add(ReportEntry.fail(hash.getValue(), null, fail, List.of()));
            }
            return report(entries);
        }

        List<ReportEntry> entries = new ArrayList<>();
        Map<RepositoryPrefix, List<PendingRemove>> grouped = new TreeMap<>();
        for (ContentHash hash : contentHashes) {
            List<RepositoryPrefix> prefixes = located.get(hash);
            if (prefixes.isEmpty()) {
                entries.add(ReportEntry.fail(hash.getValue(), null, Fail.of(ErrorCode.PACKAGE_NOT_FOUND,
                    "Package " + hash.getValue() + " is not indexed in any repository"), List.of()));
                continue;
            }
            for (RepositoryPrefix prefix : prefixes) {
                grouped.computeIfAbsent(prefix, key -> new ArrayList<>())
                    .add(new PendingRemove(entries.size(), hash.getValue(), hash));
                entries.add(null);
            }
        }

        List<RepositoryChangeSet> changeSets = new ArrayList<>();
        grouped.forEach((prefix, removes) -> changeSets.add(RepositoryChangeSet.removing(prefix, removes)));
        execute(changeSets, effective, deadline, entries);
        return report(entries);
    }

    @Override
    public UpdateReport init(RepositoryPrefix prefix, PackageFormat format) {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        if (format == null) {
            throw new IllegalArgumentException("format cannot be null");
        }
        UpdateOptions options = UpdateOptions.defaults();
        List<ReportEntry> entries = new ArrayList<>(Collections.nCopies(1, null));
        execute(List.of(RepositoryChangeSet.initializing(prefix, format, 0)), options, deadlineFor(options), entries);
        return report(entries);
    }

    @Override
    public UpdateReport resolve(List<PackageArtifact> artifacts) {
        if (artifacts == null) {
            throw new IllegalArgumentException("artifacts cannot be null");
        }
        UpdateOptions options = UpdateOptions.defaults();
        List<ReportEntry> entries = new ArrayList<>();
        for (int i = 0; i < artifacts.size(); i++) {
            PackageArtifact artifact = artifacts.get(i);
            Resolution resolution = resolveArtifact(i, artifact.getFilename(), artifact, null, options);
            if (resolution.error() != null) {
                entries.add(ReportEntry.fail(resolution.subject(), null, Fail.from(resolution.error()), resolution.warnings()));
            } else {
                entries.add(ReportEntry.ok(resolution.subject(), resolution.prefix(),
                    new Ok(EntryAction.RESOLVED, resolution.prefix().getValue()), resolution.warnings()));
            }
        }
        return UpdateReport.of(entries);
    }

    /**
     * 워커 풀 종료 (parallelism > 1일 때만 존재).
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        if (workerPool == null) {
            return;
        }
        workerPool.shutdown();
        if (!workerPool.awaitTermination(60, TimeUnit.SECONDS)) {
            workerPool.shutdownNow();
        }
    }

    /**
     * 엔진 인스턴스 식별자.
     *
     * <p>lease 보유자 ID는 업데이트마다 {@code <engineId>/<uuid>}로 새로 만들어지므로
     * 같은 엔진의 동시 호출도 서로 다른 보유자입니다.</p>
     *
     * @return 엔진 식별자
     */
    public String getEngineId() {
        return collaborators.engineId();
    }

    public EngineConfig getConfig() {
        return config;
    }

    private Resolution resolveArtifact(
        int position,
        String subject,
        PackageArtifact artifact,
        String sourceKey,
        UpdateOptions options
    ) {
        List<String> warnings = List.of();
        try {
            ExtractionResult extraction = extractor.extract(artifact);
            warnings = extraction.mismatches().stream().map(DescriptorMismatch::describe).toList();
            for (String warning : warnings) {
                log.warn("Descriptor mismatch in {}: {}", subject, warning);
            }
            RepositoryPrefix prefix = locator.resolve(extraction.descriptor(), options.variables());
            PendingAdd pending = new PendingAdd(position, subject, extraction.descriptor(), artifact.getContent(),
                warnings, sourceKey);
            return Resolution.resolved(position, subject, prefix, pending, warnings);
        } catch (RepoupException | IllegalArgumentException e) {
            log.error("Unable to resolve {}: {}", subject, e.getMessage());
            return Resolution.failed(position, subject, e, warnings);
        }
    }

    private UpdateReport applyAdds(List<Resolution> resolutions, UpdateOptions options, Deadline deadline) {
        long unresolved = resolutions.stream().filter(resolution -> resolution.error() != null).count();
        List<ReportEntry> entries = new ArrayList<>(Collections.nCopies(resolutions.size(), null));

        if (unresolved > 0 && !(options.bestEffort() || config.bestEffort())) {
            log.error("Aborting batch: {} of {} entries could not be resolved", unresolved, resolutions.size());
            Fail aborted = Fail.of(ErrorCode.BATCH_ABORTED,
                "Batch aborted: " + unresolved + " entries could not be resolved");
            for (Resolution resolution : resolutions) {
                Fail fail = resolution.error() != null ? Fail.from(resolution.error()) : aborted;
                entries.set(resolution.position(),
                    ReportEntry.fail(resolution.subject(), resolution.prefix(), fail, resolution.warnings()));
            }
            return report(entries);
        }

        Map<RepositoryPrefix, List<PendingAdd>> grouped = new TreeMap<>();
        for (Resolution resolution : resolutions) {
            if (resolution.error() != null) {
                entries.set(resolution.position(), ReportEntry.fail(resolution.subject(), null,
                    Fail.from(resolution.error()), resolution.warnings()));
            } else {
                grouped.computeIfAbsent(resolution.prefix(), key -> new ArrayList<>()).add(resolution.pending());
            }
        }

        List<RepositoryChangeSet> changeSets = new ArrayList<>();
        grouped.forEach((prefix, adds) -> changeSets.add(RepositoryChangeSet.adding(prefix, adds)));
        execute(changeSets, options, deadline, entries);
        return report(entries);
    }

    /**
     * 저장소별 업데이트 실행 후 결과를 entries의 해당 위치에 기록.
     */
    private void execute(List<RepositoryChangeSet> changeSets, UpdateOptions options, Deadline deadline, List<ReportEntry> entries) {
        if (workerPool == null || changeSets.size() < 2) {
            for (RepositoryChangeSet changeSet : changeSets) {
                collect(new RepositoryUpdate(changeSet, collaborators, deadline, options.removeSource()).run(), entries);
            }
            return;
        }

        List<Future<Map<Integer, ReportEntry>>> futures = new ArrayList<>();
        for (RepositoryChangeSet changeSet : changeSets) {
            RepositoryUpdate update = new RepositoryUpdate(changeSet, collaborators, deadline, options.removeSource());
            futures.add(workerPool.submit(update::run));
        }
        for (int i = 0; i < futures.size(); i++) {
            RepositoryChangeSet changeSet = changeSets.get(i);
            try {
                collect(futures.get(i).get(), entries);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fillMissing(changeSet, entries,
                    Fail.from(new UpdateTimeoutException("Interrupted while waiting for " + changeSet.prefix(), e)));
            } catch (ExecutionException e) {
                log.error("Repository update of {} crashed", changeSet.prefix(), e.getCause());
                fillMissing(changeSet, entries, Fail.from(e.getCause()));
            }
        }
    }

    private static void collect(Map<Integer, ReportEntry> results, List<ReportEntry> entries) {
        results.forEach(entries::set);
    }

    private static void fillMissing(RepositoryChangeSet changeSet, List<ReportEntry> entries, Fail fail) {
        for (PendingAdd add : changeSet.adds()) {
            if (entries.get(add.position()) == null) {
                entries.set(add.position(), ReportEntry.fail(add.subject(), changeSet.prefix(), fail, add.warnings()));
            }
        }
        for (PendingRemove remove : changeSet.removes()) {
            if (entries.get(remove.position()) == null) {
                entries.set(remove.position(), ReportEntry.fail(remove.subject(), changeSet.prefix(), fail, List.of()));
            }
        }
        if (changeSet.isInit() && entries.get(changeSet.initPosition()) == null) {
            entries.set(changeSet.initPosition(),
                ReportEntry.fail(changeSet.prefix().getValue(), changeSet.prefix(), fail, List.of()));
        }
    }

    private UpdateReport report(List<ReportEntry> entries) {
        UpdateReport report = UpdateReport.of(entries);
        if (report.hasFailures()) {
            log.warn("Update finished with failures: {}", report.summary());
        } else {
            log.info("Update finished: {}", report.summary());
        }
        return report;
    }

    private Deadline deadlineFor(UpdateOptions options) {
        return Deadline.after(clock, options.deadline() == null ? config.defaultDeadline() : options.deadline());
    }

    /**
     * 저장소별 업데이트가 공유하는 협력 객체.
     */
    record Collaborators(
        ObjectStorage storage,
        LeaseLockManager lockManager,
        RepositoryCatalog catalog,
        MetadataBuilder metadataBuilder,
        RepositorySigner signer,
        CacheInvalidator cacheInvalidator,
        EngineConfig config,
        Clock clock,
        String engineId
    ) {
    }

    private record Resolution(
        int position,
        String subject,
        RepositoryPrefix prefix,
        PendingAdd pending,
        RuntimeException error,
        List<String> warnings
    ) {

        static Resolution resolved(int position, String subject, RepositoryPrefix prefix, PendingAdd pending, List<String> warnings) {
            return new Resolution(position, subject, prefix, pending, null, warnings);
        }

        static Resolution failed(int position, String subject, RuntimeException error, List<String> warnings) {
            return new Resolution(position, subject, null, null, error, warnings);
        }
    }
}
