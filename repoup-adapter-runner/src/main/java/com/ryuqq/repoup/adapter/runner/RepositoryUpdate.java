package com.ryuqq.repoup.adapter.runner;

import com.ryuqq.repoup.adapter.runner.lock.LeaseHandle;
import com.ryuqq.repoup.adapter.runner.lock.LeaseLockManager;
import com.ryuqq.repoup.adapter.runner.metadata.ManifestCodec;
import com.ryuqq.repoup.adapter.runner.metadata.MetadataBuild;
import com.ryuqq.repoup.adapter.runner.metadata.MetadataBuilder;
import com.ryuqq.repoup.adapter.runner.metadata.RepositoryCatalog;
import com.ryuqq.repoup.adapter.runner.metadata.RepositoryManifest;
import com.ryuqq.repoup.adapter.runner.metadata.RepositorySnapshot;
import com.ryuqq.repoup.adapter.runner.metadata.StagedComponent;
import com.ryuqq.repoup.adapter.runner.signing.RepositorySigner;
import com.ryuqq.repoup.application.engine.ReportEntry;
import com.ryuqq.repoup.core.error.ErrorCode;
import com.ryuqq.repoup.core.error.ObjectNotFoundException;
import com.ryuqq.repoup.core.error.PreconditionFailedException;
import com.ryuqq.repoup.core.error.RepositoryBusyException;
import com.ryuqq.repoup.core.error.RepoupException;
import com.ryuqq.repoup.core.error.StorageException;
import com.ryuqq.repoup.core.model.ContentHash;
import com.ryuqq.repoup.core.model.IndexedPackage;
import com.ryuqq.repoup.core.model.PackageDescriptor;
import com.ryuqq.repoup.core.model.PackageFormat;
import com.ryuqq.repoup.core.model.RepositoryPrefix;
import com.ryuqq.repoup.core.outcome.EntryAction;
import com.ryuqq.repoup.core.outcome.Fail;
import com.ryuqq.repoup.core.outcome.Ok;
import com.ryuqq.repoup.core.spi.CacheInvalidator;
import com.ryuqq.repoup.core.spi.ObjectStorage;
import com.ryuqq.repoup.core.spi.PackageContentSource;
import com.ryuqq.repoup.core.spi.Precondition;
import com.ryuqq.repoup.core.statemachine.StateTransition;
import com.ryuqq.repoup.core.statemachine.UpdateState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * 저장소 하나에 대한 업데이트 한 번.
 *
 * <p><strong>상태 흐름:</strong></p>
 * <pre>
 * RESOLVING → LOCKING ─(lease 실패)→ ABORTED
 *               ↓
 *            STAGING ─(변경 없음)→ RELEASING → DONE
 *               ↓
 *       BUILDING_METADATA → SIGNING → PUBLISHING → RELEASING → DONE
 *               └──────────(실패)──────────┘
 *                          ↓
 *                  FAILING → ROLLED_BACK
 * </pre>
 *
 * <p><strong>게시 순서:</strong> 패키지 → 인덱스 컴포넌트 → 매니페스트 서명 → 매니페스트.
 * 매니페스트가 참조하는 모든 오브젝트가 먼저 존재하므로 리더는 이전 상태 또는 새 상태만 봅니다.
 * 매니페스트는 스냅샷에서 읽은 버전 토큰을 조건으로 씁니다.</p>
 *
 * <p><strong>롤백:</strong> 매니페스트 게시 전 실패 시 이번 시도에서 새로 만든 오브젝트만 삭제합니다.
 * 스테이징은 {@code ifAbsent}로 쓰므로 이미 있던 키는 롤백 대상이 되지 않습니다. lease를 잃었거나
 * 현재 매니페스트가 참조하는 키는 삭제하지 않습니다.</p>
 *
 * <p>스레드 안전하지 않음. 인스턴스 하나는 한 스레드에서 한 번만 실행됩니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
final class RepositoryUpdate {

    private static final Logger log = LoggerFactory.getLogger(RepositoryUpdate.class);

    private final RepositoryChangeSet changeSet;
    private final RepositoryPrefix prefix;
    private final ObjectStorage storage;
    private final LeaseLockManager lockManager;
    private final RepositoryCatalog catalog;
    private final MetadataBuilder metadataBuilder;
    private final RepositorySigner signer;
    private final CacheInvalidator cacheInvalidator;
    private final Clock clock;
    private final String holderId;
    private final Deadline deadline;
    private final boolean deletePreviousMetadata;
    private final boolean removeSource;

    private final Map<Integer, ReportEntry> results = new TreeMap<>();
    private final List<String> stagedKeys = new ArrayList<>();
    private final Map<ContentHash, PendingAdd> acceptedAdds = new LinkedHashMap<>();
    private final Map<ContentHash, PendingRemove> acceptedRemoves = new LinkedHashMap<>();
    private UpdateState state = UpdateState.IDLE;
    private LeaseHandle lease;

    RepositoryUpdate(
        RepositoryChangeSet changeSet,
        RepositoryUpdateOrchestrator.Collaborators collaborators,
        Deadline deadline,
        boolean removeSource
    ) {
        this.changeSet = changeSet;
        this.prefix = changeSet.prefix();
        this.storage = collaborators.storage();
        this.lockManager = collaborators.lockManager();
        this.catalog = collaborators.catalog();
        this.metadataBuilder = collaborators.metadataBuilder();
        this.signer = collaborators.signer();
        this.cacheInvalidator = collaborators.cacheInvalidator();
        this.clock = collaborators.clock();
        this.holderId = collaborators.engineId() + "/" + UUID.randomUUID();
        this.deletePreviousMetadata = collaborators.config().deletePreviousMetadata();
        this.deadline = deadline;
        this.removeSource = removeSource;
    }

    /**
     * 업데이트 실행.
     *
     * <p>예외를 던지지 않습니다. 모든 실패는 리포트 항목으로 변환됩니다.</p>
     *
     * @return 리포트 위치 → 항목
     */
    Map<Integer, ReportEntry> run() {
        moveTo(UpdateState.RESOLVING);
        moveTo(UpdateState.LOCKING);
        try {
            lease = lockManager.acquire(prefix, holderId, deadline);
        } catch (RuntimeException e) {
            moveTo(UpdateState.ABORTED);
            log.error("Could not lock repository {}: {}", prefix, e.getMessage());
            failUndecided(Fail.from(e));
            return results;
        }

        moveTo(UpdateState.STAGING);
        try {
            update();
        } catch (RuntimeException e) {
            if (state.requiresRollback()) {
                rollback(e);
            } else {
                // 게시 이후 단계의 예상치 못한 오류: 게시된 상태는 유효함
                log.error("Repository {} failed after publication in {}: {}", prefix, state, e.getMessage(), e);
                release();
                failUndecided(Fail.from(e));
                moveTo(UpdateState.DONE);
            }
        }
        return results;
    }

    private void update() {
        // 1. 현재 상태 읽기 + 항목별 판정
        RepositorySnapshot snapshot = catalog.snapshot(prefix);
        PackageFormat format = plan(snapshot);
        boolean initialize = !snapshot.isInitialized() && format != null
            && (changeSet.isInit() || !acceptedAdds.isEmpty());

        if (acceptedAdds.isEmpty() && acceptedRemoves.isEmpty() && !initialize) {
            log.info("Repository {} is unchanged, nothing to publish", prefix);
            moveTo(UpdateState.RELEASING);
            deleteSources();
            release();
            moveTo(UpdateState.DONE);
            return;
        }

        // 2. 패키지 서명 + 스테이징
        lockManager.renewIfNeeded(lease);
        List<PendingAdd> adds = new ArrayList<>(acceptedAdds.values());
        List<byte[]> signed = signer.signPackages(adds.stream()
            .map(add -> new RepositorySigner.Artifact(add.filename(), add.content()))
            .toList());
        Map<ContentHash, byte[]> stagedContent = new HashMap<>();
        List<IndexedPackage> indexedAdds = new ArrayList<>();
        for (int i = 0; i < adds.size(); i++) {
            PendingAdd add = adds.get(i);
            PackageDescriptor descriptor = add.descriptor();
            String key = prefix.packageKey(descriptor);
            byte[] content = signed.get(i);
            if (key.equals(add.sourceKey())) {
                // 원본이 이미 최종 위치에 업로드됨: 서명본으로 교체
                storage.put(key, content, Precondition.none());
            } else if (!putStaged(key, content)) {
                // 인덱스 체크섬은 실제로 저장된 바이트 기준
                content = storage.get(key).content();
            }
            stagedContent.put(descriptor.contentHash(), content);
            indexedAdds.add(new IndexedPackage(descriptor, key));
        }
        List<IndexedPackage> removedPackages = new ArrayList<>();
        for (ContentHash hash : acceptedRemoves.keySet()) {
            snapshot.findByHash(hash).ifPresent(removedPackages::add);
        }
        deadline.check("STAGING " + prefix);

        // 3. 전체 인덱스 재계산
        moveTo(UpdateState.BUILDING_METADATA);
        PackageContentSource contentSource = indexed -> {
            byte[] staged = stagedContent.get(indexed.contentHash());
            return staged != null ? staged.clone() : storage.get(indexed.objectKey()).content();
        };
        MetadataBuild build = metadataBuilder.build(snapshot, format, indexedAdds, acceptedRemoves.keySet(), contentSource);
        deadline.check("BUILDING_METADATA " + prefix);

        // 4. 매니페스트 서명
        moveTo(UpdateState.SIGNING);
        RepositoryManifest manifest = new RepositoryManifest(
            format.extension(),
            snapshot.metadataVersion() + 1,
            clock.instant(),
            build.manifestComponents()
        );
        byte[] manifestBytes = ManifestCodec.encode(manifest);
        byte[] signature = signer.isEnabled() ? signer.signManifest(manifestBytes) : null;
        deadline.check("SIGNING " + prefix);

        // 5. 컴포넌트 → 서명 → 매니페스트 (마지막)
        moveTo(UpdateState.PUBLISHING);
        for (StagedComponent component : build.components()) {
            if (snapshot.references(component.key())) {
                continue;
            }
            putStaged(component.key(), component.content());
        }
        if (signature != null) {
            putStaged(ManifestCodec.signatureKey(prefix, manifestBytes), signature);
        }
        lockManager.renewIfNeeded(lease);
        deadline.check("PUBLISHING " + prefix);
        publishManifest(snapshot, manifestBytes);
        stagedKeys.clear();
        log.info("Published {} metadata version {} ({} packages, +{} -{})",
            prefix, manifest.metadataVersion(), build.packages().size(), indexedAdds.size(), removedPackages.size());

        // 6. 결과 기록 + 정리 + 해제
        moveTo(UpdateState.RELEASING);
        recordPublished(indexedAdds, removedPackages, manifest);
        cleanup(snapshot, manifest, removedPackages);
        deleteSources();
        invalidateCache();
        release();
        moveTo(UpdateState.DONE);
    }

    /**
     * 스냅샷 기준 항목별 판정.
     *
     * @return 저장소 포맷 (초기화되지 않았고 정할 근거도 없으면 null)
     */
    private PackageFormat plan(RepositorySnapshot snapshot) {
        PackageFormat format = snapshot.format().orElse(null);

        if (changeSet.isInit()) {
            int position = changeSet.initPosition();
            String subject = prefix.getValue();
            if (format == null) {
                format = changeSet.initFormat();
            } else if (format != changeSet.initFormat()) {
                results.put(position, fail(subject, Fail.of(ErrorCode.FORMAT_MISMATCH, String.format(
                    "Repository %s is already initialized with format %s", prefix, format)), List.of()));
            } else {
                results.put(position, ok(subject, new Ok(EntryAction.UNCHANGED, "Repository already initialized"), List.of()));
            }
        }

        Map<String, ContentHash> identities = new HashMap<>();
        for (PendingAdd add : changeSet.adds()) {
            PackageDescriptor descriptor = add.descriptor();
            ContentHash hash = descriptor.contentHash();
            if (format == null) {
                format = descriptor.format();
                log.info("Repository {} is not initialized, initializing it for format {}", prefix, format);
            }
            if (descriptor.format() != format) {
                results.put(add.position(), fail(add.subject(), Fail.of(ErrorCode.FORMAT_MISMATCH, String.format(
                    "Package format %s does not match repository %s format %s", descriptor.format(), prefix, format)),
                    add.warnings()));
                continue;
            }
            if (snapshot.findByHash(hash).isPresent() || acceptedAdds.containsKey(hash)) {
                results.put(add.position(), ok(add.subject(), new Ok(EntryAction.UNCHANGED, "Package already indexed"),
                    add.warnings()));
                continue;
            }
            Optional<IndexedPackage> existing = snapshot.findByIdentity(descriptor.identity());
            ContentHash conflicting = existing.map(IndexedPackage::contentHash).orElse(identities.get(descriptor.identity()));
            if (conflicting != null) {
                results.put(add.position(), fail(add.subject(), Fail.of(ErrorCode.PACKAGE_CONFLICT, String.format(
                    "Package %s already exists in %s with content hash %s",
                    descriptor.identity(), prefix, conflicting.shortValue())), add.warnings()));
                continue;
            }
            acceptedAdds.put(hash, add);
            identities.put(descriptor.identity(), hash);
        }

        for (PendingRemove remove : changeSet.removes()) {
            if (acceptedRemoves.containsKey(remove.hash())) {
                results.put(remove.position(), ok(remove.subject(), new Ok(EntryAction.UNCHANGED, "Duplicate removal request"),
                    List.of()));
            } else if (snapshot.findByHash(remove.hash()).isEmpty()) {
                results.put(remove.position(), fail(remove.subject(), Fail.of(ErrorCode.PACKAGE_NOT_FOUND,
                    "Package " + remove.hash().getValue() + " is not indexed in " + prefix), List.of()));
            } else {
                acceptedRemoves.put(remove.hash(), remove);
            }
        }
        return format;
    }

    /**
     * 콘텐츠 주소 키에 없을 때만 씁니다.
     *
     * <p>이미 있는 오브젝트는 다른 매니페스트가 참조할 수 있으므로 롤백 대상에 넣지 않습니다.
     * 결과가 불확실한 쓰기는 롤백 대상에 남깁니다.</p>
     *
     * @return 새로 썼으면 true, 기존 오브젝트를 재사용하면 false
     */
    private boolean putStaged(String key, byte[] content) {
        stagedKeys.add(key);
        try {
            storage.put(key, content, Precondition.ifAbsent());
            return true;
        } catch (PreconditionFailedException e) {
            stagedKeys.remove(stagedKeys.size() - 1);
            log.debug("Object {} already exists, reusing it", key);
            return false;
        }
    }

    private void publishManifest(RepositorySnapshot snapshot, byte[] manifestBytes) {
        String manifestKey = prefix.manifestKey();
        try {
            storage.put(manifestKey, manifestBytes, Precondition.expecting(snapshot.manifestVersion()));
        } catch (PreconditionFailedException e) {
            if (!manifestEquals(manifestKey, manifestBytes)) {
                throw new RepositoryBusyException(
                    "Manifest of " + prefix + " was changed by another writer while the lease was held", e);
            }
            log.warn("Manifest write for {} was confirmed on re-read", prefix);
        } catch (StorageException e) {
            // 쓰기 결과 불확실: 이미 게시됐다면 롤백하면 안 됨
            if (!manifestEqualsQuietly(manifestKey, manifestBytes)) {
                throw e;
            }
            log.warn("Manifest write for {} reported {} but the manifest is published", prefix, e.getMessage());
        }
    }

    private boolean manifestEqualsQuietly(String manifestKey, byte[] expected) {
        try {
            return manifestEquals(manifestKey, expected);
        } catch (RepoupException e) {
            log.warn("Could not re-read manifest {}: {}", manifestKey, e.getMessage());
            return false;
        }
    }

    private boolean manifestEquals(String manifestKey, byte[] expected) {
        try {
            return Arrays.equals(storage.get(manifestKey).content(), expected);
        } catch (ObjectNotFoundException e) {
            return false;
        }
    }

    private void recordPublished(List<IndexedPackage> indexedAdds, List<IndexedPackage> removedPackages, RepositoryManifest manifest) {
        for (IndexedPackage indexed : indexedAdds) {
            PendingAdd add = acceptedAdds.get(indexed.contentHash());
            results.put(add.position(), ok(add.subject(), new Ok(EntryAction.ADDED, indexed.objectKey()), add.warnings()));
        }
        for (IndexedPackage indexed : removedPackages) {
            PendingRemove remove = acceptedRemoves.get(indexed.contentHash());
            results.put(remove.position(), ok(remove.subject(), new Ok(EntryAction.REMOVED, indexed.objectKey()), List.of()));
        }
        if (changeSet.isInit() && !results.containsKey(changeSet.initPosition())) {
            results.put(changeSet.initPosition(), ok(prefix.getValue(),
                new Ok(EntryAction.INITIALIZED, "metadata version " + manifest.metadataVersion()), List.of()));
        }
    }

    /**
     * 게시 후 더 이상 참조되지 않는 오브젝트 삭제 (best-effort).
     */
    private void cleanup(RepositorySnapshot snapshot, RepositoryManifest manifest, List<IndexedPackage> removedPackages) {
        List<String> obsolete = new ArrayList<>();
        for (IndexedPackage indexed : removedPackages) {
            obsolete.add(indexed.objectKey());
        }
        if (deletePreviousMetadata && snapshot.isInitialized()) {
            Set<String> live = new HashSet<>(manifest.componentKeys());
            for (String key : snapshot.manifest().componentKeys()) {
                if (!live.contains(key)) {
                    obsolete.add(key);
                }
            }
            obsolete.add(ManifestCodec.signatureKey(prefix, snapshot.manifestBytes()));
        }
        for (String key : obsolete) {
            deleteQuietly(key, "obsolete object");
        }
        log.debug("Removed {} obsolete objects from {}", obsolete.size(), prefix);
    }

    private void deleteSources() {
        if (!removeSource) {
            return;
        }
        for (PendingAdd add : changeSet.adds()) {
            ReportEntry entry = results.get(add.position());
            if (add.sourceKey() == null || entry == null || entry.isFailure()) {
                continue;
            }
            if (!add.sourceKey().equals(prefix.packageKey(add.descriptor()))) {
                deleteQuietly(add.sourceKey(), "source object");
            }
        }
    }

    private void invalidateCache() {
        List<String> paths = List.of(prefix.manifestKey(), prefix.metadataKey("*"));
        try {
            cacheInvalidator.invalidate(paths);
        } catch (RuntimeException e) {
            log.warn("Cache invalidation failed for {}: {}", paths, e.getMessage());
        }
    }

    private void rollback(RuntimeException cause) {
        log.error("Update of {} failed during {}: {}", prefix, state, cause.getMessage(), cause);
        moveTo(UpdateState.FAILING);
        List<String> keys = rollbackCandidates(new ArrayList<>(stagedKeys));
        for (int i = keys.size() - 1; i >= 0; i--) {
            deleteQuietly(keys.get(i), "staged object");
        }
        log.warn("Rolled back {} of {} staged objects in {}", keys.size(), stagedKeys.size(), prefix);
        stagedKeys.clear();
        release();
        moveTo(UpdateState.ROLLED_BACK);
        failUndecided(Fail.from(cause));
    }

    /**
     * 삭제해도 되는 스테이징 키.
     *
     * <p>lease를 잃었으면 다른 보유자가 같은 콘텐츠 주소 키를 게시했을 수 있으므로 아무것도 지우지 않습니다.
     * lease를 보유 중이어도 현재 게시된 매니페스트가 참조하는 키는 제외합니다.
     * 남겨진 오브젝트는 참조되지 않을 뿐 리더에게는 보이지 않습니다.</p>
     */
    private List<String> rollbackCandidates(List<String> keys) {
        if (keys.isEmpty()) {
            return keys;
        }
        if (lease == null || !lockManager.isStillHeld(lease)) {
            log.warn("Lease on {} is no longer held, leaving {} staged objects in place", prefix, keys.size());
            return List.of();
        }
        Set<String> live;
        try {
            live = liveKeys(catalog.snapshot(prefix));
        } catch (RepoupException e) {
            log.warn("Could not re-read manifest of {} before rollback, leaving {} staged objects in place: {}",
                prefix, keys.size(), e.getMessage());
            return List.of();
        }
        List<String> deletable = new ArrayList<>();
        for (String key : keys) {
            if (live.contains(key)) {
                log.warn("Staged object {} is referenced by the published manifest, keeping it", key);
            } else {
                deletable.add(key);
            }
        }
        return deletable;
    }

    private Set<String> liveKeys(RepositorySnapshot current) {
        Set<String> live = new HashSet<>();
        if (!current.isInitialized()) {
            return live;
        }
        live.addAll(current.manifest().componentKeys());
        for (IndexedPackage indexed : current.packages()) {
            live.add(indexed.objectKey());
        }
        live.add(ManifestCodec.signatureKey(prefix, current.manifestBytes()));
        return live;
    }

    private void release() {
        if (lease != null && lease.isHeld()) {
            lockManager.release(lease);
        }
    }

    private void deleteQuietly(String key, String what) {
        try {
            storage.delete(key);
        } catch (RepoupException e) {
            log.warn("Failed to delete {} {}: {}", what, key, e.getMessage());
        }
    }

    /**
     * 아직 결과가 없는 모든 항목을 실패로 기록.
     */
    private void failUndecided(Fail fail) {
        for (PendingAdd add : changeSet.adds()) {
            results.putIfAbsent(add.position(), fail(add.subject(), fail, add.warnings()));
        }
        for (PendingRemove remove : changeSet.removes()) {
            results.putIfAbsent(remove.position(), fail(remove.subject(), fail, List.of()));
        }
        if (changeSet.isInit()) {
            results.putIfAbsent(changeSet.initPosition(), fail(prefix.getValue(), fail, List.of()));
        }
    }

    private ReportEntry ok(String subject, Ok ok, List<String> warnings) {
        return ReportEntry.ok(subject, prefix, ok, warnings);
    }

    private ReportEntry fail(String subject, Fail fail, List<String> warnings) {
        return ReportEntry.fail(subject, prefix, fail, warnings);
    }

    private void moveTo(UpdateState next) {
        UpdateState previous = state;
        state = StateTransition.transition(state, next);
        log.info("Repository {}: {} → {}", prefix, previous, next);
    }

    UpdateState getState() {
        return state;
    }
}
