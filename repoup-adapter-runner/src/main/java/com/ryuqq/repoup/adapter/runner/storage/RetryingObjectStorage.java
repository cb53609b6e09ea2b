package com.ryuqq.repoup.adapter.runner.storage;

import com.ryuqq.repoup.adapter.runner.BackoffCalculator;
import com.ryuqq.repoup.core.error.StorageException;
import com.ryuqq.repoup.core.spi.ObjectStorage;
import com.ryuqq.repoup.core.spi.Precondition;
import com.ryuqq.repoup.core.spi.StoredObject;
import com.ryuqq.repoup.core.spi.VersionToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * 일시적 스토리지 오류를 재시도하는 {@link ObjectStorage} 데코레이터.
 *
 * <p>{@link StorageException}만 재시도합니다. PreconditionFailed와 ObjectNotFound는
 * 재시도 대상이 아니며 즉시 전파됩니다. 한도를 넘으면 마지막 StorageException이
 * 그대로 전파되어 치명적 오류로 분류됩니다.</p>
 *
 * <p>응답이 유실된 조건부 put을 재시도하면 첫 시도가 이미 성공한 경우
 * PreconditionFailed가 날 수 있습니다. 호출자(lease 관리자, 매니페스트 게시)는
 * 오브젝트를 다시 읽어 자신의 쓰기인지 확인합니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class RetryingObjectStorage implements ObjectStorage {

    private static final Logger log = LoggerFactory.getLogger(RetryingObjectStorage.class);

    private final ObjectStorage delegate;
    private final StorageRetryConfig config;
    private final BackoffCalculator backoffCalculator;

    public RetryingObjectStorage(ObjectStorage delegate, StorageRetryConfig config) {
        this(delegate, config, config == null ? null : config.backoffCalculator());
    }

    /**
     * 생성자 (커스텀 BackoffCalculator 주입).
     *
     * @param delegate 실제 스토리지
     * @param config 재시도 설정
     * @param backoffCalculator 재시도 backoff
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryingObjectStorage(ObjectStorage delegate, StorageRetryConfig config, BackoffCalculator backoffCalculator) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.delegate = delegate;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
    }

    @Override
    public StoredObject get(String key) {
        return withRetry("get " + key, () -> delegate.get(key));
    }

    @Override
    public VersionToken put(String key, byte[] content, Precondition precondition) {
        return withRetry("put " + key, () -> delegate.put(key, content, precondition));
    }

    @Override
    public void delete(String key) {
        withRetry("delete " + key, () -> {
            delegate.delete(key);
            return null;
        });
    }

    @Override
    public List<String> list(String prefix) {
        return withRetry("list " + prefix, () -> delegate.list(prefix));
    }

    public ObjectStorage getDelegate() {
        return delegate;
    }

    private <T> T withRetry(String operation, Supplier<T> call) {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (StorageException e) {
                if (attempt >= config.maxAttempts()) {
                    log.error("Storage operation failed after {} attempts: {}", attempt, operation);
                    throw e;
                }
                long delay = backoffCalculator.calculate(attempt);
                log.warn("Transient storage error on {} (attempt {}/{}), retrying in {}ms: {}",
                    operation, attempt, config.maxAttempts(), delay, e.getMessage());
                sleep(delay, operation, e);
            }
        }
    }

    private static void sleep(long millis, String operation, StorageException cause) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            StorageException interrupted = new StorageException("Interrupted while retrying " + operation, e);
            interrupted.addSuppressed(cause);
            throw interrupted;
        }
    }
}
