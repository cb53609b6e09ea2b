package com.ryuqq.repoup.adapter.runner.storage;

import com.ryuqq.repoup.adapter.runner.BackoffCalculator;
import com.ryuqq.repoup.core.error.ObjectNotFoundException;
import com.ryuqq.repoup.core.error.PreconditionFailedException;
import com.ryuqq.repoup.core.error.StorageException;
import com.ryuqq.repoup.core.spi.ObjectStorage;
import com.ryuqq.repoup.core.spi.Precondition;
import com.ryuqq.repoup.core.spi.StoredObject;
import com.ryuqq.repoup.core.spi.VersionToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * RetryingObjectStorage 유닛 테스트.
 *
 * <p>StorageException만 재시도하고, 조건부 쓰기 실패와 NotFound는 그대로 전달하는지 검증합니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RetryingObjectStorageTest {

    @Mock
    private ObjectStorage delegate;

    private RetryingObjectStorage storage;

    @BeforeEach
    void setUp() {
        StorageRetryConfig config = new StorageRetryConfig().withMaxAttempts(3);
        storage = new RetryingObjectStorage(delegate, config, new BackoffCalculator(1, 2, 0.0));
    }

    @Test
    void 일시_오류_후_성공하면_결과_반환() {
        // given
        StoredObject stored = new StoredObject("a/metadata/manifest", new byte[]{1}, VersionToken.of("v1"));
        when(delegate.get("a/metadata/manifest"))
            .thenThrow(new StorageException("503"))
            .thenThrow(new StorageException("503"))
            .thenReturn(stored);

        // when
        StoredObject result = storage.get("a/metadata/manifest");

        // then
        assertThat(result).isSameAs(stored);
        verify(delegate, times(3)).get("a/metadata/manifest");
    }

    @Test
    void 재시도_한도_소진_시_마지막_예외_전달() {
        // given
        when(delegate.put(eq("a/packages/x.rpm"), any(), any()))
            .thenThrow(new StorageException("timeout"));

        // when & then
        assertThatThrownBy(() -> storage.put("a/packages/x.rpm", new byte[]{1}, Precondition.none()))
            .isInstanceOf(StorageException.class)
            .hasMessage("timeout");
        verify(delegate, times(3)).put(eq("a/packages/x.rpm"), any(), any());
    }

    @Test
    void 조건부_쓰기_실패는_재시도하지_않음() {
        // given
        when(delegate.put(eq("a/lock"), any(), any()))
            .thenThrow(new PreconditionFailedException("a/lock", "exists"));

        // when & then
        assertThatThrownBy(() -> storage.put("a/lock", new byte[]{1}, Precondition.ifAbsent()))
            .isInstanceOf(PreconditionFailedException.class);
        verify(delegate, times(1)).put(eq("a/lock"), any(), any());
    }

    @Test
    void NotFound는_재시도하지_않음() {
        // given
        when(delegate.get("missing")).thenThrow(new ObjectNotFoundException("missing"));

        // when & then
        assertThatThrownBy(() -> storage.get("missing"))
            .isInstanceOf(ObjectNotFoundException.class);
        verify(delegate, times(1)).get("missing");
    }

    @Test
    void delete와_list도_재시도() {
        // given
        doThrow(new StorageException("reset")).doNothing().when(delegate).delete("a/lock");
        when(delegate.list("a/"))
            .thenThrow(new StorageException("reset"))
            .thenReturn(List.of("a/lock"));

        // when
        storage.delete("a/lock");
        List<String> keys = storage.list("a/");

        // then
        assertThat(keys).containsExactly("a/lock");
        verify(delegate, times(2)).delete("a/lock");
        verify(delegate, times(2)).list("a/");
    }

    @Test
    void 잘못된_설정은_예외() {
        assertThatThrownBy(() -> new StorageRetryConfig(0, 100, 200, 0.1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryingObjectStorage(null, new StorageRetryConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("delegate");
    }
}
