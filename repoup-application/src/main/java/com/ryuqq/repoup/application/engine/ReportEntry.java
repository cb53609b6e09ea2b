package com.ryuqq.repoup.application.engine;

import com.ryuqq.repoup.core.model.RepositoryPrefix;
import com.ryuqq.repoup.core.outcome.Fail;
import com.ryuqq.repoup.core.outcome.Ok;
import com.ryuqq.repoup.core.outcome.Outcome;

import java.util.List;

/**
 * 보고서 항목 - 입력 패키지(또는 저장소) 하나의 처리 결과.
 *
 * @author Repoup Team
 * @since 1.0.0
 * @param subject 입력 식별자 (파일 이름, 오브젝트 키, 콘텐츠 해시 또는 prefix)
 * @param repository 결정된 저장소 (RESOLVING 실패 시 null)
 * @param outcome 처리 결과 (Ok 또는 Fail)
 * @param warnings 비치명적 경고 (예: DescriptorMismatch)
 */
public record ReportEntry(
    String subject,
    RepositoryPrefix repository,
    Outcome outcome,
    List<String> warnings
) {

    public ReportEntry {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject cannot be null or blank");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ReportEntry ok(String subject, RepositoryPrefix repository, Ok ok, List<String> warnings) {
        return new ReportEntry(subject, repository, ok, warnings);
    }

    public static ReportEntry fail(String subject, RepositoryPrefix repository, Fail fail, List<String> warnings) {
        return new ReportEntry(subject, repository, fail, warnings);
    }

    public boolean isFailure() {
        return outcome.isFail();
    }

    /**
     * 이 항목의 결과를 다른 Outcome으로 교체한 사본.
     *
     * @param replacement 새 결과
     * @return 새 ReportEntry
     */
    public ReportEntry withOutcome(Outcome replacement) {
        return new ReportEntry(subject, repository, replacement, warnings);
    }
}
