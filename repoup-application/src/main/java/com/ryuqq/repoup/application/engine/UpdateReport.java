package com.ryuqq.repoup.application.engine;

import com.ryuqq.repoup.core.model.RepositoryPrefix;
import com.ryuqq.repoup.core.outcome.Fail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 엔진 호출 결과 보고서.
 *
 * <p>입력 패키지/저장소 쌍마다 하나의 {@link ReportEntry}를 가집니다.
 * 종료 코드는 하나라도 실패한 항목이 있으면 1이며, 부분 성공을 가리지 않습니다.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public final class UpdateReport {

    private final List<ReportEntry> entries;

    private UpdateReport(List<ReportEntry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public static UpdateReport of(List<ReportEntry> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        return new UpdateReport(entries);
    }

    public static UpdateReport empty() {
        return new UpdateReport(List.of());
    }

    public List<ReportEntry> getEntries() {
        return entries;
    }

    public boolean hasFailures() {
        return entries.stream().anyMatch(ReportEntry::isFailure);
    }

    public List<ReportEntry> failures() {
        return entries.stream().filter(ReportEntry::isFailure).toList();
    }

    /**
     * 특정 저장소에 대한 항목 조회.
     *
     * @param repository 저장소 prefix
     * @return 해당 저장소 항목
     */
    public List<ReportEntry> entriesFor(RepositoryPrefix repository) {
        return entries.stream().filter(entry -> Objects.equals(entry.repository(), repository)).toList();
    }

    /**
     * 프로세스 종료 코드.
     *
     * @return 실패 항목이 있으면 1, 아니면 0
     */
    public int exitStatus() {
        return hasFailures() ? 1 : 0;
    }

    /**
     * 한 줄 요약 (로그용).
     *
     * @return 요약 문자열
     */
    public String summary() {
        long failed = entries.stream().filter(ReportEntry::isFailure).count();
        return String.format("%d entries, %d ok, %d failed", entries.size(), entries.size() - failed, failed);
    }

    /**
     * 실패 항목의 첫 번째 Fail (없으면 null).
     *
     * @return 첫 번째 Fail 또는 null
     */
    public Fail firstFailureOrNull() {
        return entries.stream()
            .filter(ReportEntry::isFailure)
            .map(entry -> (Fail) entry.outcome())
            .findFirst()
            .orElse(null);
    }

    @Override
    public String toString() {
        return "UpdateReport{" + summary() + ", entries=" + entries + "}";
    }
}
