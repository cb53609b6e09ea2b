package com.ryuqq.repoup.application.engine;

import com.ryuqq.repoup.core.error.ErrorCode;
import com.ryuqq.repoup.core.model.RepositoryPrefix;
import com.ryuqq.repoup.core.outcome.EntryAction;
import com.ryuqq.repoup.core.outcome.Fail;
import com.ryuqq.repoup.core.outcome.Ok;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * UpdateReport / UpdateOptions 유닛 테스트.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
class UpdateReportTest {

    private static final RepositoryPrefix ARM = RepositoryPrefix.of("/arm");
    private static final RepositoryPrefix DEFAULT = RepositoryPrefix.of("/default");

    @Test
    void 모두_성공하면_exitStatus_0() {
        // given
        UpdateReport report = UpdateReport.of(List.of(
            ReportEntry.ok("a.rpm", ARM, Ok.of(EntryAction.ADDED), List.of()),
            ReportEntry.ok("b.rpm", DEFAULT, Ok.of(EntryAction.UNCHANGED), List.of("arch differs"))
        ));

        // then
        assertThat(report.hasFailures()).isFalse();
        assertThat(report.exitStatus()).isZero();
        assertThat(report.summary()).isEqualTo("2 entries, 2 ok, 0 failed");
        assertThat(report.firstFailureOrNull()).isNull();
    }

    @Test
    void 부분_실패는_exitStatus_1이고_성공_항목_유지() {
        // given
        UpdateReport report = UpdateReport.of(List.of(
            ReportEntry.ok("a.rpm", ARM, Ok.of(EntryAction.ADDED), List.of()),
            ReportEntry.fail("b.rpm", DEFAULT, Fail.of(ErrorCode.REPOSITORY_BUSY, "busy"), List.of())
        ));

        // then
        assertThat(report.hasFailures()).isTrue();
        assertThat(report.exitStatus()).isEqualTo(1);
        assertThat(report.failures()).extracting(ReportEntry::subject).containsExactly("b.rpm");
        assertThat(report.entriesFor(RepositoryPrefix.of("arm"))).hasSize(1);
        assertThat(report.firstFailureOrNull().errorCode()).isEqualTo(ErrorCode.REPOSITORY_BUSY);
    }

    @Test
    void 빈_보고서는_성공() {
        assertThat(UpdateReport.empty().exitStatus()).isZero();
    }

    @Test
    void UpdateOptions_기본값과_복사() {
        UpdateOptions options = UpdateOptions.defaults()
            .withBestEffort(true)
            .withDeadline(Duration.ofSeconds(30))
            .withVariables(Map.of("channel", "stable"));

        assertThat(options.bestEffort()).isTrue();
        assertThat(options.removeSource()).isFalse();
        assertThat(options.deadline()).isEqualTo(Duration.ofSeconds(30));
        assertThat(options.variables()).containsEntry("channel", "stable");
    }

    @Test
    void UpdateOptions_음수_deadline_거부() {
        assertThatThrownBy(() -> UpdateOptions.defaults().withDeadline(Duration.ofSeconds(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("deadline");
    }
}
