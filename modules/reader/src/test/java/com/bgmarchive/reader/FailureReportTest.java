package com.bgmarchive.reader;

import com.bgmarchive.reader.stream.RecordFailure;
import com.bgmarchive.schema.decode.DecodeFailure;
import com.bgmarchive.schema.decode.FailureKind;
import com.bgmarchive.schema.registry.EntityType;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class FailureReportTest {

    @Test
    void shouldSummarizeFailuresPerEntity() {
        Map<EntityType, List<RecordFailure>> failures = new EnumMap<>(EntityType.class);
        failures.put(EntityType.EPISODE, List.of(
                failure(EntityType.EPISODE, 1, "999"),
                failure(EntityType.EPISODE, 4, "1000"),
                failure(EntityType.EPISODE, 9, "999")));
        failures.put(EntityType.PERSON, List.of(failure(EntityType.PERSON, 0, null)));
        failures.put(EntityType.SUBJECT, List.of());

        FailureReport report = FailureReport.of(failures);

        assertThat(report.totalFailures()).isEqualTo(4);
        assertThat(report.isEmpty()).isFalse();
        assertThat(report.asMap()).containsOnlyKeys(EntityType.PERSON, EntityType.EPISODE);
        assertThat(report.first(EntityType.EPISODE, 2)).extracting(RecordFailure::lineNumber)
                .containsExactly(1L, 4L);
        assertThat(report.first(EntityType.EPISODE, 10)).hasSize(3);
        assertThat(report.distinctOffendingValues(EntityType.EPISODE)).containsExactly("999", "1000");
        assertThat(report.distinctOffendingValues(EntityType.PERSON)).isEmpty();
        assertThat(report.failures(EntityType.CHARACTER)).isEmpty();
    }

    @Test
    void emptyReportShouldHaveNoFailures() {
        FailureReport report = FailureReport.of(Map.of());

        assertThat(report).isSameAs(FailureReport.empty());
        assertThat(report.isEmpty()).isTrue();
        assertThat(report.totalFailures()).isZero();
    }

    @Test
    void shouldRejectNegativeLimit() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> FailureReport.empty().first(EntityType.SUBJECT, -1));
    }

    private static RecordFailure failure(EntityType type, long line, String value) {
        return new RecordFailure(type, type.memberName(), line,
                new DecodeFailure(FailureKind.UNKNOWN_ENUM_VALUE, "type", value, "bad code"));
    }
}
