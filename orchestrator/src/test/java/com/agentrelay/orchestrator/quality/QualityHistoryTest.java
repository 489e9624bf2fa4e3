package com.agentrelay.orchestrator.quality;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QualityHistoryTest {

    private static QualityMetrics scored(double overall, QualityLevel level) {
        return new QualityMetrics(overall, overall, overall, overall, overall, overall, overall,
                0, false, 0, 0,
                10, 1, 1,
                overall, level, List.of(), List.of());
    }

    @Test
    void record_atCapacity_evictsOldestEntry() {
        QualityHistory history = new QualityHistory(1000);
        QualityMetrics oldest = QualityMetrics.failed("first");
        history.record(ContentType.OPTIMIZATION, oldest);
        for (int i = 0; i < 1000; i++) {
            history.record(ContentType.OPTIMIZATION, scored(0.95, QualityLevel.EXCELLENT));
        }

        assertThat(history.size(ContentType.OPTIMIZATION)).isEqualTo(1000);
        List<QualityMetrics> all = history.recent(ContentType.OPTIMIZATION, 1000);
        assertThat(all).hasSize(1000).doesNotContain(oldest);

        QualityStats stats = history.stats(ContentType.OPTIMIZATION, 1000);
        assertThat(stats.count()).isEqualTo(1000);
        assertThat(stats.minScore()).isEqualTo(0.95);
        assertThat(stats.qualityDistribution())
                .containsEntry(QualityLevel.EXCELLENT, 1000)
                .doesNotContainKey(QualityLevel.UNACCEPTABLE);
    }

    @Test
    void record_belowCapacity_keepsEverythingInOrder() {
        QualityHistory history = new QualityHistory(3);
        QualityMetrics a = scored(0.2, QualityLevel.UNACCEPTABLE);
        QualityMetrics b = scored(0.6, QualityLevel.ACCEPTABLE);
        QualityMetrics c = scored(0.8, QualityLevel.GOOD);
        QualityMetrics d = scored(0.95, QualityLevel.EXCELLENT);

        history.record(ContentType.REPORT, a);
        history.record(ContentType.REPORT, b);
        history.record(ContentType.REPORT, c);
        assertThat(history.recent(ContentType.REPORT, 10)).containsExactly(a, b, c);

        history.record(ContentType.REPORT, d);
        assertThat(history.recent(ContentType.REPORT, 10)).containsExactly(b, c, d);
        assertThat(history.recent(ContentType.REPORT, 2)).containsExactly(c, d);
        assertThat(history.size(ContentType.TRIAGE)).isZero();
    }
}
