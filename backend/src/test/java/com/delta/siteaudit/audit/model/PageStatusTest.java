package com.delta.siteaudit.audit.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PageStatusTest {

    @Test
    void derivesStatusForEveryCombinationOfThreeChecks() {
        CheckKind[] kinds = CheckKind.values();
        for (int mask = 0; mask < 8; mask++) {
            List<CheckOutcome> outcomes = new ArrayList<>();
            int successes = 0;
            for (int i = 0; i < kinds.length; i++) {
                if ((mask & (1 << i)) != 0) {
                    outcomes.add(success(kinds[i]));
                    successes++;
                } else if (i % 2 == 0) {
                    outcomes.add(CheckOutcome.error(kinds[i], "boom", Duration.ZERO));
                } else {
                    outcomes.add(CheckOutcome.timeout(kinds[i], "slow", Duration.ZERO));
                }
            }

            PageStatus expected = successes == 3 ? PageStatus.SUCCESS
                : successes == 0 ? PageStatus.FAILED
                : PageStatus.PARTIAL;
            assertThat(PageStatus.derive(outcomes)).as("mask %s", mask).isEqualTo(expected);
        }
    }

    @Test
    void noOutcomesMeansFailed() {
        assertThat(PageStatus.derive(List.of())).isEqualTo(PageStatus.FAILED);
    }

    private static CheckOutcome success(CheckKind kind) {
        if (kind == CheckKind.STRUCTURAL) {
            return CheckOutcome.success(StructuralReport.of(List.of()), Duration.ZERO);
        }
        if (kind == CheckKind.PERFORMANCE) {
            return CheckOutcome.success(new PerformanceReport(80, List.of()), Duration.ZERO);
        }
        return CheckOutcome.success(BotAccessReport.of(List.of()), Duration.ZERO);
    }
}
