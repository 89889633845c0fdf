package com.eyelevel.batchorchestrator.model;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class PlanKeyTest {

    @ParameterizedTest
    @CsvSource({
            "free, FREE",
            "Personal, PERSONAL",
            "PRO, PRO",
            "professional, PRO",
            "enterprise, ENTERPRISE",
            "个人版, PERSONAL",
            "专业版, PRO",
            "企业版, ENTERPRISE",
            "免费版, FREE",
            "Pro Annual, PRO",
            "Enterprise (legacy), ENTERPRISE"
    })
    void normalizesKnownLabels(String raw, PlanKey expected) {
        assertThat(PlanKey.fromValue(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"gold", "  "})
    void unknownPlansFallBackToFree(String raw) {
        assertThat(PlanKey.fromValue(raw)).isEqualTo(PlanKey.FREE);
    }
}
