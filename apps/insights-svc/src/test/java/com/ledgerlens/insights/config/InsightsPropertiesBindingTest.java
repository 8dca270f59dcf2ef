package com.ledgerlens.insights.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "insights.anomaly.frequency-threshold24h=4",
        "insights.recurring.confidence-threshold=0.75"
})
class InsightsPropertiesBindingTest {

    @Autowired
    InsightsProperties properties;

    @Test
    void bindsApplicationConfigurationWithOverrides() {
        assertThat(properties.anomaly().frequencyThreshold24h()).isEqualTo(4);
        assertThat(properties.anomaly().frequencyThreshold7d()).isEqualTo(5);
        assertThat(properties.recurring().confidenceThreshold()).isEqualTo(0.75);
        assertThat(properties.recurring().intervalToleranceDays()).isEqualTo(7);
    }
}
