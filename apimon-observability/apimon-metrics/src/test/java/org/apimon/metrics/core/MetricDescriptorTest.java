// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class MetricDescriptorTest {

    @Test
    void testEqualDescriptors() {
        MetricDescriptor d1 = new MetricDescriptor("m", MetricType.COUNTER, "help", List.of("a", "b"), List.of());
        MetricDescriptor d2 = new MetricDescriptor("m", MetricType.COUNTER, "help", List.of("a", "b"), List.of());

        assertThat(d1).isEqualTo(d2).hasSameHashCodeAs(d2);
    }

    @Test
    void testLabelOrderMatters() {
        MetricDescriptor d1 = new MetricDescriptor("m", MetricType.COUNTER, "", List.of("a", "b"), List.of());
        MetricDescriptor d2 = new MetricDescriptor("m", MetricType.COUNTER, "", List.of("b", "a"), List.of());

        assertThat(d1).isNotEqualTo(d2);
    }

    @Test
    void testHistogramBucketsNormalized() {
        MetricDescriptor d1 = new MetricDescriptor(
                "h", MetricType.HISTOGRAM, "", List.of(), List.of(0.1, 1.0, Double.POSITIVE_INFINITY));
        MetricDescriptor d2 = new MetricDescriptor("h", MetricType.HISTOGRAM, "", List.of(), List.of(0.1, 1.0));

        assertThat(d1).isEqualTo(d2);
        assertThat(d1.bucketBounds()).containsExactly(0.1, 1.0);
    }

    @ParameterizedTest
    @ValueSource(strings = {"1abc", "with-dash", "with space", "with:colon", "ümlaut"})
    void testInvalidMetricNameThrows(String name) {
        assertThatThrownBy(() -> new MetricDescriptor(name, MetricType.GAUGE, "", List.of(), List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("illegal character");
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "_private", "http_requests_total", "A1_b2"})
    void testValidMetricName(String name) {
        assertThat(new MetricDescriptor(name, MetricType.GAUGE, "", List.of(), List.of()).name())
                .isEqualTo(name);
    }

    @Test
    void testBlankNameThrows() {
        assertThatThrownBy(() -> new MetricDescriptor(" ", MetricType.GAUGE, "", List.of(), List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("metric name cannot be blank");
    }

    @Test
    void testDuplicateLabelNamesThrow() {
        assertThatThrownBy(() -> new MetricDescriptor("m", MetricType.GAUGE, "", List.of("a", "a"), List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Duplicate label name: a");
    }

    @Test
    void testLabelEqualToMetricNameThrows() {
        assertThatThrownBy(() -> new MetricDescriptor("m", MetricType.GAUGE, "", List.of("m"), List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("same as metric name");
    }

    @Test
    void testBucketsOnNonHistogramThrow() {
        assertThatThrownBy(() -> new MetricDescriptor("m", MetricType.GAUGE, "", List.of(), List.of(1.0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("only allowed for histograms");
    }

    @Test
    void testNullHelpThrows() {
        assertThatThrownBy(() -> new MetricDescriptor("m", MetricType.GAUGE, null, List.of(), List.of()))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("help must not be null");
    }
}
