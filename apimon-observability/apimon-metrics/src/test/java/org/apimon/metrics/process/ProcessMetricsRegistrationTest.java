// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.process;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.apimon.metrics.core.MeasurementSnapshot;
import org.apimon.metrics.core.Metric;
import org.apimon.metrics.core.MetricRegistry;
import org.apimon.metrics.core.MetricRegistrySnapshot;
import org.apimon.metrics.core.MetricSnapshot;
import org.apimon.metrics.core.MetricType;
import org.apimon.metrics.core.ValueMeasurementSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProcessMetricsRegistrationTest {

    @TempDir
    Path tempDir;

    private static MetricRegistry registryWith(ProcessMetricsRegistration registration) {
        MetricRegistry registry = MetricRegistry.builder().withoutProcessMetrics().build();
        for (Metric.Builder<?, ?> builder : registration.getMetricsToRegister()) {
            registry.register(builder);
        }
        return registry;
    }

    private static double singleValue(MetricRegistrySnapshot snapshot, String name) {
        MetricSnapshot metric = snapshot.find(name).orElseThrow();
        assertThat(metric.measurements()).hasSize(1);
        return ((ValueMeasurementSnapshot) metric.measurements().get(0)).value();
    }

    @Test
    void testMemoryMetricsFromStatusFile() throws IOException {
        Path status = Files.writeString(tempDir.resolve("status"), ProcStatusReaderTest.STATUS);

        MetricRegistrySnapshot snapshot = registryWith(new ProcessMetricsRegistration(status)).snapshot();

        assertThat(singleValue(snapshot, "process_resident_memory_bytes")).isEqualTo(10240.0 * 1024);
        assertThat(singleValue(snapshot, "process_virtual_memory_bytes")).isEqualTo(3000000.0 * 1024);
    }

    @Test
    void testMemoryMetricsSkippedWithoutStatusFile() {
        MetricRegistrySnapshot snapshot =
                registryWith(new ProcessMetricsRegistration(tempDir.resolve("absent"))).snapshot();

        assertThat(snapshot.find("process_resident_memory_bytes")).isEmpty();
        assertThat(snapshot.find("process_virtual_memory_bytes")).isEmpty();
        assertThat(snapshot.find("process_start_time_seconds")).isPresent();
    }

    @Test
    void testStartTimeAndRuntimeInfo() {
        MetricRegistrySnapshot snapshot =
                registryWith(new ProcessMetricsRegistration(tempDir.resolve("absent"))).snapshot();

        double startTime = singleValue(snapshot, "process_start_time_seconds");
        assertThat(startTime).isPositive().isLessThanOrEqualTo(System.currentTimeMillis() / 1000.0);

        MetricSnapshot info = snapshot.find("jvm_info").orElseThrow();
        assertThat(info.type()).isEqualTo(MetricType.GAUGE);
        assertThat(info.descriptor().labelNames()).containsExactly("version", "vendor", "runtime");
        assertThat(((ValueMeasurementSnapshot) info.measurements().get(0)).value()).isEqualTo(1.0);
    }

    @Test
    void testCpuAndGcCountersAreNonNegative() {
        MetricRegistrySnapshot snapshot = registryWith(new ProcessMetricsRegistration()).snapshot();

        snapshot.find("process_cpu_seconds_total").ifPresent(cpu -> {
            assertThat(cpu.type()).isEqualTo(MetricType.COUNTER);
            assertThat(((ValueMeasurementSnapshot) cpu.measurements().get(0)).value())
                    .isGreaterThanOrEqualTo(0.0);
        });
        snapshot.find("jvm_gc_collections_total").ifPresent(gc -> gc.forEach(m -> assertThat(
                        ((ValueMeasurementSnapshot) m).value())
                .isGreaterThanOrEqualTo(0.0)));
    }

    @Test
    void testGcFamiliesHaveOneSeriesPerCollector() {
        List<String> collectors = ManagementFactory.getGarbageCollectorMXBeans().stream()
                .map(GarbageCollectorMXBean::getName)
                .collect(Collectors.toList());
        MetricRegistrySnapshot snapshot =
                registryWith(new ProcessMetricsRegistration(tempDir.resolve("absent"))).snapshot();

        for (String name : List.of("jvm_gc_collections_total", "jvm_gc_collection_seconds_total")) {
            if (collectors.isEmpty()) {
                assertThat(snapshot.find(name)).isEmpty();
                continue;
            }
            MetricSnapshot gc = snapshot.find(name).orElseThrow();
            assertThat(gc.type()).isEqualTo(MetricType.COUNTER);
            assertThat(gc.descriptor().labelNames()).containsExactly("gc");
            assertThat(gc.measurements().stream()
                            .map(MeasurementSnapshot::labelValues)
                            .map(labels -> labels.get(0))
                            .collect(Collectors.toList()))
                    .containsExactlyElementsOf(collectors);
        }
    }
}
