// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.process;

import com.sun.management.UnixOperatingSystemMXBean;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.RuntimeMXBean;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.apimon.metrics.ObservableMetric;
import org.apimon.metrics.core.Metric;
import org.apimon.metrics.core.MetricUtils;
import org.apimon.metrics.core.MetricsRegistrationProvider;

/**
 * A {@link MetricsRegistrationProvider} that registers standard process and runtime metrics: CPU time,
 * memory, file descriptors, start time, garbage collections and runtime information.
 * <p>
 * All values are read by callbacks when metrics are rendered. Metrics the platform can't provide are not
 * registered at all, e.g. memory metrics when {@code /proc/self/status} is not readable.
 */
public final class ProcessMetricsRegistration implements MetricsRegistrationProvider {

    private static final String GC_LABEL = "gc";

    private final Path statusFile;

    public ProcessMetricsRegistration() {
        this(ProcStatusReader.SELF_STATUS);
    }

    ProcessMetricsRegistration(@NonNull Path statusFile) {
        this.statusFile = statusFile;
    }

    @NonNull
    @Override
    public Collection<Metric.Builder<?, ?>> getMetricsToRegister() {
        Collection<Metric.Builder<?, ?>> builders = new ArrayList<>();

        final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();
        final RuntimeMXBean runtimeBean = ManagementFactory.getRuntimeMXBean();

        if (osBean instanceof com.sun.management.OperatingSystemMXBean mBean) {
            builders.add(ObservableMetric.counterBuilder("process_cpu_seconds_total")
                    .setHelp("Total user and system CPU time spent in seconds.")
                    .observe(() -> MetricUtils.nanosToSeconds(Math.max(0L, mBean.getProcessCpuTime()))));
        }

        final ProcStatusReader statusReader = new ProcStatusReader(statusFile);
        if (statusReader.isAvailable()) {
            builders.add(ObservableMetric.gaugeBuilder("process_virtual_memory_bytes")
                    .setHelp("Virtual memory size in bytes.")
                    .observe(() -> statusReader.readBytes(ProcStatusReader.VIRTUAL_MEMORY)));
            builders.add(ObservableMetric.gaugeBuilder("process_resident_memory_bytes")
                    .setHelp("Resident memory size in bytes.")
                    .observe(() -> statusReader.readBytes(ProcStatusReader.RESIDENT_MEMORY)));
        }

        builders.add(ObservableMetric.gaugeBuilder("process_start_time_seconds")
                .setHelp("Start time of the process since unix epoch in seconds.")
                .observe(() -> runtimeBean.getStartTime() / 1000.0));

        if (osBean instanceof UnixOperatingSystemMXBean mBean) {
            builders.add(ObservableMetric.gaugeBuilder("process_open_fds")
                    .setHelp("Number of open file descriptors.")
                    .observe(mBean::getOpenFileDescriptorCount));
            builders.add(ObservableMetric.gaugeBuilder("process_max_fds")
                    .setHelp("Maximum number of open file descriptors.")
                    .observe(mBean::getMaxFileDescriptorCount));
        }

        // the only labeled process families: one series per collector
        final List<GarbageCollectorMXBean> gcBeans = ManagementFactory.getGarbageCollectorMXBeans();
        if (!gcBeans.isEmpty()) {
            ObservableMetric.Builder collections = ObservableMetric.counterBuilder("jvm_gc_collections_total")
                    .setHelp("Number of times this garbage collector has run.")
                    .addLabelNames(GC_LABEL);
            ObservableMetric.Builder collectionSeconds = ObservableMetric.counterBuilder(
                            "jvm_gc_collection_seconds_total")
                    .setHelp("Time spent in this garbage collector in seconds.")
                    .addLabelNames(GC_LABEL);
            for (GarbageCollectorMXBean gcBean : gcBeans) {
                // -1 means undefined for this collector
                collections.observe(() -> Math.max(0L, gcBean.getCollectionCount()), gcBean.getName());
                collectionSeconds.observe(
                        () -> Math.max(0L, gcBean.getCollectionTime()) / 1000.0, gcBean.getName());
            }
            builders.add(collections);
            builders.add(collectionSeconds);
        }

        builders.add(ObservableMetric.gaugeBuilder("jvm_info")
                .setHelp("Java runtime information.")
                .addLabelNames("version", "vendor", "runtime")
                .observe(
                        () -> 1L,
                        System.getProperty("java.runtime.version", "unknown"),
                        System.getProperty("java.vm.vendor", "unknown"),
                        System.getProperty("java.runtime.name", "unknown")));

        return builders;
    }
}
