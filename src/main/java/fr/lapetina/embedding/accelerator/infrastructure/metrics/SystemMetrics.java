package fr.lapetina.embedding.accelerator.infrastructure.metrics;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.time.Instant;

/**
 * Host and JVM resource usage at one instant.
 */
public record SystemMetrics(
        double cpuPercent,
        long heapUsedBytes,
        long heapMaxBytes,
        double memoryPercent,
        int threadCount,
        Instant timestamp
) {

    /**
     * Reads the platform MXBeans. CPU load is reported as 0 where the platform does not expose it.
     */
    public static SystemMetrics capture() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        double cpuPercent;
        if (os instanceof com.sun.management.OperatingSystemMXBean extended) {
            cpuPercent = extended.getCpuLoad() * 100.0;
        } else {
            double load = os.getSystemLoadAverage();
            cpuPercent = load < 0 ? 0.0 : Math.min(100.0, load / os.getAvailableProcessors() * 100.0);
        }
        if (cpuPercent < 0 || Double.isNaN(cpuPercent)) {
            cpuPercent = 0.0;
        }
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        double memoryPercent = max > 0 ? heap.getUsed() * 100.0 / max : 0.0;
        int threads = ManagementFactory.getThreadMXBean().getThreadCount();
        return new SystemMetrics(cpuPercent, heap.getUsed(), max, memoryPercent, threads, Instant.now());
    }
}
