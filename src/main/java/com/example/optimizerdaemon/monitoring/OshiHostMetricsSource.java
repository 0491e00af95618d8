package com.example.optimizerdaemon.monitoring;

import com.example.optimizerdaemon.domain.MetricsSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import oshi.SystemInfo;
import oshi.hardware.GlobalMemory;
import oshi.hardware.HardwareAbstractionLayer;
import oshi.hardware.NetworkIF;
import oshi.software.os.OperatingSystem;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Host metrics backed by OSHI. Disk usage is read from the JDK file store
 * of the configured mount path.
 */
@Slf4j
@Component
public class OshiHostMetricsSource implements HostMetricsSource {

    private final HardwareAbstractionLayer hardware;
    private final OperatingSystem operatingSystem;

    public OshiHostMetricsSource() {
        SystemInfo systemInfo = new SystemInfo();
        this.hardware = systemInfo.getHardware();
        this.operatingSystem = systemInfo.getOperatingSystem();
    }

    @Override
    public double cpuPercent(long windowMillis) {
        double load = hardware.getProcessor().getSystemCpuLoad(windowMillis);
        if (load < 0) {
            throw new IllegalStateException("CPU load not available on this platform");
        }
        return Math.round(load * 1000.0) / 10.0;
    }

    @Override
    public MetricsSnapshot.Memory memory() {
        GlobalMemory memory = hardware.getMemory();
        return MetricsSnapshot.Memory.of(memory.getTotal(), memory.getAvailable());
    }

    @Override
    public MetricsSnapshot.Disk disk(String path) {
        try {
            FileStore store = Files.getFileStore(Path.of(path));
            return MetricsSnapshot.Disk.of(path, store.getTotalSpace(), store.getUsableSpace());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read file store for " + path, e);
        }
    }

    @Override
    public MetricsSnapshot.Network network() {
        List<NetworkIF> interfaces = hardware.getNetworkIFs();
        long bytesSent = 0, bytesRecv = 0, packetsSent = 0, packetsRecv = 0;
        long errin = 0, errout = 0, dropin = 0;
        for (NetworkIF net : interfaces) {
            bytesSent += net.getBytesSent();
            bytesRecv += net.getBytesRecv();
            packetsSent += net.getPacketsSent();
            packetsRecv += net.getPacketsRecv();
            errin += net.getInErrors();
            errout += net.getOutErrors();
            dropin += net.getInDrops();
        }
        log.trace("Summed network counters over {} interfaces", interfaces.size());
        return new MetricsSnapshot.Network(bytesSent, bytesRecv, packetsSent, packetsRecv, errin, errout, dropin);
    }

    @Override
    public int processCount() {
        return operatingSystem.getProcessCount();
    }
}
