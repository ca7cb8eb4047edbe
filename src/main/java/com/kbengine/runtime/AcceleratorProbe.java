package com.kbengine.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbengine.error.ValidationException;

public class AcceleratorProbe {
    private static final Logger log = LoggerFactory.getLogger(AcceleratorProbe.class);
    public static final String CPU = "cpu";
    public static final String CUDA = "cuda";
    public static final String INTEL_GPU = "intel-gpu";
    public static final String NPU = "npu";

    private final SystemInspector inspector;

    public AcceleratorProbe() {
        this(new DefaultSystemInspector());
    }

    public AcceleratorProbe(SystemInspector inspector) {
        this.inspector = inspector;
    }

    public CapabilityReport probe() {
        Map<String, Boolean> devices = new LinkedHashMap<>();
        devices.put(CUDA, inspector.fileExists("/dev/nvidia0") || inspector.commandExists("nvidia-smi"));
        devices.put(INTEL_GPU, inspector.fileExists("/dev/dri/renderD128")
                && (inspector.commandExists("sycl-ls") || inspector.commandExists("clinfo") || inspector.envEnabled("ONEAPI_ROOT")));
        devices.put(NPU, inspector.fileExists("/dev/accel/accel0"));
        devices.put(CPU, true);

        String best = devices.entrySet().stream()
                .filter(Map.Entry::getValue)
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(CPU);
        return new CapabilityReport(best, devices);
    }

    public DeviceSelection select(String requested) {
        CapabilityReport report = probe();
        String normalized = requested == null ? "auto" : requested.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty() || "auto".equals(normalized)) {
            return new DeviceSelection(normalized.isEmpty() ? "auto" : normalized, report.bestDevice(), "");
        }
        if (!report.devices().containsKey(normalized)) {
            throw new ValidationException("Unknown device capability: " + requested);
        }
        if (report.devices().get(normalized)) {
            return new DeviceSelection(normalized, normalized, "");
        }
        String cause = normalized + " accelerator not detected";
        log.warn("{} requested but unavailable; falling back to cpu", normalized);
        return new DeviceSelection(normalized, CPU, cause);
    }

    public record CapabilityReport(String bestDevice, Map<String, Boolean> devices) {
        public boolean acceleratorAvailable() {
            return !CPU.equals(bestDevice);
        }
    }

    public record DeviceSelection(String requested, String device, String fallbackCause) {
    }

    public interface SystemInspector {
        boolean fileExists(String path);

        boolean commandExists(String command);

        boolean envEnabled(String key);
    }

    static class DefaultSystemInspector implements SystemInspector {
        @Override
        public boolean fileExists(String path) {
            return Files.exists(Path.of(path));
        }

        @Override
        public boolean commandExists(String command) {
            try {
                Process process = new ProcessBuilder("sh", "-c", "command -v " + command).start();
                return process.waitFor() == 0;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (IOException e) {
                return false;
            }
        }

        @Override
        public boolean envEnabled(String key) {
            String value = System.getenv(key);
            return value != null && !value.isBlank();
        }
    }
}
