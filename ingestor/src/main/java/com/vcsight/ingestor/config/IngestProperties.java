package com.vcsight.ingestor.config;

import com.vcsight.ingestor.export.ExportFormat;
import com.vcsight.ingestor.model.EnvironmentTag;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Static configuration for the ingest pipeline, bound from the
 * {@code vcsight.*} keys of application.yml.
 *
 * Defaults match a local run: directories relative to the working
 * directory, all three export formats, one artifact set per environment.
 */
@ConfigurationProperties(prefix = "vcsight")
public class IngestProperties {

    private Path watchDirectory     = Path.of("./ansible_outputs");
    private Path processedDirectory = Path.of("./processed");
    private Path outputDirectory    = Path.of("./powerbi_outputs");

    // Substring pattern → partial tag. Iteration order is declaration order.
    private Map<String, EnvironmentTag> environmentMapping = new LinkedHashMap<>();

    private List<String> supportedExtensions = List.of(".json", ".yaml", ".yml");
    private long maxFileSizeMb = 50;

    private boolean  watcherEnabled   = true;
    private Duration settleDelay      = Duration.ofSeconds(2);
    private Duration initialScanDelay = Duration.ofSeconds(10);

    private int      batchSize          = 10;
    private Duration processingInterval = Duration.ofMinutes(5);
    private Duration cleanupInterval    = Duration.ofHours(24);
    private Duration retention          = Duration.ofDays(30);

    private Set<ExportFormat> exportFormats = EnumSet.allOf(ExportFormat.class);
    private boolean separateByEnvironment   = true;

    // ------------------------------------------------------------------
    // Derived helpers
    // ------------------------------------------------------------------

    /** True when the file name ends with one of the supported extensions (case-insensitive). */
    public boolean isSupported(Path file) {
        Path name = file.getFileName();
        if (name == null) return false;
        String lower = name.toString().toLowerCase(Locale.ROOT);
        return supportedExtensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .anyMatch(lower::endsWith);
    }

    public long maxFileSizeBytes() {
        return maxFileSizeMb * 1024 * 1024;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Path getWatchDirectory()                     { return watchDirectory; }
    public void setWatchDirectory(Path v)               { this.watchDirectory = v; }
    public Path getProcessedDirectory()                 { return processedDirectory; }
    public void setProcessedDirectory(Path v)           { this.processedDirectory = v; }
    public Path getOutputDirectory()                    { return outputDirectory; }
    public void setOutputDirectory(Path v)              { this.outputDirectory = v; }

    public Map<String, EnvironmentTag> getEnvironmentMapping()       { return environmentMapping; }
    public void setEnvironmentMapping(Map<String, EnvironmentTag> v) { this.environmentMapping = new LinkedHashMap<>(v); }

    public List<String> getSupportedExtensions()        { return supportedExtensions; }
    public void setSupportedExtensions(List<String> v)  { this.supportedExtensions = v; }
    public long getMaxFileSizeMb()                      { return maxFileSizeMb; }
    public void setMaxFileSizeMb(long v)                { this.maxFileSizeMb = v; }

    public boolean isWatcherEnabled()                   { return watcherEnabled; }
    public void setWatcherEnabled(boolean v)            { this.watcherEnabled = v; }
    public Duration getSettleDelay()                    { return settleDelay; }
    public void setSettleDelay(Duration v)              { this.settleDelay = v; }
    public Duration getInitialScanDelay()               { return initialScanDelay; }
    public void setInitialScanDelay(Duration v)         { this.initialScanDelay = v; }

    public int getBatchSize()                           { return batchSize; }
    public void setBatchSize(int v)                     { this.batchSize = v; }
    public Duration getProcessingInterval()             { return processingInterval; }
    public void setProcessingInterval(Duration v)       { this.processingInterval = v; }
    public Duration getCleanupInterval()                { return cleanupInterval; }
    public void setCleanupInterval(Duration v)          { this.cleanupInterval = v; }
    public Duration getRetention()                      { return retention; }
    public void setRetention(Duration v)                { this.retention = v; }

    public Set<ExportFormat> getExportFormats()         { return exportFormats; }
    public void setExportFormats(Set<ExportFormat> v)   { this.exportFormats = v; }
    public boolean isSeparateByEnvironment()            { return separateByEnvironment; }
    public void setSeparateByEnvironment(boolean v)     { this.separateByEnvironment = v; }
}
