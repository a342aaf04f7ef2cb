package com.phillippitts.n8nsync.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Configuration for the local workflow directory, observation timing and filtering.
 */
@ConfigurationProperties(prefix = "n8n.sync")
@Validated
public class SyncProperties {

    /** Root directory; workflows live in a per-instance subdirectory below it. */
    @NotBlank(message = "n8n.sync.directory must be set")
    private String directory = "./workflows";

    /** Subdirectory name; derived from host and API key when blank. */
    private String instanceIdentifier = "";

    /** Remote polling interval in milliseconds. 0 disables polling. */
    @Min(value = 0, message = "Poll interval must not be negative")
    private long pollIntervalMs = 3_000;

    /** Quiet period a file must reach before a change is processed. */
    @Min(value = 0, message = "Debounce must not be negative")
    private long debounceMs = 500;

    /** Whether inactive remote workflows are synced. */
    private boolean syncInactive = true;

    /** Remote workflows carrying any of these tags (case-insensitive) are ignored. */
    private List<String> ignoredTags = new ArrayList<>(List.of("archive"));

    /** Start filesystem watching and polling when the application starts. */
    private boolean watchOnStartup = true;

    /** Pull/push non-conflicting changes automatically as they are observed. */
    private boolean autoSync = false;

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public String getInstanceIdentifier() {
        return instanceIdentifier;
    }

    public void setInstanceIdentifier(String instanceIdentifier) {
        this.instanceIdentifier = instanceIdentifier;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public long getDebounceMs() {
        return debounceMs;
    }

    public void setDebounceMs(long debounceMs) {
        this.debounceMs = debounceMs;
    }

    public boolean isSyncInactive() {
        return syncInactive;
    }

    public void setSyncInactive(boolean syncInactive) {
        this.syncInactive = syncInactive;
    }

    public List<String> getIgnoredTags() {
        return ignoredTags;
    }

    public void setIgnoredTags(List<String> ignoredTags) {
        this.ignoredTags = ignoredTags == null ? new ArrayList<>() : new ArrayList<>(ignoredTags);
    }

    /** Ignored tags lower-cased for comparison. */
    public List<String> normalizedIgnoredTags() {
        return ignoredTags.stream()
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .filter(t -> !t.isEmpty())
                .toList();
    }

    public boolean isWatchOnStartup() {
        return watchOnStartup;
    }

    public void setWatchOnStartup(boolean watchOnStartup) {
        this.watchOnStartup = watchOnStartup;
    }

    public boolean isAutoSync() {
        return autoSync;
    }

    public void setAutoSync(boolean autoSync) {
        this.autoSync = autoSync;
    }
}
