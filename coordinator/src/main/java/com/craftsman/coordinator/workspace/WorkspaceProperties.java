package com.craftsman.coordinator.workspace;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Settings under {@code craftsman.workspace}. The local file operations are
 * only registered when {@code root} is set.
 */
@Component
@ConfigurationProperties(prefix = "craftsman.workspace")
public class WorkspaceProperties {

    private Path root;
    private int  maxSearchResults = 50;
    private long maxFileBytes     = 1_048_576;

    public Path getRoot() { return root; }
    public void setRoot(Path root) { this.root = root; }
    public int getMaxSearchResults() { return maxSearchResults; }
    public void setMaxSearchResults(int maxSearchResults) { this.maxSearchResults = maxSearchResults; }
    public long getMaxFileBytes() { return maxFileBytes; }
    public void setMaxFileBytes(long maxFileBytes) { this.maxFileBytes = maxFileBytes; }
}
