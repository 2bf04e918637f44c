package com.craftsman.coordinator.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the local file operations when {@code craftsman.workspace.root}
 * is set. Without it the coordinator runs with whatever ToolOperation beans
 * the host application provides.
 */
@Configuration
@ConditionalOnProperty(prefix = "craftsman.workspace", name = "root")
public class WorkspaceConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceConfiguration.class);

    @Bean
    Workspace workspace(WorkspaceProperties properties) {
        Workspace ws = new Workspace(properties.getRoot());
        log.info("Local workspace operations enabled at {}", ws.root());
        return ws;
    }

    @Bean
    ReadFileOperation readFileOperation(Workspace workspace, WorkspaceProperties properties) {
        return new ReadFileOperation(workspace, properties.getMaxFileBytes());
    }

    @Bean
    WriteFileOperation writeFileOperation(Workspace workspace) {
        return new WriteFileOperation(workspace);
    }

    @Bean
    SearchOperation searchOperation(Workspace workspace, WorkspaceProperties properties) {
        return new SearchOperation(workspace, properties.getMaxSearchResults());
    }
}
