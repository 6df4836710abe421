package com.metamodel.generator.codegen;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for the project generator.
 */
@Data
@Builder
public class GeneratorConfig {
    private String projectName;
    private Path schemaFile;
    private String packageName;

    /**
     * Directory of hand-written snippets, or null if the meta-model needs none.
     */
    private Path snippetsDir;

    private Path outputDir;
    private boolean force;

    /**
     * Get the directory the project is generated into.
     */
    public Path getProjectDir() {
        return outputDir.resolve(projectName);
    }

    /**
     * Get the artifact ID for Maven.
     */
    public String getArtifactId() {
        return projectName.toLowerCase().replaceAll("[^a-z0-9-]", "-");
    }

    /**
     * Get the group ID for Maven, i.e. the package without its last segment.
     */
    public String getGroupId() {
        int lastDot = packageName.lastIndexOf('.');
        return lastDot < 0 ? packageName : packageName.substring(0, lastDot);
    }
}
