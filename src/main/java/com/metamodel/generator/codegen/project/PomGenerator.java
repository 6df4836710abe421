package com.metamodel.generator.codegen.project;

import com.metamodel.generator.codegen.model.output.GeneratedFile;
import com.metamodel.generator.codegen.model.output.GeneratedFileType;

/**
 * Generates the Maven pom.xml of the generated project.
 */
public class PomGenerator {

    // Keep versions centralized so later upgrades are easy.
    static final String JACKSON_VERSION = "2.17.0";
    static final String JAVA_VERSION = "17";

    public GeneratedFile generate(String groupId, String artifactId) {
        return GeneratedFile.builder()
                .relativePath("pom.xml")
                .contents(generatePomContent(groupId, artifactId))
                .type(GeneratedFileType.BUILD)
                .build();
    }

    public String generatePomContent(String groupId, String artifactId) {
        return """
                <?xml version="1.0" encoding="UTF-8"?>
                <project xmlns="http://maven.apache.org/POM/4.0.0"
                         xmlns:xsi="http://www.w3.org/2001/XMLSchema-instance"
                         xsi:schemaLocation="http://maven.apache.org/POM/4.0.0 http://maven.apache.org/xsd/maven-4.0.0.xsd">
                    <modelVersion>4.0.0</modelVersion>

                    <groupId>%1$s</groupId>
                    <artifactId>%2$s</artifactId>
                    <version>1.0.0-SNAPSHOT</version>
                    <packaging>jar</packaging>

                    <name>%2$s</name>
                    <description>Meta-model types with JSON de/serialization</description>

                    <properties>
                        <project.build.sourceEncoding>UTF-8</project.build.sourceEncoding>
                        <maven.compiler.release>%3$s</maven.compiler.release>
                        <jackson.version>%4$s</jackson.version>
                    </properties>

                    <dependencies>
                        <dependency>
                            <groupId>com.fasterxml.jackson.core</groupId>
                            <artifactId>jackson-databind</artifactId>
                            <version>${jackson.version}</version>
                        </dependency>
                    </dependencies>
                </project>
                """.formatted(groupId, artifactId, JAVA_VERSION, JACKSON_VERSION);
    }
}
