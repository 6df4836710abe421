package com.metamodel.generator.codegen.model.output;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Generated file held in memory until the whole generation succeeded.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedFile {

    /**
     * Path relative to the root of the generated project, with forward slashes.
     */
    @NonNull
    String relativePath;

    @NonNull
    String contents;

    @NonNull
    GeneratedFileType type;

    public static GeneratedFile java(String packageName, String className, String contents) {
        return GeneratedFile.builder()
                .relativePath("src/main/java/" + packageName.replace('.', '/') + "/" + className + ".java")
                .contents(contents)
                .type(GeneratedFileType.JAVA)
                .build();
    }
}
