package com.metamodel.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import com.metamodel.generator.common.GenerationError;

import lombok.Builder;
import lombok.Data;

/**
 * Result of the project generation process.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;

    @Builder.Default
    private List<GenerationError> errors = List.of();

    private Path outputPath;

    private int enumerationCount;
    private int constrainedPrimitiveCount;
    private int classCount;
    private int interfaceCount;
    private int filesWritten;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public static GeneratorResult failure(String errorMessage, List<GenerationError> errors) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errors(List.copyOf(errors))
                .build();
    }
}
