package com.metamodel.generator.codegen.model.output;

/**
 * Categories of the files written into the generated project.
 */
public enum GeneratedFileType {
    JAVA,
    DOCUMENTATION,
    BUILD
}
