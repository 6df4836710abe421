package com.metamodel.generator.codegen.jsonization;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metamodel.generator.codegen.model.output.GeneratedFile;
import com.metamodel.generator.codegen.util.JavaSourceUtil;
import com.metamodel.generator.common.GenerationError;
import com.metamodel.generator.common.GenerationOutcome;
import com.metamodel.generator.model.SymbolTable;
import com.metamodel.generator.specific.SpecificImplementations;

/**
 * Assembles {@code Jsonization.java} from the de-serialization, serialization
 * and facade parts.
 *
 * Errors of both directions are collected before giving up, so that a single
 * run reports every missing snippet.
 */
public class JsonizationGenerator {
    private static final Logger log = LoggerFactory.getLogger(JsonizationGenerator.class);

    static final List<String> JAVA_IMPORTS = List.of(
            "java.util.ArrayList",
            "java.util.Base64",
            "java.util.Iterator",
            "java.util.List",
            "java.util.Map");

    static final List<String> JACKSON_IMPORTS = List.of(
            "com.fasterxml.jackson.databind.JsonNode",
            "com.fasterxml.jackson.databind.node.ArrayNode",
            "com.fasterxml.jackson.databind.node.BooleanNode",
            "com.fasterxml.jackson.databind.node.DoubleNode",
            "com.fasterxml.jackson.databind.node.JsonNodeFactory",
            "com.fasterxml.jackson.databind.node.LongNode",
            "com.fasterxml.jackson.databind.node.ObjectNode",
            "com.fasterxml.jackson.databind.node.TextNode");

    private final DeserializationGenerator deserializationGenerator;
    private final SerializationGenerator serializationGenerator;
    private final FacadeGenerator facadeGenerator;

    public JsonizationGenerator(TypeAnnotationResolver resolver) {
        this.deserializationGenerator = new DeserializationGenerator(resolver);
        this.serializationGenerator = new SerializationGenerator(resolver);
        this.facadeGenerator = new FacadeGenerator();
    }

    public GenerationOutcome<GeneratedFile> generate(SymbolTable symbolTable,
                                                     SpecificImplementations specifics,
                                                     String packageName) {
        GenerationOutcome<String> deserialization = deserializationGenerator.generate(symbolTable, specifics);
        GenerationOutcome<String> transformer = serializationGenerator.generateTransformer(symbolTable, specifics);

        List<GenerationError> errors = new ArrayList<>();
        errors.addAll(deserialization.getErrors());
        errors.addAll(transformer.getErrors());
        if (!errors.isEmpty()) {
            log.debug("Jsonization could not be generated because of {} error(s)", errors.size());
            return GenerationOutcome.failure(errors);
        }

        List<String> blocks = List.of(
                """
                private Jsonization() {
                    // Prevent instantiation
                }""",
                deserialization.getValue(),
                facadeGenerator.generate(symbolTable),
                transformer.getValue(),
                serializationGenerator.generateSerialize(symbolTable));

        String contents = JavaSourceUtil.fileHeader(packageName, List.of(JAVA_IMPORTS, JACKSON_IMPORTS))
                + """
                /**
                 * Provide de/serialization of meta-model instances from/to JSON.
                 */
                public final class Jsonization {
                %s
                }
                """.formatted(JavaSourceUtil.indent(JavaSourceUtil.joinBlocks(blocks), 1));

        return GenerationOutcome.success(GeneratedFile.java(packageName, "Jsonization", contents));
    }
}
