package com.metamodel.generator.schema;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metamodel.generator.common.GenerationError;
import com.metamodel.generator.common.GenerationOutcome;
import com.metamodel.generator.model.AbstractClass;
import com.metamodel.generator.model.ArgumentDeclaration;
import com.metamodel.generator.model.ConcreteClass;
import com.metamodel.generator.model.ConstrainedPrimitive;
import com.metamodel.generator.model.DefaultValue;
import com.metamodel.generator.model.Enumeration;
import com.metamodel.generator.model.EnumerationLiteral;
import com.metamodel.generator.model.OurType;
import com.metamodel.generator.model.PrimitiveType;
import com.metamodel.generator.model.Property;
import com.metamodel.generator.model.SymbolTable;
import com.metamodel.generator.model.SymbolTableBuilder;
import com.metamodel.generator.model.TypeAnnotation;
import com.metamodel.generator.schema.dto.ArgumentDto;
import com.metamodel.generator.schema.dto.LiteralDto;
import com.metamodel.generator.schema.dto.PropertyDto;
import com.metamodel.generator.schema.dto.SchemaDocument;
import com.metamodel.generator.schema.dto.TypeDefinitionDto;

/**
 * Reads a resolved meta-model dump from JSON into a {@link SymbolTable}.
 *
 * The dump is expected to be complete; the loader only binds the references
 * and synthesizes what can be derived (inherited properties, constructor
 * arguments, interfaces). Every problem is reported, not only the first one.
 */
public class SchemaLoader {
    private static final Logger log = LoggerFactory.getLogger(SchemaLoader.class);

    private final ObjectMapper objectMapper;
    private final TypeAnnotationParser typeParser = new TypeAnnotationParser();

    public SchemaLoader() {
        this(new ObjectMapper());
    }

    public SchemaLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public GenerationOutcome<SymbolTable> load(Path schemaFile) {
        SchemaDocument document;
        try {
            document = objectMapper.readValue(schemaFile.toFile(), SchemaDocument.class);
        } catch (JsonProcessingException e) {
            return GenerationOutcome.failure(List.of(GenerationError.of(schemaFile.toString(),
                    "Invalid schema model: " + e.getOriginalMessage())));
        } catch (IOException e) {
            return GenerationOutcome.failure(List.of(GenerationError.of(schemaFile.toString(),
                    "Failed to read the schema model: " + e.getMessage())));
        }
        return load(document);
    }

    public GenerationOutcome<SymbolTable> load(String json) {
        try {
            return load(objectMapper.readValue(json, SchemaDocument.class));
        } catch (JsonProcessingException e) {
            return GenerationOutcome.failure(List.of(GenerationError.of("schema",
                    "Invalid schema model: " + e.getOriginalMessage())));
        }
    }

    public GenerationOutcome<SymbolTable> load(SchemaDocument document) {
        List<GenerationError> errors = new ArrayList<>();
        List<OurType> ourTypes = new ArrayList<>();

        if (document == null || document.getTypes() == null) {
            return GenerationOutcome.failure(List.of(GenerationError.of("schema",
                    "The list of types is missing")));
        }

        int index = 0;
        for (TypeDefinitionDto definition : document.getTypes()) {
            if (definition == null) {
                errors.add(GenerationError.of("types[" + index + "]", "The type definition is null"));
                index++;
                continue;
            }
            String subject = definition.getName() != null ? definition.getName() : "types[" + index + "]";
            index++;
            try {
                ourTypes.add(toOurType(definition));
                log.debug("Loaded {} {}", definition.getKind(), definition.getName());
            } catch (IllegalArgumentException e) {
                errors.add(GenerationError.of(subject, e.getMessage()));
            }
        }

        if (!errors.isEmpty()) {
            log.warn("Schema model loaded with {} errors", errors.size());
            return GenerationOutcome.failure(errors);
        }
        return new SymbolTableBuilder(ourTypes).build();
    }

    private OurType toOurType(TypeDefinitionDto definition) {
        requireText(definition.getName(), "Every type needs a name");
        requireText(definition.getKind(), "The kind of the type is missing");

        switch (definition.getKind()) {
            case TypeDefinitionDto.ENUMERATION:
                return toEnumeration(definition);
            case TypeDefinitionDto.CONSTRAINED_PRIMITIVE:
                PrimitiveType constrainee = PrimitiveType.fromSchemaName(definition.getConstrainee())
                        .orElseThrow(() -> new IllegalArgumentException(
                                "Invalid constrainee: " + definition.getConstrainee()));
                return new ConstrainedPrimitive(definition.getName(), definition.getDescription(), constrainee);
            case TypeDefinitionDto.ABSTRACT_CLASS:
                if (definition.isImplementationSpecific()) {
                    throw new IllegalArgumentException("Only concrete classes can be implementation-specific");
                }
                return AbstractClass.builder()
                        .name(definition.getName())
                        .description(definition.getDescription())
                        .inheritanceNames(requireList(definition.getInheritances(), "inheritances"))
                        .ownProperties(toProperties(definition))
                        .argumentDeclarations(toArguments(definition))
                        .modelTypeDeclared(definition.isWithModelType())
                        .build();
            case TypeDefinitionDto.CONCRETE_CLASS:
                return ConcreteClass.builder()
                        .name(definition.getName())
                        .description(definition.getDescription())
                        .inheritanceNames(requireList(definition.getInheritances(), "inheritances"))
                        .ownProperties(toProperties(definition))
                        .argumentDeclarations(toArguments(definition))
                        .modelTypeDeclared(definition.isWithModelType())
                        .implementationSpecific(definition.isImplementationSpecific())
                        .build();
            default:
                throw new IllegalArgumentException("Unknown kind of type: " + definition.getKind());
        }
    }

    private Enumeration toEnumeration(TypeDefinitionDto definition) {
        List<EnumerationLiteral> literals = new ArrayList<>();
        for (LiteralDto literal : requireList(definition.getLiterals(), "literals")) {
            requireText(literal.getName(), "Every literal needs a name");
            literals.add(EnumerationLiteral.builder()
                    .name(literal.getName())
                    .value(literal.getValue() != null ? literal.getValue() : literal.getName())
                    .description(literal.getDescription())
                    .build());
        }
        return new Enumeration(definition.getName(), definition.getDescription(), literals);
    }

    private List<Property> toProperties(TypeDefinitionDto definition) {
        List<Property> properties = new ArrayList<>();
        for (PropertyDto property : requireList(definition.getProperties(), "properties")) {
            requireText(property.getName(), "Every property needs a name");
            properties.add(Property.builder()
                    .name(property.getName())
                    .typeAnnotation(parseType(property.getType(), "property " + property.getName()))
                    .description(property.getDescription())
                    .declaringClass(definition.getName())
                    .build());
        }
        return properties;
    }

    private List<ArgumentDeclaration> toArguments(TypeDefinitionDto definition) {
        if (definition.getConstructor() == null) {
            return null;
        }
        List<ArgumentDeclaration> arguments = new ArrayList<>();
        for (ArgumentDto argument : requireList(definition.getConstructor(), "constructor arguments")) {
            requireText(argument.getName(), "Every constructor argument needs a name");
            TypeAnnotation type = argument.getType() == null
                    ? null
                    : parseType(argument.getType(), "constructor argument " + argument.getName());
            arguments.add(ArgumentDeclaration.builder()
                    .name(argument.getName())
                    .typeAnnotation(type)
                    .defaultValue(toDefault(argument.getName(), argument.getDefaultValue()))
                    .build());
        }
        return arguments;
    }

    private TypeAnnotation parseType(String text, String where) {
        try {
            return typeParser.parse(text);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("The type of the " + where + " is invalid: " + e.getMessage(), e);
        }
    }

    private static DefaultValue toDefault(String argumentName, JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return DefaultValue.of(node.booleanValue());
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return DefaultValue.of(node.longValue());
        }
        if (node.isNumber()) {
            return DefaultValue.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return DefaultValue.of(node.textValue());
        }
        throw new IllegalArgumentException("Unsupported default of the constructor argument "
                + argumentName + ": " + node);
    }

    /**
     * The list itself, once checked that neither it nor any of its entries is null.
     */
    private static <T> List<T> requireList(List<T> list, String what) {
        if (list == null) {
            throw new IllegalArgumentException("The " + what + " must be a list, but got null");
        }
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == null) {
                throw new IllegalArgumentException("The entry " + i + " of the " + what + " is null");
            }
        }
        return list;
    }

    private static void requireText(String text, String message) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException(message);
        }
    }
}
