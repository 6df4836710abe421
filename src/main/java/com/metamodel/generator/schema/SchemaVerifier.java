package com.metamodel.generator.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metamodel.generator.codegen.jsonization.TypeAnnotationResolver;
import com.metamodel.generator.codegen.naming.JavaNaming;
import com.metamodel.generator.codegen.naming.JsonNaming;
import com.metamodel.generator.common.GenerationError;
import com.metamodel.generator.model.AbstractClass;
import com.metamodel.generator.model.Argument;
import com.metamodel.generator.model.AtomicTypeAnnotation;
import com.metamodel.generator.model.ClassDefinition;
import com.metamodel.generator.model.ConstrainedPrimitive;
import com.metamodel.generator.model.DefaultValue;
import com.metamodel.generator.model.Enumeration;
import com.metamodel.generator.model.EnumerationLiteral;
import com.metamodel.generator.model.ListTypeAnnotation;
import com.metamodel.generator.model.OptionalTypeAnnotation;
import com.metamodel.generator.model.OurType;
import com.metamodel.generator.model.OurTypeAnnotation;
import com.metamodel.generator.model.PrimitiveType;
import com.metamodel.generator.model.PrimitiveTypeAnnotation;
import com.metamodel.generator.model.Property;
import com.metamodel.generator.model.SymbolTable;
import com.metamodel.generator.model.TypeAnnotation;

/**
 * Checks the invariants the code generators rely on.
 *
 * All the violations in the symbol table are reported in one pass.
 */
public class SchemaVerifier {
    private static final Logger log = LoggerFactory.getLogger(SchemaVerifier.class);

    /**
     * Names of the Java types which are always generated.
     */
    static final Set<String> RESERVED_JAVA_NAMES = Set.of(
            "IClass", "AbstractTransformer", "Jsonization", "Reporting", "Stringification",
            "DeserializeImplementation", "Deserialize", "DeserializationException", "Transformer", "Serialize",
            "List", "Map", "Iterator", "ArrayList", "Arrays", "Base64", "Objects", "Collections",
            "JsonNode", "ObjectNode", "ArrayNode", "JsonNodeFactory", "TextNode", "BooleanNode",
            "DoubleNode", "LongNode", "Object", "String", "Long", "Double", "Boolean", "Override");

    static final Set<String> RESERVED_GETTERS = Set.of("getClass");

    /**
     * Parse routines of the primitive types, generated next to the ones of our types.
     */
    static final Set<String> PRIMITIVE_PARSE_METHODS = Arrays.stream(PrimitiveType.values())
            .map(TypeAnnotationResolver::parseMethodFor)
            .collect(Collectors.toUnmodifiableSet());

    public List<GenerationError> verify(SymbolTable symbolTable) {
        List<GenerationError> errors = new ArrayList<>();

        verifyJavaNames(symbolTable, errors);
        for (OurType ourType : symbolTable.getOurTypes()) {
            if (ourType instanceof Enumeration enumeration) {
                verifyEnumeration(enumeration, errors);
            } else if (ourType instanceof ClassDefinition cls) {
                verifyClass(cls, errors);
            }
        }

        if (!errors.isEmpty()) {
            log.warn("Schema model violates {} invariant(s)", errors.size());
        }
        return errors;
    }

    private void verifyJavaNames(SymbolTable symbolTable, List<GenerationError> errors) {
        Map<String, String> owners = new HashMap<>();
        for (OurType ourType : symbolTable.getOurTypes()) {
            List<String> javaNames = new ArrayList<>();
            if (ourType instanceof Enumeration) {
                javaNames.add(JavaNaming.enumName(ourType.getName()));
            } else if (ourType instanceof ClassDefinition cls) {
                if (!cls.isAbstract()) {
                    javaNames.add(JavaNaming.className(cls.getName()));
                }
                if (cls.getInterface().isPresent() || cls.isAbstract()) {
                    javaNames.add(JavaNaming.interfaceName(cls.getName()));
                }
            }
            for (String javaName : javaNames) {
                if (RESERVED_JAVA_NAMES.contains(javaName)) {
                    errors.add(GenerationError.of(ourType.getName(),
                            "The Java name " + javaName + " is reserved for the generated infrastructure"));
                }
                String parseMethod = JavaNaming.fromMethodName(javaName);
                if (PRIMITIVE_PARSE_METHODS.contains(parseMethod)) {
                    errors.add(GenerationError.of(ourType.getName(), "The parse routine " + parseMethod
                            + " of the Java name " + javaName + " clashes with the one of a primitive type"));
                }
                String previous = owners.putIfAbsent(javaName, ourType.getName());
                if (previous != null) {
                    errors.add(GenerationError.of(ourType.getName(),
                            "The Java name " + javaName + " clashes with the one of " + previous));
                }
            }
        }
    }

    private void verifyEnumeration(Enumeration enumeration, List<GenerationError> errors) {
        Set<String> javaNames = new HashSet<>();
        Set<String> values = new HashSet<>();
        for (EnumerationLiteral literal : enumeration.getLiterals()) {
            if (!javaNames.add(JavaNaming.enumLiteralName(literal.getName()))) {
                errors.add(GenerationError.of(enumeration.getName(),
                        "The literal " + literal.getName() + " clashes with another literal"));
            }
            if (!values.add(literal.getValue())) {
                errors.add(GenerationError.of(enumeration.getName(),
                        "The value " + literal.getValue() + " is used by more than one literal"));
            }
        }
    }

    private void verifyClass(ClassDefinition cls, List<GenerationError> errors) {
        if (cls instanceof AbstractClass && cls.getDescendants().isEmpty()) {
            errors.add(GenerationError.of(cls.getName(),
                    "The abstract class has no descendants and can not be instantiated"));
        }
        cls.getInterface().ifPresent(classInterface -> {
            if (classInterface.getImplementers().isEmpty()) {
                errors.add(GenerationError.of(cls.getName(), "The class has no concrete implementers"));
            }
        });

        for (Property property : cls.getProperties()) {
            verifyShape(cls, "property " + property.getName(), property.getTypeAnnotation(), errors);
            if (RESERVED_GETTERS.contains(JavaNaming.getterName(property.getName()))) {
                errors.add(GenerationError.of(cls.getName(), "The property " + property.getName()
                        + " would shadow " + JavaNaming.getterName(property.getName()) + " of java.lang.Object"));
            }
        }
        verifyPropertiesMatchArguments(cls, errors);
        verifyJsonNames(cls, errors);

        for (Argument argument : cls.getConstructorArguments()) {
            verifyShape(cls, "constructor argument " + argument.getName(), argument.getTypeAnnotation(), errors);
            argument.getDefault().ifPresent(defaultValue -> verifyDefault(cls, argument, defaultValue, errors));
        }
    }

    private void verifyPropertiesMatchArguments(ClassDefinition cls, List<GenerationError> errors) {
        Set<String> propertyNames = new LinkedHashSet<>();
        cls.getProperties().forEach(property -> propertyNames.add(property.getName()));

        Set<String> argumentNames = new LinkedHashSet<>();
        for (Argument argument : cls.getConstructorArguments()) {
            if (!argumentNames.add(argument.getName())) {
                errors.add(GenerationError.of(cls.getName(),
                        "The constructor argument " + argument.getName() + " is duplicated"));
            }
        }

        for (String name : propertyNames) {
            if (!argumentNames.contains(name)) {
                errors.add(GenerationError.of(cls.getName(),
                        "The property " + name + " is not initialized by a constructor argument"));
            }
        }
        for (Argument argument : cls.getConstructorArguments()) {
            if (!propertyNames.contains(argument.getName())) {
                errors.add(GenerationError.of(cls.getName(),
                        "The constructor argument " + argument.getName() + " has no corresponding property"));
                continue;
            }
            Property property = cls.findProperty(argument.getName()).orElseThrow();
            String propertyType = property.getTypeAnnotation().toSchemaString();
            String argumentType = argument.getTypeAnnotation().toSchemaString();
            if (!propertyType.equals(argumentType)) {
                errors.add(GenerationError.of(cls.getName(),
                        "The constructor argument " + argument.getName() + " is of type " + argumentType
                                + ", but the property is of type " + propertyType));
            }
        }
    }

    private void verifyJsonNames(ClassDefinition cls, List<GenerationError> errors) {
        Map<String, String> jsonNames = new HashMap<>();
        for (Property property : cls.getProperties()) {
            String jsonName = JsonNaming.propertyName(property.getName());
            if (jsonName.equals(JsonNaming.MODEL_TYPE_KEY)) {
                errors.add(GenerationError.of(cls.getName(),
                        "The property " + property.getName() + " collides with the discriminator "
                                + JsonNaming.MODEL_TYPE_KEY));
            }
            String previous = jsonNames.putIfAbsent(jsonName, property.getName());
            if (previous != null) {
                errors.add(GenerationError.of(cls.getName(),
                        "The properties " + previous + " and " + property.getName()
                                + " share the JSON name " + jsonName));
            }
        }
    }

    /**
     * Only atomic values, lists of atomic values and their optional variants are supported.
     */
    private void verifyShape(ClassDefinition cls, String where, TypeAnnotation annotation,
                             List<GenerationError> errors) {
        TypeAnnotation beneath = annotation.beneathOptional();
        if (beneath instanceof ListTypeAnnotation list) {
            beneath = list.getItems();
        }
        if (!(beneath instanceof AtomicTypeAnnotation)) {
            errors.add(GenerationError.of(cls.getName(), "The type " + annotation.toSchemaString() + " of the "
                    + where + " is not supported; expected an atomic type, a list of atomic types "
                    + "or an optional of either"));
        }
    }

    private void verifyDefault(ClassDefinition cls, Argument argument, DefaultValue defaultValue,
                               List<GenerationError> errors) {
        String subject = cls.getName();
        if (!(argument.getTypeAnnotation() instanceof OptionalTypeAnnotation optional)) {
            errors.add(GenerationError.of(subject,
                    "The constructor argument " + argument.getName() + " is required and can not have a default"));
            return;
        }
        Object value = defaultValue.getValue();
        TypeAnnotation type = optional.getValue();

        PrimitiveType primitive = null;
        if (type instanceof PrimitiveTypeAnnotation primitiveAnnotation) {
            primitive = primitiveAnnotation.getType();
        } else if (type instanceof OurTypeAnnotation reference) {
            OurType ourType = reference.getOurType();
            if (ourType instanceof ConstrainedPrimitive constrained) {
                primitive = constrained.getConstrainee();
            } else if (ourType instanceof Enumeration enumeration) {
                if (!(value instanceof String literal) || enumeration.findLiteral(literal).isEmpty()) {
                    errors.add(GenerationError.of(subject, "The default of the constructor argument "
                            + argument.getName() + " is not a literal of " + enumeration.getName() + ": " + value));
                }
                return;
            }
        }

        boolean compatible = primitive != null && switch (primitive) {
            case BOOL -> value instanceof Boolean;
            case INT -> value instanceof Long;
            case FLOAT -> value instanceof Double || value instanceof Long;
            case STR -> value instanceof String;
            case BYTEARRAY -> false;
        };
        if (!compatible) {
            errors.add(GenerationError.of(subject, "The default " + value + " of the constructor argument "
                    + argument.getName() + " does not fit the type " + argument.getTypeAnnotation()));
        }
    }
}
