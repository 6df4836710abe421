package com.metamodel.generator.codegen.jsonization;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.metamodel.generator.codegen.naming.JavaNaming;
import com.metamodel.generator.codegen.naming.JsonNaming;
import com.metamodel.generator.codegen.util.JavaSourceUtil;
import com.metamodel.generator.common.GenerationError;
import com.metamodel.generator.common.GenerationOutcome;
import com.metamodel.generator.model.ConcreteClass;
import com.metamodel.generator.model.Enumeration;
import com.metamodel.generator.model.Property;
import com.metamodel.generator.model.SymbolTable;
import com.metamodel.generator.specific.ImplementationKey;
import com.metamodel.generator.specific.SpecificImplementations;

/**
 * Generates {@code Jsonization.Transformer}, which turns instances into JSON
 * objects by dispatching on their runtime class, and the public
 * {@code Jsonization.Serialize} entry points.
 */
public class SerializationGenerator {

    private final TypeAnnotationResolver resolver;

    public SerializationGenerator(TypeAnnotationResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Generates the nested class {@code Transformer}, unindented.
     */
    public GenerationOutcome<String> generateTransformer(SymbolTable symbolTable,
                                                         SpecificImplementations specifics) {
        List<String> blocks = new ArrayList<>();
        List<GenerationError> errors = new ArrayList<>();

        blocks.add("""
                /**
                 * Convert the integer to a JSON number.
                 *
                 * @throws IllegalArgumentException if the integer can not be represented
                 *     by a double without a loss of precision
                 */
                static JsonNode toJsonValue(long value) {
                    double asDouble = (double) value;
                    if (asDouble >= 0x1p63 || (long) asDouble != value) {
                        throw new IllegalArgumentException(
                                "The integer can not be represented losslessly as a JSON number: " + value);
                    }
                    return LongNode.valueOf(value);
                }""");

        for (ConcreteClass cls : symbolTable.getConcreteClasses()) {
            if (cls.isImplementationSpecific()) {
                ImplementationKey key = ImplementationKey.transformation(JavaNaming.className(cls.getName()));
                Optional<String> fragment = specifics.get(key);
                if (fragment.isPresent()) {
                    blocks.add(fragment.get());
                } else {
                    errors.add(GenerationError.of(cls.getName(),
                            "The implementation snippet is missing for the serialization: " + key));
                }
            } else {
                blocks.add(transformMethod(cls));
            }
        }

        if (!errors.isEmpty()) {
            return GenerationOutcome.failure(errors);
        }

        return GenerationOutcome.success("""
                /**
                 * Convert instances of the meta-model to JSON objects.
                 */
                static final class Transformer extends AbstractTransformer<ObjectNode> {
                %s
                }""".formatted(JavaSourceUtil.indent(JavaSourceUtil.joinBlocks(blocks), 1)));
    }

    /**
     * Generates the nested class {@code Serialize}, unindented.
     */
    public String generateSerialize(SymbolTable symbolTable) {
        List<String> blocks = new ArrayList<>();
        blocks.add("""
                private static final Transformer TRANSFORMER = new Transformer();

                private Serialize() {
                    // Prevent instantiation
                }

                /**
                 * Serialize an instance of the meta-model to a JSON object.
                 */
                public static ObjectNode toJsonObject(IClass that) {
                    return TRANSFORMER.transform(that);
                }""");
        for (Enumeration enumeration : symbolTable.getEnumerations()) {
            String enumName = JavaNaming.enumName(enumeration.getName());
            blocks.add("""
                    /**
                     * Serialize a literal of {@link %s} to a JSON string.
                     */
                    public static JsonNode %s(%s that) {
                        return TextNode.valueOf(Stringification.%s(that));
                    }""".formatted(
                    enumName,
                    JavaNaming.toJsonValueMethodName(enumeration.getName()),
                    enumName,
                    JavaNaming.toStringMethodName(enumeration.getName())));
        }

        return """
                /**
                 * Serialize instances of the meta-model to JSON.
                 */
                public static final class Serialize {
                %s
                }""".formatted(JavaSourceUtil.indent(JavaSourceUtil.joinBlocks(blocks), 1));
    }

    String transformMethod(ConcreteClass cls) {
        String className = JavaNaming.className(cls.getName());
        StringBuilder body = new StringBuilder();
        body.append("ObjectNode result = JsonNodeFactory.instance.objectNode();\n");

        for (Property property : cls.getProperties()) {
            CodecStrategy strategy = resolver.resolve(property.getTypeAnnotation());
            String getter = "that." + JavaNaming.getterName(property.getName()) + "()";
            String jsonName = JavaSourceUtil.stringLiteral(JsonNaming.propertyName(property.getName()));

            String setting;
            if (strategy.isList()) {
                String array = JavaNaming.variableName("array_" + property.getName());
                setting = """
                        ArrayNode %1$s = JsonNodeFactory.instance.arrayNode();
                        for (%2$s item : %3$s) {
                            %1$s.add(%4$s);
                        }
                        result.set(%5$s, %1$s);
                        """.formatted(
                        array,
                        strategy.getAtomic().getJavaType(),
                        getter,
                        toJsonExpression(strategy.getAtomic(), "item"),
                        jsonName);
            } else {
                setting = "result.set(%s, %s);\n".formatted(
                        jsonName, toJsonExpression(strategy.getAtomic(), getter));
            }

            if (strategy.isOptional()) {
                body.append("if (").append(getter).append(" != null) {\n")
                        .append(JavaSourceUtil.indent(setting, 1))
                        .append("}\n");
            } else {
                body.append(setting);
            }
        }

        if (cls.isWithModelType()) {
            body.append("result.put(%s, %s);\n".formatted(
                    JavaSourceUtil.stringLiteral(JsonNaming.MODEL_TYPE_KEY),
                    JavaSourceUtil.stringLiteral(JsonNaming.modelType(cls.getName()))));
        }
        body.append("return result;\n");

        return """
                @Override
                public ObjectNode %s(%s that) {
                %s}""".formatted(
                JavaNaming.transformMethodName(cls.getName()),
                className,
                JavaSourceUtil.indent(body.toString(), 1));
    }

    /**
     * Java expression converting the atomic value to a {@code JsonNode}.
     */
    String toJsonExpression(AtomicCodec atomic, String source) {
        return switch (atomic.getKind()) {
            case PRIMITIVE -> switch (atomic.getPrimitiveType()) {
                case BOOL -> "BooleanNode.valueOf(" + source + ")";
                case INT -> "Transformer.toJsonValue(" + source + ")";
                case FLOAT -> "DoubleNode.valueOf(" + source + ")";
                case STR -> "TextNode.valueOf(" + source + ")";
                case BYTEARRAY -> "TextNode.valueOf(Base64.getEncoder().encodeToString(" + source + "))";
            };
            case ENUMERATION -> "Serialize." + JavaNaming.toJsonValueMethodName(atomic.getOurType().getName())
                    + "(" + source + ")";
            case INTERFACE, CLASS -> "transform(" + source + ")";
        };
    }
}
