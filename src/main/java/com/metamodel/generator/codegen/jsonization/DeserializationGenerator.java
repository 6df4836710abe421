package com.metamodel.generator.codegen.jsonization;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.metamodel.generator.codegen.naming.JavaNaming;
import com.metamodel.generator.codegen.naming.JsonNaming;
import com.metamodel.generator.codegen.util.JavaSourceUtil;
import com.metamodel.generator.common.GenerationError;
import com.metamodel.generator.common.GenerationOutcome;
import com.metamodel.generator.model.AbstractClass;
import com.metamodel.generator.model.Argument;
import com.metamodel.generator.model.ConcreteClass;
import com.metamodel.generator.model.ConstrainedPrimitive;
import com.metamodel.generator.model.Enumeration;
import com.metamodel.generator.model.Interface;
import com.metamodel.generator.model.OurType;
import com.metamodel.generator.model.OurTypeVisitor;
import com.metamodel.generator.model.SymbolTable;
import com.metamodel.generator.specific.ImplementationKey;
import com.metamodel.generator.specific.SpecificImplementations;

/**
 * Generates {@code Jsonization.DeserializeImplementation}, the parse routines
 * returning a {@code Reporting.Result} instead of throwing.
 *
 * Every routine stops at the first failure. Errors of nested values get the
 * segment of their enclosing property or list item prepended on the way out.
 */
public class DeserializationGenerator {

    private static final String PRIMITIVES = """
            static Reporting.Result<Boolean> boolFrom(JsonNode node) {
                if (!node.isBoolean()) {
                    return Reporting.Result.failure(new Reporting.Error(
                            "Expected a boolean, but got " + node.getNodeType()));
                }
                return Reporting.Result.success(node.booleanValue());
            }

            static Reporting.Result<Long> longFrom(JsonNode node) {
                if (!node.isIntegralNumber()) {
                    return Reporting.Result.failure(new Reporting.Error(
                            "Expected an integer number, but got " + node.getNodeType()));
                }
                if (!node.canConvertToLong()) {
                    return Reporting.Result.failure(new Reporting.Error(
                            "Expected a 64-bit integer number, but got an out-of-range number: " + node.asText()));
                }
                return Reporting.Result.success(node.longValue());
            }

            static Reporting.Result<Double> doubleFrom(JsonNode node) {
                if (!node.isNumber()) {
                    return Reporting.Result.failure(new Reporting.Error(
                            "Expected a number, but got " + node.getNodeType()));
                }
                return Reporting.Result.success(node.doubleValue());
            }

            static Reporting.Result<String> stringFrom(JsonNode node) {
                if (!node.isTextual()) {
                    return Reporting.Result.failure(new Reporting.Error(
                            "Expected a string, but got " + node.getNodeType()));
                }
                return Reporting.Result.success(node.textValue());
            }

            static Reporting.Result<byte[]> bytesFrom(JsonNode node) {
                if (!node.isTextual()) {
                    return Reporting.Result.failure(new Reporting.Error(
                            "Expected a Base-64 encoded string, but got " + node.getNodeType()));
                }
                try {
                    return Reporting.Result.success(Base64.getDecoder().decode(node.textValue()));
                } catch (IllegalArgumentException exception) {
                    return Reporting.Result.failure(new Reporting.Error(
                            "Expected Base-64 encoded bytes, but the conversion failed because: "
                                    + exception.getMessage()));
                }
            }""";

    private final TypeAnnotationResolver resolver;

    public DeserializationGenerator(TypeAnnotationResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Generates the nested class, unindented.
     *
     * All the missing fragments of implementation-specific classes are reported.
     */
    public GenerationOutcome<String> generate(SymbolTable symbolTable, SpecificImplementations specifics) {
        List<String> blocks = new ArrayList<>();
        List<GenerationError> errors = new ArrayList<>();

        blocks.add("private DeserializeImplementation() {\n"
                + JavaSourceUtil.INDENT + "// Prevent instantiation\n"
                + "}");
        blocks.add(PRIMITIVES);

        for (OurType ourType : symbolTable.getOurTypes()) {
            ourType.accept(new OurTypeVisitor<Void>() {
                @Override
                public Void visit(Enumeration enumeration) {
                    blocks.add(enumerationFrom(enumeration));
                    return null;
                }

                @Override
                public Void visit(ConstrainedPrimitive constrainedPrimitive) {
                    // Parsed as the constrainee.
                    return null;
                }

                @Override
                public Void visit(AbstractClass abstractClass) {
                    abstractClass.getInterface().ifPresent(iface -> blocks.add(interfaceFrom(iface)));
                    return null;
                }

                @Override
                public Void visit(ConcreteClass concreteClass) {
                    concreteClass.getInterface().ifPresent(iface -> blocks.add(interfaceFrom(iface)));
                    if (concreteClass.isImplementationSpecific()) {
                        ImplementationKey key = ImplementationKey.deserialization(
                                JavaNaming.className(concreteClass.getName()));
                        Optional<String> fragment = specifics.get(key);
                        if (fragment.isPresent()) {
                            blocks.add(fragment.get());
                        } else {
                            errors.add(GenerationError.of(concreteClass.getName(),
                                    "The implementation snippet is missing for the de-serialization: " + key));
                        }
                    } else {
                        blocks.add(concreteClassFrom(concreteClass));
                    }
                    return null;
                }
            });
        }

        if (!errors.isEmpty()) {
            return GenerationOutcome.failure(errors);
        }

        String body = JavaSourceUtil.indent(JavaSourceUtil.joinBlocks(blocks), 1);
        return GenerationOutcome.success("""
                /**
                 * Implement the de-serialization of meta-model values from JSON nodes.
                 *
                 * The routines report failures as results so that the path to the
                 * failing value can be recorded on the way out.
                 */
                static final class DeserializeImplementation {
                %s
                }""".formatted(body));
    }

    String enumerationFrom(Enumeration enumeration) {
        String enumName = JavaNaming.enumName(enumeration.getName());
        return """
                /**
                 * Parse the JSON representation of {@link %1$s}.
                 */
                static Reporting.Result<%1$s> %2$s(JsonNode node) {
                    Reporting.Result<String> text = DeserializeImplementation.stringFrom(node);
                    if (text.isError()) {
                        return Reporting.Result.failure(text.getError());
                    }
                    %1$s literal = Stringification.%3$s(text.getValue());
                    if (literal == null) {
                        return Reporting.Result.failure(new Reporting.Error(
                                "Not a valid JSON representation of %1$s"));
                    }
                    return Reporting.Result.success(literal);
                }""".formatted(
                enumName,
                JavaNaming.fromMethodName(enumName),
                JavaNaming.fromStringMethodName(enumeration.getName()));
    }

    String interfaceFrom(Interface iface) {
        String interfaceName = JavaNaming.interfaceName(iface.getName());
        StringBuilder cases = new StringBuilder();
        for (ConcreteClass implementer : iface.getImplementers()) {
            String className = JavaNaming.className(implementer.getName());
            cases.append("""
                    case %s:
                        return Reporting.Result.widen(DeserializeImplementation.%s(node));
                    """.formatted(
                    JavaSourceUtil.stringLiteral(JsonNaming.modelType(implementer.getName())),
                    JavaNaming.fromMethodName(className)));
        }
        cases.append("""
                default:
                    return Reporting.Result.failure(new Reporting.Error(
                            "Unexpected model type for %s: " + modelType));
                """.formatted(interfaceName));

        return """
                /**
                 * Dispatch on the model type to parse an instance of {@link %1$s}.
                 */
                static Reporting.Result<%1$s> %2$s(JsonNode node) {
                    if (!node.isObject()) {
                        return Reporting.Result.failure(new Reporting.Error(
                                "Expected a JSON object, but got " + node.getNodeType()));
                    }
                    JsonNode modelTypeNode = node.get(%3$s);
                    if (modelTypeNode == null || modelTypeNode.isNull()) {
                        return Reporting.Result.failure(new Reporting.Error(
                                "Expected a model type, but none is present"));
                    }
                    if (!modelTypeNode.isTextual()) {
                        return Reporting.Result.failure(new Reporting.Error(
                                "Expected a model type as a string, but got " + modelTypeNode.getNodeType()));
                    }
                    String modelType = modelTypeNode.textValue();
                    switch (modelType) {
                %4$s    }
                }""".formatted(
                interfaceName,
                JavaNaming.fromMethodName(interfaceName),
                JavaSourceUtil.stringLiteral(JsonNaming.MODEL_TYPE_KEY),
                JavaSourceUtil.indent(cases.toString(), 2));
    }

    String concreteClassFrom(ConcreteClass cls) {
        String className = JavaNaming.className(cls.getName());
        List<Argument> arguments = cls.getConstructorArguments();

        StringBuilder slots = new StringBuilder();
        StringBuilder cases = new StringBuilder();
        StringBuilder requiredChecks = new StringBuilder();
        List<String> constructorArguments = new ArrayList<>();

        for (Argument argument : arguments) {
            CodecStrategy strategy = resolver.resolve(argument.getTypeAnnotation());
            String slot = slotName(argument);
            String jsonName = JsonNaming.propertyName(argument.getName());

            slots.append(strategy.slotType()).append(' ').append(slot).append(" = null;\n");
            cases.append(propertyCase(jsonName, slot, strategy));
            if (!strategy.isOptional()) {
                requiredChecks.append("""
                        if (%s == null) {
                            return Reporting.Result.failure(new Reporting.Error(
                                    %s));
                        }

                        """.formatted(slot, JavaSourceUtil.stringLiteral(
                        "Required property \"" + jsonName + "\" is missing")));
            }
            constructorArguments.add(slot);
        }

        if (cls.isWithModelType()) {
            cases.append("""
                    case %s:
                        // The discriminator has been already dispatched on.
                        break;
                    """.formatted(JavaSourceUtil.stringLiteral(JsonNaming.MODEL_TYPE_KEY)));
        }
        cases.append("""
                default:
                    return Reporting.Result.failure(new Reporting.Error(
                            "Unexpected property: " + keyValue.getKey()));
                """);

        String construction = constructorArguments.isEmpty()
                ? "new " + className + "()"
                : "new " + className + "(\n"
                        + JavaSourceUtil.indent(String.join(",\n", constructorArguments), 2) + ")";

        return """
                /**
                 * Parse an instance of {@link %1$s}.
                 */
                static Reporting.Result<%1$s> %2$s(JsonNode node) {
                    if (!node.isObject()) {
                        return Reporting.Result.failure(new Reporting.Error(
                                "Expected a JSON object, but got " + node.getNodeType()));
                    }

                %3$s
                    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                    while (fields.hasNext()) {
                        Map.Entry<String, JsonNode> keyValue = fields.next();
                        JsonNode value = keyValue.getValue();
                        switch (keyValue.getKey()) {
                %4$s        }
                    }

                %5$s    return Reporting.Result.success(%6$s);
                }""".formatted(
                className,
                JavaNaming.fromMethodName(className),
                JavaSourceUtil.indent(slots.toString(), 1),
                JavaSourceUtil.indent(cases.toString(), 3),
                JavaSourceUtil.indent(requiredChecks.toString(), 1),
                construction);
    }

    private String propertyCase(String jsonName, String slot, CodecStrategy strategy) {
        String name = JavaSourceUtil.stringLiteral(jsonName);
        AtomicCodec atomic = strategy.getAtomic();
        String body;
        if (strategy.isList()) {
            body = """
                    if (!value.isArray()) {
                        Reporting.Error error = new Reporting.Error(
                                "Expected a JSON array, but got " + value.getNodeType());
                        error.prependSegment(new Reporting.NameSegment(%1$s));
                        return Reporting.Result.failure(error);
                    }
                    List<%2$s> items = new ArrayList<>(value.size());
                    int index = 0;
                    for (JsonNode item : value) {
                        if (item.isNull()) {
                            Reporting.Error error = new Reporting.Error(
                                    "Expected a non-null item, but got a null");
                            error.prependSegment(new Reporting.IndexSegment(index));
                            error.prependSegment(new Reporting.NameSegment(%1$s));
                            return Reporting.Result.failure(error);
                        }
                        Reporting.Result<%2$s> parsed = DeserializeImplementation.%3$s(item);
                        if (parsed.isError()) {
                            parsed.getError().prependSegment(new Reporting.IndexSegment(index));
                            parsed.getError().prependSegment(new Reporting.NameSegment(%1$s));
                            return Reporting.Result.failure(parsed.getError());
                        }
                        items.add(parsed.getValue());
                        index++;
                    }
                    %4$s = items;
                    """.formatted(name, atomic.getJavaType(), atomic.getParseMethod(), slot);
        } else {
            body = """
                    Reporting.Result<%2$s> parsed = DeserializeImplementation.%3$s(value);
                    if (parsed.isError()) {
                        parsed.getError().prependSegment(new Reporting.NameSegment(%1$s));
                        return Reporting.Result.failure(parsed.getError());
                    }
                    %4$s = parsed.getValue();
                    """.formatted(name, atomic.getJavaType(), atomic.getParseMethod(), slot);
        }

        return "case " + name + ": {\n"
                + JavaSourceUtil.INDENT + "if (value.isNull()) {\n"
                + JavaSourceUtil.INDENT.repeat(2) + "break;\n"
                + JavaSourceUtil.INDENT + "}\n"
                + JavaSourceUtil.indent(body, 1)
                + JavaSourceUtil.INDENT + "break;\n"
                + "}\n";
    }

    /**
     * Local variable holding the parsed argument; the prefix keeps it apart
     * from the other locals of the routine.
     */
    static String slotName(Argument argument) {
        return JavaNaming.variableName("the_" + argument.getName());
    }
}
