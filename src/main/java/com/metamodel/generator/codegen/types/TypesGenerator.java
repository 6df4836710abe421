package com.metamodel.generator.codegen.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.metamodel.generator.codegen.doc.JavadocRenderer;
import com.metamodel.generator.codegen.mapper.JavaTypeMapper;
import com.metamodel.generator.codegen.model.output.GeneratedFile;
import com.metamodel.generator.codegen.naming.JavaNaming;
import com.metamodel.generator.codegen.util.JavaSourceUtil;
import com.metamodel.generator.common.GenerationError;
import com.metamodel.generator.common.GenerationOutcome;
import com.metamodel.generator.model.Argument;
import com.metamodel.generator.model.ClassDefinition;
import com.metamodel.generator.model.ConcreteClass;
import com.metamodel.generator.model.ConstrainedPrimitive;
import com.metamodel.generator.model.DefaultValue;
import com.metamodel.generator.model.Enumeration;
import com.metamodel.generator.model.EnumerationLiteral;
import com.metamodel.generator.model.ListTypeAnnotation;
import com.metamodel.generator.model.OurTypeAnnotation;
import com.metamodel.generator.model.PrimitiveType;
import com.metamodel.generator.model.PrimitiveTypeAnnotation;
import com.metamodel.generator.model.Property;
import com.metamodel.generator.model.SymbolTable;
import com.metamodel.generator.model.TypeAnnotation;
import com.metamodel.generator.specific.ImplementationKey;
import com.metamodel.generator.specific.SpecificImplementations;

/**
 * Generates the Java types of the meta-model: the {@code IClass} root, one
 * interface per class with descendants, one final class per concrete class,
 * the enumerations and the {@code AbstractTransformer} visitor.
 */
public class TypesGenerator {

    static final List<String> CLASS_IMPORTS = List.of(
            "java.util.Arrays",
            "java.util.List",
            "java.util.Objects");

    public GenerationOutcome<List<GeneratedFile>> generate(SymbolTable symbolTable,
                                                           SpecificImplementations specifics,
                                                           String packageName) {
        List<GeneratedFile> files = new ArrayList<>();
        List<GenerationError> errors = new ArrayList<>();

        files.add(GeneratedFile.java(packageName, "IClass", generateIClass(packageName)));
        files.add(GeneratedFile.java(packageName, "AbstractTransformer",
                generateAbstractTransformer(symbolTable, packageName)));

        for (Enumeration enumeration : symbolTable.getEnumerations()) {
            files.add(GeneratedFile.java(packageName, JavaNaming.enumName(enumeration.getName()),
                    generateEnumeration(enumeration, packageName)));
        }

        for (ClassDefinition cls : symbolTable.getClasses()) {
            if (cls.getInterface().isPresent()) {
                files.add(GeneratedFile.java(packageName, JavaNaming.interfaceName(cls.getName()),
                        generateInterface(cls, packageName)));
            }
            if (!(cls instanceof ConcreteClass concrete)) {
                continue;
            }
            String className = JavaNaming.className(concrete.getName());
            if (concrete.isImplementationSpecific()) {
                ImplementationKey key = ImplementationKey.typeDeclaration(className);
                Optional<String> fragment = specifics.get(key);
                if (fragment.isPresent()) {
                    String contents = JavaSourceUtil.fileHeader(packageName, List.of(CLASS_IMPORTS))
                            + fragment.get().strip() + "\n";
                    files.add(GeneratedFile.java(packageName, className, contents));
                } else {
                    errors.add(GenerationError.of(concrete.getName(),
                            "The implementation snippet is missing for the class declaration: " + key));
                }
            } else {
                files.add(GeneratedFile.java(packageName, className, generateClass(concrete, packageName)));
            }
        }

        if (!errors.isEmpty()) {
            return GenerationOutcome.failure(errors);
        }
        return GenerationOutcome.success(files);
    }

    String generateIClass(String packageName) {
        return JavaSourceUtil.fileHeader(packageName, List.of()) + """
                /**
                 * Represent the common ancestor of all the classes of the meta-model.
                 */
                public interface IClass {
                    /**
                     * Dispatch the transformer on the concrete class of this instance.
                     */
                    <T> T transform(AbstractTransformer<T> transformer);
                }
                """;
    }

    String generateAbstractTransformer(SymbolTable symbolTable, String packageName) {
        StringBuilder methods = new StringBuilder();
        for (ConcreteClass cls : symbolTable.getConcreteClasses()) {
            methods.append("\n    public abstract T %s(%s that);\n".formatted(
                    JavaNaming.transformMethodName(cls.getName()),
                    JavaNaming.className(cls.getName())));
        }
        return JavaSourceUtil.fileHeader(packageName, List.of()) + """
                /**
                 * Transform an instance of the meta-model into something else.
                 *
                 * @param <T> type of the transformation result
                 */
                public abstract class AbstractTransformer<T> {
                    public T transform(IClass that) {
                        return that.transform(this);
                    }
                %s}
                """.formatted(methods);
    }

    String generateEnumeration(Enumeration enumeration, String packageName) {
        String enumName = JavaNaming.enumName(enumeration.getName());
        List<String> literals = new ArrayList<>();
        for (EnumerationLiteral literal : enumeration.getLiterals()) {
            literals.add(JavadocRenderer.renderLine(literal.getDescription())
                    + JavaNaming.enumLiteralName(literal.getName())
                    + "(" + JavaSourceUtil.stringLiteral(literal.getValue()) + ")");
        }
        String literalBlock = literals.isEmpty() ? ";" : String.join(",\n", literals) + ";";

        return JavaSourceUtil.fileHeader(packageName, List.of())
                + JavadocRenderer.renderLine(enumeration.getDescription())
                + """
                public enum %1$s {
                %2$s

                    private final String value;

                    %1$s(String value) {
                        this.value = value;
                    }

                    /**
                     * Text representing the literal in JSON.
                     */
                    public String getValue() {
                        return value;
                    }
                }
                """.formatted(enumName, JavaSourceUtil.indent(literalBlock, 1));
    }

    String generateInterface(ClassDefinition cls, String packageName) {
        String interfaceName = JavaNaming.interfaceName(cls.getName());
        List<String> parents = new ArrayList<>();
        for (ClassDefinition parent : cls.getInheritances()) {
            parents.add(JavaNaming.interfaceName(parent.getName()));
        }
        if (parents.isEmpty()) {
            parents.add("IClass");
        }

        StringBuilder getters = new StringBuilder();
        for (Property property : cls.getProperties()) {
            if (!property.getDeclaringClass().equals(cls.getName())) {
                continue;
            }
            getters.append('\n')
                    .append(JavaSourceUtil.indent(JavadocRenderer.renderLine(property.getDescription()), 1))
                    .append("    ")
                    .append(JavaTypeMapper.javaType(property.getTypeAnnotation()))
                    .append(' ')
                    .append(JavaNaming.getterName(property.getName()))
                    .append("();\n");
        }

        return JavaSourceUtil.fileHeader(packageName, List.of(List.of("java.util.List")))
                + JavadocRenderer.renderLine(cls.getDescription())
                + "public interface %s extends %s {%s}\n".formatted(
                interfaceName, String.join(", ", parents), getters);
    }

    String generateClass(ConcreteClass cls, String packageName) {
        String className = JavaNaming.className(cls.getName());

        List<String> implemented = new ArrayList<>();
        if (cls.getInterface().isPresent()) {
            implemented.add(JavaNaming.interfaceName(cls.getName()));
        } else {
            for (ClassDefinition parent : cls.getInheritances()) {
                implemented.add(JavaNaming.interfaceName(parent.getName()));
            }
        }
        if (implemented.isEmpty()) {
            implemented.add("IClass");
        }

        List<String> blocks = new ArrayList<>();

        StringBuilder fields = new StringBuilder();
        for (Property property : cls.getProperties()) {
            fields.append(JavadocRenderer.renderLine(property.getDescription()))
                    .append("private final ")
                    .append(JavaTypeMapper.javaType(property.getTypeAnnotation()))
                    .append(' ')
                    .append(JavaNaming.variableName(property.getName()))
                    .append(";\n");
        }
        if (fields.length() > 0) {
            blocks.add(fields.toString());
        }

        blocks.add(constructor(cls, className));

        for (Property property : cls.getProperties()) {
            blocks.add("""
                    public %s %s() {
                        return %s;
                    }""".formatted(
                    JavaTypeMapper.javaType(property.getTypeAnnotation()),
                    JavaNaming.getterName(property.getName()),
                    JavaNaming.variableName(property.getName())));
        }

        blocks.add("""
                @Override
                public <T> T transform(AbstractTransformer<T> transformer) {
                    return transformer.%s(this);
                }""".formatted(JavaNaming.transformMethodName(cls.getName())));

        blocks.add(equalsMethod(cls, className));
        blocks.add(hashCodeMethod(cls));

        return JavaSourceUtil.fileHeader(packageName, List.of(CLASS_IMPORTS))
                + JavadocRenderer.renderLine(cls.getDescription())
                + "public final class %s implements %s {\n%s\n}\n".formatted(
                className,
                String.join(", ", implemented),
                JavaSourceUtil.indent(JavaSourceUtil.joinBlocks(blocks), 1));
    }

    private String constructor(ConcreteClass cls, String className) {
        List<String> parameters = new ArrayList<>();
        StringBuilder body = new StringBuilder();
        for (Argument argument : cls.getConstructorArguments()) {
            TypeAnnotation type = argument.getTypeAnnotation();
            String name = JavaNaming.variableName(argument.getName());
            parameters.add(JavaTypeMapper.javaType(type) + " " + name);

            String value = name;
            boolean isList = type.beneathOptional() instanceof ListTypeAnnotation;
            if (type.isOptional()) {
                Optional<DefaultValue> defaultValue = argument.getDefault();
                if (defaultValue.isPresent()) {
                    value = "%s != null ? %s : %s".formatted(name, name, defaultLiteral(type, defaultValue.get()));
                } else if (isList) {
                    value = "%s == null ? null : List.copyOf(%s)".formatted(name, name);
                }
            } else if (isList) {
                value = "List.copyOf(Objects.requireNonNull(%s, %s))".formatted(
                        name, JavaSourceUtil.stringLiteral(name));
            } else if (!JavaTypeMapper.isUnboxed(type)) {
                value = "Objects.requireNonNull(%s, %s)".formatted(name, JavaSourceUtil.stringLiteral(name));
            }
            body.append("this.").append(name).append(" = ").append(value).append(";\n");
        }

        String signature = parameters.isEmpty()
                ? "public " + className + "() {\n"
                : "public " + className + "(\n"
                        + JavaSourceUtil.indent(String.join(",\n", parameters), 2) + ") {\n";
        return signature + JavaSourceUtil.indent(body.toString(), 1) + "}";
    }

    private String equalsMethod(ConcreteClass cls, String className) {
        List<String> comparisons = new ArrayList<>();
        for (Property property : cls.getProperties()) {
            String name = JavaNaming.variableName(property.getName());
            if (JavaTypeMapper.isByteArray(property.getTypeAnnotation())) {
                comparisons.add("Arrays.equals(this.%s, casted.%s)".formatted(name, name));
            } else {
                comparisons.add("Objects.equals(this.%s, casted.%s)".formatted(name, name));
            }
        }
        String comparison = comparisons.isEmpty()
                ? "true"
                : String.join("\n" + JavaSourceUtil.INDENT.repeat(2) + "&& ", comparisons);
        return """
                @Override
                public boolean equals(Object other) {
                    if (this == other) {
                        return true;
                    }
                    if (!(other instanceof %1$s)) {
                        return false;
                    }
                    %1$s casted = (%1$s) other;
                    return %2$s;
                }""".formatted(className, comparison);
    }

    private String hashCodeMethod(ConcreteClass cls) {
        List<String> parts = new ArrayList<>();
        for (Property property : cls.getProperties()) {
            String name = JavaNaming.variableName(property.getName());
            parts.add(JavaTypeMapper.isByteArray(property.getTypeAnnotation())
                    ? "Arrays.hashCode(" + name + ")"
                    : name);
        }
        return """
                @Override
                public int hashCode() {
                    return Objects.hash(%s);
                }""".formatted(String.join(", ", parts));
    }

    /**
     * Java literal of the default, typed after the argument it initializes.
     */
    String defaultLiteral(TypeAnnotation type, DefaultValue defaultValue) {
        TypeAnnotation beneath = type.beneathOptional();
        Object value = defaultValue.getValue();
        if (beneath instanceof OurTypeAnnotation reference
                && reference.getOurType() instanceof Enumeration enumeration) {
            return JavaNaming.enumName(enumeration.getName()) + "." + JavaNaming.enumLiteralName((String) value);
        }

        PrimitiveType primitive;
        if (beneath instanceof PrimitiveTypeAnnotation primitiveAnnotation) {
            primitive = primitiveAnnotation.getType();
        } else if (beneath instanceof OurTypeAnnotation reference
                && reference.getOurType() instanceof ConstrainedPrimitive constrained) {
            primitive = constrained.getConstrainee();
        } else {
            throw new IllegalStateException("Unexpected type of a default: " + type);
        }

        return switch (primitive) {
            case BOOL -> String.valueOf(value);
            case INT -> value + "L";
            case FLOAT -> Double.toString(((Number) value).doubleValue());
            case STR -> JavaSourceUtil.stringLiteral((String) value);
            case BYTEARRAY -> throw new IllegalStateException("Byte arrays can not have a default: " + type);
        };
    }
}
