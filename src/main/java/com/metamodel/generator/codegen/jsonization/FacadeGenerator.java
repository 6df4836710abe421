package com.metamodel.generator.codegen.jsonization;

import java.util.ArrayList;
import java.util.List;

import com.metamodel.generator.codegen.naming.JavaNaming;
import com.metamodel.generator.codegen.util.JavaSourceUtil;
import com.metamodel.generator.model.ClassDefinition;
import com.metamodel.generator.model.ConcreteClass;
import com.metamodel.generator.model.Enumeration;
import com.metamodel.generator.model.OurType;
import com.metamodel.generator.model.SymbolTable;

/**
 * Generates the public {@code Jsonization.Deserialize} entry points, the only
 * place where a failed result becomes a {@code DeserializationException}.
 */
public class FacadeGenerator {

    private static final String EXCEPTION = """
            /**
             * Signal that the JSON could not be de-serialized.
             */
            public static final class DeserializationException extends RuntimeException {
                private static final long serialVersionUID = 1L;

                private final String path;
                private final String reason;

                public DeserializationException(String path, String reason) {
                    super(reason + " at: " + path);
                    this.path = path;
                    this.reason = reason;
                }

                /**
                 * JSON path to the failing value, e.g. {@code $.shapes[3].id}.
                 */
                public String getPath() {
                    return path;
                }

                public String getReason() {
                    return reason;
                }
            }""";

    /**
     * Generates {@code DeserializationException} followed by {@code Deserialize}, unindented.
     */
    public String generate(SymbolTable symbolTable) {
        List<String> blocks = new ArrayList<>();
        blocks.add("""
                private Deserialize() {
                    // Prevent instantiation
                }""");

        for (OurType ourType : symbolTable.getOurTypes()) {
            if (ourType instanceof Enumeration enumeration) {
                blocks.add(entryPoint(JavaNaming.enumName(enumeration.getName())));
            } else if (ourType instanceof ClassDefinition cls) {
                if (cls.getInterface().isPresent()) {
                    blocks.add(entryPoint(JavaNaming.interfaceName(cls.getName())));
                }
                if (cls instanceof ConcreteClass) {
                    blocks.add(entryPoint(JavaNaming.className(cls.getName())));
                }
            }
        }

        String deserialize = """
                /**
                 * De-serialize instances of the meta-model from JSON.
                 */
                public static final class Deserialize {
                %s
                }""".formatted(JavaSourceUtil.indent(JavaSourceUtil.joinBlocks(blocks), 1));

        return EXCEPTION + "\n\n" + deserialize;
    }

    String entryPoint(String javaType) {
        return """
                /**
                 * De-serialize an instance of {@link %1$s} from the JSON node.
                 *
                 * @throws DeserializationException if the node does not represent a valid instance
                 */
                public static %1$s %2$s(JsonNode node) {
                    Reporting.Result<%1$s> result = DeserializeImplementation.%2$s(node);
                    if (result.isError()) {
                        throw new DeserializationException(
                                Reporting.generateJsonPath(result.getError().getPathSegments()),
                                result.getError().getCause());
                    }
                    return result.getValue();
                }""".formatted(javaType, JavaNaming.fromMethodName(javaType));
    }
}
