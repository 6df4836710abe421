package com.metamodel.generator.codegen.mapper;

import com.metamodel.generator.codegen.naming.JavaNaming;
import com.metamodel.generator.model.AbstractClass;
import com.metamodel.generator.model.ConcreteClass;
import com.metamodel.generator.model.ConstrainedPrimitive;
import com.metamodel.generator.model.Enumeration;
import com.metamodel.generator.model.ListTypeAnnotation;
import com.metamodel.generator.model.OptionalTypeAnnotation;
import com.metamodel.generator.model.OurType;
import com.metamodel.generator.model.OurTypeAnnotation;
import com.metamodel.generator.model.OurTypeVisitor;
import com.metamodel.generator.model.PrimitiveType;
import com.metamodel.generator.model.PrimitiveTypeAnnotation;
import com.metamodel.generator.model.TypeAnnotation;
import com.metamodel.generator.model.TypeAnnotationVisitor;

import lombok.experimental.UtilityClass;

/**
 * Maps meta-model type annotations to Java types.
 *
 * Required primitives are unboxed; optional values and list items are boxed so
 * that they can be absent. Class references prefer the interface, if any, to
 * allow for polymorphism.
 */
@UtilityClass
public class JavaTypeMapper {

    public static String javaType(TypeAnnotation annotation) {
        return annotation.accept(new TypeAnnotationVisitor<String>() {
            @Override
            public String visit(PrimitiveTypeAnnotation primitive) {
                return unboxed(primitive.getType());
            }

            @Override
            public String visit(OurTypeAnnotation reference) {
                return reference.getOurType().accept(new OurTypeVisitor<String>() {
                    @Override
                    public String visit(Enumeration enumeration) {
                        return atomicTypeName(enumeration);
                    }

                    @Override
                    public String visit(ConstrainedPrimitive constrainedPrimitive) {
                        return unboxed(constrainedPrimitive.getConstrainee());
                    }

                    @Override
                    public String visit(AbstractClass abstractClass) {
                        return atomicTypeName(abstractClass);
                    }

                    @Override
                    public String visit(ConcreteClass concreteClass) {
                        return atomicTypeName(concreteClass);
                    }
                });
            }

            @Override
            public String visit(ListTypeAnnotation list) {
                return "List<" + boxedType(list.getItems()) + ">";
            }

            @Override
            public String visit(OptionalTypeAnnotation optional) {
                return boxedType(optional.getValue());
            }
        });
    }

    /**
     * Java type which can hold null.
     */
    public static String boxedType(TypeAnnotation annotation) {
        if (annotation instanceof PrimitiveTypeAnnotation primitive) {
            return boxed(primitive.getType());
        }
        if (annotation instanceof OurTypeAnnotation reference
                && reference.getOurType() instanceof ConstrainedPrimitive constrained) {
            return boxed(constrained.getConstrainee());
        }
        if (annotation instanceof OptionalTypeAnnotation optional) {
            return boxedType(optional.getValue());
        }
        return javaType(annotation);
    }

    /**
     * Name of the Java type standing for a named type when it is referenced.
     */
    public static String atomicTypeName(OurType ourType) {
        return ourType.accept(new OurTypeVisitor<String>() {
            @Override
            public String visit(Enumeration enumeration) {
                return JavaNaming.enumName(enumeration.getName());
            }

            @Override
            public String visit(ConstrainedPrimitive constrainedPrimitive) {
                return boxed(constrainedPrimitive.getConstrainee());
            }

            @Override
            public String visit(AbstractClass abstractClass) {
                return JavaNaming.interfaceName(abstractClass.getName());
            }

            @Override
            public String visit(ConcreteClass concreteClass) {
                return concreteClass.getInterface().isPresent()
                        ? JavaNaming.interfaceName(concreteClass.getName())
                        : JavaNaming.className(concreteClass.getName());
            }
        });
    }

    public static String unboxed(PrimitiveType type) {
        return switch (type) {
            case BOOL -> "boolean";
            case INT -> "long";
            case FLOAT -> "double";
            case STR -> "String";
            case BYTEARRAY -> "byte[]";
        };
    }

    public static String boxed(PrimitiveType type) {
        return switch (type) {
            case BOOL -> "Boolean";
            case INT -> "Long";
            case FLOAT -> "Double";
            case STR -> "String";
            case BYTEARRAY -> "byte[]";
        };
    }

    /**
     * Whether values of the type are compared by content in {@code equals}.
     */
    public static boolean isByteArray(TypeAnnotation annotation) {
        TypeAnnotation beneath = annotation.beneathOptional();
        if (beneath instanceof PrimitiveTypeAnnotation primitive) {
            return primitive.getType() == PrimitiveType.BYTEARRAY;
        }
        return beneath instanceof OurTypeAnnotation reference
                && reference.getOurType() instanceof ConstrainedPrimitive constrained
                && constrained.getConstrainee() == PrimitiveType.BYTEARRAY;
    }

    /**
     * Whether the type maps to a Java primitive, i.e. can not be null.
     */
    public static boolean isUnboxed(TypeAnnotation annotation) {
        String type = javaType(annotation);
        return type.equals("boolean") || type.equals("long") || type.equals("double");
    }
}
