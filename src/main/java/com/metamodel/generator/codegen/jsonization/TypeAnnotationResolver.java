package com.metamodel.generator.codegen.jsonization;

import com.metamodel.generator.codegen.mapper.JavaTypeMapper;
import com.metamodel.generator.codegen.naming.JavaNaming;
import com.metamodel.generator.model.AbstractClass;
import com.metamodel.generator.model.AtomicTypeAnnotation;
import com.metamodel.generator.model.ConcreteClass;
import com.metamodel.generator.model.ConstrainedPrimitive;
import com.metamodel.generator.model.Enumeration;
import com.metamodel.generator.model.ListTypeAnnotation;
import com.metamodel.generator.model.OptionalTypeAnnotation;
import com.metamodel.generator.model.OurTypeAnnotation;
import com.metamodel.generator.model.OurTypeVisitor;
import com.metamodel.generator.model.PrimitiveType;
import com.metamodel.generator.model.PrimitiveTypeAnnotation;
import com.metamodel.generator.model.TypeAnnotation;
import com.metamodel.generator.model.TypeAnnotationVisitor;

/**
 * Decides the codec strategy of a type annotation.
 *
 * The resolver is pure and assumes a verified symbol table: shapes other than
 * atomic, list of atomic and optional of either are defects of the caller.
 */
public class TypeAnnotationResolver {

    public CodecStrategy resolve(TypeAnnotation annotation) {
        TypeAnnotation beneath = annotation.beneathOptional();
        boolean list = false;
        if (beneath instanceof ListTypeAnnotation listAnnotation) {
            list = true;
            beneath = listAnnotation.getItems();
        }
        if (!(beneath instanceof AtomicTypeAnnotation atomic)) {
            throw new IllegalStateException("Unsupported type annotation: " + annotation);
        }
        return new CodecStrategy(annotation.isOptional(), list, resolveAtomic(atomic));
    }

    public AtomicCodec resolveAtomic(AtomicTypeAnnotation annotation) {
        return annotation.accept(new TypeAnnotationVisitor<AtomicCodec>() {
            @Override
            public AtomicCodec visit(PrimitiveTypeAnnotation primitive) {
                return primitiveCodec(primitive.getType(), null);
            }

            @Override
            public AtomicCodec visit(OurTypeAnnotation reference) {
                return resolveOurType(reference);
            }

            @Override
            public AtomicCodec visit(ListTypeAnnotation list) {
                throw new IllegalStateException("Not an atomic type annotation: " + list);
            }

            @Override
            public AtomicCodec visit(OptionalTypeAnnotation optional) {
                throw new IllegalStateException("Not an atomic type annotation: " + optional);
            }
        });
    }

    /**
     * Name of the parse routine for the primitive type.
     */
    public static String parseMethodFor(PrimitiveType type) {
        return switch (type) {
            case BOOL -> "boolFrom";
            case INT -> "longFrom";
            case FLOAT -> "doubleFrom";
            case STR -> "stringFrom";
            case BYTEARRAY -> "bytesFrom";
        };
    }

    private AtomicCodec resolveOurType(OurTypeAnnotation reference) {
        return reference.getOurType().accept(new OurTypeVisitor<AtomicCodec>() {
            @Override
            public AtomicCodec visit(Enumeration enumeration) {
                String javaType = JavaNaming.enumName(enumeration.getName());
                return AtomicCodec.builder()
                        .kind(AtomicCodecKind.ENUMERATION)
                        .ourType(enumeration)
                        .javaType(javaType)
                        .parseMethod(JavaNaming.fromMethodName(javaType))
                        .build();
            }

            @Override
            public AtomicCodec visit(ConstrainedPrimitive constrainedPrimitive) {
                return primitiveCodec(constrainedPrimitive.getConstrainee(), constrainedPrimitive);
            }

            @Override
            public AtomicCodec visit(AbstractClass abstractClass) {
                String javaType = JavaNaming.interfaceName(abstractClass.getName());
                return AtomicCodec.builder()
                        .kind(AtomicCodecKind.INTERFACE)
                        .ourType(abstractClass)
                        .javaType(javaType)
                        .parseMethod(JavaNaming.fromMethodName(javaType))
                        .build();
            }

            @Override
            public AtomicCodec visit(ConcreteClass concreteClass) {
                boolean polymorphic = concreteClass.getInterface().isPresent();
                String javaType = polymorphic
                        ? JavaNaming.interfaceName(concreteClass.getName())
                        : JavaNaming.className(concreteClass.getName());
                return AtomicCodec.builder()
                        .kind(polymorphic ? AtomicCodecKind.INTERFACE : AtomicCodecKind.CLASS)
                        .ourType(concreteClass)
                        .javaType(javaType)
                        .parseMethod(JavaNaming.fromMethodName(javaType))
                        .build();
            }
        });
    }

    private static AtomicCodec primitiveCodec(PrimitiveType type, ConstrainedPrimitive constrained) {
        return AtomicCodec.builder()
                .kind(AtomicCodecKind.PRIMITIVE)
                .primitiveType(type)
                .ourType(constrained)
                .javaType(JavaTypeMapper.boxed(type))
                .parseMethod(parseMethodFor(type))
                .build();
    }
}
