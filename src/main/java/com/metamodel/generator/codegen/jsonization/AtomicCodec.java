package com.metamodel.generator.codegen.jsonization;

import com.metamodel.generator.model.OurType;
import com.metamodel.generator.model.PrimitiveType;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Codec of an atomic value: the parse routine to call and the Java type it yields.
 */
@Value
@Builder
public class AtomicCodec {

    @NonNull
    AtomicCodecKind kind;

    /**
     * Set for {@link AtomicCodecKind#PRIMITIVE}.
     */
    PrimitiveType primitiveType;

    /**
     * Set for all the kinds but primitives of built-in type.
     */
    OurType ourType;

    /**
     * Java type of a parsed value, boxed.
     */
    @NonNull
    String javaType;

    /**
     * Name of the routine in {@code DeserializeImplementation}.
     */
    @NonNull
    String parseMethod;
}
