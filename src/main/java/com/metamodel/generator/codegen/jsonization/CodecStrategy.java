package com.metamodel.generator.codegen.jsonization;

import lombok.NonNull;
import lombok.Value;

/**
 * Codec of a property or constructor argument: an atomic codec, possibly
 * applied to the items of a list, possibly optional.
 */
@Value
public class CodecStrategy {

    boolean optional;

    boolean list;

    @NonNull
    AtomicCodec atomic;

    /**
     * Java type of the value held by the deserialization slot, boxed.
     */
    public String slotType() {
        return list ? "List<" + atomic.getJavaType() + ">" : atomic.getJavaType();
    }
}
