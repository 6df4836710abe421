package com.metamodel.generator.schema.dto;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named type in a meta-model dump. Which fields are used depends on {@link #kind}.
 */
@Data
@NoArgsConstructor
public class TypeDefinitionDto {

    public static final String ENUMERATION = "enumeration";
    public static final String CONSTRAINED_PRIMITIVE = "constrained_primitive";
    public static final String ABSTRACT_CLASS = "abstract_class";
    public static final String CONCRETE_CLASS = "concrete_class";

    private String kind;
    private String name;
    private String description;

    // enumeration
    private List<LiteralDto> literals = new ArrayList<>();

    // constrained_primitive
    private String constrainee;

    // abstract_class, concrete_class
    private List<String> inheritances = new ArrayList<>();
    private List<PropertyDto> properties = new ArrayList<>();
    private List<ArgumentDto> constructor;

    @JsonProperty("implementation_specific")
    private boolean implementationSpecific;

    @JsonProperty("with_model_type")
    private boolean withModelType;
}
