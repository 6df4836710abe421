package com.metamodel.generator.schema.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class ArgumentDto {
    private String name;

    /**
     * Type of the argument; null means "same as the property".
     */
    private String type;

    @JsonProperty("default")
    private JsonNode defaultValue;
}
