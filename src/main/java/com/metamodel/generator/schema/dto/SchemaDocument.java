package com.metamodel.generator.schema.dto;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Root of a meta-model dump as read from JSON.
 */
@Data
@NoArgsConstructor
public class SchemaDocument {
    private List<TypeDefinitionDto> types = new ArrayList<>();
}
