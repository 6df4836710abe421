package com.metamodel.generator.schema.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class PropertyDto {
    private String name;
    private String type;
    private String description;
}
