package com.metamodel.generator.schema.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class LiteralDto {
    private String name;
    private String value;
    private String description;
}
