package com.metamodel.generator.codegen;

import java.io.IOException;
import java.util.List;

import com.metamodel.generator.codegen.model.output.GeneratedFile;
import com.metamodel.generator.common.GenerationOutcome;
import com.metamodel.generator.model.SymbolTable;
import com.metamodel.generator.specific.SpecificImplementations;

/**
 * Generates the files of a target language from a verified symbol table.
 *
 * Implementations write nothing; they return the files or every error found.
 */
public interface TargetGenerator {

    GenerationOutcome<List<GeneratedFile>> generate(SymbolTable symbolTable,
                                                    SpecificImplementations specifics,
                                                    GeneratorConfig config) throws IOException;
}
