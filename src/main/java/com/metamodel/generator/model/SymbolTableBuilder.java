package com.metamodel.generator.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.metamodel.generator.common.GenerationError;
import com.metamodel.generator.common.GenerationOutcome;

/**
 * Resolves the declarations of named types into a {@link SymbolTable}.
 *
 * Binds the type references, links the classes to their parents and
 * descendants, collects the inherited properties, derives the constructor
 * arguments and synthesizes the interfaces. All problems are collected;
 * the table is only returned if there are none.
 */
public class SymbolTableBuilder {

    private final List<OurType> ourTypes;
    private final Map<String, OurType> byName = new LinkedHashMap<>();
    private final List<GenerationError> errors = new ArrayList<>();

    public SymbolTableBuilder(List<OurType> ourTypes) {
        this.ourTypes = List.copyOf(ourTypes);
    }

    public GenerationOutcome<SymbolTable> build() {
        indexNames();
        bindReferences();
        if (!errors.isEmpty()) {
            return GenerationOutcome.failure(errors);
        }

        resolveInheritances();
        if (!errors.isEmpty()) {
            return GenerationOutcome.failure(errors);
        }

        for (OurType ourType : ourTypes) {
            if (ourType instanceof ClassDefinition cls) {
                resolveMembers(cls);
            }
        }
        synthesizeInterfaces();

        if (!errors.isEmpty()) {
            return GenerationOutcome.failure(errors);
        }
        return GenerationOutcome.success(new SymbolTable(ourTypes));
    }

    private void indexNames() {
        for (OurType ourType : ourTypes) {
            OurType previous = byName.putIfAbsent(ourType.getName(), ourType);
            if (previous != null) {
                errors.add(GenerationError.of(ourType.getName(), "The name is defined more than once"));
            }
        }
    }

    private void bindReferences() {
        for (OurType ourType : ourTypes) {
            if (!(ourType instanceof ClassDefinition cls)) {
                continue;
            }
            for (Property property : cls.getOwnProperties()) {
                bind(cls, "property " + property.getName(), property.getTypeAnnotation());
            }
            if (cls.getArgumentDeclarations() != null) {
                for (ArgumentDeclaration declaration : cls.getArgumentDeclarations()) {
                    if (declaration.getTypeAnnotation() != null) {
                        bind(cls, "constructor argument " + declaration.getName(), declaration.getTypeAnnotation());
                    }
                }
            }
        }
    }

    private void bind(ClassDefinition cls, String where, TypeAnnotation annotation) {
        annotation.accept(new TypeAnnotationVisitor<Void>() {
            @Override
            public Void visit(PrimitiveTypeAnnotation primitive) {
                return null;
            }

            @Override
            public Void visit(OurTypeAnnotation reference) {
                OurType target = byName.get(reference.getName());
                if (target == null) {
                    errors.add(GenerationError.of(cls.getName(),
                            "The type of the " + where + " refers to an undefined type: " + reference.getName()));
                } else {
                    reference.bind(target);
                }
                return null;
            }

            @Override
            public Void visit(ListTypeAnnotation list) {
                return list.getItems().accept(this);
            }

            @Override
            public Void visit(OptionalTypeAnnotation optional) {
                return optional.getValue().accept(this);
            }
        });
    }

    private void resolveInheritances() {
        Map<ClassDefinition, List<ClassDefinition>> parents = new LinkedHashMap<>();
        for (OurType ourType : ourTypes) {
            if (!(ourType instanceof ClassDefinition cls)) {
                continue;
            }
            List<ClassDefinition> resolved = new ArrayList<>();
            for (String parentName : cls.getInheritanceNames()) {
                OurType parent = byName.get(parentName);
                if (parent instanceof ClassDefinition parentClass) {
                    resolved.add(parentClass);
                } else if (parent == null) {
                    errors.add(GenerationError.of(cls.getName(), "The parent class is not defined: " + parentName));
                } else {
                    errors.add(GenerationError.of(cls.getName(), "The parent is not a class: " + parentName));
                }
            }
            parents.put(cls, resolved);
        }
        if (!errors.isEmpty()) {
            return;
        }

        for (ClassDefinition cls : parents.keySet()) {
            if (reaches(cls, cls, parents, new HashSet<>())) {
                errors.add(GenerationError.of(cls.getName(), "The class inherits from itself"));
            }
        }
        if (!errors.isEmpty()) {
            return;
        }

        for (ClassDefinition cls : parents.keySet()) {
            List<ClassDefinition> descendants = new ArrayList<>();
            for (ClassDefinition candidate : parents.keySet()) {
                if (candidate != cls && reaches(candidate, cls, parents, new HashSet<>())) {
                    descendants.add(candidate);
                }
            }
            cls.resolveInheritance(parents.get(cls), descendants);
        }
    }

    private static boolean reaches(ClassDefinition from, ClassDefinition target,
                                   Map<ClassDefinition, List<ClassDefinition>> parents,
                                   Set<ClassDefinition> visited) {
        for (ClassDefinition parent : parents.get(from)) {
            if (parent == target) {
                return true;
            }
            if (visited.add(parent) && reaches(parent, target, parents, visited)) {
                return true;
            }
        }
        return false;
    }

    private void resolveMembers(ClassDefinition cls) {
        Map<String, Property> properties = new LinkedHashMap<>();
        collectProperties(cls, properties, new LinkedHashSet<>());

        List<Argument> arguments = new ArrayList<>();
        if (cls.getArgumentDeclarations() == null) {
            for (Property property : properties.values()) {
                arguments.add(Argument.builder()
                        .name(property.getName())
                        .typeAnnotation(property.getTypeAnnotation())
                        .build());
            }
        } else {
            for (ArgumentDeclaration declaration : cls.getArgumentDeclarations()) {
                TypeAnnotation type = declaration.getTypeAnnotation();
                if (type == null) {
                    Property property = properties.get(declaration.getName());
                    if (property == null) {
                        errors.add(GenerationError.of(cls.getName(),
                                "The constructor argument " + declaration.getName()
                                        + " has no type and there is no property to take it from"));
                        continue;
                    }
                    type = property.getTypeAnnotation();
                }
                arguments.add(Argument.builder()
                        .name(declaration.getName())
                        .typeAnnotation(type)
                        .defaultValue(declaration.getDefaultValue())
                        .build());
            }
        }
        cls.resolveMembers(new ArrayList<>(properties.values()), arguments);
    }

    private void collectProperties(ClassDefinition cls, Map<String, Property> into, Set<ClassDefinition> visited) {
        if (!visited.add(cls)) {
            return;
        }
        for (ClassDefinition parent : cls.getInheritances()) {
            collectProperties(parent, into, visited);
        }
        for (Property property : cls.getOwnProperties()) {
            Property inherited = into.putIfAbsent(property.getName(), property);
            if (inherited != null && inherited != property) {
                errors.add(GenerationError.of(cls.getName(),
                        "The property " + property.getName() + " is already defined in "
                                + inherited.getDeclaringClass()));
            }
        }
    }

    private void synthesizeInterfaces() {
        for (OurType ourType : ourTypes) {
            if (!(ourType instanceof ClassDefinition cls) || cls.getDescendants().isEmpty()) {
                continue;
            }
            List<ConcreteClass> implementers = new ArrayList<>();
            for (OurType candidate : ourTypes) {
                if (candidate instanceof ConcreteClass concrete
                        && (concrete == cls || cls.getDescendants().contains(concrete))) {
                    implementers.add(concrete);
                }
            }
            cls.resolveInterface(new Interface(cls, implementers), true);
        }

        for (OurType ourType : ourTypes) {
            if (ourType instanceof ClassDefinition cls && cls.getDescendants().isEmpty()) {
                boolean inHierarchy = cls.isModelTypeDeclared()
                        || cls.getInheritances().stream().anyMatch(SymbolTableBuilder::hasAncestorWithInterface);
                cls.resolveInterface(null, inHierarchy);
            }
        }
    }

    private static boolean hasAncestorWithInterface(ClassDefinition cls) {
        if (cls.getInterface().isPresent()) {
            return true;
        }
        return cls.getInheritances().stream().anyMatch(SymbolTableBuilder::hasAncestorWithInterface);
    }
}
