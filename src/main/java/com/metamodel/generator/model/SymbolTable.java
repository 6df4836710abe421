package com.metamodel.generator.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, fully resolved collection of the named types of a meta-model.
 */
public final class SymbolTable {

    private final List<OurType> ourTypes;
    private final Map<String, OurType> byName;

    SymbolTable(List<OurType> ourTypes) {
        this.ourTypes = List.copyOf(ourTypes);
        Map<String, OurType> index = new LinkedHashMap<>();
        for (OurType ourType : ourTypes) {
            index.put(ourType.getName(), ourType);
        }
        this.byName = index;
    }

    public List<OurType> getOurTypes() {
        return ourTypes;
    }

    public Optional<OurType> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public List<Enumeration> getEnumerations() {
        return ofKind(Enumeration.class);
    }

    public List<ConstrainedPrimitive> getConstrainedPrimitives() {
        return ofKind(ConstrainedPrimitive.class);
    }

    public List<ClassDefinition> getClasses() {
        return ofKind(ClassDefinition.class);
    }

    public List<ConcreteClass> getConcreteClasses() {
        return ofKind(ConcreteClass.class);
    }

    public List<Interface> getInterfaces() {
        return getClasses().stream()
                .map(ClassDefinition::getInterface)
                .flatMap(Optional::stream)
                .toList();
    }

    private <T extends OurType> List<T> ofKind(Class<T> kind) {
        return ourTypes.stream()
                .filter(kind::isInstance)
                .map(kind::cast)
                .toList();
    }
}
