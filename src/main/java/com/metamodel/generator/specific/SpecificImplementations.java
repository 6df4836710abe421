package com.metamodel.generator.specific;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hand-written code fragments for the parts that can not be generated.
 */
public final class SpecificImplementations {
    private static final Logger log = LoggerFactory.getLogger(SpecificImplementations.class);

    private final Map<ImplementationKey, String> fragments;

    private SpecificImplementations(Map<ImplementationKey, String> fragments) {
        this.fragments = Map.copyOf(fragments);
    }

    public static SpecificImplementations empty() {
        return new SpecificImplementations(Map.of());
    }

    public static SpecificImplementations of(Map<ImplementationKey, String> fragments) {
        return new SpecificImplementations(fragments);
    }

    /**
     * Loads every {@code *.java} file below the directory, keyed by its
     * relative path with forward slashes.
     */
    public static SpecificImplementations load(Path directory) throws IOException {
        Map<ImplementationKey, String> fragments = new LinkedHashMap<>();
        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(ImplementationKey.EXTENSION))
                    .sorted()
                    .toList();
        }
        for (Path file : files) {
            String relative = directory.relativize(file).toString().replace('\\', '/');
            fragments.put(new ImplementationKey(relative), Files.readString(file, StandardCharsets.UTF_8));
            log.debug("Loaded specific implementation {}", relative);
        }
        log.info("Loaded {} specific implementation(s) from {}", fragments.size(), directory);
        return new SpecificImplementations(fragments);
    }

    public Optional<String> get(ImplementationKey key) {
        return Optional.ofNullable(fragments.get(key));
    }

    public int size() {
        return fragments.size();
    }
}
