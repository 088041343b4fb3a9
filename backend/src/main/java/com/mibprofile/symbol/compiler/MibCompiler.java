package com.mibprofile.symbol.compiler;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Compiles a raw MIB module into a symbol table {@code {symbolName: {oid, nodetype, description, ...}}}.
 * Implementations never throw: any failure yields an empty result ("no data").
 */
public interface MibCompiler {

    /**
     * Compile the MIB module in the given file. The module name is the file name without extension.
     */
    Optional<JsonNode> compile(Path mibFile);

    /**
     * Compile MIB source text by staging it as {@code <mibName>.mib} in a temporary directory.
     */
    default Optional<JsonNode> compileSource(String mibName, String source) {
        if (mibName == null || mibName.isBlank() || source == null || source.isBlank()) {
            return Optional.empty();
        }
        Path dir = null;
        try {
            dir = Files.createTempDirectory("mib-src-");
            Path file = dir.resolve(mibName + ".mib");
            Files.writeString(file, source, StandardCharsets.UTF_8);
            return compile(file);
        } catch (IOException e) {
            return Optional.empty();
        } finally {
            deleteRecursively(dir);
        }
    }

    static void deleteRecursively(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            dir.toFile().deleteOnExit();
        }
    }
}
