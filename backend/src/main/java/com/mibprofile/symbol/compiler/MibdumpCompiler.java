package com.mibprofile.symbol.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mibprofile.symbol.config.CompilerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs pysmi's {@code mibdump} with the JSON code generator and reads {@code <MIB>.json} from a scratch directory.
 * Dependency errors are tolerated: when mibdump exits non-zero but still wrote the JSON, the JSON is used.
 */
@RequiredArgsConstructor
@Slf4j
public class MibdumpCompiler implements MibCompiler {

    private final CompilerProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<JsonNode> compile(Path mibFile) {
        if (mibFile == null || !Files.isRegularFile(mibFile)) {
            log.warn("MIB file not found: {}", mibFile);
            return Optional.empty();
        }
        String mibName = mibName(mibFile);
        Path outputDir = null;
        try {
            outputDir = Files.createTempDirectory(workDir(), "mibdump-");
            List<String> command = buildCommand(mibFile, mibName, outputDir);
            log.debug("Command: {}", String.join(" ", command));

            ProcessBuilder builder = new ProcessBuilder(command);
            builder.redirectErrorStream(true);
            builder.redirectOutput(outputDir.resolve("mibdump.log").toFile());
            Process process = builder.start();
            if (!process.waitFor(properties.getTimeoutMs(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("mibdump timed out after {} ms for {}", properties.getTimeoutMs(), mibName);
                return Optional.empty();
            }
            if (process.exitValue() != 0) {
                log.warn("mibdump exited with {} for {}; checking for partial output", process.exitValue(), mibName);
            }
            Path json = outputDir.resolve(mibName + ".json");
            if (!Files.isRegularFile(json)) {
                log.warn("mibdump produced no JSON for {}", mibName);
                return Optional.empty();
            }
            return Optional.of(objectMapper.readTree(json.toFile()));
        } catch (IOException e) {
            log.warn("MIB compile failed for {}: {}", mibName, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("MIB compile interrupted for {}", mibName);
            return Optional.empty();
        } finally {
            MibCompiler.deleteRecursively(outputDir);
        }
    }

    List<String> buildCommand(Path mibFile, String mibName, Path outputDir) {
        List<String> command = new ArrayList<>();
        command.add(properties.getCommand());
        command.add("--destination-format=json");
        command.add("--destination-directory=" + outputDir.toAbsolutePath());
        command.add("--generate-mib-texts");
        Path parent = mibFile.toAbsolutePath().getParent();
        if (parent != null) {
            command.add("--mib-source=" + parent);
        }
        for (String source : properties.getMibSources()) {
            if (source != null && !source.isBlank()) {
                command.add("--mib-source=" + source.strip());
            }
        }
        command.add(mibName);
        return command;
    }

    static String mibName(Path mibFile) {
        String fileName = mibFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private Path workDir() throws IOException {
        String configured = properties.getWorkDir();
        Path dir = configured == null || configured.isBlank()
                ? Paths.get(System.getProperty("java.io.tmpdir"))
                : Paths.get(configured);
        Files.createDirectories(dir);
        return dir;
    }
}
