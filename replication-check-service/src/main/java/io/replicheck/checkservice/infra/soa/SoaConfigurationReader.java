package io.replicheck.checkservice.infra.soa;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads per-service YAML files from a SOA configuration directory laid out as
 * {@code <soa-dir>/<service>/<file>.yaml}.
 */
public class SoaConfigurationReader {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Path soaDir;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public SoaConfigurationReader(Path soaDir) {
        this.soaDir = Objects.requireNonNull(soaDir, "soaDir");
    }

    public Path soaDir() {
        return soaDir;
    }

    /**
     * Lists service directories, sorted by name.
     *
     * @throws IllegalStateException if the SOA directory itself cannot be listed
     */
    public List<String> listServices() {
        if (!Files.isDirectory(soaDir)) {
            throw new IllegalStateException("SOA directory " + soaDir + " does not exist or is not a directory");
        }
        List<String> services = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(soaDir, Files::isDirectory)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                if (!name.startsWith(".")) {
                    services.add(name);
                }
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to list SOA directory " + soaDir, ex);
        }
        Collections.sort(services);
        return services;
    }

    /**
     * Reads {@code <soa-dir>/<service>/<fileName>} as a mapping.
     *
     * @return the parsed mapping, or empty when the file does not exist
     * @throws SoaConfigurationException when the file exists but is unreadable or not a mapping
     */
    public Optional<Map<String, Object>> readMapping(String service, String fileName) {
        Path file = soaDir.resolve(service).resolve(fileName);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = yamlMapper.readTree(file.toFile());
        } catch (IOException ex) {
            throw new SoaConfigurationException("Failed to read " + file + ": " + ex.getMessage(), ex);
        }
        // empty and comment-only documents
        if (root == null || root.isMissingNode() || root.isNull()) {
            return Optional.of(Map.of());
        }
        if (!root.isObject()) {
            throw new SoaConfigurationException(
                "Expected a mapping in " + file + " but found " + root.getNodeType(), null);
        }
        Map<String, Object> parsed = yamlMapper.convertValue(root, MAP_TYPE);
        return Optional.of(Collections.unmodifiableMap(new LinkedHashMap<>(parsed)));
    }
}
