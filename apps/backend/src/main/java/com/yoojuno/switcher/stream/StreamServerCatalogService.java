package com.yoojuno.switcher.stream;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class StreamServerCatalogService {
    private static final Logger log = LoggerFactory.getLogger(StreamServerCatalogService.class);

    @Value("${stream-servers.file:./stream-servers.json}")
    private String catalogFile;

    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final Map<String, StreamServer> catalog = new LinkedHashMap<>();

    public StreamServerCatalogService(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    @PostConstruct
    public void load() {
        catalog.clear();
        Path path = Path.of(catalogFile).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            log.warn("Stream server catalog not found, no servers will be probed. path={}", path);
            return;
        }

        List<StreamServer> servers;
        try {
            servers = objectMapper.readValue(path.toFile(), new TypeReference<List<StreamServer>>() {
            });
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read stream server catalog " + path + ": " + e.getMessage(), e);
        }

        List<StreamServer> ordered = new ArrayList<>();
        for (StreamServer server : servers) {
            if (server == null) {
                continue;
            }
            validate(server);
            ordered.add(server);
        }
        ordered.sort(Comparator.comparingInt(StreamServer::priority));

        for (StreamServer server : ordered) {
            if (catalog.putIfAbsent(server.name(), server) != null) {
                throw new IllegalStateException("Duplicate stream server name '" + server.name() + "' in " + path);
            }
        }
        log.info("Loaded stream server catalog. path={}, servers={}", path, catalog.size());
    }

    public List<StreamServer> all() {
        return List.copyOf(catalog.values());
    }

    public Optional<StreamServer> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(catalog.get(name));
    }

    private void validate(StreamServer server) {
        Set<ConstraintViolation<StreamServer>> violations = validator.validate(server);
        if (violations.isEmpty()) {
            return;
        }
        String details = violations.stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
        throw new IllegalStateException("Invalid stream server '" + server.name() + "': " + details);
    }
}
