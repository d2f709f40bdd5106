package com.yuzhi.dts.iac.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the desired configuration from a directory. Every file is optional; an absent file manages nothing of its
 * kinds.
 */
@Component
public class DesiredConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DesiredConfigLoader.class);

    public static final String CONNECTIONS_FILE = "connections.yaml";
    public static final String PROJECTS_FILE = "projects.yaml";
    public static final String ROLES_FILE = "roles.yaml";
    public static final String FOLDERS_FILE = "folders.yaml";
    public static final String OIDC_FILE = "oidc.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final DesiredResourceMapper mapper;

    public DesiredConfigLoader(DesiredResourceMapper mapper) {
        this.mapper = mapper;
    }

    public DesiredConfig load(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new ConfigLoadException("Config directory not found: " + directory.toAbsolutePath());
        }
        DesiredConfig config = new DesiredConfig(
            mapper.connections(read(directory, CONNECTIONS_FILE), CONNECTIONS_FILE),
            mapper.projects(read(directory, PROJECTS_FILE), PROJECTS_FILE),
            mapper.roles(read(directory, ROLES_FILE), ROLES_FILE),
            mapper.folders(read(directory, FOLDERS_FILE), FOLDERS_FILE),
            mapper.oidc(read(directory, OIDC_FILE), OIDC_FILE)
        );
        LOG.info(
            "Loaded desired config from {}: {} connections, {} projects, {} folders, roles={}, oidc={}",
            directory,
            config.connections().size(),
            config.projects().size(),
            config.folders().size(),
            config.hasRoles(),
            config.hasOidc()
        );
        return config;
    }

    private Object read(Path directory, String fileName) {
        Path file = directory.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            LOG.debug("{} not present, skipped", file);
            return null;
        }
        try {
            if (Files.size(file) == 0) {
                return null;
            }
            try (InputStream in = Files.newInputStream(file)) {
                return yamlMapper.readValue(in, Object.class);
            }
        } catch (IOException ex) {
            throw new ConfigLoadException("Cannot read " + fileName + ": " + ex.getMessage(), ex);
        }
    }
}
