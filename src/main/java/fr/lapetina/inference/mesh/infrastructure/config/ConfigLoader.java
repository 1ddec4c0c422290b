package fr.lapetina.inference.mesh.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads {@link MeshConfig} from YAML, looking on the file system first and then on the
 * classpath. Values are validated after loading.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(MeshConfig.class, new LoaderOptions()));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading fails or a value is invalid
     */
    public MeshConfig load() {
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    /**
     * Loads configuration from an input stream.
     */
    public MeshConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "stream");
    }

    private MeshConfig parse(InputStream is, String source) {
        MeshConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            config = new MeshConfig();
        }
        validate(config);
        return config;
    }

    static void validate(MeshConfig config) {
        MeshConfig.DisruptorConfig disruptor = config.getDisruptor();
        if (Integer.bitCount(disruptor.getRingBufferSize()) != 1) {
            throw new ConfigurationException(
                    "disruptor.ringBufferSize must be a power of 2, got " + disruptor.getRingBufferSize());
        }
        double tolerance = config.getConsensus().getByzantineTolerance();
        if (tolerance < 0 || tolerance >= 1) {
            throw new ConfigurationException("consensus.byzantineTolerance must be in [0, 1), got " + tolerance);
        }
        if (config.getInference().getRedundancy() < 1) {
            throw new ConfigurationException(
                    "inference.redundancy must be at least 1, got " + config.getInference().getRedundancy());
        }
        if (config.getNetwork().getMessageTtl() < 1) {
            throw new ConfigurationException(
                    "network.messageTtl must be positive, got " + config.getNetwork().getMessageTtl());
        }
        if (config.getDht().getBucketSize() < 1) {
            throw new ConfigurationException(
                    "dht.bucketSize must be at least 1, got " + config.getDht().getBucketSize());
        }
    }

    /**
     * Creates a default configuration.
     */
    public static MeshConfig createDefault() {
        return new MeshConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
