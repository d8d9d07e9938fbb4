package org.janelia.speckle.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Layers configuration properties; properties loaded later override the ones loaded before.
 */
public class ConfigProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigProvider.class);
    private static final String DEFAULT_CONFIG_RESOURCES = "/speckle-correction.properties";

    public static ConfigProvider getInstance() {
        return new ConfigProvider();
    }

    private final Properties properties = new Properties();

    private ConfigProvider() {
    }

    public ConfigProvider fromDefaultResources() {
        return fromResource(DEFAULT_CONFIG_RESOURCES);
    }

    public ConfigProvider fromResource(String resourceName) {
        try (InputStream configStream = ConfigProvider.class.getResourceAsStream(resourceName)) {
            if (configStream == null) {
                LOG.warn("Config resource {} not found", resourceName);
                return this;
            }
            Properties resourceProperties = new Properties();
            resourceProperties.load(configStream);
            properties.putAll(resourceProperties);
            return this;
        } catch (IOException e) {
            throw new IllegalStateException("Error reading config resource " + resourceName, e);
        }
    }

    public ConfigProvider fromFile(String fileName) {
        if (StringUtils.isBlank(fileName)) {
            return this;
        }
        Path configFile = Paths.get(fileName);
        if (!Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("Config file " + fileName + " not found");
        }
        try (Reader configReader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            Properties fileProperties = new Properties();
            fileProperties.load(configReader);
            LOG.info("Loaded {} properties from {}", fileProperties.size(), configFile);
            properties.putAll(fileProperties);
            return this;
        } catch (IOException e) {
            throw new IllegalStateException("Error reading config file " + fileName, e);
        }
    }

    public ConfigProvider fromProperties(Map<String, String> overrides) {
        if (overrides != null) {
            properties.putAll(overrides);
        }
        return this;
    }

    public Config get() {
        Properties configProperties = new Properties();
        configProperties.putAll(properties);
        return new Config(configProperties);
    }
}
