package org.hdrequalize.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects configuration properties from several sources. Sources added later override the earlier ones.
 */
public class ConfigProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigProvider.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/hdrequalize.properties";

    private final Properties properties = new Properties();

    public static ConfigProvider getInstance() {
        return new ConfigProvider();
    }

    private ConfigProvider() {
    }

    public ConfigProvider fromDefaultResources() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    public ConfigProvider fromResource(String resourceName) {
        try (InputStream configStream = ConfigProvider.class.getResourceAsStream(resourceName)) {
            if (configStream == null) {
                LOG.warn("Config resource {} not found", resourceName);
            } else {
                LOG.debug("Read config from {}", resourceName);
                properties.load(configStream);
            }
            return this;
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading config resource " + resourceName, e);
        }
    }

    /**
     * Override the current settings with the properties from the given file. A blank file name is ignored.
     */
    public ConfigProvider fromFile(String fileName) {
        if (StringUtils.isBlank(fileName)) {
            return this;
        }
        try (Reader configReader = Files.newBufferedReader(Paths.get(fileName), StandardCharsets.UTF_8)) {
            LOG.info("Read config from {}", fileName);
            properties.load(configReader);
            return this;
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading config file " + fileName, e);
        }
    }

    public ConfigProvider fromProperties(Map<String, String> overrides) {
        properties.putAll(overrides);
        return this;
    }

    public Config get() {
        Properties configProperties = new Properties();
        configProperties.putAll(properties);
        return new Config(configProperties);
    }
}
