package org.hdrequalize.config;

import java.util.Properties;

import javax.annotation.Nullable;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Read only view of the configured properties. Blank values are treated as missing.
 */
public class Config {

    private final Properties properties;

    Config(Properties properties) {
        this.properties = properties;
    }

    @Nullable
    public String getStringPropertyValue(String name) {
        String value = properties.getProperty(name);
        return StringUtils.isBlank(value) ? null : value.trim();
    }

    public String getStringPropertyValue(String name, String defaultValue) {
        String value = getStringPropertyValue(name);
        return value == null ? defaultValue : value;
    }

    public Integer getIntegerPropertyValue(String name, Integer defaultValue) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer value for " + name + ": " + value, e);
        }
    }

    public Double getDoublePropertyValue(String name, Double defaultValue) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value for " + name + ": " + value, e);
        }
    }

    public Boolean getBooleanPropertyValue(String name, Boolean defaultValue) {
        String value = getStringPropertyValue(name);
        return value == null ? defaultValue : Boolean.valueOf(value);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("properties", properties)
                .toString();
    }
}
