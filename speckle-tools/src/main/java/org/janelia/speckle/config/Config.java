package org.janelia.speckle.config;

import java.util.Arrays;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

/**
 * Read only view of the configuration properties.
 */
public class Config {

    private final Properties properties;

    Config(Properties properties) {
        this.properties = properties;
    }

    public String getStringPropertyValue(String name) {
        return StringUtils.trimToNull(properties.getProperty(name));
    }

    public String getStringPropertyValue(String name, String defaultValue) {
        String value = getStringPropertyValue(name);
        return value != null ? value : defaultValue;
    }

    public boolean hasProperty(String name) {
        return getStringPropertyValue(name) != null;
    }

    public int getIntegerPropertyValue(String name, int defaultValue) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer value for " + name + ": " + value, e);
        }
    }

    public double getDoublePropertyValue(String name, double defaultValue) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value for " + name + ": " + value, e);
        }
    }

    /**
     * Comma separated list of numbers.
     */
    public double[] getDoubleArrayPropertyValue(String name, double[] defaultValue) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Arrays.stream(StringUtils.split(value, ','))
                    .map(String::trim)
                    .filter(StringUtils::isNotEmpty)
                    .mapToDouble(Double::parseDouble)
                    .toArray();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid list of numbers for " + name + ": " + value, e);
        }
    }

    @Override
    public String toString() {
        return properties.toString();
    }
}
