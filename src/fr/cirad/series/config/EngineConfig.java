/*******************************************************************************
 * MGDB Series - indexed series transforms, queries and factorization
 * Copyright (C) 2016 - 2025, <CIRAD> <IRD>
 *
 * This program is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Affero General Public License, version 3 as published by
 * the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
 * FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * See <http://www.gnu.org/licenses/agpl.html> for details about GNU General
 * Public License V3.
 *******************************************************************************/
package fr.cirad.series.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.apache.commons.lang.StringUtils;
import org.apache.log4j.Logger;

/**
 * Engine settings, read from series-engine.properties on the classpath.
 * A JVM system property with the same name overrides the file value.
 */
public class EngineConfig {

    static private final Logger LOG = Logger.getLogger(EngineConfig.class);

    public static final String RESOURCE_NAME = "series-engine.properties";

    public static final String THREADS = "series.threads";
    public static final String PARTITIONS = "series.partitions";
    public static final String ZERO_VARIANCE_POLICY = "series.zeroVariancePolicy";
    public static final String ZERO_VARIANCE_EPSILON = "series.zeroVarianceEpsilon";
    public static final String NORMALIZE_PERCENTILE = "series.normalize.percentile";
    public static final String NORMALIZE_OFFSET = "series.normalize.offset";
    public static final String SVD_MAX_ITERATIONS = "svd.maxIterations";
    public static final String SVD_TOLERANCE = "svd.tolerance";
    public static final String SVD_SEED = "svd.seed";

    private static EngineConfig defaultInstance;

    private final Properties props;

    public EngineConfig(Properties props) {
        this.props = props;
    }

    /**
     * @return the configuration loaded from the classpath resource (loaded once)
     */
    public static synchronized EngineConfig getDefault() {
        if (defaultInstance == null)
            defaultInstance = load(RESOURCE_NAME);
        return defaultInstance;
    }

    public static EngineConfig load(String resourceName) {
        Properties props = new Properties();
        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (is == null)
                LOG.info("No " + resourceName + " found on classpath, using built-in defaults");
            else {
                props.load(is);
                LOG.debug("Loaded " + props.size() + " settings from " + resourceName);
            }
        }
        catch (IOException ioe) {
            LOG.warn("Unable to read " + resourceName + ", using built-in defaults", ioe);
        }
        return new EngineConfig(props);
    }

    /**
     * @return a copy of this configuration with one setting replaced
     */
    public EngineConfig with(String key, Object value) {
        Properties copy = new Properties();
        copy.putAll(props);
        copy.setProperty(key, String.valueOf(value));
        return new EngineConfig(copy);
    }

    public String get(String key) {
        String sysValue = System.getProperty(key);
        if (StringUtils.isNotBlank(sysValue))
            return sysValue.trim();
        String value = props.getProperty(key);
        return StringUtils.isBlank(value) ? null : value.trim();
    }

    public int getInt(String key, int defaultValue) {
        String value = get(key);
        if (value == null)
            return defaultValue;
        try {
            return Integer.parseInt(value);
        }
        catch (NumberFormatException nfe) {
            LOG.warn("Invalid integer for " + key + ": '" + value + "', using " + defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = get(key);
        if (value == null)
            return defaultValue;
        try {
            return Long.parseLong(value);
        }
        catch (NumberFormatException nfe) {
            LOG.warn("Invalid long for " + key + ": '" + value + "', using " + defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = get(key);
        if (value == null)
            return defaultValue;
        try {
            return Double.parseDouble(value);
        }
        catch (NumberFormatException nfe) {
            LOG.warn("Invalid number for " + key + ": '" + value + "', using " + defaultValue);
            return defaultValue;
        }
    }

    /**
     * Thread count heuristic: half the available processors unless configured.
     */
    public int getThreadCount() {
        int threads = getInt(THREADS, 0);
        return threads > 0 ? threads : Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
    }

    public int getDefaultPartitionCount() {
        return Math.max(1, getInt(PARTITIONS, 4));
    }

    public ZeroVariancePolicy getZeroVariancePolicy() {
        String value = get(ZERO_VARIANCE_POLICY);
        if (value == null)
            return ZeroVariancePolicy.FAIL;
        try {
            return ZeroVariancePolicy.valueOf(value.toUpperCase());
        }
        catch (IllegalArgumentException iae) {
            LOG.warn("Invalid value for " + ZERO_VARIANCE_POLICY + ": '" + value + "', using " + ZeroVariancePolicy.FAIL);
            return ZeroVariancePolicy.FAIL;
        }
    }

    public double getZeroVarianceEpsilon() {
        return getDouble(ZERO_VARIANCE_EPSILON, 1e-20);
    }

    public double getNormalizePercentile() {
        return getDouble(NORMALIZE_PERCENTILE, 20);
    }

    public double getNormalizeOffset() {
        return getDouble(NORMALIZE_OFFSET, 0.1);
    }

    public int getSvdMaxIterations() {
        return getInt(SVD_MAX_ITERATIONS, 200);
    }

    public double getSvdTolerance() {
        return getDouble(SVD_TOLERANCE, 1e-10);
    }

    public long getSvdSeed() {
        return getLong(SVD_SEED, 42);
    }
}
