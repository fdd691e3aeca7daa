/*
 *  Copyright (c) 2025, WSO2 LLC. (https://www.wso2.com).
 *
 *  WSO2 LLC. licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except
 *  in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing,
 *  software distributed under the License is distributed on an
 *  "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 *  KIND, either express or implied.  See the License for the
 *  specific language governing permissions and limitations
 *  under the License.
 */
package org.wso2.carbon.messaging.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.commons.lang.BooleanUtils;
import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.math.NumberUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.util.Properties;

/**
 * Utility methods shared by the consumer and publisher: typed property lookups that fall back
 * to defaults, and the JSON mapper used for message bodies and failure envelopes.
 */
public class RabbitMQUtils {
    private static final Log log = LogFactory.getLog(RabbitMQUtils.class);

    private RabbitMQUtils() {
    }

    /**
     * Creates the Jackson mapper used to serialize published messages and dead-letter envelopes.
     * Timestamps are written as ISO-8601 strings.
     *
     * @return A configured {@link ObjectMapper}.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return objectMapper;
    }

    /**
     * Reads a string property, logging a warning and returning the default when it is not defined.
     *
     * @param properties   The configuration properties.
     * @param key          The property key.
     * @param defaultValue The value used when the key is absent or empty.
     * @param logPrefix    Prefix identifying the component in log output.
     * @return The configured value or the default.
     */
    public static String getStringProperty(Properties properties, String key, String defaultValue, String logPrefix) {
        String value = properties.getProperty(key);
        if (StringUtils.isEmpty(value)) {
            log.warn(logPrefix + " - " + key + " is not provided. Using default: " + defaultValue);
            return defaultValue;
        }
        return value.trim();
    }

    /**
     * Reads an integer property. Missing and unparseable values fall back to the default with a warning.
     *
     * @param properties   The configuration properties.
     * @param key          The property key.
     * @param defaultValue The value used when the key is absent or invalid.
     * @param logPrefix    Prefix identifying the component in log output.
     * @return The configured value or the default.
     */
    public static int getIntProperty(Properties properties, String key, int defaultValue, String logPrefix) {
        String value = properties.getProperty(key);
        if (StringUtils.isEmpty(value)) {
            log.warn(logPrefix + " - " + key + " is not provided. Using default: " + defaultValue);
            return defaultValue;
        }
        String trimmed = value.trim();
        if (isInteger(trimmed)) {
            try {
                return Integer.parseInt(trimmed);
            } catch (NumberFormatException e) {
                log.warn(logPrefix + " - Value for " + key + " is out of range: '" + value
                        + "'. Using default: " + defaultValue);
                return defaultValue;
            }
        }
        log.warn(logPrefix + " - Invalid value for " + key + " : '" + value + "'. Using default: " + defaultValue);
        return defaultValue;
    }

    /**
     * Reads a long property. Missing and unparseable values fall back to the default with a warning.
     *
     * @param properties   The configuration properties.
     * @param key          The property key.
     * @param defaultValue The value used when the key is absent or invalid.
     * @param logPrefix    Prefix identifying the component in log output.
     * @return The configured value or the default.
     */
    public static long getLongProperty(Properties properties, String key, long defaultValue, String logPrefix) {
        String value = properties.getProperty(key);
        if (StringUtils.isEmpty(value)) {
            if (log.isDebugEnabled()) {
                log.debug(logPrefix + " - " + key + " is not provided. Using default: " + defaultValue);
            }
            return defaultValue;
        }
        String trimmed = value.trim();
        if (isInteger(trimmed)) {
            try {
                return Long.parseLong(trimmed);
            } catch (NumberFormatException e) {
                log.warn(logPrefix + " - Value for " + key + " is out of range: '" + value
                        + "'. Using default: " + defaultValue);
                return defaultValue;
            }
        }
        log.warn(logPrefix + " - Invalid value for " + key + " : '" + value + "'. Using default: " + defaultValue);
        return defaultValue;
    }

    private static boolean isInteger(String value) {
        String digits = value.startsWith("-") ? value.substring(1) : value;
        return NumberUtils.isDigits(digits);
    }

    /**
     * Reads a boolean property. Values other than true/false/yes/no/on/off fall back to the default.
     *
     * @param properties   The configuration properties.
     * @param key          The property key.
     * @param defaultValue The value used when the key is absent or invalid.
     * @return The configured value or the default.
     */
    public static boolean getBooleanProperty(Properties properties, String key, boolean defaultValue) {
        return BooleanUtils.toBooleanDefaultIfNull(
                BooleanUtils.toBooleanObject(properties.getProperty(key)), defaultValue);
    }
}
