// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.common.utils;

import java.util.function.UnaryOperator;

public class CommonUtils {

  @SuppressWarnings({"FieldMayBeFinal", "CanBeFinal"})
  private static UnaryOperator<String> getEnvironmentVariable = System::getenv;

  private CommonUtils() {
    // no-op
  }

  /**
   * Returns true if the string is null or empty.
   *
   * @param value the string to check
   * @return true if there is nothing in the string
   */
  public static boolean isNullOrEmpty(String value) {
    return value == null || value.isEmpty();
  }

  /**
   * Returns the java system property value, treating an empty value as absent.
   *
   * @param propertyName the Java system property name
   * @return the system property value or null
   */
  public static String getNonEmptySystemProperty(String propertyName) {
    return getNonEmptySystemProperty(propertyName, null);
  }

  /**
   * Returns the java system property value or the default.
   * An empty string in the actual value is treated as null so that the default is returned.
   *
   * @param propertyName the Java system property name
   * @param defaultValue the default value
   * @return the system property value or the default
   */
  public static String getNonEmptySystemProperty(String propertyName, String defaultValue) {
    String propertyValue = System.getProperty(propertyName);
    return isNullOrEmpty(propertyValue) ? defaultValue : propertyValue;
  }

  /**
   * Get the named property from system environment or Java system property.
   * If the property is defined in the Environment, that value will take precedence over
   * Java properties.
   *
   * @param name the name of the environment variable, or Java property
   * @param defaultValue if no value is found in the environment or Java properties
   * @return the value of the property
   */
  public static String getEnvironmentProperty(String name, String defaultValue) {
    String envValue = getEnvironmentVariable.apply(name);
    return isNullOrEmpty(envValue) ? getNonEmptySystemProperty(name, defaultValue) : envValue;
  }

  /**
   * Get the named property as a whole number, falling back to the default when it is missing or unparseable.
   *
   * @param name the name of the environment variable, or Java property
   * @param defaultValue the value to use when none is configured
   * @return the configured value
   */
  public static long getEnvironmentProperty(String name, long defaultValue) {
    String value = getEnvironmentProperty(name, (String) null);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  /**
   * Get the named property as a boolean.
   *
   * @param name the name of the environment variable, or Java property
   * @param defaultValue the value to use when none is configured
   * @return the configured value
   */
  public static boolean getEnvironmentProperty(String name, boolean defaultValue) {
    String value = getEnvironmentProperty(name, (String) null);
    return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
  }
}
