// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.common.logging;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.equalTo;

class LoggingFormatterTest {

  private final LoggingFormatter formatter = new LoggingFormatter();

  private Map<String, Object> format(LogRecord logRecord) throws Exception {
    String json = formatter.format(logRecord);
    assertThat(json, endsWith("\n"));
    return new ObjectMapper().readValue(json, new TypeReference<>() {});
  }

  @Test
  void formattedRecord_containsSourceLevelAndMessage() throws Exception {
    LogRecord logRecord = new LogRecord(Level.INFO, "Scaling MachineSet {0} to {1} replicas");
    logRecord.setParameters(new Object[] {"workers-a", 3});
    logRecord.setSourceClassName("io.clusterapi.Scaler");
    logRecord.setSourceMethodName("scale");

    Map<String, Object> fields = format(logRecord);

    assertThat(fields.get("level"), equalTo(Level.INFO.getLocalizedName()));
    assertThat(fields.get("class"), equalTo("io.clusterapi.Scaler"));
    assertThat(fields.get("method"), equalTo("scale"));
    assertThat(fields.get("message"), equalTo("Scaling MachineSet workers-a to 3 replicas"));
    assertThat(fields.get("exception"), equalTo(""));
  }

  @Test
  void whenNoSourceClass_loggerNameIsUsed() throws Exception {
    LogRecord logRecord = new LogRecord(Level.FINE, "hello");
    logRecord.setSourceClassName(null);
    logRecord.setLoggerName("Actuator");

    assertThat(format(logRecord).get("class"), equalTo("Actuator"));
  }

  @Test
  void whenThrowablePresent_stackTraceIsIncluded() throws Exception {
    LogRecord logRecord = new LogRecord(Level.WARNING, "failed");
    logRecord.setThrown(new IllegalArgumentException("bad annotation"));

    assertThat((String) format(logRecord).get("exception"), containsString("bad annotation"));
  }
}
