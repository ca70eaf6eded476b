// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.waiter;

import java.io.Serial;

/** A read which failed, or returned data that is plausible but not yet converged. Waiters retry on it. */
public class TransientReadException extends RuntimeException {

  @Serial
  private static final long serialVersionUID = 1L;

  public TransientReadException(String message) {
    super(message);
  }

  public TransientReadException(String message, Throwable cause) {
    super(message, cause);
  }
}
