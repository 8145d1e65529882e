/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.queryplan.exception;

/** Base class for errors raised while reading, building or validating a plan document. */
public class PlanModelException extends RuntimeException {

  public PlanModelException(String message) {
    super(message);
  }

  public PlanModelException(String message, Throwable cause) {
    super(message, cause);
  }
}
