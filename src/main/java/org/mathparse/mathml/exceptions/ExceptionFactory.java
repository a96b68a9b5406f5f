/*
 *    Copyright 2009-2021 the original author or authors.
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */
package org.mathparse.mathml.exceptions;

/**
 * Converts foreign failures (I/O, parser setup) into {@link MathMLException}.
 */
public class ExceptionFactory {

  private ExceptionFactory() {
    // Prevent Instantiation
  }

  /**
   * Wraps {@code e} unless it already is a {@link MathMLException}, in which case it is returned as is so callers
   * keep the specific error kind.
   *
   * @param message what was being attempted
   * @param e the failure
   * @return the exception to throw
   */
  public static MathMLException wrapException(String message, Exception e) {
    if (e instanceof MathMLException) {
      return (MathMLException) e;
    }
    return new MathMLException(message + " Cause: " + e, e);
  }

}
