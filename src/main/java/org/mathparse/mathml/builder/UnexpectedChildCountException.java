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
package org.mathparse.mathml.builder;

/**
 * A {@code <cn>} whose child nodes do not match the physical layout of its numeric type.
 */
public class UnexpectedChildCountException extends BuilderException {

  private static final long serialVersionUID = -1472085917005528836L;

  private final String numericType;
  private final String expected;
  private final int actual;

  public UnexpectedChildCountException(String numericType, String expected, int actual) {
    super("A <cn type=\"" + numericType + "\"> needs " + expected + " child node(s) but has " + actual + ".");
    this.numericType = numericType;
    this.expected = expected;
    this.actual = actual;
  }

  public String getNumericType() {
    return numericType;
  }

  /**
   * @return accepted child counts, e.g. {@code "3"} or {@code "1 or 3"}
   */
  public String getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }

}
