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
package org.mathparse.mathml.parsing;

import org.mathparse.mathml.exceptions.MathMLException;

/**
 * The (sanitized) input is not well-formed XML.
 */
public class XmlSyntaxException extends MathMLException {

  private static final long serialVersionUID = -2149853076530482113L;

  private final int lineNumber;
  private final int columnNumber;

  public XmlSyntaxException(String message, Throwable cause) {
    this(message, -1, -1, cause);
  }

  public XmlSyntaxException(String message, int lineNumber, int columnNumber, Throwable cause) {
    super(message, cause);
    this.lineNumber = lineNumber;
    this.columnNumber = columnNumber;
  }

  /**
   * @return 1-based line of the error, or -1 when the XML parser did not report one
   */
  public int getLineNumber() {
    return lineNumber;
  }

  public int getColumnNumber() {
    return columnNumber;
  }

}
