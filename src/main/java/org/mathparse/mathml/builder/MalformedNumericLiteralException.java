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
 * The text of a {@code <cn>} element cannot be read as a number of its declared type and base.
 */
public class MalformedNumericLiteralException extends BuilderException {

  private static final long serialVersionUID = 2307758116457036129L;

  private final String reason;

  public MalformedNumericLiteralException(String reason) {
    super("Malformed numeric literal: " + reason);
    this.reason = reason;
  }

  public MalformedNumericLiteralException(String reason, Throwable cause) {
    super("Malformed numeric literal: " + reason, cause);
    this.reason = reason;
  }

  public String getReason() {
    return reason;
  }

}
