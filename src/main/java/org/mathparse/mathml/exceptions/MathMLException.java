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
 * Root of every failure raised while turning MathML text into a math tree.
 * <p>
 * Any instance is terminal for the parse call that raised it: no partial tree is ever returned.
 */
public class MathMLException extends RuntimeException {

  private static final long serialVersionUID = 3880206998166270511L;

  public MathMLException() {
    super();
  }

  public MathMLException(String message) {
    super(message);
  }

  public MathMLException(String message, Throwable cause) {
    super(message, cause);
  }

  public MathMLException(Throwable cause) {
    super(cause);
  }

}
