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

public class InvalidBaseException extends BuilderException {

  private static final long serialVersionUID = 5021960342468219367L;

  private final String rawBase;

  public InvalidBaseException(String rawBase) {
    super("Invalid base '" + rawBase + "', expected an integer between " + Character.MIN_RADIX + " and "
        + Character.MAX_RADIX + ".");
    this.rawBase = rawBase;
  }

  public String getRawBase() {
    return rawBase;
  }

}
