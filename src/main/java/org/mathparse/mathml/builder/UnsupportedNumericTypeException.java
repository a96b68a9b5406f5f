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

public class UnsupportedNumericTypeException extends BuilderException {

  private static final long serialVersionUID = -6719480612331569842L;

  private final String typeString;

  public UnsupportedNumericTypeException(String typeString) {
    super("Unsupported <cn> type '" + typeString + "'.");
    this.typeString = typeString;
  }

  public String getTypeString() {
    return typeString;
  }

}
