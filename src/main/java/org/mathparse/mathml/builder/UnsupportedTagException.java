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
 * An element (or DOM node kind) that has no meaning in the supported MathML subset.
 */
public class UnsupportedTagException extends BuilderException {

  private static final long serialVersionUID = 4128730377263465218L;

  private final String tag;
  private final String location;

  public UnsupportedTagException(String tag, String location) {
    super("Unsupported element <" + tag + "> at " + location + ".");
    this.tag = tag;
    this.location = location;
  }

  public String getTag() {
    return tag;
  }

  /**
   * @return slash separated element path of the offending node, e.g. {@code math/apply/bogus}
   */
  public String getLocation() {
    return location;
  }

}
