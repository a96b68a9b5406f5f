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
 * Nesting deeper than {@link org.mathparse.mathml.session.Configuration#getMaxDepth()}.
 */
public class MaxDepthExceededException extends BuilderException {

  private static final long serialVersionUID = -8315442718090640174L;

  private final int maxDepth;
  private final String location;

  public MaxDepthExceededException(int maxDepth, String location) {
    super("Document nesting exceeds the maximum depth of " + maxDepth + " at " + location + ".");
    this.maxDepth = maxDepth;
    this.location = location;
  }

  /**
   * The call stack ran out before {@code maxDepth} was reached.
   */
  public MaxDepthExceededException(int maxDepth, String location, Throwable cause) {
    super("Document nesting below " + location + " exhausted the call stack before reaching the maximum depth of "
        + maxDepth + ".", cause);
    this.maxDepth = maxDepth;
    this.location = location;
  }

  public int getMaxDepth() {
    return maxDepth;
  }

  public String getLocation() {
    return location;
  }

}
