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
package org.mathparse.mathml.ast;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An XML processing instruction, {@code <?target value?>}.
 */
public final class ProcessingInstructionNode implements MathNode {

  private final String target;
  private final String value;

  /**
   * @param target required
   * @param value {@code null} when the instruction carries no data
   */
  public ProcessingInstructionNode(String target, String value) {
    this.target = Objects.requireNonNull(target, "target");
    this.value = value;
  }

  public String getTarget() {
    return target;
  }

  public String getValue() {
    return value;
  }

  @Override
  public List<MathNode> getChildren() {
    return Collections.emptyList();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ProcessingInstructionNode)) {
      return false;
    }
    ProcessingInstructionNode that = (ProcessingInstructionNode) o;
    return target.equals(that.target) && Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(target, value);
  }

  @Override
  public String toString() {
    return "PI(" + target + (value == null ? "" : ", " + value) + ")";
  }
}
