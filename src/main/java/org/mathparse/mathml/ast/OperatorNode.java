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

public final class OperatorNode implements MathNode {

  private final OperatorTag tag;

  public OperatorNode(OperatorTag tag) {
    this.tag = Objects.requireNonNull(tag, "tag");
  }

  public OperatorTag getTag() {
    return tag;
  }

  @Override
  public List<MathNode> getChildren() {
    return Collections.emptyList();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof OperatorNode && tag == ((OperatorNode) o).tag);
  }

  @Override
  public int hashCode() {
    return tag.hashCode();
  }

  @Override
  public String toString() {
    return "Op(" + tag.getTagName() + ")";
  }
}
