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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base for nodes that own an ordered list of children.
 */
public abstract class AbstractParentNode implements MathNode {

  private final List<MathNode> children;

  protected AbstractParentNode(List<? extends MathNode> children) {
    Objects.requireNonNull(children, "children");
    List<MathNode> copy = new ArrayList<>(children.size());
    for (MathNode child : children) {
      copy.add(Objects.requireNonNull(child, "child"));
    }
    this.children = Collections.unmodifiableList(copy);
  }

  @Override
  public List<MathNode> getChildren() {
    return children;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return children.equals(((AbstractParentNode) o).children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass(), children);
  }

  protected abstract String getLabel();

  @Override
  public String toString() {
    return getLabel() + children;
  }
}
