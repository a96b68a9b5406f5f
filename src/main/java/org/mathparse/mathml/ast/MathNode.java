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

import java.util.List;

/**
 * A node of the math tree produced from MathML content markup.
 * <p>
 * Implementations are immutable and form a strict tree: a node is owned by exactly one parent and keeps no
 * reference back to it. {@link Object#equals(Object)} is exact; use {@link TolerantEquality} to compare trees that
 * carry floating point numbers.
 */
public interface MathNode {

  /**
   * @return child nodes in document order, never {@code null}; leaves return an empty list
   */
  List<MathNode> getChildren();

}
