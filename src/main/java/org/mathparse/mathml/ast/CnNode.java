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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code <cn>} numeric literal.
 */
public final class CnNode implements MathNode {

  public static final int DEFAULT_BASE = 10;

  private final NumType numType;
  /**
   * Radix of {@link NumType.Int} and {@link NumType.Rational}, recorded but unused for the other kinds
   */
  private final int base;
  private final String definitionUrl;
  private final String encoding;
  /**
   * Namespaced vendor attributes keyed {@code "<namespaceUri>:<localName>"}, {@code null} when there were none
   */
  private final Map<String, String> attributes;

  public CnNode(NumType numType) {
    this(numType, DEFAULT_BASE, null, null, null);
  }

  public CnNode(NumType numType, int base, String definitionUrl, String encoding, Map<String, String> attributes) {
    this.numType = Objects.requireNonNull(numType, "numType");
    this.base = base;
    this.definitionUrl = definitionUrl;
    this.encoding = encoding;
    this.attributes = attributes == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public NumType getNumType() {
    return numType;
  }

  public int getBase() {
    return base;
  }

  /**
   * @return the attribute verbatim, {@code null} if absent
   */
  public String getDefinitionUrl() {
    return definitionUrl;
  }

  /**
   * @return the attribute verbatim, {@code null} if absent
   */
  public String getEncoding() {
    return encoding;
  }

  /**
   * @return unmodifiable vendor attributes, or {@code null} if the element carried none
   */
  public Map<String, String> getAttributes() {
    return attributes;
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
    if (!(o instanceof CnNode)) {
      return false;
    }
    CnNode that = (CnNode) o;
    return base == that.base
        && numType.equals(that.numType)
        && Objects.equals(definitionUrl, that.definitionUrl)
        && Objects.equals(encoding, that.encoding)
        && Objects.equals(attributes, that.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(numType, base, definitionUrl, encoding, attributes);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Cn{").append(numType);
    if (base != DEFAULT_BASE) {
      sb.append(", base=").append(base);
    }
    if (definitionUrl != null) {
      sb.append(", definitionUrl=").append(definitionUrl);
    }
    if (encoding != null) {
      sb.append(", encoding=").append(encoding);
    }
    if (attributes != null) {
      sb.append(", attributes=").append(attributes);
    }
    return sb.append('}').toString();
  }
}
