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
import java.util.Objects;

/**
 * {@code <csymbol>}: a symbol defined outside MathML, referenced by URI.
 */
public final class CsymbolNode extends AbstractParentNode {

  private final String definitionUrl;
  private final String encoding;

  /**
   * @param definitionUrl required
   * @param encoding may be {@code null}
   * @param children converted content of the element
   */
  public CsymbolNode(String definitionUrl, String encoding, List<? extends MathNode> children) {
    super(children);
    this.definitionUrl = Objects.requireNonNull(definitionUrl, "definitionUrl");
    this.encoding = encoding;
  }

  public String getDefinitionUrl() {
    return definitionUrl;
  }

  /**
   * @return the encoding attribute verbatim, {@code null} if absent
   */
  public String getEncoding() {
    return encoding;
  }

  @Override
  public boolean equals(Object o) {
    if (!super.equals(o)) {
      return false;
    }
    CsymbolNode that = (CsymbolNode) o;
    return definitionUrl.equals(that.definitionUrl) && Objects.equals(encoding, that.encoding);
  }

  @Override
  public int hashCode() {
    return Objects.hash(super.hashCode(), definitionUrl, encoding);
  }

  @Override
  protected String getLabel() {
    return "Csymbol{definitionUrl=" + definitionUrl + (encoding == null ? "" : ", encoding=" + encoding) + "}";
  }
}
