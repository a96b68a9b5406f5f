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
package org.mathparse.mathml.parsing;

import org.w3c.dom.Node;

/**
 * The node kinds the math tree builder understands.
 */
public enum XNodeType {
  DOCUMENT,
  ELEMENT,
  /**
   * Character data, CDATA sections included.
   */
  TEXT,
  PROCESSING_INSTRUCTION,
  COMMENT;

  /**
   * @param domNodeType one of the {@link Node} type constants
   * @return the matching kind, or {@code null} for DOM node kinds without a counterpart (entity references, doctype)
   */
  public static XNodeType forDomNodeType(short domNodeType) {
    switch (domNodeType) {
      case Node.DOCUMENT_NODE:
        return DOCUMENT;
      case Node.ELEMENT_NODE:
        return ELEMENT;
      case Node.TEXT_NODE:
      case Node.CDATA_SECTION_NODE:
        return TEXT;
      case Node.PROCESSING_INSTRUCTION_NODE:
        return PROCESSING_INSTRUCTION;
      case Node.COMMENT_NODE:
        return COMMENT;
      default:
        return null;
    }
  }
}
