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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import javax.xml.XMLConstants;

import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.w3c.dom.ProcessingInstruction;

/**
 * Read-only view over a namespace aware DOM node.
 */
public class XNode {

  /**
   * The wrapped DOM node
   */
  private final Node node;
  /**
   * Local name for elements, the DOM node name ({@code #text}, {@code #comment}, PI target, ...) otherwise
   */
  private final String name;
  private final XNodeType type;

  public XNode(Node node) {
    this.node = node;
    this.type = XNodeType.forDomNodeType(node.getNodeType());
    String localName = node.getNodeType() == Node.ELEMENT_NODE ? node.getLocalName() : null;
    this.name = localName != null ? localName : node.getNodeName();
  }

  public XNode newXNode(Node node) {
    return new XNode(node);
  }

  /**
   * @return the parent element, or {@code null} at the top of the element tree
   */
  public XNode getParent() {
    Node parent = node.getParentNode();
    if (!(parent instanceof Element)) {
      return null;
    }
    return new XNode(parent);
  }

  /**
   * @return slash separated names from the outermost element down to this node, e.g. {@code math/apply/ci}
   */
  public String getPath() {
    StringBuilder builder = new StringBuilder();
    XNode current = this;
    while (current != null) {
      if (current != this) {
        builder.insert(0, "/");
      }
      builder.insert(0, current.getName());
      current = current.getParent();
    }
    return builder.toString();
  }

  public String getName() {
    return name;
  }

  /**
   * @return the node kind, or {@code null} if the DOM node kind is not one the math tree knows about
   */
  public XNodeType getType() {
    return type;
  }

  public String getNamespace() {
    return node.getNamespaceURI();
  }

  /**
   * @return the document element when this is the document root, {@code null} otherwise
   */
  public XNode getDocumentElement() {
    if (type != XNodeType.DOCUMENT) {
      return null;
    }
    for (XNode child : getChildNodes()) {
      if (child.getType() == XNodeType.ELEMENT) {
        return child;
      }
    }
    return null;
  }

  /**
   * @return every child node (elements, text, comments, processing instructions) in document order
   */
  public List<XNode> getChildNodes() {
    NodeList nodeList = node.getChildNodes();
    if (nodeList == null || nodeList.getLength() == 0) {
      return Collections.emptyList();
    }
    List<XNode> children = new ArrayList<>(nodeList.getLength());
    for (int i = 0; i < nodeList.getLength(); i++) {
      children.add(newXNode(nodeList.item(i)));
    }
    return children;
  }

  /**
   * @return element children only
   */
  public List<XNode> getChildren() {
    List<XNode> children = new ArrayList<>();
    for (XNode child : getChildNodes()) {
      if (child.getType() == XNodeType.ELEMENT) {
        children.add(child);
      }
    }
    return children;
  }

  /**
   * Raw character data of a text or comment node, untrimmed; {@code null} for other kinds.
   */
  public String getStringBody() {
    return getStringBody(null);
  }

  public String getStringBody(String def) {
    if (type == XNodeType.TEXT || type == XNodeType.COMMENT) {
      String data = node.getNodeValue();
      return data == null ? def : data;
    }
    return def;
  }

  /**
   * @return the target of a processing instruction, {@code null} for other kinds
   */
  public String getTarget() {
    return node instanceof ProcessingInstruction ? ((ProcessingInstruction) node).getTarget() : null;
  }

  /**
   * @return the data of a processing instruction ({@code ""} when it has none), {@code null} for other kinds
   */
  public String getData() {
    return node instanceof ProcessingInstruction ? ((ProcessingInstruction) node).getData() : null;
  }

  /**
   * Looks up an attribute without a namespace.
   *
   * @param name local name
   * @return the value, or {@code null} if absent
   */
  public String getStringAttribute(String name) {
    return getStringAttribute(name, null);
  }

  public String getStringAttribute(String name, String def) {
    if (!(node instanceof Element)) {
      return def;
    }
    Attr attr = ((Element) node).getAttributeNodeNS(null, name);
    return attr == null ? def : attr.getValue();
  }

  /**
   * @return every attribute of an element except namespace declarations, in DOM order
   */
  public List<Attribute> getAttributes() {
    NamedNodeMap attributeNodes = node.getAttributes();
    if (attributeNodes == null) {
      return Collections.emptyList();
    }
    List<Attribute> attributes = new ArrayList<>(attributeNodes.getLength());
    for (int i = 0; i < attributeNodes.getLength(); i++) {
      Node attribute = attributeNodes.item(i);
      if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attribute.getNamespaceURI())) {
        continue;
      }
      String localName = attribute.getLocalName() != null ? attribute.getLocalName() : attribute.getNodeName();
      attributes.add(new Attribute(attribute.getNamespaceURI(), localName, attribute.getNodeValue()));
    }
    return attributes;
  }

  @Override
  public String toString() {
    return getPath();
  }

  /**
   * A single attribute with its resolved namespace.
   */
  public static final class Attribute {

    private final String namespace;
    private final String localName;
    private final String value;

    public Attribute(String namespace, String localName, String value) {
      this.namespace = namespace;
      this.localName = localName;
      this.value = value;
    }

    /**
     * @return namespace URI, {@code null} for an unprefixed attribute
     */
    public String getNamespace() {
      return namespace;
    }

    public String getLocalName() {
      return localName;
    }

    public String getValue() {
      return value;
    }

    @Override
    public String toString() {
      return (namespace == null ? "" : "{" + namespace + "}") + localName + "=\"" + value + "\"";
    }
  }

}
