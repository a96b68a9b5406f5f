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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.mathparse.mathml.ast.ApplyNode;
import org.mathparse.mathml.ast.CiNode;
import org.mathparse.mathml.ast.CommentNode;
import org.mathparse.mathml.ast.CsymbolNode;
import org.mathparse.mathml.ast.MathNode;
import org.mathparse.mathml.ast.OperatorNode;
import org.mathparse.mathml.ast.OperatorTag;
import org.mathparse.mathml.ast.ProcessingInstructionNode;
import org.mathparse.mathml.ast.RootNode;
import org.mathparse.mathml.ast.TextNode;
import org.mathparse.mathml.parsing.XNode;
import org.mathparse.mathml.parsing.XNodeType;
import org.mathparse.mathml.session.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a parsed MathML document (or a bare {@code apply}/{@code ci}/{@code cn}/{@code csymbol} fragment) into a
 * {@link MathNode} tree.
 * <p>
 * Unknown elements abort the whole conversion with {@link UnsupportedTagException}; they are never skipped or kept
 * as opaque text.
 */
public class MathNodeBuilder extends BaseBuilder {

  private static final Logger log = LoggerFactory.getLogger(MathNodeBuilder.class);

  private final NumericLiteralDecoder numericLiteralDecoder;
  /**
   * Structural element name to its handler
   */
  private final Map<String, NodeHandler> nodeHandlerMap = new HashMap<>();

  public MathNodeBuilder(Configuration configuration) {
    super(configuration);
    this.numericLiteralDecoder = new NumericLiteralDecoder(configuration);
    initNodeHandlerMap();
  }

  private void initNodeHandlerMap() {
    nodeHandlerMap.put("apply", new ApplyHandler());
    nodeHandlerMap.put("ci", new CiHandler());
    nodeHandlerMap.put("csymbol", new CsymbolHandler());
    nodeHandlerMap.put("cn", new CnHandler());
  }

  /**
   * @param node the document root, or any node below it
   * @return the converted tree
   */
  public MathNode parse(XNode node) {
    log.debug("Building math tree from {}", node.getName());
    try {
      return parseNode(node, 1);
    } catch (StackOverflowError e) {
      // maxDepth set higher than the thread stack can hold
      log.warn("Call stack exhausted while building math tree; maxDepth {} is too high for this thread",
          configuration.getMaxDepth());
      throw new MaxDepthExceededException(configuration.getMaxDepth(), node.getPath(), e);
    }
  }

  protected MathNode parseNode(XNode node, int depth) {
    if (depth > configuration.getMaxDepth()) {
      throw new MaxDepthExceededException(configuration.getMaxDepth(), node.getPath());
    }
    XNodeType type = node.getType();
    if (type == null) {
      throw new UnsupportedTagException(node.getName(), node.getPath());
    }
    switch (type) {
      case TEXT:
        return new TextNode(node.getStringBody("").trim());
      case DOCUMENT: {
        XNode documentElement = node.getDocumentElement();
        if (documentElement == null) {
          throw new BuilderException("The document has no root element.");
        }
        return parseNode(documentElement, depth);
      }
      case ELEMENT:
        return parseElement(node, depth);
      case PROCESSING_INSTRUCTION: {
        String data = node.getData();
        return new ProcessingInstructionNode(node.getTarget(), data == null || data.isEmpty() ? null : data);
      }
      case COMMENT:
        return new CommentNode(node.getStringBody(""));
      default:
        throw new UnsupportedTagException(node.getName(), node.getPath());
    }
  }

  private MathNode parseElement(XNode node, int depth) {
    String nodeName = node.getName();
    // <1> the <math> wrapper
    if (configuration.getRootTagName().equals(nodeName)) {
      return new RootNode(parseChildren(node, depth));
    }
    // <2> operators are leaves, whatever they contain
    OperatorTag operator = OperatorTag.forTagName(nodeName);
    if (operator != null) {
      if (log.isDebugEnabled() && !node.getChildren().isEmpty()) {
        log.debug("Ignoring child elements of operator <{}> at {}", nodeName, node.getPath());
      }
      return new OperatorNode(operator);
    }
    // <3> structural elements
    NodeHandler handler = nodeHandlerMap.get(nodeName);
    if (handler == null) {
      throw new UnsupportedTagException(nodeName, node.getPath());
    }
    return handler.handleNode(node, depth);
  }

  /**
   * Converts every child in document order and drops text that was whitespace only.
   */
  protected List<MathNode> parseChildren(XNode node, int depth) {
    List<MathNode> contents = new ArrayList<>();
    for (XNode child : node.getChildNodes()) {
      MathNode converted = parseNode(child, depth + 1);
      if (converted instanceof TextNode && ((TextNode) converted).isEmpty()) {
        continue;
      }
      contents.add(converted);
    }
    return contents;
  }

  private interface NodeHandler {
    MathNode handleNode(XNode nodeToHandle, int depth);
  }

  private class ApplyHandler implements NodeHandler {
    public ApplyHandler() {
      // Prevent Synthetic Access
    }

    @Override
    public MathNode handleNode(XNode nodeToHandle, int depth) {
      return new ApplyNode(parseChildren(nodeToHandle, depth));
    }
  }

  private class CiHandler implements NodeHandler {
    public CiHandler() {
      // Prevent Synthetic Access
    }

    @Override
    public MathNode handleNode(XNode nodeToHandle, int depth) {
      return new CiNode(parseChildren(nodeToHandle, depth));
    }
  }

  private class CsymbolHandler implements NodeHandler {
    public CsymbolHandler() {
      // Prevent Synthetic Access
    }

    @Override
    public MathNode handleNode(XNode nodeToHandle, int depth) {
      String definitionUrl = resolveDefinitionUrl(nodeToHandle);
      if (definitionUrl == null) {
        throw new MissingRequiredAttributeException(DEFINITION_URL, nodeToHandle.getName());
      }
      String encoding = nodeToHandle.getStringAttribute(ENCODING);
      return new CsymbolNode(definitionUrl, encoding, parseChildren(nodeToHandle, depth));
    }
  }

  private class CnHandler implements NodeHandler {
    public CnHandler() {
      // Prevent Synthetic Access
    }

    @Override
    public MathNode handleNode(XNode nodeToHandle, int depth) {
      return numericLiteralDecoder.decode(nodeToHandle);
    }
  }

}
