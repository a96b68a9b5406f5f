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

import java.io.IOException;
import java.io.StringReader;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.mathparse.mathml.exceptions.ExceptionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Parses XML text into a DOM and hands out {@link XNode} views over it.
 */
public class XmlDocumentParser {

  private static final Logger log = LoggerFactory.getLogger(XmlDocumentParser.class);

  private final Document document;

  public XmlDocumentParser(String xml) {
    this.document = createDocument(new InputSource(new StringReader(xml)));
  }

  /**
   * @return the document-root node
   */
  public XNode getRoot() {
    return new XNode(document);
  }

  private Document createDocument(InputSource inputSource) {
    DocumentBuilder builder;
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      // DTDs and external entities are never fetched
      factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
      factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
      factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
      factory.setXIncludeAware(false);
      factory.setValidating(false);
      factory.setNamespaceAware(true);
      factory.setIgnoringComments(false);
      factory.setIgnoringElementContentWhitespace(false);
      factory.setCoalescing(true);
      factory.setExpandEntityReferences(true);
      builder = factory.newDocumentBuilder();
    } catch (ParserConfigurationException e) {
      throw ExceptionFactory.wrapException("Error creating document builder.", e);
    }
    builder.setErrorHandler(new ErrorHandler() {
      @Override
      public void error(SAXParseException exception) throws SAXException {
        throw exception;
      }

      @Override
      public void fatalError(SAXParseException exception) throws SAXException {
        throw exception;
      }

      @Override
      public void warning(SAXParseException exception) {
        log.debug("XML warning at line {}, column {}: {}", exception.getLineNumber(), exception.getColumnNumber(),
            exception.getMessage());
      }
    });
    try {
      return builder.parse(inputSource);
    } catch (SAXParseException e) {
      throw new XmlSyntaxException("Malformed XML at line " + e.getLineNumber() + ", column " + e.getColumnNumber()
          + ": " + e.getMessage(), e.getLineNumber(), e.getColumnNumber(), e);
    } catch (SAXException e) {
      throw new XmlSyntaxException("Malformed XML: " + e.getMessage(), e);
    } catch (IOException e) {
      throw ExceptionFactory.wrapException("Error reading XML document.", e);
    }
  }

}
