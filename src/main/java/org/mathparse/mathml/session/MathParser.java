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
package org.mathparse.mathml.session;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import org.mathparse.mathml.ast.MathNode;
import org.mathparse.mathml.builder.MathNodeBuilder;
import org.mathparse.mathml.exceptions.ExceptionFactory;
import org.mathparse.mathml.exceptions.MathMLException;
import org.mathparse.mathml.parsing.EntitySanitizer;
import org.mathparse.mathml.parsing.XmlDocumentParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: MathML content markup text in, {@link MathNode} tree out.
 * <p>
 * Each call is independent; a parser can serve several threads as long as its {@link Configuration} is left alone.
 * Created by {@link MathParserBuilder}.
 */
public class MathParser {

  private static final Logger log = LoggerFactory.getLogger(MathParser.class);

  private final Configuration configuration;

  public MathParser(Configuration configuration) {
    this.configuration = configuration;
  }

  public Configuration getConfiguration() {
    return configuration;
  }

  /**
   * Parses a {@code <math>} document or a bare {@code apply}/{@code ci}/{@code cn}/{@code csymbol} fragment.
   *
   * @param text the document
   * @return the tree; never partial
   * @throws MathMLException on malformed XML or content that cannot be mapped
   */
  public MathNode parse(String text) {
    if (text == null) {
      throw new IllegalArgumentException("text must not be null");
    }
    log.debug("Parsing MathML document of {} characters", text.length());
    // <1> rewrite entities the XML parser would reject
    String sanitized = EntitySanitizer.sanitize(text);
    // <2> generic XML tree
    XmlDocumentParser parser = new XmlDocumentParser(sanitized);
    // <3> math tree
    return new MathNodeBuilder(configuration).parse(parser.getRoot());
  }

  /**
   * Reads the whole document, closes the reader and parses it.
   */
  public MathNode parse(Reader reader) {
    if (reader == null) {
      throw new IllegalArgumentException("reader must not be null");
    }
    String text;
    try (Reader in = reader) {
      text = readFully(in);
    } catch (IOException e) {
      throw ExceptionFactory.wrapException("Error reading MathML document.", e);
    }
    return parse(text);
  }

  /**
   * Reads the whole UTF-8 document, closes the stream and parses it.
   */
  public MathNode parse(InputStream inputStream) {
    if (inputStream == null) {
      throw new IllegalArgumentException("inputStream must not be null");
    }
    return parse(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
  }

  private static String readFully(Reader reader) throws IOException {
    StringBuilder sb = new StringBuilder();
    char[] buffer = new char[4096];
    int n;
    while ((n = reader.read(buffer)) != -1) {
      sb.append(buffer, 0, n);
    }
    return sb.toString();
  }

}
