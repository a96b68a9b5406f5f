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

import org.mathparse.mathml.parsing.XNode;
import org.mathparse.mathml.session.Configuration;

/**
 * Common state and attribute helpers of the builders.
 */
public abstract class BaseBuilder {

  protected static final String DEFINITION_URL = "definitionUrl";
  /**
   * MathML 2 spells the attribute {@code definitionURL}
   */
  protected static final String DEFINITION_URL_MATHML = "definitionURL";
  protected static final String ENCODING = "encoding";

  protected final Configuration configuration;

  public BaseBuilder(Configuration configuration) {
    this.configuration = configuration;
  }

  /**
   * @return {@code definitionUrl}, falling back to {@code definitionURL}, or {@code null}
   */
  protected String resolveDefinitionUrl(XNode node) {
    String definitionUrl = node.getStringAttribute(DEFINITION_URL);
    return definitionUrl != null ? definitionUrl : node.getStringAttribute(DEFINITION_URL_MATHML);
  }

}
