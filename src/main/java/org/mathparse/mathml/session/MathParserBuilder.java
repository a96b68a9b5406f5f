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
import java.util.Properties;

import org.mathparse.mathml.exceptions.ExceptionFactory;

/**
 * Builds {@link MathParser} instances, usually the first class a caller touches.
 */
public class MathParserBuilder {

  /**
   * @return a parser with default settings
   */
  public MathParser build() {
    return build(new Configuration());
  }

  /**
   * @param settings e.g. {@code maxDepth=64}
   */
  public MathParser build(Properties settings) {
    return build(Configuration.fromProperties(settings));
  }

  /**
   * @param inputStream a {@code .properties} stream, closed afterwards
   */
  public MathParser build(InputStream inputStream) {
    Properties settings = new Properties();
    try (InputStream in = inputStream) {
      settings.load(in);
    } catch (IOException e) {
      throw ExceptionFactory.wrapException("Error reading parser settings.", e);
    }
    return build(settings);
  }

  public MathParser build(Configuration config) {
    return new MathParser(config);
  }

}
