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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Properties;
import java.util.Set;

import org.mathparse.mathml.builder.BuilderException;

/**
 * Settings shared by every parse of a {@link MathParser}.
 * <p>
 * Populate it before building the parser; a configuration that is no longer modified can be shared across threads.
 */
public class Configuration {

  public static final String MAX_DEPTH = "maxDepth";

  public static final int DEFAULT_MAX_DEPTH = 256;

  /**
   * Element that is turned into the root node
   */
  public static final String ROOT_TAG_NAME = "math";

  private static final Set<String> KNOWN_SETTINGS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
      MAX_DEPTH)));

  /**
   * Deepest element/text nesting accepted before the parse is aborted
   */
  protected int maxDepth = DEFAULT_MAX_DEPTH;

  public Configuration() {
  }

  /**
   * @param settings setting name to value; names are case sensitive
   * @return a configuration with the given settings applied over the defaults
   */
  public static Configuration fromProperties(Properties settings) {
    Configuration configuration = new Configuration();
    if (settings == null) {
      return configuration;
    }
    // Check that all settings are known
    for (String key : settings.stringPropertyNames()) {
      if (!KNOWN_SETTINGS.contains(key)) {
        throw new BuilderException("The setting " + key + " is not known.  Make sure you spelled it correctly (case sensitive).");
      }
    }
    String maxDepth = settings.getProperty(MAX_DEPTH);
    if (maxDepth != null) {
      try {
        configuration.setMaxDepth(Integer.parseInt(maxDepth.trim()));
      } catch (NumberFormatException e) {
        throw new BuilderException("The setting " + MAX_DEPTH + " must be an integer but was '" + maxDepth + "'.", e);
      }
    }
    return configuration;
  }

  public int getMaxDepth() {
    return maxDepth;
  }

  public void setMaxDepth(int maxDepth) {
    if (maxDepth < 1) {
      throw new BuilderException("The setting " + MAX_DEPTH + " must be at least 1 but was " + maxDepth + ".");
    }
    this.maxDepth = maxDepth;
  }

  public String getRootTagName() {
    return ROOT_TAG_NAME;
  }

}
