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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites named character references that a plain XML parser rejects as undefined.
 * <p>
 * MathML embedded in SBML routinely uses {@code &tau;}, {@code &alpha;}, ... without declaring them. Each
 * registered reference {@code &name;} becomes the literal text {@code $FIXED_name}, so the symbol survives
 * parsing and surfaces verbatim in the tree (typically as a {@code constant} number).
 */
public final class EntitySanitizer {

  private static final Logger log = LoggerFactory.getLogger(EntitySanitizer.class);

  public static final String PLACEHOLDER_PREFIX = "$FIXED_";

  private static final String OPEN_TOKEN = "&";
  private static final String CLOSE_TOKEN = ";";

  private static final Set<String> REGISTERED_NAMES = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
      "alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta",
      "iota", "kappa", "lambda", "mu", "nu", "xi", "omicron", "pi",
      "rho", "sigma", "tau", "upsilon", "phi", "chi", "psi", "omega")));

  private EntitySanitizer() {
    // Prevent Instantiation
  }

  /**
   * @return the entity names that are rewritten, in registry order
   */
  public static Set<String> getRegisteredNames() {
    return REGISTERED_NAMES;
  }

  /**
   * @param text raw document text
   * @return the text with every registered {@code &name;} replaced by {@code $FIXED_name}
   */
  public static String sanitize(String text) {
    if (text == null) {
      throw new IllegalArgumentException("text must not be null");
    }
    int start = text.indexOf(OPEN_TOKEN);
    if (start == -1) {
      return text;
    }
    final StringBuilder builder = new StringBuilder(text.length());
    int offset = 0;
    int replaced = 0;
    while (start > -1) {
      int end = text.indexOf(CLOSE_TOKEN, start + OPEN_TOKEN.length());
      if (end == -1) {
        break;
      }
      String name = text.substring(start + OPEN_TOKEN.length(), end);
      if (REGISTERED_NAMES.contains(name)) {
        builder.append(text, offset, start).append(PLACEHOLDER_PREFIX).append(name);
        offset = end + CLOSE_TOKEN.length();
        replaced++;
        start = text.indexOf(OPEN_TOKEN, offset);
      } else {
        // not ours (&amp;, &#955;, a stray '&'), resume right after the '&'
        start = text.indexOf(OPEN_TOKEN, start + OPEN_TOKEN.length());
      }
    }
    if (replaced == 0) {
      return text;
    }
    builder.append(text, offset, text.length());
    log.debug("Replaced {} named character reference(s)", replaced);
    return builder.toString();
  }

}
