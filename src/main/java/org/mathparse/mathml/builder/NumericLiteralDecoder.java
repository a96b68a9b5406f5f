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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.mathparse.mathml.ast.CnNode;
import org.mathparse.mathml.ast.NumType;
import org.mathparse.mathml.parsing.XNode;
import org.mathparse.mathml.parsing.XNodeType;
import org.mathparse.mathml.session.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@code <cn>} element into a {@link CnNode}.
 * <p>
 * Supported layouts:
 * <pre>
 * &lt;cn&gt;12.5&lt;/cn&gt;                                   real (default type)
 * &lt;cn type="integer" base="16"&gt;AB3&lt;/cn&gt;
 * &lt;cn type="rational"&gt;1&lt;sep/&gt;3&lt;/cn&gt;
 * &lt;cn type="complex-cartesian"&gt;1.5&lt;sep/&gt;-2&lt;/cn&gt;  (complex-polar alike)
 * &lt;cn type="constant"&gt;$FIXED_tau&lt;/cn&gt;
 * &lt;cn type="e-notation"&gt;2&lt;sep/&gt;-5&lt;/cn&gt;  or  &lt;cn type="e-notation"&gt;2e-5&lt;/cn&gt;
 * </pre>
 */
public class NumericLiteralDecoder extends BaseBuilder {

  private static final Logger log = LoggerFactory.getLogger(NumericLiteralDecoder.class);

  public static final String TYPE = "type";
  public static final String BASE = "base";
  public static final String UNITS = "units";
  public static final String SEPARATOR = "sep";

  private static final String DEFAULT_TYPE = NumType.Kind.REAL.getTypeName();

  /**
   * Attribute names with a meaning of their own when they carry no namespace
   */
  private static final Set<String> RESERVED_ATTRIBUTES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
      TYPE, BASE, ENCODING, DEFINITION_URL, DEFINITION_URL_MATHML, UNITS)));

  private static final Pattern DECIMAL = Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");
  private static final Pattern UNSIGNED_DECIMAL_DIGITS = Pattern.compile("[0-9]+");
  /**
   * ASCII digits and letters only; the radix check itself is left to {@link Long#parseLong(String, int)}
   */
  private static final Pattern RADIX_INTEGER = Pattern.compile("[+-]?[0-9A-Za-z]+");
  private static final Pattern NON_FINITE = Pattern.compile("[+-]?(?:inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

  public NumericLiteralDecoder(Configuration configuration) {
    super(configuration);
  }

  public CnNode decode(XNode node) {
    // <1> numeric type, "real" when absent
    String typeName = node.getStringAttribute(TYPE, DEFAULT_TYPE);
    // <2> radix of integer and rational literals
    int base = parseBase(node.getStringAttribute(BASE));
    // <3> the value itself
    NumType.Kind kind = NumType.Kind.forTypeName(typeName);
    if (kind == null) {
      throw new UnsupportedNumericTypeException(typeName);
    }
    List<XNode> children = node.getChildNodes();
    checkChildElements(children);
    NumType numType = decodeValue(kind, children, base);
    // <4> vendor attributes, e.g. SBML units
    Map<String, String> attributes = harvestAttributes(node);
    // <5> opaque attributes copied verbatim
    return new CnNode(numType, base, resolveDefinitionUrl(node), node.getStringAttribute(ENCODING), attributes);
  }

  private NumType decodeValue(NumType.Kind kind, List<XNode> children, int base) {
    switch (kind) {
      case REAL:
        return NumType.real(parseDouble(singleText(kind, children)));
      case INTEGER:
        return NumType.integer(parseLong(singleText(kind, children), base));
      case RATIONAL: {
        List<XNode> parts = separated(kind, children);
        return NumType.rational(parseLong(text(parts.get(0)), base), parseLong(text(parts.get(2)), base));
      }
      case COMPLEX_CARTESIAN: {
        List<XNode> parts = separated(kind, children);
        return NumType.complexCartesian(parseDouble(text(parts.get(0))), parseDouble(text(parts.get(2))));
      }
      case COMPLEX_POLAR: {
        List<XNode> parts = separated(kind, children);
        return NumType.complexPolar(parseDouble(text(parts.get(0))), parseDouble(text(parts.get(2))));
      }
      case CONSTANT:
        return NumType.constant(singleText(kind, children));
      case E_NOTATION:
        return decodeENotation(children);
      default:
        throw new UnsupportedNumericTypeException(kind.getTypeName());
    }
  }

  /**
   * MathML writes {@code 2<sep/>-5}, SBML tools often write {@code 2e-5}; both are accepted.
   */
  private NumType decodeENotation(List<XNode> children) {
    if (children.size() == 3) {
      List<XNode> parts = separated(NumType.Kind.E_NOTATION, children);
      return NumType.eNotation(parseDouble(text(parts.get(0))), parseLong(text(parts.get(2)), 10));
    }
    if (children.size() == 1) {
      String literal = text(children.get(0));
      String[] parts = literal.toLowerCase(Locale.ENGLISH).split("e", -1);
      if (parts.length != 2) {
        throw new MalformedNumericLiteralException("'" + literal + "' is not of the form <mantissa>e<exponent>");
      }
      return NumType.eNotation(parseDouble(parts[0].trim()), parseLong(parts[1].trim(), 10));
    }
    throw new UnexpectedChildCountException(NumType.Kind.E_NOTATION.getTypeName(), "1 or 3", children.size());
  }

  private int parseBase(String rawBase) {
    if (rawBase == null) {
      return CnNode.DEFAULT_BASE;
    }
    String trimmed = rawBase.trim();
    if (!UNSIGNED_DECIMAL_DIGITS.matcher(trimmed).matches()) {
      throw new InvalidBaseException(rawBase);
    }
    int base;
    try {
      base = Integer.parseInt(trimmed);
    } catch (NumberFormatException e) {
      throw new InvalidBaseException(rawBase);
    }
    if (base < Character.MIN_RADIX || base > Character.MAX_RADIX) {
      throw new InvalidBaseException(rawBase);
    }
    return base;
  }

  private Map<String, String> harvestAttributes(XNode node) {
    Map<String, String> attributes = new LinkedHashMap<>();
    for (XNode.Attribute attribute : node.getAttributes()) {
      if (attribute.getNamespace() == null) {
        if (!RESERVED_ATTRIBUTES.contains(attribute.getLocalName())) {
          log.debug("Dropping attribute '{}' without namespace on <{}>", attribute.getLocalName(), node.getPath());
        }
        continue;
      }
      attributes.put(attribute.getNamespace() + ":" + attribute.getLocalName(), attribute.getValue());
    }
    return attributes.isEmpty() ? null : attributes;
  }

  /**
   * {@code <sep/>} is the only element a number may contain.
   */
  private void checkChildElements(List<XNode> children) {
    for (XNode child : children) {
      if (child.getType() == XNodeType.ELEMENT && !SEPARATOR.equals(child.getName())) {
        throw new UnsupportedTagException(child.getName(), child.getPath());
      }
    }
  }

  private String singleText(NumType.Kind kind, List<XNode> children) {
    if (children.size() != 1) {
      throw new UnexpectedChildCountException(kind.getTypeName(), "1", children.size());
    }
    return text(children.get(0));
  }

  /**
   * @return the three children {@code value <sep/> value}
   */
  private List<XNode> separated(NumType.Kind kind, List<XNode> children) {
    if (children.size() != 3) {
      throw new UnexpectedChildCountException(kind.getTypeName(), "3", children.size());
    }
    XNode separator = children.get(1);
    if (separator.getType() != XNodeType.ELEMENT || !SEPARATOR.equals(separator.getName())) {
      throw new MalformedNumericLiteralException("expected <" + SEPARATOR + "/> between the parts of a "
          + kind.getTypeName() + " number but found " + separator.getName());
    }
    return children;
  }

  private String text(XNode child) {
    if (child.getType() != XNodeType.TEXT) {
      throw new MalformedNumericLiteralException("expected text but found " + child.getName());
    }
    return child.getStringBody("").trim();
  }

  private long parseLong(String text, int base) {
    if (!RADIX_INTEGER.matcher(text).matches()) {
      throw new MalformedNumericLiteralException("'" + text + "' is not an integer in base " + base);
    }
    try {
      return Long.parseLong(text, base);
    } catch (NumberFormatException e) {
      throw new MalformedNumericLiteralException("'" + text + "' is not an integer in base " + base, e);
    }
  }

  private double parseDouble(String text) {
    if (DECIMAL.matcher(text).matches()) {
      return Double.parseDouble(text);
    }
    if (NON_FINITE.matcher(text).matches()) {
      String lower = text.toLowerCase(Locale.ENGLISH);
      if (lower.endsWith("nan")) {
        return Double.NaN;
      }
      return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
    throw new MalformedNumericLiteralException("'" + text + "' is not a floating point number");
  }

}
