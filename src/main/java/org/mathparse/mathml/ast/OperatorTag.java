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
package org.mathparse.mathml.ast;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * The closed vocabulary of MathML content operators.
 * <p>
 * Elements whose local name matches {@link #getTagName()} exactly become {@link OperatorNode} leaves.
 */
public enum OperatorTag {
  // unary arithmetic and functions
  FACTORIAL("factorial"),
  MINUS("minus"),
  ABS("abs"),
  CONJUGATE("conjugate"),
  ARG("arg"),
  REAL("real"),
  IMAGINARY("imaginary"),
  FLOOR("floor"),
  CEILING("ceiling"),
  NOT("not"),
  INVERSE("inverse"),
  IDENT("ident"),
  DOMAIN("domain"),
  CODOMAIN("codomain"),
  IMAGE("image"),
  // trigonometric and hyperbolic
  SIN("sin"),
  COS("cos"),
  TAN("tan"),
  SEC("sec"),
  CSC("csc"),
  COT("cot"),
  SINH("sinh"),
  COSH("cosh"),
  TANH("tanh"),
  SECH("sech"),
  CSCH("csch"),
  COTH("coth"),
  ARCSIN("arcsin"),
  ARCCOS("arccos"),
  ARCTAN("arctan"),
  ARCCOSH("arccosh"),
  ARCCOT("arccot"),
  ARCCOTH("arccoth"),
  ARCCSC("arccsc"),
  ARCCSCH("arccsch"),
  ARCSEC("arcsec"),
  ARCSECH("arcsech"),
  ARCSINH("arcsinh"),
  ARCTANH("arctanh"),
  // exponential and logarithmic
  EXP("exp"),
  LN("ln"),
  LOG("log"),
  // linear algebra and vector calculus
  DETERMINANT("determinant"),
  TRANSPOSE("transpose"),
  DIVERGENCE("divergence"),
  GRAD("grad"),
  CURL("curl"),
  LAPLACIAN("laplacian"),
  // sets (unary)
  CARD("card"),
  // binary
  QUOTIENT("quotient"),
  DIVIDE("divide"),
  POWER("power"),
  REM("rem"),
  IMPLIES("implies"),
  EQUIVALENT("equivalent"),
  APPROX("approx"),
  SETDIFF("setdiff"),
  VECTORPRODUCT("vectorproduct"),
  SCALARPRODUCT("scalarproduct"),
  OUTERPRODUCT("outerproduct"),
  // n-ary arithmetic and statistics
  PLUS("plus"),
  TIMES("times"),
  MAX("max"),
  MIN("min"),
  GCD("gcd"),
  LCM("lcm"),
  MEAN("mean"),
  SDEV("sdev"),
  VARIANCE("variance"),
  MEDIAN("median"),
  MODE("mode"),
  // logical
  AND("and"),
  OR("or"),
  XOR("xor"),
  // n-ary constructors
  SELECTOR("selector"),
  UNION("union"),
  INTERSECT("intersect"),
  CARTESIANPRODUCT("cartesianproduct"),
  COMPOSE("compose"),
  // calculus and quantifiers
  FN("fn"),
  INT("int"),
  SUM("sum"),
  PRODUCT("product"),
  DIFF("diff"),
  PARTIALDIFF("partialdiff"),
  FORALL("forall"),
  EXISTS("exists"),
  // relational
  EQ("eq"),
  NEQ("neq"),
  GT("gt"),
  LT("lt"),
  GEQ("geq"),
  LEQ("leq"),
  FACTOROF("factorof"),
  // roots
  ROOT("root"),
  // set membership and inclusion
  IN("in"),
  NOTIN("notin"),
  SUBSET("subset"),
  PRSUBSET("prsubset"),
  NOTSUBSET("notsubset"),
  NOTPRSUBSET("notprsubset");

  /**
   * Tag name to operator, built once.
   */
  private static final Map<String, OperatorTag> tagLookup;

  static {
    Map<String, OperatorTag> lookup = new HashMap<>();
    for (OperatorTag tag : OperatorTag.values()) {
      lookup.put(tag.tagName, tag);
    }
    tagLookup = Collections.unmodifiableMap(lookup);
  }

  private final String tagName;

  OperatorTag(String tagName) {
    this.tagName = tagName;
  }

  /**
   * @return the MathML element name, e.g. {@code plus}
   */
  public String getTagName() {
    return tagName;
  }

  /**
   * Exact, case-sensitive lookup.
   *
   * @param tagName local name of an element
   * @return the operator, or {@code null} if {@code tagName} is not in the vocabulary
   */
  public static OperatorTag forTagName(String tagName) {
    if (tagName == null) {
      return null;
    }
    return tagLookup.get(tagName);
  }

  @Override
  public String toString() {
    return tagName;
  }
}
