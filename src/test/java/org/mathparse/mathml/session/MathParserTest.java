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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mathparse.mathml.ast.ApplyNode;
import org.mathparse.mathml.ast.CiNode;
import org.mathparse.mathml.ast.CnNode;
import org.mathparse.mathml.ast.CsymbolNode;
import org.mathparse.mathml.ast.MathNode;
import org.mathparse.mathml.ast.NumType;
import org.mathparse.mathml.ast.OperatorNode;
import org.mathparse.mathml.ast.OperatorTag;
import org.mathparse.mathml.ast.RootNode;
import org.mathparse.mathml.ast.TextNode;
import org.mathparse.mathml.ast.TolerantEquality;
import org.mathparse.mathml.builder.UnsupportedTagException;
import org.mathparse.mathml.parsing.XmlSyntaxException;

class MathParserTest {

  private static final String SBML_NS = "http://www.sbml.org/sbml/level3/version2/core";

  private MathParser parser;

  @BeforeEach
  void setUp() {
    parser = new MathParserBuilder().build();
  }

  private static CiNode ci(String name) {
    return new CiNode(Collections.singletonList(new TextNode(name)));
  }

  private static OperatorNode op(OperatorTag tag) {
    return new OperatorNode(tag);
  }

  @Test
  void shouldParseSimpleSum() {
    MathNode tree = parser.parse("<math xmlns=\"http://www.w3.org/1998/Math/MathML\">\n"
        + "  <apply>\n"
        + "    <plus/>\n"
        + "    <ci> x </ci>\n"
        + "    <ci> y </ci>\n"
        + "  </apply></math>");
    assertThat(tree).isEqualTo(new RootNode(Collections.singletonList(
        new ApplyNode(Arrays.asList(op(OperatorTag.PLUS), ci("x"), ci("y"))))));
  }

  @Test
  void shouldParseNestedApplications() {
    MathNode tree = parser.parse("<apply>\n"
        + "  <plus/>\n"
        + "  <apply>\n"
        + "    <times/>\n"
        + "    <ci> a </ci>\n"
        + "    <ci> x </ci>\n"
        + "  </apply>\n"
        + "  <ci> b </ci>\n"
        + "</apply>");
    assertThat(tree).isEqualTo(new ApplyNode(Arrays.asList(
        op(OperatorTag.PLUS),
        new ApplyNode(Arrays.asList(op(OperatorTag.TIMES), ci("a"), ci("x"))),
        ci("b"))));
  }

  @Test
  void shouldParseEveryNumericType() {
    MathNode tree = parser.parse("<math xmlns=\"http://www.w3.org/1998/Math/MathML\">\n"
        + "  <cn type=\"real\"> 12345.7 </cn>\n"
        + "  <cn type=\"integer\"> 12345 </cn>\n"
        + "  <cn type=\"integer\" base=\"16\"> AB3 </cn>\n"
        + "  <cn type=\"rational\"> 12342 <sep/> 2342342 </cn>\n"
        + "  <cn type=\"complex-cartesian\"> 12.3 <sep/> 5 </cn>\n"
        + "  <cn type=\"complex-polar\"> 2 <sep/> 3.1415 </cn>\n"
        + "  <cn type=\"constant\">  &tau; </cn>\n"
        + "  <cn type=\"e-notation\"> 2e-5 </cn>\n"
        + "</math>");
    MathNode expected = new RootNode(Arrays.asList(
        new CnNode(NumType.real(12345.7)),
        new CnNode(NumType.integer(12345)),
        new CnNode(NumType.integer(2739), 16, null, null, null),
        new CnNode(NumType.rational(12342, 2342342)),
        new CnNode(NumType.complexCartesian(12.3, 5)),
        new CnNode(NumType.complexPolar(2, 3.1415)),
        new CnNode(NumType.constant("$FIXED_tau")),
        new CnNode(NumType.eNotation(2, -5))));
    assertThat(TolerantEquality.approximatelyEqual(tree, expected)).isTrue();
  }

  @Test
  void shouldParseSbmlKineticLaw() throws Exception {
    MathNode tree;
    try (InputStream in = getClass().getResourceAsStream("sbml-kinetic-law.xml")) {
      tree = parser.parse(in);
    }
    Map<String, String> dimensionless = Collections.singletonMap(SBML_NS + ":units", "dimensionless");
    Map<String, String> perSecond = Collections.singletonMap(SBML_NS + ":units", "per_second");
    MathNode expected = new RootNode(Collections.singletonList(new ApplyNode(Arrays.asList(
        op(OperatorTag.TIMES),
        ci("compartment"),
        ci("k1"),
        new ApplyNode(Arrays.asList(op(OperatorTag.POWER), ci("S1"),
            new CnNode(NumType.integer(2), 10, null, null, dimensionless))),
        new CnNode(NumType.eNotation(1.5, -3), 10, null, null, perSecond)))));
    assertThat(tree).isEqualTo(expected);
  }

  @Test
  void shouldSurfaceSanitizedGreekLetters() throws Exception {
    MathNode tree;
    try (InputStream in = getClass().getResourceAsStream("greek-constants.xml")) {
      tree = parser.parse(in);
    }
    assertThat(tree).isEqualTo(new RootNode(Collections.singletonList(new ApplyNode(Arrays.asList(
        op(OperatorTag.TIMES),
        new CnNode(NumType.constant("$FIXED_pi")),
        ci("$FIXED_alpha"),
        new CsymbolNode("http://www.sbml.org/sbml/symbols/time", "text",
            Collections.singletonList(new TextNode("t"))))))));
  }

  @Test
  void shouldParseFromReader() {
    assertThat(parser.parse(new StringReader("<cn type=\"integer\">42</cn>")))
        .isEqualTo(new CnNode(NumType.integer(42)));
  }

  @Test
  void shouldRejectMalformedXml() {
    assertThatThrownBy(() -> parser.parse("<math><apply><plus/></math>")).isInstanceOf(XmlSyntaxException.class);
    assertThatThrownBy(() -> parser.parse("")).isInstanceOf(XmlSyntaxException.class);
  }

  @Test
  void shouldRejectUnregisteredEntities() {
    assertThatThrownBy(() -> parser.parse("<cn type=\"constant\">&Gamma;</cn>"))
        .isInstanceOf(XmlSyntaxException.class);
  }

  @Test
  void shouldNeverReturnPartialTrees() {
    assertThatThrownBy(() -> parser.parse("<math><apply><plus/><ci>x</ci></apply><apply><bogus/></apply></math>"))
        .isInstanceOf(UnsupportedTagException.class)
        .hasMessageContaining("bogus");
  }

  @Test
  void shouldRejectNullText() {
    assertThatThrownBy(() -> parser.parse((String) null)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> parser.parse((Reader) null)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> parser.parse((InputStream) null)).isInstanceOf(IllegalArgumentException.class);
  }

}
