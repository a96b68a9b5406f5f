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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

class XmlDocumentParserTest {

  @Test
  void shouldExposeNodeKindsInDocumentOrder() {
    XmlDocumentParser parser = new XmlDocumentParser(
        "<math xmlns=\"http://www.w3.org/1998/Math/MathML\"><!-- c --><?target data?><ci> x </ci></math>");
    XNode root = parser.getRoot();
    assertThat(root.getType()).isEqualTo(XNodeType.DOCUMENT);

    XNode math = root.getDocumentElement();
    assertThat(math.getType()).isEqualTo(XNodeType.ELEMENT);
    assertThat(math.getName()).isEqualTo("math");
    assertThat(math.getNamespace()).isEqualTo("http://www.w3.org/1998/Math/MathML");

    List<XNode> children = math.getChildNodes();
    assertThat(children).extracting(XNode::getType)
        .containsExactly(XNodeType.COMMENT, XNodeType.PROCESSING_INSTRUCTION, XNodeType.ELEMENT);
    assertThat(children.get(0).getStringBody()).isEqualTo(" c ");
    assertThat(children.get(1).getTarget()).isEqualTo("target");
    assertThat(children.get(1).getData()).isEqualTo("data");
    assertThat(children.get(2).getChildNodes().get(0).getStringBody()).isEqualTo(" x ");
    assertThat(math.getChildren()).hasSize(1);
  }

  @Test
  void shouldReportPrefixedElementsByLocalName() {
    XNode math = new XmlDocumentParser("<m:math xmlns:m=\"http://www.w3.org/1998/Math/MathML\"><m:ci>x</m:ci></m:math>")
        .getRoot().getDocumentElement();
    assertThat(math.getName()).isEqualTo("math");
    assertThat(math.getChildren().get(0).getName()).isEqualTo("ci");
  }

  @Test
  void shouldResolveAttributeNamespacesAndSkipDeclarations() {
    XNode cn = new XmlDocumentParser("<cn xmlns=\"http://www.w3.org/1998/Math/MathML\" "
        + "xmlns:sbml=\"http://www.sbml.org/sbml/level3/version1/core\" sbml:units=\"mole\" type=\"integer\">3</cn>")
        .getRoot().getDocumentElement();
    List<XNode.Attribute> attributes = cn.getAttributes();
    assertThat(attributes).hasSize(2);
    assertThat(attributes).anySatisfy(attribute -> {
      assertThat(attribute.getNamespace()).isEqualTo("http://www.sbml.org/sbml/level3/version1/core");
      assertThat(attribute.getLocalName()).isEqualTo("units");
      assertThat(attribute.getValue()).isEqualTo("mole");
    });
    assertThat(attributes).anySatisfy(attribute -> {
      assertThat(attribute.getNamespace()).isNull();
      assertThat(attribute.getLocalName()).isEqualTo("type");
    });
    assertThat(cn.getStringAttribute("type")).isEqualTo("integer");
    assertThat(cn.getStringAttribute("units")).isNull();
    assertThat(cn.getStringAttribute("base", "10")).isEqualTo("10");
  }

  @Test
  void shouldBuildElementPath() {
    XNode math = new XmlDocumentParser("<math><apply><bogus/></apply></math>").getRoot().getDocumentElement();
    XNode bogus = math.getChildren().get(0).getChildren().get(0);
    assertThat(bogus.getPath()).isEqualTo("math/apply/bogus");
  }

  @Test
  void shouldMergeCdataIntoText() {
    XNode ci = new XmlDocumentParser("<ci>a<![CDATA[b]]>c</ci>").getRoot().getDocumentElement();
    assertThat(ci.getChildNodes()).hasSize(1);
    assertThat(ci.getChildNodes().get(0).getStringBody()).isEqualTo("abc");
  }

  @Test
  void shouldFailOnMalformedXml() {
    assertThatThrownBy(() -> new XmlDocumentParser("<math>\n<apply></math>"))
        .isInstanceOfSatisfying(XmlSyntaxException.class, e -> assertThat(e.getLineNumber()).isEqualTo(2));
  }

  @Test
  void shouldFailOnUndefinedEntity() {
    assertThatThrownBy(() -> new XmlDocumentParser("<cn type=\"constant\">&tau;</cn>"))
        .isInstanceOf(XmlSyntaxException.class);
  }

}
