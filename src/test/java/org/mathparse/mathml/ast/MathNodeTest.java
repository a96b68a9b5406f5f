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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class MathNodeTest {

  @Test
  void childrenAreCopiedAndUnmodifiable() {
    List<MathNode> children = new ArrayList<>();
    children.add(new OperatorNode(OperatorTag.PLUS));
    ApplyNode apply = new ApplyNode(children);
    children.add(new TextNode("late"));

    assertThat(apply.getChildren()).containsExactly(new OperatorNode(OperatorTag.PLUS));
    assertThatThrownBy(() -> apply.getChildren().add(new TextNode("x")))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void attributesAreCopiedAndUnmodifiable() {
    Map<String, String> attributes = new HashMap<>();
    attributes.put("urn:sbml:units", "mole");
    CnNode cn = new CnNode(NumType.integer(3), 10, null, null, attributes);
    attributes.clear();

    assertThat(cn.getAttributes()).containsEntry("urn:sbml:units", "mole");
    assertThatThrownBy(() -> cn.getAttributes().put("a", "b")).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void absentAndEmptyOptionalFieldsDiffer() {
    CnNode absent = new CnNode(NumType.integer(3));
    CnNode empty = new CnNode(NumType.integer(3), 10, "", "", Collections.emptyMap());
    assertThat(absent.getEncoding()).isNull();
    assertThat(absent.getDefinitionUrl()).isNull();
    assertThat(absent.getAttributes()).isNull();
    assertThat(empty.getEncoding()).isEmpty();
    assertThat(empty.getAttributes()).isEmpty();
    assertThat(absent).isNotEqualTo(empty);
  }

  @Test
  void equalityIsStructural() {
    MathNode a = new ApplyNode(Arrays.asList(new OperatorNode(OperatorTag.TIMES),
        new CiNode(Collections.singletonList(new TextNode("a")))));
    MathNode b = new ApplyNode(Arrays.asList(new OperatorNode(OperatorTag.TIMES),
        new CiNode(Collections.singletonList(new TextNode("a")))));
    assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    assertThat(new RootNode(Collections.emptyList())).isNotEqualTo(new ApplyNode(Collections.emptyList()));
    assertThat(new CiNode(Collections.emptyList())).isNotEqualTo(new ApplyNode(Collections.emptyList()));
  }

  @Test
  void leavesHaveNoChildren() {
    assertThat(new OperatorNode(OperatorTag.SIN).getChildren()).isEmpty();
    assertThat(new CnNode(NumType.constant("pi")).getChildren()).isEmpty();
    assertThat(new CommentNode(" c ").getChildren()).isEmpty();
    assertThat(new ProcessingInstructionNode("t", null).getChildren()).isEmpty();
  }

  @Test
  void nullChildrenAreRejected() {
    assertThatThrownBy(() -> new ApplyNode(Arrays.asList(new TextNode("x"), null)))
        .isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> new CsymbolNode(null, null, Collections.emptyList()))
        .isInstanceOf(NullPointerException.class);
  }

  @Test
  void toStringMirrorsTheTree() {
    MathNode tree = new RootNode(Collections.singletonList(new ApplyNode(Arrays.asList(
        new OperatorNode(OperatorTag.PLUS),
        new CiNode(Collections.singletonList(new TextNode("x"))),
        new CnNode(NumType.rational(1, 3))))));
    assertThat(tree).hasToString("Root[Apply[Op(plus), Ci[Text(x)], Cn{Rational(1, 3)}]]");
  }

}
