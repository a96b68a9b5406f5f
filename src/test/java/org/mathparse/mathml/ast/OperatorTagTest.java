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

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

class OperatorTagTest {

  @ParameterizedTest
  @EnumSource(OperatorTag.class)
  void shouldClassifyEveryTagAsItself(OperatorTag tag) {
    assertThat(OperatorTag.forTagName(tag.getTagName())).isSameAs(tag);
  }

  @Test
  void shouldUseDistinctLowerCaseTagNames() {
    Set<String> names = new HashSet<>();
    for (OperatorTag tag : OperatorTag.values()) {
      assertThat(names.add(tag.getTagName())).as("duplicate %s", tag).isTrue();
      assertThat(tag.getTagName()).isEqualTo(tag.name().toLowerCase());
    }
    assertThat(names).hasSize(101).contains("plus", "sin", "forall", "eq", "gcd", "fn", "int", "and");
  }

  @ParameterizedTest
  @ValueSource(strings = { "apply", "ci", "cn", "csymbol", "math", "sep", "bogus", "Plus", "PLUS", "plus ", " sin",
      "si", "sinus", "" })
  void shouldNotClassifyNamesOutsideTheVocabulary(String name) {
    assertThat(OperatorTag.forTagName(name)).isNull();
  }

  @Test
  void shouldNotClassifyNull() {
    assertThat(OperatorTag.forTagName(null)).isNull();
  }

}
