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

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.mathparse.mathml.builder.BuilderException;
import org.mathparse.mathml.builder.MaxDepthExceededException;
import org.mathparse.mathml.exceptions.MathMLException;

class MathParserBuilderTest {

  @Test
  void shouldUseDefaults() {
    MathParser parser = new MathParserBuilder().build();
    assertThat(parser.getConfiguration().getMaxDepth()).isEqualTo(Configuration.DEFAULT_MAX_DEPTH);
    assertThat(parser.getConfiguration().getRootTagName()).isEqualTo("math");
  }

  @Test
  void shouldApplyProperties() {
    Properties settings = new Properties();
    settings.setProperty("maxDepth", " 64 ");
    assertThat(new MathParserBuilder().build(settings).getConfiguration().getMaxDepth()).isEqualTo(64);
  }

  @Test
  void shouldLoadSettingsFromStream() {
    MathParser parser = new MathParserBuilder().build(getClass().getResourceAsStream("parser-settings.properties"));
    assertThat(parser.getConfiguration().getMaxDepth()).isEqualTo(8);
    assertThatThrownBy(() -> parser.parse(
        "<math><apply><apply><apply><apply><apply><apply><ci>x</ci></apply></apply></apply></apply></apply></apply></math>"))
        .isInstanceOf(MaxDepthExceededException.class);
  }

  @Test
  void shouldRejectUnknownSettings() {
    Properties settings = new Properties();
    settings.setProperty("maxdepth", "3");
    assertThatThrownBy(() -> new MathParserBuilder().build(settings))
        .isInstanceOf(BuilderException.class)
        .hasMessageContaining("maxdepth");
  }

  @Test
  void shouldRejectInvalidMaxDepth() {
    Properties notANumber = new Properties();
    notANumber.setProperty("maxDepth", "deep");
    assertThatThrownBy(() -> Configuration.fromProperties(notANumber)).isInstanceOf(BuilderException.class);

    Properties zero = new Properties();
    zero.setProperty("maxDepth", "0");
    assertThatThrownBy(() -> Configuration.fromProperties(zero)).isInstanceOf(BuilderException.class);
  }

  @Test
  void shouldWrapStreamFailures() {
    InputStream failing = new InputStream() {
      @Override
      public int read() throws IOException {
        throw new IOException("disk on fire");
      }
    };
    assertThatThrownBy(() -> new MathParserBuilder().build(failing))
        .isInstanceOf(MathMLException.class)
        .hasCauseInstanceOf(IOException.class);
  }

}
