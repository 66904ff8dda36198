/*
Copyright 2026 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.nonogram.core;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.fail;

import org.junit.Test;

import java.util.Properties;

public class ConfigTest {

  @Test public void defaults() {
    Config config = Config.DEFAULT;
    assertThat(config.maxColors).isEqualTo(6);
    assertThat(config.maxCluesPerLine).isEqualTo(15);
    assertThat(config.timeoutMillis).isEqualTo(30000L);
    assertThat(config.tierThreshold(Difficulty.TRIVIAL)).isEqualTo(0.0);
    assertThat(config.tierThresholds().keySet()).containsExactlyElementsIn(Difficulty.values())
        .inOrder();
  }

  @Test public void readsProperties() {
    Properties props = new Properties();
    props.setProperty("maxColors", "4");
    props.setProperty("timeoutSeconds", "2");
    props.setProperty("weight.branch", " 7.5 ");
    props.setProperty("tier.master", "120");
    Config config = Config.fromProperties(props);
    assertThat(config.maxColors).isEqualTo(4);
    assertThat(config.timeoutMillis).isEqualTo(2000L);
    assertThat(config.branchWeight).isEqualTo(7.5);
    assertThat(config.tierThreshold(Difficulty.MASTER)).isEqualTo(120.0);
    assertThat(config.maxCluesPerLine).isEqualTo(Config.DEFAULT.maxCluesPerLine);
  }

  @Test public void millisOverrideSeconds() {
    Properties props = new Properties();
    props.setProperty("timeoutSeconds", "2");
    props.setProperty("timeoutMillis", "250");
    assertThat(Config.fromProperties(props).timeoutMillis).isEqualTo(250L);
  }

  @Test public void rejectsMalformedValues() {
    assertRejected("maxNodes", "lots");
    assertRejected("maxNodes", "0");
    assertRejected("maxColors", "31");
    assertRejected("weight.edge", "-1");
    assertRejected("weight.depth", "NaN");
    assertRejected("tier.trivial", "1");
    assertRejected("tier.hard", "10");
  }

  @Test public void rejectsValuesThatDontFit() {
    // 2^32 + 15 would wrap around to 15 as an int.
    assertRejected("maxCluesPerLine", "4294967311");
    assertRejected("maxColors", "-4294967290");
    assertRejected("timeoutSeconds", "9223372036854776");
    assertRejected("timeoutSeconds", "0x7fffffffffffffff");
  }

  private static void assertRejected(String key, String value) {
    Properties props = new Properties();
    props.setProperty(key, value);
    try {
      Config.fromProperties(props);
      fail(key + "=" + value);
    } catch (IllegalArgumentException expected) {
    }
  }

  @Test public void toBuilderKeepsValues() {
    Config config = Config.DEFAULT.toBuilder().setMaxNodes(17).build();
    assertThat(config.maxNodes).isEqualTo(17L);
    assertThat(config.toBuilder().build().maxNodes).isEqualTo(17L);
    assertThat(config.minColorDistance).isEqualTo(Config.DEFAULT.minColorDistance);
  }

  @Test public void scoresMapToTiers() {
    Config config = Config.DEFAULT;
    assertThat(Difficulty.forScore(0, config)).isEqualTo(Difficulty.TRIVIAL);
    assertThat(Difficulty.forScore(7.99, config)).isEqualTo(Difficulty.TRIVIAL);
    assertThat(Difficulty.forScore(8, config)).isEqualTo(Difficulty.EASY);
    assertThat(Difficulty.forScore(25, config)).isEqualTo(Difficulty.HARD);
    assertThat(Difficulty.forScore(1000, config)).isEqualTo(Difficulty.MASTER);
  }

  @Test public void tierCodes() {
    assertThat(Difficulty.CHALLENGING.code()).isEqualTo("challenging");
    assertThat(Difficulty.fromCode("expert")).isEqualTo(Difficulty.EXPERT);
  }
}
