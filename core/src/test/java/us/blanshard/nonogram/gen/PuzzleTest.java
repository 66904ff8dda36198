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
package us.blanshard.nonogram.gen;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;

public class PuzzleTest {

  @Test public void displayNames() {
    assertThat(Puzzle.displayName("red_fox")).isEqualTo("Red Fox");
    assertThat(Puzzle.displayName("BIG-old__TREE")).isEqualTo("Big Old Tree");
    assertThat(Puzzle.displayName("x")).isEqualTo("X");
    assertThat(Puzzle.displayName("")).isEmpty();
  }
}
