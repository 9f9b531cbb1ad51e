/*
 *   Copyright panFMP Developers Team c/o Uwe Schindler
 *
 *   Licensed under the Apache License, Version 2.0 (the "License");
 *   you may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package fi.kielipankki.harvester.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class BooleanParserTest {

  @Test
  void parsesConfigurationBooleans() {
    assertThat(BooleanParser.parseBoolean("yes")).isTrue();
    assertThat(BooleanParser.parseBoolean(" On ")).isTrue();
    assertThat(BooleanParser.parseBoolean("FALSE")).isFalse();
    assertThat(BooleanParser.parseBoolean("", true)).isTrue();
    assertThat(BooleanParser.parseBoolean(null, false)).isFalse();
    assertThatThrownBy(() -> BooleanParser.parseBoolean("maybe")).isInstanceOf(IllegalArgumentException.class);
  }

}
