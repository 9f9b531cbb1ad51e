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

package fi.kielipankki.harvester.mapping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class DialectTest {

  @Test
  void findsDialectByConfigName() {
    assertThat(Dialect.forName("cmdi")).isSameAs(Dialect.CMDI);
    assertThat(Dialect.forName("META-SHARE")).isSameAs(Dialect.META_SHARE);
    assertThat(Dialect.forName("meta_share")).isSameAs(Dialect.META_SHARE);
    assertThatThrownBy(() -> Dialect.forName("dublin-core")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void normalizesMetasharePids() {
    assertThat(Dialect.META_SHARE.normalizePid("http://urn.fi/urn:nbn:fi:lb-2017021609")).isEqualTo("urn:nbn:fi:lb-2017021609");
    assertThat(Dialect.META_SHARE.normalizePid("urn.fi/urn:nbn:fi:lb-2017021609")).isEqualTo("urn:nbn:fi:lb-2017021609");
    assertThat(Dialect.META_SHARE.normalizePid(" lb-2017021609 ")).isEqualTo("urn:nbn:fi:lb-2017021609");
    assertThat(Dialect.META_SHARE.normalizePid("urn:nbn:fi:lb-2017021609")).isEqualTo("urn:nbn:fi:lb-2017021609");
  }

  @Test
  void cmdiPidsAreOnlyTrimmed() {
    assertThat(Dialect.CMDI.normalizePid(" urn:nbn:fi:lb-2017021609 ")).isEqualTo("urn:nbn:fi:lb-2017021609");
    assertThat(Dialect.CMDI.normalizePid("http://urn.fi/urn:nbn:fi:lb-1")).isEqualTo("http://urn.fi/urn:nbn:fi:lb-1");
  }

}
