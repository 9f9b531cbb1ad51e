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

import java.time.Instant;
import java.time.format.DateTimeParseException;

import org.junit.jupiter.api.Test;

class ISODateFormatterTest {

  @Test
  void parsesLongAndShortDates() {
    assertThat(ISODateFormatter.parseDate("2023-04-12T10:00:00Z")).isEqualTo(Instant.parse("2023-04-12T10:00:00Z"));
    assertThat(ISODateFormatter.parseDate(" 2017-02-15 ")).isEqualTo(Instant.parse("2017-02-15T00:00:00Z"));
    assertThat(ISODateFormatter.parseDate(null)).isNull();
  }

  @Test
  void rejectsInvalidDates() {
    assertThatThrownBy(() -> ISODateFormatter.parseDate("2017-02-30")).isInstanceOf(DateTimeParseException.class);
    assertThatThrownBy(() -> ISODateFormatter.parseDate("15.2.2017")).isInstanceOf(DateTimeParseException.class);
  }

  @Test
  void formatsUtc() {
    final Instant i = Instant.parse("2024-05-02T12:30:45.123Z");
    assertThat(ISODateFormatter.formatLong(i)).isEqualTo("2024-05-02T12:30:45Z");
    assertThat(ISODateFormatter.formatShort(i)).isEqualTo("2024-05-02");
  }

}
