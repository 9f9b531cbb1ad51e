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

package fi.kielipankki.harvester.harvester;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import fi.kielipankki.harvester.TestRecords;
import fi.kielipankki.harvester.mapping.Dialect;
import fi.kielipankki.harvester.mapping.LanguageVocabulary;
import fi.kielipankki.harvester.mapping.RecordMapper;
import fi.kielipankki.harvester.mapping.RecordParsingException;
import fi.kielipankki.harvester.mapping.VocabularyCache;

class SourceCatalogClientTest {

  private static final RecordMapper MAPPER = new RecordMapper(Dialect.CMDI, "urn:nbn:fi:att:data-catalog-test",
      new LanguageVocabulary("test:languages", new VocabularyCache(), endpoint -> Set.of()));

  private static SourceCatalogClient client(Document... docs) {
    return new SourceCatalogClient((from, handler) -> {
      for (Document d : docs) handler.handleRecord(d);
      return Instant.parse("2024-05-02T12:30:00Z");
    }, MAPPER);
  }

  @Test
  void deliversOnlyCorpora() throws Exception {
    final Document tool = TestRecords.setText(TestRecords.cmdiWithPid("urn:nbn:fi:lb-1"), Dialect.CMDI, "//md:resourceType", "toolService");
    final Document untyped = TestRecords.remove(TestRecords.cmdiWithPid("urn:nbn:fi:lb-2"), Dialect.CMDI, "//md:resourceType");
    final SourceCatalogClient client = client(TestRecords.cmdi(), tool, untyped);

    final List<SourceRecord> records = new ArrayList<>();
    assertThat(client.corpora(null, records::add)).isEqualTo(Instant.parse("2024-05-02T12:30:00Z"));
    assertThat(records).hasSize(2);
    assertThat(records.get(0).pid()).isEqualTo(TestRecords.CMDI_PID);
    assertThat(records.get(1).bestEffortIdentifier()).isEqualTo("urn:nbn:fi:lb-2");
    assertThat(client.corpusPids()).containsExactly(TestRecords.CMDI_PID, "urn:nbn:fi:lb-2");
  }

  @Test
  void corpusPidsFailOnUnidentifiableRecord() {
    final Document noPid = TestRecords.remove(TestRecords.cmdi(), Dialect.CMDI, "//md:Header/md:MdSelfLink");
    assertThatThrownBy(() -> client(noPid).corpusPids())
        .isInstanceOf(RecordParsingException.class)
        .hasMessageContaining("persistent identifier");
  }

}
