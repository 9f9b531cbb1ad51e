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

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import fi.kielipankki.harvester.FakeMetaxServer;
import fi.kielipankki.harvester.TestRecords;
import fi.kielipankki.harvester.config.Config;
import fi.kielipankki.harvester.mapping.VocabularyCache;

class HarvesterTest {

  @TempDir
  Path tmp;

  private HttpServer server;
  private FakeMetaxServer metax;
  private final List<String> oaiQueries = new ArrayList<>();
  private int vocabularyRequests = 0;

  @BeforeEach
  void setUp() throws IOException {
    metax = new FakeMetaxServer();
    server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    server.createContext("/oai", ex -> {
      synchronized (this) {
        oaiQueries.add(URLDecoder.decode(ex.getRequestURI().getRawQuery(), StandardCharsets.UTF_8));
      }
      final String record = TestRecords.fixture("cmdi_record.xml").replaceFirst("<\\?xml[^>]*\\?>", "");
      respond(ex, "text/xml", "<OAI-PMH xmlns=\"http://www.openarchives.org/OAI/2.0/\">"
          + "<responseDate>2024-05-02T12:30:00Z</responseDate><ListRecords>" + record + "</ListRecords></OAI-PMH>");
    });
    server.createContext("/vocabulary", ex -> {
      synchronized (this) {
        vocabularyRequests++;
      }
      respond(ex, "application/json", TestRecords.fixture("language_vocabulary.json"));
    });
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
    metax.close();
  }

  private static void respond(HttpExchange ex, String type, String body) throws IOException {
    final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    ex.getResponseHeaders().set("Content-Type", type);
    ex.sendResponseHeaders(200, bytes.length);
    try (OutputStream out = ex.getResponseBody()) {
      out.write(bytes);
    }
  }

  private Config config() throws Exception {
    final String local = "http://127.0.0.1:" + server.getAddress().getPort();
    final Path file = tmp.resolve("config.xml");
    Files.writeString(file, "<config>"
        + "<source><baseUrl>" + local + "/oai</baseUrl><setSpec>FIN-CLARIN</setSpec></source>"
        + "<destination><baseUrl>" + metax.baseUrl() + "</baseUrl><catalogId>" + FakeMetaxServer.CATALOG + "</catalogId>"
        + "<apiToken>" + FakeMetaxServer.TOKEN + "</apiToken><timeoutAfterSeconds>10</timeoutAfterSeconds></destination>"
        + "<languageVocabulary><endpoint>" + local + "/vocabulary</endpoint></languageVocabulary>"
        + "<harvester><stateFile>state.properties</stateFile><backupDirectory>backup</backupDirectory></harvester>"
        + "</config>");
    return new Config(file.toString());
  }

  @Test
  void harvestsConfiguredSourceIntoMetax() throws Exception {
    final VocabularyCache cache = new VocabularyCache();
    metax.addDataset("urn:nbn:fi:lb-2000010101");

    final HarvestResult first = Harvester.runHarvester(config(), cache);
    assertThat(first.isSuccess()).isTrue();
    assertThat(first.getDeleted()).containsExactly("urn:nbn:fi:lb-2000010101");
    assertThat(metax.pids()).containsExactly(TestRecords.CMDI_PID);
    assertThat(metax.body(TestRecords.CMDI_PID).path("language").size()).isEqualTo(2);
    assertThat(new HarvestState(tmp.resolve("state.properties")).getLastHarvested())
        .isEqualTo(Instant.parse("2024-05-02T12:30:00Z"));
    assertThat(tmp.resolve("backup").resolve("urn_nbn_fi_lb-2017021609.xml")).exists();

    final HarvestResult second = Harvester.runHarvester(config(), cache);
    assertThat(second.isSuccess()).isTrue();
    assertThat(metax.requests("PUT")).hasSize(1);
    assertThat(oaiQueries.get(2)).contains("from=2024-05-02T12:30:00Z");
    // the vocabulary cache outlives the run
    assertThat(vocabularyRequests).isEqualTo(1);
  }

}
