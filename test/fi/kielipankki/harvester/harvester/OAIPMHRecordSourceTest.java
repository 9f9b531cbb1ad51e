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

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.zip.GZIPOutputStream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import fi.kielipankki.harvester.TestRecords;
import fi.kielipankki.harvester.mapping.Dialect;
import fi.kielipankki.harvester.mapping.LanguageVocabulary;
import fi.kielipankki.harvester.mapping.RecordMapper;
import fi.kielipankki.harvester.mapping.VocabularyCache;

class OAIPMHRecordSourceTest {

  private HttpServer server;
  private String baseUrl;
  private final List<String> queries = new ArrayList<>();
  private volatile String listFixture = "oai/list_page1.xml";
  private volatile int status = 200;

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    server.createContext("/md_api/que", this::handle);
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/md_api/que";
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  private void handle(HttpExchange ex) throws IOException {
    final String query = URLDecoder.decode(ex.getRequestURI().getRawQuery(), StandardCharsets.UTF_8);
    synchronized (queries) {
      queries.add(query);
    }
    if (status != 200) {
      ex.sendResponseHeaders(status, -1);
      ex.close();
      return;
    }
    final String fixture = query.contains("resumptionToken=token/page 2") ? "oai/list_page2.xml" : listFixture;
    final byte[] body = TestRecords.fixture(fixture).getBytes(StandardCharsets.UTF_8);
    ex.getResponseHeaders().set("Content-Type", "text/xml; charset=UTF-8");
    final String accept = ex.getRequestHeaders().getFirst("Accept-Encoding");
    if (accept != null && accept.contains("gzip")) {
      ex.getResponseHeaders().set("Content-Encoding", "gzip");
      ex.sendResponseHeaders(200, 0);
      try (OutputStream out = new GZIPOutputStream(ex.getResponseBody())) {
        out.write(body);
      }
    } else {
      ex.sendResponseHeaders(200, body.length);
      try (OutputStream out = ex.getResponseBody()) {
        out.write(body);
      }
    }
  }

  private OAIPMHRecordSource source() {
    return new OAIPMHRecordSource(baseUrl, "cmdi", "FIN-CLARIN", Duration.ofSeconds(10));
  }

  private static String selfLink(Document doc) {
    return doc.getElementsByTagNameNS(Dialect.CMDI.namespace, "MdSelfLink").item(0).getTextContent();
  }

  @Test
  void followsResumptionTokensAndSkipsDeletedRecords() throws Exception {
    final List<Document> records = new ArrayList<>();
    final Instant responseDate = source().harvest(Instant.parse("2024-01-01T00:00:00Z"), records::add);

    assertThat(responseDate).isEqualTo(Instant.parse("2024-05-02T12:30:00Z"));
    assertThat(records).extracting(OAIPMHRecordSourceTest::selfLink)
        .containsExactly("urn:nbn:fi:lb-0000000001", "urn:nbn:fi:lb-0000000003");
    assertThat(queries).containsExactly(
        "verb=ListRecords&metadataPrefix=cmdi&set=FIN-CLARIN&from=2024-01-01T00:00:00Z",
        "verb=ListRecords&resumptionToken=token/page 2");
  }

  @Test
  void deliversStandaloneRecordDocuments() throws Exception {
    final List<Document> records = new ArrayList<>();
    source().harvest(null, records::add);
    assertThat(queries.get(0)).isEqualTo("verb=ListRecords&metadataPrefix=cmdi&set=FIN-CLARIN");
    assertThat(records.get(0).getDocumentElement().getLocalName()).isEqualTo("record");
    // each record is its own document, usable by the mapper without the list around it
    final RecordMapper mapper = new RecordMapper(Dialect.CMDI, "c",
        new LanguageVocabulary("test:languages", new VocabularyCache(), endpoint -> Set.of()));
    assertThat(mapper.pid(records.get(0))).isEqualTo("urn:nbn:fi:lb-0000000001");
    assertThat(mapper.resourceType(records.get(1))).contains("toolService");
  }

  @Test
  void noRecordsMatchIsAnEmptyHarvest() throws Exception {
    listFixture = "oai/no_records.xml";
    final List<Document> records = new ArrayList<>();
    source().harvest(Instant.parse("2024-05-01T00:00:00Z"), records::add);
    assertThat(records).isEmpty();
  }

  @Test
  void otherOaiErrorsFail() {
    listFixture = "oai/bad_argument.xml";
    assertThatThrownBy(() -> source().harvest(null, doc -> {}))
        .isInstanceOf(OAIException.class)
        .satisfies(e -> assertThat(((OAIException) e).getCode()).isEqualTo("cannotDisseminateFormat"));
  }

  @Test
  void httpErrorsFail() {
    status = 503;
    assertThatThrownBy(() -> source().harvest(null, doc -> {}))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("503");
  }

}
