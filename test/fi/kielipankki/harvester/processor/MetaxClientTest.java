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

package fi.kielipankki.harvester.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import fi.kielipankki.harvester.FakeMetaxServer;
import fi.kielipankki.harvester.TestRecords;
import fi.kielipankki.harvester.mapping.RecordParsingException;

class MetaxClientTest {

  private FakeMetaxServer server;
  private MetaxClient client;

  @BeforeEach
  void setUp() throws Exception {
    server = new FakeMetaxServer();
    client = new MetaxClient(server.baseUrl(), FakeMetaxServer.CATALOG, FakeMetaxServer.TOKEN, Duration.ofSeconds(10));
  }

  @AfterEach
  void tearDown() {
    server.close();
  }

  private static RetainedRecord retained(String pid) {
    return () -> pid;
  }

  @Test
  void sendCreatesThenUpdates() throws Exception {
    client.send(TestRecords.dataset("urn:nbn:fi:lb-1"));
    assertThat(server.pids()).containsExactly("urn:nbn:fi:lb-1");
    assertThat(server.requests("POST")).hasSize(1);
    assertThat(server.body("urn:nbn:fi:lb-1").path("data_catalog").asText()).isEqualTo(FakeMetaxServer.CATALOG);

    client.send(TestRecords.dataset("urn:nbn:fi:lb-1"));
    assertThat(server.size()).isEqualTo(1);
    assertThat(server.requests("POST")).hasSize(1);
    assertThat(server.requests("PUT")).containsExactly("PUT /v3/datasets/id-1");
  }

  @Test
  void looksUpPidInCatalog() throws Exception {
    final String id = server.addDataset("urn:nbn:fi:lb-1");
    assertThat(client.recordId("urn:nbn:fi:lb-1")).contains(id);
    assertThat(client.recordId("urn:nbn:fi:lb-2")).isEmpty();
    assertThat(server.requests("GET").get(0))
        .contains("data_catalog__id=urn%3Anbn%3Afi%3Aatt%3Adata-catalog-test")
        .contains("persistent_identifier=urn%3Anbn%3Afi%3Alb-1");

    final MetaxClient otherCatalog = new MetaxClient(server.baseUrl(), "urn:nbn:fi:att:other", FakeMetaxServer.TOKEN, Duration.ofSeconds(10));
    assertThat(otherCatalog.recordId("urn:nbn:fi:lb-1")).isEmpty();
  }

  @Test
  void duplicatePidIsAnError() throws Exception {
    server.addDataset("urn:nbn:fi:lb-1");
    server.addDataset("urn:nbn:fi:lb-1");
    assertThatThrownBy(() -> client.send(TestRecords.dataset("urn:nbn:fi:lb-1")))
        .isInstanceOf(DestinationCatalogException.class)
        .hasMessageContaining("2 datasets with PID urn:nbn:fi:lb-1");
    assertThat(server.requests("PUT")).isEmpty();
    assertThat(server.requests("POST")).isEmpty();
  }

  @Test
  void followsPagination() throws Exception {
    server.setPageSize(2);
    for (int i = 1; i <= 5; i++) server.addDataset("urn:nbn:fi:lb-" + i);
    assertThat(client.allIdentifiers()).containsExactlyInAnyOrder(
        "urn:nbn:fi:lb-1", "urn:nbn:fi:lb-2", "urn:nbn:fi:lb-3", "urn:nbn:fi:lb-4", "urn:nbn:fi:lb-5");
    assertThat(server.requests("GET")).hasSize(3);
    assertThat(server.requests("GET").get(0)).contains("limit=" + MetaxClient.PAGE_SIZE);
  }

  @Test
  void deletesRecordsMissingFromSource() throws Exception {
    server.addDataset("urn:nbn:fi:lb-A");
    server.addDataset("urn:nbn:fi:lb-B");
    assertThat(client.deleteRecordsNotIn(List.of(retained("urn:nbn:fi:lb-A")))).containsExactly("urn:nbn:fi:lb-B");
    assertThat(server.pids()).containsExactly("urn:nbn:fi:lb-A");
    assertThat(server.requests("DELETE")).containsExactly("DELETE /v3/datasets/id-2");

    assertThat(client.deleteRecordsNotIn(List.of(retained("urn:nbn:fi:lb-A")))).isEmpty();
    assertThat(server.requests("DELETE")).hasSize(1);
  }

  @Test
  void unparseableRetainedRecordAbortsDeletion() {
    server.addDataset("urn:nbn:fi:lb-A");
    server.addDataset("urn:nbn:fi:lb-B");
    final RetainedRecord broken = () -> {
      throw new RecordParsingException("Could not find persistent identifier", "oai:x:1");
    };
    assertThatThrownBy(() -> client.deleteRecordsNotIn(List.of(retained("urn:nbn:fi:lb-A"), broken)))
        .isInstanceOf(RecordParsingException.class);
    assertThat(server.requests("DELETE")).isEmpty();
    assertThat(server.size()).isEqualTo(2);
  }

  @Test
  void deleteSingleRecord() throws Exception {
    final String id = server.addDataset("urn:nbn:fi:lb-1");
    assertThat(client.deleteRecord("urn:nbn:fi:lb-2")).isEmpty();
    assertThat(client.deleteRecord("urn:nbn:fi:lb-1")).contains(id);
    assertThat(server.size()).isZero();
  }

  @Test
  void rejectedTokenIsMisconfiguration() throws Exception {
    final MetaxClient bad = new MetaxClient(server.baseUrl(), FakeMetaxServer.CATALOG, "wrong", Duration.ofSeconds(10));
    assertThatThrownBy(() -> bad.send(TestRecords.dataset("urn:nbn:fi:lb-1")))
        .isInstanceOf(MisconfigurationException.class)
        .hasMessageContaining("401");
  }

  @Test
  void serverErrorIsDestinationError() {
    server.setForcedStatus(500);
    assertThatThrownBy(() -> client.send(TestRecords.dataset("urn:nbn:fi:lb-1")))
        .isInstanceOf(DestinationCatalogException.class)
        .satisfies(e -> {
          assertThat(((DestinationCatalogException) e).getStatusCode()).isEqualTo(500);
          assertThat(((DestinationCatalogException) e).getResponseText()).contains("forced failure");
        });
  }

  @Test
  void droppedConnectionIsDestinationError() {
    server.dropConnections("POST");
    assertThatThrownBy(() -> client.send(TestRecords.dataset("urn:nbn:fi:lb-1")))
        .isInstanceOf(DestinationCatalogException.class)
        .hasMessageStartingWith("POST ")
        .hasCauseInstanceOf(IOException.class);
    assertThat(server.requests("POST")).hasSize(1);
  }

  @Test
  void invalidBaseUrlIsMisconfiguration() {
    assertThatThrownBy(() -> new MetaxClient("ftp://metax.example.org/v3", "c", "t", Duration.ofSeconds(1)))
        .isInstanceOf(MisconfigurationException.class);
    assertThatThrownBy(() -> new MetaxClient("not a url", "c", "t", Duration.ofSeconds(1)))
        .isInstanceOf(MisconfigurationException.class);
    assertThatThrownBy(() -> new MetaxClient(null, "c", "t", Duration.ofSeconds(1)))
        .isInstanceOf(MisconfigurationException.class);
  }

  @Test
  void unknownHostIsMisconfiguration() throws Exception {
    final MetaxClient unknown = new MetaxClient("http://metax.nonexistent.invalid/v3", "c", "t", Duration.ofSeconds(5));
    assertThatThrownBy(() -> unknown.recordId("urn:nbn:fi:lb-1"))
        .isInstanceOf(MisconfigurationException.class);
  }

}
