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

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import fi.kielipankki.harvester.Package;
import fi.kielipankki.harvester.config.DestinationConfig;
import fi.kielipankki.harvester.mapping.RecordParsingException;
import fi.kielipankki.harvester.model.DatasetRecord;
import fi.kielipankki.harvester.utils.HttpClientUtils;

/**
 * Client of the Metax V3 <code>datasets</code> API, restricted to one data catalog.
 * Every request is logged to this class' logger (configured as the separate request log).
 */
public class MetaxClient {
  private static final org.apache.commons.logging.Log log = org.apache.commons.logging.LogFactory.getLog(MetaxClient.class);

  public static final String USER_AGENT = Package.getUserAgent("Metax client");

  public static final int PAGE_SIZE = 100;

  private final URI baseUrl;
  private final String catalogId;
  private final String apiToken;
  private final Duration timeout;
  private final HttpClient httpClient;
  private final ObjectMapper mapper = new ObjectMapper();

  public MetaxClient(DestinationConfig config) throws MisconfigurationException {
    this(config.getBaseUrl(), config.getCatalogId(), config.getApiToken(), config.getTimeout());
  }

  public MetaxClient(String baseUrl, String catalogId, String apiToken, Duration timeout) throws MisconfigurationException {
    this.baseUrl = parseBaseUrl(baseUrl);
    this.catalogId = catalogId;
    this.apiToken = apiToken;
    this.timeout = timeout;
    this.httpClient = HttpClient.newBuilder()
        .connectTimeout(timeout)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  private static URI parseBaseUrl(String baseUrl) throws MisconfigurationException {
    if (baseUrl == null) throw new MisconfigurationException("Metax base URL is not configured");
    final URI uri;
    try {
      uri = new URI(baseUrl.endsWith("/") ? baseUrl : (baseUrl + "/"));
    } catch (URISyntaxException e) {
      throw new MisconfigurationException("Invalid Metax base URL: " + baseUrl, e);
    }
    final String scheme = (uri.getScheme() == null) ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!("http".equals(scheme) || "https".equals(scheme)) || uri.getHost() == null) {
      throw new MisconfigurationException("Metax base URL must be an absolute HTTP(S) URL: " + baseUrl);
    }
    return uri;
  }

  public String getCatalogId() {
    return catalogId;
  }

  /**
   * Returns the Metax identifier of the dataset with the given PID in the catalog.
   * @throws DestinationCatalogException if Metax holds more than one dataset with this PID
   */
  public Optional<String> recordId(String pid) throws IOException {
    final JsonNode resp = request("GET", endpoint("datasets", "data_catalog__id", catalogId, "persistent_identifier", pid), null);
    final JsonNode results = resp.path("results");
    final int count = resp.path("count").asInt(results.size());
    if (count == 0 || results.size() == 0) {
      return Optional.empty();
    }
    if (count > 1) {
      // TODO: drop this check when Metax enforces unique PIDs within a catalog
      throw new DestinationCatalogException("Metax has " + count + " datasets with PID " + pid + " in catalog " + catalogId);
    }
    return Optional.of(results.get(0).path("id").asText());
  }

  /** Creates a new dataset and returns its Metax identifier. */
  public String create(DatasetRecord record) throws IOException {
    final JsonNode resp = request("POST", endpoint("datasets"), record);
    return resp.path("id").asText(null);
  }

  /** Replaces the dataset with Metax identifier <code>id</code>. */
  public void update(String id, DatasetRecord record) throws IOException {
    request("PUT", endpoint("datasets/" + encode(id)), record);
  }

  public void delete(String id) throws IOException {
    request("DELETE", endpoint("datasets/" + encode(id)), null);
  }

  /** Creates the dataset or updates it if its PID is already known to Metax. */
  public void send(DatasetRecord record) throws IOException {
    final Optional<String> id = recordId(record.getPersistentIdentifier());
    if (id.isPresent()) {
      update(id.get(), record);
    } else {
      create(record);
    }
  }

  /** PIDs of all datasets in the catalog, following the pagination until the end. */
  public Set<String> allIdentifiers() throws IOException {
    final Set<String> pids = new HashSet<>();
    URI next = endpoint("datasets", "data_catalog__id", catalogId, "limit", Integer.toString(PAGE_SIZE));
    while (next != null) {
      final JsonNode page = request("GET", next, null);
      for (JsonNode r : page.path("results")) {
        final JsonNode pid = r.path("persistent_identifier");
        if (pid.isTextual()) pids.add(pid.asText());
      }
      final JsonNode n = page.path("next");
      next = (n.isTextual() && !n.asText().isEmpty()) ? baseUrl.resolve(n.asText()) : null;
    }
    return pids;
  }

  /**
   * Deletes all datasets of the catalog whose PID is not among the retained records.
   * The retained PIDs are collected before anything is deleted, so a record that cannot
   * be parsed aborts the whole deletion.
   * @return the deleted PIDs
   */
  public Set<String> deleteRecordsNotIn(Collection<? extends RetainedRecord> retained)
      throws IOException, RecordParsingException {
    final Set<String> retainedPids = new HashSet<>();
    for (RetainedRecord r : retained) {
      retainedPids.add(r.pid());
    }
    final Set<String> toDelete = new TreeSet<>(allIdentifiers());
    toDelete.removeAll(retainedPids);
    log.info("Deleting " + toDelete.size() + " datasets no longer present in the source catalog");
    final List<String> deleted = new ArrayList<>();
    for (String pid : toDelete) {
      if (deleteRecord(pid).isPresent()) deleted.add(pid);
    }
    return new TreeSet<>(deleted);
  }

  /**
   * Deletes the dataset with the given PID.
   * @return the Metax identifier of the deleted dataset, empty if the PID was not found
   */
  public Optional<String> deleteRecord(String pid) throws IOException {
    final Optional<String> id = recordId(pid);
    if (id.isPresent()) {
      delete(id.get());
    }
    return id;
  }

  private URI endpoint(String path, String... params) {
    final StringBuilder sb = new StringBuilder(path);
    for (int i = 0; i < params.length; i += 2) {
      sb.append((i == 0) ? '?' : '&').append(params[i]).append('=').append(encode(params[i + 1]));
    }
    return baseUrl.resolve(sb.toString());
  }

  private static String encode(String s) {
    return URLEncoder.encode(s, StandardCharsets.UTF_8);
  }

  /** Sends a request and returns the parsed JSON response (a missing node for empty responses). */
  private JsonNode request(String method, URI uri, Object body) throws IOException {
    final HttpRequest.Builder reqBuilder = HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .setHeader("User-Agent", USER_AGENT)
        .setHeader("Accept", "application/json")
        .setHeader("Authorization", "Token " + apiToken);
    HttpClientUtils.sendCompressionHeaders(reqBuilder);
    if (body != null) {
      final String json;
      try {
        json = mapper.writeValueAsString(body);
      } catch (JsonProcessingException e) {
        throw new IllegalStateException("Cannot serialize request body", e);
      }
      reqBuilder.setHeader("Content-Type", "application/json; charset=utf-8")
          .method(method, HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
    } else {
      reqBuilder.method(method, HttpRequest.BodyPublishers.noBody());
    }

    final HttpResponse<InputStream> resp;
    final String text;
    try {
      resp = HttpClientUtils.sendHttpRequest(httpClient, reqBuilder.build(), HttpResponse.BodyHandlers.ofInputStream());
      text = HttpClientUtils.readBodyAsString(resp);
    } catch (HttpTimeoutException e) {
      log.error("Request failed. Method: " + method + ", URL: " + uri + ", Error: timeout");
      throw new DestinationCatalogException("Request to " + uri + " timed out", e);
    } catch (ConnectException e) {
      if (isUnknownHost(e)) {
        throw new MisconfigurationException("Unknown Metax host: " + uri.getHost(), e);
      }
      log.error("Request failed. Method: " + method + ", URL: " + uri + ", Error: " + e);
      throw new DestinationCatalogException("Cannot connect to " + uri, e);
    } catch (UnknownHostException e) {
      throw new MisconfigurationException("Unknown Metax host: " + uri.getHost(), e);
    } catch (IOException e) {
      if (Thread.currentThread().isInterrupted()) throw e;
      // dropped connections, resets, truncated responses
      log.error("Request failed. Method: " + method + ", URL: " + uri + ", Error: " + e);
      throw new DestinationCatalogException(method + " " + uri + " failed: " + e.getMessage(), e);
    }

    final int status = resp.statusCode();
    if (status == 401 || status == 403) {
      log.error("Request failed. Method: " + method + ", URL: " + uri + ", Status: " + status + ", Response: " + text);
      throw new MisconfigurationException("Metax rejected the API token (HTTP " + status + ")");
    }
    if (status < 200 || status >= 300) {
      log.error("Request failed. Method: " + method + ", URL: " + uri + ", Status: " + status + ", Response: " + text);
      throw new DestinationCatalogException(method + " " + uri + " failed with HTTP status " + status, status, text, null);
    }
    if (!"GET".equals(method)) {
      log.info("Request succeeded. Method: " + method + ", URL: " + uri);
    } else if (log.isDebugEnabled()) {
      log.debug("Request succeeded. Method: " + method + ", URL: " + uri);
    }
    if (text.trim().isEmpty()) {
      return mapper.missingNode();
    }
    try {
      return mapper.readTree(text);
    } catch (JsonProcessingException e) {
      throw new DestinationCatalogException("Metax returned invalid JSON for " + method + " " + uri, status, text, e);
    }
  }

  private static boolean isUnknownHost(Throwable t) {
    for (Throwable c = t; c != null; c = c.getCause()) {
      if (c instanceof UnresolvedAddressException || c instanceof UnknownHostException) return true;
    }
    return false;
  }

}
