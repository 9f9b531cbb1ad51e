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

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import fi.kielipankki.harvester.Package;
import fi.kielipankki.harvester.utils.HttpClientUtils;

/**
 * Reads a reference data index of Metax. The response is an Elasticsearch search
 * result; the URIs are found in <code>hits.hits[]._source.uri</code>.
 */
public final class HttpVocabularyFetcher implements VocabularyFetcher {

  public static final String USER_AGENT = Package.getUserAgent("vocabulary reader");

  private final HttpClient httpClient;
  private final Duration timeout;
  private final ObjectMapper mapper = new ObjectMapper();

  public HttpVocabularyFetcher(Duration timeout) {
    this.timeout = timeout;
    this.httpClient = HttpClient.newBuilder()
        .connectTimeout(timeout)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Override
  public Set<String> fetch(String endpoint) throws IOException {
    final URI uri;
    try {
      uri = URI.create(endpoint);
    } catch (IllegalArgumentException e) {
      throw new IOException("Invalid vocabulary endpoint: " + endpoint, e);
    }
    final HttpRequest.Builder reqBuilder = HttpRequest.newBuilder(uri)
        .GET()
        .timeout(timeout)
        .setHeader("User-Agent", USER_AGENT)
        .setHeader("Accept", "application/json");
    HttpClientUtils.sendCompressionHeaders(reqBuilder);
    final HttpResponse<InputStream> resp = HttpClientUtils.sendHttpRequest(httpClient, reqBuilder.build(),
        HttpResponse.BodyHandlers.ofInputStream());
    if (resp.statusCode() != 200) {
      resp.body().close();
      throw new IOException("Fetching vocabulary from " + endpoint + " failed with HTTP status " + resp.statusCode());
    }
    final JsonNode root;
    try (final InputStream in = HttpClientUtils.getDecompressingInputStream(resp)) {
      root = mapper.readTree(in);
    }
    final Set<String> uris = new HashSet<>();
    for (JsonNode hit : root.path("hits").path("hits")) {
      final JsonNode u = hit.path("_source").path("uri");
      if (u.isTextual()) uris.add(u.asText());
    }
    return uris;
  }

}
