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

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;

/**
 * Some utility methods for sending requests and decompressing {@link HttpResponse}
 */
public final class HttpClientUtils {
  private static final org.apache.commons.logging.Log log = org.apache.commons.logging.LogFactory
      .getLog(HttpClientUtils.class);
  
  private HttpClientUtils() {}
  
  /** Returns an InputStream which decodes with header "Content-Encoding" */
  public static InputStream getDecompressingInputStream(final HttpResponse<InputStream> resp) throws IOException {
    final String encoding = resp.headers().firstValue("Content-Encoding").orElse("identity").toLowerCase(Locale.ROOT).trim();
    if (log.isDebugEnabled()) log.debug("HTTP server uses " + encoding + " content encoding.");
    switch (encoding) {
      case "gzip": return new GZIPInputStream(resp.body());
      case "deflate": return new InflaterInputStream(resp.body());
      case "identity": return resp.body();
    }
    resp.body().close();
    throw new IOException("Server uses an invalid content encoding: " + encoding);
  }
  
  /** Reads the whole (decompressed) response body as UTF-8 string. */
  public static String readBodyAsString(final HttpResponse<InputStream> resp) throws IOException {
    try (final InputStream in = getDecompressingInputStream(resp)) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
  
  /** Sends "Accept-Encoding" header to ask server to compress result.
   * The response can later be parsed with {@link #getDecompressingInputStream(HttpResponse)} */
  public static void sendCompressionHeaders(final HttpRequest.Builder builder) {
    builder.setHeader("Accept-Encoding", "gzip, deflate, identity;q=0.3, *;q=0");
  }
  
  /** Sends the request, converting thread interruption to an {@link IOException}. */
  public static <T> HttpResponse<T> sendHttpRequest(HttpClient client, HttpRequest request,
      HttpResponse.BodyHandler<T> responseBodyHandler) throws IOException {
    try {
      return client.send(request, responseBodyHandler);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new IOException("Connection interrupted.");
    }
  }
    
}
