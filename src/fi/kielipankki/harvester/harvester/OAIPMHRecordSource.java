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

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

import javax.xml.parsers.DocumentBuilder;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

import fi.kielipankki.harvester.Package;
import fi.kielipankki.harvester.config.SourceConfig;
import fi.kielipankki.harvester.mapping.MetadataNamespaces;
import fi.kielipankki.harvester.utils.HttpClientUtils;
import fi.kielipankki.harvester.utils.ISODateFormatter;
import fi.kielipankki.harvester.utils.StaticFactories;

/**
 * Harvests an OAI-PMH repository with <code>ListRecords</code>, following resumption tokens.
 * The supported harvester properties are:
 * <ul>
 * <li><code>baseUrl</code>: Base URL of OAI-PMH repository</li>
 * <li><code>metadataPrefix</code>: OAI metadata prefix to harvest</li>
 * <li><code>setSpec</code>: OAI set to harvest (optional)</li>
 * <li><code>timeoutAfterSeconds</code>: HTTP timeout for harvesting in seconds</li>
 * </ul>
 */
public class OAIPMHRecordSource implements RecordSource {
  private static final org.apache.commons.logging.Log log = org.apache.commons.logging.LogFactory.getLog(OAIPMHRecordSource.class);

  public static final String USER_AGENT = Package.getUserAgent("OAI harvester");

  private final String baseUrl, metadataPrefix, setSpec;
  private final Duration timeout;
  private final HttpClient httpClient;

  public OAIPMHRecordSource(SourceConfig config) {
    this(config.getBaseUrl(), config.getMetadataPrefix(), config.getSetSpec(), config.getTimeout());
  }

  public OAIPMHRecordSource(String baseUrl, String metadataPrefix, String setSpec, Duration timeout) {
    this.baseUrl = baseUrl;
    this.metadataPrefix = metadataPrefix;
    this.setSpec = setSpec;
    this.timeout = timeout;
    this.httpClient = HttpClient.newBuilder()
        .connectTimeout(timeout)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Override
  public Instant harvest(Instant from, RecordHandler handler) throws IOException {
    final StringBuilder url = new StringBuilder(baseUrl)
        .append("?verb=ListRecords&metadataPrefix=").append(encode(metadataPrefix));
    if (setSpec != null) {
      url.append("&set=").append(encode(setSpec));
    }
    if (from != null) {
      url.append("&from=").append(encode(ISODateFormatter.formatLong(from)));
    }

    Document resp = readStream(url.toString());
    final Instant responseDate = responseDate(resp);
    int count = 0;
    for (;;) {
      if (checkError(resp)) break;
      final Element listRecords = child(resp.getDocumentElement(), "ListRecords");
      if (listRecords == null) {
        throw new IOException("OAI response of " + baseUrl + " contains no ListRecords element");
      }
      String token = null;
      for (Node n = listRecords.getFirstChild(); n != null; n = n.getNextSibling()) {
        if (!isOAIElement(n)) continue;
        if ("record".equals(n.getLocalName())) {
          final Element record = (Element) n;
          if (isDeleted(record)) {
            if (log.isDebugEnabled()) log.debug("Skipping deleted record");
            continue;
          }
          handler.handleRecord(toDocument(record));
          count++;
        } else if ("resumptionToken".equals(n.getLocalName())) {
          token = n.getTextContent().trim();
        }
      }
      if (token == null || token.isEmpty()) break;
      if (log.isDebugEnabled()) log.debug("Following resumption token after " + count + " records");
      resp = readStream(baseUrl + "?verb=ListRecords&resumptionToken=" + encode(token));
    }
    return responseDate;
  }

  // harvester code
  private Document readStream(String url) throws IOException {
    log.info("Harvesting \"" + url + "\"...");
    final HttpRequest.Builder reqBuilder;
    try {
      reqBuilder = HttpRequest.newBuilder(URI.create(url));
    } catch (IllegalArgumentException e) {
      throw new IOException("Invalid OAI-PMH URL: " + url, e);
    }
    reqBuilder.GET()
        .timeout(timeout)
        .setHeader("User-Agent", USER_AGENT)
        .setHeader("Accept-Charset", StandardCharsets.UTF_8.name() + ", *;q=0.1")
        .setHeader("Accept", "text/xml, application/xml, *;q=0.1");
    HttpClientUtils.sendCompressionHeaders(reqBuilder);

    final HttpResponse<InputStream> resp = HttpClientUtils.sendHttpRequest(httpClient, reqBuilder.build(),
        HttpResponse.BodyHandlers.ofInputStream());
    if (resp.statusCode() != 200) {
      resp.body().close();
      throw new IOException("OAI-PMH repository returned HTTP status " + resp.statusCode() + " for " + url);
    }
    final DocumentBuilder builder = StaticFactories.newDocumentBuilder();
    try (final InputStream in = HttpClientUtils.getDecompressingInputStream(resp)) {
      return builder.parse(in, url);
    } catch (SAXException saxe) {
      throw new IOException("Invalid OAI-PMH response from " + url + ": " + saxe.getMessage(), saxe);
    }
  }

  /** Returns true if the response reports that no records match; throws {@link OAIException} for other errors. */
  private boolean checkError(Document resp) throws OAIException {
    final Element error = child(resp.getDocumentElement(), "error");
    if (error == null) return false;
    final String code = error.getAttribute("code");
    if ("noRecordsMatch".equals(code)) {
      log.info("No records match the request.");
      return true;
    }
    throw new OAIException(code, error.getTextContent().trim());
  }

  private Instant responseDate(Document resp) {
    final Element e = child(resp.getDocumentElement(), "responseDate");
    if (e == null) return null;
    try {
      return ISODateFormatter.parseDate(e.getTextContent());
    } catch (DateTimeParseException dte) {
      log.warn("Invalid responseDate in OAI response: " + e.getTextContent());
      return null;
    }
  }

  private static boolean isDeleted(Element record) {
    final Element header = child(record, "header");
    return header != null && "deleted".equals(header.getAttribute("status"));
  }

  private static Document toDocument(Element record) {
    final Document doc = StaticFactories.newDocumentBuilder().newDocument();
    doc.appendChild(doc.importNode(record, true));
    return doc;
  }

  private static boolean isOAIElement(Node n) {
    return n.getNodeType() == Node.ELEMENT_NODE && MetadataNamespaces.OAI_NS.equals(n.getNamespaceURI());
  }

  private static Element child(Element parent, String localName) {
    if (parent == null) return null;
    for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
      if (isOAIElement(n) && localName.equals(n.getLocalName())) return (Element) n;
    }
    return null;
  }

  private static String encode(String s) {
    return URLEncoder.encode(s, StandardCharsets.UTF_8);
  }

}
