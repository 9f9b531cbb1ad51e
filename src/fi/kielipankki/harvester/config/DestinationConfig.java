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

package fi.kielipankki.harvester.config;

import java.time.Duration;

import fi.kielipankki.harvester.utils.PublicForDigesterUse;

/**
 * Configuration of the Metax API and the data catalog that is synchronized.
 */
public final class DestinationConfig {

  public static final String DEFAULT_BASE_URL = "https://metax-service.fd-staging.csc.fi/v3";
  public static final String DEFAULT_CATALOG_ID = "urn:nbn:fi:att:data-catalog-kielipankki";

  /** Environment variable consulted when the configuration has no <code>apiToken</code>. */
  public static final String API_TOKEN_ENV = "METAX_API_TOKEN";

  String baseUrl = DEFAULT_BASE_URL;
  String catalogId = DEFAULT_CATALOG_ID;
  String apiToken = null;
  Duration timeout = Duration.ofSeconds(Config.DEFAULT_TIMEOUT_SECONDS);

  public DestinationConfig() {
  }

  void check() {
    if (apiToken == null) {
      final String env = System.getenv(API_TOKEN_ENV);
      if (env == null || env.trim().isEmpty()) {
        throw new IllegalArgumentException("Missing <apiToken> in <destination> and no " + API_TOKEN_ENV + " in environment");
      }
      apiToken = env.trim();
    }
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public String getCatalogId() {
    return catalogId;
  }

  public String getApiToken() {
    return apiToken;
  }

  public Duration getTimeout() {
    return timeout;
  }

  @PublicForDigesterUse("destination/baseUrl")
  @Deprecated
  public void setBaseUrl(String v) {
    baseUrl = Config.nonEmpty(v, "destination/baseUrl");
  }

  @PublicForDigesterUse("destination/catalogId")
  @Deprecated
  public void setCatalogId(String v) {
    catalogId = Config.nonEmpty(v, "destination/catalogId");
  }

  @PublicForDigesterUse("destination/apiToken")
  @Deprecated
  public void setApiToken(String v) {
    apiToken = Config.nonEmpty(v, "destination/apiToken");
  }

  @PublicForDigesterUse("destination/timeoutAfterSeconds")
  @Deprecated
  public void setTimeoutAfterSeconds(String v) {
    timeout = Config.parseTimeout(v, "destination/timeoutAfterSeconds");
  }

  @Override
  public String toString() {
    // never print the token
    return "Metax " + baseUrl + " (catalog " + catalogId + ")";
  }

}
