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

import fi.kielipankki.harvester.mapping.Dialect;
import fi.kielipankki.harvester.utils.PublicForDigesterUse;

/**
 * Configuration of the OAI-PMH source catalog.
 */
public final class SourceConfig {

  public static final String DEFAULT_METADATA_PREFIX = "cmdi";

  String baseUrl = null;
  String metadataPrefix = DEFAULT_METADATA_PREFIX;
  String setSpec = null;
  Dialect dialect = Dialect.CMDI;
  Duration timeout = Duration.ofSeconds(Config.DEFAULT_TIMEOUT_SECONDS);

  public SourceConfig() {
  }

  /** Checks for mandatory values. */
  void check() {
    if (baseUrl == null) throw new IllegalArgumentException("Missing <baseUrl> in <source>");
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public String getMetadataPrefix() {
    return metadataPrefix;
  }

  /** The OAI set to harvest, <code>null</code> for the whole repository. */
  public String getSetSpec() {
    return setSpec;
  }

  public Dialect getDialect() {
    return dialect;
  }

  public Duration getTimeout() {
    return timeout;
  }

  @PublicForDigesterUse("source/baseUrl")
  @Deprecated
  public void setBaseUrl(String v) {
    baseUrl = Config.nonEmpty(v, "source/baseUrl");
  }

  @PublicForDigesterUse("source/metadataPrefix")
  @Deprecated
  public void setMetadataPrefix(String v) {
    metadataPrefix = Config.nonEmpty(v, "source/metadataPrefix");
  }

  @PublicForDigesterUse("source/setSpec")
  @Deprecated
  public void setSetSpec(String v) {
    setSpec = (v == null || v.trim().isEmpty()) ? null : v.trim();
  }

  @PublicForDigesterUse("source/dialect")
  @Deprecated
  public void setDialect(String v) {
    dialect = Dialect.forName(Config.nonEmpty(v, "source/dialect"));
  }

  @PublicForDigesterUse("source/timeoutAfterSeconds")
  @Deprecated
  public void setTimeoutAfterSeconds(String v) {
    timeout = Config.parseTimeout(v, "source/timeoutAfterSeconds");
  }

}
