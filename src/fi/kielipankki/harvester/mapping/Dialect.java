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

import java.util.Locale;
import java.util.Map;

/**
 * The XML schema dialects of harvested metadata records. Every dialect binds
 * the XPath prefix <code>md</code> to its own namespace; all other field
 * locations are shared.
 */
public enum Dialect {

  /** CLARIN CMDI records (META-SHARE profile), as served by COMEDI. */
  CMDI("cmdi", "http://www.clarin.eu/cmd/", "xml:lang",
      "//md:Header/md:MdSelfLink",
      "//md:Header/md:MdCreationDate",
      "//oai:header/oai:datestamp",
      false, Map.of()) {
    @Override
    public String normalizePid(String raw) {
      return raw.trim();
    }
  },

  /** Native META-SHARE records, as served by the legacy META-SHARE node. */
  META_SHARE("metashare", "http://www.ilsp.gr/META-XMLSchema", "lang",
      "//md:identificationInfo/md:identifier",
      "//md:metadataInfo/md:metadataCreationDate",
      "//md:metadataInfo/md:metadataLastDateUpdated",
      true, Map.of("fi-fi", "fin", "fi_fi", "fin")) {
    @Override
    public String normalizePid(String raw) {
      String pid = raw.trim();
      final String lower = pid.toLowerCase(Locale.ROOT);
      if (lower.startsWith("http://")) {
        pid = pid.substring(7);
      } else if (lower.startsWith("https://")) {
        pid = pid.substring(8);
      }
      if (pid.toLowerCase(Locale.ROOT).startsWith(URN_RESOLVER_PREFIX)) {
        pid = pid.substring(URN_RESOLVER_PREFIX.length());
      }
      if (pid.startsWith("lb-")) {
        pid = URN_PREFIX + pid;
      }
      return pid;
    }
  };

  static final String URN_PREFIX = "urn:nbn:fi:";
  static final String URN_RESOLVER_PREFIX = "urn.fi/";

  public final String configName;
  public final String namespace;
  public final String languageAttribute;
  public final String pidXPath, createdXPath, modifiedXPath;
  public final boolean skipActorsWithoutPerson;
  public final Map<String,String> fallbackLanguageCodes;

  Dialect(String configName, String namespace, String languageAttribute,
      String pidXPath, String createdXPath, String modifiedXPath,
      boolean skipActorsWithoutPerson, Map<String,String> fallbackLanguageCodes) {
    this.configName = configName;
    this.namespace = namespace;
    this.languageAttribute = languageAttribute;
    this.pidXPath = pidXPath;
    this.createdXPath = createdXPath;
    this.modifiedXPath = modifiedXPath;
    this.skipActorsWithoutPerson = skipActorsWithoutPerson;
    this.fallbackLanguageCodes = fallbackLanguageCodes;
  }

  /** Converts the raw identifier found at {@link #pidXPath} to the persistent identifier sent to Metax. */
  public abstract String normalizePid(String raw);

  /** Looks up a dialect by the name used in the configuration file. */
  public static Dialect forName(String name) {
    final String n = name.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
    for (Dialect d : values()) {
      if (d.configName.equals(n)) return d;
    }
    throw new IllegalArgumentException("Unknown metadata dialect: " + name);
  }

}
