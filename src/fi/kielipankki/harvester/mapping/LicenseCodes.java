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

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed table of META-SHARE licence tokens and the corresponding
 * entries of the Fairdata license code list.
 */
public final class LicenseCodes {

  private LicenseCodes() {} // no instance

  public static final String URL_BASE = "http://uri.suomi.fi/codelist/fairdata/license/code/";

  /** Used when none of the licences of a record could be mapped. */
  public static final String OTHER_URL = URL_BASE + "other";

  public static final Map<String,String> CODES = Map.ofEntries(
    Map.entry("CLARIN_PUB", "ClarinPUB-1.0"),
    Map.entry("CLARIN_ACA", "ClarinACA-1.0"),
    Map.entry("CLARIN_ACA-NC", "ClarinACA+NC-1.0"),
    Map.entry("CLARIN_RES", "ClarinRES-1.0"),
    Map.entry("other", "other"),
    Map.entry("underNegotiation", "undernegotiation"),
    Map.entry("proprietary", "other-closed"),
    Map.entry("CC-BY", "CC-BY-1.0"),
    Map.entry("CC-BY-ND", "CC-BY-ND-4.0"),
    Map.entry("CC-BY-NC", "CC-BY-NC-2.0"),
    Map.entry("CC-BY-SA", "CC-BY-SA-3.0"),
    Map.entry("CC-BY-NC-ND", "CC-BY-NC-ND-4.0"),
    Map.entry("CC-BY-NC-SA", "CC-BY-NC-SA-4.0"),
    Map.entry("CC-ZERO", "CC0-1.0"),
    Map.entry("ApacheLicence_2.0", "Apache-2.0")
  );

  /** Licence tokens whose actual terms are given in a separate licence document. */
  public static final Set<String> CUSTOM_URL_FAMILIES = Set.of("CLARIN_RES", "other");

  /** Code list entries that restrict use to academic research. */
  public static final String ACADEMIC_FAMILY = "ClarinACA";

  public static Optional<String> url(String token) {
    if (token == null) return Optional.empty();
    final String code = CODES.get(token.trim());
    return (code == null) ? Optional.empty() : Optional.of(URL_BASE + code);
  }

}
