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

/**
 * Fixed table of organization display names and their codes in the
 * Fairdata organization code list.
 */
public final class OrganizationCodes {

  private OrganizationCodes() {} // no instance

  public static final String URL_BASE = "http://uri.suomi.fi/codelist/fairdata/organization/code/";

  public static final Map<String,String> CODES = Map.ofEntries(
    Map.entry("Aalto University", "10076"),
    Map.entry("CSC — IT Center for Science Ltd", "09206320"),
    Map.entry("Centre for Applied Language Studies", "01906-213060"),
    Map.entry("National Library of Finland", "01901-H981"),
    Map.entry("South Eastern Finland University of Applied Sciences", "10118"),
    Map.entry("University of Eastern Finland", "10088"),
    Map.entry("University of Helsinki", "01901"),
    Map.entry("University of Jyväskylä", "01906"),
    Map.entry("University of Oulu", "01904"),
    Map.entry("University of Tampere", "10122"),
    Map.entry("University of Turku", "10089")
  );

  /** Returns the code list URI of an organization, matched exactly by display name. */
  public static Optional<String> url(String displayName) {
    if (displayName == null) return Optional.empty();
    final String code = CODES.get(displayName.trim());
    return (code == null) ? Optional.empty() : Optional.of(URL_BASE + code);
  }

}
