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

package fi.kielipankki.harvester.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Access rights of a dataset: its licenses, the access type and, for restricted
 * datasets, the grounds for the restriction.
 */
public final class AccessRights {
  
  private final List<License> licenses;
  private final Reference accessType;
  private final List<Reference> restrictionGrounds;
  
  public AccessRights(List<License> licenses, Reference accessType, List<Reference> restrictionGrounds) {
    this.licenses = List.copyOf(licenses);
    this.accessType = accessType;
    this.restrictionGrounds = (restrictionGrounds == null) ? null : List.copyOf(restrictionGrounds);
  }
  
  @JsonProperty("license")
  public List<License> getLicenses() {
    return licenses;
  }
  
  @JsonProperty("access_type")
  public Reference getAccessType() {
    return accessType;
  }
  
  /** Returns <code>null</code> for open datasets. */
  @JsonProperty("restriction_grounds")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public List<Reference> getRestrictionGrounds() {
    return restrictionGrounds;
  }
  
}
