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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An actor as sent to Metax. Roles are sorted; person and organization
 * are serialized as <code>null</code> when missing.
 */
public final class ActorEntry {
  
  private final List<String> roles;
  private final PersonEntry person;
  private final OrganizationEntry organization;
  
  public ActorEntry(List<String> roles, PersonEntry person, OrganizationEntry organization) {
    this.roles = List.copyOf(roles);
    this.person = person;
    this.organization = organization;
  }
  
  @JsonProperty("roles")
  public List<String> getRoles() {
    return roles;
  }
  
  @JsonProperty("person")
  public PersonEntry getPerson() {
    return person;
  }
  
  @JsonProperty("organization")
  public OrganizationEntry getOrganization() {
    return organization;
  }
  
  @Override
  public String toString() {
    return "ActorEntry[roles=" + roles + ", person=" + person + ", organization=" + organization + "]";
  }
  
}
