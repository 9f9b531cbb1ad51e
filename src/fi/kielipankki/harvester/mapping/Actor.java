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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import fi.kielipankki.harvester.model.ActorEntry;
import fi.kielipankki.harvester.model.OrganizationEntry;
import fi.kielipankki.harvester.model.PersonEntry;

/**
 * A person and/or organization related to a dataset through a set of roles.
 * Two actors with the same {@link #identityKey()} describe the same party;
 * the mapper merges them with {@link #addRoles(Collection)}.
 */
public final class Actor {

  public static final String ROLE_CREATOR = "creator";
  public static final String ROLE_PUBLISHER = "publisher";
  public static final String ROLE_CURATOR = "curator";
  public static final String ROLE_RIGHTS_HOLDER = "rights_holder";

  private final PersonEntry person;
  private final OrganizationEntry organization;
  private final Set<String> roles = new TreeSet<>();

  public Actor(PersonEntry person, OrganizationEntry organization, Collection<String> roles) {
    this.person = person;
    this.organization = organization;
    this.roles.addAll(roles);
  }

  public PersonEntry getPerson() {
    return person;
  }

  public OrganizationEntry getOrganization() {
    return organization;
  }

  /** Person name, <code>null</code> for organizations. */
  public String getName() {
    return (person == null) ? null : person.getName();
  }

  public String getEmail() {
    return (person == null) ? null : person.getEmail();
  }

  public Set<String> getRoles() {
    return Collections.unmodifiableSet(roles);
  }

  public boolean hasRole(String role) {
    return roles.contains(role);
  }

  public void addRoles(Collection<String> newRoles) {
    roles.addAll(newRoles);
  }

  public boolean removeRole(String role) {
    return roles.remove(role);
  }

  public Key identityKey() {
    return new Key(getName(), getEmail(), organization);
  }

  /** Exports the actor, roles sorted. */
  public ActorEntry toEntry() {
    return new ActorEntry(new ArrayList<>(roles), person, organization);
  }

  @Override
  public String toString() {
    return "Actor[roles=" + roles + ", person=" + person + ", organization=" + organization + "]";
  }

  /** Composite identity of an actor: name, email and organization. */
  public static final class Key {
    private final String name, email;
    private final OrganizationEntry organization;

    Key(String name, String email, OrganizationEntry organization) {
      this.name = name;
      this.email = email;
      this.organization = organization;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Key)) return false;
      final Key other = (Key) o;
      return Objects.equals(name, other.name) && Objects.equals(email, other.email)
          && Objects.equals(organization, other.organization);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, email, organization);
    }

    @Override
    public String toString() {
      return "(" + name + ", " + email + ", " + organization + ")";
    }
  }

}
