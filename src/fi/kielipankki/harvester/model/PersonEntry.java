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

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;

/** The person part of an actor entry. */
public final class PersonEntry {
  
  private final String name, email;
  
  public PersonEntry(String name, String email) {
    this.name = name;
    this.email = email;
  }
  
  @JsonProperty("name")
  public String getName() {
    return name;
  }
  
  @JsonProperty("email")
  public String getEmail() {
    return email;
  }
  
  @Override
  public boolean equals(Object o) {
    if (!(o instanceof PersonEntry)) return false;
    final PersonEntry other = (PersonEntry) o;
    return Objects.equals(name, other.name) && Objects.equals(email, other.email);
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(name, email);
  }
  
  @Override
  public String toString() {
    return (email == null) ? String.valueOf(name) : (name + " <" + email + ">");
  }
  
}
