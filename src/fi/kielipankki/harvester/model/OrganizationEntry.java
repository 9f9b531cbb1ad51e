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

import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Organization of an actor. Either a reference to the Metax organization vocabulary
 * (only {@link #getUrl()} set) or a free-form organization with a multilingual label,
 * an optional homepage and an optional email address.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class OrganizationEntry {
  
  private final String url;
  private final Map<String,String> prefLabel;
  private final Homepage homepage;
  private final String email;
  
  private OrganizationEntry(String url, Map<String,String> prefLabel, Homepage homepage, String email) {
    this.url = url;
    this.prefLabel = prefLabel;
    this.homepage = homepage;
    this.email = email;
  }
  
  /** Creates an entry referring to the organization vocabulary. */
  public static OrganizationEntry reference(String url) {
    return new OrganizationEntry(Objects.requireNonNull(url, "url"), null, null, null);
  }
  
  /** Creates a free-form entry. The homepage and email may be <code>null</code>. */
  public static OrganizationEntry freeForm(Map<String,String> prefLabel, String homepageUrl, String email) {
    if (prefLabel == null || prefLabel.isEmpty()) {
      throw new IllegalArgumentException("A free-form organization needs a label");
    }
    return new OrganizationEntry(null, Map.copyOf(prefLabel),
        (homepageUrl == null) ? null : new Homepage(homepageUrl), email);
  }
  
  @JsonProperty("url")
  public String getUrl() {
    return url;
  }
  
  @JsonProperty("pref_label")
  public Map<String,String> getPrefLabel() {
    return prefLabel;
  }
  
  @JsonProperty("homepage")
  public Homepage getHomepage() {
    return homepage;
  }
  
  @JsonProperty("email")
  public String getEmail() {
    return email;
  }
  
  @Override
  public boolean equals(Object o) {
    if (!(o instanceof OrganizationEntry)) return false;
    final OrganizationEntry other = (OrganizationEntry) o;
    return Objects.equals(url, other.url) && Objects.equals(prefLabel, other.prefLabel)
        && Objects.equals(homepage, other.homepage) && Objects.equals(email, other.email);
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(url, prefLabel, homepage, email);
  }
  
  @Override
  public String toString() {
    return (url != null) ? url : String.valueOf(prefLabel);
  }
  
  /** Homepage of a free-form organization. */
  public static final class Homepage {
    private final String identifier;
    
    public Homepage(String identifier) {
      this.identifier = Objects.requireNonNull(identifier, "identifier");
    }
    
    @JsonProperty("identifier")
    public String getIdentifier() {
      return identifier;
    }
    
    @Override
    public boolean equals(Object o) {
      return (o instanceof Homepage) && identifier.equals(((Homepage) o).identifier);
    }
    
    @Override
    public int hashCode() {
      return identifier.hashCode();
    }
  }
  
}
