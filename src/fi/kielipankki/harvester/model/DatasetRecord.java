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

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import fi.kielipankki.harvester.utils.ISODateFormatter;

/**
 * A dataset in the shape the Metax <code>datasets</code> endpoint accepts.
 * Instances are immutable and created by the record mappers.
 */
@JsonPropertyOrder({"data_catalog", "language", "field_of_science", "persistent_identifier",
    "title", "description", "modified", "created", "access_rights", "actors", "state"})
public final class DatasetRecord {
  
  /** Field of science of all harvested corpora (linguistics). */
  public static final Reference FIELD_OF_SCIENCE = new Reference("http://www.yso.fi/onto/okm-tieteenala/ta6121");
  
  public static final String STATE_PUBLISHED = "published";
  
  private final String dataCatalog;
  private final String persistentIdentifier;
  private final Map<String,String> title, description;
  private final Instant modified, created;
  private final List<Reference> languages;
  private final AccessRights accessRights;
  private final List<ActorEntry> actors;
  
  public DatasetRecord(String dataCatalog, String persistentIdentifier,
      Map<String,String> title, Map<String,String> description,
      Instant modified, Instant created, List<Reference> languages,
      AccessRights accessRights, List<ActorEntry> actors) {
    this.dataCatalog = Objects.requireNonNull(dataCatalog, "dataCatalog");
    this.persistentIdentifier = Objects.requireNonNull(persistentIdentifier, "persistentIdentifier");
    this.title = Map.copyOf(title);
    this.description = Map.copyOf(description);
    this.modified = Objects.requireNonNull(modified, "modified");
    this.created = Objects.requireNonNull(created, "created");
    this.languages = List.copyOf(languages);
    this.accessRights = Objects.requireNonNull(accessRights, "accessRights");
    this.actors = List.copyOf(actors);
  }
  
  @JsonProperty("data_catalog")
  public String getDataCatalog() {
    return dataCatalog;
  }
  
  @JsonProperty("persistent_identifier")
  public String getPersistentIdentifier() {
    return persistentIdentifier;
  }
  
  @JsonProperty("title")
  public Map<String,String> getTitle() {
    return title;
  }
  
  @JsonProperty("description")
  public Map<String,String> getDescription() {
    return description;
  }
  
  @JsonIgnore
  public Instant getModified() {
    return modified;
  }
  
  @JsonIgnore
  public Instant getCreated() {
    return created;
  }
  
  @JsonProperty("modified")
  public String getModifiedString() {
    return ISODateFormatter.formatLong(modified);
  }
  
  @JsonProperty("created")
  public String getCreatedString() {
    return ISODateFormatter.formatLong(created);
  }
  
  @JsonProperty("language")
  public List<Reference> getLanguages() {
    return languages;
  }
  
  @JsonProperty("field_of_science")
  public List<Reference> getFieldsOfScience() {
    return List.of(FIELD_OF_SCIENCE);
  }
  
  @JsonProperty("access_rights")
  public AccessRights getAccessRights() {
    return accessRights;
  }
  
  @JsonProperty("actors")
  public List<ActorEntry> getActors() {
    return actors;
  }
  
  @JsonProperty("state")
  public String getState() {
    return STATE_PUBLISHED;
  }
  
  @Override
  public String toString() {
    return "DatasetRecord[" + persistentIdentifier + "]";
  }
  
}
