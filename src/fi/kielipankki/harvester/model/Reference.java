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

/**
 * A reference to an entry of a Metax reference vocabulary (languages, field of science,
 * access types, ...), serialized as <code>{"url": "..."}</code>.
 */
public final class Reference {
  
  private final String url;
  
  public Reference(String url) {
    this.url = Objects.requireNonNull(url, "url");
  }
  
  @JsonProperty("url")
  public String getUrl() {
    return url;
  }
  
  @Override
  public boolean equals(Object o) {
    return (o instanceof Reference) && url.equals(((Reference) o).url);
  }
  
  @Override
  public int hashCode() {
    return url.hashCode();
  }
  
  @Override
  public String toString() {
    return url;
  }
  
}
