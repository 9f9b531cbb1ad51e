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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A license of a dataset. The custom URL points to a license document
 * for licenses that are not fully identified by the code list entry.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class License {
  
  private final String url, customUrl;
  
  public License(String url, String customUrl) {
    this.url = Objects.requireNonNull(url, "url");
    this.customUrl = customUrl;
  }
  
  public License(String url) {
    this(url, null);
  }
  
  @JsonProperty("url")
  public String getUrl() {
    return url;
  }
  
  @JsonProperty("custom_url")
  public String getCustomUrl() {
    return customUrl;
  }
  
  @Override
  public boolean equals(Object o) {
    if (!(o instanceof License)) return false;
    final License other = (License) o;
    return url.equals(other.url) && Objects.equals(customUrl, other.customUrl);
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(url, customUrl);
  }
  
  @Override
  public String toString() {
    return (customUrl == null) ? url : (url + " (" + customUrl + ")");
  }
  
}
