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

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Memoizes fetched vocabularies by endpoint. Owned by the component composing
 * the {@link LanguageVocabulary}; lives as long as that component (usually
 * the whole harvester process). Not thread safe.
 */
public final class VocabularyCache {
  private static final org.apache.commons.logging.Log log = org.apache.commons.logging.LogFactory.getLog(VocabularyCache.class);

  private final Map<String,Set<String>> vocabularies = new HashMap<>();

  /** Returns the cached vocabulary of the endpoint, fetching it on first use. Failed fetches are not cached. */
  public Set<String> getOrFetch(String endpoint, VocabularyFetcher fetcher) throws IOException {
    Set<String> v = vocabularies.get(endpoint);
    if (v == null) {
      log.info("Fetching vocabulary from \"" + endpoint + "\"...");
      v = Set.copyOf(fetcher.fetch(endpoint));
      log.info("Vocabulary contains " + v.size() + " entries.");
      vocabularies.put(endpoint, v);
    }
    return v;
  }

  /** Forgets all fetched vocabularies. */
  public void invalidate() {
    vocabularies.clear();
  }

}
