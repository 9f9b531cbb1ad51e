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

/**
 * Checks language URIs against the language reference data accepted by Metax.
 * The vocabulary is fetched once per endpoint and kept in the supplied {@link VocabularyCache}.
 */
public final class LanguageVocabulary {

  public static final String DEFAULT_ENDPOINT =
      "https://metax.fairdata.fi/es/reference_data/language/_search?size=10000";

  private final String endpoint;
  private final VocabularyCache cache;
  private final VocabularyFetcher fetcher;

  public LanguageVocabulary(String endpoint, VocabularyCache cache, VocabularyFetcher fetcher) {
    this.endpoint = (endpoint == null) ? DEFAULT_ENDPOINT : endpoint;
    this.cache = cache;
    this.fetcher = fetcher;
  }

  public String getEndpoint() {
    return endpoint;
  }

  /**
   * Returns true if the URI is part of the vocabulary.
   * @throws IOException if the vocabulary could not be fetched
   */
  public boolean isAllowed(String uri) throws IOException {
    return cache.getOrFetch(endpoint, fetcher).contains(uri);
  }

}
