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

package fi.kielipankki.harvester.harvester;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import fi.kielipankki.harvester.mapping.RecordMapper;
import fi.kielipankki.harvester.mapping.RecordParsingException;

/**
 * Delivers the corpora of the source catalog. Records of other resource types
 * (tools, lexical resources, ...) are filtered out.
 */
public class SourceCatalogClient {
  private static final org.apache.commons.logging.Log log = org.apache.commons.logging.LogFactory.getLog(SourceCatalogClient.class);

  private final RecordSource source;
  private final RecordMapper mapper;

  public SourceCatalogClient(RecordSource source, RecordMapper mapper) {
    this.source = source;
    this.mapper = mapper;
  }

  public RecordMapper getMapper() {
    return mapper;
  }

  /**
   * Calls the handler for every corpus changed since <code>from</code> (<code>null</code> for all).
   * Records without resource type are delivered too, so that mapping can report them.
   * @return the harvest timestamp reported by the repository, if any
   */
  public Instant corpora(Instant from, SourceRecordHandler handler) throws IOException {
    return source.harvest(from, doc -> {
      if (mapper.isCorpusCandidate(doc)) {
        handler.handleCorpus(new SourceRecord(doc, mapper));
      } else if (log.isDebugEnabled()) {
        log.debug("Skipping non-corpus record " + mapper.bestEffortIdentifier(doc));
      }
    });
  }

  /** All corpora of the catalog. */
  public List<SourceRecord> allCorpora() throws IOException {
    final List<SourceRecord> list = new ArrayList<>();
    corpora(null, list::add);
    return list;
  }

  /** PIDs of all corpora in the catalog. */
  public List<String> corpusPids() throws IOException, RecordParsingException {
    final List<String> pids = new ArrayList<>();
    for (SourceRecord r : allCorpora()) {
      pids.add(r.pid());
    }
    return pids;
  }

}
