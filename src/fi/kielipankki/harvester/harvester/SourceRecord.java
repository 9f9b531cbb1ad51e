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

import org.w3c.dom.Document;

import fi.kielipankki.harvester.mapping.RecordMapper;
import fi.kielipankki.harvester.mapping.RecordParsingException;
import fi.kielipankki.harvester.model.DatasetRecord;
import fi.kielipankki.harvester.processor.RetainedRecord;

/**
 * A harvested raw record together with the mapper of its dialect.
 */
public final class SourceRecord implements RetainedRecord {

  private final Document document;
  private final RecordMapper mapper;

  public SourceRecord(Document document, RecordMapper mapper) {
    this.document = document;
    this.mapper = mapper;
  }

  public Document getDocument() {
    return document;
  }

  @Override
  public String pid() throws RecordParsingException {
    return mapper.pid(document);
  }

  /** The PID, or any identifier usable in messages if there is none. */
  public String bestEffortIdentifier() {
    return mapper.bestEffortIdentifier(document);
  }

  public DatasetRecord toRecord() throws RecordParsingException, IOException {
    return mapper.toRecord(document);
  }

}
