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

/** Receives the harvested records one by one. */
@FunctionalInterface
public interface RecordHandler {

  /**
   * Processes one record. Throwing an {@link IOException} stops the harvest.
   * @param record the OAI-PMH <code>record</code> element as root of its own document
   */
  void handleRecord(Document record) throws IOException;

}
