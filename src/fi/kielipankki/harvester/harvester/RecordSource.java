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

/**
 * A repository delivering raw metadata records.
 */
public interface RecordSource {

  /**
   * Delivers all records changed since <code>from</code> (all records if <code>null</code>)
   * to the handler. Deleted records are not delivered.
   * @return the repository's own timestamp of the harvest, if it reports one; used as
   * reference for the next incremental harvest
   */
  Instant harvest(Instant from, RecordHandler handler) throws IOException;

}
