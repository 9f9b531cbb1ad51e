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

/**
 * Thrown when a single harvested record cannot be mapped to a complete Metax dataset.
 * The exception carries the best-effort identifier of the record, so the harvester
 * can report the faulty record to the operator.
 */
public class RecordParsingException extends Exception {

  private static final long serialVersionUID = 1L;

  private final String identifier;

  public RecordParsingException(String message, String identifier) {
    super(message);
    this.identifier = identifier;
  }

  public RecordParsingException(String message, String identifier, Throwable cause) {
    super(message, cause);
    this.identifier = identifier;
  }

  /** The PID (or OAI identifier) of the record, may be <code>null</code> if nothing could be found. */
  public String getIdentifier() {
    return identifier;
  }

  @Override
  public String toString() {
    return "Error parsing record " + identifier + ": " + getMessage();
  }

}
