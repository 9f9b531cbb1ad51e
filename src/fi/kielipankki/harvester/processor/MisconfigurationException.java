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

package fi.kielipankki.harvester.processor;

import java.io.IOException;

/**
 * Thrown when Metax cannot be used with the current configuration (invalid base URL,
 * unknown host, rejected API token). Retrying other records is pointless, so this
 * aborts the harvest.
 */
public class MisconfigurationException extends IOException {

  private static final long serialVersionUID = 1L;

  public MisconfigurationException(String message) {
    super(message);
  }

  public MisconfigurationException(String message, Throwable cause) {
    super(message, cause);
  }

}
