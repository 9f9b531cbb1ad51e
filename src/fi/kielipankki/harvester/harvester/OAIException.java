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

/**
 * Thrown when an OAI-PMH repository answers with an error code.
 */
public class OAIException extends IOException {

  private static final long serialVersionUID = 1L;

  private final String code;

  public OAIException(String code, String message) {
    super((message == null || message.isEmpty()) ? ("OAI error: " + code) : ("OAI error " + code + ": " + message));
    this.code = code;
  }

  /** The OAI-PMH error code, e.g. <code>badArgument</code>. */
  public String getCode() {
    return code;
  }

}
