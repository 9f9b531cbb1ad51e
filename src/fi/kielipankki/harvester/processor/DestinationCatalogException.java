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
 * Thrown when a request to the Metax API fails. Carries the HTTP status
 * (or <code>-1</code> if no response was received) and the response text.
 */
public class DestinationCatalogException extends IOException {

  private static final long serialVersionUID = 1L;

  private final int statusCode;
  private final String responseText;

  public DestinationCatalogException(String message) {
    this(message, -1, null, null);
  }

  public DestinationCatalogException(String message, Throwable cause) {
    this(message, -1, null, cause);
  }

  public DestinationCatalogException(String message, int statusCode, String responseText, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.responseText = responseText;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getResponseText() {
    return responseText;
  }

}
