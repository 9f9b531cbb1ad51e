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
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.w3c.dom.Document;

import fi.kielipankki.harvester.utils.StaticFactories;

/**
 * Writes the raw XML of harvested records to a directory, one file per record,
 * named after the record identifier.
 */
public final class RawRecordBackup {

  private final Path directory;

  public RawRecordBackup(Path directory) {
    this.directory = directory;
  }

  /** Writes the record and returns the file written. */
  public Path backup(String identifier, Document record) throws IOException {
    Files.createDirectories(directory);
    final Path file = directory.resolve(fileName(identifier));
    try (OutputStream out = Files.newOutputStream(file)) {
      final Transformer trans = StaticFactories.transFactory.newTransformer();
      trans.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
      trans.setOutputProperty(OutputKeys.INDENT, "no");
      trans.transform(new DOMSource(record), new StreamResult(out));
    } catch (TransformerException e) {
      throw new IOException("Cannot write backup of " + identifier + " to \"" + file + "\"", e);
    }
    return file;
  }

  /** Makes a file name from an identifier, replacing characters that are not safe in file names. */
  static String fileName(String identifier) {
    final String id = (identifier == null || identifier.isEmpty()) ? "unknown" : identifier;
    return id.replaceAll("[^A-Za-z0-9._-]", "_") + ".xml";
  }

}
