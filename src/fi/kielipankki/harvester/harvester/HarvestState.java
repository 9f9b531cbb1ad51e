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
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Properties;

import fi.kielipankki.harvester.utils.ISODateFormatter;

/**
 * Keeps the reference time of the last successful harvest in a properties file.
 */
public final class HarvestState {
  private static final org.apache.commons.logging.Log log = org.apache.commons.logging.LogFactory.getLog(HarvestState.class);

  public static final String PROP_LAST_HARVESTED = "lastHarvested";

  private final Path file;

  public HarvestState(Path file) {
    this.file = file;
  }

  public Path getFile() {
    return file;
  }

  /** Returns the reference time of the last successful harvest, <code>null</code> if there was none. */
  public Instant getLastHarvested() throws IOException {
    if (!Files.exists(file)) {
      log.info("No harvester state found in \"" + file + "\", doing a full harvest.");
      return null;
    }
    final Properties props = new Properties();
    try (InputStream in = Files.newInputStream(file)) {
      props.load(in);
    }
    final String v = props.getProperty(PROP_LAST_HARVESTED);
    if (v == null) return null;
    try {
      return ISODateFormatter.parseDate(v);
    } catch (DateTimeParseException e) {
      throw new IOException("Invalid " + PROP_LAST_HARVESTED + " in \"" + file + "\": " + v, e);
    }
  }

  /** Stores a new reference time, replacing the file atomically. */
  public void setLastHarvested(Instant date) throws IOException {
    final Properties props = new Properties();
    props.setProperty(PROP_LAST_HARVESTED, ISODateFormatter.formatLong(date));
    final Path dir = file.toAbsolutePath().getParent();
    if (dir != null) Files.createDirectories(dir);
    final Path tmp = Files.createTempFile(dir, "harvester-state", ".tmp");
    try {
      try (OutputStream out = Files.newOutputStream(tmp)) {
        props.store(out, "Reference date of last successful harvest");
      }
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(tmp);
    }
    log.info("Stored harvest reference date " + ISODateFormatter.formatLong(date) + ".");
  }

}
