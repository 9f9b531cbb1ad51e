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

package fi.kielipankki.harvester.config;

import java.io.File;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Path;
import java.time.Duration;

import org.apache.commons.digester.ExtendedBaseRules;
import org.xml.sax.SAXException;

import fi.kielipankki.harvester.Package;
import fi.kielipankki.harvester.mapping.LanguageVocabulary;
import fi.kielipankki.harvester.utils.BooleanParser;
import fi.kielipankki.harvester.utils.ExtendedDigester;
import fi.kielipankki.harvester.utils.PublicForDigesterUse;

/**
 * Main harvester configuration class. It loads the configuration from a XML file:
 * <pre>
 * &lt;config&gt;
 *   &lt;source&gt;baseUrl, metadataPrefix, setSpec, dialect, timeoutAfterSeconds&lt;/source&gt;
 *   &lt;destination&gt;baseUrl, catalogId, apiToken, timeoutAfterSeconds&lt;/destination&gt;
 *   &lt;languageVocabulary&gt;endpoint&lt;/languageVocabulary&gt;
 *   &lt;harvester&gt;stateFile, backupDirectory, harvestMessageStep, deleteMissingRecords&lt;/harvester&gt;
 * &lt;/config&gt;
 * </pre>
 * Relative file names are resolved against the directory of the configuration file.
 */
public final class Config {
  
  private static final org.apache.commons.logging.Log log = org.apache.commons.logging.LogFactory.getLog(Config.class);
  
  public static final int DEFAULT_TIMEOUT_SECONDS = 30;
  public static final int DEFAULT_HARVEST_MESSAGE_STEP = 100;
  
  public Config(String file) throws Exception {
    this.file = file;
    
    log.info(Package.getFullPackageDescription());
    
    ExtendedDigester dig = new ExtendedDigester();
    dig.setNamespaceAware(true);
    dig.setValidating(false);
    dig.setRulesWithInvalidElementCheck(new ExtendedBaseRules());
    
    dig.addDoNothing("config");
    
    // *** SOURCE ***
    dig.addRule("config/source", new PushRule(source));
    dig.addCallMethod("config/source/baseUrl", "setBaseUrl", 0);
    dig.addCallMethod("config/source/metadataPrefix", "setMetadataPrefix", 0);
    dig.addCallMethod("config/source/setSpec", "setSetSpec", 0);
    dig.addCallMethod("config/source/dialect", "setDialect", 0);
    dig.addCallMethod("config/source/timeoutAfterSeconds", "setTimeoutAfterSeconds", 0);
    
    // *** DESTINATION ***
    dig.addRule("config/destination", new PushRule(destination));
    dig.addCallMethod("config/destination/baseUrl", "setBaseUrl", 0);
    dig.addCallMethod("config/destination/catalogId", "setCatalogId", 0);
    dig.addCallMethod("config/destination/apiToken", "setApiToken", 0);
    dig.addCallMethod("config/destination/timeoutAfterSeconds", "setTimeoutAfterSeconds", 0);
    
    // *** LANGUAGE VOCABULARY ***
    dig.addDoNothing("config/languageVocabulary");
    dig.addCallMethod("config/languageVocabulary/endpoint", "setLanguageVocabularyEndpoint", 0);
    
    // *** HARVESTER ***
    dig.addDoNothing("config/harvester");
    dig.addCallMethod("config/harvester/stateFile", "setStateFile", 0);
    dig.addCallMethod("config/harvester/backupDirectory", "setBackupDirectory", 0);
    dig.addCallMethod("config/harvester/harvestMessageStep", "setHarvestMessageStep", 0);
    dig.addCallMethod("config/harvester/deleteMissingRecords", "setDeleteMissingRecords", 0);
    
    // parse config
    try {
      dig.push(this);
      dig.parse(new File(file));
    } catch (SAXException saxe) {
      Throwable e = saxe;
      // throw the real Exception not the digester one
      if (saxe.getException() != null) e = saxe.getException();
      if (e instanceof InvocationTargetException) e = e.getCause();
      if (e instanceof Error) throw (Error) e;
      if (e instanceof Exception) throw (Exception) e;
      throw saxe;
    }
    
    // *** After loading do final checks ***
    source.check();
    destination.check();
    if (stateFile == null) {
      stateFile = resolvePath(DEFAULT_STATE_FILE);
    }
    if (log.isDebugEnabled()) log.debug("Loaded configuration: source " + source.getBaseUrl() + ", destination " + destination);
  }
  
  /** Pushes a configuration object while its element is parsed, so the child rules call its setters. */
  private static final class PushRule extends org.apache.commons.digester.Rule {
    private final Object target;
    
    PushRule(Object target) {
      this.target = target;
    }
    
    @Override
    public void begin(String namespace, String name, org.xml.sax.Attributes attributes) {
      getDigester().push(target);
    }
    
    @Override
    public void end(String namespace, String name) {
      getDigester().pop();
    }
  }
  
  /**
   * makes the given local filesystem path absolute and resolve it relative to
   * config directory
   **/
  public Path resolvePath(String path) throws IOException {
    File f = new File(path);
    if (!f.isAbsolute()) {
      f = new File(new File(this.file).getAbsoluteFile().getParentFile(), path);
    }
    return f.getCanonicalFile().toPath();
  }
  
  static String nonEmpty(String v, String element) {
    if (v == null || v.trim().isEmpty()) {
      throw new IllegalArgumentException("Empty value for <" + element + ">");
    }
    return v.trim();
  }
  
  static Duration parseTimeout(String v, String element) {
    final int secs;
    try {
      secs = Integer.parseInt(nonEmpty(v, element));
    } catch (NumberFormatException nfe) {
      throw new IllegalArgumentException("Invalid number of seconds for <" + element + ">: " + v);
    }
    if (secs <= 0) throw new IllegalArgumentException("<" + element + "> must be positive");
    return Duration.ofSeconds(secs);
  }
  
  @PublicForDigesterUse("languageVocabulary/endpoint")
  @Deprecated
  public void setLanguageVocabularyEndpoint(String v) {
    languageVocabularyEndpoint = nonEmpty(v, "languageVocabulary/endpoint");
  }
  
  @PublicForDigesterUse("harvester/stateFile")
  @Deprecated
  public void setStateFile(String v) throws IOException {
    stateFile = resolvePath(nonEmpty(v, "harvester/stateFile"));
  }
  
  @PublicForDigesterUse("harvester/backupDirectory")
  @Deprecated
  public void setBackupDirectory(String v) throws IOException {
    backupDirectory = (v == null || v.trim().isEmpty()) ? null : resolvePath(v.trim());
  }
  
  @PublicForDigesterUse("harvester/harvestMessageStep")
  @Deprecated
  public void setHarvestMessageStep(String v) {
    try {
      harvestMessageStep = Integer.parseInt(nonEmpty(v, "harvester/harvestMessageStep"));
    } catch (NumberFormatException nfe) {
      throw new IllegalArgumentException("Invalid number for <harvester/harvestMessageStep>: " + v);
    }
    if (harvestMessageStep <= 0) throw new IllegalArgumentException("<harvester/harvestMessageStep> must be positive");
  }
  
  @PublicForDigesterUse("harvester/deleteMissingRecords")
  @Deprecated
  public void setDeleteMissingRecords(String v) {
    deleteMissingRecords = BooleanParser.parseBoolean(v, true);
  }
  
  public SourceConfig getSource() {
    return source;
  }
  
  public DestinationConfig getDestination() {
    return destination;
  }
  
  public String getLanguageVocabularyEndpoint() {
    return languageVocabularyEndpoint;
  }
  
  public Path getStateFile() {
    return stateFile;
  }
  
  /** Directory for raw XML backups of harvested records, <code>null</code> if disabled. */
  public Path getBackupDirectory() {
    return backupDirectory;
  }
  
  public int getHarvestMessageStep() {
    return harvestMessageStep;
  }
  
  public boolean isDeleteMissingRecords() {
    return deleteMissingRecords;
  }
  
  public String getFile() {
    return file;
  }
  
  public static final String DEFAULT_STATE_FILE = "harvester-state.properties";
  
  // members "the configuration"
  private final String file;
  private final SourceConfig source = new SourceConfig();
  private final DestinationConfig destination = new DestinationConfig();
  private String languageVocabularyEndpoint = LanguageVocabulary.DEFAULT_ENDPOINT;
  private Path stateFile = null;
  private Path backupDirectory = null;
  private int harvestMessageStep = DEFAULT_HARVEST_MESSAGE_STEP;
  private boolean deleteMissingRecords = true;
  
}
