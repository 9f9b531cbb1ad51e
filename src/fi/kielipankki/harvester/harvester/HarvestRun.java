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
import java.time.temporal.ChronoUnit;
import java.util.List;

import fi.kielipankki.harvester.mapping.RecordParsingException;
import fi.kielipankki.harvester.model.DatasetRecord;
import fi.kielipankki.harvester.processor.DestinationCatalogException;
import fi.kielipankki.harvester.processor.MetaxClient;
import fi.kielipankki.harvester.utils.ISODateFormatter;

/**
 * One synchronization of the source catalog into Metax: harvests the corpora changed
 * since the last successful run, sends them to Metax and deletes datasets whose
 * records disappeared from the source.
 */
public class HarvestRun {
  private static final org.apache.commons.logging.Log log = org.apache.commons.logging.LogFactory.getLog(HarvestRun.class);

  private final SourceCatalogClient source;
  private final MetaxClient metax;
  private final HarvestState state;
  private final RawRecordBackup backup;
  private final int harvestMessageStep;
  private final boolean deleteMissingRecords;

  /**
   * @param backup may be <code>null</code> to disable raw record backups
   */
  public HarvestRun(SourceCatalogClient source, MetaxClient metax, HarvestState state,
      RawRecordBackup backup, int harvestMessageStep, boolean deleteMissingRecords) {
    if (harvestMessageStep <= 0) throw new IllegalArgumentException("Invalid value for harvestMessageStep: " + harvestMessageStep);
    this.source = source;
    this.metax = metax;
    this.state = state;
    this.backup = backup;
    this.harvestMessageStep = harvestMessageStep;
    this.deleteMissingRecords = deleteMissingRecords;
  }

  /**
   * Runs the synchronization. Faulty records are logged and counted; the run only
   * stops early on errors that affect all records (misconfiguration, unreachable
   * source, unavailable language vocabulary).
   */
  public HarvestResult run() throws IOException {
    final Instant startTime = Instant.now().truncatedTo(ChronoUnit.SECONDS);
    final Instant from = state.getLastHarvested();
    if (from == null) {
      log.info("Harvesting all records...");
    } else {
      log.info("Harvesting records changed since " + ISODateFormatter.formatLong(from) + "...");
    }

    final HarvestResult result = new HarvestResult();
    final Instant responseDate = source.corpora(from, record -> processRecord(record, result));
    log.info("Harvested " + result.harvested + " records - finished.");

    if (deleteMissingRecords) {
      deleteMissing(result);
    }

    if (result.isSuccess()) {
      // reference date of this harvest, only stored after a complete run
      state.setLastHarvested((responseDate != null) ? responseDate : startTime);
    } else {
      log.warn("Harvest was not complete, keeping the old reference date.");
    }
    if (result.faulty > 0) {
      log.error(result.toString());
    } else {
      log.info(result.toString());
    }
    return result;
  }

  private void processRecord(SourceRecord record, HarvestResult result) throws IOException {
    result.harvested++;
    final String identifier = record.bestEffortIdentifier();

    if (backup != null) {
      try {
        backup.backup(identifier, record.getDocument());
      } catch (IOException e) {
        result.backupFailures++;
        log.error("Could not back up record " + identifier + ": " + e.getMessage());
      }
    }

    DatasetRecord dataset = null;
    try {
      dataset = record.toRecord();
    } catch (RecordParsingException e) {
      result.faulty++;
      log.error(e.toString());
    }

    if (dataset != null) {
      try {
        metax.send(dataset);
      } catch (DestinationCatalogException e) {
        // MisconfigurationException is no DestinationCatalogException and stops the run
        result.faulty++;
        log.error("Could not send record " + identifier + " to Metax: " + e.getMessage());
      }
    }

    if (result.harvested % harvestMessageStep == 0) log.info("Harvested " + result.harvested + " records so far.");
  }

  private void deleteMissing(HarvestResult result) throws IOException {
    log.info("Listing all records of the source catalog to find removed ones...");
    final List<SourceRecord> retained = source.allCorpora();
    if (retained.isEmpty()) {
      log.warn("The source catalog has no corpora, not deleting anything from Metax.");
      return;
    }
    try {
      result.deleted.addAll(metax.deleteRecordsNotIn(retained));
      for (String pid : result.deleted) {
        log.info("Deleted record " + pid + " from Metax.");
      }
    } catch (RecordParsingException e) {
      result.deletionAborted = true;
      log.error("Deletion of removed records aborted, because the source catalog could not be read completely. " + e);
    } catch (DestinationCatalogException e) {
      result.deletionAborted = true;
      log.error("Deletion of removed records aborted: " + e.getMessage());
    }
  }

}
