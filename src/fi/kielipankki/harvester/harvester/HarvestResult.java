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

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of a {@link HarvestRun}.
 */
public final class HarvestResult {

  int harvested = 0, faulty = 0, backupFailures = 0;
  boolean deletionAborted = false;
  final Set<String> deleted = new TreeSet<>();

  HarvestResult() {
  }

  /** Number of corpus records received from the source. */
  public int getHarvested() {
    return harvested;
  }

  /** Number of records that could not be mapped or sent to Metax. */
  public int getFaulty() {
    return faulty;
  }

  public int getBackupFailures() {
    return backupFailures;
  }

  public boolean isDeletionAborted() {
    return deletionAborted;
  }

  /** PIDs deleted from Metax because they disappeared from the source. */
  public Set<String> getDeleted() {
    return Collections.unmodifiableSet(deleted);
  }

  /** True if every record was synchronized and backed up and the deletion pass completed. */
  public boolean isSuccess() {
    return faulty == 0 && backupFailures == 0 && !deletionAborted;
  }

  @Override
  public String toString() {
    return "Harvested " + harvested + " records, " + faulty + " faulty, "
        + backupFailures + " backup failures, " + deleted.size() + " deleted"
        + (deletionAborted ? " (deletion aborted)" : "");
  }

}
