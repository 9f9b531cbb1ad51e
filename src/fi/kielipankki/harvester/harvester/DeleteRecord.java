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
import java.util.Optional;

import fi.kielipankki.harvester.config.Config;
import fi.kielipankki.harvester.processor.MetaxClient;

/**
 * Command line utility that deletes a single dataset from Metax by its PID.
 */
public final class DeleteRecord {
	private static org.apache.commons.logging.Log staticLog = org.apache.commons.logging.LogFactory.getLog(DeleteRecord.class);

	private DeleteRecord() {}

	public static void main(String[] args) {
		if (args.length!=2) {
			System.err.println("Command line: java "+DeleteRecord.class.getName()+" config.xml pid");
			System.exit(2);
			return;
		}

		int status=1;
		try {
			Config conf=new Config(args[0]);
			status=deleteRecord(new MetaxClient(conf.getDestination()), args[1]) ? 0 : 1;
		} catch (Exception e) {
			staticLog.fatal("Deleting record failed:",e);
		}
		System.exit(status);
	}

	/** Deletes the record and reports the result on standard output. Returns false if the PID was not found. */
	public static boolean deleteRecord(MetaxClient metax, String pid) throws IOException {
		final Optional<String> id=metax.deleteRecord(pid);
		if (id.isPresent()) {
			System.out.println("Deleted record "+pid+" (Metax identifier "+id.get()+")");
			return true;
		}
		System.out.println("Record "+pid+" not found in Metax");
		return false;
	}

}
