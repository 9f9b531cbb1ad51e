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

import fi.kielipankki.harvester.config.Config;
import fi.kielipankki.harvester.mapping.HttpVocabularyFetcher;
import fi.kielipankki.harvester.mapping.LanguageVocabulary;
import fi.kielipankki.harvester.mapping.RecordMapper;
import fi.kielipankki.harvester.mapping.VocabularyCache;
import fi.kielipankki.harvester.processor.MetaxClient;

/**
 * Command line entry point of the harvester. Synchronizes the configured source
 * catalog into Metax once; the exit status is non-zero if any record failed.
 */
public final class Harvester {
	private static org.apache.commons.logging.Log staticLog = org.apache.commons.logging.LogFactory.getLog(Harvester.class);

	private Harvester() {}

	/**
	 * External entry point to the harvester. Called from the Java command line with one parameter (config file)
	 */
	public static void main(String[] args) {
		if (args.length!=1) {
			System.err.println("Command line: java "+Harvester.class.getName()+" config.xml");
			System.exit(2);
			return;
		}

		int status=1;
		try {
			Config conf=new Config(args[0]);
			HarvestResult result=runHarvester(conf, new VocabularyCache());
			status=result.isSuccess() ? 0 : 1;
		} catch (Exception e) {
			staticLog.fatal("Harvester general error:",e);
		}
		System.exit(status);
	}

	/**
	 * Composes the harvester components from the configuration and runs one harvest.
	 * The vocabulary cache is owned by the caller, so repeated runs in one process can share it.
	 */
	public static HarvestResult runHarvester(Config conf, VocabularyCache vocabularyCache) throws IOException {
		final LanguageVocabulary vocabulary=new LanguageVocabulary(conf.getLanguageVocabularyEndpoint(),
			vocabularyCache, new HttpVocabularyFetcher(conf.getDestination().getTimeout()));
		final RecordMapper mapper=new RecordMapper(conf.getSource().getDialect(),
			conf.getDestination().getCatalogId(), vocabulary);
		final SourceCatalogClient source=new SourceCatalogClient(new OAIPMHRecordSource(conf.getSource()), mapper);
		final MetaxClient metax=new MetaxClient(conf.getDestination());
		final RawRecordBackup backup=(conf.getBackupDirectory()==null) ? null : new RawRecordBackup(conf.getBackupDirectory());

		staticLog.info("Harvesting \""+conf.getSource().getBaseUrl()+"\" ("+conf.getSource().getDialect()+") into "+conf.getDestination()+"...");
		final HarvestRun run=new HarvestRun(source, metax, new HarvestState(conf.getStateFile()), backup,
			conf.getHarvestMessageStep(), conf.isDeleteMissingRecords());
		return run.run();
	}

}
