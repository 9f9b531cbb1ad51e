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

package fi.kielipankki.harvester.utils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;

/**
 * Simple static class to create and parse ISO-8601 date stamps (used by OAI harvester and Metax records):
 * The used date formats are:<ul>
 * <li>Long date: <code>yyyy-MM-dd'T'HH:mm:ss'Z'</code></li>
 * <li>Short date: <code>yyyy-MM-dd</code> (interpreted as midnight UTC)</li>
 * </ul>
 */
public final class ISODateFormatter {

	private ISODateFormatter() {} // no instance

	/** Parses the given string into an {@link Instant}. It accepts short and long dates (with time) */
	public static Instant parseDate(String date) throws DateTimeParseException {
		if (date==null) return null;
		date=date.trim();
		try {
			return longDate.parse(date, Instant::from);
		} catch (DateTimeParseException e) {
			return LocalDate.parse(date, shortDate).atStartOfDay(ZoneOffset.UTC).toInstant();
		}
	}

	/** Formats a long date. */
	public static String formatLong(Instant date) {
		return longDate.format(date);
	}

	/** Formats a short date. */
	public static String formatShort(Instant date) {
		return shortDate.format(date);
	}

	private static final DateTimeFormatter longDate=DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss'Z'",Locale.US)
		.withZone(ZoneOffset.UTC).withResolverStyle(ResolverStyle.STRICT);
	private static final DateTimeFormatter shortDate=DateTimeFormatter.ofPattern("uuuu-MM-dd",Locale.US)
		.withZone(ZoneOffset.UTC).withResolverStyle(ResolverStyle.STRICT);
}
