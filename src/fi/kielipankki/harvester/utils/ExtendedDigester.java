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

import org.apache.commons.digester.Digester;
import org.apache.commons.digester.Rule;
import org.apache.commons.digester.Rules;
import org.apache.commons.digester.WithDefaultsRulesWrapper;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Extension of the Commons Digester Class, which stops on the first parse error and
 * gives the possibility to not allow invalid element names.
 */
public class ExtendedDigester extends Digester {

	public ExtendedDigester() { super(); }

	/** Adds a dummy rule for element paths, that are allowed, but not parsed. */
	public void addDoNothing(String pattern) {
		addRule(pattern,new DoNothingRule());
	}

	/** Adds a default Rule for not allowing invalid (not registered) event paths. The given Rules object is
	 * wrapped and set using <code>setRules(Rules rules)</code>. */
	public void setRulesWithInvalidElementCheck(Rules rules) {
		WithDefaultsRulesWrapper r=new WithDefaultsRulesWrapper(rules);
		r.addDefault(new InvalidElementRule());
		super.setRules(r);
	}

	/** Logs the SAX exception as warning (with location). */
	@Override
	public void warning(SAXParseException ex) throws SAXException {
		log.warn("SAX parse warning in \""+ex.getSystemId()+"\", line "+ex.getLineNumber()+", column "+ex.getColumnNumber()+": "+ex.getMessage());
	}

	/** Just throws <code>ex</code>. */
	@Override
	public void error(SAXParseException ex) throws SAXException {
		throw ex;
	}

	/** Just throws <code>ex</code>. */
	@Override
	public void fatalError(SAXParseException ex) throws SAXException {
		throw ex;
	}

	/** This rule does nothing. It is needed for giving a rule for uninteresting tags to not throw an exception. */
	public static class DoNothingRule extends Rule {
		// empty, this only makes the class non-abstract
	}

	private static final class InvalidElementRule extends Rule {

		@Override
		public void begin(String namespace, String name, Attributes attributes) throws Exception {
			throw new SAXException("Unknown element at XML path: '"+getDigester().getMatch()+"'; tagname: '"+name+"'");
		}

	}
}
