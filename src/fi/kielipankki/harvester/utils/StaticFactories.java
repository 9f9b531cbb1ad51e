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

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.TransformerFactory;
import javax.xml.xpath.XPathFactory;

/**
 * Some pre-allocated XML factories.
 */
public final class StaticFactories {

	private StaticFactories() {} // no instance

	public static final XPathFactory xpathFactory;
	public static final TransformerFactory transFactory;
	public static final DocumentBuilderFactory dbf;
	static {
		try {
			xpathFactory=XPathFactory.newInstance();

			transFactory=TransformerFactory.newInstance();

			dbf=DocumentBuilderFactory.newInstance();
			dbf.setNamespaceAware(true);
			dbf.setCoalescing(true);
			dbf.setExpandEntityReferences(false);
			dbf.setIgnoringComments(true);
			dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
		} catch (Exception e) {
			throw new RuntimeException("Failed to initialize XML components",e);
		}
	}

	/** DocumentBuilders are not thread safe, so every caller gets its own. */
	public static DocumentBuilder newDocumentBuilder() {
		try {
			return dbf.newDocumentBuilder();
		} catch (ParserConfigurationException e) {
			throw new RuntimeException("Failed to create DocumentBuilder",e);
		}
	}

}
