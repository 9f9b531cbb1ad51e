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

package fi.kielipankki.harvester.mapping;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;

import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;

/**
 * Namespace bindings used in the XPath expressions of the mappers:
 * <code>md</code> is the namespace of the record dialect, <code>oai</code>
 * the OAI-PMH envelope.
 */
public final class MetadataNamespaces implements NamespaceContext {

  public static final String OAI_NS = "http://www.openarchives.org/OAI/2.0/";

  private final Map<String,String> prefixes;

  public MetadataNamespaces(Dialect dialect) {
    this.prefixes = Map.of(
      "md", dialect.namespace,
      "oai", OAI_NS,
      XMLConstants.XML_NS_PREFIX, XMLConstants.XML_NS_URI
    );
  }

  @Override
  public String getNamespaceURI(String prefix) {
    if (prefix == null) throw new IllegalArgumentException("Namespace prefix cannot be null");
    return prefixes.getOrDefault(prefix, XMLConstants.NULL_NS_URI);
  }

  @Override
  public String getPrefix(String namespaceURI) {
    final Iterator<String> it = getPrefixes(namespaceURI);
    return it.hasNext() ? it.next() : null;
  }

  @Override
  public Iterator<String> getPrefixes(String namespaceURI) {
    if (namespaceURI == null) throw new IllegalArgumentException("Namespace URI cannot be null");
    for (Map.Entry<String,String> e : prefixes.entrySet()) {
      if (e.getValue().equals(namespaceURI)) return Collections.singleton(e.getKey()).iterator();
    }
    return Collections.emptyIterator();
  }

}
