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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import fi.kielipankki.harvester.utils.StaticFactories;

/**
 * Evaluates the XPath expressions of a {@link Dialect} against record nodes.
 * Instances are not thread safe.
 */
final class RecordXPath {

  private final XPath xpath;
  private final Dialect dialect;

  RecordXPath(Dialect dialect) {
    this.dialect = dialect;
    this.xpath = StaticFactories.xpathFactory.newXPath();
    this.xpath.setNamespaceContext(new MetadataNamespaces(dialect));
  }

  Dialect dialect() {
    return dialect;
  }

  /** All elements matching the expression, in document order. */
  List<Element> elements(Node context, String expr) {
    final NodeList nl = evaluate(context, expr);
    final List<Element> result = new ArrayList<>(nl.getLength());
    for (int i = 0, c = nl.getLength(); i < c; i++) {
      final Node n = nl.item(i);
      if (n.getNodeType() == Node.ELEMENT_NODE) result.add((Element) n);
    }
    return result;
  }

  /** Trimmed, non-empty text contents of all matching nodes. */
  List<String> texts(Node context, String expr) {
    final NodeList nl = evaluate(context, expr);
    if (nl.getLength() == 0) return Collections.emptyList();
    final List<String> result = new ArrayList<>(nl.getLength());
    for (int i = 0, c = nl.getLength(); i < c; i++) {
      final String s = nl.item(i).getTextContent();
      if (s != null && !s.trim().isEmpty()) result.add(s.trim());
    }
    return result;
  }

  /** Trimmed text of the first matching node that has any, or <code>null</code>. */
  String text(Node context, String expr) {
    final List<String> l = texts(context, expr);
    return l.isEmpty() ? null : l.get(0);
  }

  /**
   * For each language tag, the first trimmed text of <code>expr</code> elements carrying
   * that tag in the dialect's language attribute. Tags without content are left out.
   */
  Map<String,String> textsByLanguage(Node context, String expr, List<String> languages) {
    final Map<String,String> result = new LinkedHashMap<>();
    for (String lang : languages) {
      final String s = text(context, expr + "[@" + dialect.languageAttribute + "='" + lang + "']");
      if (s != null) result.put(lang, s);
    }
    return result;
  }

  private NodeList evaluate(Node context, String expr) {
    try {
      return (NodeList) xpath.evaluate(expr, context, XPathConstants.NODESET);
    } catch (XPathExpressionException e) {
      throw new IllegalStateException("Invalid XPath expression: " + expr, e);
    }
  }

}
