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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.XMLConstants;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Typed intermediate tree of an actor element. Child elements are keyed by their
 * local name (namespace stripped); elements carrying a language attribute get the
 * suffix <code>"_" + language</code>. If several siblings share the same key,
 * the last one wins.
 */
public final class ActorNode {

  private final String name;
  private final String text;
  private final Map<String,ActorNode> children;

  private ActorNode(String name, String text, Map<String,ActorNode> children) {
    this.name = name;
    this.text = text;
    this.children = children;
  }

  /** Builds the tree of the given element. The element itself is the root and has no key. */
  public static ActorNode of(Element element) {
    boolean hasElements = false;
    for (Node n = element.getFirstChild(); n != null; n = n.getNextSibling()) {
      if (n.getNodeType() == Node.ELEMENT_NODE) {
        hasElements = true;
        break;
      }
    }
    if (!hasElements) {
      final String s = element.getTextContent();
      return new ActorNode(element.getLocalName(), (s == null || s.trim().isEmpty()) ? null : s.trim(),
          Collections.emptyMap());
    }
    final Map<String,ActorNode> children = new LinkedHashMap<>();
    for (Node n = element.getFirstChild(); n != null; n = n.getNextSibling()) {
      if (n.getNodeType() == Node.ELEMENT_NODE) {
        final Element child = (Element) n;
        // explicit overwrite: later duplicates replace earlier ones
        children.put(keyOf(child), of(child));
      }
    }
    return new ActorNode(element.getLocalName(), null, Collections.unmodifiableMap(children));
  }

  static String keyOf(Element e) {
    String lang = e.getAttributeNS(XMLConstants.XML_NS_URI, "lang");
    if (lang.isEmpty()) lang = e.getAttribute("lang");
    return lang.isEmpty() ? e.getLocalName() : (e.getLocalName() + "_" + lang);
  }

  /** Local name of the element this node was built from. */
  public String getName() {
    return name;
  }

  /** Trimmed text of a leaf, <code>null</code> for inner nodes and empty leaves. */
  public String getText() {
    return text;
  }

  public Map<String,ActorNode> getChildren() {
    return children;
  }

  public ActorNode child(String key) {
    return children.get(key);
  }

  /** Returns the first child of the given keys that exists. */
  public ActorNode firstChild(String... keys) {
    for (String key : keys) {
      final ActorNode c = children.get(key);
      if (c != null) return c;
    }
    return null;
  }

  /** Text of the leaf child with exactly this key. */
  public String text(String key) {
    final ActorNode c = children.get(key);
    return (c == null) ? null : c.text;
  }

  /** Text of the leaf child in the given language (<code>null</code> means the unlabeled element). */
  public String text(String key, String language) {
    return text((language == null) ? key : (key + "_" + language));
  }

  /**
   * Text of the leaf child in the first language of the list offering one,
   * falling back to the unlabeled element.
   */
  public String text(String key, List<String> languages) {
    for (String lang : languages) {
      final String s = text(key, lang);
      if (s != null) return s;
    }
    return text(key);
  }

  /** Returns true if there is a child with this key, labeled with any language or unlabeled. */
  public boolean hasAny(String key) {
    final String prefix = key + "_";
    for (String k : children.keySet()) {
      if (k.equals(key) || k.startsWith(prefix)) return true;
    }
    return false;
  }

  @Override
  public String toString() {
    return (text != null) ? (name + "=" + text) : (name + children.values());
  }

}
