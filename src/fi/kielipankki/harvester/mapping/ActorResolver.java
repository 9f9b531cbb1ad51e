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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.w3c.dom.Element;

import fi.kielipankki.harvester.model.OrganizationEntry;
import fi.kielipankki.harvester.model.PersonEntry;

/**
 * Builds {@link Actor}s from person and organization elements of a record
 * (metadata creators, contact persons, rights holders, ...).
 */
public final class ActorResolver {
  private static final org.apache.commons.logging.Log log = org.apache.commons.logging.LogFactory.getLog(ActorResolver.class);

  /** Preference order of language labelled names and organization names. */
  public static final List<String> LANGUAGE_PREFERENCE = List.of("en", "fi", "und");

  /** Umbrella consortium; actors affiliated with it are resolved by their department. */
  public static final String UMBRELLA_ORGANIZATION = "FIN-CLARIN";

  public ActorResolver() {
  }

  /** Same as {@link #build(ActorNode, Set, boolean, String)} for a raw element. */
  public Actor build(Element element, Set<String> roles, boolean affiliationMandatory, String identifier)
      throws RecordParsingException {
    return build(ActorNode.of(element), roles, affiliationMandatory, identifier);
  }

  /**
   * Creates the actor. If the affiliation is mandatory and the node has no organization
   * data, a {@link RecordParsingException} for the record <code>identifier</code> is thrown.
   */
  public Actor build(ActorNode node, Set<String> roles, boolean affiliationMandatory, String identifier)
      throws RecordParsingException {
    final PersonEntry person = person(node);
    final OrganizationEntry organization = organization(node);
    if (organization == null && affiliationMandatory) {
      final String who = (person != null) ? person.getName() : ("<" + node.getName() + ">");
      throw new RecordParsingException("Could not find affiliation for " + who, identifier);
    }
    return new Actor(person, organization, roles);
  }

  /**
   * Person name and email. The name is taken from the first preferred language
   * offering a surname, followed by the unlabeled surname; the given name is
   * put in front when present. Returns <code>null</code> if there is no surname.
   */
  public PersonEntry person(ActorNode node) {
    final String name = personName(node);
    if (name == null) return null;
    final ActorNode comm = node.child("communicationInfo");
    return new PersonEntry(name, (comm == null) ? null : comm.text("email", LANGUAGE_PREFERENCE));
  }

  /** Returns the formatted person name or <code>null</code> if the node has none. */
  public String personName(ActorNode node) {
    for (String lang : LANGUAGE_PREFERENCE) {
      final String n = formatName(node, lang);
      if (n != null) return n;
    }
    return formatName(node, null);
  }

  private String formatName(ActorNode node, String lang) {
    final String surname = node.text("surname", lang);
    if (surname == null) return null;
    String given = node.text("givenName", lang);
    if (given == null && lang != null) given = node.text("givenName");
    return (given == null) ? surname : (given + " " + surname);
  }

  /**
   * Resolves the organization of the actor: its <code>affiliation</code>, its
   * <code>organizationInfo</code>, or the node itself if it names an organization.
   * Returns <code>null</code> if none of these is present.
   */
  public OrganizationEntry organization(ActorNode node) {
    ActorNode org = node.firstChild("affiliation", "organizationInfo");
    if (org == null && node.hasAny("organizationName")) org = node;
    if (org == null) return null;

    String labelKey = "organizationName";
    String displayName = org.text(labelKey, LANGUAGE_PREFERENCE);
    if (displayName == null) return null;
    if (UMBRELLA_ORGANIZATION.equals(displayName)) {
      final String department = org.text("departmentName", LANGUAGE_PREFERENCE);
      if (department != null) {
        displayName = department;
        labelKey = "departmentName";
      } else {
        log.warn("Actor affiliated with " + UMBRELLA_ORGANIZATION + " has no department, using consortium name");
      }
    }

    final Optional<String> url = OrganizationCodes.url(displayName);
    if (url.isPresent()) {
      return OrganizationEntry.reference(url.get());
    }
    if (log.isDebugEnabled()) log.debug("No organization code for '" + displayName + "', using free-form organization");

    final Map<String,String> labels = new LinkedHashMap<>();
    for (String lang : LANGUAGE_PREFERENCE) {
      final String s = org.text(labelKey, lang);
      if (s != null) labels.put(lang, s);
    }
    if (labels.isEmpty()) labels.put("und", displayName);
    final ActorNode comm = org.child("communicationInfo");
    return OrganizationEntry.freeForm(labels,
        (comm == null) ? null : comm.text("url"),
        (comm == null) ? null : comm.text("email"));
  }

}
