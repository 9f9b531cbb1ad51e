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

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import fi.kielipankki.harvester.model.AccessRights;
import fi.kielipankki.harvester.model.ActorEntry;
import fi.kielipankki.harvester.model.DatasetRecord;
import fi.kielipankki.harvester.model.OrganizationEntry;
import fi.kielipankki.harvester.model.Reference;
import fi.kielipankki.harvester.utils.ISODateFormatter;

/**
 * Maps a harvested metadata record (an OAI-PMH <code>record</code> element or a bare
 * metadata document) to a {@link DatasetRecord}. A record is either mapped completely
 * or rejected with a {@link RecordParsingException}.
 * <p>Instances are bound to one {@link Dialect} and are not thread safe.
 */
public final class RecordMapper {
  private static final org.apache.commons.logging.Log log = org.apache.commons.logging.LogFactory.getLog(RecordMapper.class);

  /** Resource type of the records that are synchronized. */
  public static final String CORPUS = "corpus";

  public static final String MULTIPLE_PUBLISHERS_LABEL =
      "Multiple publishers, check distribution rights holders in original metadata by following its persistent identifier";

  private enum Kind { PERSON, ORGANIZATION }

  /** An XPath location of actors having a role. */
  private static final class RoleLocation {
    final String role, xpath;
    final Kind kind;
    final boolean affiliationMandatory;

    RoleLocation(String role, String xpath, Kind kind, boolean affiliationMandatory) {
      this.role = role;
      this.xpath = xpath;
      this.kind = kind;
      this.affiliationMandatory = affiliationMandatory;
    }
  }

  private static final List<RoleLocation> ROLE_LOCATIONS = List.of(
    new RoleLocation(Actor.ROLE_CREATOR, "//md:metadataInfo/md:metadataCreator", Kind.PERSON, true),
    new RoleLocation(Actor.ROLE_PUBLISHER, "//md:distributionInfo/md:licenceInfo/md:distributionRightsHolderPerson", Kind.PERSON, true),
    new RoleLocation(Actor.ROLE_PUBLISHER, "//md:distributionInfo/md:licenceInfo/md:distributionRightsHolderOrganization", Kind.ORGANIZATION, true),
    new RoleLocation(Actor.ROLE_CURATOR, "//md:resourceInfo/md:contactPerson", Kind.PERSON, true),
    new RoleLocation(Actor.ROLE_RIGHTS_HOLDER, "//md:distributionInfo/md:iprHolderPerson", Kind.PERSON, false),
    new RoleLocation(Actor.ROLE_RIGHTS_HOLDER, "//md:distributionInfo/md:iprHolderOrganization", Kind.ORGANIZATION, true)
  );

  private final Dialect dialect;
  private final String catalogId;
  private final LanguageVocabulary vocabulary;
  private final RecordXPath xpath;
  private final AccessRightsMapper accessRightsMapper;
  private final ActorResolver actorResolver = new ActorResolver();

  public RecordMapper(Dialect dialect, String catalogId, LanguageVocabulary vocabulary) {
    this.dialect = dialect;
    this.catalogId = catalogId;
    this.vocabulary = vocabulary;
    this.xpath = new RecordXPath(dialect);
    this.accessRightsMapper = new AccessRightsMapper(xpath);
  }

  public Dialect getDialect() {
    return dialect;
  }

  /**
   * Maps the record.
   * @throws RecordParsingException if the record is not a complete corpus description
   * @throws IOException if the language vocabulary cannot be fetched
   */
  public DatasetRecord toRecord(Document record) throws RecordParsingException, IOException {
    final String pid = pid(record);

    final Optional<String> type = resourceType(record);
    if (type.isEmpty()) {
      throw new RecordParsingException("Could not find resource type", pid);
    }
    if (!CORPUS.equals(type.get())) {
      throw new RecordParsingException("Resource type is '" + type.get() + "', not " + CORPUS, pid);
    }

    final Map<String,String> title = xpath.textsByLanguage(record, "//md:resourceName", ActorResolver.LANGUAGE_PREFERENCE);
    final Map<String,String> description = xpath.textsByLanguage(record, "//md:description", ActorResolver.LANGUAGE_PREFERENCE);
    final Instant modified = date(record, dialect.modifiedXPath, "modification", pid);
    final Instant created = date(record, dialect.createdXPath, "creation", pid);
    final List<Reference> languages = languages(record, pid);
    final AccessRights accessRights = accessRightsMapper.map(record, pid);
    final List<ActorEntry> actors = actors(record, pid);

    return new DatasetRecord(catalogId, pid, title, description, modified, created,
        languages, accessRights, actors);
  }

  /** Returns the persistent identifier of the record. */
  public String pid(Document record) throws RecordParsingException {
    final List<String> raw = xpath.texts(record, dialect.pidXPath);
    if (raw.isEmpty()) {
      throw new RecordParsingException("Could not find persistent identifier", oaiIdentifier(record));
    }
    for (String s : raw) {
      final String pid = dialect.normalizePid(s);
      if (pid.startsWith(Dialect.URN_PREFIX)) return pid;
    }
    return dialect.normalizePid(raw.get(0));
  }

  /** The PID if available, else the OAI identifier of the record, else <code>null</code>. For error messages. */
  public String bestEffortIdentifier(Document record) {
    try {
      return pid(record);
    } catch (RecordParsingException e) {
      return e.getIdentifier();
    }
  }

  private String oaiIdentifier(Document record) {
    return xpath.text(record, "//oai:header/oai:identifier");
  }

  /** Resource type from the dialect namespace, falling back to the OAI namespace. */
  public Optional<String> resourceType(Document record) {
    String type = xpath.text(record, "//md:resourceType");
    if (type == null) type = xpath.text(record, "//oai:resourceType");
    return Optional.ofNullable(type);
  }

  /** Returns true for corpora and for records without resource type (so {@link #toRecord} can report them). */
  public boolean isCorpusCandidate(Document record) {
    return resourceType(record).map(CORPUS::equals).orElse(true);
  }

  private Instant date(Document record, String expr, String what, String pid) throws RecordParsingException {
    final String s = xpath.text(record, expr);
    if (s == null) {
      throw new RecordParsingException("Could not find " + what + " date", pid);
    }
    try {
      return ISODateFormatter.parseDate(s);
    } catch (DateTimeParseException e) {
      throw new RecordParsingException("Invalid " + what + " date '" + s + "'", pid, e);
    }
  }

  private List<Reference> languages(Document record, String pid) throws RecordParsingException, IOException {
    final Set<String> uris = new LinkedHashSet<>();
    for (String raw : xpath.texts(record, "//md:languageInfo/md:languageId")) {
      final String code = dialect.fallbackLanguageCodes.getOrDefault(raw.toLowerCase(Locale.ROOT), raw);
      final IsoLanguageCodes.Resolution resolution = IsoLanguageCodes.resolve(code)
          .orElseThrow(() -> new RecordParsingException("Could not determine ISO 639 language code for " + raw, pid));
      boolean found = false;
      for (String uri : resolution.lexvoUris()) {
        if (vocabulary.isAllowed(uri)) {
          uris.add(uri);
          found = true;
          break;
        }
      }
      if (!found) {
        log.warn("Record " + pid + ": language " + raw + " (" + resolution + ") is not in the Metax language vocabulary");
      }
    }
    final List<Reference> result = new ArrayList<>(uris.size());
    for (String uri : uris) result.add(new Reference(uri));
    return result;
  }

  private List<ActorEntry> actors(Document record, String pid) throws RecordParsingException {
    final Map<Actor.Key,Actor> merged = new LinkedHashMap<>();
    for (RoleLocation loc : ROLE_LOCATIONS) {
      for (Element el : xpath.elements(record, loc.xpath)) {
        final ActorNode node = ActorNode.of(el);
        if (loc.kind == Kind.PERSON && actorResolver.personName(node) == null) {
          if (dialect.skipActorsWithoutPerson) {
            log.warn("Record " + pid + ": skipping <" + el.getLocalName() + "> without person name");
            continue;
          }
          throw new RecordParsingException("Could not determine person name of <" + el.getLocalName() + ">", pid);
        }
        final Actor actor = actorResolver.build(node, Set.of(loc.role), loc.affiliationMandatory, pid);
        final Actor existing = merged.putIfAbsent(actor.identityKey(), actor);
        if (existing != null) existing.addRoles(actor.getRoles());
      }
    }

    final List<Actor> publishers = new ArrayList<>();
    boolean hasCreator = false;
    for (Actor a : merged.values()) {
      if (a.hasRole(Actor.ROLE_CREATOR)) hasCreator = true;
      if (a.hasRole(Actor.ROLE_PUBLISHER)) publishers.add(a);
    }
    if (!hasCreator) {
      throw new RecordParsingException("No metadata creators (creator in Metax) found", pid);
    }
    if (publishers.isEmpty()) {
      throw new RecordParsingException("No distribution rightsholders (publisher in Metax) found", pid);
    }

    final List<Actor> actors = new ArrayList<>(merged.values());
    if (publishers.size() > 1) {
      if (log.isDebugEnabled()) log.debug("Record " + pid + " has " + publishers.size() + " publishers, replacing them");
      for (Actor p : publishers) p.removeRole(Actor.ROLE_PUBLISHER);
      actors.removeIf(a -> a.getRoles().isEmpty());
      actors.add(new Actor(null,
          OrganizationEntry.freeForm(Map.of("en", MULTIPLE_PUBLISHERS_LABEL), null, null),
          Set.of(Actor.ROLE_PUBLISHER)));
    }

    final List<ActorEntry> entries = new ArrayList<>(actors.size());
    for (Actor a : actors) entries.add(a.toEntry());
    return entries;
  }

}
