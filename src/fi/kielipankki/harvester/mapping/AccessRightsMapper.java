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
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

import fi.kielipankki.harvester.model.AccessRights;
import fi.kielipankki.harvester.model.License;
import fi.kielipankki.harvester.model.Reference;

/**
 * Maps <code>distributionInfo</code> of a record to Metax access rights.
 */
final class AccessRightsMapper {
  private static final org.apache.commons.logging.Log log = org.apache.commons.logging.LogFactory.getLog(AccessRightsMapper.class);

  static final String ACCESS_TYPE_BASE = "http://uri.suomi.fi/codelist/fairdata/access_type/code/";
  static final String RESTRICTION_GROUNDS_BASE = "http://uri.suomi.fi/codelist/fairdata/restriction_grounds/code/";

  static final Reference ACCESS_OPEN = new Reference(ACCESS_TYPE_BASE + "open");
  static final Reference ACCESS_RESTRICTED = new Reference(ACCESS_TYPE_BASE + "restricted");
  static final Reference GROUNDS_RESEARCH = new Reference(RESTRICTION_GROUNDS_BASE + "research");
  static final Reference GROUNDS_OTHER = new Reference(RESTRICTION_GROUNDS_BASE + "other");

  static final String UNRESTRICTED_AVAILABILITY = "available-unrestrictedUse";

  private static final Pattern URN_TOKEN = Pattern.compile("\\S*urn\\.fi/urn:nbn:fi\\S*", Pattern.CASE_INSENSITIVE);

  private final RecordXPath xpath;

  AccessRightsMapper(RecordXPath xpath) {
    this.xpath = xpath;
  }

  AccessRights map(Node record, String identifier) {
    final List<License> licenses = new ArrayList<>();
    for (Element licenceInfo : xpath.elements(record, "//md:distributionInfo/md:licenceInfo")) {
      final String token = xpath.text(licenceInfo, "md:licence");
      final Optional<String> url = LicenseCodes.url(token);
      if (url.isEmpty()) {
        log.warn("Record " + identifier + ": dropping unknown licence '" + token + "'");
        continue;
      }
      String customUrl = null;
      if (LicenseCodes.CUSTOM_URL_FAMILIES.contains(token.trim())) {
        customUrl = licenseDocumentUrl(record).orElse(null);
      }
      final License license = new License(url.get(), customUrl);
      if (!licenses.contains(license)) licenses.add(license);
    }
    if (licenses.isEmpty()) {
      licenses.add(new License(LicenseCodes.OTHER_URL));
    }

    final String availability = xpath.text(record, "//md:distributionInfo/md:availability");
    if (UNRESTRICTED_AVAILABILITY.equals(availability)) {
      return new AccessRights(licenses, ACCESS_OPEN, null);
    }

    final List<Reference> grounds = new ArrayList<>();
    for (License l : licenses) {
      if (l.getUrl().contains(LicenseCodes.ACADEMIC_FAMILY) && !grounds.contains(GROUNDS_RESEARCH)) {
        grounds.add(GROUNDS_RESEARCH);
      }
    }
    if (grounds.isEmpty()) grounds.add(GROUNDS_OTHER);
    return new AccessRights(licenses, ACCESS_RESTRICTED, grounds);
  }

  /**
   * Finds the URL of a licence document: first a structured document whose English title
   * mentions "license", then the first urn.fi link in an unstructured document mentioning it.
   */
  Optional<String> licenseDocumentUrl(Node record) {
    final String lang = xpath.dialect().languageAttribute;
    for (Element doc : xpath.elements(record,
        "//md:resourceDocumentationInfo/md:documentationStructured/md:documentInfo")) {
      final String title = xpath.text(doc, "md:title[@" + lang + "='en']");
      if (title != null && title.toLowerCase(Locale.ROOT).contains("license")) {
        final String url = xpath.text(doc, "md:url");
        if (url != null) return Optional.of(url);
      }
    }
    for (String text : xpath.texts(record,
        "//md:resourceDocumentationInfo/md:documentationUnstructured/md:documentUnstructured")) {
      if (!text.toLowerCase(Locale.ROOT).contains("license")) continue;
      final Matcher m = URN_TOKEN.matcher(text);
      if (m.find()) {
        return Optional.of(trimPunctuation(m.group()));
      }
    }
    return Optional.empty();
  }

  private static String trimPunctuation(String token) {
    int start = 0, end = token.length();
    while (start < end && "([<\"'".indexOf(token.charAt(start)) >= 0) start++;
    while (end > start && ".,;:)]>\"'".indexOf(token.charAt(end - 1)) >= 0) end--;
    return token.substring(start, end);
  }

}
