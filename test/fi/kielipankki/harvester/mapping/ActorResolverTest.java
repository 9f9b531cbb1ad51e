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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import java.util.Set;

import org.junit.jupiter.api.Test;

import fi.kielipankki.harvester.TestRecords;
import fi.kielipankki.harvester.model.OrganizationEntry;
import fi.kielipankki.harvester.model.PersonEntry;

class ActorResolverTest {

  private final ActorResolver resolver = new ActorResolver();

  private static ActorNode node(String xml) {
    return ActorNode.of(TestRecords.parse(
        "<actor xmlns=\"http://www.clarin.eu/cmd/\">" + xml + "</actor>").getDocumentElement());
  }

  @Test
  void keysChildrenByNameAndLanguage() {
    final ActorNode n = node("<surname xml:lang=\"en\">Kiuru</surname><surname>Kiuru-X</surname>"
        + "<communicationInfo><email>first@example.org</email><email>second@example.org</email></communicationInfo>");
    assertThat(n.getChildren()).containsOnlyKeys("surname_en", "surname", "communicationInfo");
    assertThat(n.text("surname", "en")).isEqualTo("Kiuru");
    assertThat(n.text("surname")).isEqualTo("Kiuru-X");
    // the last of equally keyed siblings wins
    assertThat(n.child("communicationInfo").text("email")).isEqualTo("second@example.org");
  }

  @Test
  void prefersEnglishName() {
    final PersonEntry p = resolver.person(node(
        "<surname xml:lang=\"fi\">Kustaa</surname><givenName xml:lang=\"fi\">Kaarle</givenName>"
        + "<surname xml:lang=\"en\">Bernadotte</surname><givenName xml:lang=\"en\">Carl Gustaf</givenName>"
        + "<communicationInfo><email>cg@example.fi</email></communicationInfo>"));
    assertThat(p).isEqualTo(new PersonEntry("Carl Gustaf Bernadotte", "cg@example.fi"));
  }

  @Test
  void fallsBackToOtherLanguagesAndUnlabeledNames() {
    assertThat(resolver.personName(node("<surname xml:lang=\"fi\">Kiuru</surname><givenName xml:lang=\"fi\">Silva</givenName>")))
        .isEqualTo("Silva Kiuru");
    assertThat(resolver.personName(node("<surname xml:lang=\"en\">Kiuru</surname><givenName>Silva</givenName>")))
        .isEqualTo("Silva Kiuru");
    assertThat(resolver.personName(node("<surname>Kiuru</surname>"))).isEqualTo("Kiuru");
    assertThat(resolver.personName(node("<givenName>Silva</givenName>"))).isNull();
    assertThat(resolver.person(node("<givenName>Silva</givenName>"))).isNull();
  }

  @Test
  void resolvesKnownOrganizationByCode() {
    final OrganizationEntry org = resolver.organization(node(
        "<affiliation><organizationName xml:lang=\"en\">University of Turku</organizationName></affiliation>"));
    assertThat(org).isEqualTo(OrganizationEntry.reference(OrganizationCodes.URL_BASE + "10089"));
  }

  @Test
  void replacesUmbrellaOrganizationByDepartment() {
    final OrganizationEntry org = resolver.organization(node(
        "<affiliation><organizationName xml:lang=\"en\">FIN-CLARIN</organizationName>"
        + "<departmentName xml:lang=\"en\">University of Helsinki</departmentName></affiliation>"));
    assertThat(org.getUrl()).isEqualTo(OrganizationCodes.URL_BASE + "01901");

    final OrganizationEntry freeForm = resolver.organization(node(
        "<affiliation><organizationName xml:lang=\"en\">FIN-CLARIN</organizationName>"
        + "<departmentName xml:lang=\"en\">Language Bank Support</departmentName>"
        + "<departmentName xml:lang=\"fi\">Kielipankin tuki</departmentName></affiliation>"));
    assertThat(freeForm.getPrefLabel()).containsOnly(entry("en", "Language Bank Support"), entry("fi", "Kielipankin tuki"));
  }

  @Test
  void buildsFreeFormOrganization() {
    final OrganizationEntry org = resolver.organization(node(
        "<organizationInfo><organizationName>Some Lab</organizationName>"
        + "<communicationInfo><url>https://lab.example.org</url><email>lab@example.org</email></communicationInfo>"
        + "</organizationInfo>"));
    assertThat(org.getUrl()).isNull();
    assertThat(org.getPrefLabel()).containsOnly(entry("und", "Some Lab"));
    assertThat(org.getHomepage().getIdentifier()).isEqualTo("https://lab.example.org");
    assertThat(org.getEmail()).isEqualTo("lab@example.org");
  }

  @Test
  void organizationElementIsItsOwnOrganization() {
    final OrganizationEntry org = resolver.organization(node("<organizationName xml:lang=\"en\">Aalto University</organizationName>"));
    assertThat(org.getUrl()).isEqualTo(OrganizationCodes.URL_BASE + "10076");
    assertThat(resolver.organization(node("<surname>Kiuru</surname>"))).isNull();
  }

  @Test
  void mandatoryAffiliation() throws Exception {
    final ActorNode n = node("<surname>Kiuru</surname><givenName>Silva</givenName>");
    assertThatThrownBy(() -> resolver.build(n, Set.of(Actor.ROLE_CREATOR), true, "urn:nbn:fi:lb-1"))
        .isInstanceOf(RecordParsingException.class)
        .hasMessage("Could not find affiliation for Silva Kiuru")
        .hasToString("Error parsing record urn:nbn:fi:lb-1: Could not find affiliation for Silva Kiuru");

    final Actor a = resolver.build(n, Set.of(Actor.ROLE_RIGHTS_HOLDER), false, "urn:nbn:fi:lb-1");
    assertThat(a.getOrganization()).isNull();
    assertThat(a.getRoles()).containsExactly(Actor.ROLE_RIGHTS_HOLDER);
  }

  @Test
  void equalActorsShareIdentityAndMergeRoles() throws Exception {
    final String xml = "<surname>Kiuru</surname><communicationInfo><email>s@example.fi</email></communicationInfo>"
        + "<affiliation><organizationName xml:lang=\"en\">University of Oulu</organizationName></affiliation>";
    final Actor a = resolver.build(node(xml), Set.of(Actor.ROLE_PUBLISHER), true, "x");
    final Actor b = resolver.build(node(xml), Set.of(Actor.ROLE_CREATOR), true, "x");
    assertThat(a.identityKey()).isEqualTo(b.identityKey()).hasSameHashCodeAs(b.identityKey());
    a.addRoles(b.getRoles());
    assertThat(a.toEntry().getRoles()).containsExactly(Actor.ROLE_CREATOR, Actor.ROLE_PUBLISHER);

    // merging in the other order gives the same roles
    final Actor c = resolver.build(node(xml), Set.of(Actor.ROLE_PUBLISHER), true, "x");
    final Actor d = resolver.build(node(xml), Set.of(Actor.ROLE_CREATOR), true, "x");
    d.addRoles(c.getRoles());
    assertThat(d.toEntry().getRoles()).isEqualTo(a.toEntry().getRoles());
    assertThat(d.toEntry().getPerson()).isEqualTo(a.toEntry().getPerson());
    assertThat(d.toEntry().getOrganization()).isEqualTo(a.toEntry().getOrganization());

    final Actor other = resolver.build(node(xml.replace("s@example.fi", "t@example.fi")), Set.of(Actor.ROLE_CREATOR), true, "x");
    assertThat(other.identityKey()).isNotEqualTo(a.identityKey());
  }

}
