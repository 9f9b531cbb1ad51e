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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resolves ISO 639 language codes found in metadata records. Two-letter codes (639-1)
 * and bibliographic 639-2 codes are converted to their three-letter terminology codes,
 * language family codes are resolved as ISO 639-5 collective codes.
 * <p>Individual languages are looked up in the ISO 639-3 code table
 * (<code>iso-639-3.tab</code> in the SIL registration authority's layout), so
 * well-formed but unassigned codes do not resolve.
 */
public final class IsoLanguageCodes {

  private IsoLanguageCodes() {} // no instance

  public static final String LEXVO_639_3 = "http://lexvo.org/id/iso639-3/";
  public static final String LEXVO_639_5 = "http://lexvo.org/id/iso639-5/";

  static final String CODE_TABLE = "iso-639-3.tab";

  private static final Pattern TWO_OR_THREE_LETTERS = Pattern.compile("[a-z]{2,3}");

  /** ISO 639-5 language family and group codes. */
  private static final Set<String> COLLECTIVE_CODES = Set.of(
    "aav", "afa", "alg", "alv", "apa", "aqa", "aql", "art", "ath", "auf",
    "aus", "awd", "azc", "bad", "bai", "bat", "ber", "bih", "bnt", "btk",
    "cai", "cau", "cba", "ccn", "ccs", "cdc", "cdd", "cel", "cmc", "cpe",
    "cpf", "cpp", "crp", "csu", "cus", "day", "dmn", "dra", "egx", "esx",
    "euq", "fiu", "fox", "gem", "gme", "gmq", "gmw", "grk", "hmx", "hok",
    "hyx", "iir", "ijo", "inc", "ine", "ira", "iro", "itc", "jpx", "kar",
    "kdo", "khi", "kro", "map", "mkh", "mno", "mun", "myn", "nah", "nai",
    "ngf", "nic", "nub", "omq", "omv", "oto", "paa", "phi", "plf", "poz",
    "pqe", "pqw", "pra", "qwe", "roa", "sai", "sal", "sdv", "sem", "sgn",
    "sio", "sit", "sla", "smi", "son", "sqj", "ssa", "syd", "tai", "tbq",
    "trk", "tup", "tut", "tuw", "urj", "wak", "wen", "xgn", "xnd", "ypk",
    "zhx", "zle", "zls", "zlw", "znd"
  );

  /**
   * Resolves a raw code. The result has a 639-3 code for individual languages and a
   * 639-5 code for language families; empty if the code is not an ISO 639 code at all.
   */
  public static Optional<Resolution> resolve(String rawCode) {
    if (rawCode == null) return Optional.empty();
    final String code = rawCode.trim().toLowerCase(Locale.ROOT);
    if (!TWO_OR_THREE_LETTERS.matcher(code).matches()) return Optional.empty();
    final String part3 = CodeTable.TERMINOLOGY_CODES.get(code);
    if (part3 != null) {
      return Optional.of(new Resolution(part3, null));
    }
    if (COLLECTIVE_CODES.contains(code)) {
      return Optional.of(new Resolution(null, code));
    }
    return Optional.empty();
  }

  /** Maps 639-3, 639-2/B and 639-1 codes of the code table to the 639-3 code. */
  static Map<String,String> readCodeTable(InputStream in) throws IOException {
    final Map<String,String> codes = new HashMap<>();
    final BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    String line = reader.readLine(); // header
    while ((line = reader.readLine()) != null) {
      if (line.isBlank()) continue;
      final String[] cols = line.split("\t", -1);
      if (cols.length < 4) throw new IOException("Invalid line in ISO 639-3 code table: " + line);
      final String id = cols[0].trim();
      codes.put(id, id);
      for (int i = 1; i <= 3; i++) {
        final String alias = cols[i].trim();
        if (!alias.isEmpty()) codes.putIfAbsent(alias, id);
      }
    }
    return Collections.unmodifiableMap(codes);
  }

  private static final class CodeTable {
    static final Map<String,String> TERMINOLOGY_CODES;
    static {
      try (InputStream in = IsoLanguageCodes.class.getResourceAsStream("/" + CODE_TABLE)) {
        if (in == null) throw new IllegalStateException("Missing resource: " + CODE_TABLE);
        TERMINOLOGY_CODES = readCodeTable(in);
      } catch (IOException e) {
        throw new UncheckedIOException("Cannot read ISO 639-3 code table", e);
      }
    }
  }

  /** Result of {@link IsoLanguageCodes#resolve(String)}. */
  public static final class Resolution {
    public final String part3, part5;

    Resolution(String part3, String part5) {
      this.part3 = part3;
      this.part5 = part5;
    }

    /** Lexvo URIs of the code, 639-3 before 639-5. */
    public Iterable<String> lexvoUris() {
      if (part3 != null && part5 != null) return Arrays.asList(LEXVO_639_3 + part3, LEXVO_639_5 + part5);
      if (part3 != null) return Collections.singletonList(LEXVO_639_3 + part3);
      return Collections.singletonList(LEXVO_639_5 + part5);
    }

    @Override
    public String toString() {
      return (part3 != null) ? part3 : part5;
    }
  }

}
