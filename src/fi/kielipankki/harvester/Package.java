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

package fi.kielipankki.harvester;

/**
 * Class to get version information about the harvester.
 */
public final class Package {

    private Package() {}

    /** Gets package object from classloader. */
    public static java.lang.Package get() {
        return Package.class.getPackage();
    }

    /** Gets version of the harvester, "dev" when not running from a packaged JAR. */
    public static String getVersion() {
        java.lang.Package pkg=get();
        String v=(pkg==null) ? null : pkg.getImplementationVersion();
        return (v==null) ? "dev" : v;
    }

    /** Gets product name. */
    public static String getProductName() {
        java.lang.Package pkg=get();
        String t=(pkg==null) ? null : pkg.getImplementationTitle();
        return (t==null) ? "kielipankki-metadata-harvester" : t;
    }

    /** Gets a version string to print out. */
    public static String getFullPackageDescription() {
        StringBuilder sb=new StringBuilder();
        sb.append(getProductName());
        sb.append(" version ");
        sb.append(getVersion());
        return sb.toString();
    }

    /** User agent sent with every HTTP request. */
    public static String getUserAgent(String component) {
        return new StringBuilder("Java/")
            .append(System.getProperty("java.version")).append(" (")
            .append(getProductName()).append('/')
            .append(getVersion())
            .append("; ").append(component).append(')').toString();
    }

}
