package uk.gegc.dolos.features.packaging.infra;

import javax.xml.namespace.QName;

/**
 * Namespace URIs and relationship types used by word-processing packages.
 */
public final class OoxmlNamespaces {

    public static final String W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    public static final String R = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";
    public static final String PACKAGE_RELATIONSHIPS = "http://schemas.openxmlformats.org/package/2006/relationships";
    public static final String CONTENT_TYPES = "http://schemas.openxmlformats.org/package/2006/content-types";
    public static final String CP = "http://schemas.openxmlformats.org/package/2006/metadata/core-properties";
    public static final String DC = "http://purl.org/dc/elements/1.1/";
    public static final String DCTERMS = "http://purl.org/dc/terms/";
    public static final String XSI = "http://www.w3.org/2001/XMLSchema-instance";
    public static final String EXTENDED_PROPERTIES = "http://schemas.openxmlformats.org/officeDocument/2006/extended-properties";
    public static final String XML = "http://www.w3.org/XML/1998/namespace";

    public static final String REL_OFFICE_DOCUMENT = "http://schemas.openxmlformats.org/officeDocument/2006/relationships/officeDocument";
    public static final String REL_CORE_PROPERTIES = "http://schemas.openxmlformats.org/package/2006/relationships/metadata/core-properties";
    public static final String REL_EXTENDED_PROPERTIES = "http://schemas.openxmlformats.org/officeDocument/2006/relationships/extended-properties";
    public static final String REL_SETTINGS = "http://schemas.openxmlformats.org/officeDocument/2006/relationships/settings";

    public static final String SETTINGS_CONTENT_TYPE = "application/vnd.openxmlformats-officedocument.wordprocessingml.settings+xml";

    public static final QName XML_SPACE = new QName(XML, "space", "xml");

    private OoxmlNamespaces() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static QName w(String localName) {
        return new QName(W, localName, "w");
    }
}
