package com.example.redaction.infrastructure.docx;

import org.apache.poi.ooxml.util.DocumentHelper;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackagePart;
import org.apache.poi.openxml4j.opc.PackageRelationship;
import org.apache.poi.openxml4j.opc.PackageRelationshipCollection;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.List;

/**
 * Reads every text node of every XML part in a Word package, plus the targets of all relationships.
 * Footnotes, comments, content controls, text boxes, document properties and hyperlink targets are all covered,
 * whatever the paragraph walk used for reading and rewriting visits.
 * Binary parts (images, embedded objects) are not inspected.
 */
final class DocxPackageText {

    private DocxPackageText() {
    }

    static String read(byte[] content) throws IOException, InvalidFormatException, SAXException {
        StringBuilder text = new StringBuilder();
        OPCPackage pkg = OPCPackage.open(new ByteArrayInputStream(content));
        try {
            appendTargets(pkg.getRelationships(), text);
            List<PackagePart> parts = pkg.getParts();
            for (PackagePart part : parts) {
                if (part.isRelationshipPart()) {
                    continue;
                }
                appendTargets(part.getRelationships(), text);
                if (isXml(part)) {
                    appendTextNodes(part, text);
                }
            }
        } finally {
            pkg.revert();
        }
        return text.toString();
    }

    static boolean targetContainsAny(PackageRelationship relationship, Iterable<String> literals) {
        URI target = relationship.getTargetURI();
        String raw = target.toString();
        String decoded = target.getSchemeSpecificPart();
        for (String literal : literals) {
            if (raw.contains(literal) || (decoded != null && decoded.contains(literal))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isXml(PackagePart part) {
        String contentType = part.getContentType();
        return contentType != null && contentType.endsWith("xml");
    }

    private static void appendTextNodes(PackagePart part, StringBuilder text) throws IOException, SAXException {
        try (InputStream in = part.getInputStream()) {
            Element root = DocumentHelper.readDocument(in).getDocumentElement();
            if (root != null) {
                // runs are adjacent text nodes, so a literal split across runs is found too
                text.append(root.getTextContent()).append('\n');
            }
        }
    }

    private static void appendTargets(PackageRelationshipCollection relationships, StringBuilder text) {
        for (PackageRelationship relationship : relationships) {
            URI target = relationship.getTargetURI();
            text.append(target).append('\n');
            String decoded = target.getSchemeSpecificPart();
            if (decoded != null) {
                text.append(decoded).append('\n');
            }
        }
    }
}
