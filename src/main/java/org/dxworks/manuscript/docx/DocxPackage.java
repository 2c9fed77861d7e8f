package org.dxworks.manuscript.docx;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * The parts of a DOCX zip archive by name, in archive order.
 */
public class DocxPackage {

    public static final String CONTENT_TYPES = "[Content_Types].xml";
    public static final String PACKAGE_RELS = "_rels/.rels";
    public static final String DOCUMENT = "word/document.xml";
    public static final String DOCUMENT_RELS = "word/_rels/document.xml.rels";
    public static final String STYLES = "word/styles.xml";
    public static final String SETTINGS = "word/settings.xml";
    public static final String NUMBERING = "word/numbering.xml";
    public static final String COMMENTS = "word/comments.xml";
    public static final String COMMENTS_EXTENDED = "word/commentsExtended.xml";
    public static final String FOOTNOTES = "word/footnotes.xml";
    public static final String ENDNOTES = "word/endnotes.xml";
    public static final String CORE_PROPERTIES = "docProps/core.xml";
    public static final String CUSTOM_PROPERTIES = "docProps/custom.xml";

    // 1980-01-01, the earliest time a zip entry can carry
    private static final long ENTRY_TIME = 315532800000L;

    private final Map<String, byte[]> parts = new LinkedHashMap<>();

    public void put(String name, byte[] content) {
        parts.put(name, content);
    }

    public void put(String name, String xml) {
        parts.put(name, xml.getBytes(StandardCharsets.UTF_8));
    }

    public Optional<byte[]> get(String name) {
        return Optional.ofNullable(parts.get(name));
    }

    public boolean contains(String name) {
        return parts.containsKey(name);
    }

    public Map<String, byte[]> parts() {
        return Collections.unmodifiableMap(parts);
    }

    public static DocxPackage read(byte[] docx) throws DocxFormatException {
        DocxPackage docxPackage = new DocxPackage();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(docx))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (!entry.isDirectory()) {
                    docxPackage.put(entry.getName(), zip.readAllBytes());
                }
            }
        } catch (ZipException e) {
            throw new DocxFormatException("Not a zip archive: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DocxFormatException("Could not read the package: " + e.getMessage(), e);
        }
        if (!docxPackage.contains(DOCUMENT)) {
            throw new DocxFormatException("Not a DOCX package: " + DOCUMENT + " is missing");
        }
        return docxPackage;
    }

    /** Archive bytes, with the content types part first as the format expects. */
    public byte[] toBytes() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            if (parts.containsKey(CONTENT_TYPES)) {
                writeEntry(zip, CONTENT_TYPES, parts.get(CONTENT_TYPES));
            }
            for (Map.Entry<String, byte[]> part : parts.entrySet()) {
                if (!part.getKey().equals(CONTENT_TYPES)) {
                    writeEntry(zip, part.getKey(), part.getValue());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write the package", e);
        }
        return bytes.toByteArray();
    }

    private static void writeEntry(ZipOutputStream zip, String name, byte[] content) throws IOException {
        ZipEntry entry = new ZipEntry(name);
        entry.setTime(ENTRY_TIME);
        zip.putNextEntry(entry);
        zip.write(content);
        zip.closeEntry();
    }
}
