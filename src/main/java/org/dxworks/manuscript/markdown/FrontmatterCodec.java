package org.dxworks.manuscript.markdown;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.dxworks.manuscript.model.Frontmatter;
import org.dxworks.manuscript.model.NoteType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reads and writes the leading {@code ---} YAML block of a manuscript.
 * Invalid values are dropped; a broken block never fails the conversion.
 */
public final class FrontmatterCodec {

    private static final Logger LOG = LoggerFactory.getLogger(FrontmatterCodec.class);

    private static final YAMLFactory YAML = YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .disable(YAMLGenerator.Feature.SPLIT_LINES)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .build();

    private static final Pattern TIMEZONE = Pattern.compile("^[+-](?:[01]\\d|2[0-3]):[0-5]\\d$");
    private static final Pattern HEX_COLOR = Pattern.compile("^#?[0-9a-fA-F]{6}$");

    /**
     * Frontmatter plus the remaining text. {@code body} keeps one empty line per frontmatter line
     * so line numbers in the body match the original document.
     */
    public record Split(Frontmatter frontmatter, String body) {
    }

    private FrontmatterCodec() {}

    public static Split split(String markdown) {
        String text = markdown.startsWith("\uFEFF") ? markdown.substring(1) : markdown;
        String[] lines = text.split("\n", -1);
        if (lines.length == 0 || !lines[0].strip().equals("---")) {
            return new Split(new Frontmatter(), text);
        }
        int close = -1;
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.equals("---") || line.equals("...")) {
                close = i;
                break;
            }
        }
        if (close < 0) {
            return new Split(new Frontmatter(), text);
        }

        StringBuilder yaml = new StringBuilder();
        for (int i = 1; i < close; i++) {
            yaml.append(lines[i]).append('\n');
        }
        StringBuilder body = new StringBuilder();
        body.append("\n".repeat(close + 1));
        for (int i = close + 1; i < lines.length; i++) {
            body.append(lines[i]);
            if (i < lines.length - 1) {
                body.append('\n');
            }
        }
        return new Split(parse(yaml.toString()), body.toString());
    }

    public static Frontmatter parse(String yaml) {
        Frontmatter frontmatter = new Frontmatter();
        if (yaml == null || yaml.isBlank()) {
            return frontmatter;
        }
        try (JsonParser parser = YAML.createParser(yaml)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                return frontmatter;
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String key = parser.currentName().trim().toLowerCase(Locale.ROOT);
                JsonToken value = parser.nextToken();
                if (value == JsonToken.START_ARRAY) {
                    while (parser.nextToken() != JsonToken.END_ARRAY) {
                        if (parser.currentToken().isScalarValue()) {
                            apply(frontmatter, key, parser.getText());
                        } else {
                            parser.skipChildren();
                        }
                    }
                } else if (value != null && value.isScalarValue()) {
                    apply(frontmatter, key, parser.getText());
                } else {
                    parser.skipChildren();
                }
            }
        } catch (IOException e) {
            LOG.debug("Ignoring the rest of a malformed frontmatter block: {}", e.getMessage());
        }
        return frontmatter;
    }

    public static String serialize(Frontmatter frontmatter) {
        if (frontmatter == null || frontmatter.isEmpty()) {
            return "";
        }
        StringWriter writer = new StringWriter();
        try (YAMLGenerator generator = (YAMLGenerator) YAML.createGenerator(writer)) {
            generator.writeStartObject();
            for (String title : frontmatter.titles) {
                generator.writeStringField("title", title);
            }
            writeString(generator, "author", frontmatter.author);
            writeString(generator, "csl", frontmatter.csl);
            writeString(generator, "locale", frontmatter.locale);
            if (frontmatter.noteType != null) {
                generator.writeStringField("note-type", frontmatter.noteType.getId());
            }
            writeString(generator, "timezone", frontmatter.timezone);
            writeString(generator, "bibliography", frontmatter.bibliography);
            writeString(generator, "font", frontmatter.font);
            writeNumber(generator, "font-size", frontmatter.fontSize);
            writeString(generator, "code-font", frontmatter.codeFont);
            writeNumber(generator, "code-font-size", frontmatter.codeFontSize);
            writeString(generator, "code-background-color", frontmatter.codeBackgroundColor);
            writeString(generator, "code-font-color", frontmatter.codeFontColor);
            writeNumber(generator, "code-block-inset", frontmatter.codeBlockInset);
            generator.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write frontmatter", e);
        }
        return "---\n" + writer.toString().stripTrailing() + "\n---\n";
    }

    /** Sets one frontmatter key the way the YAML block would; unknown keys and invalid values are ignored. */
    public static void apply(Frontmatter frontmatter, String key, String rawValue) {
        String value = rawValue == null ? "" : rawValue.trim();
        if (value.isEmpty()) {
            return;
        }
        switch (key) {
            case "title" -> frontmatter.titles.add(value);
            case "author" -> frontmatter.author = value;
            case "csl" -> frontmatter.csl = value;
            case "locale" -> frontmatter.locale = value;
            case "note-type" -> NoteType.parse(value).ifPresentOrElse(
                    type -> frontmatter.noteType = type, () -> dropped(key, value));
            case "timezone" -> {
                if (TIMEZONE.matcher(value).matches()) {
                    frontmatter.timezone = value;
                } else {
                    dropped(key, value);
                }
            }
            case "bibliography" -> frontmatter.bibliography = value;
            case "font" -> frontmatter.font = value;
            case "font-size" -> frontmatter.fontSize = positiveNumber(key, value);
            case "code-font" -> frontmatter.codeFont = value;
            case "code-font-size" -> frontmatter.codeFontSize = positiveNumber(key, value);
            case "code-background-color", "code-background" -> frontmatter.codeBackgroundColor = color(key, value);
            case "code-font-color", "code-color" -> frontmatter.codeFontColor = color(key, value);
            case "code-block-inset" -> {
                Double inset = number(value);
                if (inset != null && inset >= 0) {
                    frontmatter.codeBlockInset = inset;
                } else {
                    dropped(key, value);
                }
            }
            default -> LOG.debug("Unknown frontmatter key '{}'", key);
        }
    }

    private static Double positiveNumber(String key, String value) {
        Double number = number(value);
        if (number == null || number <= 0) {
            dropped(key, value);
            return null;
        }
        return number;
    }

    private static Double number(String value) {
        try {
            double parsed = Double.parseDouble(value);
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String color(String key, String value) {
        if (!HEX_COLOR.matcher(value).matches()) {
            dropped(key, value);
            return null;
        }
        return (value.startsWith("#") ? value.substring(1) : value).toUpperCase(Locale.ROOT);
    }

    private static void dropped(String key, String value) {
        LOG.debug("Dropping invalid frontmatter value {}: {}", key, value);
    }

    private static void writeString(YAMLGenerator generator, String key, String value) throws IOException {
        if (value != null) {
            generator.writeStringField(key, value);
        }
    }

    private static void writeNumber(YAMLGenerator generator, String key, Double value) throws IOException {
        if (value == null) {
            return;
        }
        generator.writeFieldName(key);
        if (value == Math.rint(value)) {
            generator.writeNumber(value.longValue());
        } else {
            generator.writeNumber(value);
        }
    }
}
