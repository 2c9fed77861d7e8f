package org.dxworks.manuscript;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.manuscript.model.CitationKeyFormat;
import org.dxworks.manuscript.model.HighlightColor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class ManuscriptConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ManuscriptConfig.class);

    private static final String CONFIG_FILE_NAME = "manuscript-config.yml";
    private static final CitationKeyFormat DEFAULT_CITATION_KEY_FORMAT = CitationKeyFormat.AUTHOR_YEAR_TITLE;
    private static final HighlightColor DEFAULT_HIGHLIGHT_COLOR = HighlightColor.YELLOW;
    private static final int DEFAULT_MAX_XML_DEPTH = 50;
    private static final String DEFAULT_MEDIA_DIRECTORY = "media";

    private final CitationKeyFormat citationKeyFormat;
    private final HighlightColor defaultHighlightColor;
    private final int maxXmlDepth;
    private final String mediaDirectory;

    private ManuscriptConfig(CitationKeyFormat citationKeyFormat, HighlightColor defaultHighlightColor,
                             int maxXmlDepth, String mediaDirectory) {
        this.citationKeyFormat = citationKeyFormat;
        this.defaultHighlightColor = defaultHighlightColor;
        this.maxXmlDepth = maxXmlDepth;
        this.mediaDirectory = mediaDirectory;
    }

    public CitationKeyFormat getCitationKeyFormat() {
        return citationKeyFormat;
    }

    /** Color used for {@code ==text==} highlights without an explicit color, and omitted when exporting. */
    public HighlightColor getDefaultHighlightColor() {
        return defaultHighlightColor;
    }

    public int getMaxXmlDepth() {
        return maxXmlDepth;
    }

    public String getMediaDirectory() {
        return mediaDirectory;
    }

    public static ManuscriptConfig defaults() {
        return new ManuscriptConfig(DEFAULT_CITATION_KEY_FORMAT, DEFAULT_HIGHLIGHT_COLOR, DEFAULT_MAX_XML_DEPTH,
                DEFAULT_MEDIA_DIRECTORY);
    }

    public static ManuscriptConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static ManuscriptConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                CitationKeyFormat format = yamlConfig.citationKeyFormat == null
                        ? DEFAULT_CITATION_KEY_FORMAT
                        : CitationKeyFormat.fromId(yamlConfig.citationKeyFormat).orElse(DEFAULT_CITATION_KEY_FORMAT);
                HighlightColor color = HighlightColor.resolve(yamlConfig.defaultHighlightColor);
                int depth = (yamlConfig.maxXmlDepth != null && yamlConfig.maxXmlDepth > 0)
                        ? yamlConfig.maxXmlDepth
                        : DEFAULT_MAX_XML_DEPTH;
                String media = (yamlConfig.mediaDirectory != null && !yamlConfig.mediaDirectory.isBlank())
                        ? yamlConfig.mediaDirectory
                        : DEFAULT_MEDIA_DIRECTORY;
                return new ManuscriptConfig(format, color, depth, media);
            }
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static ManuscriptConfig with(CitationKeyFormat citationKeyFormat, HighlightColor defaultHighlightColor,
                                        int maxXmlDepth) {
        return new ManuscriptConfig(
                citationKeyFormat != null ? citationKeyFormat : DEFAULT_CITATION_KEY_FORMAT,
                defaultHighlightColor != null ? defaultHighlightColor : DEFAULT_HIGHLIGHT_COLOR,
                maxXmlDepth > 0 ? maxXmlDepth : DEFAULT_MAX_XML_DEPTH,
                DEFAULT_MEDIA_DIRECTORY);
    }

    private static class YamlConfig {
        public String citationKeyFormat;
        public String defaultHighlightColor;
        public Integer maxXmlDepth;
        public String mediaDirectory;
    }
}
