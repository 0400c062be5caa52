package com.questrail.designer.core;

import com.questrail.designer.codec.ConfigParser;
import com.questrail.designer.codec.ParsedDiagram;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads configuration text from a file or string and parses it, without touching
 * any store. The caller commits the result in one step, so a failure here leaves
 * the store as it was.
 */
public final class DiagramImporter
{
    private final ConfigParser parser;

    public DiagramImporter(ConfigParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /**
     * @throws com.questrail.designer.codec.ConfigParseException if the text is malformed
     */
    public ParsedDiagram importText(String text) {
        return parser.parse(text);
    }

    /**
     * Reads {@code path} as UTF-8 and parses it.
     *
     * @throws IOException if the file cannot be read
     * @throws com.questrail.designer.codec.ConfigParseException if the text is malformed
     */
    public ParsedDiagram importFile(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        return parser.parse(Files.readString(path, StandardCharsets.UTF_8));
    }
}
