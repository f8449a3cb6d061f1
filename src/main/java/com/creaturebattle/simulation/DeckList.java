package com.creaturebattle.simulation;

import com.creaturebattle.card.CardRepository;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A deck as a list of card template ids.
 */
public class DeckList {
    private final List<String> templateIds;
    private final String name;

    public DeckList(List<String> templateIds, String name) {
        this.templateIds = List.copyOf(templateIds);
        this.name = name;
    }

    /**
     * Load a deck from a file.
     * Format: "4 template-id" per line, supports comments with # or //
     *
     * @param path       Path to the deck file
     * @param repository Card data, used to check every template id exists
     * @return Parsed deck
     * @throws DeckException if the file cannot be read or parsed
     */
    public static DeckList loadFromFile(String path, CardRepository repository) throws DeckException {
        String content;
        try {
            content = Files.readString(Path.of(path));
        } catch (IOException e) {
            throw new DeckException("Failed to read deck file: " + e.getMessage(), e);
        }
        String fileName = Path.of(path).getFileName().toString();
        String deckName = fileName.endsWith(".txt") ? fileName.substring(0, fileName.length() - 4) : fileName;
        return parse(content, deckName, repository);
    }

    public static DeckList loadFromResource(String resourcePath, CardRepository repository) throws DeckException {
        try (InputStream in = DeckList.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new DeckException("Deck resource not found: " + resourcePath);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), resourcePath, repository);
        } catch (IOException e) {
            throw new DeckException("Failed to read deck resource: " + e.getMessage(), e);
        }
    }

    public static DeckList parse(String content, String name, CardRepository repository) throws DeckException {
        List<String> ids = new ArrayList<>();
        String[] lines = content.split("\n");

        for (int lineNum = 0; lineNum < lines.length; lineNum++) {
            String line = lines[lineNum].trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith("//")) {
                continue;
            }

            int spaceIdx = line.indexOf(' ');
            if (spaceIdx == -1) {
                throw new DeckException("Invalid deck format at line " + (lineNum + 1)
                        + ": Expected format 'COUNT TEMPLATE_ID'");
            }
            String countStr = line.substring(0, spaceIdx);
            String templateId = line.substring(spaceIdx + 1).trim();

            int count;
            try {
                count = Integer.parseInt(countStr);
            } catch (NumberFormatException e) {
                throw new DeckException("Invalid deck format at line " + (lineNum + 1)
                        + ": '" + countStr + "' is not a valid number", e);
            }
            if (!repository.hasCard(templateId)) {
                throw new DeckException("Card not found at line " + (lineNum + 1) + ": " + templateId);
            }
            for (int i = 0; i < count; i++) {
                ids.add(templateId);
            }
        }
        return new DeckList(ids, name);
    }

    public List<String> getTemplateIds() {
        return templateIds;
    }

    public int size() {
        return templateIds.size();
    }

    public String getName() {
        return name;
    }

    /**
     * Exception thrown when deck parsing fails.
     */
    public static class DeckException extends Exception {
        public DeckException(String message) {
            super(message);
        }

        public DeckException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
