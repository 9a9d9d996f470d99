package com.example.bulkops;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads operation input: one identifier per line. Blank lines and lines starting with {@code #}
 * are ignored, surrounding whitespace is trimmed and file order is kept.
 */
public final class InputItems {
    private InputItems() {
    }

    public static List<String> read(Path file) throws IOException {
        return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    static List<String> parse(List<String> lines) {
        List<String> items = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            items.add(trimmed);
        }
        return items;
    }
}
