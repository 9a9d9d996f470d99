package com.example.bulkops;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class InputItemsTest {
    @Test
    void skipsBlankLinesAndComments() throws Exception {
        Path file = Files.createTempDirectory("input-test").resolve("users.txt");
        Files.writeString(file, "# exported 2024-03-05\nauth0|1\n\n  google-oauth2|2  \n   # trailing note\nauth0|3");

        assertEquals(List.of("auth0|1", "google-oauth2|2", "auth0|3"), InputItems.read(file));
    }

    @Test
    void keepsDuplicatesForTheManagerToResolve() {
        assertEquals(List.of("a", "a"), InputItems.parse(List.of("a", "a")));
    }
}
