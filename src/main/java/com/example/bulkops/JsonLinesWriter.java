package com.example.bulkops;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Buffers export records and appends them, one JSON document per line, to a single output file.
 * Appending keeps a resumed run's output additive to what the earlier run already wrote.
 */
public class JsonLinesWriter<T> implements Closeable {
    public static final int DEFAULT_THRESHOLD = 100;

    private final ObjectWriter writer;
    private final Path outputFile;
    private final int threshold;
    private final List<T> buffer;
    private long written;

    public JsonLinesWriter(Path outputFile) {
        this(null, outputFile, DEFAULT_THRESHOLD);
    }

    public JsonLinesWriter(ObjectMapper mapper, Path outputFile, int threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        ObjectMapper effective = mapper == null
                ? new ObjectMapper().registerModule(new JavaTimeModule())
                        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                : mapper;
        this.writer = effective.writer().without(SerializationFeature.INDENT_OUTPUT);
        this.outputFile = outputFile;
        this.threshold = threshold;
        this.buffer = new ArrayList<>(threshold);
    }

    public synchronized void add(T entry) throws IOException {
        buffer.add(entry);
        if (buffer.size() >= threshold) {
            flush();
        }
    }

    public synchronized void flush() throws IOException {
        if (buffer.isEmpty()) {
            return;
        }
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter out = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            for (T entry : buffer) {
                out.write(writer.writeValueAsString(entry));
                out.newLine();
            }
        }
        written += buffer.size();
        buffer.clear();
    }

    @Override
    public synchronized void close() throws IOException {
        flush();
    }

    public synchronized int pending() {
        return buffer.size();
    }

    public synchronized long written() {
        return written;
    }

    public Path outputFile() {
        return outputFile;
    }
}
