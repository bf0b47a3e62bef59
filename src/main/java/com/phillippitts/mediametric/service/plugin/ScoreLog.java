package com.phillippitts.mediametric.service.plugin;

import com.phillippitts.mediametric.exception.ResultParseException;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Line-oriented per-frame score artifact.
 *
 * <pre>
 * PSNR_1.0
 * frame=0 psnr_y=38.125
 * frame=1 psnr_y=37.900
 * </pre>
 * The first line is the executor id; every further line holds one frame's {@code key=value} pairs.
 */
public final class ScoreLog {

    private static final String FRAME_KEY = "frame";

    private ScoreLog() {
        // Utility class - prevent instantiation
    }

    /**
     * Creates (or truncates) the log and writes the executor id line.
     */
    public static void init(Path path, String executorId) throws IOException {
        Files.writeString(path, executorId + System.lineSeparator(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    /**
     * Opens the log for appending frame lines.
     */
    public static Appender append(Path path) throws IOException {
        return new Appender(Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.APPEND));
    }

    /**
     * Parses the log, checking that it was produced for {@code expectedExecutorId}.
     *
     * @return per-key score lists in frame order
     * @throws ResultParseException if the log is missing, mislabelled or malformed
     */
    public static Map<String, List<Double>> read(Path path, String expectedExecutorId) {
        Map<String, List<Double>> scores = new LinkedHashMap<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String header = reader.readLine();
            if (header == null || !header.strip().equals(expectedExecutorId)) {
                throw new ResultParseException("Log header '" + header + "' does not match executor "
                        + expectedExecutorId, path);
            }
            String line;
            int expectedFrame = 0;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                parseFrame(path, line, expectedFrame, scores);
                expectedFrame++;
            }
        } catch (NoSuchFileException e) {
            throw new ResultParseException("Score log not found", path, e);
        } catch (IOException e) {
            throw new ResultParseException("Cannot read score log: " + e.getMessage(), path, e);
        }
        return scores;
    }

    private static void parseFrame(Path path, String line, int expectedFrame, Map<String, List<Double>> scores) {
        for (String token : line.trim().split("\\s+")) {
            int eq = token.indexOf('=');
            if (eq <= 0 || eq == token.length() - 1) {
                throw new ResultParseException("Malformed token '" + token + "' in line: " + line, path);
            }
            String key = token.substring(0, eq);
            String value = token.substring(eq + 1);
            try {
                if (FRAME_KEY.equals(key)) {
                    if (Integer.parseInt(value) != expectedFrame) {
                        throw new ResultParseException("Expected frame " + expectedFrame + ", got " + value, path);
                    }
                    continue;
                }
                scores.computeIfAbsent(key, k -> new ArrayList<>()).add(Double.parseDouble(value));
            } catch (NumberFormatException e) {
                throw new ResultParseException("Not a number in '" + token + "'", path, e);
            }
        }
    }

    /**
     * Writes frame lines in order.
     */
    public static final class Appender implements AutoCloseable {
        private final BufferedWriter writer;
        private int frame;

        private Appender(BufferedWriter writer) {
            this.writer = writer;
        }

        public void frame(Map<String, Double> values) throws IOException {
            StringBuilder sb = new StringBuilder(FRAME_KEY).append('=').append(frame++);
            values.forEach((k, v) -> sb.append(' ').append(k).append('=').append(String.format(Locale.ROOT, "%.6f", v)));
            writer.write(sb.toString());
            writer.newLine();
        }

        @Override
        public void close() throws IOException {
            writer.close();
        }
    }
}
