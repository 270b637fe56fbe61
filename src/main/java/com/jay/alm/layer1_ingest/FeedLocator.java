package com.jay.alm.layer1_ingest;

import com.jay.alm.config.AlmConfig;
import com.jay.alm.exception.FeedParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds the extract files of each feed in the configured data directory.
 * Files are returned sorted by name, which is the order the ingestor consumes them in
 * (and so decides which duplicate is "first seen").
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeedLocator {

    private final AlmConfig config;

    /** The extracts one run consumes, per source type. Exercises and interest may be empty. */
    public record FeedFiles(List<Path> trades, List<Path> cash, List<Path> nav,
                            List<Path> exercises, List<Path> interest) {

        public FeedFiles(List<Path> trades, List<Path> cash, List<Path> nav) {
            this(trades, cash, nav, List.of(), List.of());
        }

        public int size() {
            return trades.size() + cash.size() + nav.size() + exercises.size() + interest.size();
        }
    }

    public FeedFiles locate() {
        Path dir = Path.of(config.feeds().getDataDir());
        if (!Files.isDirectory(dir)) {
            throw new FeedParseException(dir.toString(), "data directory does not exist");
        }
        FeedFiles files = new FeedFiles(
            required(dir, config.feeds().getTradesGlob()),
            required(dir, config.feeds().getCashGlob()),
            required(dir, config.feeds().getNavGlob()),
            optional(dir, config.feeds().getExercisesGlob()),
            optional(dir, config.feeds().getInterestGlob()));
        log.info("FeedLocator: {} trade, {} cash, {} NAV, {} exercise, {} interest extracts in {}",
            files.trades().size(), files.cash().size(), files.nav().size(),
            files.exercises().size(), files.interest().size(), dir);
        return files;
    }

    List<Path> find(Path dir, String glob) {
        List<Path> found = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) found.add(p);
            }
        } catch (IOException e) {
            throw new FeedParseException(dir.toString(), "cannot list extracts: " + e.getMessage(), e);
        }
        found.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return found;
    }

    private List<Path> optional(Path dir, String glob) {
        if (glob == null || glob.isBlank()) return List.of();
        List<Path> found = find(dir, glob);
        if (found.isEmpty()) {
            log.warn("FeedLocator: no extract matching {} — continuing without it", glob);
        }
        return found;
    }

    private List<Path> required(Path dir, String glob) {
        List<Path> found = find(dir, glob);
        if (found.isEmpty()) {
            throw new FeedParseException(dir.toString(), "no extract matching " + glob);
        }
        return found;
    }
}
