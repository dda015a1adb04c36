package com.formpilot.infrastructure.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.formpilot.domain.form.model.PendingReviewItem;
import com.formpilot.domain.form.model.PersistOutcome;
import com.formpilot.domain.form.model.ValidationResult;
import com.formpilot.infrastructure.preprocessing.QuestionTextCleaner;
import com.formpilot.infrastructure.validation.AnswerValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Durable store of confirmed answers inside the JSON profile document.
 * <p>
 * Writes are crash-safe: the current file is copied to a timestamped backup, old backups are
 * pruned, the new document goes to {@code <target>.tmp} and is then renamed over the target.
 * A failure before the rename leaves the target byte-for-byte unchanged.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LearnedStore {

    private static final DateTimeFormatter BACKUP_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String BACKUP_MARKER = "_backup_";
    private static final String JSON_SUFFIX = ".json";

    private final ObjectMapper objectMapper;
    private final AnswerValidator answerValidator;
    private final QuestionTextCleaner textCleaner;

    @Value("${form-filler.profile-path:user_data.json}")
    private Path profilePath;

    @Value("${form-filler.backup.max-count:5}")
    private int maxBackups = 5;

    private Clock clock = Clock.systemDefaultZone();

    private ProfileDocument document;

    // ===== Reads =====

    /**
     * The loaded document. Loads it on first access, creating the default skeleton if the file
     * does not exist yet.
     */
    public synchronized ProfileDocument document() {
        if (document == null) {
            document = load();
        }
        return document;
    }

    public synchronized Map<String, String> learnedAnswers() {
        return document().learnedQuestions();
    }

    /**
     * Case-insensitive lookup by cleaned question text.
     */
    public synchronized Optional<String> lookupExact(String question) {
        return findStoredKey(question).map(key -> document().learnedQuestions().get(key));
    }

    public synchronized Optional<String> personalInfo(String field) {
        return document().personalInfo(field);
    }

    public synchronized boolean preference(String name, boolean defaultValue) {
        return document().preference(name, defaultValue);
    }

    public synchronized String profileJson() {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document().root());
        } catch (IOException e) {
            throw new LearnedStoreException("Failed to serialize profile document", e);
        }
    }

    // ===== Writes =====

    /**
     * Validate reviewed items, merge the valid ones into {@code learned_questions} and persist.
     * <p>
     * Invalid items are skipped with a logged reason. Nothing is written when no item is valid
     * or when the profile disables learning. If persisting fails the in-memory merge is kept so
     * the caller can retry {@link #persist()}.
     * </p>
     *
     * @throws LearnedStoreException if the document could not be written
     */
    public synchronized PersistOutcome mergeAndPersist(List<PendingReviewItem> items) {
        if (!document().preference("learn_new_questions", true)) {
            log.info("[Store] learn_new_questions disabled, {} reviewed items not saved", items.size());
            return new PersistOutcome(0, List.of(), false);
        }

        int saved = 0;
        List<String> skipped = new ArrayList<>();

        for (PendingReviewItem item : items) {
            String value = item.value();
            if (value == null || value.isBlank()) {
                log.warn("[Store] Skipped empty {} answer for '{}'", item.source(), item.question());
                skipped.add(item.question());
                continue;
            }

            ValidationResult validation = answerValidator.validate(item.question(), value);
            if (!validation.passed()) {
                log.warn("[Store] Skipped invalid {} answer for '{}': {}",
                        item.source(), item.question(), String.join(", ", validation.messages()));
                skipped.add(item.question());
                continue;
            }

            String key = textCleaner.clean(item.question());
            String storedKey = findStoredKey(key).orElse(key);
            document().putLearned(storedKey, value);
            saved++;
            log.info("[Store] Learned {} answer: {} -> {}", item.source(), storedKey, value);
        }

        if (saved == 0) {
            log.info("[Store] No new data to save");
            return new PersistOutcome(0, List.copyOf(skipped), false);
        }

        persist();
        log.info("[Store] Saved {} items ({} skipped)", saved, skipped.size());
        return new PersistOutcome(saved, List.copyOf(skipped), true);
    }

    /**
     * Write the whole document: backup, prune backups, write temp file, atomic rename.
     *
     * @throws LearnedStoreException if any step fails; the target file is then unchanged
     */
    public synchronized void persist() {
        write(document());
    }

    // ===== Internal =====

    private void write(ProfileDocument source) {
        Path target = profilePath.toAbsolutePath();
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");

        try {
            if (Files.exists(target)) {
                Path backup = createBackup(target);
                log.info("[Store] Backup created: {}", backup.getFileName());
                pruneBackups(target);
            }

            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), source.root());
            moveIntoPlace(temp, target);
            log.info("[Store] Profile written to {}", target);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(temp);
            throw new LearnedStoreException("Failed to persist profile document " + target, e);
        }
    }

    private ProfileDocument load() {
        Path path = profilePath.toAbsolutePath();
        if (!Files.exists(path)) {
            log.info("[Store] No profile at {}, creating default document", path);
            // not cached until the skeleton is on disk
            ProfileDocument defaults = ProfileDocument.defaults();
            write(defaults);
            return defaults;
        }

        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            if (!(root instanceof ObjectNode objectNode)) {
                throw new IOException("Profile document root is not a JSON object");
            }
            ProfileDocument loaded = new ProfileDocument(objectNode);
            log.info("[Store] Loaded profile {} ({} learned questions)", path, loaded.learnedQuestions().size());
            return loaded;
        } catch (IOException e) {
            throw new LearnedStoreException("Failed to read profile document " + path, e);
        }
    }

    private Optional<String> findStoredKey(String question) {
        String wanted = textCleaner.matchKey(question);
        return document().learnedQuestions().keySet().stream()
                .filter(key -> textCleaner.matchKey(key).equals(wanted))
                .findFirst();
    }

    private Path createBackup(Path target) throws IOException {
        String timestamp = LocalDateTime.now(clock).format(BACKUP_TIMESTAMP);
        String stem = backupPrefix(target) + timestamp;
        Path backup = target.resolveSibling(stem + JSON_SUFFIX);
        for (int n = 1; Files.exists(backup); n++) {
            backup = target.resolveSibling(stem + "_" + n + JSON_SUFFIX);
        }
        Files.copy(target, backup, StandardCopyOption.COPY_ATTRIBUTES);
        // copy keeps the source mtime; the backup must sort as the newest one
        Files.setLastModifiedTime(backup, FileTime.from(clock.instant()));
        return backup;
    }

    private void pruneBackups(Path target) throws IOException {
        String prefix = backupPrefix(target);
        List<Path> backups;
        try (Stream<Path> siblings = Files.list(target.getParent())) {
            backups = siblings
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(prefix) && name.endsWith(JSON_SUFFIX);
                    })
                    .sorted(Comparator.comparing(this::lastModified).reversed())
                    .toList();
        }

        for (Path old : backups.stream().skip(maxBackups).toList()) {
            try {
                Files.deleteIfExists(old);
                log.info("[Store] Removed old backup: {}", old.getFileName());
            } catch (IOException e) {
                log.warn("[Store] Could not remove old backup {}: {}", old.getFileName(), e.getMessage());
            }
        }
    }

    private FileTime lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("[Store] Atomic move not supported, falling back to replace");
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("[Store] Could not delete temp file {}: {}", temp, e.getMessage());
        }
    }

    private static String backupPrefix(Path target) {
        String name = target.getFileName().toString();
        String stem = name.toLowerCase(Locale.ROOT).endsWith(JSON_SUFFIX)
                ? name.substring(0, name.length() - JSON_SUFFIX.length())
                : name;
        return stem + BACKUP_MARKER;
    }
}
