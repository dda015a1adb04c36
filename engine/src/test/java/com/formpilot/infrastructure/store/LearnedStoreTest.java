package com.formpilot.infrastructure.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formpilot.domain.form.model.FieldType;
import com.formpilot.domain.form.model.ManualChange;
import com.formpilot.domain.form.model.PendingReviewItem;
import com.formpilot.domain.form.model.PersistOutcome;
import com.formpilot.domain.form.model.ValidationResult;
import com.formpilot.infrastructure.preprocessing.QuestionTextCleaner;
import com.formpilot.infrastructure.validation.AnswerValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LearnedStoreTest {

    private static final String PROFILE = """
            {
              "personal_info": {"full_name": "Jane Doe", "email": "jane@example.com", "city": ""},
              "education": {"degree": "BSc"},
              "custom_section": {"keep": [1, 2, 3]},
              "learned_questions": {"Full Name": "Jane Doe", "Favourite sport": "Tennis"},
              "preferences": {"auto_fill_enabled": true, "learn_new_questions": true}
            }
            """;

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AnswerValidator validator = new AnswerValidator();
    private Path profile;
    private LearnedStore store;
    private Instant now = Instant.parse("2026-03-01T10:00:00Z");

    @BeforeEach
    void setUp() {
        profile = dir.resolve("user_data.json");
        store = new LearnedStore(objectMapper, validator, new QuestionTextCleaner());
        ReflectionTestUtils.setField(store, "profilePath", profile);
        setClock(now);
    }

    private void setClock(Instant instant) {
        ReflectionTestUtils.setField(store, "clock", Clock.fixed(instant, ZoneOffset.UTC));
    }

    private PendingReviewItem ai(String question, String value) {
        return PendingReviewItem.ai(question, value, validator.validate(question, value));
    }

    private PendingReviewItem manual(String question, String original, String value) {
        ValidationResult validation = validator.validate(question, value);
        return PendingReviewItem.manual(question, new ManualChange(original, value, FieldType.TEXT), validation);
    }

    private List<Path> backups() throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().startsWith("user_data_backup_")).toList();
        }
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("Missing profile is created with the default skeleton")
        void createsDefaultDocument() throws IOException {
            assertThat(store.learnedAnswers()).isEmpty();

            JsonNode written = objectMapper.readTree(profile.toFile());
            assertThat(written.has("personal_info")).isTrue();
            assertThat(written.has("education")).isTrue();
            assertThat(written.has("professional")).isTrue();
            assertThat(written.path("learned_questions").isObject()).isTrue();
            assertThat(written.path("preferences").path("auto_fill_enabled").asBoolean()).isTrue();
            assertThat(written.path("preferences").path("learn_new_questions").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("A default skeleton that could not be written is not used; the next access retries")
        void failedBootstrapRetried() throws IOException {
            Path nested = dir.resolve("profiles").resolve("user_data.json");
            ReflectionTestUtils.setField(store, "profilePath", nested);

            assertThatThrownBy(() -> store.learnedAnswers()).isInstanceOf(LearnedStoreException.class);

            Files.createDirectory(dir.resolve("profiles"));
            assertThat(store.learnedAnswers()).isEmpty();
            assertThat(Files.exists(nested)).isTrue();
        }

        @Test
        @DisplayName("Exact lookup ignores case")
        void caseInsensitiveLookup() throws IOException {
            Files.writeString(profile, PROFILE);

            assertThat(store.lookupExact("full name")).contains("Jane Doe");
            assertThat(store.lookupExact("FULL NAME *")).contains("Jane Doe");
            assertThat(store.lookupExact("Nickname")).isEmpty();
        }

        @Test
        @DisplayName("Blank personal info values count as absent")
        void personalInfo() throws IOException {
            Files.writeString(profile, PROFILE);

            assertThat(store.personalInfo("email")).contains("jane@example.com");
            assertThat(store.personalInfo("city")).isEmpty();
            assertThat(store.personalInfo("phone")).isEmpty();
        }

        @Test
        @DisplayName("Unreadable profile fails with LearnedStoreException")
        void brokenJson() throws IOException {
            Files.writeString(profile, "{ not json");

            assertThatThrownBy(() -> store.learnedAnswers()).isInstanceOf(LearnedStoreException.class);
        }
    }

    @Nested
    @DisplayName("Merging")
    class Merging {

        @BeforeEach
        void writeProfile() throws IOException {
            Files.writeString(profile, PROFILE);
        }

        @Test
        @DisplayName("Invalid answers are never persisted, even after acceptance")
        void validationGating() throws IOException {
            PersistOutcome outcome = store.mergeAndPersist(List.of(
                    ai("Email Address *", "not-an-email"),
                    ai("City", "Berlin"),
                    manual("Phone number", "", "12345")));

            assertThat(outcome.savedCount()).isEqualTo(1);
            assertThat(outcome.skipped()).containsExactly("Email Address *", "Phone number");

            JsonNode learned = objectMapper.readTree(profile.toFile()).path("learned_questions");
            assertThat(learned.has("City")).isTrue();
            assertThat(learned.has("Email Address")).isFalse();
            assertThat(learned.has("Phone number")).isFalse();
        }

        @Test
        @DisplayName("Keys are re-cleaned and merged case-insensitively into the stored casing")
        void keyNormalization() throws IOException {
            store.mergeAndPersist(List.of(
                    manual("full name", "Jane Doe", "Jane A. Doe"),
                    ai("Hometown *", "Hamburg")));

            JsonNode learned = objectMapper.readTree(profile.toFile()).path("learned_questions");
            assertThat(learned.path("Full Name").asText()).isEqualTo("Jane A. Doe");
            assertThat(learned.has("full name")).isFalse();
            assertThat(learned.path("Hometown").asText()).isEqualTo("Hamburg");
        }

        @Test
        @DisplayName("Manual items after AI items win for the same question")
        void manualOverridesAi() {
            store.mergeAndPersist(List.of(
                    ai("Favourite sport", "Football"),
                    manual("Favourite sport", "Football", "Chess")));

            assertThat(store.lookupExact("Favourite sport")).contains("Chess");
        }

        @Test
        @DisplayName("Sections the pipeline does not own are written back unchanged")
        void preservesOtherSections() throws IOException {
            store.mergeAndPersist(List.of(ai("City", "Berlin")));

            JsonNode root = objectMapper.readTree(profile.toFile());
            assertThat(root.path("custom_section").path("keep")).hasSize(3);
            assertThat(root.path("education").path("degree").asText()).isEqualTo("BSc");
            assertThat(root.path("personal_info").path("full_name").asText()).isEqualTo("Jane Doe");
        }

        @Test
        @DisplayName("Nothing valid means no write and no backup")
        void noValidItems() throws IOException {
            byte[] before = Files.readAllBytes(profile);

            PersistOutcome outcome = store.mergeAndPersist(List.of(ai("Email", "nope")));

            assertThat(outcome.written()).isFalse();
            assertThat(Files.readAllBytes(profile)).isEqualTo(before);
            assertThat(backups()).isEmpty();
        }

        @Test
        @DisplayName("learn_new_questions=false turns persistence into a no-op")
        void learningDisabled() throws IOException {
            Files.writeString(profile, PROFILE.replace("\"learn_new_questions\": true", "\"learn_new_questions\": false"));
            byte[] before = Files.readAllBytes(profile);

            PersistOutcome outcome = store.mergeAndPersist(List.of(ai("City", "Berlin")));

            assertThat(outcome.savedCount()).isZero();
            assertThat(Files.readAllBytes(profile)).isEqualTo(before);
        }
    }

    @Nested
    @DisplayName("Persisting")
    class Persisting {

        @BeforeEach
        void writeProfile() throws IOException {
            Files.writeString(profile, PROFILE);
        }

        @Test
        @DisplayName("Each persist creates one timestamped backup of the previous file")
        void createsBackup() throws IOException {
            byte[] before = Files.readAllBytes(profile);

            store.mergeAndPersist(List.of(ai("City", "Berlin")));

            assertThat(backups()).extracting(p -> p.getFileName().toString())
                    .containsExactly("user_data_backup_20260301_100000.json");
            assertThat(Files.readAllBytes(backups().get(0))).isEqualTo(before);
            assertThat(Files.exists(dir.resolve("user_data.json.tmp"))).isFalse();
        }

        @Test
        @DisplayName("Two persists within the same second keep both backups")
        void backupNameCollision() throws IOException {
            store.mergeAndPersist(List.of(ai("City", "Berlin")));
            byte[] afterFirst = Files.readAllBytes(profile);

            store.mergeAndPersist(List.of(ai("City", "Hamburg")));

            assertThat(backups()).extracting(p -> p.getFileName().toString())
                    .containsExactlyInAnyOrder(
                            "user_data_backup_20260301_100000.json",
                            "user_data_backup_20260301_100000_1.json");
            assertThat(Files.readAllBytes(dir.resolve("user_data_backup_20260301_100000_1.json")))
                    .isEqualTo(afterFirst);
        }

        @Test
        @DisplayName("Never more than five backups are kept, the newest survive")
        void prunesBackups() throws IOException {
            for (int i = 0; i < 8; i++) {
                setClock(now.plusSeconds(i * 60L));
                store.mergeAndPersist(List.of(ai("City", "Berlin " + i)));
            }

            List<String> names = backups().stream().map(p -> p.getFileName().toString()).toList();
            assertThat(names).hasSize(5);
            assertThat(names).contains("user_data_backup_20260301_100700.json");
            assertThat(names).doesNotContain("user_data_backup_20260301_100000.json");
        }

        @Test
        @DisplayName("A failed write leaves the target file byte-for-byte unchanged")
        void failedWriteKeepsTarget() throws IOException {
            byte[] before = Files.readAllBytes(profile);
            // a non-empty directory in place of the temp file makes the write fail
            Path blocker = Files.createDirectory(dir.resolve("user_data.json.tmp"));
            Files.writeString(blocker.resolve("lock"), "x");

            assertThatThrownBy(() -> store.mergeAndPersist(List.of(ai("City", "Berlin"))))
                    .isInstanceOf(LearnedStoreException.class);

            assertThat(Files.readAllBytes(profile)).isEqualTo(before);
            assertThat(store.lookupExact("City")).contains("Berlin");
        }
    }
}
