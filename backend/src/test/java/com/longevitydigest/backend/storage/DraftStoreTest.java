package com.longevitydigest.backend.storage;

import static com.longevitydigest.backend.support.Fixtures.candidate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.longevitydigest.backend.model.dto.Citation;
import com.longevitydigest.backend.model.dto.Draft;
import com.longevitydigest.backend.model.enums.ContentType;
import com.longevitydigest.backend.model.enums.DraftStatus;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DraftStoreTest {

    @TempDir
    Path directory;

    @Test
    void fileName_shouldUseDateTypeAndIdentifierSlug() {
        Draft draft = draft("10.1038/s41586-025-12345-x", DraftStatus.READY_FOR_REVIEW);

        assertThat(DraftStore.fileName(draft)).isEqualTo("2025-03-03_newsletter_10.1038_s41586-025-1.json");
    }

    @Test
    void slug_shouldFallBackToUntitled() {
        assertThat(DraftStore.slug("")).isEqualTo("untitled");
        assertThat(DraftStore.slug(null)).isEqualTo("untitled");
        assertThat(DraftStore.slug("NCT05000001")).isEqualTo("NCT05000001");
    }

    @Test
    void save_shouldWriteJsonThatReadsBack() throws Exception {
        DraftStore store = new DraftStore(directory);
        Draft original = draft("10.1/abc", DraftStatus.NEEDS_REVISION);

        Path file = store.save(original);
        Draft loaded = store.read(file);

        assertThat(Files.readString(file)).contains("\"status\" : \"needs_revision\"").contains("\"contentType\" : \"newsletter\"");
        assertThat(loaded.getStatus()).isEqualTo(DraftStatus.NEEDS_REVISION);
        assertThat(loaded.getTitle()).isEqualTo(original.getTitle());
        assertThat(loaded.getCreatedAt()).isEqualTo(original.getCreatedAt());
        assertThat(loaded.getCandidate().getIdentifier()).isEqualTo("10.1/abc");
        assertThat(loaded.getCandidate().getTags()).containsExactly("pubmed");
        assertThat(loaded.getCitations()).singleElement().satisfies(c -> assertThat(c.getDoi()).isEqualTo("10.1/abc"));
        assertThat(loaded.getFactCheckNotes()).containsExactly("needs a source");
    }

    @Test
    void list_shouldSkipUnreadableFiles_andFilterByStatus() throws Exception {
        DraftStore store = new DraftStore(directory);
        store.save(draft("a", DraftStatus.READY_FOR_REVIEW));
        store.save(draft("b", DraftStatus.NEEDS_REVISION));
        Files.writeString(directory.resolve("broken.json"), "{ not json");
        Files.writeString(directory.resolve("notes.txt"), "ignored");

        assertThat(store.list()).hasSize(2);
        assertThat(store.listByStatus(DraftStatus.NEEDS_REVISION))
                .extracting(StoredDraft::getFileName)
                .containsExactly("2025-03-03_newsletter_b.json");
    }

    @Test
    void list_shouldBeEmpty_whenDirectoryDoesNotExist() {
        assertThat(new DraftStore(directory.resolve("missing")).list()).isEmpty();
    }

    @Test
    void save_shouldKeepBothDrafts_whenFileNamesCollide() {
        DraftStore store = new DraftStore(directory);

        Path firstUntitled = store.save(draft("", DraftStatus.READY_FOR_REVIEW));
        Path secondUntitled = store.save(draft("", DraftStatus.NEEDS_REVISION));
        Path firstPreprint = store.save(draft("10.1101/2024.05.10.592345", DraftStatus.READY_FOR_REVIEW));
        Path secondPreprint = store.save(draft("10.1101/2024.05.10.598765", DraftStatus.READY_FOR_REVIEW));

        assertThat(firstUntitled.getFileName().toString()).isEqualTo("2025-03-03_newsletter_untitled.json");
        assertThat(secondUntitled.getFileName().toString()).isEqualTo("2025-03-03_newsletter_untitled_2.json");
        assertThat(firstPreprint).isNotEqualTo(secondPreprint);
        assertThat(secondPreprint.getFileName().toString()).isEqualTo("2025-03-03_newsletter_10.1101_2024.05.10.5_2.json");

        assertThat(store.list()).hasSize(4);
        assertThat(store.read(firstPreprint).getCandidate().getIdentifier()).isEqualTo("10.1101/2024.05.10.592345");
        assertThat(store.read(secondPreprint).getCandidate().getIdentifier()).isEqualTo("10.1101/2024.05.10.598765");
        assertThat(store.read(firstUntitled).getStatus()).isEqualTo(DraftStatus.READY_FOR_REVIEW);
    }

    @Test
    void write_shouldOverwriteInPlace() {
        DraftStore store = new DraftStore(directory);
        Draft draft = draft("a", DraftStatus.NEEDS_REVISION);
        Path file = store.save(draft);

        draft.setStatus(DraftStatus.READY_FOR_REVIEW);
        store.write(file, draft);

        assertThat(store.read(file).getStatus()).isEqualTo(DraftStatus.READY_FOR_REVIEW);
        assertThat(store.list()).hasSize(1);
    }

    @Test
    void read_shouldWrapIoFailures() {
        DraftStore store = new DraftStore(directory);

        assertThatThrownBy(() -> store.read(directory.resolve("absent.json")))
                .isInstanceOf(DraftStorageException.class);
    }

    private static Draft draft(String identifier, DraftStatus status) {
        return Draft.builder()
                .candidate(candidate(identifier, "Paper " + identifier, "pubmed"))
                .contentType(ContentType.NEWSLETTER)
                .title("Title " + identifier)
                .summary("Summary")
                .body("Body")
                .citations(new ArrayList<>(List.of(new Citation(identifier, "Paper " + identifier, "Journal"))))
                .factCheckNotes(new ArrayList<>(List.of("needs a source")))
                .confidenceScore(0.7)
                .createdAt(LocalDateTime.of(2025, 3, 3, 9, 30))
                .status(status)
                .source("pubmed")
                .build();
    }
}
