package com.helmet.corpus.service;

import com.helmet.corpus.exception.ConflictException;
import com.helmet.corpus.exception.EntityNotFoundException;
import com.helmet.corpus.model.PaperRecord;
import com.helmet.corpus.repository.ArtifactRepository;
import com.helmet.corpus.repository.PaperRepository;
import com.helmet.corpus.util.StableIds;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PaperStoreImplTest {

    private final PaperRepository paperRepository = Mockito.mock(PaperRepository.class);
    private final ArtifactRepository artifactRepository = Mockito.mock(ArtifactRepository.class);
    private final PaperStore paperStore = new PaperStoreImpl(paperRepository, artifactRepository);

    private final UUID paperId = StableIds.paperId("PMC1");

    @Nested
    @DisplayName("Put")
    class PutTest {

        @Test
        @DisplayName("A new source id is inserted under its stable id")
        void shouldInsertNewPaper() {
            when(paperRepository.findById(paperId)).thenReturn(Optional.empty());
            when(paperRepository.insertIfAbsent(any(PaperRecord.class)))
                .thenAnswer(invocation -> Optional.of(invocation.getArgument(0)));

            PaperRecord stored = paperStore.put(" PMC1 ", "content", false);

            assertThat(stored.id()).isEqualTo(paperId);
            assertThat(stored.externalSourceId()).isEqualTo("PMC1");
            assertThat(stored.contentHash()).isEqualTo(StableIds.contentHash("content"));
        }

        @Test
        @DisplayName("Identical content returns the stored record without writing")
        void shouldBeIdempotentForSameContent() {
            PaperRecord existing = record("content");
            when(paperRepository.findById(paperId)).thenReturn(Optional.of(existing));

            PaperRecord result = paperStore.put("PMC1", "content", false);

            assertThat(result).isSameAs(existing);
            verify(paperRepository, never()).insertIfAbsent(any());
            verify(paperRepository, never()).replaceContent(any(), any(), any());
        }

        @Test
        @DisplayName("Different content without overwrite is a conflict")
        void shouldRejectChangedContent() {
            when(paperRepository.findById(paperId)).thenReturn(Optional.of(record("old")));

            assertThatThrownBy(() -> paperStore.put("PMC1", "new", false))
                .isInstanceOf(ConflictException.class);
            verify(paperRepository, never()).replaceContent(any(), any(), any());
        }

        @Test
        @DisplayName("Different content with overwrite replaces the stored content")
        void shouldOverwriteWhenAllowed() {
            PaperRecord replaced = record("new");
            when(paperRepository.findById(paperId)).thenReturn(Optional.of(record("old")));
            when(paperRepository.replaceContent(paperId, "new", StableIds.contentHash("new"))).thenReturn(replaced);

            assertThat(paperStore.put("PMC1", "new", true)).isEqualTo(replaced);
        }

        @Test
        @DisplayName("Losing an insert race falls back to the winner's record")
        void shouldReadBackAfterLostRace() {
            PaperRecord winner = record("content");
            when(paperRepository.findById(paperId)).thenReturn(Optional.empty(), Optional.of(winner));
            when(paperRepository.insertIfAbsent(any(PaperRecord.class))).thenReturn(Optional.empty());

            assertThat(paperStore.put("PMC1", "content", false)).isEqualTo(winner);
        }

        @Test
        @DisplayName("Blank source id and null content are rejected")
        void shouldValidateInput() {
            assertThatThrownBy(() -> paperStore.put(" ", "content", false)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> paperStore.put("PMC1", null, false)).isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(paperRepository);
        }
    }

    @Nested
    @DisplayName("Get and purge")
    class ReadAndPurgeTest {

        @Test
        @DisplayName("Unknown paper id is not found")
        void shouldThrowWhenMissing() {
            when(paperRepository.findById(paperId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> paperStore.get(paperId))
                .isInstanceOf(EntityNotFoundException.class)
                .hasMessageContaining(paperId.toString());
        }

        @Test
        @DisplayName("Purge refuses papers still referenced by artifacts")
        void shouldRefusePurgeWhenReferenced() {
            when(paperRepository.findById(paperId)).thenReturn(Optional.of(record("content")));
            when(artifactRepository.isReferenced(paperId)).thenReturn(true);

            assertThatThrownBy(() -> paperStore.purge(paperId)).isInstanceOf(ConflictException.class);
            verify(paperRepository, never()).delete(any());
        }

        @Test
        @DisplayName("Purge deletes unreferenced papers")
        void shouldPurgeUnreferenced() {
            when(paperRepository.findById(paperId)).thenReturn(Optional.of(record("content")));
            when(artifactRepository.isReferenced(paperId)).thenReturn(false);

            paperStore.purge(paperId);

            verify(paperRepository).delete(paperId);
        }
    }

    private PaperRecord record(String content) {
        return new PaperRecord(paperId, "PMC1", content, StableIds.contentHash(content), OffsetDateTime.now());
    }
}
