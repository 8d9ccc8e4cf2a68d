package com.filingsync.ingestion.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FetchWindowTest {

    @Test
    void splitsIntoInclusiveChunks() {
        FetchWindow window = new FetchWindow(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 5));

        List<FetchWindow> chunks = window.split(30);

        assertThat(chunks).containsExactly(
            new FetchWindow(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 30)),
            new FetchWindow(LocalDate.of(2024, 1, 31), LocalDate.of(2024, 2, 29)),
            new FetchWindow(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 5))
        );
    }

    @Test
    void singleDayWindowIsOneChunk() {
        FetchWindow window = new FetchWindow(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 1));
        assertThat(window.split(7)).containsExactly(window);
    }

    @Test
    void rejectsInvertedWindowAndBadChunkSize() {
        assertThatThrownBy(() -> new FetchWindow(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 1)))
            .isInstanceOf(IllegalArgumentException.class);
        FetchWindow window = new FetchWindow(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2));
        assertThatThrownBy(() -> window.split(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
