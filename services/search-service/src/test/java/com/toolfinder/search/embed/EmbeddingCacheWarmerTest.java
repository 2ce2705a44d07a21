package com.toolfinder.search.embed;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EmbeddingCacheWarmerTest {

    @Mock
    private EmbeddingService embeddingService;

    @Mock
    private EmbeddingCache cache;

    private EmbeddingProperties properties;
    private EmbeddingCacheWarmer warmer;

    @BeforeEach
    void setUp() {
        properties = new EmbeddingProperties();
        properties.getWarming().setQueries(List.of("image editor", "vector database", "kanban board"));
        properties.getWarming().setMaxWarmupSize(2);
        warmer = new EmbeddingCacheWarmer(properties, embeddingService, cache);
    }

    @Test
    void warmsUpToMaxWarmupSize() {
        when(embeddingService.warm("image editor")).thenReturn(true);
        when(embeddingService.warm("vector database")).thenReturn(false);

        assertEquals(1, warmer.warm());
        verify(embeddingService, never()).warm("kanban board");
    }

    @Test
    void stopsWhenEmbeddingIsUnavailable() {
        when(embeddingService.warm("image editor")).thenThrow(new EmbeddingUnavailableException("embed_circuit_open"));

        assertEquals(0, warmer.warm());
        verify(embeddingService, never()).warm("vector database");
    }

    @Test
    void disabledWarmingSchedulesNothing() {
        warmer.init();

        verify(cache, never()).scheduleWarming(any(), anyLong());
    }
}
