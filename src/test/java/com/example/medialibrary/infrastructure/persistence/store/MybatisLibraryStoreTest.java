package com.example.medialibrary.infrastructure.persistence.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.medialibrary.application.service.MediaItemResolver;
import com.example.medialibrary.application.service.PlaybackQueue;
import com.example.medialibrary.application.service.ScopeLockRegistry;
import com.example.medialibrary.domain.model.CollectionEntry;
import com.example.medialibrary.domain.model.CollectionScope;
import com.example.medialibrary.domain.model.MediaItemRef;
import com.example.medialibrary.domain.model.ResolvedEntry;
import com.example.medialibrary.infrastructure.persistence.entity.PlaylistItemEntity;
import com.example.medialibrary.infrastructure.persistence.entity.QueueItemEntity;
import com.example.medialibrary.infrastructure.persistence.entity.TrackEntity;
import com.example.medialibrary.infrastructure.persistence.entity.VideoEntity;
import com.example.medialibrary.infrastructure.persistence.mapper.ChannelMapper;
import com.example.medialibrary.infrastructure.persistence.mapper.PlaylistItemMapper;
import com.example.medialibrary.infrastructure.persistence.mapper.PlaylistMapper;
import com.example.medialibrary.infrastructure.persistence.mapper.QueueItemMapper;
import com.example.medialibrary.infrastructure.persistence.mapper.TrackMapper;
import com.example.medialibrary.infrastructure.persistence.mapper.VideoMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.transaction.support.TransactionOperations;

class MybatisLibraryStoreTest {

    private TrackMapper trackMapper;
    private VideoMapper videoMapper;
    private PlaylistItemMapper playlistItemMapper;
    private QueueItemMapper queueItemMapper;
    private MybatisLibraryStore store;

    @BeforeEach
    void setUp() {
        trackMapper = mock(TrackMapper.class);
        videoMapper = mock(VideoMapper.class);
        playlistItemMapper = mock(PlaylistItemMapper.class);
        queueItemMapper = mock(QueueItemMapper.class);
        store = new MybatisLibraryStore(trackMapper, videoMapper, mock(ChannelMapper.class),
                mock(PlaylistMapper.class), playlistItemMapper, queueItemMapper);
    }

    @Test
    void shouldDropQueueRowsWithoutExactlyOneReference() {
        when(queueItemMapper.selectAllOrdered()).thenReturn(Arrays.asList(
                queueRow(1L, 0, "/m/a.mp3", null),
                queueRow(2L, 1, null, null),
                queueRow(3L, 2, "/m/b.mp3", 7L),
                queueRow(4L, 3, null, 9L)));

        List<CollectionEntry> entries = store.listEntries(CollectionScope.QUEUE);

        assertEquals(2, entries.size());
        assertEquals(MediaItemRef.track("/m/a.mp3"), entries.get(0).getRef());
        assertEquals(MediaItemRef.video(9L), entries.get(1).getRef());
        assertEquals(3, entries.get(1).getPosition());
    }

    @Test
    void shouldReadPlaylistEntriesInScope() {
        PlaylistItemEntity row = new PlaylistItemEntity();
        row.setId(11L);
        row.setPlaylistId(5L);
        row.setPosition(0);
        row.setYoutubeVideoId(3L);
        when(playlistItemMapper.selectByPlaylistIdOrdered(5L)).thenReturn(Collections.singletonList(row));

        List<CollectionEntry> entries = store.listEntries(CollectionScope.playlist(5L));

        assertEquals(1, entries.size());
        assertEquals(CollectionScope.playlist(5L), entries.get(0).getScope());
        assertEquals(Long.valueOf(11L), entries.get(0).getId());
    }

    @Test
    void shouldRouteInsertByScopeAndKind() {
        store.insertEntry(CollectionScope.QUEUE, 4, MediaItemRef.video(8L));
        store.insertEntry(CollectionScope.playlist(2L), 0, MediaItemRef.track("/m/a.mp3"));

        verify(queueItemMapper).insert(4, null, 8L);
        verify(playlistItemMapper).insert(2L, 0, "/m/a.mp3", null);
    }

    @Test
    void shouldSkipEmptyDeleteAndNormalizeInsertIgnore() {
        assertEquals(0, store.deleteByFilenames(Collections.<String>emptyList()));
        verify(trackMapper, never()).deleteByFilenames(any());

        when(videoMapper.insertIgnore(any(VideoEntity.class))).thenReturn(2);
        assertEquals(1, store.insertVideoIfAbsent(new VideoEntity()));
    }

    @Test
    void shouldReturnNullFirstEntryForEmptyQueue() {
        when(queueItemMapper.selectAllOrdered()).thenReturn(Collections.<QueueItemEntity>emptyList());

        assertNull(store.firstEntry(CollectionScope.QUEUE));
    }

    @Test
    void shouldSkipMalformedHeadRowWhenReadingFirstQueueEntry() {
        when(queueItemMapper.selectAllOrdered()).thenReturn(Arrays.asList(
                queueRow(1L, 0, null, null),
                queueRow(2L, 1, "/m/a.mp3", null)));

        CollectionEntry first = store.firstEntry(CollectionScope.QUEUE);

        assertEquals(Long.valueOf(2L), first.getId());
        assertEquals(MediaItemRef.track("/m/a.mp3"), first.getRef());
    }

    @Test
    void shouldPopPastMalformedHeadRow() {
        when(queueItemMapper.selectAllOrdered()).thenReturn(Arrays.asList(
                queueRow(1L, 0, null, null),
                queueRow(2L, 1, "/m/a.mp3", null)));
        TrackEntity track = new TrackEntity();
        track.setFilename("/m/a.mp3");
        track.setTitle("A");
        when(trackMapper.selectByFilename("/m/a.mp3")).thenReturn(track);
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        PlaybackQueue queue = new PlaybackQueue(store, new MediaItemResolver(store), new ScopeLockRegistry(),
                beanFactory.getBeanProvider(TransactionOperations.class),
                beanFactory.getBeanProvider(MeterRegistry.class));

        ResolvedEntry popped = queue.popFront();

        assertNotNull(popped);
        assertEquals(MediaItemRef.track("/m/a.mp3"), popped.getEntry().getRef());
        assertEquals("A", popped.getItem().getTitle());
        verify(queueItemMapper).deleteById(2L);
    }

    private QueueItemEntity queueRow(Long id, int position, String filename, Long videoId) {
        QueueItemEntity row = new QueueItemEntity();
        row.setId(id);
        row.setPosition(position);
        row.setTrackFilename(filename);
        row.setYoutubeVideoId(videoId);
        return row;
    }
}
