package com.example.medialibrary.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.medialibrary.api.request.ChannelVideoRequest;
import com.example.medialibrary.api.request.CreateChannelRequest;
import com.example.medialibrary.api.response.ChannelResponse;
import com.example.medialibrary.api.response.ChannelVideosResponse;
import com.example.medialibrary.api.response.MediaItemResponse;
import com.example.medialibrary.common.exception.BusinessException;
import com.example.medialibrary.support.InMemoryLibraryStore;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChannelCatalogServiceTest {

    private InMemoryLibraryStore store;
    private ChannelCatalogService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryLibraryStore();
        service = new ChannelCatalogService(store);
    }

    @Test
    void shouldAddAndListChannel() {
        ChannelResponse created = service.addChannel(channelRequest(" UC123 ", " Lofi Radio "));

        assertNotNull(created.getId());
        assertEquals("UC123", created.getChannelId());
        assertEquals("Lofi Radio", created.getName());
        assertNull(created.getLastFetched());
        assertEquals(1, service.listChannels().size());
    }

    @Test
    void shouldIgnoreAlreadyCatalogedVideos() {
        Long channelId = service.addChannel(channelRequest("UC1", "Channel")).getId();

        ChannelVideosResponse first = service.addVideos(channelId, Arrays.asList(
                video("v1", "First", LocalDateTime.of(2024, 1, 1, 0, 0)),
                video("v2", "Second", LocalDateTime.of(2024, 2, 1, 0, 0))));
        ChannelVideosResponse second = service.addVideos(channelId, Arrays.asList(
                video("v2", "Second again", LocalDateTime.of(2024, 2, 1, 0, 0)),
                video("v3", "Third", LocalDateTime.of(2024, 3, 1, 0, 0))));

        assertEquals(2, first.getInserted());
        assertEquals(0, first.getIgnored());
        assertEquals(2, second.getReceived());
        assertEquals(1, second.getInserted());
        assertEquals(1, second.getIgnored());
        assertNotNull(store.lookupChannelById(channelId).getLastFetched());
    }

    @Test
    void shouldListVideosNewestFirst() {
        Long channelId = service.addChannel(channelRequest("UC1", "Channel")).getId();
        service.addVideos(channelId, Arrays.asList(
                video("old", "Old", LocalDateTime.of(2023, 5, 1, 0, 0)),
                video("new", "New", LocalDateTime.of(2024, 5, 1, 0, 0))));

        List<MediaItemResponse> videos = service.listVideos(channelId);

        assertEquals(2, videos.size());
        assertEquals("New", videos.get(0).getTitle());
        assertEquals("video", videos.get(0).getKind());
        assertTrue(videos.get(0).getRef().startsWith("video:"));
    }

    @Test
    void shouldRejectUnknownChannel() {
        BusinessException missing = assertThrows(BusinessException.class,
                () -> service.addVideos(99L, Collections.singletonList(video("v", "V", null))));
        assertEquals("404", missing.getCode());

        BusinessException delete = assertThrows(BusinessException.class, () -> service.deleteChannel(99L));
        assertEquals("404", delete.getCode());
    }

    @Test
    void shouldDeleteChannel() {
        Long channelId = service.addChannel(channelRequest("UC1", "Channel")).getId();

        service.deleteChannel(channelId);

        assertTrue(service.listChannels().isEmpty());
    }

    private CreateChannelRequest channelRequest(String channelId, String name) {
        CreateChannelRequest request = new CreateChannelRequest();
        request.setChannelId(channelId);
        request.setName(name);
        return request;
    }

    private ChannelVideoRequest video(String videoId, String title, LocalDateTime publishedAt) {
        ChannelVideoRequest request = new ChannelVideoRequest();
        request.setVideoId(videoId);
        request.setTitle(title);
        request.setDurationSec(180);
        request.setPublishedAt(publishedAt);
        return request;
    }
}
