package com.example.medialibrary.application.service;

import com.example.medialibrary.api.request.ChannelVideoRequest;
import com.example.medialibrary.api.request.CreateChannelRequest;
import com.example.medialibrary.api.response.ChannelResponse;
import com.example.medialibrary.api.response.ChannelVideosResponse;
import com.example.medialibrary.api.response.MediaItemResponse;
import com.example.medialibrary.application.store.LibraryStore;
import com.example.medialibrary.common.exception.BusinessException;
import com.example.medialibrary.domain.model.MediaItem;
import com.example.medialibrary.infrastructure.persistence.entity.ChannelEntity;
import com.example.medialibrary.infrastructure.persistence.entity.VideoEntity;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Remote video channels and their videos. Fetching from the provider happens elsewhere; this service only
 * stores what the fetcher delivers.
 */
@Service
public class ChannelCatalogService {

    private static final Logger log = LoggerFactory.getLogger(ChannelCatalogService.class);

    private final LibraryStore libraryStore;

    public ChannelCatalogService(LibraryStore libraryStore) {
        this.libraryStore = libraryStore;
    }

    public ChannelResponse addChannel(CreateChannelRequest request) {
        ChannelEntity entity = new ChannelEntity();
        entity.setChannelId(request.getChannelId().trim());
        entity.setName(request.getName().trim());
        entity.setHandle(request.getHandle());
        entity.setUrl(request.getUrl());
        entity.setThumbnailUrl(request.getThumbnailUrl());
        libraryStore.insertChannel(entity);
        log.info("CHANNEL_ADDED id={} channelId={}", entity.getId(), entity.getChannelId());
        ChannelEntity created = entity.getId() == null ? null : libraryStore.lookupChannelById(entity.getId());
        return toResponse(created == null ? entity : created);
    }

    public List<ChannelResponse> listChannels() {
        List<ChannelResponse> result = new ArrayList<>();
        for (ChannelEntity entity : libraryStore.listChannels()) {
            result.add(toResponse(entity));
        }
        return result;
    }

    public void deleteChannel(Long id) {
        requireChannel(id);
        libraryStore.deleteChannel(id);
        log.info("CHANNEL_DELETED id={}", id);
    }

    /**
     * Stores fetched videos, ignoring provider ids already cataloged, and stamps the channel's fetch time.
     */
    @Transactional(rollbackFor = Exception.class)
    public ChannelVideosResponse addVideos(Long channelId, List<ChannelVideoRequest> videos) {
        requireChannel(channelId);
        int inserted = 0;
        for (ChannelVideoRequest video : videos) {
            VideoEntity entity = new VideoEntity();
            entity.setVideoId(video.getVideoId().trim());
            entity.setChannelId(channelId);
            entity.setTitle(video.getTitle());
            entity.setDurationSec(video.getDurationSec());
            entity.setThumbnailUrl(video.getThumbnailUrl());
            entity.setPublishedAt(video.getPublishedAt());
            inserted += libraryStore.insertVideoIfAbsent(entity);
        }
        libraryStore.touchChannelFetched(channelId);
        log.info("CHANNEL_VIDEOS_STORED channelId={} received={} inserted={}", channelId, videos.size(), inserted);
        return new ChannelVideosResponse(channelId, videos.size(), inserted, videos.size() - inserted);
    }

    /**
     * Videos of the channel, newest publication first.
     */
    public List<MediaItemResponse> listVideos(Long channelId) {
        requireChannel(channelId);
        List<MediaItem> items = new ArrayList<>();
        for (VideoEntity video : libraryStore.listVideosByChannel(channelId)) {
            items.add(MediaItem.ofVideo(video));
        }
        return MediaItemViews.toResponses(items);
    }

    private ChannelEntity requireChannel(Long id) {
        ChannelEntity channel = id == null ? null : libraryStore.lookupChannelById(id);
        if (channel == null) {
            throw new BusinessException("404", "Channel not found");
        }
        return channel;
    }

    private ChannelResponse toResponse(ChannelEntity entity) {
        return new ChannelResponse(entity.getId(), entity.getChannelId(), entity.getName(), entity.getHandle(),
                entity.getUrl(), entity.getThumbnailUrl(), entity.getLastFetched(), entity.getCreatedAt());
    }
}
