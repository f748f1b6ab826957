package com.example.medialibrary.support;

import com.example.medialibrary.application.store.LibraryStore;
import com.example.medialibrary.domain.model.CollectionEntry;
import com.example.medialibrary.domain.model.CollectionScope;
import com.example.medialibrary.domain.model.MediaItemRef;
import com.example.medialibrary.infrastructure.persistence.entity.ChannelEntity;
import com.example.medialibrary.infrastructure.persistence.entity.PlaylistEntity;
import com.example.medialibrary.infrastructure.persistence.entity.TrackEntity;
import com.example.medialibrary.infrastructure.persistence.entity.VideoEntity;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed store for unit tests. Deletes never cascade, so collections can hold dangling references.
 */
public class InMemoryLibraryStore implements LibraryStore {

    private final Map<String, TrackEntity> tracks = new LinkedHashMap<>();
    private final Map<Long, VideoEntity> videos = new LinkedHashMap<>();
    private final Map<Long, ChannelEntity> channels = new LinkedHashMap<>();
    private final Map<Long, PlaylistEntity> playlists = new LinkedHashMap<>();
    private final Map<CollectionScope, List<CollectionEntry>> entries = new HashMap<>();
    private final AtomicLong ids = new AtomicLong();

    private final Set<String> failingFilenames = new HashSet<>();

    /**
     * Makes {@link #insertTrack} and {@link #updateDuration} throw for this filename.
     */
    public synchronized void failWritesFor(String filename) {
        failingFilenames.add(filename);
    }

    public synchronized void putTrack(TrackEntity track) {
        tracks.put(track.getFilename(), track);
    }

    public synchronized VideoEntity putVideo(String videoId, String title) {
        VideoEntity video = new VideoEntity();
        video.setId(ids.incrementAndGet());
        video.setVideoId(videoId);
        video.setTitle(title);
        video.setPlayCount(0);
        video.setFetchedAt(LocalDateTime.now());
        videos.put(video.getId(), video);
        return video;
    }

    public synchronized void removeTrack(String filename) {
        tracks.remove(filename);
    }

    public synchronized void removeVideo(Long id) {
        videos.remove(id);
    }

    public synchronized int trackCount() {
        return tracks.size();
    }

    @Override
    public synchronized TrackEntity lookupByFilename(String filename) {
        return tracks.get(filename);
    }

    @Override
    public synchronized List<TrackEntity> listAllTracks() {
        return new ArrayList<>(tracks.values());
    }

    @Override
    public synchronized List<String> listAllFilenames() {
        return new ArrayList<>(tracks.keySet());
    }

    @Override
    public synchronized void insertTrack(TrackEntity track) {
        checkWritable(track.getFilename());
        if (tracks.containsKey(track.getFilename())) {
            throw new IllegalStateException("duplicate track " + track.getFilename());
        }
        if (track.getPlayCount() == null) {
            track.setPlayCount(0);
        }
        if (track.getAdded() == null) {
            track.setAdded(LocalDateTime.now());
        }
        tracks.put(track.getFilename(), track);
    }

    @Override
    public synchronized int updateDuration(String filename, Integer durationSec) {
        checkWritable(filename);
        TrackEntity track = tracks.get(filename);
        if (track == null) {
            return 0;
        }
        track.setDurationSec(durationSec);
        return 1;
    }

    @Override
    public synchronized int deleteByFilenames(Collection<String> filenames) {
        int deleted = 0;
        for (String filename : filenames) {
            if (tracks.remove(filename) != null) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public synchronized int recordTrackPlay(String filename, boolean incrementCount) {
        TrackEntity track = tracks.get(filename);
        if (track == null) {
            return 0;
        }
        if (incrementCount) {
            track.setPlayCount((track.getPlayCount() == null ? 0 : track.getPlayCount()) + 1);
        }
        track.setLastPlayed(LocalDateTime.now());
        return 1;
    }

    @Override
    public synchronized VideoEntity lookupVideoById(Long id) {
        return videos.get(id);
    }

    @Override
    public synchronized List<VideoEntity> listAllVideos() {
        return new ArrayList<>(videos.values());
    }

    @Override
    public synchronized int recordVideoPlay(Long id, boolean incrementCount) {
        VideoEntity video = videos.get(id);
        if (video == null) {
            return 0;
        }
        if (incrementCount) {
            video.setPlayCount((video.getPlayCount() == null ? 0 : video.getPlayCount()) + 1);
        }
        video.setLastPlayed(LocalDateTime.now());
        return 1;
    }

    @Override
    public synchronized void insertChannel(ChannelEntity channel) {
        for (ChannelEntity existing : channels.values()) {
            if (existing.getChannelId().equals(channel.getChannelId())) {
                throw new IllegalStateException("duplicate channel " + channel.getChannelId());
            }
        }
        channel.setId(ids.incrementAndGet());
        channel.setCreatedAt(LocalDateTime.now());
        channels.put(channel.getId(), channel);
    }

    @Override
    public synchronized ChannelEntity lookupChannelById(Long id) {
        return channels.get(id);
    }

    @Override
    public synchronized List<ChannelEntity> listChannels() {
        return new ArrayList<>(channels.values());
    }

    @Override
    public synchronized int deleteChannel(Long id) {
        return channels.remove(id) == null ? 0 : 1;
    }

    @Override
    public synchronized int touchChannelFetched(Long id) {
        ChannelEntity channel = channels.get(id);
        if (channel == null) {
            return 0;
        }
        channel.setLastFetched(LocalDateTime.now());
        return 1;
    }

    @Override
    public synchronized int insertVideoIfAbsent(VideoEntity video) {
        for (VideoEntity existing : videos.values()) {
            if (existing.getVideoId().equals(video.getVideoId())) {
                return 0;
            }
        }
        video.setId(ids.incrementAndGet());
        video.setPlayCount(0);
        video.setFetchedAt(LocalDateTime.now());
        video.setAdded(LocalDateTime.now());
        videos.put(video.getId(), video);
        return 1;
    }

    @Override
    public synchronized List<VideoEntity> listVideosByChannel(Long channelId) {
        List<VideoEntity> result = new ArrayList<>();
        for (VideoEntity video : videos.values()) {
            if (channelId.equals(video.getChannelId())) {
                result.add(video);
            }
        }
        result.sort(Comparator.comparing(VideoEntity::getPublishedAt,
                Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder())));
        return result;
    }

    @Override
    public synchronized void insertPlaylist(PlaylistEntity playlist) {
        playlist.setId(ids.incrementAndGet());
        playlist.setCreatedAt(LocalDateTime.now());
        playlist.setUpdatedAt(playlist.getCreatedAt());
        playlists.put(playlist.getId(), playlist);
    }

    @Override
    public synchronized PlaylistEntity lookupPlaylistById(Long id) {
        return playlists.get(id);
    }

    @Override
    public synchronized List<PlaylistEntity> listPlaylists() {
        return new ArrayList<>(playlists.values());
    }

    @Override
    public synchronized int renamePlaylist(Long id, String name) {
        PlaylistEntity playlist = playlists.get(id);
        if (playlist == null) {
            return 0;
        }
        playlist.setName(name);
        playlist.setUpdatedAt(LocalDateTime.now());
        return 1;
    }

    @Override
    public synchronized int deletePlaylist(Long id) {
        return playlists.remove(id) == null ? 0 : 1;
    }

    @Override
    public synchronized Integer maxPosition(CollectionScope scope) {
        Integer max = null;
        for (CollectionEntry entry : scopeEntries(scope)) {
            if (max == null || entry.getPosition() > max) {
                max = entry.getPosition();
            }
        }
        return max;
    }

    @Override
    public synchronized void insertEntry(CollectionScope scope, int position, MediaItemRef ref) {
        scopeEntries(scope).add(new CollectionEntry(ids.incrementAndGet(), scope, position, ref, LocalDateTime.now()));
    }

    @Override
    public synchronized List<CollectionEntry> listEntries(CollectionScope scope) {
        List<CollectionEntry> result = new ArrayList<>();
        for (CollectionEntry entry : scopeEntries(scope)) {
            result.add(new CollectionEntry(entry.getId(), entry.getScope(), entry.getPosition(), entry.getRef(),
                    entry.getAddedAt()));
        }
        result.sort(Comparator.comparingInt(CollectionEntry::getPosition).thenComparing(CollectionEntry::getId));
        return result;
    }

    @Override
    public synchronized CollectionEntry firstEntry(CollectionScope scope) {
        List<CollectionEntry> ordered = listEntries(scope);
        return ordered.isEmpty() ? null : ordered.get(0);
    }

    @Override
    public synchronized int deleteEntry(CollectionScope scope, Long entryId) {
        Iterator<CollectionEntry> it = scopeEntries(scope).iterator();
        while (it.hasNext()) {
            if (it.next().getId().equals(entryId)) {
                it.remove();
                return 1;
            }
        }
        return 0;
    }

    @Override
    public synchronized int deleteEntries(CollectionScope scope, MediaItemRef ref) {
        int removed = 0;
        Iterator<CollectionEntry> it = scopeEntries(scope).iterator();
        while (it.hasNext()) {
            if (it.next().getRef().equals(ref)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public synchronized int updateEntryPosition(CollectionScope scope, Long entryId, int position) {
        for (CollectionEntry entry : scopeEntries(scope)) {
            if (entry.getId().equals(entryId)) {
                entry.setPosition(position);
                return 1;
            }
        }
        return 0;
    }

    @Override
    public synchronized int clearEntries(CollectionScope scope) {
        List<CollectionEntry> list = scopeEntries(scope);
        int size = list.size();
        list.clear();
        return size;
    }

    @Override
    public synchronized int countEntries(CollectionScope scope) {
        return scopeEntries(scope).size();
    }

    private List<CollectionEntry> scopeEntries(CollectionScope scope) {
        return entries.computeIfAbsent(scope, key -> new ArrayList<CollectionEntry>());
    }

    private void checkWritable(String filename) {
        if (failingFilenames.contains(filename)) {
            throw new IllegalStateException("simulated store failure for " + filename);
        }
    }
}
