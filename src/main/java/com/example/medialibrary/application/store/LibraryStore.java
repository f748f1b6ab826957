package com.example.medialibrary.application.store;

import com.example.medialibrary.domain.model.CollectionEntry;
import com.example.medialibrary.domain.model.CollectionScope;
import com.example.medialibrary.domain.model.MediaItemRef;
import com.example.medialibrary.infrastructure.persistence.entity.ChannelEntity;
import com.example.medialibrary.infrastructure.persistence.entity.PlaylistEntity;
import com.example.medialibrary.infrastructure.persistence.entity.TrackEntity;
import com.example.medialibrary.infrastructure.persistence.entity.VideoEntity;
import java.util.Collection;
import java.util.List;

/**
 * Catalog persistence used by the sync and collection services. Implementations decide how rows are stored;
 * callers only rely on the semantics documented here.
 *
 * <p>Collection entries always come back as a well-formed {@link MediaItemRef}: rows that reference no item,
 * or both a track and a video, are dropped by the implementation.
 */
public interface LibraryStore {

    // tracks

    TrackEntity lookupByFilename(String filename);

    List<TrackEntity> listAllTracks();

    List<String> listAllFilenames();

    void insertTrack(TrackEntity track);

    int updateDuration(String filename, Integer durationSec);

    int deleteByFilenames(Collection<String> filenames);

    int recordTrackPlay(String filename, boolean incrementCount);

    // videos and channels

    VideoEntity lookupVideoById(Long id);

    List<VideoEntity> listAllVideos();

    int recordVideoPlay(Long id, boolean incrementCount);

    void insertChannel(ChannelEntity channel);

    ChannelEntity lookupChannelById(Long id);

    List<ChannelEntity> listChannels();

    int deleteChannel(Long id);

    int touchChannelFetched(Long id);

    /**
     * Inserts the video unless one with the same provider video id exists.
     *
     * @return 1 when inserted, 0 when ignored
     */
    int insertVideoIfAbsent(VideoEntity video);

    List<VideoEntity> listVideosByChannel(Long channelId);

    // playlists

    void insertPlaylist(PlaylistEntity playlist);

    PlaylistEntity lookupPlaylistById(Long id);

    List<PlaylistEntity> listPlaylists();

    int renamePlaylist(Long id, String name);

    int deletePlaylist(Long id);

    // ordered collections

    /**
     * @return the highest position in the scope, or {@code null} when the scope is empty
     */
    Integer maxPosition(CollectionScope scope);

    void insertEntry(CollectionScope scope, int position, MediaItemRef ref);

    /**
     * Entries ascending by position; ties keep insertion order.
     */
    List<CollectionEntry> listEntries(CollectionScope scope);

    CollectionEntry firstEntry(CollectionScope scope);

    int deleteEntry(CollectionScope scope, Long entryId);

    int deleteEntries(CollectionScope scope, MediaItemRef ref);

    int updateEntryPosition(CollectionScope scope, Long entryId, int position);

    int clearEntries(CollectionScope scope);

    int countEntries(CollectionScope scope);
}
