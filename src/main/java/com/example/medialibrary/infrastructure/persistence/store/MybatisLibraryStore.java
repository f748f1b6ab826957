package com.example.medialibrary.infrastructure.persistence.store;

import com.example.medialibrary.application.store.LibraryStore;
import com.example.medialibrary.domain.model.CollectionEntry;
import com.example.medialibrary.domain.model.CollectionScope;
import com.example.medialibrary.domain.model.MediaItemRef;
import com.example.medialibrary.infrastructure.persistence.entity.ChannelEntity;
import com.example.medialibrary.infrastructure.persistence.entity.PlaylistEntity;
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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link LibraryStore} over the MyBatis mappers. Queue and playlist entries share one code path that
 * dispatches on the scope.
 */
@Component
public class MybatisLibraryStore implements LibraryStore {

    private static final Logger log = LoggerFactory.getLogger(MybatisLibraryStore.class);

    private final TrackMapper trackMapper;
    private final VideoMapper videoMapper;
    private final ChannelMapper channelMapper;
    private final PlaylistMapper playlistMapper;
    private final PlaylistItemMapper playlistItemMapper;
    private final QueueItemMapper queueItemMapper;

    public MybatisLibraryStore(TrackMapper trackMapper,
                               VideoMapper videoMapper,
                               ChannelMapper channelMapper,
                               PlaylistMapper playlistMapper,
                               PlaylistItemMapper playlistItemMapper,
                               QueueItemMapper queueItemMapper) {
        this.trackMapper = trackMapper;
        this.videoMapper = videoMapper;
        this.channelMapper = channelMapper;
        this.playlistMapper = playlistMapper;
        this.playlistItemMapper = playlistItemMapper;
        this.queueItemMapper = queueItemMapper;
    }

    @Override
    public TrackEntity lookupByFilename(String filename) {
        return trackMapper.selectByFilename(filename);
    }

    @Override
    public List<TrackEntity> listAllTracks() {
        return trackMapper.selectAll();
    }

    @Override
    public List<String> listAllFilenames() {
        return trackMapper.selectAllFilenames();
    }

    @Override
    public void insertTrack(TrackEntity track) {
        trackMapper.insert(track);
    }

    @Override
    public int updateDuration(String filename, Integer durationSec) {
        return trackMapper.updateDuration(filename, durationSec);
    }

    @Override
    public int deleteByFilenames(Collection<String> filenames) {
        if (filenames == null || filenames.isEmpty()) {
            return 0;
        }
        return trackMapper.deleteByFilenames(filenames);
    }

    @Override
    public int recordTrackPlay(String filename, boolean incrementCount) {
        return incrementCount ? trackMapper.incrementPlayCount(filename) : trackMapper.markLastPlayed(filename);
    }

    @Override
    public VideoEntity lookupVideoById(Long id) {
        return videoMapper.selectById(id);
    }

    @Override
    public List<VideoEntity> listAllVideos() {
        return videoMapper.selectAll();
    }

    @Override
    public int recordVideoPlay(Long id, boolean incrementCount) {
        return incrementCount ? videoMapper.incrementPlayCount(id) : videoMapper.markLastPlayed(id);
    }

    @Override
    public void insertChannel(ChannelEntity channel) {
        channelMapper.insert(channel);
    }

    @Override
    public ChannelEntity lookupChannelById(Long id) {
        return channelMapper.selectById(id);
    }

    @Override
    public List<ChannelEntity> listChannels() {
        return channelMapper.selectAll();
    }

    @Override
    public int deleteChannel(Long id) {
        return channelMapper.deleteById(id);
    }

    @Override
    public int touchChannelFetched(Long id) {
        return channelMapper.touchLastFetched(id);
    }

    @Override
    public int insertVideoIfAbsent(VideoEntity video) {
        return videoMapper.insertIgnore(video) > 0 ? 1 : 0;
    }

    @Override
    public List<VideoEntity> listVideosByChannel(Long channelId) {
        return videoMapper.selectByChannelId(channelId);
    }

    @Override
    public void insertPlaylist(PlaylistEntity playlist) {
        playlistMapper.insert(playlist);
    }

    @Override
    public PlaylistEntity lookupPlaylistById(Long id) {
        return playlistMapper.selectById(id);
    }

    @Override
    public List<PlaylistEntity> listPlaylists() {
        return playlistMapper.selectAll();
    }

    @Override
    public int renamePlaylist(Long id, String name) {
        return playlistMapper.rename(id, name);
    }

    @Override
    public int deletePlaylist(Long id) {
        return playlistMapper.deleteById(id);
    }

    @Override
    public Integer maxPosition(CollectionScope scope) {
        return scope.isQueue()
                ? queueItemMapper.selectMaxPosition()
                : playlistItemMapper.selectMaxPosition(scope.getPlaylistId());
    }

    @Override
    public void insertEntry(CollectionScope scope, int position, MediaItemRef ref) {
        if (scope.isQueue()) {
            queueItemMapper.insert(position, ref.getTrackFilename(), ref.getVideoId());
        } else {
            playlistItemMapper.insert(scope.getPlaylistId(), position, ref.getTrackFilename(), ref.getVideoId());
        }
    }

    @Override
    public List<CollectionEntry> listEntries(CollectionScope scope) {
        List<CollectionEntry> result = new ArrayList<CollectionEntry>();
        if (scope.isQueue()) {
            List<QueueItemEntity> rows = queueItemMapper.selectAllOrdered();
            if (rows == null) {
                return Collections.emptyList();
            }
            for (QueueItemEntity row : rows) {
                CollectionEntry entry = toEntry(row);
                if (entry != null) {
                    result.add(entry);
                }
            }
        } else {
            List<PlaylistItemEntity> rows = playlistItemMapper.selectByPlaylistIdOrdered(scope.getPlaylistId());
            if (rows == null) {
                return Collections.emptyList();
            }
            for (PlaylistItemEntity row : rows) {
                CollectionEntry entry = toEntry(scope, row);
                if (entry != null) {
                    result.add(entry);
                }
            }
        }
        return result;
    }

    /**
     * First entry by position among the rows that hold exactly one reference; rejected rows never shadow
     * the valid ones behind them.
     */
    @Override
    public CollectionEntry firstEntry(CollectionScope scope) {
        List<CollectionEntry> entries = listEntries(scope);
        return entries.isEmpty() ? null : entries.get(0);
    }

    @Override
    public int deleteEntry(CollectionScope scope, Long entryId) {
        return scope.isQueue()
                ? queueItemMapper.deleteById(entryId)
                : playlistItemMapper.deleteById(scope.getPlaylistId(), entryId);
    }

    @Override
    public int deleteEntries(CollectionScope scope, MediaItemRef ref) {
        if (scope.isQueue()) {
            return ref.isTrack()
                    ? queueItemMapper.deleteByTrack(ref.getTrackFilename())
                    : queueItemMapper.deleteByVideo(ref.getVideoId());
        }
        return ref.isTrack()
                ? playlistItemMapper.deleteByTrack(scope.getPlaylistId(), ref.getTrackFilename())
                : playlistItemMapper.deleteByVideo(scope.getPlaylistId(), ref.getVideoId());
    }

    @Override
    public int updateEntryPosition(CollectionScope scope, Long entryId, int position) {
        return scope.isQueue()
                ? queueItemMapper.updatePosition(entryId, position)
                : playlistItemMapper.updatePosition(scope.getPlaylistId(), entryId, position);
    }

    @Override
    public int clearEntries(CollectionScope scope) {
        return scope.isQueue()
                ? queueItemMapper.deleteAll()
                : playlistItemMapper.deleteByPlaylistId(scope.getPlaylistId());
    }

    @Override
    public int countEntries(CollectionScope scope) {
        return scope.isQueue()
                ? queueItemMapper.count()
                : playlistItemMapper.countByPlaylistId(scope.getPlaylistId());
    }

    private CollectionEntry toEntry(QueueItemEntity row) {
        MediaItemRef ref = MediaItemRef.fromColumns(row.getTrackFilename(), row.getYoutubeVideoId());
        if (ref == null) {
            log.warn("COLLECTION_ROW_REJECTED scope=queue entryId={} trackFilename={} videoId={}",
                    row.getId(), row.getTrackFilename(), row.getYoutubeVideoId());
            return null;
        }
        int position = row.getPosition() == null ? 0 : row.getPosition();
        return new CollectionEntry(row.getId(), CollectionScope.QUEUE, position, ref, row.getAddedAt());
    }

    private CollectionEntry toEntry(CollectionScope scope, PlaylistItemEntity row) {
        MediaItemRef ref = MediaItemRef.fromColumns(row.getTrackFilename(), row.getYoutubeVideoId());
        if (ref == null) {
            log.warn("COLLECTION_ROW_REJECTED scope={} entryId={} trackFilename={} videoId={}",
                    scope, row.getId(), row.getTrackFilename(), row.getYoutubeVideoId());
            return null;
        }
        int position = row.getPosition() == null ? 0 : row.getPosition();
        return new CollectionEntry(row.getId(), scope, position, ref, row.getAddedAt());
    }
}
