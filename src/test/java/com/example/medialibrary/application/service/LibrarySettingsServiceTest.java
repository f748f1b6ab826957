package com.example.medialibrary.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.medialibrary.common.config.AppLibraryProperties;
import com.example.medialibrary.common.exception.BusinessException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LibrarySettingsServiceTest {

    @TempDir
    Path tempDir;

    private LibrarySettingsService service;

    @BeforeEach
    void setUp() {
        service = new LibrarySettingsService(new AppLibraryProperties());
    }

    @Test
    void shouldSeedFoldersFromPropertiesWithoutDuplicates() {
        AppLibraryProperties properties = new AppLibraryProperties();
        properties.setFolders(Arrays.asList("/music/a", "/music/a/", " ", "/music/b/../c"));

        List<String> folders = new LibrarySettingsService(properties).listFolders();

        assertEquals(Arrays.asList("/music/a", "/music/c"), folders);
    }

    @Test
    void shouldAddExistingDirectoryOnce() throws Exception {
        Path music = Files.createDirectory(tempDir.resolve("music"));

        service.addFolder(music.toString());
        List<String> folders = service.addFolder(music.toString());

        assertEquals(1, folders.size());
        assertEquals(music.toRealPath().toString(), folders.get(0));
    }

    @Test
    void shouldRejectMissingOrRegularFile() throws Exception {
        Path file = Files.createFile(tempDir.resolve("song.mp3"));

        BusinessException missing = assertThrows(BusinessException.class,
                () -> service.addFolder(tempDir.resolve("absent").toString()));
        BusinessException notDirectory = assertThrows(BusinessException.class,
                () -> service.addFolder(file.toString()));

        assertEquals("400", missing.getCode());
        assertEquals("400", notDirectory.getCode());
        assertTrue(service.listFolders().isEmpty());
    }

    @Test
    void shouldRemoveFolderOrReportMissing() throws Exception {
        Path music = Files.createDirectory(tempDir.resolve("music"));
        String stored = service.addFolder(music.toString()).get(0);

        assertTrue(service.removeFolder(stored).isEmpty());
        BusinessException error = assertThrows(BusinessException.class, () -> service.removeFolder(stored));
        assertEquals("404", error.getCode());
    }
}
