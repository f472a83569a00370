package com.microblog.adapter.out.storage;

import com.microblog.application.port.out.IdGenerator;
import com.microblog.application.port.out.MediaStorage;
import com.microblog.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Keeps media files flat in one directory; the key is the file name.
 */
@Component
public class FileSystemMediaStorage implements MediaStorage {

    private static final Logger log = LoggerFactory.getLogger(FileSystemMediaStorage.class);

    private final Path root;
    private final IdGenerator idGenerator;

    public FileSystemMediaStorage(AppProperties appProperties, IdGenerator idGenerator) {
        this.root = Path.of(appProperties.getMedia().getStoragePath()).toAbsolutePath().normalize();
        this.idGenerator = idGenerator;
    }

    @Override
    public String put(byte[] content, String extension) throws IOException {
        Files.createDirectories(root);
        String key = idGenerator.generate() + (extension != null ? extension : "");
        Files.write(resolve(key), content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        log.debug("Stored media file: key={}, bytes={}", key, content.length);
        return key;
    }

    @Override
    public void delete(String key) throws IOException {
        if (!Files.deleteIfExists(resolve(key))) {
            log.warn("Media file already absent: key={}", key);
        }
    }

    private Path resolve(String key) throws IOException {
        Path path = root.resolve(key).normalize();
        if (!path.getParent().equals(root)) {
            throw new IOException("Storage key escapes the media directory: " + key);
        }
        return path;
    }
}
