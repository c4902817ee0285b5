package com.sandkev.organizer;

import com.sandkev.PhotoSweep.Directories;
import com.sandkev.PhotoSweep.FileKind;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Moves every image under a directory into a folder named after its capture date (or quarter),
 * created directly under that directory. The capture date comes from EXIF when present, otherwise
 * from the last modified time. A file already present at the destination is never overwritten,
 * the image is skipped instead.
 */
@Slf4j
public class DateFolderOrganizer {

    private final CaptureDateReader dateReader;
    private final ZoneId zone;

    public DateFolderOrganizer() {
        this(new ExifCaptureDateReader(), ZoneId.systemDefault());
    }

    public DateFolderOrganizer(CaptureDateReader dateReader, ZoneId zone) {
        this.dateReader = dateReader;
        this.zone = zone;
    }

    public OrganizeResult classify(Path directory, OrganizeMode mode) throws IOException {
        Path root = Directories.requireDirectory(directory);
        List<Path> images = listImages(root);
        log.info("organizing {} images in {} by {}", images.size(), root, mode.getToken());

        Map<String, Path> bucketFolders = new HashMap<>();
        Set<String> failedBuckets = new HashSet<>();
        int organized = 0;
        int skipped = 0;

        for (Path image : images) {
            Optional<String> key = bucketDate(image).map(mode::folderKey);
            Path folder = key.isPresent() ? bucketFolder(root, key.get(), bucketFolders, failedBuckets) : null;
            if (folder != null && moveInto(image, folder)) {
                organized++;
            } else {
                skipped++;
            }
        }

        log.info("organized {} of {} images, skipped {}", organized, images.size(), skipped);
        return new OrganizeResult(images.size(), organized, skipped);
    }

    /**
     * The listing is taken up front so folders created by this run are not walked again.
     */
    List<Path> listImages(Path root) throws IOException {
        List<Path> images = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && FileKind.isImageName(file.getFileName().toString())) {
                    images.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.debug("skipping unreadable entry {}: {}", file, exc.toString());
                return FileVisitResult.CONTINUE;
            }
        });
        return images;
    }

    Optional<LocalDate> bucketDate(Path image) {
        Optional<LocalDate> captured = dateReader.captureDate(image);
        if (captured.isPresent()) {
            return captured;
        }
        try {
            return Optional.of(LocalDate.ofInstant(Files.getLastModifiedTime(image).toInstant(), zone));
        } catch (IOException e) {
            log.warn("no date for {}: {}", image, e.toString());
            return Optional.empty();
        }
    }

    private Path bucketFolder(Path root, String key, Map<String, Path> bucketFolders, Set<String> failedBuckets) {
        Path folder = bucketFolders.get(key);
        if (folder != null || failedBuckets.contains(key)) {
            return folder;
        }
        try {
            folder = Files.createDirectories(root.resolve(key));
            bucketFolders.put(key, folder);
            return folder;
        } catch (IOException e) {
            log.warn("could not create folder {} under {}: {}", key, root, e.toString());
            failedBuckets.add(key);
            return null;
        }
    }

    private boolean moveInto(Path image, Path folder) {
        Path target = folder.resolve(image.getFileName().toString());
        if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            log.debug("skipping {}, {} already exists", image, target);
            return false;
        }
        try {
            FileUtils.moveFile(image.toFile(), target.toFile());
            return true;
        } catch (IOException e) {
            log.warn("could not move {} to {}: {}", image, folder, e.toString());
            return false;
        }
    }
}
