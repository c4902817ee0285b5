package com.sandkev.PhotoSweep;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RetentionResolverTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-06T07:08:09Z"), ZoneOffset.UTC);

    @TempDir
    Path root;

    @TempDir
    Path output;

    private RetentionResolver resolver() {
        return new RetentionResolver(output, CLOCK);
    }

    private FileRecord file(String relative, String content, long size, long createdSecond, String hash) throws IOException {
        Path path = root.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
        return Records.record(path.toString(), size, createdSecond, hash, FileKind.GENERIC);
    }

    @Test
    void quarantineFolderIsNamedAfterTheRunTime() {
        Path folder = resolver().quarantineFolderFor(LocalDateTime.now(CLOCK));

        assertThat(folder).isEqualTo(output.resolve("duplicates_20240506_070809"));
    }

    @ParameterizedTest
    @EnumSource(RetentionStrategy.class)
    void survivorStaysAndTheRestAreMoved(RetentionStrategy strategy) throws IOException {
        ListMultimap<HashKey, FileRecord> classes = ArrayListMultimap.create();
        HashKey key = new HashKey(FileKind.GENERIC, "abc");
        List<FileRecord> members = List.of(
                file("a/one.txt", "same", 10, 300, "abc"),
                file("a/bb/two.txt", "same", 30, 100, "abc"),
                file("a/bb/ccc/three.txt", "same", 20, 200, "abc"));
        classes.putAll(key, members);
        FileRecord survivor = strategy.survivor(members);

        RetentionResult result = resolver().resolve(classes, strategy);

        assertThat(survivor.getPath()).exists();
        assertThat(result.getMovedCount()).isEqualTo(2);
        assertThat(result.getMovedRecords()).hasSize(2).doesNotContain(survivor);
        for (FileRecord moved : result.getMovedRecords()) {
            assertThat(moved.getPath()).doesNotExist();
            assertThat(result.getQuarantineFolder().resolve(moved.getPath().getFileName())).hasContent("same");
        }
        long expectedBytes = members.stream().filter(member -> member != survivor).mapToLong(FileRecord::getSize).sum();
        assertThat(result.getMovedBytes()).isEqualTo(expectedBytes);
    }

    @Test
    void sameNameInQuarantineLeavesTheFileInPlace() throws IOException {
        ListMultimap<HashKey, FileRecord> classes = ArrayListMultimap.create();
        FileRecord keep = file("keep/photo.txt", "one", 3, 1, "h1");
        FileRecord first = file("x/photo.txt", "one", 3, 2, "h1");
        FileRecord second = file("y/photo.txt", "one", 3, 3, "h1");
        classes.putAll(new HashKey(FileKind.GENERIC, "h1"), List.of(keep, first, second));

        RetentionResult result = resolver().resolve(classes, RetentionStrategy.OLDEST);

        assertThat(result.getMovedCount()).isEqualTo(1);
        assertThat(result.getCollisionCount()).isEqualTo(1);
        assertThat(result.getMovedRecords()).containsExactly(first);
        assertThat(keep.getPath()).exists();
        assertThat(second.getPath()).exists().hasContent("one");
    }

    @Test
    void movedCountIsClassSizesMinusOneMinusCollisions() throws IOException {
        ListMultimap<HashKey, FileRecord> classes = ArrayListMultimap.create();
        int expected = 0;
        for (int c = 0; c < 3; c++) {
            HashKey key = new HashKey(FileKind.GENERIC, "class" + c);
            List<FileRecord> members = new ArrayList<>();
            for (int m = 0; m <= c + 1; m++) {
                members.add(file("c" + c + "/m" + m + "/f" + c + "_" + m + ".txt", "c" + c, 2, m, key.getHashHex()));
            }
            classes.putAll(key, members);
            expected += members.size() - 1;
        }

        RetentionResult result = resolver().resolve(classes, RetentionStrategy.NEWEST);

        assertThat(result.getMovedCount() + result.getCollisionCount() + result.getFailedCount()).isEqualTo(expected);
        assertThat(result.getMovedCount()).isEqualTo(expected);
    }

    @Test
    void vanishedCandidateIsCountedAsFailedAndTheRunContinues() throws IOException {
        ListMultimap<HashKey, FileRecord> classes = ArrayListMultimap.create();
        FileRecord keep = file("k/a.txt", "a", 1, 1, "h");
        FileRecord gone = file("g/b.txt", "a", 1, 2, "h");
        FileRecord other = file("o/c.txt", "a", 1, 3, "h");
        classes.putAll(new HashKey(FileKind.GENERIC, "h"), List.of(keep, gone, other));
        Files.delete(gone.getPath());

        RetentionResult result = resolver().resolve(classes, RetentionStrategy.OLDEST);

        assertThat(result.getFailedCount()).isEqualTo(1);
        assertThat(result.getMovedRecords()).containsExactly(other);
    }

    @Test
    void quarantineIsOnlyCreatedWhenNeeded() {
        RetentionResult result = resolver().resolve(ArrayListMultimap.create(), RetentionStrategy.OLDEST);

        assertThat(result.getMovedCount()).isZero();
        assertThat(result.getQuarantineFolder()).doesNotExist();
    }
}
