package com.my.notes.adapter.out.filesystem;

import com.my.notes.domain.exception.InvalidGroupPathException;
import com.my.notes.domain.exception.NoteStorageException;
import com.my.notes.domain.model.GroupPath;
import com.my.notes.domain.model.StoreError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GroupPathResolverTest {

    @TempDir
    Path tempDir;

    private Path root;
    private GroupPathResolver resolver;

    @BeforeEach
    void setUp() {
        root = tempDir.resolve("notes");
        resolver = new GroupPathResolver(root);
    }

    @Test
    void resolvedDirectoriesMapBackToTheSameGroup() {
        for (String raw : List.of("default", "Work", "Work/Notes", "한글/하위 그룹")) {
            GroupPath group = GroupPath.parse(raw);

            Path dir = resolver.resolveGroupDir(group);

            assertThat(dir).isDirectory();
            assertThat(resolver.relativeGroupPath(dir)).isEqualTo(group);
        }
    }

    @Test
    void defaultGroupIsTheRoot() {
        assertThat(resolver.resolveGroupDir(GroupPath.DEFAULT)).isEqualTo(root.toAbsolutePath().normalize());
        assertThat(resolver.relativeGroupPath(root)).isEqualTo(GroupPath.DEFAULT);
    }

    @Test
    void resolvingTwiceIsHarmless() {
        Path first = resolver.resolveGroupDir(GroupPath.parse("a/b/c"));
        Path second = resolver.resolveGroupDir(GroupPath.parse("a/b/c"));

        assertThat(second).isEqualTo(first);
        assertThat(root.resolve("a").resolve("b")).isDirectory();
    }

    @Test
    void locateDoesNotCreateDirectories() {
        Path dir = resolver.locateGroupDir(GroupPath.parse("Later"));

        assertThat(dir).doesNotExist();
    }

    @Test
    void fileOccupyingGroupNameIsCollision() throws Exception {
        Files.createDirectories(root);
        Files.writeString(root.resolve("Work"), "not a directory");

        assertThatThrownBy(() -> resolver.resolveGroupDir(GroupPath.parse("Work")))
                .isInstanceOf(NoteStorageException.class)
                .satisfies(e -> assertThat(((NoteStorageException) e).error()).isEqualTo(StoreError.NAME_COLLISION));
    }

    @Test
    void pathsOutsideRootAreRejected() {
        assertThatThrownBy(() -> resolver.relativeGroupPath(tempDir))
                .isInstanceOf(InvalidGroupPathException.class);
        assertThatThrownBy(() -> resolver.relativeGroupPath(root.resolve("..").resolve("other")))
                .isInstanceOf(InvalidGroupPathException.class);
        assertThat(resolver.isInsideRoot(tempDir.resolve("other.md"))).isFalse();
        assertThat(resolver.isInsideRoot(root)).isFalse();
        assertThat(resolver.isInsideRoot(root.resolve("Work").resolve("a.md"))).isTrue();
    }

    @Test
    void relativePathUsesForwardSlashes() {
        assertThat(resolver.relativePath(root.resolve("Work").resolve("a.md"))).isEqualTo("Work/a.md");
        assertThat(resolver.relativePath(root)).isEmpty();
    }
}
