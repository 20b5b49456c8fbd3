package com.my.notes.adapter.out.filesystem;

import com.my.notes.domain.exception.NoteStorageException;
import com.my.notes.domain.model.GroupPath;
import com.my.notes.domain.model.Note;
import com.my.notes.domain.model.ScanResult;
import com.my.notes.domain.model.StoreError;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 왜: 루트 전체를 매번 새로 읽어 노트 집합과 빈 그룹 집합을 디스크 상태 그대로 재구성하기 위함.
 */
public class FileSystemTreeScanner {

    private static final Logger log = Logger.getLogger(FileSystemTreeScanner.class);

    private final GroupPathResolver resolver;
    private final String noteExtension;
    private final boolean ignoreHidden;

    public FileSystemTreeScanner(GroupPathResolver resolver, String noteExtension, boolean ignoreHidden) {
        this.resolver = resolver;
        this.noteExtension = noteExtension;
        this.ignoreHidden = ignoreHidden;
    }

    public ScanResult scan() {
        Path root = resolver.root();
        if (!Files.isDirectory(root)) {
            log.debugf("노트 루트가 없어 빈 결과를 돌려줍니다: %s", root);
            return ScanResult.empty();
        }
        List<Note> notes = new ArrayList<>();
        Set<GroupPath> emptyGroups = new LinkedHashSet<>();
        scanDirectory(root, GroupPath.DEFAULT, notes, emptyGroups);
        addImplicitAncestors(notes, emptyGroups);
        log.debugf("스캔 완료: notes=%d, emptyGroups=%d", notes.size(), emptyGroups.size());
        return new ScanResult(notes, new ArrayList<>(emptyGroups));
    }

    private void scanDirectory(Path dir, GroupPath group, List<Note> notes, Set<GroupPath> emptyGroups) {
        List<Path> subDirs = new ArrayList<>();
        int directNotes = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (ignoreHidden && name.startsWith(".")) {
                    continue;
                }
                BasicFileAttributes attrs = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                if (attrs.isDirectory()) {
                    subDirs.add(entry);
                } else if (isNoteFile(entry, attrs)) {
                    notes.add(toNote(entry, group, attrs));
                    directNotes++;
                }
            }
        } catch (IOException e) {
            if (group.isDefault()) {
                throw new NoteStorageException(StoreError.IO_FAILURE, "노트 루트 읽기 실패: " + e.getMessage(), e);
            }
            // 읽지 못한 하위 디렉터리도 그룹으로는 남긴다.
            log.warnf("그룹 디렉터리를 읽지 못해 건너뜁니다: %s (%s)", dir, e.getMessage());
            emptyGroups.add(group);
            return;
        }

        if (!group.isDefault() && directNotes == 0) {
            emptyGroups.add(group);
        }
        for (Path subDir : subDirs) {
            scanDirectory(subDir, group.child(subDir.getFileName().toString()), notes, emptyGroups);
        }
    }

    private void addImplicitAncestors(List<Note> notes, Set<GroupPath> emptyGroups) {
        Set<GroupPath> represented = new HashSet<>(emptyGroups);
        for (Note note : notes) {
            represented.add(note.group());
        }
        for (GroupPath group : List.copyOf(represented)) {
            for (GroupPath ancestor : group.ancestors()) {
                if (represented.add(ancestor)) {
                    emptyGroups.add(ancestor);
                }
            }
        }
    }

    boolean isNoteFile(Path file, BasicFileAttributes attrs) {
        if (attrs.isSymbolicLink()) {
            return Files.isRegularFile(file) && hasNoteExtension(file);
        }
        return attrs.isRegularFile() && hasNoteExtension(file);
    }

    boolean hasNoteExtension(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(noteExtension)
                && !name.substring(0, name.length() - noteExtension.length()).isBlank();
    }

    Note toNote(Path file, GroupPath group, BasicFileAttributes attrs) {
        String fileName = file.getFileName().toString();
        String name = fileName.substring(0, fileName.length() - noteExtension.length());
        return new Note(file, name, fileName, group, attrs.lastModifiedTime().toInstant());
    }
}
