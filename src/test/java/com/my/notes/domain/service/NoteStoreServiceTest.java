package com.my.notes.domain.service;

import com.my.notes.adapter.out.clock.OffsetClockAdapter;
import com.my.notes.adapter.out.filesystem.FileSystemNoteStorage;
import com.my.notes.domain.model.ChangeEvent;
import com.my.notes.domain.model.ChangeKind;
import com.my.notes.domain.model.GroupNode;
import com.my.notes.domain.model.GroupPath;
import com.my.notes.domain.model.GroupTree;
import com.my.notes.domain.model.Note;
import com.my.notes.domain.model.NoteDocument;
import com.my.notes.domain.model.ScanResult;
import com.my.notes.domain.model.StoreError;
import com.my.notes.domain.model.StoreResult;
import com.my.notes.domain.port.in.NoteChangeListener;
import com.my.notes.domain.port.in.Subscription;
import com.my.notes.domain.port.out.ChangeWatchPort;
import com.my.notes.domain.port.out.ClockPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

class NoteStoreServiceTest {

    @TempDir
    Path tempDir;

    private Path root;
    private ChangeWatchPort watchPort;
    private NoteStoreService service;

    @BeforeEach
    void setUp() {
        root = tempDir.resolve("notes").toAbsolutePath().normalize();
        watchPort = mock(ChangeWatchPort.class);
        service = new NoteStoreService(new FileSystemNoteStorage(root, ".md", true), watchPort, OffsetClockAdapter.system());
    }

    @Test
    void createdNoteAppearsInScanWithFreshTimestamp() {
        // 파일 시스템 시각은 거친 시계를 써서 호출 직전 시각보다 몇 ms 뒤처질 수 있다.
        Instant before = Instant.now().truncatedTo(ChronoUnit.SECONDS).minusSeconds(1);

        StoreResult<Note> created = service.createNote("a", "Work", "hello");

        assertThat(created.isSuccess()).isTrue();
        assertThat(created.value().path()).isEqualTo(root.resolve("Work/a.md"));
        List<Note> notes = service.scan().orElseThrow().notesIn(GroupPath.parse("Work"));
        assertThat(notes).hasSize(1);
        assertThat(notes.get(0).name()).isEqualTo("a");
        assertThat(notes.get(0).lastModified()).isAfterOrEqualTo(before);
    }

    @Test
    void duplicateNoteNameIsCollisionAndKeepsOriginal() throws Exception {
        service.createNote("a", "Work", "hello");

        StoreResult<Note> second = service.createNote("a.md", "Work", "other");

        assertThat(second.error()).isEqualTo(StoreError.NAME_COLLISION);
        assertThat(second.message()).isNotBlank();
        assertThat(service.scan().orElseThrow().notesIn(GroupPath.parse("Work"))).hasSize(1);
        assertThat(Files.readString(root.resolve("Work/a.md"))).isEqualTo("hello");
    }

    @Test
    void invalidNamesAndPathsAreRejected() {
        assertThat(service.createNote(" ", "Work", "x").error()).isEqualTo(StoreError.INVALID_NAME);
        assertThat(service.createNote("a/b", "Work", "x").error()).isEqualTo(StoreError.INVALID_NAME);
        assertThat(service.createNote(".md", "Work", "x").error()).isEqualTo(StoreError.INVALID_NAME);
        assertThat(service.createNote("a", "../escape", "x").error()).isEqualTo(StoreError.INVALID_PATH);
        assertThat(service.createGroup("a/../../b").error()).isEqualTo(StoreError.INVALID_PATH);
        assertThat(tempDir.resolve("escape")).doesNotExist();
    }

    @Test
    void hiddenGroupsAreRejectedWhileScanSkipsThem() {
        Note note = service.createNote("a", "default", "x").orElseThrow();
        service.createGroup("Work");

        assertThat(service.createGroup(".drafts").error()).isEqualTo(StoreError.INVALID_PATH);
        assertThat(service.createNote("a", ".drafts", "x").error()).isEqualTo(StoreError.INVALID_PATH);
        assertThat(service.createTitledNote("t", "Work/.cache", "x").error()).isEqualTo(StoreError.INVALID_PATH);
        assertThat(service.moveNote(note.path(), ".drafts").error()).isEqualTo(StoreError.INVALID_PATH);
        assertThat(service.moveGroup("Work", ".archive").error()).isEqualTo(StoreError.INVALID_PATH);

        assertThat(root.resolve(".drafts")).doesNotExist();
        assertThat(root.resolve(".archive")).doesNotExist();
        assertThat(root.resolve("Work/.cache")).doesNotExist();
        assertThat(note.path()).exists();
    }

    @Test
    void hiddenGroupsAreAllowedWhenScanIncludesThem() {
        NoteStoreService showAll = new NoteStoreService(new FileSystemNoteStorage(root, ".md", false), watchPort, OffsetClockAdapter.system());

        assertThat(showAll.createNote("a", ".drafts", "x").isSuccess()).isTrue();

        assertThat(showAll.scan().orElseThrow().notesIn(GroupPath.parse(".drafts"))).extracting(Note::name).containsExactly("a");
    }

    @Test
    void groupsWithColonsCreatedElsewhereStayUsable() throws Exception {
        Path meeting = Files.createDirectories(root.resolve("Meeting 10:30"));
        Files.writeString(meeting.resolve("agenda.md"), "agenda");
        Note keep = service.createNote("keep", "Work", "x").orElseThrow();

        ScanResult scan = service.scan().orElseThrow();

        assertThat(scan.notes()).extracting(Note::name).containsExactlyInAnyOrder("agenda", "keep");
        assertThat(service.moveNote(keep.path(), "Meeting 10:30").value()).isEqualTo(meeting.resolve("keep.md"));
        assertThat(service.deleteGroup("Meeting 10:30").isSuccess()).isTrue();
        assertThat(meeting).doesNotExist();
    }

    @Test
    void notePathOutsideRootIsRejected() throws Exception {
        Path outside = Files.writeString(tempDir.resolve("outside.md"), "keep");

        assertThat(service.deleteNote(outside).error()).isEqualTo(StoreError.INVALID_PATH);
        assertThat(service.readNote(outside).error()).isEqualTo(StoreError.INVALID_PATH);
        assertThat(service.deleteNote(null).error()).isEqualTo(StoreError.INVALID_PATH);
        assertThat(outside).exists();
    }

    @Test
    void createGroupMakesEveryLevelAndIsIdempotent() {
        assertThat(service.createGroup("Work/Notes").isSuccess()).isTrue();
        assertThat(service.createGroup("Work/Notes").isSuccess()).isTrue();

        assertThat(service.scan().orElseThrow().emptyGroupNames()).containsExactly("Work", "Work/Notes");
    }

    @Test
    void defaultGroupCannotBeDeleted() {
        service.createNote("a", "default", "x");

        StoreResult<Void> result = service.deleteGroup("default");

        assertThat(result.error()).isEqualTo(StoreError.PROTECTED_GROUP);
        assertThat(root.resolve("a.md")).exists();
    }

    @Test
    void deleteGroupRemovesWholeSubtree() {
        service.createNote("n", "Work/Deep", "x");
        service.createNote("keep", "Other", "x");

        assertThat(service.deleteGroup("Work").isSuccess()).isTrue();
        assertThat(service.deleteGroup("Work").error()).isEqualTo(StoreError.NOT_FOUND);

        ScanResult scan = service.scan().orElseThrow();
        assertThat(scan.notes()).extracting(Note::name).containsExactly("keep");
        assertThat(scan.emptyGroups()).isEmpty();
    }

    @Test
    void deletingLastNoteLeavesEmptyGroup() {
        Note note = service.createNote("a", "Work", "x").orElseThrow();

        assertThat(service.deleteNote(note.path()).isSuccess()).isTrue();
        assertThat(service.deleteNote(note.path()).error()).isEqualTo(StoreError.NOT_FOUND);
        assertThat(service.scan().orElseThrow().emptyGroupNames()).containsExactly("Work");
    }

    @Test
    void deleteNoteRefusesGroupDirectories() {
        service.createGroup("Work");

        assertThat(service.deleteNote(root.resolve("Work")).error()).isEqualTo(StoreError.NOT_FOUND);
        assertThat(root.resolve("Work")).isDirectory();
    }

    @Test
    void renameNoteKeepsGroupAndChecksCollision() throws Exception {
        Note a = service.createNote("a", "Work", "A").orElseThrow();
        service.createNote("b", "Work", "B");

        assertThat(service.renameNote(a.path(), "b").error()).isEqualTo(StoreError.NAME_COLLISION);
        assertThat(service.renameNote(a.path(), "a").value()).isEqualTo(a.path());

        Path renamed = service.renameNote(a.path(), "c").orElseThrow();

        assertThat(renamed).isEqualTo(root.resolve("Work/c.md"));
        assertThat(Files.readString(renamed)).isEqualTo("A");
        assertThat(Files.readString(root.resolve("Work/b.md"))).isEqualTo("B");
        assertThat(service.renameNote(a.path(), "d").error()).isEqualTo(StoreError.NOT_FOUND);
    }

    @Test
    void renameNoteRefusesGroupDirectories() {
        service.createNote("a", "Work", "x");

        StoreResult<Path> result = service.renameNote(root.resolve("Work"), "Renamed");

        assertThat(result.error()).isEqualTo(StoreError.NOT_FOUND);
        assertThat(root.resolve("Work")).isDirectory();
        assertThat(root.resolve("Renamed.md")).doesNotExist();
        assertThat(service.scan().orElseThrow().notesIn(GroupPath.parse("Work"))).extracting(Note::name).containsExactly("a");
    }

    @Test
    void moveNoteToDefaultLeavesSourceGroupEmpty() throws Exception {
        Note note = service.createNote("a", "Work", "hello").orElseThrow();

        Path moved = service.moveNote(note.path(), "default").orElseThrow();

        assertThat(moved).isEqualTo(root.resolve("a.md"));
        assertThat(Files.readString(moved)).isEqualTo("hello");
        ScanResult scan = service.scan().orElseThrow();
        assertThat(scan.notesIn(GroupPath.DEFAULT)).extracting(Note::name).containsExactly("a");
        assertThat(scan.emptyGroupNames()).containsExactly("Work");
    }

    @Test
    void moveNoteIntoSameGroupIsNoOp() {
        Note note = service.createNote("a", "Work", "x").orElseThrow();

        assertThat(service.moveNote(note.path(), "Work").value()).isEqualTo(note.path());
        assertThat(note.path()).exists();
    }

    @Test
    void moveNoteCollisionKeepsBothNotes() throws Exception {
        Note work = service.createNote("a", "Work", "work").orElseThrow();
        service.createNote("a", "default", "top");

        assertThat(service.moveNote(work.path(), "default").error()).isEqualTo(StoreError.NAME_COLLISION);
        assertThat(Files.readString(work.path())).isEqualTo("work");
        assertThat(Files.readString(root.resolve("a.md"))).isEqualTo("top");
    }

    @Test
    void moveNoteCreatesMissingTargetGroup() {
        Note note = service.createNote("a", "default", "x").orElseThrow();

        Path moved = service.moveNote(note.path(), "New/Sub").orElseThrow();

        assertThat(moved).isEqualTo(root.resolve("New/Sub/a.md"));
        assertThat(service.moveNote(root.resolve("gone.md"), "New").error()).isEqualTo(StoreError.NOT_FOUND);
    }

    @Test
    void moveGroupIntoItselfOrDescendantChangesNothing() {
        service.createNote("n", "A/B", "x");
        ScanResult before = service.scan().orElseThrow();

        assertThat(service.moveGroup("A", "A").error()).isEqualTo(StoreError.INVALID_MOVE);
        assertThat(service.moveGroup("A", "A/B").error()).isEqualTo(StoreError.INVALID_MOVE);
        assertThat(service.moveGroup("A", "A/B/C").error()).isEqualTo(StoreError.INVALID_MOVE);

        assertThat(service.scan().orElseThrow()).isEqualTo(before);
    }

    @Test
    void moveGroupToCurrentParentCollidesWithItself() {
        service.createNote("n", "A/B", "x");
        service.createGroup("Top");
        ScanResult before = service.scan().orElseThrow();

        assertThat(service.moveGroup("A/B", "A").error()).isEqualTo(StoreError.NAME_COLLISION);
        assertThat(service.moveGroup("Top", "default").error()).isEqualTo(StoreError.NAME_COLLISION);

        assertThat(service.scan().orElseThrow()).isEqualTo(before);
    }

    @Test
    void moveGroupRelocatesSubtree() throws Exception {
        service.createNote("n", "A/B", "nested");
        service.createGroup("A/B/Empty");
        service.createGroup("Target");

        GroupPath moved = service.moveGroup("A/B", "Target").orElseThrow();

        assertThat(moved).isEqualTo(GroupPath.parse("Target/B"));
        assertThat(Files.readString(root.resolve("Target/B/n.md"))).isEqualTo("nested");
        ScanResult scan = service.scan().orElseThrow();
        assertThat(scan.notesIn(GroupPath.parse("Target/B"))).hasSize(1);
        assertThat(scan.emptyGroupNames()).containsExactly("A", "Target", "Target/B/Empty");
    }

    @Test
    void moveGroupToDefaultLiftsItToTopLevel() {
        service.createNote("n", "A/B", "x");

        assertThat(service.moveGroup("A/B", "default").value()).isEqualTo(GroupPath.parse("B"));
        assertThat(root.resolve("B/n.md")).exists();
    }

    @Test
    void moveGroupReportsProtectionMissingSourceAndCollision() {
        service.createGroup("A/X");
        service.createGroup("X");

        assertThat(service.moveGroup("default", "A").error()).isEqualTo(StoreError.PROTECTED_GROUP);
        assertThat(service.moveGroup("Nope", "A").error()).isEqualTo(StoreError.NOT_FOUND);
        assertThat(service.moveGroup("A/X", "default").error()).isEqualTo(StoreError.NAME_COLLISION);
        assertThat(root.resolve("A/X")).isDirectory();
    }

    @Test
    void titledNoteCarriesHeaderAndReadsBack() {
        OffsetDateTime fixed = OffsetDateTime.parse("2026-01-13T01:02:03+09:00");
        ClockPort clock = () -> fixed;
        NoteStoreService fixedService = new NoteStoreService(new FileSystemNoteStorage(root, ".md", true), watchPort, clock);
        String id = String.valueOf(fixed.toInstant().toEpochMilli());

        Note note = fixedService.createTitledNote("회의 메모: 1차", "Meetings", "본문").orElseThrow();

        assertThat(note.fileName()).isEqualTo("회의_메모_1차_" + id + ".md");
        NoteDocument document = fixedService.readNote(note.path()).orElseThrow();
        assertThat(document.header().title()).isEqualTo("회의 메모: 1차");
        assertThat(document.header().id()).isEqualTo(id);
        assertThat(document.header().date()).isEqualTo(fixed);
        assertThat(document.body()).isEqualTo("본문");
    }

    @Test
    void blankTitleFallsBackToUntitled() {
        OffsetDateTime fixed = OffsetDateTime.parse("2026-01-13T01:02:03+09:00");
        NoteStoreService fixedService = new NoteStoreService(new FileSystemNoteStorage(root, ".md", true), watchPort, () -> fixed);

        Note note = fixedService.createTitledNote("  ", "default", "").orElseThrow();

        assertThat(note.fileName()).isEqualTo("untitled_" + fixed.toInstant().toEpochMilli() + ".md");
    }

    @Test
    void saveNoteReplacesContent() throws Exception {
        Note note = service.createNote("a", "default", "old").orElseThrow();

        assertThat(service.saveNote(note.path(), "new").isSuccess()).isTrue();
        assertThat(Files.readString(note.path())).isEqualTo("new");
        assertThat(service.readNote(note.path()).value()).isEqualTo(NoteDocument.plain("new"));
        assertThat(service.saveNote(root.resolve("missing.md"), "x").error()).isEqualTo(StoreError.NOT_FOUND);
        assertThat(service.readNote(root.resolve("missing.md")).error()).isEqualTo(StoreError.NOT_FOUND);
    }

    @Test
    void groupTreeNestsGroupsUnderParents() {
        service.createNote("a", "default", "x");
        service.createNote("b", "work", "x");
        service.createGroup("work/Sub/Deep");
        service.createGroup("Alpha");

        GroupTree tree = service.groupTree().orElseThrow();

        assertThat(tree.defaultNotes()).extracting(Note::name).containsExactly("a");
        assertThat(tree.roots()).extracting(GroupNode::name).containsExactly("Alpha", "work");
        GroupNode work = tree.roots().get(1);
        assertThat(work.notes()).extracting(Note::name).containsExactly("b");
        assertThat(tree.find(GroupPath.parse("work/Sub/Deep"))).isPresent();
        assertThat(tree.find(GroupPath.parse("work/Sub")).orElseThrow().isEmpty()).isTrue();
    }

    @Test
    void missingRootScansEmpty() {
        assertThat(service.scan().value()).isEqualTo(ScanResult.empty());
        assertThat(root).doesNotExist();
    }

    @Test
    void startWatchingCreatesRootAndStartsWatcher() {
        service.startWatching();

        assertThat(root).isDirectory();
        verify(watchPort).start(eq(root), any());
    }

    @Test
    void watcherBatchesReachSubscribersUntilCancelled() {
        NoteChangeListener subscriber = mock(NoteChangeListener.class);
        Subscription subscription = service.onChange(subscriber);
        service.startWatching();
        ArgumentCaptor<NoteChangeListener> captor = ArgumentCaptor.forClass(NoteChangeListener.class);
        verify(watchPort).start(eq(root), captor.capture());
        List<ChangeEvent> batch = List.of(ChangeEvent.of(ChangeKind.ADDED, "a.md", GroupPath.DEFAULT));

        captor.getValue().onChange(batch);
        subscription.cancel();
        subscription.cancel();
        captor.getValue().onChange(batch);

        verify(subscriber).onChange(batch);
        verifyNoMoreInteractions(subscriber);
        assertThat(subscription.isActive()).isFalse();
    }

    @Test
    void stopWatchingDelegatesToWatcher() {
        service.stopWatching();

        verify(watchPort).stop();
        verify(watchPort, never()).start(any(), any());
    }
}
