package com.my.notes.domain.service;

import com.my.notes.domain.model.GroupNode;
import com.my.notes.domain.model.GroupPath;
import com.my.notes.domain.model.GroupTree;
import com.my.notes.domain.model.Note;
import com.my.notes.domain.model.ScanResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 왜: 스캔 결과에서 그룹 숲을 매번 새로 만들어 저장된 트리와 디스크가 어긋날 여지를 없애기 위함.
 * 조상 그룹은 스캔에 빠져 있어도 노드로 만든다.
 */
public class GroupTreeBuilder {

    private static final Comparator<GroupPath> BY_LEAF = Comparator
            .comparing(GroupPath::leaf, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(GroupPath::leaf);

    public GroupTree build(ScanResult scan) {
        Map<GroupPath, List<Note>> notesByGroup = new HashMap<>();
        Set<GroupPath> groups = new LinkedHashSet<>();
        for (Note note : scan.notes()) {
            notesByGroup.computeIfAbsent(note.group(), key -> new ArrayList<>()).add(note);
            addWithAncestors(groups, note.group());
        }
        for (GroupPath empty : scan.emptyGroups()) {
            addWithAncestors(groups, empty);
        }

        Map<GroupPath, List<GroupPath>> childrenByParent = new HashMap<>();
        for (GroupPath group : groups) {
            GroupPath parent = group.parent().orElse(GroupPath.DEFAULT);
            childrenByParent.computeIfAbsent(parent, key -> new ArrayList<>()).add(group);
        }

        List<GroupNode> roots = buildChildren(GroupPath.DEFAULT, childrenByParent, notesByGroup);
        return new GroupTree(notesByGroup.getOrDefault(GroupPath.DEFAULT, List.of()), roots);
    }

    private List<GroupNode> buildChildren(GroupPath parent,
                                          Map<GroupPath, List<GroupPath>> childrenByParent,
                                          Map<GroupPath, List<Note>> notesByGroup) {
        List<GroupPath> children = new ArrayList<>(childrenByParent.getOrDefault(parent, List.of()));
        children.sort(BY_LEAF);
        List<GroupNode> nodes = new ArrayList<>(children.size());
        for (GroupPath child : children) {
            List<Note> notes = notesByGroup.getOrDefault(child, List.of());
            nodes.add(new GroupNode(child, notes, buildChildren(child, childrenByParent, notesByGroup)));
        }
        return nodes;
    }

    private void addWithAncestors(Set<GroupPath> groups, GroupPath group) {
        if (group.isDefault()) {
            return;
        }
        groups.addAll(group.ancestors());
        groups.add(group);
    }
}
