package com.my.notes.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * 그룹 트리의 노드 하나. 스캔 결과에서 매번 새로 만들어지며 저장되지 않는다.
 */
public record GroupNode(GroupPath path, List<Note> notes, List<GroupNode> children) {

    public GroupNode {
        notes = List.copyOf(notes);
        children = List.copyOf(children);
    }

    public String name() {
        return path.leaf();
    }

    public Optional<GroupPath> parentPath() {
        return path.parent().filter(parent -> !parent.isDefault());
    }

    public boolean isEmpty() {
        return notes.isEmpty();
    }
}
