package com.my.notes.domain.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 기본 그룹의 노트와 최상위 그룹 숲을 함께 제공해 트리 렌더링 쪽이 디스크 구조를 다시 해석하지 않도록 하기 위함.
 */
public record GroupTree(List<Note> defaultNotes, List<GroupNode> roots) {

    public GroupTree {
        defaultNotes = List.copyOf(defaultNotes);
        roots = List.copyOf(roots);
    }

    public Optional<GroupNode> find(GroupPath path) {
        Deque<GroupNode> stack = new ArrayDeque<>(roots);
        while (!stack.isEmpty()) {
            GroupNode node = stack.pop();
            if (node.path().equals(path)) {
                return Optional.of(node);
            }
            if (path.isSameOrDescendantOf(node.path())) {
                stack.addAll(node.children());
            }
        }
        return Optional.empty();
    }
}
